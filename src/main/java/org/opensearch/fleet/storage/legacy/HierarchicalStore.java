/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet.storage.legacy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.function.UnaryOperator;

/**
 * Path-addressed, versioned key/value store. Each path holds a map of timestamp to value, and paths form a tree
 * through their {@code /}-separated segments.
 *
 * <p>Path segments are escaped with {@link #escape(String)} so arbitrary strings can be used as a segment.
 */
public class HierarchicalStore {

    static final char SEPARATOR = '/';

    private final ConcurrentSkipListMap<String, ConcurrentSkipListMap<Long, Object>> paths = new ConcurrentSkipListMap<>();

    /**
     * Writes {@code value} at {@code path} with version {@code timestamp}, replacing any value of the same version.
     */
    public void write(String path, long timestamp, Object value) {
        paths.computeIfAbsent(path, p -> new ConcurrentSkipListMap<>()).put(timestamp, value);
    }

    /**
     * Atomically replaces the single unversioned value held at {@code path}.
     *
     * @param path    the path to update
     * @param updater receives the current value (null if none) and returns the new one; returning null deletes the path
     */
    @SuppressWarnings("unchecked")
    public <T> T update(String path, UnaryOperator<T> updater) {
        ConcurrentSkipListMap<Long, Object> result = paths.compute(path, (p, versions) -> {
            T current = versions == null || versions.isEmpty() ? null : (T) versions.lastEntry().getValue();
            T updated = updater.apply(current);
            if (updated == null) {
                return null;
            }
            ConcurrentSkipListMap<Long, Object> single = new ConcurrentSkipListMap<>();
            single.put(0L, updated);
            return single;
        });
        return result == null ? null : (T) result.lastEntry().getValue();
    }

    public <T> Optional<T> readLatest(String path, Class<T> type) {
        ConcurrentSkipListMap<Long, Object> versions = paths.get(path);
        if (versions == null) {
            return Optional.empty();
        }
        Map.Entry<Long, Object> entry = versions.lastEntry();
        return entry == null ? Optional.empty() : Optional.of(type.cast(entry.getValue()));
    }

    /**
     * @return the newest value whose version is at or before {@code timestamp}
     */
    public <T> Optional<T> readAt(String path, long timestamp, Class<T> type) {
        ConcurrentSkipListMap<Long, Object> versions = paths.get(path);
        if (versions == null) {
            return Optional.empty();
        }
        Map.Entry<Long, Object> entry = versions.floorEntry(timestamp);
        return entry == null ? Optional.empty() : Optional.of(type.cast(entry.getValue()));
    }

    /**
     * @return values with {@code start <= version <= end}, ascending by version
     */
    public <T> List<T> readRange(String path, long start, long end, Class<T> type) {
        ConcurrentSkipListMap<Long, Object> versions = paths.get(path);
        if (versions == null || start > end) {
            return Collections.emptyList();
        }
        NavigableMap<Long, Object> range = versions.subMap(start, true, end, true);
        List<T> values = new ArrayList<>(range.size());
        for (Object value : range.values()) {
            values.add(type.cast(value));
        }
        return values;
    }

    public boolean exists(String path) {
        ConcurrentSkipListMap<Long, Object> versions = paths.get(path);
        return versions != null && versions.isEmpty() == false;
    }

    public void delete(String path) {
        paths.remove(path);
    }

    /**
     * @return the distinct, unescaped names of the direct children of {@code parent}, ascending
     */
    public List<String> listChildren(String parent) {
        String prefix = parent.isEmpty() ? "" : parent + SEPARATOR;
        ConcurrentNavigableMap<String, ConcurrentSkipListMap<Long, Object>> subtree = paths.subMap(prefix, true, prefix + Character.MAX_VALUE, false);
        TreeSet<String> children = new TreeSet<>();
        for (Map.Entry<String, ConcurrentSkipListMap<Long, Object>> entry : subtree.entrySet()) {
            if (entry.getValue().isEmpty()) {
                continue;
            }
            String rest = entry.getKey().substring(prefix.length());
            int next = rest.indexOf(SEPARATOR);
            children.add(unescape(next < 0 ? rest : rest.substring(0, next)));
        }
        return new ArrayList<>(children);
    }

    /**
     * Joins escaped segments into a path.
     */
    public static String path(String... segments) {
        StringBuilder sb = new StringBuilder();
        for (String segment : segments) {
            if (sb.length() > 0) {
                sb.append(SEPARATOR);
            }
            sb.append(escape(segment));
        }
        return sb.toString();
    }

    static String escape(String segment) {
        return segment.replace("%", "%25").replace("/", "%2F");
    }

    static String unescape(String segment) {
        return segment.replace("%2F", "/").replace("%25", "%");
    }
}
