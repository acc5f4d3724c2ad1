/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet.search;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.fleet.index.ClientIndex;
import org.opensearch.fleet.metrics.FleetMetrics;
import org.opensearch.fleet.metrics.FleetMetricsConstants;
import org.opensearch.fleet.model.ClientId;
import org.opensearch.fleet.model.ClientRecord;
import org.opensearch.fleet.storage.ClientRecordReader;
import org.opensearch.fleet.storage.FleetBackend;
import org.opensearch.telemetry.metrics.Counter;
import org.opensearch.telemetry.metrics.Histogram;
import org.opensearch.telemetry.metrics.MetricsRegistry;
import org.opensearch.telemetry.metrics.tags.Tags;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.Supplier;

/**
 * Keyword search over the clients of the reading backend.
 *
 * <p>Unrestricted searches page over the index hits directly. Label-restricted searches use the index only as a
 * coarse pre-filter: every candidate is re-checked against its actual labels and pagination happens after that
 * check, so rejected candidates never take a slot in the page.
 */
public class ClientSearchService {

    private static final Logger logger = LogManager.getLogger(ClientSearchService.class);

    private static final Metrics METRICS = new Metrics();

    private final Supplier<FleetBackend> backend;

    /**
     * @param backend supplies the backend serving reads
     */
    public ClientSearchService(Supplier<FleetBackend> backend) {
        this.backend = backend;
    }

    public static FleetMetrics.MetricsInitializer getMetricsInitializer() {
        return METRICS;
    }

    /**
     * Searches without label restrictions.
     *
     * @param query  search query, blank for all clients
     * @param offset index of the first result, {@code >= 0}
     * @param count  maximum number of results, {@code 0} for no limit
     */
    public ClientSearchResult search(String query, int offset, int count) {
        return search(query, offset, count, null);
    }

    /**
     * Searches the clients visible through {@code whitelist}, or all clients when it is null.
     */
    public ClientSearchResult search(String query, int offset, int count, LabelWhitelist whitelist) {
        validatePagination(offset, count);
        Set<String> keywords = SearchQueryParser.parse(query);
        long startNanos = System.nanoTime();

        FleetBackend reading = backend.get();
        ClientRecordReader reader = new ClientRecordReader(reading);
        ClientSearchResult result = whitelist == null
            ? searchUnrestricted(reading.clientIndex(), reader, keywords, offset, count)
            : searchRestricted(reading.clientIndex(), reader, keywords, offset, count, whitelist);

        double tookMillis = (System.nanoTime() - startNanos) / 1_000_000.0;
        Tags tags = whitelist == null ? Metrics.TAGS_UNRESTRICTED : Metrics.TAGS_RESTRICTED;
        FleetMetrics.incrementCounter(METRICS.requestsTotal, 1, tags);
        FleetMetrics.recordHistogram(METRICS.latency, tookMillis, tags);
        logger.debug("Search {} matched {} clients, returning {}", keywords, result.totalCount(), result.items().size());
        return result;
    }

    private ClientSearchResult searchUnrestricted(
        ClientIndex index,
        ClientRecordReader reader,
        Set<String> keywords,
        int offset,
        int count
    ) {
        SortedSet<ClientId> hits = index.lookupClients(keywords);
        List<ClientId> page = slice(new ArrayList<>(hits), offset, count);
        return new ClientSearchResult(reader.readClients(page), hits.size());
    }

    private ClientSearchResult searchRestricted(
        ClientIndex index,
        ClientRecordReader reader,
        Set<String> keywords,
        int offset,
        int count,
        LabelWhitelist whitelist
    ) {
        SortedSet<ClientId> candidates = new TreeSet<>();
        for (String name : whitelist.names()) {
            Set<String> coarse = new LinkedHashSet<>();
            coarse.add(ClientIndex.labelKeyword(name));
            coarse.addAll(keywords);
            candidates.addAll(index.lookupClients(coarse));
        }

        List<ClientRecord> verified = new ArrayList<>();
        int rejected = 0;
        for (ClientRecord record : reader.readClients(candidates)) {
            if (whitelist.permitsAny(record.labels())) {
                verified.add(record);
            } else {
                rejected++;
            }
        }
        if (rejected > 0) {
            FleetMetrics.incrementCounter(METRICS.candidatesRejected, rejected);
            logger.debug("Label verification rejected {} of {} candidates", rejected, candidates.size());
        }
        return new ClientSearchResult(slice(verified, offset, count), verified.size());
    }

    static void validatePagination(int offset, int count) {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be >= 0, got " + offset);
        }
        if (count < 0) {
            throw new IllegalArgumentException("count must be >= 0, got " + count);
        }
    }

    /**
     * @return {@code items[offset, offset + count)}, or everything from {@code offset} when count is 0
     */
    static <T> List<T> slice(List<T> items, int offset, int count) {
        if (offset >= items.size()) {
            return List.of();
        }
        int end = count == 0 ? items.size() : (int) Math.min((long) offset + count, items.size());
        return items.subList(offset, end);
    }

    /**
     * Metrics container for ClientSearchService.
     */
    static class Metrics implements FleetMetrics.MetricsInitializer {

        private static final String TAG_MODE = "mode";
        private static final Tags TAGS_UNRESTRICTED = Tags.create().addTag(TAG_MODE, "unrestricted");
        private static final Tags TAGS_RESTRICTED = Tags.create().addTag(TAG_MODE, "restricted");

        Counter requestsTotal;
        Counter candidatesRejected;
        Histogram latency;

        @Override
        public synchronized void register(MetricsRegistry registry) {
            requestsTotal = registry.createCounter(
                FleetMetricsConstants.SEARCH_REQUESTS_TOTAL,
                FleetMetricsConstants.SEARCH_REQUESTS_TOTAL_DESC,
                FleetMetricsConstants.UNIT_COUNT
            );
            candidatesRejected = registry.createCounter(
                FleetMetricsConstants.SEARCH_CANDIDATES_REJECTED_TOTAL,
                FleetMetricsConstants.SEARCH_CANDIDATES_REJECTED_TOTAL_DESC,
                FleetMetricsConstants.UNIT_COUNT
            );
            latency = registry.createHistogram(
                FleetMetricsConstants.SEARCH_LATENCY,
                FleetMetricsConstants.SEARCH_LATENCY_DESC,
                FleetMetricsConstants.UNIT_MILLISECONDS
            );
        }

        @Override
        public synchronized void cleanup() {
            requestsTotal = null;
            candidatesRejected = null;
            latency = null;
        }
    }
}
