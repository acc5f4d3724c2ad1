/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet.storage.relational;

import org.opensearch.fleet.model.ClientId;
import org.opensearch.fleet.model.ClientLabel;
import org.opensearch.fleet.storage.LabelStore;
import org.opensearch.fleet.storage.UnknownClientException;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Label table with one row per {@code (client, owner, name)}. Rows may only reference clients present in the
 * clients table.
 */
public class RelationalLabelStore implements LabelStore {

    private final RelationalClientStore clientStore;
    private final Map<ClientId, Set<ClientLabel>> labels = new ConcurrentHashMap<>();

    public RelationalLabelStore(RelationalClientStore clientStore) {
        this.clientStore = clientStore;
    }

    @Override
    public void addLabels(ClientId clientId, String owner, Collection<String> names) {
        requireKnown(clientId);
        labels.compute(clientId, (id, rows) -> {
            Set<ClientLabel> updated = rows == null ? ConcurrentHashMap.newKeySet() : rows;
            for (String name : names) {
                updated.add(new ClientLabel(name, owner));
            }
            return updated;
        });
    }

    @Override
    public void removeLabels(ClientId clientId, String owner, Collection<String> names) {
        requireKnown(clientId);
        labels.computeIfPresent(clientId, (id, rows) -> {
            for (String name : names) {
                rows.remove(new ClientLabel(name, owner));
            }
            return rows.isEmpty() ? null : rows;
        });
    }

    @Override
    public List<ClientLabel> readLabels(ClientId clientId) {
        Set<ClientLabel> rows = labels.getOrDefault(clientId, Set.of());
        return rows.stream().sorted(ClientLabel.ORDER).collect(Collectors.toList());
    }

    @Override
    public SortedSet<String> listLabelNames() {
        SortedSet<String> names = new TreeSet<>();
        labels.values().forEach(rows -> rows.forEach(label -> names.add(label.name())));
        return names;
    }

    private void requireKnown(ClientId clientId) {
        if (clientStore.exists(clientId) == false) {
            throw new UnknownClientException(clientId, RelationalClientStore.BACKEND_NAME);
        }
    }
}
