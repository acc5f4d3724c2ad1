/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet.storage.legacy;

import org.opensearch.fleet.model.ClientId;
import org.opensearch.fleet.model.ClientLabel;
import org.opensearch.fleet.storage.LabelStore;
import org.opensearch.fleet.storage.UnknownClientException;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * {@link LabelStore} keeping the whole label set of a client as one value at {@code clients/<id>/labels}.
 */
public class LegacyLabelStore implements LabelStore {

    private static final String LABELS = "labels";

    private final HierarchicalStore store;
    private final LegacyClientStore clientStore;

    public LegacyLabelStore(HierarchicalStore store, LegacyClientStore clientStore) {
        this.store = store;
        this.clientStore = clientStore;
    }

    @Override
    public void addLabels(ClientId clientId, String owner, Collection<String> names) {
        requireKnown(clientId);
        store.<Set<ClientLabel>>update(LegacyClientStore.clientPath(clientId, LABELS), current -> {
            Set<ClientLabel> labels = current == null ? new HashSet<>() : new HashSet<>(current);
            for (String name : names) {
                labels.add(new ClientLabel(name, owner));
            }
            return Collections.unmodifiableSet(labels);
        });
    }

    @Override
    public void removeLabels(ClientId clientId, String owner, Collection<String> names) {
        requireKnown(clientId);
        store.<Set<ClientLabel>>update(LegacyClientStore.clientPath(clientId, LABELS), current -> {
            if (current == null) {
                return null;
            }
            Set<ClientLabel> labels = new HashSet<>(current);
            for (String name : names) {
                labels.remove(new ClientLabel(name, owner));
            }
            return labels.isEmpty() ? null : Collections.unmodifiableSet(labels);
        });
    }

    @Override
    @SuppressWarnings("unchecked")
    public List<ClientLabel> readLabels(ClientId clientId) {
        Set<ClientLabel> labels = store.readLatest(LegacyClientStore.clientPath(clientId, LABELS), Set.class).orElse(Set.of());
        return labels.stream().sorted(ClientLabel.ORDER).collect(Collectors.toList());
    }

    @Override
    public SortedSet<String> listLabelNames() {
        SortedSet<String> names = new TreeSet<>();
        for (ClientId clientId : clientStore.listClients()) {
            readLabels(clientId).forEach(label -> names.add(label.name()));
        }
        return names;
    }

    private void requireKnown(ClientId clientId) {
        if (clientStore.exists(clientId) == false) {
            throw new UnknownClientException(clientId, "legacy");
        }
    }
}
