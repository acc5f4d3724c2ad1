/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet.storage.legacy;

import org.opensearch.fleet.index.ClientIndex;
import org.opensearch.fleet.model.ClientId;

import java.util.Collection;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

import static org.opensearch.fleet.storage.legacy.HierarchicalStore.path;

/**
 * {@link ClientIndex} kept inside the {@link HierarchicalStore}: the posting list of a keyword is the set of
 * children of {@code index/clients/<keyword>}.
 */
public class LegacyClientIndex implements ClientIndex {

    private static final String INDEX_ROOT = path("index", "clients");

    private final HierarchicalStore store;

    public LegacyClientIndex(HierarchicalStore store) {
        this.store = store;
    }

    private static String keywordPath(String keyword) {
        return INDEX_ROOT + HierarchicalStore.SEPARATOR + HierarchicalStore.escape(keyword);
    }

    private static String postingPath(String keyword, ClientId clientId) {
        return keywordPath(keyword) + HierarchicalStore.SEPARATOR + HierarchicalStore.escape(clientId.value());
    }

    @Override
    public void addClient(ClientId clientId, Set<String> keywords) {
        store.write(postingPath(UNIVERSAL_KEYWORD, clientId), 0L, Boolean.TRUE);
        for (String keyword : keywords) {
            store.write(postingPath(keyword, clientId), 0L, Boolean.TRUE);
        }
    }

    @Override
    public SortedSet<ClientId> lookupClients(Collection<String> keywords) {
        SortedSet<ClientId> result = null;
        for (String keyword : ClientIndex.effectiveKeywords(keywords)) {
            SortedSet<ClientId> postings = new TreeSet<>();
            for (String child : store.listChildren(keywordPath(keyword))) {
                postings.add(ClientId.fromString(child));
            }
            if (result == null) {
                result = postings;
            } else {
                result.retainAll(postings);
            }
            if (result.isEmpty()) {
                break;
            }
        }
        return result;
    }

    @Override
    public void addClientLabels(ClientId clientId, Collection<String> labelNames) {
        for (String name : labelNames) {
            store.write(postingPath(ClientIndex.labelKeyword(name), clientId), 0L, Boolean.TRUE);
        }
    }

    @Override
    public void removeClientLabels(ClientId clientId, Collection<String> labelNames) {
        for (String name : labelNames) {
            store.delete(postingPath(ClientIndex.labelKeyword(name), clientId));
        }
    }

    @Override
    public void close() {
        // shares the lifecycle of the hierarchical store
    }
}
