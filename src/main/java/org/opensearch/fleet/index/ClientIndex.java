/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet.index;

import org.opensearch.fleet.model.ClientId;

import java.io.Closeable;
import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.SortedSet;

/**
 * Inverted index from search keywords to client identifiers.
 *
 * <p>Every indexed client carries {@link #UNIVERSAL_KEYWORD}, so looking up an empty keyword set returns all
 * indexed clients. Label names are indexed as {@code label:<name>}.
 */
public interface ClientIndex extends Closeable {

    /** Keyword attached to every indexed client. */
    String UNIVERSAL_KEYWORD = ".";

    String LABEL_PREFIX = "label:";

    /**
     * Adds keywords for a client. Keywords already present are kept.
     */
    void addClient(ClientId clientId, Set<String> keywords);

    /**
     * @return clients carrying every one of {@code keywords}, ascending; all indexed clients when empty
     */
    SortedSet<ClientId> lookupClients(Collection<String> keywords);

    /**
     * Adds a {@code label:<name>} keyword for every name.
     */
    void addClientLabels(ClientId clientId, Collection<String> labelNames);

    /**
     * Removes the {@code label:<name>} keyword for every name. Other keywords are untouched.
     */
    void removeClientLabels(ClientId clientId, Collection<String> labelNames);

    static String labelKeyword(String labelName) {
        return LABEL_PREFIX + labelName.toLowerCase(Locale.ROOT);
    }

    /**
     * Keywords a lookup actually has to match: the universal keyword stands in for an empty query.
     */
    static Set<String> effectiveKeywords(Collection<String> keywords) {
        if (keywords == null || keywords.isEmpty()) {
            return Set.of(UNIVERSAL_KEYWORD);
        }
        return Set.copyOf(keywords);
    }
}
