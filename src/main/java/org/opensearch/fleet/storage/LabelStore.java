/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet.storage;

import org.opensearch.fleet.model.ClientId;
import org.opensearch.fleet.model.ClientLabel;

import java.util.Collection;
import java.util.List;
import java.util.SortedSet;

/**
 * Per-client set of {@link ClientLabel}s.
 */
public interface LabelStore {

    /**
     * Attaches labels {@code (name, owner)} for every name. Existing labels are kept.
     *
     * @throws UnknownClientException if the backend holds no record of the client
     */
    void addLabels(ClientId clientId, String owner, Collection<String> names);

    /**
     * Detaches labels {@code (name, owner)} for every name. Labels of other owners are untouched.
     *
     * @throws UnknownClientException if the backend holds no record of the client
     */
    void removeLabels(ClientId clientId, String owner, Collection<String> names);

    /**
     * @return labels of the client sorted by name then owner; empty if it has none
     */
    List<ClientLabel> readLabels(ClientId clientId);

    /**
     * @return distinct label names across all clients
     */
    SortedSet<String> listLabelNames();
}
