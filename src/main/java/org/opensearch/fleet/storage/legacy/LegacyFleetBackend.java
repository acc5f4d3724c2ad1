/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet.storage.legacy;

import org.opensearch.fleet.index.ClientIndex;
import org.opensearch.fleet.storage.BackendType;
import org.opensearch.fleet.storage.ClientStore;
import org.opensearch.fleet.storage.FleetBackend;
import org.opensearch.fleet.storage.LabelStore;

/**
 * Backend keeping clients, labels and the keyword index in one {@link HierarchicalStore}.
 */
public class LegacyFleetBackend implements FleetBackend {

    private final LegacyClientStore clientStore;
    private final LegacyLabelStore labelStore;
    private final LegacyClientIndex clientIndex;

    public LegacyFleetBackend() {
        this(new HierarchicalStore());
    }

    public LegacyFleetBackend(HierarchicalStore store) {
        this.clientStore = new LegacyClientStore(store);
        this.labelStore = new LegacyLabelStore(store, clientStore);
        this.clientIndex = new LegacyClientIndex(store);
    }

    @Override
    public BackendType type() {
        return BackendType.LEGACY;
    }

    @Override
    public ClientStore clientStore() {
        return clientStore;
    }

    @Override
    public LabelStore labelStore() {
        return labelStore;
    }

    @Override
    public ClientIndex clientIndex() {
        return clientIndex;
    }

    @Override
    public void close() {
        clientIndex.close();
    }
}
