/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet.storage.relational;

import org.apache.lucene.store.ByteBuffersDirectory;
import org.apache.lucene.store.Directory;
import org.opensearch.fleet.index.ClientIndex;
import org.opensearch.fleet.storage.BackendType;
import org.opensearch.fleet.storage.ClientStore;
import org.opensearch.fleet.storage.FleetBackend;
import org.opensearch.fleet.storage.LabelStore;

import java.io.IOException;

/**
 * Backend with table-style client and label stores and a Lucene keyword index.
 */
public class RelationalFleetBackend implements FleetBackend {

    private final RelationalClientStore clientStore;
    private final RelationalLabelStore labelStore;
    private final LuceneClientIndex clientIndex;

    public RelationalFleetBackend() {
        this(new ByteBuffersDirectory());
    }

    public RelationalFleetBackend(Directory indexDirectory) {
        this.clientStore = new RelationalClientStore();
        this.labelStore = new RelationalLabelStore(clientStore);
        this.clientIndex = new LuceneClientIndex(indexDirectory);
    }

    @Override
    public BackendType type() {
        return BackendType.RELATIONAL;
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
    public void close() throws IOException {
        clientIndex.close();
    }
}
