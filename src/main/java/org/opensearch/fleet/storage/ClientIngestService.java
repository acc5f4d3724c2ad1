/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet.storage;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.fleet.index.ClientKeywordExtractor;
import org.opensearch.fleet.model.ClientCrash;
import org.opensearch.fleet.model.ClientId;
import org.opensearch.fleet.model.ClientMetadata;
import org.opensearch.fleet.model.ClientSnapshot;
import org.opensearch.fleet.model.StatSnapshot;

import java.util.Set;

/**
 * Write path for data reported by clients. Each write is applied to every writing backend, primary first, and
 * snapshots are indexed under the keywords {@link ClientKeywordExtractor} derives from them.
 */
public class ClientIngestService {

    private static final Logger logger = LogManager.getLogger(ClientIngestService.class);

    private final FleetStorage storage;

    public ClientIngestService(FleetStorage storage) {
        this.storage = storage;
    }

    public void recordSnapshot(ClientSnapshot snapshot) {
        for (FleetBackend backend : storage.writers()) {
            backend.clientStore().writeSnapshot(snapshot);
            Set<String> keywords = ClientKeywordExtractor.extract(snapshot, backend.labelStore().readLabels(snapshot.clientId()));
            backend.clientIndex().addClient(snapshot.clientId(), keywords);
            logger.debug("Indexed client [{}] in [{}] backend under {} keywords", snapshot.clientId(), backend.type(), keywords.size());
        }
    }

    public void recordMetadata(ClientId clientId, ClientMetadata metadata) {
        for (FleetBackend backend : storage.writers()) {
            backend.clientStore().writeMetadata(clientId, metadata);
        }
    }

    public void recordStats(ClientId clientId, StatSnapshot stats) {
        for (FleetBackend backend : storage.writers()) {
            backend.clientStore().writeStats(clientId, stats);
        }
    }

    /**
     * Stores the crash and advances the client's last-crash timestamp if the crash is newer.
     */
    public void recordCrash(ClientCrash crash) {
        for (FleetBackend backend : storage.writers()) {
            ClientStore store = backend.clientStore();
            store.writeCrash(crash);
            ClientMetadata metadata = store.readMetadata(crash.clientId());
            if (metadata.lastCrash() == null || metadata.lastCrash() < crash.timestamp()) {
                store.writeMetadata(crash.clientId(), metadata.withLastCrash(crash.timestamp()));
            }
        }
    }
}
