/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet.storage;

import org.opensearch.fleet.model.ClientCrash;
import org.opensearch.fleet.model.ClientId;
import org.opensearch.fleet.model.ClientMetadata;
import org.opensearch.fleet.model.ClientSnapshot;
import org.opensearch.fleet.model.StatSnapshot;

import java.util.List;
import java.util.Optional;
import java.util.SortedSet;

/**
 * Storage of client snapshots, metadata, resource statistics and crashes.
 *
 * <p>Each call is a single logical operation against the underlying storage. Implementations must be
 * interchangeable: for identical stored data every read returns the same values in the same order.
 */
public interface ClientStore {

    /**
     * @return true if at least one snapshot of the client is stored
     */
    boolean exists(ClientId clientId);

    /**
     * @return identifiers of all clients with at least one snapshot, ascending
     */
    SortedSet<ClientId> listClients();

    void writeSnapshot(ClientSnapshot snapshot);

    /**
     * Replaces the stored metadata of a client. Null fields are stored as unset.
     *
     * @throws UnknownClientException if the backend requires a snapshot before metadata and has none
     */
    void writeMetadata(ClientId clientId, ClientMetadata metadata);

    /**
     * @throws UnknownClientException if the backend requires a snapshot before statistics and has none
     */
    void writeStats(ClientId clientId, StatSnapshot stats);

    /**
     * @throws UnknownClientException if the backend requires a snapshot before crashes and has none
     */
    void writeCrash(ClientCrash crash);

    Optional<ClientSnapshot> readLatestSnapshot(ClientId clientId);

    /**
     * @return the latest snapshot taken at or before {@code timestamp}
     */
    Optional<ClientSnapshot> readSnapshotAt(ClientId clientId, long timestamp);

    /**
     * @return snapshots with {@code start <= timestamp <= end}, ascending by timestamp
     */
    List<ClientSnapshot> readSnapshots(ClientId clientId, long start, long end);

    /**
     * @return metadata of the client, or {@link ClientMetadata#EMPTY} if nothing is recorded
     */
    ClientMetadata readMetadata(ClientId clientId);

    /**
     * @return statistics snapshots with {@code start <= timestamp <= end}, ascending by timestamp
     */
    List<StatSnapshot> readStats(ClientId clientId, long start, long end);

    /**
     * @return crashes of the client, ascending by timestamp
     */
    List<ClientCrash> readCrashes(ClientId clientId);
}
