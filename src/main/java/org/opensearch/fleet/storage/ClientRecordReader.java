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
import org.opensearch.fleet.model.ClientLabel;
import org.opensearch.fleet.model.ClientRecord;
import org.opensearch.fleet.model.ClientSnapshot;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Builds canonical {@link ClientRecord}s from whichever backend it is given. All population and ordering rules
 * live here, so both backends present identical records for identical stored data.
 */
public class ClientRecordReader {

    private final ClientStore clientStore;
    private final LabelStore labelStore;

    public ClientRecordReader(FleetBackend backend) {
        this(backend.clientStore(), backend.labelStore());
    }

    public ClientRecordReader(ClientStore clientStore, LabelStore labelStore) {
        this.clientStore = clientStore;
        this.labelStore = labelStore;
    }

    /**
     * @return the latest state of the client
     * @throws ClientNotFoundException if the backend holds no snapshot of the client
     */
    public ClientRecord readClient(ClientId clientId) {
        ClientSnapshot snapshot = clientStore.readLatestSnapshot(clientId).orElseThrow(() -> new ClientNotFoundException(clientId));
        return ClientRecord.assemble(snapshot, clientStore.readMetadata(clientId), labelStore.readLabels(clientId));
    }

    /**
     * @return the client as of the latest snapshot taken at or before {@code timestamp}
     * @throws ClientNotFoundException if there is no such snapshot
     */
    public ClientRecord readClientAt(ClientId clientId, long timestamp) {
        ClientSnapshot snapshot = clientStore.readSnapshotAt(clientId, timestamp)
            .orElseThrow(() -> new ClientNotFoundException(clientId, timestamp));
        return ClientRecord.assemble(snapshot, clientStore.readMetadata(clientId), labelStore.readLabels(clientId));
    }

    /**
     * @return records of the clients that exist, ascending by identifier; unknown identifiers are skipped
     */
    public List<ClientRecord> readClients(Collection<ClientId> clientIds) {
        List<ClientRecord> records = new ArrayList<>(clientIds.size());
        for (ClientId clientId : new TreeSet<>(clientIds)) {
            Optional<ClientSnapshot> snapshot = clientStore.readLatestSnapshot(clientId);
            snapshot.ifPresent(s -> records.add(ClientRecord.assemble(s, clientStore.readMetadata(clientId), labelStore.readLabels(clientId))));
        }
        return records;
    }

    /**
     * @return snapshots taken in {@code [start, end]}, most recent first; server-side metadata is not included
     * @throws ClientNotFoundException if the client is unknown
     */
    public List<ClientRecord> readClientVersions(ClientId clientId, long start, long end) {
        requireExists(clientId);
        List<ClientLabel> labels = labelStore.readLabels(clientId);
        List<ClientRecord> versions = new ArrayList<>();
        for (ClientSnapshot snapshot : clientStore.readSnapshots(clientId, start, end)) {
            versions.add(ClientRecord.assemble(snapshot, null, labels));
        }
        Collections.reverse(versions);
        return versions;
    }

    /**
     * @return timestamps of all stored snapshots, most recent first
     * @throws ClientNotFoundException if the client is unknown
     */
    public List<Long> readClientVersionTimes(ClientId clientId) {
        requireExists(clientId);
        List<Long> times = new ArrayList<>();
        for (ClientSnapshot snapshot : clientStore.readSnapshots(clientId, Long.MIN_VALUE, Long.MAX_VALUE)) {
            times.add(snapshot.timestamp());
        }
        Collections.reverse(times);
        return times;
    }

    /**
     * @return crashes of the client, most recent first
     * @throws ClientNotFoundException if the client is unknown
     */
    public List<ClientCrash> readClientCrashes(ClientId clientId) {
        requireExists(clientId);
        List<ClientCrash> crashes = new ArrayList<>(clientStore.readCrashes(clientId));
        Collections.reverse(crashes);
        return crashes;
    }

    /**
     * @return the last IP address recorded for the client, if any
     * @throws ClientNotFoundException if the client is unknown
     */
    public Optional<String> readLastClientIp(ClientId clientId) {
        requireExists(clientId);
        return Optional.ofNullable(clientStore.readMetadata(clientId).lastIp());
    }

    public List<ClientLabel> readLabels(ClientId clientId) {
        return labelStore.readLabels(clientId);
    }

    public boolean exists(ClientId clientId) {
        return clientStore.exists(clientId);
    }

    private void requireExists(ClientId clientId) {
        if (clientStore.exists(clientId) == false) {
            throw new ClientNotFoundException(clientId);
        }
    }
}
