/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet.storage.relational;

import org.opensearch.fleet.model.ClientCrash;
import org.opensearch.fleet.model.ClientId;
import org.opensearch.fleet.model.ClientMetadata;
import org.opensearch.fleet.model.ClientSnapshot;
import org.opensearch.fleet.model.StatSnapshot;
import org.opensearch.fleet.storage.ClientStore;
import org.opensearch.fleet.storage.UnknownClientException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@link ClientStore} laid out as tables keyed by client: a client row must exist (created by its first
 * snapshot) before metadata, statistics or crashes can reference it.
 */
public class RelationalClientStore implements ClientStore {

    static final String BACKEND_NAME = "relational";

    /**
     * One row of the clients table plus the rows of its child tables.
     */
    static final class ClientRow {
        final ConcurrentSkipListMap<Long, ClientSnapshot> snapshots = new ConcurrentSkipListMap<>();
        final ConcurrentSkipListMap<Long, StatSnapshot> stats = new ConcurrentSkipListMap<>();
        final List<ClientCrash> crashes = new CopyOnWriteArrayList<>();
        volatile ClientMetadata metadata = ClientMetadata.EMPTY;
    }

    private final Map<ClientId, ClientRow> clients = new ConcurrentHashMap<>();

    ClientRow row(ClientId clientId) {
        ClientRow row = clients.get(clientId);
        if (row == null) {
            throw new UnknownClientException(clientId, BACKEND_NAME);
        }
        return row;
    }

    @Override
    public boolean exists(ClientId clientId) {
        ClientRow row = clients.get(clientId);
        return row != null && row.snapshots.isEmpty() == false;
    }

    @Override
    public SortedSet<ClientId> listClients() {
        SortedSet<ClientId> ids = new TreeSet<>();
        clients.forEach((id, row) -> {
            if (row.snapshots.isEmpty() == false) {
                ids.add(id);
            }
        });
        return ids;
    }

    @Override
    public void writeSnapshot(ClientSnapshot snapshot) {
        clients.computeIfAbsent(snapshot.clientId(), id -> new ClientRow()).snapshots.put(snapshot.timestamp(), snapshot);
    }

    @Override
    public void writeMetadata(ClientId clientId, ClientMetadata metadata) {
        row(clientId).metadata = metadata;
    }

    @Override
    public void writeStats(ClientId clientId, StatSnapshot stats) {
        row(clientId).stats.put(stats.timestamp(), stats);
    }

    @Override
    public void writeCrash(ClientCrash crash) {
        List<ClientCrash> crashes = row(crash.clientId()).crashes;
        crashes.removeIf(existing -> existing.timestamp() == crash.timestamp());
        crashes.add(crash);
    }

    @Override
    public Optional<ClientSnapshot> readLatestSnapshot(ClientId clientId) {
        ClientRow row = clients.get(clientId);
        if (row == null) {
            return Optional.empty();
        }
        Map.Entry<Long, ClientSnapshot> entry = row.snapshots.lastEntry();
        return entry == null ? Optional.empty() : Optional.of(entry.getValue());
    }

    @Override
    public Optional<ClientSnapshot> readSnapshotAt(ClientId clientId, long timestamp) {
        ClientRow row = clients.get(clientId);
        if (row == null) {
            return Optional.empty();
        }
        Map.Entry<Long, ClientSnapshot> entry = row.snapshots.floorEntry(timestamp);
        return entry == null ? Optional.empty() : Optional.of(entry.getValue());
    }

    @Override
    public List<ClientSnapshot> readSnapshots(ClientId clientId, long start, long end) {
        ClientRow row = clients.get(clientId);
        if (row == null || start > end) {
            return List.of();
        }
        return new ArrayList<>(row.snapshots.subMap(start, true, end, true).values());
    }

    @Override
    public ClientMetadata readMetadata(ClientId clientId) {
        ClientRow row = clients.get(clientId);
        return row == null ? ClientMetadata.EMPTY : row.metadata;
    }

    @Override
    public List<StatSnapshot> readStats(ClientId clientId, long start, long end) {
        ClientRow row = clients.get(clientId);
        if (row == null || start > end) {
            return List.of();
        }
        return new ArrayList<>(row.stats.subMap(start, true, end, true).values());
    }

    @Override
    public List<ClientCrash> readCrashes(ClientId clientId) {
        ClientRow row = clients.get(clientId);
        if (row == null) {
            return List.of();
        }
        List<ClientCrash> crashes = new ArrayList<>(row.crashes);
        crashes.sort(Comparator.comparingLong(ClientCrash::timestamp));
        return crashes;
    }
}
