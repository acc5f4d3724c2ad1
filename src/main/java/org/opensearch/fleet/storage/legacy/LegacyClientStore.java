/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet.storage.legacy;

import org.opensearch.fleet.model.ClientCrash;
import org.opensearch.fleet.model.ClientId;
import org.opensearch.fleet.model.ClientMetadata;
import org.opensearch.fleet.model.ClientSnapshot;
import org.opensearch.fleet.model.StatSnapshot;
import org.opensearch.fleet.storage.ClientStore;

import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

import static org.opensearch.fleet.storage.legacy.HierarchicalStore.path;

/**
 * {@link ClientStore} over the {@link HierarchicalStore}. Every client lives under {@code clients/<id>}, with one
 * path per kind of data and one path per metadata attribute. An attribute that was never written has no path,
 * which is how "unset" is represented.
 */
public class LegacyClientStore implements ClientStore {

    static final String CLIENTS = "clients";
    private static final String SNAPSHOT = "snapshot";
    private static final String STATS = "stats";
    private static final String CRASHES = "crashes";
    private static final String METADATA = "metadata";

    private static final String FIRST_SEEN = "first_seen";
    private static final String PING = "ping";
    private static final String CLOCK = "clock";
    private static final String LAST_BOOT = "last_boot";
    private static final String LAST_CRASH = "last_crash";
    private static final String LAST_IP = "last_ip";

    private final HierarchicalStore store;

    public LegacyClientStore(HierarchicalStore store) {
        this.store = store;
    }

    static String clientPath(ClientId clientId, String... children) {
        String[] segments = new String[children.length + 2];
        segments[0] = CLIENTS;
        segments[1] = clientId.value();
        System.arraycopy(children, 0, segments, 2, children.length);
        return path(segments);
    }

    @Override
    public boolean exists(ClientId clientId) {
        return store.exists(clientPath(clientId, SNAPSHOT));
    }

    @Override
    public SortedSet<ClientId> listClients() {
        SortedSet<ClientId> clients = new TreeSet<>();
        for (String child : store.listChildren(CLIENTS)) {
            ClientId clientId = ClientId.fromString(child);
            if (exists(clientId)) {
                clients.add(clientId);
            }
        }
        return clients;
    }

    @Override
    public void writeSnapshot(ClientSnapshot snapshot) {
        store.write(clientPath(snapshot.clientId(), SNAPSHOT), snapshot.timestamp(), snapshot);
    }

    @Override
    public void writeMetadata(ClientId clientId, ClientMetadata metadata) {
        writeAttribute(clientId, FIRST_SEEN, metadata.firstSeen());
        writeAttribute(clientId, PING, metadata.lastPing());
        writeAttribute(clientId, CLOCK, metadata.lastClock());
        writeAttribute(clientId, LAST_BOOT, metadata.lastBoot());
        writeAttribute(clientId, LAST_CRASH, metadata.lastCrash());
        writeAttribute(clientId, LAST_IP, metadata.lastIp());
    }

    private void writeAttribute(ClientId clientId, String attribute, Object value) {
        String attributePath = clientPath(clientId, METADATA, attribute);
        if (value == null) {
            store.delete(attributePath);
        } else {
            store.update(attributePath, current -> value);
        }
    }

    @Override
    public void writeStats(ClientId clientId, StatSnapshot stats) {
        store.write(clientPath(clientId, STATS), stats.timestamp(), stats);
    }

    @Override
    public void writeCrash(ClientCrash crash) {
        store.write(clientPath(crash.clientId(), CRASHES), crash.timestamp(), crash);
    }

    @Override
    public Optional<ClientSnapshot> readLatestSnapshot(ClientId clientId) {
        return store.readLatest(clientPath(clientId, SNAPSHOT), ClientSnapshot.class);
    }

    @Override
    public Optional<ClientSnapshot> readSnapshotAt(ClientId clientId, long timestamp) {
        return store.readAt(clientPath(clientId, SNAPSHOT), timestamp, ClientSnapshot.class);
    }

    @Override
    public List<ClientSnapshot> readSnapshots(ClientId clientId, long start, long end) {
        return store.readRange(clientPath(clientId, SNAPSHOT), start, end, ClientSnapshot.class);
    }

    @Override
    public ClientMetadata readMetadata(ClientId clientId) {
        return new ClientMetadata(
            readAttribute(clientId, FIRST_SEEN, Long.class),
            readAttribute(clientId, PING, Long.class),
            readAttribute(clientId, CLOCK, Long.class),
            readAttribute(clientId, LAST_BOOT, Long.class),
            readAttribute(clientId, LAST_CRASH, Long.class),
            readAttribute(clientId, LAST_IP, String.class)
        );
    }

    private <T> T readAttribute(ClientId clientId, String attribute, Class<T> type) {
        return store.readLatest(clientPath(clientId, METADATA, attribute), type).orElse(null);
    }

    @Override
    public List<StatSnapshot> readStats(ClientId clientId, long start, long end) {
        return store.readRange(clientPath(clientId, STATS), start, end, StatSnapshot.class);
    }

    @Override
    public List<ClientCrash> readCrashes(ClientId clientId) {
        return store.readRange(clientPath(clientId, CRASHES), Long.MIN_VALUE, Long.MAX_VALUE, ClientCrash.class);
    }
}
