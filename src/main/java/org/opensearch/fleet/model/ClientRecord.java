/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet.model;

import org.opensearch.core.xcontent.ToXContentObject;
import org.opensearch.core.xcontent.XContentBuilder;

import java.io.IOException;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Canonical, backend-independent view of a client as returned by the API.
 *
 * <p>Optional timestamps ({@code firstSeenAt}, {@code lastSeenAt}, {@code lastBootedAt}, {@code lastClock},
 * {@code lastCrashAt}) are null when the backend holds no value and are then left out of the rendered JSON.
 */
public record ClientRecord(
    ClientId clientId,
    long age,
    ClientSnapshot snapshot,
    Long firstSeenAt,
    Long lastSeenAt,
    Long lastBootedAt,
    Long lastClock,
    Long lastCrashAt,
    List<ClientLabel> labels
) implements ToXContentObject {

    public ClientRecord {
        Objects.requireNonNull(clientId, "clientId must not be null");
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        labels = labels == null ? List.of() : List.copyOf(labels);
    }

    /**
     * Assembles a record from a snapshot, optional metadata and the client's labels. Both storage backends go
     * through here so that field population and ordering rules are identical.
     *
     * @param snapshot the snapshot to present
     * @param metadata server-side bookkeeping, or null for historical versions
     * @param labels   labels currently attached to the client
     */
    public static ClientRecord assemble(ClientSnapshot snapshot, ClientMetadata metadata, Collection<ClientLabel> labels) {
        List<ClientLabel> sortedLabels = labels == null ? List.of() : labels.stream().sorted(ClientLabel.ORDER).collect(Collectors.toList());
        List<ClientSnapshot.User> sortedUsers = snapshot.users()
            .stream()
            .sorted(Comparator.comparing(ClientSnapshot.User::username))
            .collect(Collectors.toList());
        ClientSnapshot normalized = sortedUsers.equals(snapshot.users()) ? snapshot : snapshot.withUsers(sortedUsers);
        if (metadata == null) {
            return new ClientRecord(snapshot.clientId(), snapshot.timestamp(), normalized, null, null, snapshot.bootTime(), null, null, sortedLabels);
        }
        Long bootTime = metadata.lastBoot() != null ? metadata.lastBoot() : snapshot.bootTime();
        return new ClientRecord(
            snapshot.clientId(),
            snapshot.timestamp(),
            normalized,
            metadata.firstSeen(),
            metadata.lastPing(),
            bootTime,
            metadata.lastClock(),
            metadata.lastCrash(),
            sortedLabels
        );
    }

    @Override
    public XContentBuilder toXContent(XContentBuilder builder, Params params) throws IOException {
        builder.startObject();
        builder.field("client_id", clientId.value());
        builder.field("age", age);

        builder.startObject("agent_info");
        optionalField(builder, "client_name", snapshot.agentName());
        optionalField(builder, "client_version", snapshot.agentVersion());
        builder.endObject();

        builder.startObject("os_info");
        optionalField(builder, "system", snapshot.osSystem());
        optionalField(builder, "release", snapshot.osRelease());
        optionalField(builder, "version", snapshot.osVersion());
        optionalField(builder, "kernel", snapshot.kernel());
        optionalField(builder, "machine", snapshot.arch());
        optionalField(builder, "fqdn", snapshot.fqdn());
        optionalField(builder, "install_date", snapshot.installTime());
        builder.endObject();

        optionalField(builder, "first_seen_at", firstSeenAt);
        optionalField(builder, "last_seen_at", lastSeenAt);
        optionalField(builder, "last_booted_at", lastBootedAt);
        optionalField(builder, "last_clock", lastClock);
        optionalField(builder, "last_crash_at", lastCrashAt);
        optionalField(builder, "memory_size", snapshot.memorySize());

        builder.startArray("labels");
        for (ClientLabel label : labels) {
            label.toXContent(builder, params);
        }
        builder.endArray();

        builder.startArray("users");
        for (ClientSnapshot.User user : snapshot.users()) {
            builder.startObject();
            builder.field("username", user.username());
            optionalField(builder, "full_name", user.fullName());
            builder.endObject();
        }
        builder.endArray();

        builder.startArray("interfaces");
        for (ClientSnapshot.NetworkInterface iface : snapshot.interfaces()) {
            builder.startObject();
            optionalField(builder, "ifname", iface.name());
            optionalField(builder, "mac_address", iface.macAddress());
            builder.field("addresses", iface.addresses());
            builder.endObject();
        }
        builder.endArray();

        builder.endObject();
        return builder;
    }

    private static void optionalField(XContentBuilder builder, String name, Object value) throws IOException {
        if (value != null) {
            builder.field(name, value);
        }
    }
}
