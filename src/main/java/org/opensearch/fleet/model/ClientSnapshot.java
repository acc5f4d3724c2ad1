/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The result of one interrogation of a client: host, operating system, agent, users and network interfaces
 * as observed at {@code timestamp}.
 *
 * <p>String fields may be null when the agent did not report them. {@code installTime}, {@code bootTime} and
 * {@code memorySize} are null when unknown.
 */
public record ClientSnapshot(
    ClientId clientId,
    long timestamp,
    String fqdn,
    String osSystem,
    String osRelease,
    String osVersion,
    String kernel,
    String arch,
    Long installTime,
    Long bootTime,
    Long memorySize,
    String agentName,
    String agentVersion,
    List<User> users,
    List<NetworkInterface> interfaces
) {

    public ClientSnapshot {
        Objects.requireNonNull(clientId, "clientId must not be null");
        users = users == null ? List.of() : List.copyOf(users);
        interfaces = interfaces == null ? List.of() : List.copyOf(interfaces);
    }

    /**
     * A user account known on the client.
     */
    public record User(String username, String fullName) {
        public User {
            Objects.requireNonNull(username, "username must not be null");
        }
    }

    /**
     * A network interface with its hardware address and assigned IP addresses.
     */
    public record NetworkInterface(String name, String macAddress, List<String> addresses) {
        public NetworkInterface {
            addresses = addresses == null ? List.of() : List.copyOf(addresses);
        }
    }

    public ClientSnapshot withUsers(List<User> newUsers) {
        return new ClientSnapshot(
            clientId,
            timestamp,
            fqdn,
            osSystem,
            osRelease,
            osVersion,
            kernel,
            arch,
            installTime,
            bootTime,
            memorySize,
            agentName,
            agentVersion,
            newUsers,
            interfaces
        );
    }

    public static Builder builder(ClientId clientId, long timestamp) {
        return new Builder(clientId, timestamp);
    }

    public Builder toBuilder() {
        Builder builder = new Builder(clientId, timestamp).fqdn(fqdn)
            .os(osSystem, osRelease, osVersion)
            .kernel(kernel)
            .arch(arch)
            .installTime(installTime)
            .bootTime(bootTime)
            .memorySize(memorySize)
            .agent(agentName, agentVersion);
        users.forEach(builder::user);
        interfaces.forEach(builder::networkInterface);
        return builder;
    }

    public static final class Builder {
        private ClientId clientId;
        private long timestamp;
        private String fqdn;
        private String osSystem;
        private String osRelease;
        private String osVersion;
        private String kernel;
        private String arch;
        private Long installTime;
        private Long bootTime;
        private Long memorySize;
        private String agentName;
        private String agentVersion;
        private final List<User> users = new ArrayList<>();
        private final List<NetworkInterface> interfaces = new ArrayList<>();

        private Builder(ClientId clientId, long timestamp) {
            this.clientId = clientId;
            this.timestamp = timestamp;
        }

        public Builder timestamp(long timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder fqdn(String fqdn) {
            this.fqdn = fqdn;
            return this;
        }

        public Builder os(String system, String release, String version) {
            this.osSystem = system;
            this.osRelease = release;
            this.osVersion = version;
            return this;
        }

        public Builder kernel(String kernel) {
            this.kernel = kernel;
            return this;
        }

        public Builder arch(String arch) {
            this.arch = arch;
            return this;
        }

        public Builder installTime(Long installTime) {
            this.installTime = installTime;
            return this;
        }

        public Builder bootTime(Long bootTime) {
            this.bootTime = bootTime;
            return this;
        }

        public Builder memorySize(Long memorySize) {
            this.memorySize = memorySize;
            return this;
        }

        public Builder agent(String name, String version) {
            this.agentName = name;
            this.agentVersion = version;
            return this;
        }

        public Builder user(User user) {
            users.add(user);
            return this;
        }

        public Builder user(String username, String fullName) {
            return user(new User(username, fullName));
        }

        public Builder networkInterface(NetworkInterface networkInterface) {
            interfaces.add(networkInterface);
            return this;
        }

        public Builder networkInterface(String name, String macAddress, String... addresses) {
            return networkInterface(new NetworkInterface(name, macAddress, List.of(addresses)));
        }

        public ClientSnapshot build() {
            return new ClientSnapshot(
                clientId,
                timestamp,
                fqdn,
                osSystem,
                osRelease,
                osVersion,
                kernel,
                arch,
                installTime,
                bootTime,
                memorySize,
                agentName,
                agentVersion,
                users,
                interfaces
            );
        }
    }
}
