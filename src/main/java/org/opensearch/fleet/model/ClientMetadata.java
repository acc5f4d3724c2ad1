/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet.model;

/**
 * Bookkeeping the server keeps about a client between interrogations.
 *
 * <p>Every field is nullable. A null timestamp means the value was never recorded; zero is a valid epoch
 * timestamp and is never used as a placeholder.
 *
 * @param firstSeen  first contact with the server, epoch millis
 * @param lastPing   last contact with the server, epoch millis
 * @param lastClock  client's own clock at last contact, epoch millis
 * @param lastBoot   last boot time reported by the client, epoch millis
 * @param lastCrash  time of the most recent crash, epoch millis
 * @param lastIp     last IP address the client connected from
 */
public record ClientMetadata(Long firstSeen, Long lastPing, Long lastClock, Long lastBoot, Long lastCrash, String lastIp) {

    public static final ClientMetadata EMPTY = new ClientMetadata(null, null, null, null, null, null);

    public ClientMetadata withLastPing(Long ping) {
        return new ClientMetadata(firstSeen, ping, lastClock, lastBoot, lastCrash, lastIp);
    }

    public ClientMetadata withLastCrash(Long crash) {
        return new ClientMetadata(firstSeen, lastPing, lastClock, lastBoot, crash, lastIp);
    }

    public ClientMetadata withLastIp(String ip) {
        return new ClientMetadata(firstSeen, lastPing, lastClock, lastBoot, lastCrash, ip);
    }
}
