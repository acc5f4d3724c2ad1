/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet.ip;

import java.net.InetAddress;

/**
 * Classifies IP addresses reported by clients.
 */
@FunctionalInterface
public interface IpResolver {

    /**
     * @param address address to classify, or null when unknown
     */
    IpInfo resolve(InetAddress address);
}
