/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet.ip;

import org.opensearch.common.network.InetAddresses;

import java.net.Inet6Address;
import java.net.InetAddress;

/**
 * Classifies addresses by range only: loopback, site-local, link-local and IPv6 unique local addresses are
 * internal, everything else is external.
 */
public class DefaultIpResolver implements IpResolver {

    @Override
    public IpInfo resolve(InetAddress address) {
        if (address == null) {
            return new IpInfo(IpStatus.UNKNOWN, "No ip information.");
        }
        if (isInternal(address)) {
            return new IpInfo(IpStatus.INTERNAL, "Internal IP address.");
        }
        return new IpInfo(IpStatus.EXTERNAL, InetAddresses.toAddrString(address));
    }

    /**
     * Parses a stored address string.
     *
     * @return the address, or null when the string is empty or not an IP address
     */
    public static InetAddress parse(String ip) {
        if (ip == null || ip.isEmpty() || InetAddresses.isInetAddress(ip) == false) {
            return null;
        }
        return InetAddresses.forString(ip);
    }

    static boolean isInternal(InetAddress address) {
        if (address.isLoopbackAddress() || address.isSiteLocalAddress() || address.isLinkLocalAddress()) {
            return true;
        }
        // fc00::/7
        return address instanceof Inet6Address && (address.getAddress()[0] & 0xfe) == 0xfc;
    }
}
