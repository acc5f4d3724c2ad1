/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet.ip;

import java.util.Locale;

/**
 * Coarse classification of an IP address.
 */
public enum IpStatus {
    UNKNOWN,
    INTERNAL,
    EXTERNAL;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
