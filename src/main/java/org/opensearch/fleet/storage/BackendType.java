/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet.storage;

import java.util.Arrays;
import java.util.Locale;

/**
 * Storage backends a node can read from.
 */
public enum BackendType {
    LEGACY,
    RELATIONAL;

    public String settingValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static BackendType fromString(String value) {
        for (BackendType type : values()) {
            if (type.settingValue().equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException(
            "Invalid storage backend: " + value + ". Valid options: " + Arrays.toString(Arrays.stream(values()).map(BackendType::settingValue).toArray())
        );
    }
}
