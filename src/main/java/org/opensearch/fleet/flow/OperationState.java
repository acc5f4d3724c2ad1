/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet.flow;

import java.util.Locale;

/**
 * State of an interrogation operation.
 */
public enum OperationState {
    RUNNING,
    FINISHED;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
