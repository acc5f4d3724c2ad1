/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet.storage;

import org.opensearch.ResourceNotFoundException;
import org.opensearch.fleet.model.ClientId;

/**
 * Thrown when no record exists for a client identifier.
 */
public class ClientNotFoundException extends ResourceNotFoundException {

    public ClientNotFoundException(ClientId clientId) {
        super("client [{}] not found", clientId);
    }

    public ClientNotFoundException(ClientId clientId, long timestamp) {
        super("client [{}] has no snapshot at or before [{}]", clientId, timestamp);
    }
}
