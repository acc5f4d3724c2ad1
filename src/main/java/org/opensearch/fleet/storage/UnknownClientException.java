/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet.storage;

import org.opensearch.OpenSearchException;
import org.opensearch.core.rest.RestStatus;
import org.opensearch.fleet.model.ClientId;

/**
 * Raised by a storage backend that holds no row for a client it is asked to mutate. During a migration this
 * means the client has not been copied to that backend yet.
 */
public class UnknownClientException extends OpenSearchException {

    private final ClientId clientId;

    public UnknownClientException(ClientId clientId, String backend) {
        super("client [{}] is unknown to the [{}] backend", clientId, backend);
        this.clientId = clientId;
    }

    public ClientId getClientId() {
        return clientId;
    }

    @Override
    public RestStatus status() {
        return RestStatus.NOT_FOUND;
    }
}
