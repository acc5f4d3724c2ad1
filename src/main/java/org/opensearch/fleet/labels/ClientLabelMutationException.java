/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet.labels;

import org.opensearch.ExceptionsHelper;
import org.opensearch.OpenSearchException;
import org.opensearch.core.rest.RestStatus;
import org.opensearch.fleet.model.ClientId;

import java.util.List;

/**
 * A label mutation failed on the primary backend. Clients processed before the failing one keep their changes;
 * they are listed in {@link #getCompletedClients()}.
 */
public class ClientLabelMutationException extends OpenSearchException {

    private final ClientId clientId;
    private final List<ClientId> completedClients;

    public ClientLabelMutationException(ClientId clientId, List<ClientId> completedClients, Exception cause) {
        super("failed to update labels of client [{}]: {}", cause, clientId, cause.getMessage());
        this.clientId = clientId;
        this.completedClients = List.copyOf(completedClients);
    }

    public ClientId getClientId() {
        return clientId;
    }

    public List<ClientId> getCompletedClients() {
        return completedClients;
    }

    @Override
    public RestStatus status() {
        return ExceptionsHelper.status(getCause());
    }
}
