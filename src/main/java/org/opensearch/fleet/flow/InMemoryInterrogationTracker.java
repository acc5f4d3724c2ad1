/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet.flow;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.common.UUIDs;
import org.opensearch.fleet.model.ClientId;
import org.opensearch.fleet.storage.ClientNotFoundException;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * Keeps interrogation operations in memory. Operations stay {@link OperationState#RUNNING} until
 * {@link #completeOperation(String)} is called.
 */
public class InMemoryInterrogationTracker implements InterrogationService {

    private static final Logger logger = LogManager.getLogger(InMemoryInterrogationTracker.class);

    private final Map<String, Operation> operations = new ConcurrentHashMap<>();
    private final Predicate<ClientId> clientExists;

    /**
     * @param clientExists whether a client may be interrogated
     */
    public InMemoryInterrogationTracker(Predicate<ClientId> clientExists) {
        this.clientExists = clientExists;
    }

    @Override
    public String startInterrogation(ClientId clientId, String user) {
        if (clientExists.test(clientId) == false) {
            throw new ClientNotFoundException(clientId);
        }
        String operationId = UUIDs.randomBase64UUID();
        operations.put(operationId, new Operation(clientId, user, OperationState.RUNNING));
        logger.info("User [{}] started interrogation [{}] of client [{}]", user, operationId, clientId);
        return operationId;
    }

    @Override
    public OperationState getOperationState(String operationId) {
        Operation operation = operations.get(operationId);
        if (operation == null) {
            throw new OperationNotFoundException(operationId);
        }
        return operation.state();
    }

    /**
     * Marks an operation as finished.
     *
     * @throws OperationNotFoundException if the operation id is unknown
     */
    public void completeOperation(String operationId) {
        Operation updated = operations.computeIfPresent(
            operationId,
            (id, operation) -> new Operation(operation.clientId(), operation.user(), OperationState.FINISHED)
        );
        if (updated == null) {
            throw new OperationNotFoundException(operationId);
        }
        logger.debug("Interrogation [{}] of client [{}] finished", operationId, updated.clientId());
    }

    private record Operation(ClientId clientId, String user, OperationState state) {}
}
