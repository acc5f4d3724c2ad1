/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet.flow;

import org.opensearch.fleet.model.ClientId;

/**
 * Starts interrogations of clients and reports their progress. Implementations hand the work to the flow engine.
 */
public interface InterrogationService {

    /**
     * Starts collecting a fresh snapshot from the client.
     *
     * @param user user on whose behalf the interrogation runs
     * @return opaque operation id
     */
    String startInterrogation(ClientId clientId, String user);

    /**
     * @throws OperationNotFoundException if the operation id is unknown
     */
    OperationState getOperationState(String operationId);
}
