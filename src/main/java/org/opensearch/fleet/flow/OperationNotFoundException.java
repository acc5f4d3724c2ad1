/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet.flow;

import org.opensearch.ResourceNotFoundException;

/**
 * Thrown when an interrogation operation id is not known.
 */
public class OperationNotFoundException extends ResourceNotFoundException {

    public OperationNotFoundException(String operationId) {
        super("interrogation operation [{}] not found", operationId);
    }
}
