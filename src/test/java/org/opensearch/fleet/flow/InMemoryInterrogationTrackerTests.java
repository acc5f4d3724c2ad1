/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet.flow;

import org.opensearch.core.rest.RestStatus;
import org.opensearch.fleet.storage.ClientNotFoundException;
import org.opensearch.test.OpenSearchTestCase;

import static org.opensearch.fleet.FleetTestUtils.clientId;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.not;

public class InMemoryInterrogationTrackerTests extends OpenSearchTestCase {

    private final InMemoryInterrogationTracker tracker = new InMemoryInterrogationTracker(id -> id.equals(clientId(1)));

    public void testStartedOperationIsRunningUntilCompleted() {
        String operationId = tracker.startInterrogation(clientId(1), "alice");

        assertThat(tracker.getOperationState(operationId), equalTo(OperationState.RUNNING));
        tracker.completeOperation(operationId);
        assertThat(tracker.getOperationState(operationId), equalTo(OperationState.FINISHED));
    }

    public void testOperationIdsAreUnique() {
        String first = tracker.startInterrogation(clientId(1), "alice");
        String second = tracker.startInterrogation(clientId(1), "alice");

        assertThat(first, not(equalTo(second)));
    }

    public void testUnknownClientCannotBeInterrogated() {
        expectThrows(ClientNotFoundException.class, () -> tracker.startInterrogation(clientId(2), "alice"));
    }

    public void testUnknownOperation() {
        OperationNotFoundException e = expectThrows(OperationNotFoundException.class, () -> tracker.getOperationState("missing"));
        assertThat(e.status(), equalTo(RestStatus.NOT_FOUND));
        expectThrows(OperationNotFoundException.class, () -> tracker.completeOperation("missing"));
    }

    public void testStateValues() {
        assertThat(OperationState.RUNNING.value(), equalTo("running"));
        assertThat(OperationState.FINISHED.value(), equalTo("finished"));
    }
}
