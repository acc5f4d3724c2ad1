/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet.rest;

import org.opensearch.core.rest.RestStatus;
import org.opensearch.fleet.flow.InMemoryInterrogationTracker;
import org.opensearch.rest.RestRequest;
import org.opensearch.test.rest.FakeRestChannel;

import java.util.Map;

import static org.opensearch.fleet.FleetTestUtils.clientId;
import static org.opensearch.fleet.FleetTestUtils.snapshot;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;

public class RestInterrogateClientActionTests extends FleetRestActionTestCase {

    private static final String START_PATH = "/_fleet/clients/{client_id}/_interrogate";
    private static final String STATE_PATH = "/_fleet/interrogations/{operation_id}";

    private InMemoryInterrogationTracker tracker;
    private RestInterrogateClientAction action;

    @Override
    public void setUp() throws Exception {
        super.setUp();
        ingest.recordSnapshot(snapshot(clientId(1), NOW, "web-01.example.com"));
        tracker = new InMemoryInterrogationTracker(reader::exists);
        action = new RestInterrogateClientAction(tracker, () -> NOW);
    }

    private FakeRestChannel start(String clientId) throws Exception {
        return dispatch(action, withUser(request(RestRequest.Method.POST, START_PATH, Map.of("client_id", clientId)), "alice"));
    }

    private FakeRestChannel state(String operationId) throws Exception {
        return dispatch(action, request(RestRequest.Method.GET, STATE_PATH, Map.of("operation_id", operationId)));
    }

    public void testStartAndPoll() throws Exception {
        FakeRestChannel started = start(clientId(1).value());
        assertThat(started.capturedResponse().status(), equalTo(RestStatus.OK));
        String operationId = (String) responseMap(started).get("operation_id");
        assertNotNull(operationId);

        assertThat(responseMap(state(operationId)), equalTo(Map.of("operation_id", operationId, "state", "running")));

        tracker.completeOperation(operationId);
        assertThat(responseMap(state(operationId)).get("state"), equalTo("finished"));
    }

    public void testStartRequiresUser() throws Exception {
        FakeRestChannel channel = dispatch(action, request(RestRequest.Method.POST, START_PATH, Map.of("client_id", clientId(1).value())));

        assertThat(channel.capturedResponse().status(), equalTo(RestStatus.BAD_REQUEST));
        assertThat(responseBody(channel), containsString("Missing [X-Fleet-User] header"));
    }

    public void testUnknownClient() throws Exception {
        assertThat(start(clientId(2).value()).capturedResponse().status(), equalTo(RestStatus.NOT_FOUND));
    }

    public void testUnknownOperation() throws Exception {
        FakeRestChannel channel = state("no-such-operation");

        assertThat(channel.capturedResponse().status(), equalTo(RestStatus.NOT_FOUND));
        assertThat(responseBody(channel), containsString("interrogation operation [no-such-operation] not found"));
    }
}
