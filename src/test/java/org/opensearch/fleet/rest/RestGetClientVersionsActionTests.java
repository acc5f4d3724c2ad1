/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet.rest;

import org.opensearch.common.unit.TimeValue;
import org.opensearch.core.rest.RestStatus;
import org.opensearch.rest.RestRequest;
import org.opensearch.test.rest.FakeRestChannel;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.opensearch.fleet.FleetTestUtils.clientId;
import static org.opensearch.fleet.FleetTestUtils.snapshot;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;

public class RestGetClientVersionsActionTests extends FleetRestActionTestCase {

    private static final String VERSIONS_PATH = "/_fleet/clients/{client_id}/versions";
    private static final String TIMES_PATH = "/_fleet/clients/{client_id}/version_times";
    private static final long MINUTE = 60_000L;

    private RestGetClientVersionsAction versionsAction;
    private RestGetClientVersionTimesAction timesAction;

    @Override
    public void setUp() throws Exception {
        super.setUp();
        for (int minutesAgo : new int[] { 10, 5, 2 }) {
            ingest.recordSnapshot(snapshot(clientId(1), NOW - minutesAgo * MINUTE, "host-" + minutesAgo + ".example.com"));
        }
        versionsAction = new RestGetClientVersionsAction(reader, TimeValue.timeValueMinutes(3), () -> NOW);
        timesAction = new RestGetClientVersionTimesAction(reader, () -> NOW);
    }

    @SuppressWarnings("unchecked")
    private static List<Object> ages(FakeRestChannel channel) {
        List<Map<String, Object>> items = (List<Map<String, Object>>) responseMap(channel).get("items");
        return items.stream().map(item -> item.get("age")).collect(Collectors.toList());
    }

    public void testDefaultLookback() throws Exception {
        FakeRestChannel channel = dispatch(
            versionsAction,
            request(RestRequest.Method.GET, VERSIONS_PATH, Map.of("client_id", clientId(1).value()))
        );

        assertThat(channel.capturedResponse().status(), equalTo(RestStatus.OK));
        assertThat(ages(channel), equalTo(List.of(NOW - 2 * MINUTE)));
    }

    public void testExplicitRangeMostRecentFirst() throws Exception {
        FakeRestChannel channel = dispatch(
            versionsAction,
            request(RestRequest.Method.GET, VERSIONS_PATH, Map.of("client_id", clientId(1).value(), "start", "now-1h", "end", "now-3m"))
        );

        assertThat(ages(channel), equalTo(List.of(NOW - 5 * MINUTE, NOW - 10 * MINUTE)));
    }

    public void testStartAfterEnd() throws Exception {
        FakeRestChannel channel = dispatch(
            versionsAction,
            request(RestRequest.Method.GET, VERSIONS_PATH, Map.of("client_id", clientId(1).value(), "start", "now", "end", "now-1h"))
        );

        assertThat(channel.capturedResponse().status(), equalTo(RestStatus.BAD_REQUEST));
        assertThat(responseBody(channel), containsString("Start time must not be after end time"));
    }

    public void testUnknownClient() throws Exception {
        FakeRestChannel channel = dispatch(
            versionsAction,
            request(RestRequest.Method.GET, VERSIONS_PATH, Map.of("client_id", clientId(2).value()))
        );

        assertThat(channel.capturedResponse().status(), equalTo(RestStatus.NOT_FOUND));
    }

    public void testVersionTimes() throws Exception {
        FakeRestChannel channel = dispatch(timesAction, request(RestRequest.Method.GET, TIMES_PATH, Map.of("client_id", clientId(1).value())));

        assertThat(channel.capturedResponse().status(), equalTo(RestStatus.OK));
        assertThat(responseMap(channel).get("times"), equalTo(List.of(NOW - 2 * MINUTE, NOW - 5 * MINUTE, NOW - 10 * MINUTE)));
    }

    public void testRoutes() {
        assertThat(versionsAction.routes().get(0).getPath(), equalTo(VERSIONS_PATH));
        assertThat(timesAction.routes().get(0).getPath(), equalTo(TIMES_PATH));
    }
}
