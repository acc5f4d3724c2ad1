/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet.rest;

import org.opensearch.client.node.NodeClient;
import org.opensearch.common.unit.TimeValue;
import org.opensearch.core.rest.RestStatus;
import org.opensearch.fleet.model.ClientId;
import org.opensearch.fleet.model.ClientRecord;
import org.opensearch.fleet.storage.ClientRecordReader;
import org.opensearch.rest.RestRequest;

import java.io.IOException;
import java.util.List;
import java.util.function.LongSupplier;

import static org.opensearch.rest.RestRequest.Method.GET;

/**
 * Lists the stored snapshots of a client taken in {@code [start, end]}, most recent first. Without {@code start}
 * the range covers the configured lookback before {@code end}.
 */
public class RestGetClientVersionsAction extends BaseFleetAction {
    public static final String NAME = "fleet_get_client_versions_action";

    private final ClientRecordReader reader;
    private final TimeValue defaultLookback;

    public RestGetClientVersionsAction(ClientRecordReader reader, TimeValue defaultLookback, LongSupplier clock) {
        super(clock);
        this.reader = reader;
        this.defaultLookback = defaultLookback;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public List<Route> routes() {
        return List.of(new Route(GET, CLIENT_PATH + "/versions"));
    }

    @Override
    protected RestChannelConsumer prepareRequest(RestRequest request, NodeClient client) throws IOException {
        String clientIdParam = request.param(CLIENT_ID_PARAM);
        String startParam = request.param(START_PARAM);
        String endParam = request.param(END_PARAM);

        try {
            ClientId clientId = ClientId.fromString(clientIdParam);
            long now = nowMillis();
            Long end = parseTime(END_PARAM, endParam, now);
            long endMs = end == null ? now : end;
            Long start = parseTime(START_PARAM, startParam, now);
            long startMs = start == null ? endMs - defaultLookback.millis() : start;
            if (startMs > endMs) {
                return errorResponse(RestStatus.BAD_REQUEST, "Start time must not be after end time");
            }
            List<ClientRecord> versions = reader.readClientVersions(clientId, startMs, endMs);
            return respond((builder, params) -> {
                builder.startObject();
                builder.startArray("items");
                for (ClientRecord version : versions) {
                    version.toXContent(builder, params);
                }
                builder.endArray();
                builder.endObject();
                return builder;
            });
        } catch (Exception e) {
            return failureResponse(e);
        }
    }
}
