/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet.rest;

import org.opensearch.client.node.NodeClient;
import org.opensearch.fleet.model.ClientId;
import org.opensearch.fleet.storage.ClientRecordReader;
import org.opensearch.rest.RestRequest;

import java.io.IOException;
import java.util.List;
import java.util.function.LongSupplier;

import static org.opensearch.rest.RestRequest.Method.GET;

/**
 * Lists the timestamps of all stored snapshots of a client, most recent first.
 */
public class RestGetClientVersionTimesAction extends BaseFleetAction {
    public static final String NAME = "fleet_get_client_version_times_action";

    private final ClientRecordReader reader;

    public RestGetClientVersionTimesAction(ClientRecordReader reader, LongSupplier clock) {
        super(clock);
        this.reader = reader;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public List<Route> routes() {
        return List.of(new Route(GET, CLIENT_PATH + "/version_times"));
    }

    @Override
    protected RestChannelConsumer prepareRequest(RestRequest request, NodeClient client) throws IOException {
        String clientIdParam = request.param(CLIENT_ID_PARAM);

        try {
            List<Long> times = reader.readClientVersionTimes(ClientId.fromString(clientIdParam));
            return respond((builder, params) -> {
                builder.startObject();
                builder.field("times", times);
                builder.endObject();
                return builder;
            });
        } catch (Exception e) {
            return failureResponse(e);
        }
    }
}
