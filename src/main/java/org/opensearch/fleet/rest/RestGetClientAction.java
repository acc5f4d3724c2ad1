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
 * Returns a client record, either its latest state or its state as of {@code timestamp}.
 */
public class RestGetClientAction extends BaseFleetAction {
    public static final String NAME = "fleet_get_client_action";

    private static final String TIMESTAMP_PARAM = "timestamp";

    private final ClientRecordReader reader;

    public RestGetClientAction(ClientRecordReader reader, LongSupplier clock) {
        super(clock);
        this.reader = reader;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public List<Route> routes() {
        return List.of(new Route(GET, CLIENT_PATH));
    }

    @Override
    protected RestChannelConsumer prepareRequest(RestRequest request, NodeClient client) throws IOException {
        String clientIdParam = request.param(CLIENT_ID_PARAM);
        String timestampParam = request.param(TIMESTAMP_PARAM);

        try {
            ClientId clientId = ClientId.fromString(clientIdParam);
            Long timestamp = parseTime(TIMESTAMP_PARAM, timestampParam, nowMillis());
            return respond(timestamp == null ? reader.readClient(clientId) : reader.readClientAt(clientId, timestamp));
        } catch (Exception e) {
            return failureResponse(e);
        }
    }
}
