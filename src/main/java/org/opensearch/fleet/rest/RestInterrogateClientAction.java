/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet.rest;

import org.opensearch.client.node.NodeClient;
import org.opensearch.fleet.flow.InterrogationService;
import org.opensearch.fleet.flow.OperationState;
import org.opensearch.fleet.model.ClientId;
import org.opensearch.rest.RestRequest;

import java.io.IOException;
import java.util.List;
import java.util.function.LongSupplier;

import static org.opensearch.rest.RestRequest.Method.GET;
import static org.opensearch.rest.RestRequest.Method.POST;

/**
 * Starts client interrogations and reports their state.
 *
 * <h2>Supported Routes:</h2>
 * <ul>
 *   <li>POST /_fleet/clients/{client_id}/_interrogate - start an interrogation, requires the user header</li>
 *   <li>GET /_fleet/interrogations/{operation_id} - state of an interrogation</li>
 * </ul>
 */
public class RestInterrogateClientAction extends BaseFleetAction {
    public static final String NAME = "fleet_interrogate_client_action";

    private static final String OPERATION_ID_PARAM = "operation_id";
    private static final String OPERATION_PATH = BASE_PATH + "/interrogations/{" + OPERATION_ID_PARAM + "}";

    private final InterrogationService interrogationService;

    public RestInterrogateClientAction(InterrogationService interrogationService, LongSupplier clock) {
        super(clock);
        this.interrogationService = interrogationService;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public List<Route> routes() {
        return List.of(new Route(POST, CLIENT_PATH + "/_interrogate"), new Route(GET, OPERATION_PATH));
    }

    @Override
    protected RestChannelConsumer prepareRequest(RestRequest request, NodeClient client) throws IOException {
        if (request.method() == GET) {
            return prepareGetState(request.param(OPERATION_ID_PARAM));
        }
        String clientIdParam = request.param(CLIENT_ID_PARAM);

        try {
            String user = requireUser(request);
            String operationId = interrogationService.startInterrogation(ClientId.fromString(clientIdParam), user);
            return respond((builder, params) -> {
                builder.startObject();
                builder.field(OPERATION_ID_PARAM, operationId);
                builder.endObject();
                return builder;
            });
        } catch (Exception e) {
            return failureResponse(e);
        }
    }

    private RestChannelConsumer prepareGetState(String operationId) {
        try {
            OperationState state = interrogationService.getOperationState(operationId);
            return respond((builder, params) -> {
                builder.startObject();
                builder.field(OPERATION_ID_PARAM, operationId);
                builder.field("state", state.value());
                builder.endObject();
                return builder;
            });
        } catch (Exception e) {
            return failureResponse(e);
        }
    }
}
