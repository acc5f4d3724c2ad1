/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet.rest;

import org.opensearch.client.node.NodeClient;
import org.opensearch.core.xcontent.XContentParser;
import org.opensearch.fleet.labels.ClientLabelService;
import org.opensearch.fleet.labels.LabelMutationResult;
import org.opensearch.fleet.model.ClientId;
import org.opensearch.rest.RestRequest;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.LongSupplier;

import static org.opensearch.rest.RestRequest.Method.GET;
import static org.opensearch.rest.RestRequest.Method.POST;

/**
 * Manages client labels owned by the calling user.
 *
 * <h2>Supported Routes:</h2>
 * <ul>
 *   <li>POST /_fleet/labels/_add - attach labels to clients</li>
 *   <li>POST /_fleet/labels/_remove - detach labels from clients</li>
 *   <li>GET /_fleet/labels - names of all labels in use</li>
 * </ul>
 *
 * <h2>Request Body (POST):</h2>
 * <pre>{@code
 * {
 *   "client_ids": ["C.1000000000000000"],
 *   "labels": ["prod"]
 * }
 * }</pre>
 *
 * <p>Mutations require the {@value BaseFleetAction#USER_HEADER} header; labels are owned by that user.
 */
public class RestClientLabelsAction extends BaseFleetAction {
    public static final String NAME = "fleet_client_labels_action";

    private static final String LABELS_PATH = BASE_PATH + "/labels";
    private static final String ADD_PATH = LABELS_PATH + "/_add";
    private static final String REMOVE_PATH = LABELS_PATH + "/_remove";
    private static final String CLIENT_IDS_FIELD = "client_ids";
    private static final String LABELS_FIELD = "labels";

    private final ClientLabelService labelService;

    public RestClientLabelsAction(ClientLabelService labelService, LongSupplier clock) {
        super(clock);
        this.labelService = labelService;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public List<Route> routes() {
        return List.of(new Route(POST, ADD_PATH), new Route(POST, REMOVE_PATH), new Route(GET, LABELS_PATH));
    }

    @Override
    protected RestChannelConsumer prepareRequest(RestRequest request, NodeClient client) throws IOException {
        if (request.method() == GET) {
            List<String> names = new ArrayList<>(labelService.listLabelNames());
            return respond((builder, params) -> {
                builder.startObject();
                builder.field("items", names);
                builder.endObject();
                return builder;
            });
        }

        boolean add = request.path().endsWith(ADD_PATH);
        try {
            String user = requireUser(request);
            MutationBody body = parseBody(request);
            LabelMutationResult result = add
                ? labelService.addClientsLabels(body.clientIds(), body.labels(), user)
                : labelService.removeClientsLabels(body.clientIds(), body.labels(), user);
            return respond(result);
        } catch (Exception e) {
            return failureResponse(e);
        }
    }

    static MutationBody parseBody(RestRequest request) throws IOException {
        if (request.hasContent() == false) {
            throw new IllegalArgumentException("Request body is required");
        }
        Map<String, Object> body;
        try (XContentParser parser = request.contentParser()) {
            body = parser.map();
        }
        List<ClientId> clientIds = new ArrayList<>();
        for (String raw : stringList(body, CLIENT_IDS_FIELD)) {
            clientIds.add(ClientId.fromString(raw));
        }
        return new MutationBody(clientIds, stringList(body, LABELS_FIELD));
    }

    private static List<String> stringList(Map<String, Object> body, String field) {
        Object value = body.get(field);
        if (value == null) {
            return List.of();
        }
        if (value instanceof List == false) {
            throw new IllegalArgumentException("[" + field + "] must be an array of strings");
        }
        List<String> strings = new ArrayList<>();
        for (Object item : (List<?>) value) {
            if (item instanceof String == false) {
                throw new IllegalArgumentException("[" + field + "] must be an array of strings");
            }
            strings.add((String) item);
        }
        return strings;
    }

    record MutationBody(List<ClientId> clientIds, List<String> labels) {}
}
