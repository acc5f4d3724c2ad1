/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet.rest;

import org.opensearch.client.node.NodeClient;
import org.opensearch.fleet.model.ClientCrash;
import org.opensearch.fleet.model.ClientId;
import org.opensearch.fleet.storage.ClientRecordReader;
import org.opensearch.rest.RestRequest;

import java.io.IOException;
import java.util.List;
import java.util.function.LongSupplier;
import java.util.stream.Collectors;

import static org.opensearch.rest.RestRequest.Method.GET;

/**
 * Lists the crashes of a client, most recent first.
 *
 * <h2>Parameters:</h2>
 * <ul>
 *   <li><b>offset</b>: index of the first crash (default: 0)</li>
 *   <li><b>count</b>: maximum number of crashes, 0 for no limit (default: 0)</li>
 *   <li><b>filter</b>: case-insensitive substring of the crash type or message</li>
 * </ul>
 *
 * <p>{@code total_count} is the number of crashes of the client before filtering and pagination.
 */
public class RestListClientCrashesAction extends BaseFleetAction {
    public static final String NAME = "fleet_list_client_crashes_action";

    private static final String FILTER_PARAM = "filter";

    private final ClientRecordReader reader;

    public RestListClientCrashesAction(ClientRecordReader reader, LongSupplier clock) {
        super(clock);
        this.reader = reader;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public List<Route> routes() {
        return List.of(new Route(GET, CLIENT_PATH + "/crashes"));
    }

    @Override
    protected RestChannelConsumer prepareRequest(RestRequest request, NodeClient client) throws IOException {
        String clientIdParam = request.param(CLIENT_ID_PARAM);
        String offsetParam = request.param(OFFSET_PARAM);
        String countParam = request.param(COUNT_PARAM);
        String filter = request.param(FILTER_PARAM);

        try {
            ClientId clientId = ClientId.fromString(clientIdParam);
            int offset = parseNonNegativeInt(OFFSET_PARAM, offsetParam, 0);
            int count = parseNonNegativeInt(COUNT_PARAM, countParam, 0);
            List<ClientCrash> crashes = reader.readClientCrashes(clientId);
            List<ClientCrash> page = crashes.stream()
                .filter(crash -> crash.matches(filter))
                .skip(offset)
                .limit(count == 0 ? Long.MAX_VALUE : count)
                .collect(Collectors.toList());
            return respond((builder, params) -> {
                builder.startObject();
                builder.field("total_count", crashes.size());
                builder.startArray("items");
                for (ClientCrash crash : page) {
                    crash.toXContent(builder, params);
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
