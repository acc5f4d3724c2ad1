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
import org.opensearch.fleet.search.ClientSearchService;
import org.opensearch.fleet.search.LabelWhitelist;
import org.opensearch.rest.RestRequest;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.function.LongSupplier;

import static org.opensearch.rest.RestRequest.Method.GET;
import static org.opensearch.rest.RestRequest.Method.POST;

/**
 * REST handler for client keyword search.
 *
 * <h2>Supported Routes:</h2>
 * <ul>
 *   <li>GET/POST /_fleet/clients/_search</li>
 * </ul>
 *
 * <h2>Parameters:</h2>
 * <ul>
 *   <li><b>query</b>: whitespace separated keywords, blank for all clients. A {@code query} field in the POST body
 *       takes precedence over the URL parameter.</li>
 *   <li><b>offset</b>: index of the first result (default: 0)</li>
 *   <li><b>count</b>: maximum number of results, 0 for no limit (default: 0)</li>
 * </ul>
 *
 * <p>When a label whitelist is configured, only clients carrying a whitelisted label are returned.
 */
public class RestSearchClientsAction extends BaseFleetAction {
    public static final String NAME = "fleet_search_clients_action";

    private static final String PATH = BASE_PATH + "/clients/_search";
    private static final String QUERY_PARAM = "query";

    private final ClientSearchService searchService;
    private final LabelWhitelist whitelist;

    /**
     * @param whitelist labels restricting the search, or null for unrestricted searches
     */
    public RestSearchClientsAction(ClientSearchService searchService, LabelWhitelist whitelist, LongSupplier clock) {
        super(clock);
        this.searchService = searchService;
        this.whitelist = whitelist;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public List<Route> routes() {
        return List.of(new Route(GET, PATH), new Route(POST, PATH));
    }

    @Override
    protected RestChannelConsumer prepareRequest(RestRequest request, NodeClient client) throws IOException {
        String queryParam = request.param(QUERY_PARAM);
        String offsetParam = request.param(OFFSET_PARAM);
        String countParam = request.param(COUNT_PARAM);

        try {
            String bodyQuery = parseBodyQuery(request);
            String query = bodyQuery != null ? bodyQuery : queryParam;
            int offset = parseNonNegativeInt(OFFSET_PARAM, offsetParam, 0);
            int count = parseNonNegativeInt(COUNT_PARAM, countParam, 0);
            return respond(searchService.search(query, offset, count, whitelist));
        } catch (Exception e) {
            return failureResponse(e);
        }
    }

    private static String parseBodyQuery(RestRequest request) throws IOException {
        if (request.hasContent() == false) {
            return null;
        }
        try (XContentParser parser = request.contentParser()) {
            Map<String, Object> body = parser.map();
            Object query = body.get(QUERY_PARAM);
            if (query != null && query instanceof String == false) {
                throw new IllegalArgumentException("[" + QUERY_PARAM + "] must be a string");
            }
            return (String) query;
        }
    }
}
