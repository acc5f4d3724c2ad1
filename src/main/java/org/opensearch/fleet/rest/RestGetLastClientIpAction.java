/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet.rest;

import org.opensearch.client.node.NodeClient;
import org.opensearch.common.network.InetAddresses;
import org.opensearch.fleet.ip.DefaultIpResolver;
import org.opensearch.fleet.ip.IpInfo;
import org.opensearch.fleet.ip.IpResolver;
import org.opensearch.fleet.model.ClientId;
import org.opensearch.fleet.storage.ClientRecordReader;
import org.opensearch.rest.RestRequest;

import java.io.IOException;
import java.net.InetAddress;
import java.util.List;
import java.util.function.LongSupplier;

import static org.opensearch.rest.RestRequest.Method.GET;

/**
 * Returns the last IP address a client connected from, with its classification. Addresses that are missing or
 * cannot be parsed are reported as an empty string with status {@code unknown}.
 */
public class RestGetLastClientIpAction extends BaseFleetAction {
    public static final String NAME = "fleet_get_last_client_ip_action";

    private final ClientRecordReader reader;
    private final IpResolver ipResolver;

    public RestGetLastClientIpAction(ClientRecordReader reader, IpResolver ipResolver, LongSupplier clock) {
        super(clock);
        this.reader = reader;
        this.ipResolver = ipResolver;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public List<Route> routes() {
        return List.of(new Route(GET, CLIENT_PATH + "/last_ip"));
    }

    @Override
    protected RestChannelConsumer prepareRequest(RestRequest request, NodeClient client) throws IOException {
        String clientIdParam = request.param(CLIENT_ID_PARAM);

        try {
            InetAddress address = reader.readLastClientIp(ClientId.fromString(clientIdParam))
                .map(DefaultIpResolver::parse)
                .orElse(null);
            IpInfo info = ipResolver.resolve(address);
            String ip = address == null ? "" : InetAddresses.toAddrString(address);
            return respond((builder, params) -> {
                builder.startObject();
                builder.field("ip", ip);
                builder.field("status", info.status().value());
                builder.field("info", info.info());
                builder.endObject();
                return builder;
            });
        } catch (Exception e) {
            return failureResponse(e);
        }
    }
}
