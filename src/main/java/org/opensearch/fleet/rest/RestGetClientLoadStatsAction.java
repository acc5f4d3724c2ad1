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
import org.opensearch.fleet.stats.ClientLoadStatsService;
import org.opensearch.fleet.stats.TimeSeries;
import org.opensearch.fleet.stats.TimeSeriesPoint;
import org.opensearch.rest.RestRequest;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.function.LongSupplier;

import static org.opensearch.rest.RestRequest.Method.GET;

/**
 * Returns one load statistic of a client as a normalized series.
 *
 * <h2>Parameters:</h2>
 * <ul>
 *   <li><b>metric</b> (required): e.g. {@code cpu_percent}, {@code io_read_bytes}, {@code memory_rss_size}</li>
 *   <li><b>start</b> (optional): range start, date math or epoch millis (default: end minus the configured lookback)</li>
 *   <li><b>end</b> (optional): range end (default: now)</li>
 * </ul>
 */
public class RestGetClientLoadStatsAction extends BaseFleetAction {
    public static final String NAME = "fleet_get_client_load_stats_action";

    private static final String METRIC_PARAM = "metric";

    private final ClientLoadStatsService loadStatsService;

    public RestGetClientLoadStatsAction(ClientLoadStatsService loadStatsService, LongSupplier clock) {
        super(clock);
        this.loadStatsService = loadStatsService;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public List<Route> routes() {
        return List.of(new Route(GET, CLIENT_PATH + "/load_stats"));
    }

    @Override
    protected RestChannelConsumer prepareRequest(RestRequest request, NodeClient client) throws IOException {
        String clientIdParam = request.param(CLIENT_ID_PARAM);
        String metric = request.param(METRIC_PARAM);
        String startParam = request.param(START_PARAM);
        String endParam = request.param(END_PARAM);

        try {
            ClientId clientId = ClientId.fromString(clientIdParam);
            long now = nowMillis();
            Long start = parseTime(START_PARAM, startParam, now);
            Long end = parseTime(END_PARAM, endParam, now);
            TimeSeries series = loadStatsService.readLoadStats(clientId, metric, start, end == null ? now : end);
            return respond((builder, params) -> {
                builder.startObject();
                builder.field("client_id", clientId.value());
                builder.field(METRIC_PARAM, metric.toLowerCase(Locale.ROOT));
                builder.startArray("data_points");
                for (TimeSeriesPoint point : series.points()) {
                    builder.startObject();
                    builder.field("timestamp", point.timestamp());
                    builder.field("value", point.value());
                    builder.endObject();
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
