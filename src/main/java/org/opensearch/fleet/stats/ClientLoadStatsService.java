/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet.stats;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.common.unit.TimeValue;
import org.opensearch.fleet.metrics.FleetMetrics;
import org.opensearch.fleet.metrics.FleetMetricsConstants;
import org.opensearch.fleet.model.ClientId;
import org.opensearch.fleet.model.StatSnapshot;
import org.opensearch.fleet.storage.ClientNotFoundException;
import org.opensearch.fleet.storage.ClientStore;
import org.opensearch.fleet.storage.FleetBackend;
import org.opensearch.telemetry.metrics.Counter;
import org.opensearch.telemetry.metrics.Histogram;
import org.opensearch.telemetry.metrics.MetricsRegistry;
import org.opensearch.telemetry.metrics.tags.Tags;

import java.util.List;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

/**
 * Serves a client's load statistics as a single normalized series.
 */
public class ClientLoadStatsService {

    private static final Logger logger = LogManager.getLogger(ClientLoadStatsService.class);

    private static final Metrics METRICS = new Metrics();

    private final Supplier<FleetBackend> backend;
    private final LoadStatsSeriesBuilder seriesBuilder;
    private final TimeValue defaultLookback;
    private final LongSupplier clock;

    /**
     * @param backend         supplies the backend serving reads
     * @param maxSamples      maximum number of points returned per series
     * @param defaultLookback range used when no start time is given
     * @param clock           current time in epoch millis
     */
    public ClientLoadStatsService(Supplier<FleetBackend> backend, int maxSamples, TimeValue defaultLookback, LongSupplier clock) {
        this.backend = backend;
        this.seriesBuilder = new LoadStatsSeriesBuilder(maxSamples);
        this.defaultLookback = defaultLookback;
        this.clock = clock;
    }

    public static FleetMetrics.MetricsInitializer getMetricsInitializer() {
        return METRICS;
    }

    /**
     * Reads one metric of a client over {@code [start, end]}.
     *
     * @param metricName {@link LoadStatsMetric} name, case-insensitive
     * @param start      range start in epoch millis, or null for {@code end - defaultLookback}
     * @param end        range end in epoch millis, or null for now
     * @throws UnknownMetricException  if the metric name is unknown
     * @throws ClientNotFoundException if the client is unknown
     */
    public TimeSeries readLoadStats(ClientId clientId, String metricName, Long start, Long end) {
        LoadStatsMetric metric = LoadStatsMetric.fromString(metricName);
        long resolvedEnd = end == null ? clock.getAsLong() : end;
        long resolvedStart = start == null ? resolvedEnd - defaultLookback.millis() : start;
        if (resolvedEnd < resolvedStart) {
            throw new IllegalArgumentException("end [" + resolvedEnd + "] must not be before start [" + resolvedStart + "]");
        }

        ClientStore store = backend.get().clientStore();
        if (store.exists(clientId) == false) {
            throw new ClientNotFoundException(clientId);
        }
        List<StatSnapshot> snapshots = store.readStats(clientId, resolvedStart, resolvedEnd);
        TimeSeries series = seriesBuilder.build(snapshots, metric, resolvedStart, resolvedEnd);

        Tags tags = Tags.create().addTag("metric", metric.name());
        FleetMetrics.incrementCounter(METRICS.requestsTotal, 1, tags);
        FleetMetrics.recordHistogram(METRICS.pointsReturned, series.size(), tags);
        logger.debug(
            "Load stats [{}] of client [{}] in [{}, {}]: {} snapshots, {} points",
            metric,
            clientId,
            resolvedStart,
            resolvedEnd,
            snapshots.size(),
            series.size()
        );
        return series;
    }

    /**
     * Metrics container for ClientLoadStatsService.
     */
    static class Metrics implements FleetMetrics.MetricsInitializer {
        Counter requestsTotal;
        Histogram pointsReturned;

        @Override
        public synchronized void register(MetricsRegistry registry) {
            requestsTotal = registry.createCounter(
                FleetMetricsConstants.LOAD_STATS_REQUESTS_TOTAL,
                FleetMetricsConstants.LOAD_STATS_REQUESTS_TOTAL_DESC,
                FleetMetricsConstants.UNIT_COUNT
            );
            pointsReturned = registry.createHistogram(
                FleetMetricsConstants.LOAD_STATS_POINTS,
                FleetMetricsConstants.LOAD_STATS_POINTS_DESC,
                FleetMetricsConstants.UNIT_COUNT
            );
        }

        @Override
        public synchronized void cleanup() {
            requestsTotal = null;
            pointsReturned = null;
        }
    }
}
