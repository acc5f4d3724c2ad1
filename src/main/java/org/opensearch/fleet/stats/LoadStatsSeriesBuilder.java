/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet.stats;

import org.opensearch.fleet.model.StatSnapshot;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns stored stat snapshots into a single evenly sampled series for one metric: extraction, stable merge,
 * counter repair, then downsampling when the series is longer than the sample cap.
 */
public class LoadStatsSeriesBuilder {

    private final int maxSamples;

    public LoadStatsSeriesBuilder(int maxSamples) {
        if (maxSamples < 1) {
            throw new IllegalArgumentException("maxSamples must be >= 1, got " + maxSamples);
        }
        this.maxSamples = maxSamples;
    }

    public int maxSamples() {
        return maxSamples;
    }

    public TimeSeries build(List<StatSnapshot> snapshots, LoadStatsMetric metric, long start, long end) {
        List<TimeSeriesPoint> points = new ArrayList<>();
        for (StatSnapshot snapshot : snapshots) {
            metric.extract(snapshot, points);
        }
        TimeSeries series = TimeSeries.of(points);
        if (metric.kind() == MetricKind.COUNTER) {
            series = series.makeIncreasing();
        }
        if (series.size() > maxSamples) {
            series = series.normalize(start, end, maxSamples, metric.kind());
        }
        return series;
    }
}
