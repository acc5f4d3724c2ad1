/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet.stats;

import org.opensearch.core.xcontent.ToXContentObject;
import org.opensearch.core.xcontent.XContentBuilder;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * An immutable series of points in ascending timestamp order. Points with equal timestamps keep the order in
 * which they were supplied.
 */
public final class TimeSeries implements ToXContentObject {

    private static final TimeSeries EMPTY = new TimeSeries(List.of());

    private final List<TimeSeriesPoint> points;

    private TimeSeries(List<TimeSeriesPoint> sortedPoints) {
        this.points = List.copyOf(sortedPoints);
    }

    public static TimeSeries empty() {
        return EMPTY;
    }

    /**
     * Creates a series from points in any order. The sort is stable.
     */
    public static TimeSeries of(Collection<TimeSeriesPoint> points) {
        List<TimeSeriesPoint> sorted = new ArrayList<>(points);
        sorted.sort(Comparator.comparingLong(TimeSeriesPoint::timestamp));
        return new TimeSeries(sorted);
    }

    public List<TimeSeriesPoint> points() {
        return points;
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    /**
     * Repairs counter resets: every value lower than the running maximum is raised to it, so the result is
     * non-decreasing. Timestamps are untouched.
     */
    public TimeSeries makeIncreasing() {
        List<TimeSeriesPoint> repaired = new ArrayList<>(points.size());
        double max = Double.NEGATIVE_INFINITY;
        for (TimeSeriesPoint point : points) {
            max = Math.max(max, point.value());
            repaired.add(point.value() == max ? point : new TimeSeriesPoint(point.timestamp(), max));
        }
        return new TimeSeries(repaired);
    }

    /**
     * Downsamples the series into at most {@code cap} equal-width buckets over {@code [start, end]}.
     *
     * <p>The bucket width is {@code max(1, (end - start) / cap)}; the last bucket also takes every point up to
     * {@code end}. Points outside {@code [start, end]} are dropped. Each non-empty bucket becomes one point at
     * the bucket start, holding the mean of its values for gauges and the maximum for counters.
     *
     * @throws IllegalArgumentException if {@code cap < 1} or {@code end < start}
     */
    public TimeSeries normalize(long start, long end, int cap, MetricKind kind) {
        if (cap < 1) {
            throw new IllegalArgumentException("cap must be >= 1, got " + cap);
        }
        if (end < start) {
            throw new IllegalArgumentException("end [" + end + "] must not be before start [" + start + "]");
        }
        long width = Math.max(1, (end - start) / cap);
        double[] sums = new double[cap];
        double[] maxima = new double[cap];
        int[] counts = new int[cap];

        for (TimeSeriesPoint point : points) {
            if (point.timestamp() < start || point.timestamp() > end) {
                continue;
            }
            int bucket = (int) Math.min((point.timestamp() - start) / width, cap - 1);
            maxima[bucket] = counts[bucket] == 0 ? point.value() : Math.max(maxima[bucket], point.value());
            sums[bucket] += point.value();
            counts[bucket]++;
        }

        List<TimeSeriesPoint> normalized = new ArrayList<>();
        for (int i = 0; i < cap; i++) {
            if (counts[i] == 0) {
                continue;
            }
            double value = kind == MetricKind.COUNTER ? maxima[i] : sums[i] / counts[i];
            normalized.add(new TimeSeriesPoint(start + i * width, value));
        }
        return new TimeSeries(normalized);
    }

    @Override
    public XContentBuilder toXContent(XContentBuilder builder, Params params) throws IOException {
        builder.startObject();
        builder.startArray("points");
        for (TimeSeriesPoint point : points) {
            builder.startObject();
            builder.field("timestamp", point.timestamp());
            builder.field("value", point.value());
            builder.endObject();
        }
        builder.endArray();
        builder.endObject();
        return builder;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return points.equals(((TimeSeries) o).points);
    }

    @Override
    public int hashCode() {
        return points.hashCode();
    }

    @Override
    public String toString() {
        return "TimeSeries" + points;
    }
}
