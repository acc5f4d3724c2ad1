/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet.stats;

import org.opensearch.fleet.model.StatSnapshot;

import java.util.List;
import java.util.Locale;
import java.util.function.ToDoubleFunction;

/**
 * Load statistics that can be extracted from {@link StatSnapshot}s, each with a fixed {@link MetricKind}.
 *
 * <p>CPU and I/O metrics yield one point per nested sample, timestamped by the sample. Network and memory metrics
 * yield one point per snapshot, timestamped by the snapshot.
 */
public enum LoadStatsMetric {
    CPU_PERCENT(MetricKind.GAUGE, Source.CPU, StatSnapshot.CpuSample::cpuPercent, null, null),
    CPU_SYSTEM(MetricKind.COUNTER, Source.CPU, StatSnapshot.CpuSample::systemCpuTime, null, null),
    CPU_USER(MetricKind.COUNTER, Source.CPU, StatSnapshot.CpuSample::userCpuTime, null, null),
    IO_READ_BYTES(MetricKind.COUNTER, Source.IO, null, StatSnapshot.IoSample::readBytes, null),
    IO_WRITE_BYTES(MetricKind.COUNTER, Source.IO, null, StatSnapshot.IoSample::writeBytes, null),
    IO_READ_OPS(MetricKind.COUNTER, Source.IO, null, StatSnapshot.IoSample::readCount, null),
    IO_WRITE_OPS(MetricKind.COUNTER, Source.IO, null, StatSnapshot.IoSample::writeCount, null),
    NETWORK_BYTES_RECEIVED(MetricKind.COUNTER, Source.SNAPSHOT, null, null, s -> s.bytesReceived()),
    NETWORK_BYTES_SENT(MetricKind.COUNTER, Source.SNAPSHOT, null, null, s -> s.bytesSent()),
    MEMORY_PERCENT(MetricKind.GAUGE, Source.SNAPSHOT, null, null, StatSnapshot::memoryPercent),
    MEMORY_RSS_SIZE(MetricKind.GAUGE, Source.SNAPSHOT, null, null, s -> s.rssSize()),
    MEMORY_VMS_SIZE(MetricKind.GAUGE, Source.SNAPSHOT, null, null, s -> s.vmsSize());

    private enum Source {
        CPU,
        IO,
        SNAPSHOT
    }

    private final MetricKind kind;
    private final Source source;
    private final ToDoubleFunction<StatSnapshot.CpuSample> cpuValue;
    private final ToDoubleFunction<StatSnapshot.IoSample> ioValue;
    private final ToDoubleFunction<StatSnapshot> snapshotValue;

    LoadStatsMetric(
        MetricKind kind,
        Source source,
        ToDoubleFunction<StatSnapshot.CpuSample> cpuValue,
        ToDoubleFunction<StatSnapshot.IoSample> ioValue,
        ToDoubleFunction<StatSnapshot> snapshotValue
    ) {
        this.kind = kind;
        this.source = source;
        this.cpuValue = cpuValue;
        this.ioValue = ioValue;
        this.snapshotValue = snapshotValue;
    }

    public MetricKind kind() {
        return kind;
    }

    /**
     * Appends the points this metric contributes from one snapshot, in the snapshot's own order.
     */
    public void extract(StatSnapshot snapshot, List<TimeSeriesPoint> points) {
        switch (source) {
            case CPU -> snapshot.cpuSamples().forEach(sample -> points.add(new TimeSeriesPoint(sample.timestamp(), cpuValue.applyAsDouble(sample))));
            case IO -> snapshot.ioSamples().forEach(sample -> points.add(new TimeSeriesPoint(sample.timestamp(), ioValue.applyAsDouble(sample))));
            case SNAPSHOT -> points.add(new TimeSeriesPoint(snapshot.timestamp(), snapshotValue.applyAsDouble(snapshot)));
        }
    }

    /**
     * Resolves a metric by name, case-insensitively.
     *
     * @throws UnknownMetricException if no metric has that name
     */
    public static LoadStatsMetric fromString(String name) {
        if (name == null || name.isBlank()) {
            throw new UnknownMetricException(String.valueOf(name));
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new UnknownMetricException(name);
        }
    }
}
