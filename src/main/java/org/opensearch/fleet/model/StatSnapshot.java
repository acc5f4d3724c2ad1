/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet.model;

import java.util.List;

/**
 * One interval of agent resource telemetry. CPU and I/O figures come as nested samples with their own
 * timestamps; network and memory figures are single values for the whole snapshot.
 */
public record StatSnapshot(
    long timestamp,
    List<CpuSample> cpuSamples,
    List<IoSample> ioSamples,
    long bytesReceived,
    long bytesSent,
    double memoryPercent,
    long rssSize,
    long vmsSize
) {

    public StatSnapshot {
        cpuSamples = cpuSamples == null ? List.of() : List.copyOf(cpuSamples);
        ioSamples = ioSamples == null ? List.of() : List.copyOf(ioSamples);
    }

    /** Cumulative CPU times (seconds) and instantaneous CPU usage at {@code timestamp}. */
    public record CpuSample(long timestamp, double userCpuTime, double systemCpuTime, double cpuPercent) {}

    /** Cumulative I/O operation and byte counts at {@code timestamp}. */
    public record IoSample(long timestamp, long readCount, long writeCount, long readBytes, long writeBytes) {}
}
