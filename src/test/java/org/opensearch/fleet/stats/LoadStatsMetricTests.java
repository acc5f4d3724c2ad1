/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet.stats;

import org.opensearch.core.rest.RestStatus;
import org.opensearch.fleet.model.StatSnapshot;
import org.opensearch.test.OpenSearchTestCase;

import java.util.ArrayList;
import java.util.List;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;

public class LoadStatsMetricTests extends OpenSearchTestCase {

    private static final StatSnapshot SNAPSHOT = new StatSnapshot(
        100_000L,
        List.of(new StatSnapshot.CpuSample(90_000L, 1.5, 0.5, 12.0), new StatSnapshot.CpuSample(95_000L, 2.0, 0.75, 30.0)),
        List.of(new StatSnapshot.IoSample(91_000L, 3, 4, 1024, 2048)),
        500L,
        600L,
        42.5,
        1L << 20,
        1L << 30
    );

    private static List<TimeSeriesPoint> extract(LoadStatsMetric metric) {
        List<TimeSeriesPoint> points = new ArrayList<>();
        metric.extract(SNAPSHOT, points);
        return points;
    }

    public void testCpuMetricsUseSampleTimestamps() {
        assertThat(extract(LoadStatsMetric.CPU_PERCENT), contains(new TimeSeriesPoint(90_000L, 12.0), new TimeSeriesPoint(95_000L, 30.0)));
        assertThat(extract(LoadStatsMetric.CPU_USER), contains(new TimeSeriesPoint(90_000L, 1.5), new TimeSeriesPoint(95_000L, 2.0)));
        assertThat(extract(LoadStatsMetric.CPU_SYSTEM), contains(new TimeSeriesPoint(90_000L, 0.5), new TimeSeriesPoint(95_000L, 0.75)));
    }

    public void testIoMetrics() {
        assertThat(extract(LoadStatsMetric.IO_READ_OPS), contains(new TimeSeriesPoint(91_000L, 3)));
        assertThat(extract(LoadStatsMetric.IO_WRITE_OPS), contains(new TimeSeriesPoint(91_000L, 4)));
        assertThat(extract(LoadStatsMetric.IO_READ_BYTES), contains(new TimeSeriesPoint(91_000L, 1024)));
        assertThat(extract(LoadStatsMetric.IO_WRITE_BYTES), contains(new TimeSeriesPoint(91_000L, 2048)));
    }

    public void testSnapshotMetricsUseSnapshotTimestamp() {
        assertThat(extract(LoadStatsMetric.NETWORK_BYTES_RECEIVED), contains(new TimeSeriesPoint(100_000L, 500)));
        assertThat(extract(LoadStatsMetric.NETWORK_BYTES_SENT), contains(new TimeSeriesPoint(100_000L, 600)));
        assertThat(extract(LoadStatsMetric.MEMORY_PERCENT), contains(new TimeSeriesPoint(100_000L, 42.5)));
        assertThat(extract(LoadStatsMetric.MEMORY_RSS_SIZE), contains(new TimeSeriesPoint(100_000L, 1L << 20)));
        assertThat(extract(LoadStatsMetric.MEMORY_VMS_SIZE), contains(new TimeSeriesPoint(100_000L, 1L << 30)));
    }

    public void testKinds() {
        assertThat(LoadStatsMetric.CPU_PERCENT.kind(), equalTo(MetricKind.GAUGE));
        assertThat(LoadStatsMetric.MEMORY_PERCENT.kind(), equalTo(MetricKind.GAUGE));
        assertThat(LoadStatsMetric.CPU_USER.kind(), equalTo(MetricKind.COUNTER));
        assertThat(LoadStatsMetric.IO_WRITE_BYTES.kind(), equalTo(MetricKind.COUNTER));
        assertThat(LoadStatsMetric.NETWORK_BYTES_SENT.kind(), equalTo(MetricKind.COUNTER));
    }

    public void testFromStringIsCaseInsensitive() {
        assertThat(LoadStatsMetric.fromString("cpu_percent"), equalTo(LoadStatsMetric.CPU_PERCENT));
        assertThat(LoadStatsMetric.fromString(" Memory_RSS_Size "), equalTo(LoadStatsMetric.MEMORY_RSS_SIZE));
    }

    public void testUnknownMetricIsBadRequest() {
        UnknownMetricException e = expectThrows(UnknownMetricException.class, () -> LoadStatsMetric.fromString("disk_temperature"));
        assertThat(e.status(), equalTo(RestStatus.BAD_REQUEST));
        assertThat(e.getMessage(), containsString("disk_temperature"));
        expectThrows(UnknownMetricException.class, () -> LoadStatsMetric.fromString(""));
        expectThrows(UnknownMetricException.class, () -> LoadStatsMetric.fromString(null));
    }
}
