/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet.stats;

import org.opensearch.common.unit.TimeValue;
import org.opensearch.fleet.metrics.FleetMetrics;
import org.opensearch.fleet.metrics.FleetMetricsConstants;
import org.opensearch.fleet.model.StatSnapshot;
import org.opensearch.fleet.storage.BackendType;
import org.opensearch.fleet.storage.ClientIngestService;
import org.opensearch.fleet.storage.ClientNotFoundException;
import org.opensearch.fleet.storage.FleetStorage;
import org.opensearch.fleet.storage.legacy.LegacyFleetBackend;
import org.opensearch.fleet.storage.relational.RelationalFleetBackend;
import org.opensearch.telemetry.metrics.Counter;
import org.opensearch.telemetry.metrics.Histogram;
import org.opensearch.telemetry.metrics.MetricsRegistry;
import org.opensearch.telemetry.metrics.tags.Tags;
import org.opensearch.test.OpenSearchTestCase;

import java.util.List;

import static org.opensearch.fleet.FleetTestUtils.BASE_TIME;
import static org.opensearch.fleet.FleetTestUtils.clientId;
import static org.opensearch.fleet.FleetTestUtils.snapshot;
import static org.opensearch.fleet.FleetTestUtils.stats;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class ClientLoadStatsServiceTests extends OpenSearchTestCase {

    private static final long MINUTE = 60_000L;

    private FleetStorage storage;
    private ClientIngestService ingest;
    private ClientLoadStatsService service;

    @Override
    public void setUp() throws Exception {
        super.setUp();
        storage = new FleetStorage(
            new LegacyFleetBackend(),
            new RelationalFleetBackend(),
            randomFrom(BackendType.values()),
            true
        );
        ingest = new ClientIngestService(storage);
        ingest.recordSnapshot(snapshot(clientId(1), BASE_TIME - 120 * MINUTE, "web-01.example.com"));
        service = new ClientLoadStatsService(storage::reader, 100, TimeValue.timeValueMinutes(30), () -> BASE_TIME);
    }

    @Override
    public void tearDown() throws Exception {
        FleetMetrics.cleanup();
        storage.close();
        super.tearDown();
    }

    private void recordCpu(long timestamp, double percent) {
        ingest.recordStats(clientId(1), stats(timestamp, List.of(new StatSnapshot.CpuSample(timestamp, 0, 0, percent)), List.of()));
    }

    public void testDefaultRangeIsLookbackBeforeNow() {
        recordCpu(BASE_TIME - 45 * MINUTE, 10);
        recordCpu(BASE_TIME - 20 * MINUTE, 20);
        recordCpu(BASE_TIME - MINUTE, 30);

        TimeSeries series = service.readLoadStats(clientId(1), "cpu_percent", null, null);

        assertThat(series.points(), contains(new TimeSeriesPoint(BASE_TIME - 20 * MINUTE, 20), new TimeSeriesPoint(BASE_TIME - MINUTE, 30)));
    }

    public void testLookbackAppliesToExplicitEnd() {
        recordCpu(BASE_TIME - 45 * MINUTE, 10);
        recordCpu(BASE_TIME - 20 * MINUTE, 20);

        TimeSeries series = service.readLoadStats(clientId(1), "CPU_PERCENT", null, BASE_TIME - 30 * MINUTE);

        assertThat(series.points(), contains(new TimeSeriesPoint(BASE_TIME - 45 * MINUTE, 10)));
    }

    public void testExplicitRange() {
        recordCpu(BASE_TIME - 90 * MINUTE, 10);
        recordCpu(BASE_TIME - 60 * MINUTE, 20);

        TimeSeries series = service.readLoadStats(clientId(1), "cpu_percent", BASE_TIME - 100 * MINUTE, BASE_TIME - 70 * MINUTE);

        assertThat(series.points(), contains(new TimeSeriesPoint(BASE_TIME - 90 * MINUTE, 10)));
    }

    public void testLongRangeIsCapped() {
        long start = BASE_TIME - 100 * MINUTE;
        for (int i = 0; i < 1000; i++) {
            recordCpu(start + i * 6_000L, i % 7);
        }

        TimeSeries series = service.readLoadStats(clientId(1), "cpu_percent", start, BASE_TIME);

        assertThat(series.size(), equalTo(100));
        assertThat(series.points().get(1).timestamp(), equalTo(start + MINUTE));
    }

    public void testCounterSeriesIsRepaired() {
        long[] received = { 100, 250, 40, 90 };
        for (int i = 0; i < received.length; i++) {
            ingest.recordStats(clientId(1), new StatSnapshot(BASE_TIME - (10 - i) * MINUTE, List.of(), List.of(), received[i], 0, 0, 0, 0));
        }

        TimeSeries series = service.readLoadStats(clientId(1), "network_bytes_received", null, null);

        assertThat(series.points().stream().map(TimeSeriesPoint::value).toArray(), equalTo(new Object[] { 100.0, 250.0, 250.0, 250.0 }));
    }

    public void testUnknownMetricFailsBeforeLookup() {
        expectThrows(UnknownMetricException.class, () -> service.readLoadStats(clientId(42), "fan_speed", null, null));
    }

    public void testUnknownClient() {
        expectThrows(ClientNotFoundException.class, () -> service.readLoadStats(clientId(42), "cpu_percent", null, null));
    }

    public void testEndBeforeStartRejected() {
        expectThrows(IllegalArgumentException.class, () -> service.readLoadStats(clientId(1), "cpu_percent", BASE_TIME, BASE_TIME - 1));
    }

    public void testMetricsTaggedByMetric() {
        MetricsRegistry registry = mock(MetricsRegistry.class);
        Counter requests = mock(Counter.class);
        Histogram points = mock(Histogram.class);
        when(registry.createCounter(eq(FleetMetricsConstants.LOAD_STATS_REQUESTS_TOTAL), any(), any())).thenReturn(requests);
        when(registry.createHistogram(eq(FleetMetricsConstants.LOAD_STATS_POINTS), any(), any())).thenReturn(points);
        FleetMetrics.initialize(registry, ClientLoadStatsService.getMetricsInitializer());
        recordCpu(BASE_TIME - MINUTE, 30);

        service.readLoadStats(clientId(1), "cpu_percent", null, null);

        verify(requests).add(eq(1.0), any(Tags.class));
        verify(points).record(eq(1.0), any(Tags.class));
    }
}
