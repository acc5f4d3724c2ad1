/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet.metrics;

import org.opensearch.fleet.labels.ClientLabelService;
import org.opensearch.fleet.search.ClientSearchService;
import org.opensearch.fleet.stats.ClientLoadStatsService;
import org.opensearch.telemetry.metrics.Counter;
import org.opensearch.telemetry.metrics.Histogram;
import org.opensearch.telemetry.metrics.MetricsRegistry;
import org.opensearch.telemetry.metrics.tags.Tags;
import org.opensearch.test.OpenSearchTestCase;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

public class FleetMetricsTests extends OpenSearchTestCase {

    private MetricsRegistry registry;

    @Override
    public void setUp() throws Exception {
        super.setUp();
        FleetMetrics.cleanup();
        registry = mock(MetricsRegistry.class);
        when(registry.createCounter(anyString(), anyString(), anyString())).thenReturn(mock(Counter.class));
        when(registry.createHistogram(anyString(), anyString(), anyString())).thenReturn(mock(Histogram.class));
    }

    @Override
    public void tearDown() throws Exception {
        FleetMetrics.cleanup();
        super.tearDown();
    }

    private static class RecordingInitializer implements FleetMetrics.MetricsInitializer {
        Counter counter;
        int registered;
        int cleanedUp;

        @Override
        public void register(MetricsRegistry metricsRegistry) {
            counter = metricsRegistry.createCounter("fleet.test.total", "test counter", FleetMetricsConstants.UNIT_COUNT);
            registered++;
        }

        @Override
        public void cleanup() {
            counter = null;
            cleanedUp++;
        }
    }

    public void testInitializeRegistersComponents() {
        RecordingInitializer first = new RecordingInitializer();
        RecordingInitializer second = new RecordingInitializer();

        FleetMetrics.initialize(registry, first, second);

        assertTrue(FleetMetrics.isInitialized());
        assertSame(registry, FleetMetrics.getRegistry());
        assertEquals(1, first.registered);
        assertEquals(1, second.registered);
        assertNotNull(first.counter);
    }

    public void testCleanupResetsComponents() {
        RecordingInitializer component = new RecordingInitializer();
        FleetMetrics.initialize(registry, component);

        FleetMetrics.cleanup();

        assertFalse(FleetMetrics.isInitialized());
        assertNull(FleetMetrics.getRegistry());
        assertNull(component.counter);
        assertEquals(1, component.cleanedUp);

        FleetMetrics.cleanup();
        assertEquals(1, component.cleanedUp);
    }

    public void testHelpersIgnoreMissingInstruments() {
        FleetMetrics.incrementCounter(null, 1);
        FleetMetrics.incrementCounter(null, 1, Tags.EMPTY);
        FleetMetrics.recordHistogram(null, 1);
        FleetMetrics.recordHistogram(null, 1, Tags.EMPTY);
    }

    public void testHelpersDelegate() {
        Counter counter = mock(Counter.class);
        Histogram histogram = mock(Histogram.class);
        Tags tags = Tags.create().addTag("mode", "restricted");

        FleetMetrics.incrementCounter(counter, 2);
        FleetMetrics.incrementCounter(counter, 3, tags);
        FleetMetrics.recordHistogram(histogram, 4.5);
        FleetMetrics.recordHistogram(histogram, 5.5, tags);

        verify(counter).add(2.0);
        verify(counter).add(3.0, tags);
        verify(histogram).record(4.5);
        verify(histogram).record(5.5, tags);
    }

    public void testServiceInitializersCreateTheirInstruments() {
        FleetMetrics.initialize(
            registry,
            ClientSearchService.getMetricsInitializer(),
            ClientLabelService.getMetricsInitializer(),
            ClientLoadStatsService.getMetricsInitializer()
        );

        verify(registry).createCounter(
            FleetMetricsConstants.SEARCH_REQUESTS_TOTAL,
            FleetMetricsConstants.SEARCH_REQUESTS_TOTAL_DESC,
            FleetMetricsConstants.UNIT_COUNT
        );
        verify(registry).createHistogram(
            FleetMetricsConstants.SEARCH_LATENCY,
            FleetMetricsConstants.SEARCH_LATENCY_DESC,
            FleetMetricsConstants.UNIT_MILLISECONDS
        );
        verify(registry).createCounter(
            FleetMetricsConstants.LABEL_SECONDARY_WRITES_TOTAL,
            FleetMetricsConstants.LABEL_SECONDARY_WRITES_TOTAL_DESC,
            FleetMetricsConstants.UNIT_COUNT
        );
        verify(registry).createHistogram(
            FleetMetricsConstants.LOAD_STATS_POINTS,
            FleetMetricsConstants.LOAD_STATS_POINTS_DESC,
            FleetMetricsConstants.UNIT_COUNT
        );
    }

    public void testNoInstrumentsWithoutInitialization() {
        verifyNoInteractions(registry);
        assertFalse(FleetMetrics.isInitialized());
    }
}
