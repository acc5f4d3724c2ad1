/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet.metrics;

import org.opensearch.telemetry.metrics.Counter;
import org.opensearch.telemetry.metrics.Histogram;
import org.opensearch.telemetry.metrics.MetricsRegistry;
import org.opensearch.telemetry.metrics.tags.Tags;

import java.util.ArrayList;
import java.util.List;

/**
 * Static holder for fleet telemetry. Components contribute their instruments through a {@link MetricsInitializer};
 * until {@link #initialize} runs every record call is a no-op.
 */
public final class FleetMetrics {

    private static volatile MetricsRegistry registry;
    private static final List<MetricsInitializer> initializers = new ArrayList<>();

    private FleetMetrics() {
        // Utility class, no instantiation
    }

    /**
     * Creates instruments for a component.
     */
    public interface MetricsInitializer {
        void register(MetricsRegistry registry);

        void cleanup();
    }

    public static synchronized void initialize(MetricsRegistry metricsRegistry, MetricsInitializer... components) {
        registry = metricsRegistry;
        for (MetricsInitializer component : components) {
            component.register(metricsRegistry);
            initializers.add(component);
        }
    }

    public static synchronized void cleanup() {
        for (MetricsInitializer component : initializers) {
            component.cleanup();
        }
        initializers.clear();
        registry = null;
    }

    public static boolean isInitialized() {
        return registry != null;
    }

    public static MetricsRegistry getRegistry() {
        return registry;
    }

    public static void incrementCounter(Counter counter, double value) {
        if (counter != null) {
            counter.add(value);
        }
    }

    public static void incrementCounter(Counter counter, double value, Tags tags) {
        if (counter != null) {
            counter.add(value, tags);
        }
    }

    public static void recordHistogram(Histogram histogram, double value) {
        if (histogram != null) {
            histogram.record(value);
        }
    }

    public static void recordHistogram(Histogram histogram, double value, Tags tags) {
        if (histogram != null) {
            histogram.record(value, tags);
        }
    }
}
