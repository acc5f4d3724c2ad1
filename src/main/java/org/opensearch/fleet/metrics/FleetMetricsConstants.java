/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet.metrics;

/** Metric names, descriptions, and units. */
public final class FleetMetricsConstants {

    private FleetMetricsConstants() {
        // Utility class, no instantiation
    }

    // ============================================
    // Search Metrics
    // ============================================

    /** Counter: Total number of client searches (tagged with mode: unrestricted or restricted) */
    public static final String SEARCH_REQUESTS_TOTAL = "fleet.search.requests.total";

    /** Counter: Total number of candidates dropped by label re-verification */
    public static final String SEARCH_CANDIDATES_REJECTED_TOTAL = "fleet.search.candidates.rejected.total";

    /** Histogram: Latency of a client search */
    public static final String SEARCH_LATENCY = "fleet.search.latency";

    // ============================================
    // Label Metrics
    // ============================================

    /** Counter: Total number of client label mutations (tagged with action: add or remove) */
    public static final String LABEL_MUTATIONS_TOTAL = "fleet.labels.mutations.total";

    /** Counter: Secondary backend writes (tagged with outcome: migrated, not_yet_migrated, failed) */
    public static final String LABEL_SECONDARY_WRITES_TOTAL = "fleet.labels.secondary_writes.total";

    // ============================================
    // Load Stats Metrics
    // ============================================

    /** Counter: Total number of load stats requests (tagged with metric) */
    public static final String LOAD_STATS_REQUESTS_TOTAL = "fleet.load_stats.requests.total";

    /** Histogram: Points returned per load stats request */
    public static final String LOAD_STATS_POINTS = "fleet.load_stats.points";

    // Descriptions
    public static final String SEARCH_REQUESTS_TOTAL_DESC = "Total number of client searches";
    public static final String SEARCH_CANDIDATES_REJECTED_TOTAL_DESC = "Total number of search candidates dropped by label verification";
    public static final String SEARCH_LATENCY_DESC = "Latency of client searches";
    public static final String LABEL_MUTATIONS_TOTAL_DESC = "Total number of client label mutations";
    public static final String LABEL_SECONDARY_WRITES_TOTAL_DESC = "Total number of label writes to the secondary storage backend";
    public static final String LOAD_STATS_REQUESTS_TOTAL_DESC = "Total number of client load stats requests";
    public static final String LOAD_STATS_POINTS_DESC = "Number of points returned per client load stats request";

    // Units
    public static final String UNIT_COUNT = "1";
    public static final String UNIT_MILLISECONDS = "ms";
}
