/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet.stats;

/**
 * How the values of a metric relate over time.
 */
public enum MetricKind {
    /** Instantaneous value; passed through unchanged and averaged when downsampled. */
    GAUGE,
    /** Cumulative value; repaired to be non-decreasing and reduced to its bucket maximum when downsampled. */
    COUNTER
}
