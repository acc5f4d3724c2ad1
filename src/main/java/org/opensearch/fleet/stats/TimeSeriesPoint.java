/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet.stats;

/**
 * A single {@code (timestamp, value)} sample; timestamp in epoch millis.
 */
public record TimeSeriesPoint(long timestamp, double value) {}
