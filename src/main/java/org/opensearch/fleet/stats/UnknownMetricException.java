/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet.stats;

import org.opensearch.OpenSearchException;
import org.opensearch.core.rest.RestStatus;

/**
 * Thrown for a load stats metric name that is not a {@link LoadStatsMetric}.
 */
public class UnknownMetricException extends OpenSearchException {

    public UnknownMetricException(String metric) {
        super("unknown load stats metric [{}]", metric);
    }

    @Override
    public RestStatus status() {
        return RestStatus.BAD_REQUEST;
    }
}
