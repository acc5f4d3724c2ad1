/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet.audit;

import java.util.List;

/**
 * Destination of audit events. Receives each batch in a single call.
 */
@FunctionalInterface
public interface AuditEventSink {

    void publish(List<AuditEvent> events);
}
