/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet.audit;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.List;

/**
 * Collects the audit events of a batch mutation and hands them to the sink exactly once, on {@link #close()}.
 * Meant for try-with-resources so the events gathered before a failure are still published.
 *
 * <p>Not thread-safe; a batch belongs to the request that opened it.
 */
public class AuditEventBatch implements Closeable {

    private final AuditEventSink sink;
    private final List<AuditEvent> events = new ArrayList<>();
    private boolean closed;

    public AuditEventBatch(AuditEventSink sink) {
        this.sink = sink;
    }

    public void add(AuditEvent event) {
        if (closed) {
            throw new IllegalStateException("audit batch already published");
        }
        events.add(event);
    }

    public List<AuditEvent> events() {
        return List.copyOf(events);
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (events.isEmpty() == false) {
            sink.publish(List.copyOf(events));
        }
    }
}
