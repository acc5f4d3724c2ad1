/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet.audit;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * Writes audit events to the {@code org.opensearch.fleet.audit} logger, one line per event.
 */
public class LoggingAuditEventSink implements AuditEventSink {

    private static final Logger auditLogger = LogManager.getLogger("org.opensearch.fleet.audit");

    @Override
    public void publish(List<AuditEvent> events) {
        for (AuditEvent event : events) {
            auditLogger.info(
                "action=[{}] user=[{}] client=[{}] description=[{}] timestamp=[{}]",
                event.action(),
                event.user(),
                event.clientId(),
                event.description(),
                event.timestamp()
            );
        }
    }
}
