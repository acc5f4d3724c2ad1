/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet.audit;

import org.opensearch.fleet.model.ClientId;

import java.util.Objects;

/**
 * Structured record of one mutation of one client.
 *
 * @param action      what was done
 * @param user        who did it
 * @param clientId    the client it was done to
 * @param description free-form detail, e.g. the affected labels as {@code owner.name}
 * @param timestamp   when, epoch millis
 */
public record AuditEvent(AuditAction action, String user, ClientId clientId, String description, long timestamp) {

    public AuditEvent {
        Objects.requireNonNull(action, "action must not be null");
        Objects.requireNonNull(user, "user must not be null");
        Objects.requireNonNull(clientId, "clientId must not be null");
    }
}
