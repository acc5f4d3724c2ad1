/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet.audit;

import org.opensearch.test.OpenSearchTestCase;

import java.util.ArrayList;
import java.util.List;

import static org.opensearch.fleet.FleetTestUtils.BASE_TIME;
import static org.opensearch.fleet.FleetTestUtils.clientId;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;

public class AuditEventBatchTests extends OpenSearchTestCase {

    private final List<List<AuditEvent>> published = new ArrayList<>();

    private AuditEvent event(long n) {
        return new AuditEvent(AuditAction.CLIENT_ADD_LABEL, "alice", clientId(n), "alice.prod", BASE_TIME + n);
    }

    public void testPublishesAllEventsInOneCallOnClose() {
        AuditEvent first = event(1);
        AuditEvent second = event(2);
        try (AuditEventBatch batch = new AuditEventBatch(published::add)) {
            batch.add(first);
            batch.add(second);
            assertThat(published, empty());
        }
        assertThat(published, hasSize(1));
        assertThat(published.get(0), contains(first, second));
    }

    public void testEmptyBatchPublishesNothing() {
        try (AuditEventBatch batch = new AuditEventBatch(published::add)) {
            assertThat(batch.events(), empty());
        }
        assertThat(published, empty());
    }

    public void testEventsCollectedBeforeFailureArePublished() {
        AuditEvent first = event(1);
        expectThrows(IllegalStateException.class, () -> {
            try (AuditEventBatch batch = new AuditEventBatch(published::add)) {
                batch.add(first);
                throw new IllegalStateException("boom");
            }
        });
        assertThat(published, hasSize(1));
        assertThat(published.get(0), contains(first));
    }

    public void testCloseIsIdempotentAndSealsTheBatch() {
        AuditEventBatch batch = new AuditEventBatch(published::add);
        batch.add(event(1));
        batch.close();
        batch.close();
        assertThat(published, hasSize(1));
        expectThrows(IllegalStateException.class, () -> batch.add(event(2)));
    }

    public void testEventRequiresActionUserAndClient() {
        expectThrows(NullPointerException.class, () -> new AuditEvent(null, "alice", clientId(1), "", 0));
        expectThrows(NullPointerException.class, () -> new AuditEvent(AuditAction.CLIENT_ADD_LABEL, null, clientId(1), "", 0));
        expectThrows(NullPointerException.class, () -> new AuditEvent(AuditAction.CLIENT_ADD_LABEL, "alice", null, "", 0));
    }
}
