/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet.storage;

import org.opensearch.fleet.index.ClientIndex;
import org.opensearch.fleet.model.ClientId;
import org.opensearch.test.OpenSearchTestCase;

import java.util.List;
import java.util.Set;

import static org.opensearch.fleet.FleetTestUtils.clientId;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;

/**
 * Behavior every {@link ClientIndex} implementation must share.
 */
public abstract class ClientIndexConformanceTestCase extends OpenSearchTestCase {

    private FleetBackend backend;
    protected ClientIndex index;

    protected abstract FleetBackend newBackend();

    @Override
    public void setUp() throws Exception {
        super.setUp();
        backend = newBackend();
        index = backend.clientIndex();
    }

    @Override
    public void tearDown() throws Exception {
        backend.close();
        super.tearDown();
    }

    public void testLookupIsConjunctive() {
        ClientId web = clientId(1);
        ClientId db = clientId(2);
        index.addClient(web, Set.of("linux", "host:web-01"));
        index.addClient(db, Set.of("linux", "host:db-01"));

        assertThat(index.lookupClients(List.of("linux")), contains(web, db));
        assertThat(index.lookupClients(List.of("linux", "host:db-01")), contains(db));
        assertThat(index.lookupClients(List.of("linux", "windows")), empty());
        assertThat(index.lookupClients(List.of("unknown")), empty());
    }

    public void testEmptyLookupReturnsAllClients() {
        index.addClient(clientId(3), Set.of("linux"));
        index.addClient(clientId(1), Set.of());

        assertThat(index.lookupClients(List.of()), contains(clientId(1), clientId(3)));
        assertThat(index.lookupClients(List.of(ClientIndex.UNIVERSAL_KEYWORD)), contains(clientId(1), clientId(3)));
    }

    public void testAddClientKeepsExistingKeywords() {
        index.addClient(clientId(1), Set.of("linux"));
        index.addClient(clientId(1), Set.of("host:web-01"));

        assertThat(index.lookupClients(List.of("linux", "host:web-01")), contains(clientId(1)));
    }

    public void testLabelKeywordsAreAddedAndRemoved() {
        ClientId clientId = clientId(1);
        index.addClient(clientId, Set.of("linux"));

        index.addClientLabels(clientId, List.of("Prod", "canary"));
        assertThat(index.lookupClients(List.of("label:prod")), contains(clientId));
        assertThat(index.lookupClients(List.of(ClientIndex.labelKeyword("canary"), "linux")), contains(clientId));

        index.removeClientLabels(clientId, List.of("prod"));
        assertThat(index.lookupClients(List.of("label:prod")), empty());
        assertThat(index.lookupClients(List.of("label:canary")), contains(clientId));
        assertThat(index.lookupClients(List.of("linux")), contains(clientId));
    }

    public void testRemovingAbsentLabelIsNoOp() {
        ClientId clientId = clientId(1);
        index.addClient(clientId, Set.of("linux"));

        index.removeClientLabels(clientId, List.of("never-added"));
        index.removeClientLabels(clientId(2), List.of("never-added"));

        assertThat(index.lookupClients(List.of()), contains(clientId));
    }
}
