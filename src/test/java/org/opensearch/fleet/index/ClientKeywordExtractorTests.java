/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet.index;

import org.opensearch.fleet.model.ClientId;
import org.opensearch.fleet.model.ClientLabel;
import org.opensearch.fleet.model.ClientSnapshot;
import org.opensearch.test.OpenSearchTestCase;

import java.util.List;
import java.util.Set;

import static org.opensearch.fleet.FleetTestUtils.BASE_TIME;
import static org.opensearch.fleet.FleetTestUtils.clientId;
import static org.opensearch.fleet.FleetTestUtils.snapshot;
import static org.hamcrest.Matchers.hasItems;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.hasItem;

public class ClientKeywordExtractorTests extends OpenSearchTestCase {

    public void testHostKeywordsIncludeLeadingSegments() {
        Set<String> keywords = ClientKeywordExtractor.extract(snapshot(clientId(1), BASE_TIME, "Web-01.Example.com"), List.of());

        assertThat(
            keywords,
            hasItems("web-01.example.com", "host:web-01.example.com", "host:web-01.example", "host:web-01", "host:web", "web")
        );
    }

    public void testUniversalKeywordAndClientId() {
        Set<String> keywords = ClientKeywordExtractor.extract(ClientSnapshot.builder(clientId(0xab), BASE_TIME).build(), null);

        assertThat(keywords, hasItems(ClientIndex.UNIVERSAL_KEYWORD, "c.00000000000000ab"));
    }

    public void testUsersIpsMacsAndAgent() {
        Set<String> keywords = ClientKeywordExtractor.extract(snapshot(clientId(1), BASE_TIME, "web-01"), List.of());

        assertThat(keywords, hasItems("user:alice", "user:alice liddell", "user:liddell"));
        assertThat(keywords, hasItems("ip:10.0.0.5", "ip:10.0.0", "ip:10", "ip:fe80::1", "ip:fe80"));
        assertThat(keywords, hasItems("mac:aabbccddeeff", "mac:aa:bb:cc:dd:ee:ff"));
        assertThat(keywords, hasItems("client:fleet-agent", "client:3.4.7", "linux", "x86_64"));
    }

    public void testLabelsAreIndexedWithPrefix() {
        ClientId clientId = clientId(1);
        Set<String> keywords = ClientKeywordExtractor.extract(
            ClientSnapshot.builder(clientId, BASE_TIME).build(),
            List.of(new ClientLabel("Prod", "alice"), ClientLabel.systemLabel("agent"))
        );

        assertThat(keywords, hasItems("label:prod", "label:agent"));
        assertThat(keywords, not(hasItem("prod")));
    }

    public void testNormalize() {
        assertEquals("web-01", ClientKeywordExtractor.normalize("  WEB-01 "));
    }
}
