/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet.search;

import org.opensearch.fleet.model.ClientLabel;
import org.opensearch.test.OpenSearchTestCase;

import java.util.List;

public class LabelWhitelistTests extends OpenSearchTestCase {

    private final LabelWhitelist whitelist = new LabelWhitelist(List.of("prod", "eu"), List.of("admin"));

    public void testNameAndOwnerMustMatchOnOneLabel() {
        assertTrue(whitelist.permits(new ClientLabel("prod", "admin")));
        assertFalse(whitelist.permits(new ClientLabel("prod", "alice")));
        assertFalse(whitelist.permits(new ClientLabel("staging", "admin")));

        assertFalse(whitelist.permitsAny(List.of(new ClientLabel("prod", "alice"), new ClientLabel("staging", "admin"))));
        assertTrue(whitelist.permitsAny(List.of(new ClientLabel("staging", "admin"), new ClientLabel("eu", "admin"))));
        assertFalse(whitelist.permitsAny(List.of()));
    }

    public void testNamesCannotBeModifiedByCallers() {
        expectThrows(UnsupportedOperationException.class, () -> whitelist.names().add("staging"));
        expectThrows(UnsupportedOperationException.class, () -> whitelist.owners().add("alice"));
        assertFalse(whitelist.permits(new ClientLabel("staging", "admin")));
    }

    public void testBothListsAreRequired() {
        expectThrows(IllegalArgumentException.class, () -> new LabelWhitelist(List.of(), List.of("admin")));
        expectThrows(IllegalArgumentException.class, () -> new LabelWhitelist(List.of("prod"), List.of()));
    }
}
