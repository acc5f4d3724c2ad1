/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet.model;

import org.opensearch.core.rest.RestStatus;
import org.opensearch.test.OpenSearchTestCase;

import java.util.List;
import java.util.TreeSet;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;

public class ClientIdTests extends OpenSearchTestCase {

    public void testCanonicalForm() {
        assertThat(ClientId.fromString("c.1234567890ABCDEF").value(), equalTo("C.1234567890abcdef"));
        assertThat(ClientId.fromString("C.1234567890abcdef"), equalTo(ClientId.fromString("c.1234567890ABCDEF")));
    }

    public void testRejectsMalformedIdentifiers() {
        for (String raw : List.of("", "C.123", "X.1234567890abcdef", "C.1234567890abcdeg", "C1234567890abcdef0", "C.1234567890abcdef0")) {
            InvalidClientIdException e = expectThrows(InvalidClientIdException.class, () -> ClientId.fromString(raw));
            assertThat(e.status(), equalTo(RestStatus.BAD_REQUEST));
        }
        InvalidClientIdException e = expectThrows(InvalidClientIdException.class, () -> ClientId.fromString("bogus"));
        assertThat(e.getMessage(), containsString("bogus"));
        expectThrows(InvalidClientIdException.class, () -> ClientId.fromString(null));
    }

    public void testIsValid() {
        assertTrue(ClientId.isValid("C.00000000000000ff"));
        assertFalse(ClientId.isValid("C.ff"));
        assertFalse(ClientId.isValid(null));
    }

    public void testOrderingFollowsCanonicalString() {
        TreeSet<ClientId> ids = new TreeSet<>(
            List.of(ClientId.fromString("C.000000000000000b"), ClientId.fromString("c.000000000000000A"), ClientId.fromString("C.0000000000000001"))
        );
        assertThat(
            ids,
            contains(
                ClientId.fromString("C.0000000000000001"),
                ClientId.fromString("C.000000000000000a"),
                ClientId.fromString("C.000000000000000b")
            )
        );
    }
}
