/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet.storage.legacy;

import org.opensearch.test.OpenSearchTestCase;

import java.util.List;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;

public class HierarchicalStoreTests extends OpenSearchTestCase {

    private final HierarchicalStore store = new HierarchicalStore();

    public void testVersionedReads() {
        store.write("a/b", 10, "ten");
        store.write("a/b", 30, "thirty");
        store.write("a/b", 20, "twenty");

        assertThat(store.readLatest("a/b", String.class).orElseThrow(), equalTo("thirty"));
        assertThat(store.readAt("a/b", 25, String.class).orElseThrow(), equalTo("twenty"));
        assertThat(store.readAt("a/b", 20, String.class).orElseThrow(), equalTo("twenty"));
        assertFalse(store.readAt("a/b", 5, String.class).isPresent());
        assertThat(store.readRange("a/b", 10, 20, String.class), contains("ten", "twenty"));
        assertThat(store.readRange("a/b", 20, 10, String.class), empty());
    }

    public void testUpdateReplacesSingleValueAndDeletesOnNull() {
        assertThat(store.<Integer>update("counter", current -> current == null ? 1 : current + 1), equalTo(1));
        assertThat(store.<Integer>update("counter", current -> current == null ? 1 : current + 1), equalTo(2));
        assertTrue(store.exists("counter"));

        store.<Integer>update("counter", current -> null);
        assertFalse(store.exists("counter"));
    }

    public void testListChildrenUnescapesSegments() {
        store.write(HierarchicalStore.path("index", "a/b", "x"), 0, true);
        store.write(HierarchicalStore.path("index", "100%", "y"), 0, true);
        store.write(HierarchicalStore.path("index", "plain"), 0, true);
        store.write(HierarchicalStore.path("indexes", "other"), 0, true);

        assertThat(store.listChildren("index"), contains("100%", "a/b", "plain"));
    }

    public void testDeletedChildrenDisappear() {
        String path = HierarchicalStore.path("index", "gone");
        store.write(path, 0, true);
        store.delete(path);

        assertThat(store.listChildren("index"), empty());
    }

    public void testEscapeRoundTrip() {
        for (String segment : List.of("plain", "a/b", "%2F", "50%/x")) {
            assertThat(HierarchicalStore.unescape(HierarchicalStore.escape(segment)), equalTo(segment));
        }
    }
}
