/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet.search;

import org.opensearch.test.OpenSearchTestCase;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;

public class SearchQueryParserTests extends OpenSearchTestCase {

    public void testBlankQueryYieldsNoKeywords() {
        assertThat(SearchQueryParser.parse(null), empty());
        assertThat(SearchQueryParser.parse(""), empty());
        assertThat(SearchQueryParser.parse("   \t "), empty());
    }

    public void testTokensAreLowerCasedAndDeduplicated() {
        assertThat(SearchQueryParser.parse("Host:Web-01  linux host:web-01"), contains("host:web-01", "linux"));
    }

    public void testQuoting() {
        assertThat(SearchQueryParser.parse("user:'Alice Liddell' linux"), contains("user:alice liddell", "linux"));
        assertThat(SearchQueryParser.parse("\"say \\\"hi\\\"\""), contains("say \"hi\""));
        assertThat(SearchQueryParser.parse("a\\ b"), contains("a b"));
    }

    public void testMalformedQueriesAreRejected() {
        IllegalArgumentException e = expectThrows(IllegalArgumentException.class, () -> SearchQueryParser.parse("'open"));
        assertThat(e.getMessage(), containsString("No closing quotation"));
        expectThrows(IllegalArgumentException.class, () -> SearchQueryParser.parse("\"open"));
        expectThrows(IllegalArgumentException.class, () -> SearchQueryParser.parse("dangling\\"));
    }

    public void testEmptyTypedTokenIsRejected() {
        IllegalArgumentException e = expectThrows(IllegalArgumentException.class, () -> SearchQueryParser.parse("linux label:"));
        assertThat(e.getMessage(), containsString("label:"));
        assertThat(SearchQueryParser.parse("custom:"), contains("custom:"));
    }
}
