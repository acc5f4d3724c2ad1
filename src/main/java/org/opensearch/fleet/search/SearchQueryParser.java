/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet.search;

import org.opensearch.fleet.index.ClientKeywordExtractor;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Splits a client search query into index keywords.
 *
 * <p>Tokens are separated by whitespace and follow shell quoting rules: single quotes are literal, double quotes
 * allow {@code \"} and {@code \\}, and a backslash outside quotes escapes the next character. Tokens are
 * lower-cased to match the index. A token such as {@code label:} whose type prefix is known but whose value is
 * empty is rejected rather than dropped.
 */
public final class SearchQueryParser {

    private SearchQueryParser() {
        // Utility class
    }

    /**
     * @param query raw query, may be null or blank
     * @return distinct keywords in query order; empty for a blank query
     * @throws IllegalArgumentException if the query has unbalanced quotes, a dangling escape or an empty typed token
     */
    public static Set<String> parse(String query) {
        Set<String> keywords = new LinkedHashSet<>();
        if (query == null) {
            return keywords;
        }
        for (String token : split(query)) {
            String keyword = ClientKeywordExtractor.normalize(token);
            if (keyword.isEmpty()) {
                continue;
            }
            int colon = keyword.indexOf(':');
            if (colon > 0 && colon == keyword.length() - 1 && ClientKeywordExtractor.KNOWN_PREFIXES.contains(keyword.substring(0, colon))) {
                throw new IllegalArgumentException("Empty value for search term [" + token + "]");
            }
            keywords.add(keyword);
        }
        return keywords;
    }

    static List<String> split(String query) {
        List<String> tokens = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inToken = false;
        int i = 0;
        while (i < query.length()) {
            char c = query.charAt(i);
            if (Character.isWhitespace(c)) {
                if (inToken) {
                    tokens.add(current.toString());
                    current.setLength(0);
                    inToken = false;
                }
                i++;
            } else if (c == '\'') {
                int close = query.indexOf('\'', i + 1);
                if (close < 0) {
                    throw new IllegalArgumentException("No closing quotation in query [" + query + "]");
                }
                current.append(query, i + 1, close);
                inToken = true;
                i = close + 1;
            } else if (c == '"') {
                i = readDoubleQuoted(query, i + 1, current);
                inToken = true;
            } else if (c == '\\') {
                if (i + 1 >= query.length()) {
                    throw new IllegalArgumentException("No escaped character in query [" + query + "]");
                }
                current.append(query.charAt(i + 1));
                inToken = true;
                i += 2;
            } else {
                current.append(c);
                inToken = true;
                i++;
            }
        }
        if (inToken) {
            tokens.add(current.toString());
        }
        return tokens;
    }

    private static int readDoubleQuoted(String query, int start, StringBuilder current) {
        int i = start;
        while (i < query.length()) {
            char c = query.charAt(i);
            if (c == '"') {
                return i + 1;
            }
            if (c == '\\' && i + 1 < query.length() && (query.charAt(i + 1) == '"' || query.charAt(i + 1) == '\\')) {
                current.append(query.charAt(i + 1));
                i += 2;
            } else {
                current.append(c);
                i++;
            }
        }
        throw new IllegalArgumentException("No closing quotation in query [" + query + "]");
    }
}
