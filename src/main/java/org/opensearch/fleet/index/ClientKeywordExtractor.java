/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet.index;

import org.opensearch.fleet.model.ClientLabel;
import org.opensearch.fleet.model.ClientSnapshot;

import java.util.Arrays;
import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Computes the keywords a client is indexed under.
 *
 * <p>Every value is indexed lower-cased, both bare and with a type prefix, e.g. {@code web-01} and
 * {@code host:web-01}. Dotted and dashed names are also indexed by their leading segments so that
 * {@code host:web} finds {@code web-01.example.com}.
 */
public final class ClientKeywordExtractor {

    public static final String HOST_PREFIX = "host";
    public static final String USER_PREFIX = "user";
    public static final String IP_PREFIX = "ip";
    public static final String MAC_PREFIX = "mac";
    public static final String CLIENT_PREFIX = "client";
    public static final String LABEL_PREFIX = "label";

    /** Prefixes the query parser recognizes as typed tokens. */
    public static final Set<String> KNOWN_PREFIXES = Set.of(HOST_PREFIX, USER_PREFIX, IP_PREFIX, MAC_PREFIX, CLIENT_PREFIX, LABEL_PREFIX);

    private ClientKeywordExtractor() {
        // Utility class
    }

    /**
     * @param snapshot latest snapshot of the client
     * @param labels   labels currently attached to the client
     * @return all keywords for the client, including {@link ClientIndex#UNIVERSAL_KEYWORD}
     */
    public static Set<String> extract(ClientSnapshot snapshot, Collection<ClientLabel> labels) {
        Set<String> keywords = new TreeSet<>();
        keywords.add(ClientIndex.UNIVERSAL_KEYWORD);
        append(keywords, null, snapshot.clientId().value());

        String fqdn = snapshot.fqdn();
        if (fqdn != null && fqdn.isEmpty() == false) {
            String hostname = fqdn.split("\\.", -1)[0];
            appendPrefixes(keywords, HOST_PREFIX, hostname, "-");
            appendPrefixes(keywords, HOST_PREFIX, fqdn, ".");
        }

        append(keywords, null, snapshot.osSystem());
        append(keywords, null, snapshot.osRelease());
        append(keywords, null, snapshot.osVersion());
        append(keywords, null, snapshot.kernel());
        append(keywords, null, snapshot.arch());

        for (ClientSnapshot.User user : snapshot.users()) {
            append(keywords, USER_PREFIX, user.username());
            String fullName = user.fullName();
            if (fullName != null && fullName.isBlank() == false) {
                append(keywords, USER_PREFIX, fullName);
                for (String part : fullName.trim().split("\\s+")) {
                    append(keywords, USER_PREFIX, strip(part, "\"'()"));
                }
            }
        }

        for (ClientSnapshot.NetworkInterface iface : snapshot.interfaces()) {
            appendMac(keywords, iface.macAddress());
            for (String address : iface.addresses()) {
                appendIp(keywords, address);
            }
        }

        append(keywords, CLIENT_PREFIX, snapshot.agentName());
        append(keywords, CLIENT_PREFIX, snapshot.agentVersion());

        if (labels != null) {
            for (ClientLabel label : labels) {
                keywords.add(ClientIndex.labelKeyword(label.name()));
            }
        }
        return keywords;
    }

    /**
     * Lower-cases and trims a keyword the same way indexed values are normalized.
     */
    public static String normalize(String keyword) {
        return keyword.trim().toLowerCase(Locale.ROOT);
    }

    private static void append(Set<String> keywords, String prefix, String value) {
        if (value == null) {
            return;
        }
        String keyword = normalize(value);
        if (keyword.isEmpty()) {
            return;
        }
        keywords.add(keyword);
        if (prefix != null) {
            keywords.add(prefix + ":" + keyword);
        }
    }

    private static int appendPrefixes(Set<String> keywords, String prefix, String value, String delimiter) {
        append(keywords, prefix, value);
        String[] segments = value.split(Pattern.quote(delimiter), -1);
        for (int i = 1; i < segments.length; i++) {
            append(keywords, prefix, String.join(delimiter, Arrays.copyOfRange(segments, 0, i)));
        }
        return segments.length;
    }

    private static void appendIp(Set<String> keywords, String address) {
        if (address == null || address.isEmpty()) {
            return;
        }
        if (appendPrefixes(keywords, IP_PREFIX, address, ".") == 4) {
            return;
        }
        appendPrefixes(keywords, IP_PREFIX, address, ":");
    }

    private static void appendMac(Set<String> keywords, String mac) {
        if (mac == null || mac.isEmpty()) {
            return;
        }
        append(keywords, MAC_PREFIX, mac);
        if (mac.length() == 12) {
            StringBuilder colon = new StringBuilder();
            for (int i = 0; i < 12; i += 2) {
                if (i > 0) {
                    colon.append(':');
                }
                colon.append(mac, i, i + 2);
            }
            append(keywords, MAC_PREFIX, colon.toString());
        }
    }

    private static String strip(String value, String chars) {
        int start = 0;
        int end = value.length();
        while (start < end && chars.indexOf(value.charAt(start)) >= 0) {
            start++;
        }
        while (end > start && chars.indexOf(value.charAt(end - 1)) >= 0) {
            end--;
        }
        return value.substring(start, end);
    }
}
