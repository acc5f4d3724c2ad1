/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet.model;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Validated identifier of a managed client, e.g. {@code C.1234567890abcdef}.
 *
 * <p>Input is accepted case-insensitively; the canonical form always starts with an upper-case {@code C.}
 * followed by sixteen lower-case hex digits. Ordering follows the canonical string.
 */
public final class ClientId implements Comparable<ClientId> {

    private static final Pattern CLIENT_ID_PATTERN = Pattern.compile("^[Cc]\\.[0-9a-fA-F]{16}$");

    private final String value;

    private ClientId(String value) {
        this.value = value;
    }

    /**
     * Parses and validates a client identifier.
     *
     * @param raw identifier string
     * @return the canonical identifier
     * @throws InvalidClientIdException if the string is not a valid identifier
     */
    public static ClientId fromString(String raw) {
        if (raw == null || raw.isEmpty()) {
            throw new InvalidClientIdException("client id must not be empty");
        }
        if (CLIENT_ID_PATTERN.matcher(raw).matches() == false) {
            throw new InvalidClientIdException("invalid client id [{}]", raw);
        }
        return new ClientId("C." + raw.substring(2).toLowerCase(Locale.ROOT));
    }

    /**
     * @return true if {@code raw} parses as a client identifier
     */
    public static boolean isValid(String raw) {
        return raw != null && CLIENT_ID_PATTERN.matcher(raw).matches();
    }

    public String value() {
        return value;
    }

    @Override
    public int compareTo(ClientId other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return value.equals(((ClientId) o).value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
