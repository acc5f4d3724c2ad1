/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet.model;

import org.opensearch.core.xcontent.ToXContentObject;
import org.opensearch.core.xcontent.XContentBuilder;

import java.io.IOException;
import java.util.Comparator;
import java.util.Objects;

/**
 * A {@code (name, owner)} tag attached to a client.
 *
 * <p>Labels owned by {@link #SYSTEM_OWNER} are system labels. The flag is computed once here so callers never
 * compare owner strings themselves.
 */
public final class ClientLabel implements ToXContentObject {

    /** Owner reserved for labels applied by the system rather than by a user. */
    public static final String SYSTEM_OWNER = "system";

    public static final Comparator<ClientLabel> ORDER = Comparator.comparing(ClientLabel::name).thenComparing(ClientLabel::owner);

    private final String name;
    private final String owner;
    private final boolean system;

    public ClientLabel(String name, String owner) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("label name must not be empty");
        }
        if (owner == null || owner.isBlank()) {
            throw new IllegalArgumentException("label owner must not be empty");
        }
        this.name = name;
        this.owner = owner;
        this.system = SYSTEM_OWNER.equals(owner);
    }

    public static ClientLabel systemLabel(String name) {
        return new ClientLabel(name, SYSTEM_OWNER);
    }

    public String name() {
        return name;
    }

    public String owner() {
        return owner;
    }

    public boolean isSystem() {
        return system;
    }

    @Override
    public XContentBuilder toXContent(XContentBuilder builder, Params params) throws IOException {
        builder.startObject();
        builder.field("name", name);
        builder.field("owner", owner);
        builder.endObject();
        return builder;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ClientLabel that = (ClientLabel) o;
        return name.equals(that.name) && owner.equals(that.owner);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, owner);
    }

    @Override
    public String toString() {
        return owner + "." + name;
    }
}
