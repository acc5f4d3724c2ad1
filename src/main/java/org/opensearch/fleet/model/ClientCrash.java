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
import java.util.Locale;
import java.util.Objects;

/**
 * A crash reported by (or on behalf of) a client agent.
 */
public record ClientCrash(ClientId clientId, long timestamp, String crashType, String crashMessage) implements ToXContentObject {

    public ClientCrash {
        Objects.requireNonNull(clientId, "clientId must not be null");
    }

    /**
     * Case-insensitive substring match over the crash type and message.
     */
    public boolean matches(String filter) {
        if (filter == null || filter.isEmpty()) {
            return true;
        }
        String needle = filter.toLowerCase(Locale.ROOT);
        return (crashType != null && crashType.toLowerCase(Locale.ROOT).contains(needle))
            || (crashMessage != null && crashMessage.toLowerCase(Locale.ROOT).contains(needle));
    }

    @Override
    public XContentBuilder toXContent(XContentBuilder builder, Params params) throws IOException {
        builder.startObject();
        builder.field("client_id", clientId.value());
        builder.field("timestamp", timestamp);
        if (crashType != null) {
            builder.field("crash_type", crashType);
        }
        if (crashMessage != null) {
            builder.field("crash_message", crashMessage);
        }
        builder.endObject();
        return builder;
    }
}
