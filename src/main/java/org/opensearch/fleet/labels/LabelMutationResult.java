/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet.labels;

import org.opensearch.core.xcontent.ToXContentObject;
import org.opensearch.core.xcontent.XContentBuilder;
import org.opensearch.fleet.model.ClientId;

import java.io.IOException;
import java.util.List;

/**
 * Per-client outcome of a batch label mutation. Every listed client was updated on the primary backend.
 */
public record LabelMutationResult(List<Item> items) implements ToXContentObject {

    /**
     * @param clientId  the mutated client
     * @param secondary outcome on the secondary backend, null when secondary writes are disabled
     */
    public record Item(ClientId clientId, SecondaryWriteOutcome secondary) {}

    public LabelMutationResult {
        items = List.copyOf(items);
    }

    /**
     * @return true if any secondary write failed for a reason other than a missing client
     */
    public boolean hasFailures() {
        return items.stream().anyMatch(item -> item.secondary() != null && item.secondary().status() == SecondaryWriteOutcome.Status.FAILED);
    }

    @Override
    public XContentBuilder toXContent(XContentBuilder builder, Params params) throws IOException {
        builder.startObject();
        builder.field("errors", hasFailures());
        builder.startArray("items");
        for (Item item : items) {
            builder.startObject();
            builder.field("client_id", item.clientId().value());
            if (item.secondary() != null) {
                builder.field("secondary");
                item.secondary().toXContent(builder, params);
            }
            builder.endObject();
        }
        builder.endArray();
        builder.endObject();
        return builder;
    }
}
