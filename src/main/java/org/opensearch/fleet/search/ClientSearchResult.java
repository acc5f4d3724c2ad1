/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet.search;

import org.opensearch.core.xcontent.ToXContentObject;
import org.opensearch.core.xcontent.XContentBuilder;
import org.opensearch.fleet.model.ClientRecord;

import java.io.IOException;
import java.util.List;

/**
 * One page of search results.
 *
 * @param items      records of the page, ascending by client identifier
 * @param totalCount number of clients matching the query before pagination
 */
public record ClientSearchResult(List<ClientRecord> items, int totalCount) implements ToXContentObject {

    public ClientSearchResult {
        items = List.copyOf(items);
    }

    @Override
    public XContentBuilder toXContent(XContentBuilder builder, Params params) throws IOException {
        builder.startObject();
        builder.field("total_count", totalCount);
        builder.startArray("items");
        for (ClientRecord item : items) {
            item.toXContent(builder, params);
        }
        builder.endArray();
        builder.endObject();
        return builder;
    }
}
