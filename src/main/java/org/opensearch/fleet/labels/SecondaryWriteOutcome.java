/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet.labels;

import org.opensearch.ExceptionsHelper;
import org.opensearch.core.xcontent.ToXContentObject;
import org.opensearch.core.xcontent.XContentBuilder;
import org.opensearch.fleet.storage.BackendType;

import java.io.IOException;
import java.util.Locale;
import java.util.Objects;

/**
 * Result of mirroring a mutation to the secondary backend. Callers have to handle each status explicitly;
 * a client missing from the secondary backend is reported as {@link Status#NOT_YET_MIGRATED}, not ignored.
 */
public final class SecondaryWriteOutcome implements ToXContentObject {

    public enum Status {
        /** The secondary backend holds the client and applied the mutation. */
        MIGRATED,
        /** The secondary backend has no record of the client yet. */
        NOT_YET_MIGRATED,
        /** The secondary backend failed for another reason; see {@link #cause()}. */
        FAILED;

        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    private final BackendType backend;
    private final Status status;
    private final Exception cause;

    private SecondaryWriteOutcome(BackendType backend, Status status, Exception cause) {
        this.backend = Objects.requireNonNull(backend);
        this.status = Objects.requireNonNull(status);
        this.cause = cause;
    }

    public static SecondaryWriteOutcome migrated(BackendType backend) {
        return new SecondaryWriteOutcome(backend, Status.MIGRATED, null);
    }

    public static SecondaryWriteOutcome notYetMigrated(BackendType backend, Exception cause) {
        return new SecondaryWriteOutcome(backend, Status.NOT_YET_MIGRATED, cause);
    }

    public static SecondaryWriteOutcome failed(BackendType backend, Exception cause) {
        return new SecondaryWriteOutcome(backend, Status.FAILED, Objects.requireNonNull(cause));
    }

    public BackendType backend() {
        return backend;
    }

    public Status status() {
        return status;
    }

    /**
     * @return the exception behind a non-migrated outcome, null when migrated
     */
    public Exception cause() {
        return cause;
    }

    @Override
    public XContentBuilder toXContent(XContentBuilder builder, Params params) throws IOException {
        builder.startObject();
        builder.field("backend", backend.settingValue());
        builder.field("status", status.value());
        if (status == Status.FAILED) {
            builder.field("reason", ExceptionsHelper.unwrapCause(cause).getMessage());
        }
        builder.endObject();
        return builder;
    }

    @Override
    public String toString() {
        return backend.settingValue() + ":" + status.value();
    }
}
