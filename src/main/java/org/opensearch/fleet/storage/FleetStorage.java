/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet.storage;

import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The primary (legacy) and secondary (relational) backends of a node and which of them serves reads.
 *
 * <p>Writes always go to the primary first; the secondary receives them only while secondary writes are enabled.
 */
public class FleetStorage implements Closeable {

    private final FleetBackend primary;
    private final FleetBackend secondary;
    private final boolean secondaryWritesEnabled;
    private final FleetBackend reader;

    public FleetStorage(FleetBackend primary, FleetBackend secondary, BackendType readBackend, boolean secondaryWritesEnabled) {
        if (primary.type() == secondary.type()) {
            throw new IllegalArgumentException("primary and secondary backends must differ, both are " + primary.type().settingValue());
        }
        if (readBackend == secondary.type() && secondaryWritesEnabled == false) {
            throw new IllegalArgumentException(
                "cannot read from the " + readBackend.settingValue() + " backend while writes to it are disabled"
            );
        }
        this.primary = primary;
        this.secondary = secondary;
        this.secondaryWritesEnabled = secondaryWritesEnabled;
        this.reader = readBackend == primary.type() ? primary : secondary;
    }

    public FleetBackend primary() {
        return primary;
    }

    /**
     * @return the secondary backend, or empty while writes to it are disabled
     */
    public Optional<FleetBackend> secondary() {
        return secondaryWritesEnabled ? Optional.of(secondary) : Optional.empty();
    }

    /**
     * @return the backend serving reads and searches
     */
    public FleetBackend reader() {
        return reader;
    }

    /**
     * @return every backend that receives writes, primary first
     */
    public List<FleetBackend> writers() {
        List<FleetBackend> writers = new ArrayList<>(2);
        writers.add(primary);
        secondary().ifPresent(writers::add);
        return writers;
    }

    @Override
    public void close() throws IOException {
        try {
            primary.close();
        } finally {
            secondary.close();
        }
    }
}
