/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet.storage;

import org.opensearch.fleet.index.ClientIndex;

import java.io.Closeable;

/**
 * One storage backend: its client store, label store and keyword index. Callers depend on this interface and
 * never on a particular backend.
 */
public interface FleetBackend extends Closeable {

    BackendType type();

    ClientStore clientStore();

    LabelStore labelStore();

    ClientIndex clientIndex();
}
