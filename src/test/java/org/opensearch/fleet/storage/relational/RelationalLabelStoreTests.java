/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet.storage.relational;

import org.opensearch.fleet.storage.LabelStoreConformanceTestCase;
import org.opensearch.fleet.storage.FleetBackend;

public class RelationalLabelStoreTests extends LabelStoreConformanceTestCase {

    @Override
    protected FleetBackend newBackend() {
        return new RelationalFleetBackend();
    }
}
