/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet.storage.legacy;

import org.opensearch.fleet.storage.ClientRecordReaderConformanceTestCase;
import org.opensearch.fleet.storage.FleetBackend;

public class LegacyClientRecordReaderTests extends ClientRecordReaderConformanceTestCase {

    @Override
    protected FleetBackend newBackend() {
        return new LegacyFleetBackend();
    }
}
