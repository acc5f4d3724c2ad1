/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet.audit;

/**
 * Client mutations that are audited.
 */
public enum AuditAction {
    CLIENT_ADD_LABEL,
    CLIENT_REMOVE_LABEL
}
