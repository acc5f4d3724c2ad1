/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet.ip;

/**
 * Result of resolving an IP address: its classification and a human readable description.
 */
public record IpInfo(IpStatus status, String info) {}
