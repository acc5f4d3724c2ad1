/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet.search;

import org.opensearch.fleet.model.ClientLabel;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Label names and label owners a caller is allowed to see clients through.
 *
 * <p>A client is visible only if one single label matches both lists; see {@link #permits(ClientLabel)}.
 */
public final class LabelWhitelist {

    private final SortedSet<String> names;
    private final Set<String> owners;

    public LabelWhitelist(Collection<String> names, Collection<String> owners) {
        if (names == null || names.isEmpty()) {
            throw new IllegalArgumentException("label whitelist must name at least one label");
        }
        if (owners == null || owners.isEmpty()) {
            throw new IllegalArgumentException("label whitelist must name at least one label owner");
        }
        this.names = new TreeSet<>(names);
        this.owners = Set.copyOf(owners);
    }

    public SortedSet<String> names() {
        return Collections.unmodifiableSortedSet(names);
    }

    public Set<String> owners() {
        return owners;
    }

    /**
     * @return true if this label's name and owner are both whitelisted
     */
    public boolean permits(ClientLabel label) {
        return names.contains(label.name()) && owners.contains(label.owner());
    }

    /**
     * @return true if some single label in {@code labels} is permitted
     */
    public boolean permitsAny(List<ClientLabel> labels) {
        for (ClientLabel label : labels) {
            if (permits(label)) {
                return true;
            }
        }
        return false;
    }
}
