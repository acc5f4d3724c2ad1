/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet.labels;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.fleet.audit.AuditAction;
import org.opensearch.fleet.audit.AuditEvent;
import org.opensearch.fleet.audit.AuditEventBatch;
import org.opensearch.fleet.audit.AuditEventSink;
import org.opensearch.fleet.index.ClientIndex;
import org.opensearch.fleet.metrics.FleetMetrics;
import org.opensearch.fleet.metrics.FleetMetricsConstants;
import org.opensearch.fleet.model.ClientId;
import org.opensearch.fleet.model.ClientLabel;
import org.opensearch.fleet.storage.ClientNotFoundException;
import org.opensearch.fleet.storage.FleetBackend;
import org.opensearch.fleet.storage.FleetStorage;
import org.opensearch.fleet.storage.UnknownClientException;
import org.opensearch.telemetry.metrics.Counter;
import org.opensearch.telemetry.metrics.MetricsRegistry;
import org.opensearch.telemetry.metrics.tags.Tags;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.LongSupplier;
import java.util.stream.Collectors;

/**
 * Adds and removes user-owned labels on batches of clients.
 *
 * <p>All arguments are validated before anything is written. Each client is then updated on the primary backend
 * (label store, then index) and mirrored to the secondary backend, whose outcome is reported per client. A primary
 * failure stops the batch with a {@link ClientLabelMutationException}; clients already processed keep their
 * changes. Audit events for the processed clients are published exactly once, whether or not the batch
 * completed.
 */
public class ClientLabelService {

    private static final Logger logger = LogManager.getLogger(ClientLabelService.class);

    private static final Metrics METRICS = new Metrics();

    private final FleetStorage storage;
    private final AuditEventSink auditSink;
    private final LongSupplier clock;

    public ClientLabelService(FleetStorage storage, AuditEventSink auditSink, LongSupplier clock) {
        this.storage = storage;
        this.auditSink = auditSink;
        this.clock = clock;
    }

    public static FleetMetrics.MetricsInitializer getMetricsInitializer() {
        return METRICS;
    }

    /**
     * Attaches labels owned by {@code user} to every client.
     */
    public LabelMutationResult addClientsLabels(List<ClientId> clientIds, List<String> labelNames, String user) {
        Set<String> names = validate(clientIds, labelNames, user);
        return mutate(clientIds, names, user, AuditAction.CLIENT_ADD_LABEL, backend -> (clientId -> {
            backend.labelStore().addLabels(clientId, user, names);
            backend.clientIndex().addClientLabels(clientId, names);
        }));
    }

    /**
     * Detaches labels owned by {@code user} from every client. Labels of the same name owned by others, including
     * system labels, stay in place, and so does their index entry.
     */
    public LabelMutationResult removeClientsLabels(List<ClientId> clientIds, List<String> labelNames, String user) {
        Set<String> names = validate(clientIds, labelNames, user);
        return mutate(clientIds, names, user, AuditAction.CLIENT_REMOVE_LABEL, backend -> (clientId -> {
            backend.labelStore().removeLabels(clientId, user, names);
            Set<String> remaining = backend.labelStore()
                .readLabels(clientId)
                .stream()
                .map(label -> ClientIndex.labelKeyword(label.name()))
                .collect(Collectors.toSet());
            List<String> unindexed = names.stream()
                .filter(name -> remaining.contains(ClientIndex.labelKeyword(name)) == false)
                .collect(Collectors.toList());
            if (unindexed.isEmpty() == false) {
                backend.clientIndex().removeClientLabels(clientId, unindexed);
            }
        }));
    }

    /**
     * @return names of all labels attached to any client of the reading backend
     */
    public SortedSet<String> listLabelNames() {
        return new TreeSet<>(storage.reader().labelStore().listLabelNames());
    }

    private Set<String> validate(List<ClientId> clientIds, List<String> labelNames, String user) {
        if (user == null || user.isBlank()) {
            throw new IllegalArgumentException("user must not be empty");
        }
        if (clientIds == null || clientIds.isEmpty()) {
            throw new IllegalArgumentException("at least one client id is required");
        }
        if (labelNames == null || labelNames.isEmpty()) {
            throw new IllegalArgumentException("at least one label is required");
        }
        Set<String> names = new LinkedHashSet<>();
        for (String name : labelNames) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("label names must not be empty");
            }
            if (new ClientLabel(name, user).isSystem()) {
                throw new IllegalArgumentException("labels owned by [" + ClientLabel.SYSTEM_OWNER + "] cannot be changed through this API");
            }
            names.add(name);
        }
        for (ClientId clientId : clientIds) {
            if (storage.primary().clientStore().exists(clientId) == false) {
                throw new ClientNotFoundException(clientId);
            }
        }
        return names;
    }

    private LabelMutationResult mutate(
        List<ClientId> clientIds,
        Set<String> names,
        String user,
        AuditAction action,
        MutationFactory mutationFactory
    ) {
        FleetBackend primary = storage.primary();
        Optional<FleetBackend> secondary = storage.secondary();
        String description = names.stream().map(name -> user + "." + name).collect(Collectors.joining(","));
        List<LabelMutationResult.Item> items = new ArrayList<>();
        List<ClientId> completed = new ArrayList<>();

        try (AuditEventBatch audit = new AuditEventBatch(auditSink)) {
            for (ClientId clientId : new LinkedHashSet<>(clientIds)) {
                try {
                    mutationFactory.forBackend(primary).apply(clientId);
                } catch (Exception e) {
                    throw new ClientLabelMutationException(clientId, completed, e);
                }
                SecondaryWriteOutcome outcome = secondary.map(backend -> mirror(backend, clientId, mutationFactory)).orElse(null);
                items.add(new LabelMutationResult.Item(clientId, outcome));
                completed.add(clientId);
                audit.add(new AuditEvent(action, user, clientId, description, clock.getAsLong()));
                FleetMetrics.incrementCounter(METRICS.mutationsTotal, 1, Tags.create().addTag("action", action.name()));
            }
        }
        return new LabelMutationResult(items);
    }

    private SecondaryWriteOutcome mirror(FleetBackend backend, ClientId clientId, MutationFactory mutationFactory) {
        SecondaryWriteOutcome outcome;
        try {
            mutationFactory.forBackend(backend).apply(clientId);
            outcome = SecondaryWriteOutcome.migrated(backend.type());
        } catch (UnknownClientException e) {
            logger.debug("Client [{}] not yet migrated to [{}] backend", clientId, backend.type());
            outcome = SecondaryWriteOutcome.notYetMigrated(backend.type(), e);
        } catch (Exception e) {
            logger.warn("Failed to mirror label change of client [{}] to [{}] backend", clientId, backend.type(), e);
            outcome = SecondaryWriteOutcome.failed(backend.type(), e);
        }
        FleetMetrics.incrementCounter(METRICS.secondaryWrites, 1, Tags.create().addTag("outcome", outcome.status().value()));
        return outcome;
    }

    @FunctionalInterface
    private interface ClientMutation {
        void apply(ClientId clientId);
    }

    @FunctionalInterface
    private interface MutationFactory {
        ClientMutation forBackend(FleetBackend backend);
    }

    /**
     * Metrics container for ClientLabelService.
     */
    static class Metrics implements FleetMetrics.MetricsInitializer {
        Counter mutationsTotal;
        Counter secondaryWrites;

        @Override
        public synchronized void register(MetricsRegistry registry) {
            mutationsTotal = registry.createCounter(
                FleetMetricsConstants.LABEL_MUTATIONS_TOTAL,
                FleetMetricsConstants.LABEL_MUTATIONS_TOTAL_DESC,
                FleetMetricsConstants.UNIT_COUNT
            );
            secondaryWrites = registry.createCounter(
                FleetMetricsConstants.LABEL_SECONDARY_WRITES_TOTAL,
                FleetMetricsConstants.LABEL_SECONDARY_WRITES_TOTAL_DESC,
                FleetMetricsConstants.UNIT_COUNT
            );
        }

        @Override
        public synchronized void cleanup() {
            mutationsTotal = null;
            secondaryWrites = null;
        }
    }
}
