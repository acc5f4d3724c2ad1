/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.fleet;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.client.Client;
import org.opensearch.cluster.metadata.IndexNameExpressionResolver;
import org.opensearch.cluster.node.DiscoveryNodes;
import org.opensearch.cluster.service.ClusterService;
import org.opensearch.common.settings.ClusterSettings;
import org.opensearch.common.settings.IndexScopedSettings;
import org.opensearch.common.settings.Setting;
import org.opensearch.common.settings.Settings;
import org.opensearch.common.settings.SettingsFilter;
import org.opensearch.common.unit.TimeValue;
import org.opensearch.core.common.io.stream.NamedWriteableRegistry;
import org.opensearch.core.xcontent.NamedXContentRegistry;
import org.opensearch.env.Environment;
import org.opensearch.env.NodeEnvironment;
import org.opensearch.fleet.audit.LoggingAuditEventSink;
import org.opensearch.fleet.flow.InMemoryInterrogationTracker;
import org.opensearch.fleet.ip.DefaultIpResolver;
import org.opensearch.fleet.labels.ClientLabelService;
import org.opensearch.fleet.metrics.FleetMetrics;
import org.opensearch.fleet.rest.RestClientLabelsAction;
import org.opensearch.fleet.rest.RestGetClientAction;
import org.opensearch.fleet.rest.RestGetClientLoadStatsAction;
import org.opensearch.fleet.rest.RestGetClientVersionTimesAction;
import org.opensearch.fleet.rest.RestGetClientVersionsAction;
import org.opensearch.fleet.rest.RestGetLastClientIpAction;
import org.opensearch.fleet.rest.RestInterrogateClientAction;
import org.opensearch.fleet.rest.RestListClientCrashesAction;
import org.opensearch.fleet.rest.RestSearchClientsAction;
import org.opensearch.fleet.search.ClientSearchService;
import org.opensearch.fleet.search.LabelWhitelist;
import org.opensearch.fleet.stats.ClientLoadStatsService;
import org.opensearch.fleet.storage.BackendType;
import org.opensearch.fleet.storage.ClientIngestService;
import org.opensearch.fleet.storage.ClientRecordReader;
import org.opensearch.fleet.storage.FleetStorage;
import org.opensearch.fleet.storage.legacy.LegacyFleetBackend;
import org.opensearch.fleet.storage.relational.RelationalFleetBackend;
import org.opensearch.plugins.ActionPlugin;
import org.opensearch.plugins.Plugin;
import org.opensearch.plugins.TelemetryAwarePlugin;
import org.opensearch.repositories.RepositoriesService;
import org.opensearch.rest.RestController;
import org.opensearch.rest.RestHandler;
import org.opensearch.script.ScriptService;
import org.opensearch.telemetry.metrics.MetricsRegistry;
import org.opensearch.telemetry.tracing.Tracer;
import org.opensearch.threadpool.ThreadPool;
import org.opensearch.watcher.ResourceWatcherService;

import java.io.IOException;
import java.util.Collection;
import java.util.List;
import java.util.function.Function;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

/**
 * Plugin serving the client fleet: client search, client records, labels, load statistics and interrogations.
 *
 * <p>Client data lives in two backends. The legacy backend always receives writes; the relational backend
 * receives them while {@link #RELATIONAL_WRITES_ENABLED} is set. {@link #READ_BACKEND} picks the backend serving
 * reads.
 */
public class FleetPlugin extends Plugin implements ActionPlugin, TelemetryAwarePlugin {

    private static final Logger logger = LogManager.getLogger(FleetPlugin.class);

    /**
     * Backend serving reads and searches, {@code legacy} or {@code relational}.
     */
    public static final Setting<BackendType> READ_BACKEND = new Setting<>(
        "fleet.storage.read_backend",
        BackendType.LEGACY.settingValue(),
        BackendType::fromString,
        Setting.Property.NodeScope
    );

    /**
     * Whether writes are mirrored to the relational backend.
     */
    public static final Setting<Boolean> RELATIONAL_WRITES_ENABLED = Setting.boolSetting(
        "fleet.storage.relational_writes.enabled",
        true,
        Setting.Property.NodeScope
    );

    /**
     * Label names a search may return clients for. Empty means unrestricted search.
     */
    public static final Setting<List<String>> SEARCH_LABELS_WHITELIST = Setting.listSetting(
        "fleet.search.labels_whitelist",
        List.of(),
        Function.identity(),
        Setting.Property.NodeScope
    );

    /**
     * Owners whose whitelisted labels count. Required when {@link #SEARCH_LABELS_WHITELIST} is set.
     */
    public static final Setting<List<String>> SEARCH_LABEL_OWNERS_WHITELIST = Setting.listSetting(
        "fleet.search.label_owners_whitelist",
        List.of(),
        Function.identity(),
        Setting.Property.NodeScope
    );

    public static final Setting<Integer> LOAD_STATS_MAX_SAMPLES = Setting.intSetting(
        "fleet.load_stats.max_samples",
        100,
        1,
        Setting.Property.NodeScope
    );

    public static final Setting<TimeValue> LOAD_STATS_DEFAULT_LOOKBACK = Setting.positiveTimeSetting(
        "fleet.load_stats.default_lookback",
        TimeValue.timeValueMinutes(30),
        Setting.Property.NodeScope
    );

    public static final Setting<TimeValue> CLIENT_VERSIONS_DEFAULT_LOOKBACK = Setting.positiveTimeSetting(
        "fleet.client_versions.default_lookback",
        TimeValue.timeValueMinutes(3),
        Setting.Property.NodeScope
    );

    private final LongSupplier clock;

    private FleetStorage storage;
    private ClientRecordReader reader;
    private ClientIngestService ingestService;
    private ClientSearchService searchService;
    private ClientLabelService labelService;
    private ClientLoadStatsService loadStatsService;
    private InMemoryInterrogationTracker interrogationTracker;

    /**
     * Default constructor
     */
    public FleetPlugin() {
        this(System::currentTimeMillis);
    }

    FleetPlugin(LongSupplier clock) {
        this.clock = clock;
    }

    @Override
    public List<Setting<?>> getSettings() {
        return List.of(
            READ_BACKEND,
            RELATIONAL_WRITES_ENABLED,
            SEARCH_LABELS_WHITELIST,
            SEARCH_LABEL_OWNERS_WHITELIST,
            LOAD_STATS_MAX_SAMPLES,
            LOAD_STATS_DEFAULT_LOOKBACK,
            CLIENT_VERSIONS_DEFAULT_LOOKBACK
        );
    }

    /**
     * Initialize metrics if telemetry is available, and create the fleet services.
     */
    @Override
    public Collection<Object> createComponents(
        Client client,
        ClusterService clusterService,
        ThreadPool threadPool,
        ResourceWatcherService resourceWatcherService,
        ScriptService scriptService,
        NamedXContentRegistry xContentRegistry,
        Environment environment,
        NodeEnvironment nodeEnvironment,
        NamedWriteableRegistry namedWriteableRegistry,
        IndexNameExpressionResolver indexNameExpressionResolver,
        Supplier<RepositoriesService> repositoriesServiceSupplier,
        Tracer tracer,
        MetricsRegistry metricsRegistry
    ) {
        if (metricsRegistry != null) {
            FleetMetrics.initialize(
                metricsRegistry,
                ClientSearchService.getMetricsInitializer(),
                ClientLabelService.getMetricsInitializer(),
                ClientLoadStatsService.getMetricsInitializer()
            );
        } else {
            logger.warn("MetricsRegistry is null; fleet metrics not initialized");
        }
        initServices(environment.settings());
        return List.of(storage, ingestService, searchService, labelService, loadStatsService, interrogationTracker);
    }

    @Override
    public List<RestHandler> getRestHandlers(
        Settings settings,
        RestController restController,
        ClusterSettings clusterSettings,
        IndexScopedSettings indexScopedSettings,
        SettingsFilter settingsFilter,
        IndexNameExpressionResolver indexNameExpressionResolver,
        Supplier<DiscoveryNodes> nodesInCluster
    ) {
        initServices(settings);
        return List.of(
            new RestSearchClientsAction(searchService, labelWhitelist(settings), clock),
            new RestGetClientAction(reader, clock),
            new RestGetClientVersionsAction(reader, CLIENT_VERSIONS_DEFAULT_LOOKBACK.get(settings), clock),
            new RestGetClientVersionTimesAction(reader, clock),
            new RestGetClientLoadStatsAction(loadStatsService, clock),
            new RestGetLastClientIpAction(reader, new DefaultIpResolver(), clock),
            new RestListClientCrashesAction(reader, clock),
            new RestInterrogateClientAction(interrogationTracker, clock),
            new RestClientLabelsAction(labelService, clock)
        );
    }

    /**
     * Builds the storage backends and services once per node.
     *
     * @throws IllegalArgumentException if the storage settings are inconsistent
     */
    synchronized void initServices(Settings settings) {
        if (storage != null) {
            return;
        }
        BackendType readBackend = READ_BACKEND.get(settings);
        boolean relationalWrites = RELATIONAL_WRITES_ENABLED.get(settings);
        storage = new FleetStorage(new LegacyFleetBackend(), new RelationalFleetBackend(), readBackend, relationalWrites);
        reader = new ClientRecordReader(storage.reader());
        ingestService = new ClientIngestService(storage);
        searchService = new ClientSearchService(storage::reader);
        labelService = new ClientLabelService(storage, new LoggingAuditEventSink(), clock);
        loadStatsService = new ClientLoadStatsService(
            storage::reader,
            LOAD_STATS_MAX_SAMPLES.get(settings),
            LOAD_STATS_DEFAULT_LOOKBACK.get(settings),
            clock
        );
        interrogationTracker = new InMemoryInterrogationTracker(reader::exists);
        logger.info("Fleet storage reads from [{}] backend, relational writes enabled [{}]", readBackend.settingValue(), relationalWrites);
    }

    /**
     * @return the configured search whitelist, or null when searches are unrestricted
     */
    static LabelWhitelist labelWhitelist(Settings settings) {
        List<String> names = SEARCH_LABELS_WHITELIST.get(settings);
        if (names.isEmpty()) {
            return null;
        }
        return new LabelWhitelist(names, SEARCH_LABEL_OWNERS_WHITELIST.get(settings));
    }

    ClientIngestService ingestService() {
        return ingestService;
    }

    @Override
    public void close() throws IOException {
        FleetMetrics.cleanup();
        if (storage != null) {
            storage.close();
        }
    }
}
