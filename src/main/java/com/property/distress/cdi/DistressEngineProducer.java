package com.property.distress.cdi;

import com.property.distress.archive.ArchiveRotator;
import com.property.distress.cache.CacheConfig;
import com.property.distress.dedup.DedupGate;
import com.property.distress.ingest.IngestionLoader;
import com.property.distress.ingest.IngestionOptions;
import com.property.distress.ingest.IngestionPipeline;
import com.property.distress.ingest.PropertyLoader;
import com.property.distress.ingest.handler.RecordHandlerRegistry;
import com.property.distress.metrics.MetricsService;
import com.property.distress.metrics.MicrometerMetricsService;
import com.property.distress.metrics.NoOpMetricsService;
import com.property.distress.resolve.PropertyResolver;
import com.property.distress.resolve.ResolverOptions;
import com.property.distress.rules.AbsenteeClassifier;
import com.property.distress.rules.Normalizer;
import com.property.distress.rules.NormalizerConfig;
import com.property.distress.scoring.ScoreStore;
import com.property.distress.scoring.ScoringEngine;
import com.property.distress.scoring.ScoringPolicy;
import com.property.distress.scoring.ScoringService;
import com.property.distress.store.DistressScoreRepository;
import com.property.distress.store.InMemoryDistressScoreRepository;
import com.property.distress.store.InMemoryPropertyRepository;
import com.property.distress.store.InMemorySignalRepository;
import com.property.distress.store.PropertyRepository;
import com.property.distress.store.SignalRepository;
import com.property.distress.store.jdbc.JdbcDistressScoreRepository;
import com.property.distress.store.jdbc.JdbcPropertyRepository;
import com.property.distress.store.jdbc.JdbcSchemaInitializer;
import com.property.distress.store.jdbc.JdbcSignalRepository;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.time.Clock;
import java.time.Duration;

/**
 * CDI producer that wires the engine from MicroProfile Config properties.
 *
 * <h2>Configuration</h2>
 * <pre>
 * distress.store.type=jdbc            # or memory
 * distress.jdbc.url=jdbc:postgresql://localhost/distress
 * distress.jdbc.username=distress
 * distress.jdbc.password=...
 * distress.jdbc.initialize-schema=true
 * </pre>
 *
 * <p>Resolver windows, the qualification threshold, batch size, cache and metrics have
 * defaults; see {@code META-INF/microprofile-config.properties}.</p>
 */
@ApplicationScoped
public class DistressEngineProducer {

    private static final Logger log = LoggerFactory.getLogger(DistressEngineProducer.class);

    // ── Store ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "distress.store.type", defaultValue = "jdbc")
    String storeType;

    @Inject
    @ConfigProperty(name = "distress.jdbc.url", defaultValue = "jdbc:h2:mem:distress;DB_CLOSE_DELAY=-1")
    String jdbcUrl;

    @Inject
    @ConfigProperty(name = "distress.jdbc.username", defaultValue = "sa")
    String jdbcUsername;

    @Inject
    @ConfigProperty(name = "distress.jdbc.password", defaultValue = "")
    String jdbcPassword;

    @Inject
    @ConfigProperty(name = "distress.jdbc.initialize-schema", defaultValue = "true")
    boolean initializeSchema;

    // ── Resolution ────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "distress.resolver.fuzzy-address-window", defaultValue = "1000")
    int fuzzyAddressWindow;

    @Inject
    @ConfigProperty(name = "distress.resolver.fuzzy-address-threshold", defaultValue = "85")
    double fuzzyAddressThreshold;

    @Inject
    @ConfigProperty(name = "distress.resolver.partial-owner-limit", defaultValue = "50")
    int partialOwnerLimit;

    @Inject
    @ConfigProperty(name = "distress.resolver.fallback-owner-window", defaultValue = "100")
    int fallbackOwnerWindow;

    @Inject
    @ConfigProperty(name = "distress.resolver.owner-threshold", defaultValue = "75")
    double ownerThreshold;

    @Inject
    @ConfigProperty(name = "distress.home-state", defaultValue = "FL")
    String homeState;

    // ── Cache ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "distress.cache.enabled", defaultValue = "true")
    boolean cacheEnabled;

    @Inject
    @ConfigProperty(name = "distress.cache.max-size", defaultValue = "50000")
    int cacheMaxSize;

    @Inject
    @ConfigProperty(name = "distress.cache.ttl-seconds", defaultValue = "600")
    int cacheTtlSeconds;

    // ── Ingestion & scoring ───────────────────────────────────

    @Inject
    @ConfigProperty(name = "distress.ingest.batch-size", defaultValue = "1000")
    int batchSize;

    @Inject
    @ConfigProperty(name = "distress.scoring.qualification-threshold", defaultValue = "70")
    int qualificationThreshold;

    @Inject
    @ConfigProperty(name = "distress.metrics.enabled", defaultValue = "true")
    boolean metricsEnabled;

    @Inject
    Instance<MeterRegistry> meterRegistry;

    private DataSource dataSource;

    // ══════════════════════════════════════════════════════════
    //  Store
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public PropertyRepository propertyRepository() {
        return isJdbc() ? new JdbcPropertyRepository(jdbcTemplate(), transactionTemplate())
                : new InMemoryPropertyRepository();
    }

    @Produces
    @ApplicationScoped
    public SignalRepository signalRepository() {
        return isJdbc() ? new JdbcSignalRepository(jdbcTemplate(), transactionTemplate())
                : new InMemorySignalRepository();
    }

    @Produces
    @ApplicationScoped
    public DistressScoreRepository distressScoreRepository() {
        return isJdbc() ? new JdbcDistressScoreRepository(jdbcTemplate()) : new InMemoryDistressScoreRepository();
    }

    // ══════════════════════════════════════════════════════════
    //  Engine
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public MetricsService metricsService() {
        if (metricsEnabled && meterRegistry.isResolvable()) {
            log.info("Metrics enabled: Micrometer");
            return new MicrometerMetricsService(meterRegistry.get());
        }
        log.info("Metrics disabled");
        return new NoOpMetricsService();
    }

    @Produces
    @ApplicationScoped
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Produces
    @ApplicationScoped
    public Normalizer normalizer() {
        return new Normalizer(normalizerConfig());
    }

    @Produces
    @ApplicationScoped
    public AbsenteeClassifier absenteeClassifier(Normalizer normalizer) {
        return new AbsenteeClassifier(normalizer, homeState);
    }

    @Produces
    @ApplicationScoped
    public PropertyResolver propertyResolver(PropertyRepository repository, Normalizer normalizer,
                                             MetricsService metrics) {
        ResolverOptions options = ResolverOptions.builder()
                .fuzzyAddressWindow(fuzzyAddressWindow)
                .fuzzyAddressThreshold(fuzzyAddressThreshold)
                .partialOwnerLimit(partialOwnerLimit)
                .fallbackOwnerWindow(fallbackOwnerWindow)
                .ownerThreshold(ownerThreshold)
                .build();
        CacheConfig cacheConfig = new CacheConfig(cacheMaxSize, Duration.ofSeconds(cacheTtlSeconds), cacheEnabled);
        log.info("Producing PropertyResolver: fuzzyWindow={} cache={}", fuzzyAddressWindow, cacheEnabled);
        return new PropertyResolver(repository, normalizer, options, cacheConfig.createCache(), metrics);
    }

    @Produces
    @ApplicationScoped
    public IngestionLoader ingestionLoader(PropertyResolver resolver, SignalRepository signals,
                                           MetricsService metrics) {
        return new IngestionLoader(RecordHandlerRegistry.defaults(), resolver, new DedupGate(signals), signals,
                ingestionOptions(), metrics);
    }

    @Produces
    @ApplicationScoped
    public PropertyLoader propertyLoader(PropertyRepository repository, Normalizer normalizer,
                                         AbsenteeClassifier classifier, PropertyResolver resolver,
                                         MetricsService metrics) {
        return new PropertyLoader(repository, normalizer, classifier, resolver, ingestionOptions(), metrics);
    }

    @Produces
    @ApplicationScoped
    public IngestionPipeline ingestionPipeline(IngestionLoader loader, PropertyLoader propertyLoader, Clock clock) {
        return new IngestionPipeline(loader, propertyLoader, new ArchiveRotator(clock));
    }

    @Produces
    @ApplicationScoped
    public ScoringEngine scoringEngine(PropertyRepository properties, SignalRepository signals,
                                       AbsenteeClassifier classifier, MetricsService metrics, Clock clock) {
        ScoringPolicy policy = ScoringPolicy.builder()
                .qualificationThreshold(qualificationThreshold)
                .build();
        return new ScoringEngine(properties, signals, policy, classifier, metrics, clock);
    }

    @Produces
    @ApplicationScoped
    public ScoreStore scoreStore(DistressScoreRepository repository, MetricsService metrics, Clock clock) {
        return new ScoreStore(repository, metrics, clock);
    }

    @Produces
    @ApplicationScoped
    public ScoringService scoringService(SignalRepository signals, ScoringEngine engine, ScoreStore store) {
        return new ScoringService(signals, engine, store);
    }

    // ══════════════════════════════════════════════════════════
    //  Internal
    // ══════════════════════════════════════════════════════════

    private boolean isJdbc() {
        if ("memory".equalsIgnoreCase(storeType)) {
            return false;
        }
        if (!"jdbc".equalsIgnoreCase(storeType)) {
            throw new IllegalStateException("Unknown distress.store.type '" + storeType + "', expected jdbc or memory");
        }
        return true;
    }

    private NormalizerConfig normalizerConfig() {
        NormalizerConfig defaults = NormalizerConfig.defaults();
        return new NormalizerConfig(defaults.addressBlocklist(), defaults.abbreviations(), defaults.cityNames(),
                defaults.ownerSuffixes(), homeState);
    }

    private IngestionOptions ingestionOptions() {
        return IngestionOptions.builder().batchSize(batchSize).build();
    }

    private synchronized DataSource dataSource() {
        if (dataSource == null) {
            log.info("Connecting store: url={}", jdbcUrl);
            DataSource created = new DriverManagerDataSource(jdbcUrl, jdbcUsername, jdbcPassword);
            if (initializeSchema) {
                JdbcSchemaInitializer.initialize(created);
            }
            dataSource = created;
        }
        return dataSource;
    }

    private JdbcTemplate jdbcTemplate() {
        return new JdbcTemplate(dataSource());
    }

    private TransactionTemplate transactionTemplate() {
        return new TransactionTemplate(new DataSourceTransactionManager(dataSource()));
    }
}
