package com.property.distress.ingest;

import com.property.distress.core.model.AbsenteeStatus;
import com.property.distress.core.model.Owner;
import com.property.distress.core.model.Property;
import com.property.distress.logging.LogContext;
import com.property.distress.metrics.MetricsService;
import com.property.distress.metrics.NoOpMetricsService;
import com.property.distress.resolve.PropertyResolver;
import com.property.distress.rules.AbsenteeClassifier;
import com.property.distress.rules.Normalizer;
import com.property.distress.store.PropertyRepository;
import com.property.distress.store.PropertyWithOwner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Loads the property appraiser's master roll: one property, and usually one owner, per parcel.
 * Normalized keys and the absentee classification are computed here, once, at load time.
 */
public class PropertyLoader {
    private static final Logger log = LoggerFactory.getLogger(PropertyLoader.class);

    static final String SOURCE = "master";
    static final String PARCEL_COLUMN = "FOLIO";

    private final PropertyRepository repository;
    private final Normalizer normalizer;
    private final AbsenteeClassifier classifier;
    private final PropertyResolver resolver;
    private final IngestionOptions options;
    private final MetricsService metrics;

    public PropertyLoader(PropertyRepository repository, Normalizer normalizer, AbsenteeClassifier classifier,
                          PropertyResolver resolver) {
        this(repository, normalizer, classifier, resolver, IngestionOptions.defaults(), new NoOpMetricsService());
    }

    public PropertyLoader(PropertyRepository repository, Normalizer normalizer, AbsenteeClassifier classifier,
                          PropertyResolver resolver, IngestionOptions options, MetricsService metrics) {
        this.repository = repository;
        this.normalizer = normalizer;
        this.classifier = classifier;
        this.resolver = resolver;
        this.options = options;
        this.metrics = metrics;
    }

    /**
     * @throws IngestionConfigurationException if any row lacks the {@code FOLIO} column
     * @throws BatchCommitException            when a batch cannot be persisted
     */
    public IngestionResult loadFromRecords(List<SourceRow> rows, boolean skipDuplicates) {
        for (SourceRow row : rows) {
            if (!row.hasColumn(PARCEL_COLUMN)) {
                throw new IngestionConfigurationException("Master roll lacks identity column '"
                        + PARCEL_COLUMN + "' (row " + row.rowNumber() + ")");
            }
        }
        Instant started = Instant.now();

        try (LogContext ignored = LogContext.forIngestion(LogContext.generateRunId(), SOURCE)) {
            Set<String> stored = skipDuplicates ? repository.findAllParcelIds() : Set.of();
            Set<String> seen = new HashSet<>();
            List<PropertyWithOwner> pending = new ArrayList<>();
            List<IngestionResult.IngestionError> errors = new ArrayList<>();
            long loaded = 0;
            long skipped = 0;
            long committed = 0;

            for (SourceRow row : rows) {
                String parcelId = row.text(PARCEL_COLUMN);
                try {
                    if (parcelId == null) {
                        throw new RecordValidationException(row.rowNumber(), PARCEL_COLUMN, "required value is missing");
                    }
                    if (stored.contains(parcelId) || !seen.add(parcelId)) {
                        skipped++;
                        continue;
                    }
                    pending.add(toPropertyWithOwner(row, parcelId));
                    loaded++;
                } catch (RecordValidationException | IllegalArgumentException e) {
                    errors.add(new IngestionResult.IngestionError(row.rowNumber(), parcelId, e.getMessage()));
                    log.warn("ingest.row_failed type={} row={} key={} error={}",
                            SOURCE, row.rowNumber(), parcelId, e.getMessage());
                }

                if (pending.size() >= options.getBatchSize()) {
                    committed += commit(pending, rows.size(), loaded, skipped, committed, errors);
                }
            }
            committed += commit(pending, rows.size(), loaded, skipped, committed, errors);

            IngestionResult result = new IngestionResult(SOURCE, rows.size(), loaded, 0, skipped, errors.size(),
                    committed, errors);
            metrics.recordIngestion(SOURCE, result.matched(), 0, result.skipped(), result.failed(),
                    Duration.between(started, Instant.now()));
            log.info("ingest.completed type={} result={}", SOURCE, result);
            return result;
        }
    }

    private int commit(List<PropertyWithOwner> pending, long total, long loaded, long skipped, long committed,
                       List<IngestionResult.IngestionError> errors) {
        if (pending.isEmpty()) {
            return 0;
        }
        int size = pending.size();
        try {
            repository.saveAll(List.copyOf(pending));
        } catch (RuntimeException e) {
            IngestionResult partial = new IngestionResult(SOURCE, total, loaded, 0, skipped, errors.size(),
                    committed, errors);
            log.error("ingest.commit_failed type={} batch={} committed={} error={}",
                    SOURCE, size, committed, e.getMessage());
            throw new BatchCommitException("Failed to commit " + size + " properties", partial, e);
        }
        // A new property can beat a match that is already cached
        resolver.invalidateCache();
        pending.clear();
        return size;
    }

    private PropertyWithOwner toPropertyWithOwner(SourceRow row, String parcelId) {
        String siteAddress = row.text("SITE_ADDR");
        Property property = Property.builder()
                .parcelId(parcelId)
                .address(siteAddress)
                .normalizedAddress(normalizer.normalizeAddress(siteAddress))
                .city(row.text("SITE_CITY"))
                .state(row.text("SITE_STATE"))
                .zip(row.text("SITE_ZIP"))
                .propertyType(row.text("TYPE"))
                .assessedMarketValue(row.amount("ASD_VAL"))
                .taxableValue(row.amount("TAX_VAL"))
                .build();

        String ownerName = row.text("OWNER");
        if (ownerName == null) {
            return new PropertyWithOwner(property, null);
        }
        String mailingAddress = row.joinText("ADDR_1", "ADDR_2");
        String mailingState = row.text("STATE");
        String mailingZip = row.text("ZIP");
        AbsenteeStatus absentee = classifier.classify(property, mailingAddress, mailingState, mailingZip);
        Owner owner = Owner.builder()
                .ownerName(ownerName)
                .normalizedName(normalizer.normalizeOwnerName(ownerName))
                .mailingAddress(mailingAddress)
                .mailingCity(row.text("CITY"))
                .mailingState(mailingState)
                .mailingZip(mailingZip)
                .absenteeStatus(absentee)
                .build();
        return new PropertyWithOwner(property, owner);
    }
}
