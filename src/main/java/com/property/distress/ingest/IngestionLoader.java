package com.property.distress.ingest;

import com.property.distress.core.model.MatchResult;
import com.property.distress.core.model.RecordType;
import com.property.distress.core.model.SignalRecord;
import com.property.distress.dedup.DedupGate;
import com.property.distress.ingest.handler.RecordHandler;
import com.property.distress.ingest.handler.RecordHandlerRegistry;
import com.property.distress.logging.LogContext;
import com.property.distress.metrics.MetricsService;
import com.property.distress.metrics.NoOpMetricsService;
import com.property.distress.resolve.PropertyResolver;
import com.property.distress.store.SignalRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Loads signal records from an extract: drops rows already stored, resolves each remaining
 * row to a property, and commits the records in batches.
 *
 * <p>Loading the same extract twice with {@code skipDuplicates} leaves the store unchanged on
 * the second run, which reports every row as skipped.</p>
 */
public class IngestionLoader {
    private static final Logger log = LoggerFactory.getLogger(IngestionLoader.class);

    private final RecordHandlerRegistry handlers;
    private final PropertyResolver resolver;
    private final DedupGate dedupGate;
    private final SignalRepository repository;
    private final IngestionOptions options;
    private final MetricsService metrics;

    public IngestionLoader(RecordHandlerRegistry handlers, PropertyResolver resolver, DedupGate dedupGate,
                           SignalRepository repository) {
        this(handlers, resolver, dedupGate, repository, IngestionOptions.defaults(), new NoOpMetricsService());
    }

    public IngestionLoader(RecordHandlerRegistry handlers, PropertyResolver resolver, DedupGate dedupGate,
                           SignalRepository repository, IngestionOptions options, MetricsService metrics) {
        this.handlers = handlers;
        this.resolver = resolver;
        this.dedupGate = dedupGate;
        this.repository = repository;
        this.options = options;
        this.metrics = metrics;
    }

    public IngestionResult loadFromRecords(RecordType recordType, List<SourceRow> rows, boolean skipDuplicates) {
        return loadFromRecords(recordType, rows, skipDuplicates, Map.of(), ProgressCallback.NOOP);
    }

    public IngestionResult loadFromRecords(RecordType recordType, List<SourceRow> rows, boolean skipDuplicates,
                                           Map<String, ?> extraFilters) {
        return loadFromRecords(recordType, rows, skipDuplicates, extraFilters, ProgressCallback.NOOP);
    }

    /**
     * @throws IngestionConfigurationException before any row is processed, for an unknown type,
     *                                         a missing identity column or an unsupported filter
     * @throws BatchCommitException            when a batch cannot be persisted
     */
    public IngestionResult loadFromRecords(RecordType recordType, List<SourceRow> rows, boolean skipDuplicates,
                                           Map<String, ?> extraFilters, ProgressCallback callback) {
        RecordHandler handler = handlers.get(recordType);
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        Map<String, ?> filters = extraFilters != null ? extraFilters : Map.of();
        Instant started = Instant.now();

        try (LogContext ignored = LogContext.forIngestion(LogContext.generateRunId(), recordType.getKey())) {
            List<SourceRow> records = handler.consolidate(rows);
            dedupGate.requireIdentityColumn(records, recordType);
            Run run = new Run(recordType, records.size());

            List<SourceRow> candidates = records;
            if (skipDuplicates && !records.isEmpty()) {
                candidates = dropStored(handler, records, filters, run);
            }

            Set<String> seen = new HashSet<>();
            List<SignalRecord> pending = new ArrayList<>();
            long processed = 0;
            for (SourceRow row : candidates) {
                processed++;
                String externalKey = row.text(handler.identityColumn());
                try {
                    if (externalKey == null) {
                        throw new RecordValidationException(row.rowNumber(), handler.identityColumn(),
                                "required value is missing");
                    }
                    String batchKey = externalKey + "|" + handler.taxYear(row);
                    if (seen.contains(batchKey)) {
                        run.skipped++;
                    } else {
                        Optional<MatchResult> match = resolver.resolveFirst(handler.resolutionRequests(row));
                        if (match.isPresent()) {
                            pending.add(handler.buildRecord(row, match.get().propertyId()));
                            seen.add(batchKey);
                            run.matched++;
                        } else {
                            run.unmatched++;
                            log.debug("ingest.unmatched type={} row={} key={}",
                                    recordType.getKey(), row.rowNumber(), externalKey);
                        }
                    }
                } catch (RecordValidationException | IllegalArgumentException e) {
                    run.fail(row, externalKey, e.getMessage());
                }

                if (pending.size() >= options.getBatchSize()) {
                    commit(pending, run);
                }
                if (processed % options.getProgressInterval() == 0) {
                    cb.onProgress(processed, records.size(), "Processed " + processed + " records");
                }
            }
            commit(pending, run);

            IngestionResult result = run.toResult();
            metrics.recordIngestion(recordType.getKey(), result.matched(), result.unmatched(), result.skipped(),
                    result.failed(), Duration.between(started, Instant.now()));
            cb.onProgress(records.size(), records.size(), "Ingestion completed");
            log.info("ingest.completed type={} result={}", recordType.getKey(), result);
            return result;
        }
    }

    /**
     * Tax accounts repeat every year, so without an explicit year filter the stored set is
     * looked up per tax year found in the batch.
     */
    private List<SourceRow> dropStored(RecordHandler handler, List<SourceRow> records, Map<String, ?> filters,
                                       Run run) {
        RecordType recordType = handler.recordType();
        if (recordType != RecordType.TAX || filters.containsKey(DedupGate.TAX_YEAR)) {
            List<SourceRow> fresh = dedupGate.filterNew(records, recordType, filters);
            run.skipped += records.size() - fresh.size();
            return fresh;
        }

        Map<Integer, List<SourceRow>> byYear = new LinkedHashMap<>();
        Set<SourceRow> invalid = Collections.newSetFromMap(new IdentityHashMap<>());
        for (SourceRow row : records) {
            try {
                byYear.computeIfAbsent(handler.taxYear(row), k -> new ArrayList<>()).add(row);
            } catch (RecordValidationException e) {
                run.fail(row, row.text(handler.identityColumn()), e.getMessage());
                invalid.add(row);
            }
        }
        Set<SourceRow> fresh = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Map.Entry<Integer, List<SourceRow>> entry : byYear.entrySet()) {
            Map<String, Object> yearFilters = new HashMap<>(filters);
            yearFilters.put(DedupGate.TAX_YEAR, entry.getKey());
            fresh.addAll(dedupGate.filterNew(entry.getValue(), recordType, yearFilters));
        }
        run.skipped += records.size() - invalid.size() - fresh.size();
        return records.stream().filter(fresh::contains).toList();
    }

    private void commit(List<SignalRecord> pending, Run run) {
        if (pending.isEmpty()) {
            return;
        }
        try {
            repository.saveAll(List.copyOf(pending));
        } catch (RuntimeException e) {
            IngestionResult partial = run.toResult();
            log.error("ingest.commit_failed type={} batch={} committed={} error={}",
                    run.recordType.getKey(), pending.size(), run.committed, e.getMessage());
            throw new BatchCommitException("Failed to commit " + pending.size() + " "
                    + run.recordType.getKey() + " records", partial, e);
        }
        metrics.recordBatchCommit(run.recordType, pending.size());
        run.committed += pending.size();
        log.debug("ingest.batch_committed type={} size={} committed={}",
                run.recordType.getKey(), pending.size(), run.committed);
        pending.clear();
    }

    /**
     * Mutable counters for one load.
     */
    private static final class Run {
        private final RecordType recordType;
        private final long total;
        private final List<IngestionResult.IngestionError> errors = new ArrayList<>();
        private long matched;
        private long unmatched;
        private long skipped;
        private long failed;
        private long committed;

        private Run(RecordType recordType, long total) {
            this.recordType = recordType;
            this.total = total;
        }

        private void fail(SourceRow row, String externalKey, String message) {
            failed++;
            errors.add(new IngestionResult.IngestionError(row.rowNumber(), externalKey, message));
            log.warn("ingest.row_failed type={} row={} key={} error={}",
                    recordType.getKey(), row.rowNumber(), externalKey, message);
        }

        private IngestionResult toResult() {
            return new IngestionResult(recordType.getKey(), total, matched, unmatched, skipped, failed,
                    committed, errors);
        }
    }
}
