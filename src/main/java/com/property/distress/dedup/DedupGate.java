package com.property.distress.dedup;

import com.property.distress.core.model.RecordType;
import com.property.distress.ingest.IngestionConfigurationException;
import com.property.distress.ingest.SourceRow;
import com.property.distress.store.SignalFilter;
import com.property.distress.store.SignalRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Drops rows whose identity value is already stored, before any resolution work is spent on them.
 * Read-only: the store is queried once per call.
 */
public class DedupGate {
    private static final Logger log = LoggerFactory.getLogger(DedupGate.class);

    public static final String TAX_YEAR = "tax_year";
    public static final String RECORD_SUBTYPE = "record_subtype";

    private final SignalRepository repository;

    public DedupGate(SignalRepository repository) {
        this.repository = repository;
    }

    public List<SourceRow> filterNew(List<SourceRow> rows, RecordType recordType) {
        return filterNew(rows, recordType, Map.of());
    }

    /**
     * Rows whose trimmed identity value is not yet stored for the type.
     *
     * @param extraFilters narrows the stored set; supported keys are {@value #TAX_YEAR} and
     *                     {@value #RECORD_SUBTYPE}
     * @throws IngestionConfigurationException if a row lacks the identity column or a filter
     *                                         key is unsupported
     */
    public List<SourceRow> filterNew(List<SourceRow> rows, RecordType recordType, Map<String, ?> extraFilters) {
        String identityColumn = requireIdentityColumn(rows, recordType);
        SignalFilter filter = toFilter(extraFilters);
        if (rows.isEmpty()) {
            return List.of();
        }

        Set<String> existing = repository.findExternalKeys(recordType, filter);
        List<SourceRow> fresh = rows.stream()
                .filter(row -> {
                    String key = row.text(identityColumn);
                    return key == null || !existing.contains(key);
                })
                .toList();

        DedupSummary summary = summarize(rows.size(), fresh.size());
        log.info("dedup.filtered type={} total={} fresh={} existing={} rate={}%",
                recordType.getKey(), summary.total(), summary.fresh(), summary.existing(),
                String.format("%.1f", summary.dedupRate()));
        return fresh;
    }

    /**
     * True when every row of a non-empty batch is already stored.
     */
    public boolean allExist(List<SourceRow> rows, RecordType recordType) {
        return !rows.isEmpty() && filterNew(rows, recordType).isEmpty();
    }

    public DedupSummary summarize(long total, long fresh) {
        return DedupSummary.of(total, fresh);
    }

    /**
     * @return the identity column of the type
     * @throws IngestionConfigurationException if any row lacks it
     */
    public String requireIdentityColumn(List<SourceRow> rows, RecordType recordType) {
        if (recordType == null) {
            throw new IngestionConfigurationException("Record type is required");
        }
        String identityColumn = recordType.getIdentityColumn();
        for (SourceRow row : rows) {
            if (!row.hasColumn(identityColumn)) {
                throw new IngestionConfigurationException("Extract for " + recordType.getKey()
                        + " lacks identity column '" + identityColumn + "' (row " + row.rowNumber() + ")");
            }
        }
        return identityColumn;
    }

    static SignalFilter toFilter(Map<String, ?> extraFilters) {
        if (extraFilters == null || extraFilters.isEmpty()) {
            return SignalFilter.none();
        }
        Integer taxYear = null;
        String subtype = null;
        for (Map.Entry<String, ?> entry : extraFilters.entrySet()) {
            Object value = entry.getValue();
            switch (entry.getKey()) {
                case TAX_YEAR -> taxYear = toYear(value);
                case RECORD_SUBTYPE -> subtype = value != null ? value.toString() : null;
                default -> throw new IngestionConfigurationException("Unsupported dedup filter: " + entry.getKey());
            }
        }
        return new SignalFilter(taxYear, subtype);
    }

    private static Integer toYear(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        try {
            return Integer.valueOf(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IngestionConfigurationException("tax_year filter is not a year: " + value);
        }
    }
}
