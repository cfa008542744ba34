package com.property.distress.ingest;

import java.util.List;

/**
 * Counts from one ingestion run.
 *
 * @param source    record type key, or {@code master} for the property roll
 * @param total     rows considered after consolidation
 * @param matched   rows resolved to a property and queued for commit
 * @param unmatched rows no resolver tier could place
 * @param skipped   duplicates, either already stored or repeated within the batch
 * @param failed    rows rejected by validation
 * @param committed records actually persisted
 * @param errors    one entry per failed row
 */
public record IngestionResult(
        String source,
        long total,
        long matched,
        long unmatched,
        long skipped,
        long failed,
        long committed,
        List<IngestionError> errors
) {
    public IngestionResult {
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public static IngestionResult empty(String source) {
        return new IngestionResult(source, 0, 0, 0, 0, 0, 0, List.of());
    }

    /**
     * Share of resolution attempts that found a property, 0-100. Duplicates and failed rows
     * are not attempts.
     */
    public double matchRate() {
        long attempts = matched + unmatched;
        return attempts == 0 ? 0.0 : matched * 100.0 / attempts;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * @param rowNumber   source line, 1-based with the header on line 1
     * @param externalKey identity value of the row, when it had one
     * @param message     why the row was rejected
     */
    public record IngestionError(long rowNumber, String externalKey, String message) {}

    @Override
    public String toString() {
        return "IngestionResult{source=" + source +
                ", total=" + total +
                ", matched=" + matched +
                ", unmatched=" + unmatched +
                ", skipped=" + skipped +
                ", failed=" + failed +
                ", committed=" + committed +
                String.format(", matchRate=%.1f%%", matchRate()) + '}';
    }
}
