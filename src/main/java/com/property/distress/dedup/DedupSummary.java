package com.property.distress.dedup;

/**
 * How much of a batch was already stored.
 *
 * @param total     rows in the batch
 * @param fresh     rows not yet stored
 * @param existing  rows already stored
 * @param dedupRate share of existing rows, 0-100
 */
public record DedupSummary(long total, long fresh, long existing, double dedupRate) {

    public static DedupSummary of(long total, long fresh) {
        if (fresh < 0 || fresh > total) {
            throw new IllegalArgumentException("fresh must be between 0 and total");
        }
        long existing = total - fresh;
        double rate = total == 0 ? 0.0 : existing * 100.0 / total;
        return new DedupSummary(total, fresh, existing, rate);
    }
}
