package com.property.distress.rest.dto;

import com.property.distress.ingest.IngestionResult;

import java.util.List;

public record IngestionResponse(
        String recordType,
        long total,
        long matched,
        long unmatched,
        long skipped,
        long failed,
        long committed,
        double matchRate,
        List<IngestionResult.IngestionError> errors
) {
    public static IngestionResponse from(IngestionResult result) {
        return new IngestionResponse(result.source(), result.total(), result.matched(), result.unmatched(),
                result.skipped(), result.failed(), result.committed(), result.matchRate(), result.errors());
    }
}
