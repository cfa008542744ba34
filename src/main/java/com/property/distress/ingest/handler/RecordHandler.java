package com.property.distress.ingest.handler;

import com.property.distress.core.model.RecordType;
import com.property.distress.core.model.SignalRecord;
import com.property.distress.ingest.RecordValidationException;
import com.property.distress.ingest.SourceRow;
import com.property.distress.resolve.ResolutionRequest;

import java.util.List;

/**
 * Turns rows of one extract type into signal records.
 * Implementations are stateless and know the column contract of their extract.
 */
public interface RecordHandler {

    RecordType recordType();

    default String identityColumn() {
        return recordType().getIdentityColumn();
    }

    /**
     * Collapses multi-row entities (one row per case party, say) into one row per record.
     * The default keeps every row.
     */
    default List<SourceRow> consolidate(List<SourceRow> rows) {
        return rows;
    }

    /**
     * Tax year that scopes the row's identity, or 0 for types that have none.
     *
     * @throws RecordValidationException if the row carries an unusable year
     */
    default int taxYear(SourceRow row) {
        return 0;
    }

    /**
     * Resolution attempts for the row, in the order they should be tried.
     */
    List<ResolutionRequest> resolutionRequests(SourceRow row);

    /**
     * @throws RecordValidationException for rows that cannot be turned into a record
     */
    SignalRecord buildRecord(SourceRow row, long propertyId);
}
