package com.property.distress.store;

import com.property.distress.core.model.RecordType;
import com.property.distress.core.model.SignalRecord;

import java.util.List;
import java.util.Set;

/**
 * Append-only storage for signal records.
 * {@code (recordType, externalKey, taxYear)} is unique; inserting a duplicate fails the whole batch.
 */
public interface SignalRepository {

    /**
     * Identity values already stored for a record type, narrowed by the filter.
     */
    Set<String> findExternalKeys(RecordType recordType, SignalFilter filter);

    boolean exists(RecordType recordType, String externalKey, int taxYear);

    /**
     * Inserts the batch in a single transaction.
     */
    void saveAll(List<SignalRecord> records);

    List<SignalRecord> findByProperty(long propertyId, RecordType recordType);

    /**
     * Ids of every property that has at least one signal, ascending.
     */
    List<Long> findPropertyIdsWithSignals();

    long count(RecordType recordType);
}
