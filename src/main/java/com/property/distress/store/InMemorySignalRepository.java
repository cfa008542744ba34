package com.property.distress.store;

import com.property.distress.core.model.RecordType;
import com.property.distress.core.model.SignalRecord;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * In-memory signal store. Batches are applied under a lock so a failing batch leaves no trace.
 */
public class InMemorySignalRepository implements SignalRepository {

    private final AtomicLong sequence = new AtomicLong();
    private final Map<String, SignalRecord> recordsByIdentity = new LinkedHashMap<>();

    @Override
    public synchronized Set<String> findExternalKeys(RecordType recordType, SignalFilter filter) {
        SignalFilter effective = filter != null ? filter : SignalFilter.none();
        return recordsByIdentity.values().stream()
                .filter(r -> r.recordType() == recordType)
                .filter(r -> effective.taxYear() == null || r.taxYear() == effective.taxYear())
                .filter(r -> effective.recordSubtype() == null
                        || effective.recordSubtype().equalsIgnoreCase(r.recordSubtype()))
                .map(SignalRecord::externalKey)
                .collect(Collectors.toSet());
    }

    @Override
    public synchronized boolean exists(RecordType recordType, String externalKey, int taxYear) {
        return recordsByIdentity.containsKey(recordType.name() + "|" + externalKey.trim() + "|" + taxYear);
    }

    @Override
    public synchronized void saveAll(List<SignalRecord> records) {
        Set<String> incoming = new HashSet<>();
        for (SignalRecord record : records) {
            String identity = record.identityKey();
            if (recordsByIdentity.containsKey(identity) || !incoming.add(identity)) {
                throw new IllegalStateException("Duplicate signal record: " + identity);
            }
        }
        for (SignalRecord record : records) {
            recordsByIdentity.put(record.identityKey(), record.withId(sequence.incrementAndGet()));
        }
    }

    @Override
    public synchronized List<SignalRecord> findByProperty(long propertyId, RecordType recordType) {
        return recordsByIdentity.values().stream()
                .filter(r -> r.propertyId() == propertyId)
                .filter(r -> recordType == null || r.recordType() == recordType)
                .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public synchronized List<Long> findPropertyIdsWithSignals() {
        return new ArrayList<>(recordsByIdentity.values().stream()
                .map(SignalRecord::propertyId)
                .collect(Collectors.toCollection(TreeSet::new)));
    }

    @Override
    public synchronized long count(RecordType recordType) {
        return recordsByIdentity.values().stream()
                .filter(r -> recordType == null || r.recordType() == recordType)
                .count();
    }
}
