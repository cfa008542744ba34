package com.property.distress.core.model;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;

/**
 * An append-only public-record signal attached to exactly one property.
 * Identity is {@code (recordType, externalKey, taxYear)}; the tax year is 0 for types without one.
 */
public record SignalRecord(
        Long id,
        long propertyId,
        RecordType recordType,
        String externalKey,
        int taxYear,
        String recordSubtype,
        LocalDate eventDate,
        SignalDetails details,
        Instant createdAt
) {
    public SignalRecord {
        Objects.requireNonNull(recordType, "recordType is required");
        Objects.requireNonNull(externalKey, "externalKey is required");
        Objects.requireNonNull(details, "details is required");
        externalKey = externalKey.trim();
        if (externalKey.isEmpty()) {
            throw new IllegalArgumentException("externalKey must not be blank");
        }
        if (!recordType.getDetailsType().isInstance(details)) {
            throw new IllegalArgumentException("Record type " + recordType + " cannot carry "
                    + details.getClass().getSimpleName());
        }
        createdAt = createdAt != null ? createdAt : Instant.now();
    }

    /**
     * Creates an unsaved record.
     */
    public static SignalRecord of(long propertyId, RecordType recordType, String externalKey,
                                  int taxYear, String recordSubtype, LocalDate eventDate,
                                  SignalDetails details) {
        return new SignalRecord(null, propertyId, recordType, externalKey, taxYear,
                recordSubtype, eventDate, details, null);
    }

    public SignalRecord withId(long newId) {
        return new SignalRecord(newId, propertyId, recordType, externalKey, taxYear,
                recordSubtype, eventDate, details, createdAt);
    }

    /**
     * Key under which duplicates are detected.
     */
    public String identityKey() {
        return recordType.name() + "|" + externalKey + "|" + taxYear;
    }
}
