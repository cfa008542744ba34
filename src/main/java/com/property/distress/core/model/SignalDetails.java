package com.property.distress.core.model;

/**
 * Typed, per-record-type payload of a {@link SignalRecord}.
 * {@link RecordType#getDetailsType()} fixes which variant each record type carries.
 */
public interface SignalDetails {
}
