package com.property.distress.ingest;

/**
 * The ingestion request itself is unusable: an unknown record type, an extract without the
 * identity column, or an unsupported dedup filter. Raised before any row is processed.
 */
public class IngestionConfigurationException extends RuntimeException {

    public IngestionConfigurationException(String message) {
        super(message);
    }
}
