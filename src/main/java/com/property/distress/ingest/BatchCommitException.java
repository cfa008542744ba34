package com.property.distress.ingest;

/**
 * A batch could not be committed. Earlier batches stay persisted; {@link #getPartialResult()}
 * reports what was committed before the failure.
 */
public class BatchCommitException extends RuntimeException {

    private final transient IngestionResult partialResult;

    public BatchCommitException(String message, IngestionResult partialResult, Throwable cause) {
        super(message, cause);
        this.partialResult = partialResult;
    }

    public IngestionResult getPartialResult() {
        return partialResult;
    }
}
