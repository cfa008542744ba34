package com.property.distress.ingest.handler;

import com.property.distress.core.model.RecordType;
import com.property.distress.ingest.IngestionConfigurationException;

import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Handlers keyed by the record type they process.
 */
public class RecordHandlerRegistry {

    private final Map<RecordType, RecordHandler> handlers = new EnumMap<>(RecordType.class);

    /**
     * A registry with a handler for every record type.
     */
    public static RecordHandlerRegistry defaults() {
        return new RecordHandlerRegistry()
                .register(new ViolationHandler())
                .register(new LienHandler(RecordType.LIENS))
                .register(new LienHandler(RecordType.JUDGMENTS))
                .register(new DeedHandler())
                .register(new ForeclosureHandler())
                .register(new TaxDelinquencyHandler())
                .register(new PermitHandler())
                .register(new ProbateHandler())
                .register(new EvictionHandler())
                .register(new BankruptcyHandler())
                .register(new IncidentHandler());
    }

    /**
     * Registers a handler, replacing any previous one for the same type.
     */
    public RecordHandlerRegistry register(RecordHandler handler) {
        handlers.put(handler.recordType(), handler);
        return this;
    }

    /**
     * @throws IngestionConfigurationException if no handler is registered for the type
     */
    public RecordHandler get(RecordType recordType) {
        RecordHandler handler = recordType != null ? handlers.get(recordType) : null;
        if (handler == null) {
            throw new IngestionConfigurationException("No handler registered for record type " + recordType);
        }
        return handler;
    }

    public Set<RecordType> supportedTypes() {
        return Set.copyOf(handlers.keySet());
    }
}
