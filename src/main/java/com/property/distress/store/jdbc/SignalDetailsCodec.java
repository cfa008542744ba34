package com.property.distress.store.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.property.distress.core.model.RecordType;
import com.property.distress.core.model.SignalDetails;

/**
 * Stores a {@link SignalDetails} variant as JSON text. The record type column decides
 * which variant the text is read back into, so the column never holds free-form data.
 */
public class SignalDetailsCodec {

    private final ObjectMapper objectMapper;

    public SignalDetailsCodec() {
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public String encode(SignalDetails details) {
        try {
            return objectMapper.writeValueAsString(details);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode " + details.getClass().getSimpleName(), e);
        }
    }

    public SignalDetails decode(RecordType recordType, String json) {
        try {
            return objectMapper.readValue(json, recordType.getDetailsType());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt details for record type " + recordType, e);
        }
    }
}
