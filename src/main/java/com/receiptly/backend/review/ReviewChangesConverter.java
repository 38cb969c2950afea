package com.receiptly.backend.review;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import lombok.extern.slf4j.Slf4j;

/**
 * Stores review changes as a JSON array of {@code {field, before, after}} objects.
 */
@Converter
@Slf4j
public class ReviewChangesConverter implements AttributeConverter<List<FieldChange>, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private static final TypeReference<List<FieldChange>> TYPE = new TypeReference<>() {};

    @Override
    public String convertToDatabaseColumn(List<FieldChange> changes) {
        if (changes == null || changes.isEmpty()) return null;
        try {
            return MAPPER.writeValueAsString(changes);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize review changes", e);
        }
    }

    @Override
    public List<FieldChange> convertToEntityAttribute(String json) {
        if (json == null || json.isBlank()) return new ArrayList<>();
        try {
            return new ArrayList<>(MAPPER.readValue(json, TYPE));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            // malformed history reads as "no changes"
            log.warn("[ReviewChanges] Ignoring unreadable review_changes: {}", e.getMessage());
            return new ArrayList<>();
        }
    }
}
