package com.workflowtrader.mapper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.workflowtrader.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON columns and logs: order intent documents, stored decisions, and the prompt snapshot
 * written to the raw log.
 *
 * <p>Stored documents may carry fields added by a later intent version, so unknown properties
 * are ignored on read. Decimal quantities and prices are written in plain notation.
 */
public final class JsonHelper {

    private static final Logger log = LoggerFactory.getLogger(JsonHelper.class);

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .findAndAddModules()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(StreamWriteFeature.WRITE_BIGDECIMAL_AS_PLAIN)
            .build();

    private JsonHelper() {}

    /** Null in, null out. A value that cannot be written is a programming error. */
    public static String toJson(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.error("JSON write failed: type={}", value.getClass().getSimpleName(), e);
            throw new IllegalStateException("Cannot write " + value.getClass().getSimpleName() + " as JSON", e);
        }
    }

    /**
     * Reads a stored document. Blank input decodes to null.
     *
     * @throws ValidationException if the document is not valid JSON for {@code type}
     */
    public static <T> T fromJson(String json, Class<T> type) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            log.warn("Stored document unreadable: type={}, error={}", type.getSimpleName(), e.getOriginalMessage());
            throw new ValidationException("Malformed " + type.getSimpleName() + " document");
        }
    }
}
