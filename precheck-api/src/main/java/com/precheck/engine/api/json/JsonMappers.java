package com.precheck.engine.api.json;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Factory for the ObjectMapper configuration shared by checklist loading and report output.
 */
public final class JsonMappers {

    private JsonMappers() {
    }

    /**
     * Creates a mapper that tolerates unknown properties (upstream parsers add
     * fields freely) and writes timestamps as ISO-8601 strings.
     */
    public static ObjectMapper create() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    }
}
