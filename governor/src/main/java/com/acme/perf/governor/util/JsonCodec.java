package com.acme.perf.governor.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonWriteFeature;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Single-line JSON encoding for report payloads.
 *
 * <p>Non-finite numbers are written as strings, so a NaN hit rate from a collaborator
 * still yields parseable JSON.
 */
public final class JsonCodec {
    private static final JsonMapper MAPPER = JsonMapper.builder()
        .enable(JsonWriteFeature.WRITE_NAN_AS_STRINGS)
        .disable(SerializationFeature.INDENT_OUTPUT)
        .build();

    private JsonCodec() {
    }

    public static String writeLine(Object payload) throws JsonProcessingException {
        return MAPPER.writeValueAsString(payload);
    }
}
