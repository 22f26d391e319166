package com.temenos.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.temenos.error.SerializationException;

/**
 * Plaintext JSON codec for stored records. Independent of the HTTP layer's mapper so the
 * on-disk format does not move when web settings change.
 */
public class RecordJson {

    private final ObjectMapper mapper;

    public RecordJson() {
        this(defaultMapper());
    }

    public RecordJson(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public static ObjectMapper defaultMapper() {
        return JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    public String write(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }

    public String writePretty(Object value) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }

    // Jackson messages can quote the offending text, so only the type name goes into ours.
    public <T> T read(String json, Class<T> type) {
        try {
            T value = mapper.readValue(json, type);
            if (value == null) {
                throw new SerializationException("Empty JSON for " + type.getSimpleName(), null);
            }
            return value;
        } catch (JsonProcessingException e) {
            throw new SerializationException("Invalid JSON for " + type.getSimpleName(), e);
        }
    }

    public <T> T read(String json, TypeReference<T> type) {
        try {
            T value = mapper.readValue(json, type);
            if (value == null) {
                throw new SerializationException("Empty JSON for " + type.getType().getTypeName(), null);
            }
            return value;
        } catch (JsonProcessingException e) {
            throw new SerializationException("Invalid JSON for " + type.getType().getTypeName(), e);
        }
    }
}
