package com.geevly.eventsourcing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.io.IOException;

/**
 * JSON codec for event payloads.
 */
public class PayloadCodec {

    private final ObjectMapper mapper;

    public PayloadCodec(ObjectMapper mapper) {
        this.mapper = mapper.copy()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public static PayloadCodec defaultCodec() {
        return new PayloadCodec(JsonMapper.builder().findAndAddModules().build());
    }

    public byte[] encode(Object payload) {
        try {
            return mapper.writeValueAsBytes(payload);
        } catch (JsonProcessingException ex) {
            throw new PayloadSerializationException(
                "cannot encode " + payload.getClass().getSimpleName() + ": " + ex.getOriginalMessage(), ex);
        }
    }

    public <P> P decode(byte[] payload, Class<P> type) {
        try {
            return mapper.readValue(payload, type);
        } catch (IOException ex) {
            throw new PayloadSerializationException(
                "cannot decode " + type.getSimpleName() + ": " + ex.getMessage(), ex);
        }
    }

    public JsonNode tree(byte[] payload) {
        if (payload.length == 0) {
            return mapper.createObjectNode();
        }
        try {
            return mapper.readTree(payload);
        } catch (IOException ex) {
            throw new PayloadSerializationException("payload is not JSON: " + ex.getMessage(), ex);
        }
    }

    public String toJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new PayloadSerializationException("cannot write JSON: " + ex.getOriginalMessage(), ex);
        }
    }

    public <T> T fromJson(String json, Class<T> type) {
        try {
            return mapper.readValue(json, type);
        } catch (JsonProcessingException ex) {
            throw new PayloadSerializationException("cannot read JSON: " + ex.getOriginalMessage(), ex);
        }
    }

    public <T> T fromJson(String json, TypeReference<T> type) {
        try {
            return mapper.readValue(json, type);
        } catch (JsonProcessingException ex) {
            throw new PayloadSerializationException("cannot read JSON: " + ex.getOriginalMessage(), ex);
        }
    }
}
