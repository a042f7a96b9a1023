package com.sync.pipeline.bus;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;

/**
 * JSON wire codec for {@link EventEnvelope}s.
 */
public class EventCodec {

    private final ObjectMapper objectMapper;

    public EventCodec() {
        this(defaultMapper());
    }

    public EventCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * The mapper configuration shared by the bus and everything serialized alongside events.
     */
    public static ObjectMapper defaultMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public byte[] encode(EventEnvelope envelope) {
        try {
            return objectMapper.writeValueAsBytes(envelope);
        } catch (JsonProcessingException e) {
            throw new EventCodecException("Failed to encode event " + envelope.getEventId(), e);
        }
    }

    public EventEnvelope decode(byte[] bytes) {
        try {
            return objectMapper.readValue(bytes, EventEnvelope.class);
        } catch (IOException e) {
            throw new EventCodecException("Failed to decode event", e);
        }
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }
}
