package dev.mars.journal.api.codec;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.mars.journal.api.Event;
import dev.mars.journal.api.JournalErrorCodes;

import java.util.Objects;

/**
 * {@link EventCodec} that stores events as JSON.
 *
 * The payload is the JSON form of the concrete event class. The type discriminator is
 * stored alongside the payload and resolved through an {@link EventTypeRegistry} on decode.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public class JacksonEventCodec implements EventCodec {

    private final ObjectMapper objectMapper;
    private final EventTypeRegistry registry;

    public JacksonEventCodec(EventTypeRegistry registry) {
        this(registry, createDefaultObjectMapper());
    }

    public JacksonEventCodec(EventTypeRegistry registry, ObjectMapper objectMapper) {
        this.registry = Objects.requireNonNull(registry, "Event type registry cannot be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "Object mapper cannot be null");
    }

    /**
     * Creates the mapper used when none is supplied. Unknown properties are ignored so that
     * payloads written by newer event classes still decode.
     */
    public static ObjectMapper createDefaultObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Override
    public String encode(Event event) {
        Objects.requireNonNull(event, "Event cannot be null");
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new EventCodecException(JournalErrorCodes.ENCODE_FAILED,
                "Failed to encode event " + event.getId() + " of type " + event.getType(), e);
        }
    }

    @Override
    public Event decode(String type, String payload) {
        Class<? extends Event> eventClass = registry.resolve(type)
            .orElseThrow(() -> new EventCodecException(JournalErrorCodes.UNKNOWN_EVENT_TYPE,
                "No event class registered for type '" + type + "'"));
        if (payload == null) {
            throw new EventCodecException(JournalErrorCodes.DECODE_FAILED, "Payload cannot be null");
        }
        try {
            return objectMapper.readValue(payload, eventClass);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new EventCodecException(JournalErrorCodes.DECODE_FAILED,
                "Failed to decode event of type '" + type + "' as " + eventClass.getSimpleName(), e);
        }
    }

    public EventTypeRegistry getRegistry() {
        return registry;
    }
}
