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
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.mars.journal.api.Event;
import dev.mars.journal.api.Hash;
import dev.mars.journal.api.JournalErrorCodes;

import java.util.Objects;

/**
 * Computes content hashes of events.
 *
 * The hash is the SHA-256 of a canonical JSON rendering: properties and map entries are
 * written in key order and no whitespace is emitted, so equal events always hash equally
 * regardless of field declaration or map insertion order.
 */
public final class EventHasher {

    private static final EventHasher DEFAULT = new EventHasher();

    private final ObjectMapper canonicalMapper;

    public EventHasher() {
        this.canonicalMapper = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .disable(MapperFeature.SORT_CREATOR_PROPERTIES_FIRST)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(SerializationFeature.INDENT_OUTPUT)
            .build();
    }

    public static EventHasher getDefault() {
        return DEFAULT;
    }

    public Hash hash(Event event) {
        return Hash.sha256(canonicalForm(event));
    }

    public String canonicalForm(Event event) {
        Objects.requireNonNull(event, "Event cannot be null");
        try {
            return canonicalMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new EventCodecException(JournalErrorCodes.ENCODE_FAILED,
                "Failed to compute canonical form of event " + event.getId(), e);
        }
    }
}
