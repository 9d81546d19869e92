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

import dev.mars.journal.api.Event;
import dev.mars.journal.api.SimpleEvent;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of the concrete event classes known for each event type discriminator.
 *
 * Thread-safe. Registrations may happen at any time, typically at startup.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public final class EventTypeRegistry {

    private final Map<String, Class<? extends Event>> types = new ConcurrentHashMap<>();
    private volatile Class<? extends Event> fallback;

    /**
     * Creates an empty registry. Unknown types fail to decode.
     */
    public EventTypeRegistry() {
    }

    /**
     * Creates a registry that decodes unregistered types as {@link SimpleEvent}.
     */
    public static EventTypeRegistry withSimpleEventFallback() {
        EventTypeRegistry registry = new EventTypeRegistry();
        registry.fallback(SimpleEvent.class);
        return registry;
    }

    public EventTypeRegistry register(String type, Class<? extends Event> eventClass) {
        Objects.requireNonNull(type, "Event type cannot be null");
        Objects.requireNonNull(eventClass, "Event class cannot be null");
        Class<? extends Event> previous = types.putIfAbsent(type, eventClass);
        if (previous != null && !previous.equals(eventClass)) {
            throw new IllegalStateException("Event type '" + type + "' already registered to " + previous.getName());
        }
        return this;
    }

    public EventTypeRegistry fallback(Class<? extends Event> eventClass) {
        this.fallback = eventClass;
        return this;
    }

    public Optional<Class<? extends Event>> resolve(String type) {
        Class<? extends Event> eventClass = type != null ? types.get(type) : null;
        return Optional.ofNullable(eventClass != null ? eventClass : fallback);
    }

    public Set<String> registeredTypes() {
        return Set.copyOf(types.keySet());
    }
}
