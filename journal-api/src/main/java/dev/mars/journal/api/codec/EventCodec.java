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

/**
 * Converts events to and from their stored text form.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public interface EventCodec {

    /**
     * Encodes an event as a self-contained payload.
     *
     * @throws EventCodecException if the event cannot be serialized
     */
    String encode(Event event);

    /**
     * Decodes a payload previously produced by {@link #encode(Event)}.
     *
     * @param type the stored event type, used to select the target class
     * @param payload the stored payload
     * @throws EventCodecException if the type is unknown or the payload is malformed
     */
    Event decode(String type, String payload);
}
