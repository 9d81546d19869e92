package dev.mars.journal.api;

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

import dev.mars.journal.api.codec.EventHasher;

/**
 * An immutable fact recorded against an aggregate.
 *
 * Events of one aggregate form a singly linked chain: {@link #getCurrentVersion()} is the
 * hash of the event this one follows, or {@code null} for the first event. The hash of an
 * event is derived from its own content, so altering a committed event breaks every later link.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public interface Event {

    /** Unique identifier of this event. */
    String getId();

    /** Identifier of the aggregate this event belongs to. */
    String getAggregateId();

    /** Logical or wall clock time of the event. Not guaranteed to be strictly increasing. */
    long getTimestamp();

    /** Hash of the preceding event of the aggregate, or {@code null} for the first event. */
    Hash getCurrentVersion();

    /** Discriminator used for filtering and polymorphic decoding. */
    String getType();

    /**
     * Content hash of this event. Two events with identical fields hash identically.
     * The default implementation hashes the canonical JSON form of the event.
     */
    default Hash hash() {
        return EventHasher.getDefault().hash(this);
    }
}
