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

import java.util.Objects;
import java.util.Optional;

/**
 * Query descriptor for the events of one aggregate.
 *
 * The aggregate id is required. Event type and the inclusive timestamp bounds are optional.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public final class EventFilter {

    private final String aggregateId;
    private final String type;
    private final Long start;
    private final Long end;

    private EventFilter(Builder builder) {
        this.aggregateId = Objects.requireNonNull(builder.aggregateId, "Aggregate ID cannot be null");
        this.type = builder.type;
        this.start = builder.start;
        this.end = builder.end;
    }

    public static Builder builder(String aggregateId) {
        return new Builder(aggregateId);
    }

    /**
     * Creates a filter for every event of an aggregate.
     */
    public static EventFilter forAggregate(String aggregateId) {
        return builder(aggregateId).build();
    }

    public String getAggregateId() {
        return aggregateId;
    }

    public Optional<String> getType() {
        return Optional.ofNullable(type);
    }

    public Optional<Long> getStart() {
        return Optional.ofNullable(start);
    }

    public Optional<Long> getEnd() {
        return Optional.ofNullable(end);
    }

    /**
     * Evaluates this filter against an event in memory.
     */
    public boolean matches(Event event) {
        if (!aggregateId.equals(event.getAggregateId())) {
            return false;
        }
        if (type != null && !type.equals(event.getType())) {
            return false;
        }
        if (start != null && event.getTimestamp() < start) {
            return false;
        }
        return end == null || event.getTimestamp() <= end;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EventFilter that = (EventFilter) o;
        return aggregateId.equals(that.aggregateId) &&
               Objects.equals(type, that.type) &&
               Objects.equals(start, that.start) &&
               Objects.equals(end, that.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(aggregateId, type, start, end);
    }

    @Override
    public String toString() {
        return "EventFilter{" +
                "aggregateId='" + aggregateId + '\'' +
                ", type=" + type +
                ", start=" + start +
                ", end=" + end +
                '}';
    }

    public static final class Builder {
        private final String aggregateId;
        private String type;
        private Long start;
        private Long end;

        private Builder(String aggregateId) {
            this.aggregateId = aggregateId;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        /** Inclusive lower timestamp bound. */
        public Builder start(long start) {
            this.start = start;
            return this;
        }

        /** Inclusive upper timestamp bound. */
        public Builder end(long end) {
            this.end = end;
            return this;
        }

        public Builder between(long start, long end) {
            return start(start).end(end);
        }

        public EventFilter build() {
            if (start != null && end != null && start > end) {
                throw new IllegalArgumentException("Start " + start + " is after end " + end);
            }
            return new EventFilter(this);
        }
    }
}
