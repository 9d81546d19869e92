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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * General purpose event with a free-form data body.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public final class SimpleEvent implements Event {

    private final String id;
    private final String aggregateId;
    private final long timestamp;
    private final Hash currentVersion;
    private final String type;
    private final Map<String, Object> data;

    @JsonCreator
    public SimpleEvent(@JsonProperty("id") String id,
                       @JsonProperty("aggregateId") String aggregateId,
                       @JsonProperty("timestamp") long timestamp,
                       @JsonProperty("currentVersion") Hash currentVersion,
                       @JsonProperty("type") String type,
                       @JsonProperty("data") Map<String, Object> data) {
        this.id = Objects.requireNonNull(id, "Event ID cannot be null");
        this.aggregateId = Objects.requireNonNull(aggregateId, "Aggregate ID cannot be null");
        this.timestamp = timestamp;
        this.currentVersion = currentVersion;
        this.type = Objects.requireNonNull(type, "Event type cannot be null");
        this.data = data != null ? Collections.unmodifiableMap(new LinkedHashMap<>(data)) : Map.of();
    }

    @Override
    public String getId() { return id; }

    @Override
    public String getAggregateId() { return aggregateId; }

    @Override
    public long getTimestamp() { return timestamp; }

    @Override
    public Hash getCurrentVersion() { return currentVersion; }

    @Override
    public String getType() { return type; }

    public Map<String, Object> getData() { return data; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SimpleEvent that = (SimpleEvent) o;
        return timestamp == that.timestamp &&
               id.equals(that.id) &&
               aggregateId.equals(that.aggregateId) &&
               Objects.equals(currentVersion, that.currentVersion) &&
               type.equals(that.type) &&
               data.equals(that.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, aggregateId, timestamp, currentVersion, type, data);
    }

    @Override
    public String toString() {
        return "SimpleEvent{" +
                "id='" + id + '\'' +
                ", aggregateId='" + aggregateId + '\'' +
                ", timestamp=" + timestamp +
                ", currentVersion=" + currentVersion +
                ", type='" + type + '\'' +
                ", data=" + data +
                '}';
    }
}
