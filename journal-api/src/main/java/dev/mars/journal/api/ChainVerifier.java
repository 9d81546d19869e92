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

import java.util.List;
import java.util.Objects;

/**
 * Checks the integrity of an aggregate's hash chain.
 *
 * A chain is valid when the first event has no predecessor, every later event names the
 * hash of the event before it, every event belongs to the aggregate, and the last hash
 * equals the aggregate's ref when one is supplied.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public final class ChainVerifier {

    private ChainVerifier() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Verifies events given in commit order.
     */
    public static ChainVerification verify(String aggregateId, List<? extends Event> history) {
        return verify(aggregateId, history, null);
    }

    /**
     * Verifies events given in commit order against the aggregate's current ref.
     *
     * @param ref the stored ref, or {@code null} to skip the head check
     */
    public static ChainVerification verify(String aggregateId, List<? extends Event> history, Hash ref) {
        Objects.requireNonNull(aggregateId, "Aggregate ID cannot be null");
        Objects.requireNonNull(history, "History cannot be null");

        Hash previous = Hash.ZERO;
        for (int i = 0; i < history.size(); i++) {
            Event event = history.get(i);
            if (!aggregateId.equals(event.getAggregateId())) {
                return ChainVerification.broken(aggregateId, history.size(), previous, i,
                    "event " + event.getId() + " belongs to aggregate " + event.getAggregateId());
            }
            Hash link = event.getCurrentVersion() != null ? event.getCurrentVersion() : Hash.ZERO;
            if (!link.equals(previous)) {
                return ChainVerification.broken(aggregateId, history.size(), previous, i,
                    "event " + event.getId() + " links to " + link + " but predecessor is " + previous);
            }
            previous = event.hash();
        }

        if (ref != null && !ref.equals(previous)) {
            return ChainVerification.broken(aggregateId, history.size(), previous, history.size(),
                "ref " + ref + " does not match chain head " + previous);
        }
        return ChainVerification.valid(aggregateId, history.size(), previous);
    }
}
