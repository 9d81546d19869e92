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
 * Outcome of walking the hash chain of an aggregate.
 *
 * @see ChainVerifier
 */
public final class ChainVerification {

    private final String aggregateId;
    private final boolean valid;
    private final int length;
    private final Hash head;
    private final int brokenAt;
    private final String reason;

    private ChainVerification(String aggregateId, boolean valid, int length, Hash head, int brokenAt, String reason) {
        this.aggregateId = aggregateId;
        this.valid = valid;
        this.length = length;
        this.head = head;
        this.brokenAt = brokenAt;
        this.reason = reason;
    }

    static ChainVerification valid(String aggregateId, int length, Hash head) {
        return new ChainVerification(aggregateId, true, length, head, -1, null);
    }

    static ChainVerification broken(String aggregateId, int length, Hash head, int brokenAt, String reason) {
        return new ChainVerification(aggregateId, false, length, head, brokenAt, reason);
    }

    public String getAggregateId() {
        return aggregateId;
    }

    public boolean isValid() {
        return valid;
    }

    /** Number of events examined. */
    public int getLength() {
        return length;
    }

    /** Hash of the last event of the chain, {@link Hash#ZERO} for an empty chain. */
    public Hash getHead() {
        return head;
    }

    /** Index of the first offending event, or -1 for a valid chain. */
    public int getBrokenAt() {
        return brokenAt;
    }

    public Optional<String> getReason() {
        return Optional.ofNullable(reason);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ChainVerification that = (ChainVerification) o;
        return valid == that.valid && length == that.length && brokenAt == that.brokenAt &&
               aggregateId.equals(that.aggregateId) && head.equals(that.head) &&
               Objects.equals(reason, that.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(aggregateId, valid, length, head, brokenAt, reason);
    }

    @Override
    public String toString() {
        return "ChainVerification{" +
                "aggregateId='" + aggregateId + '\'' +
                ", valid=" + valid +
                ", length=" + length +
                ", head=" + head +
                (valid ? "" : ", brokenAt=" + brokenAt + ", reason='" + reason + '\'') +
                '}';
    }
}
