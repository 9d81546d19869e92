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

/**
 * Signals that an expected version did not match the stored ref.
 *
 * Covers stale versions, creating over an existing ref, updating a missing ref and
 * starting a new aggregate from a non-zero version. The journal never retries; callers
 * re-read the ref and try again if they want to proceed.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public class ConcurrencyException extends JournalException {

    private final String aggregateId;

    public ConcurrencyException(String aggregateId, String message) {
        this(JournalErrorCodes.CONCURRENCY_CONFLICT, aggregateId, message);
    }

    public ConcurrencyException(String code, String aggregateId, String message) {
        super(code, message);
        this.aggregateId = aggregateId;
    }

    public static ConcurrencyException versionMismatch(String aggregateId, Hash expected, Hash actual) {
        return new ConcurrencyException(JournalErrorCodes.CONCURRENCY_CONFLICT, aggregateId,
            "Concurrency conflict on '" + aggregateId + "': expected version " + expected +
            ", but current version is " + actual);
    }

    public static ConcurrencyException refExists(String aggregateId, Hash actual) {
        return new ConcurrencyException(JournalErrorCodes.REF_ALREADY_EXISTS, aggregateId,
            "Concurrency conflict on '" + aggregateId + "': expected no ref, but found " + actual);
    }

    public static ConcurrencyException refMissing(String aggregateId, Hash expected) {
        return new ConcurrencyException(JournalErrorCodes.REF_NOT_FOUND, aggregateId,
            "Concurrency conflict on '" + aggregateId + "': expected version " + expected +
            ", but no ref exists");
    }

    public String getAggregateId() {
        return aggregateId;
    }
}
