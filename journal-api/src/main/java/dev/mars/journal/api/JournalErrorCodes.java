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
 * Standard error codes used by the journal.
 *
 * Format: JRNERR followed by a four digit number. Ranges:
 * <ul>
 *   <li>0100-0199 concurrency</li>
 *   <li>0200-0299 serialization</li>
 *   <li>0300-0399 storage</li>
 * </ul>
 */
public final class JournalErrorCodes {

    private JournalErrorCodes() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static final String CONCURRENCY_CONFLICT = "JRNERR0100";
    public static final String REF_ALREADY_EXISTS = "JRNERR0101";
    public static final String REF_NOT_FOUND = "JRNERR0102";
    public static final String DUPLICATE_EVENT = "JRNERR0103";

    public static final String ENCODE_FAILED = "JRNERR0200";
    public static final String DECODE_FAILED = "JRNERR0201";
    public static final String UNKNOWN_EVENT_TYPE = "JRNERR0202";

    public static final String STORAGE_FAILURE = "JRNERR0300";
}
