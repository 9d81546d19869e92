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

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Maps an aggregate id to the hash of its most recently committed event.
 *
 * The only way to change a ref is an atomic compare-and-swap. Of any set of concurrent
 * swaps racing on the same aggregate and the same expected value exactly one succeeds;
 * the others fail with {@link ConcurrencyException}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public interface RefStore {

    /**
     * Atomically replaces the ref of an aggregate.
     *
     * <ul>
     *   <li>{@code oldRef} equal to {@code newRef}: no-op.</li>
     *   <li>{@code oldRef} null: creates the ref; fails if one already exists.</li>
     *   <li>otherwise: replaces the ref only if it currently equals {@code oldRef}.</li>
     * </ul>
     *
     * @param aggregateId the aggregate, must not be empty
     * @param newRef the new ref value
     * @param oldRef the expected current value, or {@code null} when creating
     * @return a future completing when the swap is applied, or failing with {@link ConcurrencyException}
     * @throws IllegalArgumentException if the aggregate id is empty
     */
    CompletableFuture<Void> swap(String aggregateId, Hash newRef, Hash oldRef);

    /**
     * Reads the current ref of an aggregate. Unknown and empty ids yield an empty result.
     */
    CompletableFuture<Optional<Hash>> read(String aggregateId);
}
