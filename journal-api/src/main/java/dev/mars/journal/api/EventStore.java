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
import java.util.concurrent.CompletableFuture;
import java.util.stream.Stream;

/**
 * Append-only, content-addressed event store with optimistic concurrency control.
 *
 * A commit succeeds only when the caller's expected version equals the aggregate's ref
 * (or the zero hash for an aggregate without events). The event is appended and the ref
 * advanced to the event's hash as one atomic step; a commit that loses the race leaves
 * no trace in the log.
 *
 * Queries read the log directly and never consult refs.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public interface EventStore extends AutoCloseable {

    /**
     * Commits an event to an aggregate.
     *
     * @param aggregateId the aggregate, must not be empty and must match the event's aggregate id
     * @param event the event to append; its current version must link to {@code expectedVersion}
     * @param expectedVersion the caller's view of the aggregate head, {@link Hash#ZERO} for a new aggregate
     * @return a future with the event's hash, the new version of the aggregate, or failing with
     *         {@link ConcurrencyException} if the expected version is stale
     * @throws IllegalArgumentException if the arguments are inconsistent
     */
    CompletableFuture<Hash> commit(String aggregateId, Event event, Hash expectedVersion);

    /**
     * Returns the events matching a filter, ordered by ascending timestamp and then by commit order.
     * Stored records that cannot be decoded are skipped.
     */
    CompletableFuture<List<Event>> events(EventFilter filter);

    /**
     * Returns every event of an aggregate in timestamp order.
     */
    default CompletableFuture<List<Event>> events(String aggregateId) {
        return events(EventFilter.forAggregate(aggregateId));
    }

    /**
     * Returns the events of an aggregate in commit order, which is the order of the hash chain.
     */
    CompletableFuture<List<Event>> history(String aggregateId);

    /**
     * Returns every committed event across all aggregates ordered by ascending timestamp.
     * The stream is lazy and can be consumed once; call again to re-read the store.
     */
    CompletableFuture<Stream<Event>> getAllEvents();

    /**
     * Closes the store. Operations invoked afterwards fail with {@link IllegalStateException}.
     */
    @Override
    void close();
}
