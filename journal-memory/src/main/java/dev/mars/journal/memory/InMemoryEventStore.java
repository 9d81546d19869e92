package dev.mars.journal.memory;

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

import dev.mars.journal.api.ConcurrencyException;
import dev.mars.journal.api.Event;
import dev.mars.journal.api.EventFilter;
import dev.mars.journal.api.EventStore;
import dev.mars.journal.api.Hash;
import dev.mars.journal.api.JournalErrorCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * In-process {@link EventStore} backed by an {@link InMemoryRefStore}.
 *
 * <p>Each aggregate owns a separate log. A commit appends to that log and swaps the ref while
 * holding the log's monitor, removing the event again if the swap loses. Readers take the same
 * monitor, so they observe either both effects of a commit or neither. Commits on different
 * aggregates lock different logs and proceed in parallel.</p>
 *
 * <p>Event ids are unique across the store. An id is claimed before the append and released
 * again when the commit is rolled back.</p>
 *
 * <p>Every committed event receives a sequence number from a store-wide counter. Queries order by
 * timestamp and fall back to that number for equal timestamps.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public class InMemoryEventStore implements EventStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryEventStore.class);

    private static final Comparator<Entry> CHRONOLOGICAL =
        Comparator.comparingLong((Entry e) -> e.event.getTimestamp()).thenComparingLong(e -> e.sequence);

    private final InMemoryRefStore refStore;
    private final ConcurrentMap<String, AggregateLog> logs = new ConcurrentHashMap<>();
    private final Set<String> eventIds = ConcurrentHashMap.newKeySet();
    private final AtomicLong sequence = new AtomicLong();
    private volatile boolean closed = false;

    public InMemoryEventStore() {
        this(new InMemoryRefStore());
    }

    public InMemoryEventStore(InMemoryRefStore refStore) {
        this.refStore = Objects.requireNonNull(refStore, "Ref store cannot be null");
        logger.info("Created in-memory event store");
    }

    public InMemoryRefStore getRefStore() {
        return refStore;
    }

    @Override
    public CompletableFuture<Hash> commit(String aggregateId, Event event, Hash expectedVersion) {
        InMemoryRefStore.requireAggregateId(aggregateId);
        Objects.requireNonNull(event, "Event cannot be null");
        Objects.requireNonNull(expectedVersion, "Expected version cannot be null");
        if (!aggregateId.equals(event.getAggregateId())) {
            throw new IllegalArgumentException("Event " + event.getId() + " belongs to aggregate '" +
                event.getAggregateId() + "', not '" + aggregateId + "'");
        }
        if (closed) {
            return CompletableFuture.failedFuture(new IllegalStateException("Event store is closed"));
        }

        try {
            return CompletableFuture.completedFuture(commitNow(aggregateId, event, expectedVersion));
        } catch (ConcurrencyException | IllegalArgumentException | CancellationException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private Hash commitNow(String aggregateId, Event event, Hash expectedVersion) {
        Optional<Hash> current = refStore.current(aggregateId);
        if (current.isPresent() && !current.get().equals(expectedVersion)) {
            throw ConcurrencyException.versionMismatch(aggregateId, expectedVersion, current.get());
        }
        if (current.isEmpty() && !expectedVersion.isZero()) {
            throw ConcurrencyException.refMissing(aggregateId, expectedVersion);
        }
        requireLinked(event, expectedVersion);

        Hash newVersion = event.hash();
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Commit of event " + event.getId() + " cancelled before append");
        }

        if (!eventIds.add(event.getId())) {
            throw new ConcurrencyException(JournalErrorCodes.DUPLICATE_EVENT, aggregateId,
                "Event " + event.getId() + " has already been committed");
        }

        AggregateLog log = logs.computeIfAbsent(aggregateId, id -> new AggregateLog());
        synchronized (log) {
            Entry entry = new Entry(sequence.incrementAndGet(), event);
            log.entries.add(entry);
            try {
                refStore.swapNow(aggregateId, newVersion, current.orElse(null));
            } catch (ConcurrencyException e) {
                log.entries.remove(log.entries.size() - 1);
                eventIds.remove(event.getId());
                logger.debug("Commit of event {} lost the race on aggregate {}", event.getId(), aggregateId);
                throw e;
            }
        }

        logger.debug("Committed event {} to aggregate {} at version {}", event.getId(), aggregateId, newVersion);
        return newVersion;
    }

    static void requireLinked(Event event, Hash expectedVersion) {
        Hash parent = event.getCurrentVersion() != null ? event.getCurrentVersion() : Hash.ZERO;
        if (!parent.equals(expectedVersion)) {
            throw new IllegalArgumentException("Event " + event.getId() + " follows " + parent +
                " but was committed at expected version " + expectedVersion);
        }
    }

    @Override
    public CompletableFuture<List<Event>> events(EventFilter filter) {
        Objects.requireNonNull(filter, "Filter cannot be null");
        if (closed) {
            return CompletableFuture.failedFuture(new IllegalStateException("Event store is closed"));
        }
        List<Event> result = snapshot(filter.getAggregateId()).stream()
            .filter(e -> filter.matches(e.event))
            .sorted(CHRONOLOGICAL)
            .map(e -> e.event)
            .collect(Collectors.toList());
        return CompletableFuture.completedFuture(result);
    }

    @Override
    public CompletableFuture<List<Event>> history(String aggregateId) {
        Objects.requireNonNull(aggregateId, "Aggregate ID cannot be null");
        if (closed) {
            return CompletableFuture.failedFuture(new IllegalStateException("Event store is closed"));
        }
        List<Event> result = snapshot(aggregateId).stream()
            .map(e -> e.event)
            .collect(Collectors.toList());
        return CompletableFuture.completedFuture(result);
    }

    @Override
    public CompletableFuture<Stream<Event>> getAllEvents() {
        if (closed) {
            return CompletableFuture.failedFuture(new IllegalStateException("Event store is closed"));
        }
        List<Entry> all = new ArrayList<>();
        for (String aggregateId : logs.keySet()) {
            all.addAll(snapshot(aggregateId));
        }
        all.sort(CHRONOLOGICAL);
        return CompletableFuture.completedFuture(all.stream().map(e -> e.event));
    }

    private List<Entry> snapshot(String aggregateId) {
        AggregateLog log = logs.get(aggregateId);
        if (log == null) {
            return List.of();
        }
        synchronized (log) {
            return new ArrayList<>(log.entries);
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        logger.info("In-memory event store closed");
    }

    private static final class AggregateLog {
        private final List<Entry> entries = new ArrayList<>();
    }

    private static final class Entry {
        private final long sequence;
        private final Event event;

        private Entry(long sequence, Event event) {
            this.sequence = sequence;
            this.event = event;
        }
    }
}
