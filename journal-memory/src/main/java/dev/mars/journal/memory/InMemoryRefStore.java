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
import dev.mars.journal.api.Hash;
import dev.mars.journal.api.RefStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-process {@link RefStore} holding one atomic cell per aggregate.
 *
 * Creating a ref races through {@link ConcurrentMap#putIfAbsent}; updating it races through
 * {@link AtomicReference#compareAndSet} on the aggregate's own cell, so swaps on different
 * aggregates never contend with each other. All futures are already complete when returned.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public class InMemoryRefStore implements RefStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryRefStore.class);

    private final ConcurrentMap<String, AtomicReference<Hash>> refs = new ConcurrentHashMap<>();

    @Override
    public CompletableFuture<Void> swap(String aggregateId, Hash newRef, Hash oldRef) {
        requireAggregateId(aggregateId);
        Objects.requireNonNull(newRef, "New ref cannot be null");
        try {
            swapNow(aggregateId, newRef, oldRef);
            return CompletableFuture.completedFuture(null);
        } catch (ConcurrencyException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    @Override
    public CompletableFuture<Optional<Hash>> read(String aggregateId) {
        return CompletableFuture.completedFuture(current(aggregateId));
    }

    /**
     * Performs the swap on the calling thread.
     *
     * @throws ConcurrencyException if the stored ref does not match {@code oldRef}
     */
    void swapNow(String aggregateId, Hash newRef, Hash oldRef) {
        if (newRef.equals(oldRef)) {
            return;
        }

        if (oldRef == null) {
            AtomicReference<Hash> existing = refs.putIfAbsent(aggregateId, new AtomicReference<>(newRef));
            if (existing != null) {
                throw ConcurrencyException.refExists(aggregateId, existing.get());
            }
            logger.debug("Created ref for aggregate {} at {}", aggregateId, newRef);
            return;
        }

        AtomicReference<Hash> cell = refs.get(aggregateId);
        if (cell == null) {
            throw ConcurrencyException.refMissing(aggregateId, oldRef);
        }
        // compareAndSet compares identity, so swap against the instance actually stored
        Hash current = cell.get();
        if (!oldRef.equals(current) || !cell.compareAndSet(current, newRef)) {
            throw ConcurrencyException.versionMismatch(aggregateId, oldRef, cell.get());
        }
        logger.debug("Advanced ref for aggregate {} from {} to {}", aggregateId, oldRef, newRef);
    }

    Optional<Hash> current(String aggregateId) {
        if (aggregateId == null || aggregateId.isEmpty()) {
            return Optional.empty();
        }
        AtomicReference<Hash> cell = refs.get(aggregateId);
        return cell != null ? Optional.ofNullable(cell.get()) : Optional.empty();
    }

    static void requireAggregateId(String aggregateId) {
        if (aggregateId == null || aggregateId.isEmpty()) {
            throw new IllegalArgumentException("Aggregate ID cannot be empty");
        }
    }
}
