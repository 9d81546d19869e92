package dev.mars.journal.runtime;

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

import dev.mars.journal.api.ChainVerification;
import dev.mars.journal.api.ChainVerifier;
import dev.mars.journal.api.EventStore;
import dev.mars.journal.api.RefStore;
import dev.mars.journal.api.codec.EventCodec;
import dev.mars.journal.db.JournalManager;
import dev.mars.journal.db.config.JournalConfiguration;
import dev.mars.journal.db.store.PgJournalStore;
import dev.mars.journal.memory.InMemoryEventStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.vertx.sqlclient.Pool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point for obtaining a journal backed by either the in-memory store or PostgreSQL.
 *
 * <pre>{@code
 * // Tests and single-process tools
 * try (JournalRepository journal = JournalRepository.createInMemory()) {
 *     journal.eventStore().commit("order-1", event, Hash.ZERO);
 * }
 *
 * // Production
 * JournalRepository journal = JournalRepository.createPersistent(
 *     new JournalConfiguration("production"), codec);
 * }</pre>
 *
 * The event store and the ref store handed out by one repository always share the
 * same head pointers, so a ref read through {@link #refStore()} reflects commits made
 * through {@link #eventStore()}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public final class JournalRepository implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(JournalRepository.class);

    private final EventStore eventStore;
    private final RefStore refStore;
    private final AutoCloseable owned;

    private JournalRepository(EventStore eventStore, RefStore refStore, AutoCloseable owned) {
        this.eventStore = eventStore;
        this.refStore = refStore;
        this.owned = owned;
    }

    /**
     * Creates a repository whose events live only for the lifetime of this JVM.
     */
    public static JournalRepository createInMemory() {
        InMemoryEventStore store = new InMemoryEventStore();
        logger.info("Created in-memory journal");
        return new JournalRepository(store, store.getRefStore(), null);
    }

    /**
     * Creates a repository on a PostgreSQL database described by the configuration.
     * The connection pool and, when needed, the Vert.x instance are created here and
     * released by {@link #close()}. Blocks until the database is reachable and the
     * schema is in place.
     *
     * @param configuration database, pool and metrics settings
     * @param codec codec used to store and rebuild event payloads
     * @return a started repository
     */
    public static JournalRepository createPersistent(JournalConfiguration configuration, EventCodec codec) {
        return createPersistent(configuration, codec, new SimpleMeterRegistry());
    }

    public static JournalRepository createPersistent(JournalConfiguration configuration, EventCodec codec,
                                                     MeterRegistry meterRegistry) {
        Objects.requireNonNull(configuration, "configuration cannot be null");
        Objects.requireNonNull(codec, "codec cannot be null");
        Objects.requireNonNull(meterRegistry, "meterRegistry cannot be null");

        JournalManager manager = new JournalManager(configuration, meterRegistry);
        try {
            manager.start();
            PgJournalStore store = manager.createStore(codec);
            logger.info("Created persistent journal for profile '{}'", configuration.getProfile());
            return new JournalRepository(store, store, manager);
        } catch (RuntimeException e) {
            logger.error("Failed to create persistent journal for profile '{}': {}",
                    configuration.getProfile(), e.getMessage());
            manager.close();
            throw e;
        }
    }

    /**
     * Creates a repository on a pool the caller already manages. The schema must exist;
     * closing the repository leaves the pool open.
     */
    public static JournalRepository createWithPool(Pool pool, EventCodec codec) {
        Objects.requireNonNull(pool, "pool cannot be null");
        Objects.requireNonNull(codec, "codec cannot be null");
        PgJournalStore store = new PgJournalStore(pool, codec);
        logger.info("Created journal on caller-managed pool");
        return new JournalRepository(store, store, null);
    }

    public EventStore eventStore() {
        return eventStore;
    }

    public RefStore refStore() {
        return refStore;
    }

    /**
     * Walks the history of an aggregate and checks each parent link as well as the
     * stored head reference. A commit racing with verification can be reported as a
     * ref mismatch.
     *
     * @param aggregateId the aggregate to verify
     * @return the verification outcome; an unknown aggregate verifies as an empty valid chain
     */
    public CompletableFuture<ChainVerification> verify(String aggregateId) {
        Objects.requireNonNull(aggregateId, "aggregateId cannot be null");
        return refStore.read(aggregateId).thenCompose(ref ->
                eventStore.history(aggregateId).thenApply(history -> {
                    ChainVerification result = ChainVerifier.verify(aggregateId, history, ref.orElse(null));
                    if (!result.isValid()) {
                        logger.warn("Chain for aggregate {} is broken at index {}: {}",
                                aggregateId, result.getBrokenAt(), result.getReason().orElse(""));
                    }
                    return result;
                }));
    }

    @Override
    public void close() {
        eventStore.close();
        if (owned != null) {
            try {
                owned.close();
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new IllegalStateException("Failed to release journal resources", e);
            }
        }
        logger.debug("Journal repository closed");
    }
}
