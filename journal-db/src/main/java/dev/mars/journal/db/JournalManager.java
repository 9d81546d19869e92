package dev.mars.journal.db;

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

import dev.mars.journal.api.codec.EventCodec;
import dev.mars.journal.db.config.JournalConfiguration;
import dev.mars.journal.db.connection.PgPoolFactory;
import dev.mars.journal.db.metrics.JournalMetrics;
import dev.mars.journal.db.setup.JournalSchemaInitializer;
import dev.mars.journal.db.store.PgJournalStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.sqlclient.Pool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Owns the infrastructure behind PostgreSQL journal stores.
 *
 * <p>Creates (or borrows) the Vert.x instance, builds the pool from configuration, binds metrics
 * and creates the schema on start when {@code journal.schema.auto-create} is set. Stores created
 * through {@link #createStore(EventCodec)} share the pool. Closing the manager closes the stores,
 * then the pool, then the Vert.x instance if the manager created it.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public class JournalManager implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(JournalManager.class);

    private static final Duration BLOCKING_TIMEOUT = Duration.ofSeconds(30);

    private final JournalConfiguration configuration;
    private final Vertx vertx;
    private final boolean vertxOwnedByManager;
    private final MeterRegistry meterRegistry;
    private final Pool pool;
    private final JournalMetrics metrics;
    private final List<PgJournalStore> stores = new CopyOnWriteArrayList<>();
    private volatile boolean started = false;
    private volatile boolean closed = false;

    public JournalManager(JournalConfiguration configuration) {
        this(configuration, new SimpleMeterRegistry(), null);
    }

    public JournalManager(JournalConfiguration configuration, MeterRegistry meterRegistry) {
        this(configuration, meterRegistry, null);
    }

    /**
     * @param vertx an application Vert.x instance to reuse, or null to create one owned by the manager
     */
    public JournalManager(JournalConfiguration configuration, MeterRegistry meterRegistry, Vertx vertx) {
        this.configuration = Objects.requireNonNull(configuration, "Configuration cannot be null");
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "Meter registry cannot be null");

        logger.info("Initializing journal manager with profile: {}", configuration.getProfile());

        if (vertx != null) {
            this.vertx = vertx;
            this.vertxOwnedByManager = false;
            logger.info("Using provided Vert.x instance (external ownership)");
        } else {
            this.vertx = Vertx.vertx();
            this.vertxOwnedByManager = true;
            logger.info("Created new Vert.x instance (manager ownership)");
        }

        this.pool = new PgPoolFactory(this.vertx, meterRegistry)
            .createPool(configuration.getDatabaseConfig(), configuration.getPoolConfig());

        JournalConfiguration.MetricsConfig metricsConfig = configuration.getMetricsConfig();
        this.metrics = new JournalMetrics(metricsConfig.getInstanceId());
        if (metricsConfig.isEnabled()) {
            metrics.bindTo(meterRegistry);
        }
    }

    /**
     * Verifies connectivity and creates the schema when configured to.
     */
    public Future<Void> startReactive() {
        if (closed) {
            return Future.failedFuture(new IllegalStateException("Journal manager is closed"));
        }
        if (started) {
            logger.warn("Journal manager is already started");
            return Future.succeededFuture();
        }

        logger.info("Starting journal manager");
        return pool.query("SELECT 1").execute()
            .compose(v -> {
                if (!configuration.isSchemaAutoCreate()) {
                    logger.info("Schema auto-create disabled, expecting existing journal tables");
                    return Future.<Void>succeededFuture();
                }
                return new JournalSchemaInitializer(pool, configuration.getDatabaseConfig().getSchema())
                    .initializeSchema();
            })
            .onSuccess(v -> {
                started = true;
                logger.info("Journal manager started successfully");
            })
            .onFailure(e -> logger.error("Failed to start journal manager: {}", e.getMessage(), e));
    }

    /**
     * Blocking variant of {@link #startReactive()}. Must not be called on an event loop thread.
     */
    public void start() {
        if (Vertx.currentContext() != null && Vertx.currentContext().isEventLoopContext()) {
            throw new IllegalStateException("Do not call blocking start() on event-loop thread - use startReactive() instead");
        }
        ReactiveUtils.await(startReactive(), BLOCKING_TIMEOUT);
    }

    /**
     * Creates a store on the shared pool. The store is closed together with the manager.
     */
    public PgJournalStore createStore(EventCodec codec) {
        if (closed) {
            throw new IllegalStateException("Journal manager is closed");
        }
        PgJournalStore store = new PgJournalStore(pool, codec, metrics);
        stores.add(store);
        return store;
    }

    public Future<Void> closeReactive() {
        if (closed) {
            return Future.succeededFuture();
        }
        closed = true;
        logger.info("Closing journal manager");

        stores.forEach(PgJournalStore::close);
        stores.clear();

        return pool.close()
            .onSuccess(v -> logger.info("Journal pool closed"))
            .recover(e -> {
                logger.warn("Error closing journal pool: {}", e.getMessage());
                return Future.succeededFuture();
            })
            .compose(v -> {
                if (vertxOwnedByManager) {
                    logger.info("Closing Vert.x instance (manager-owned)");
                    return vertx.close();
                }
                logger.debug("Skipping Vert.x close (external ownership)");
                return Future.<Void>succeededFuture();
            })
            .onSuccess(v -> logger.info("Journal manager closed"));
    }

    /**
     * Blocking close. On an event loop thread the close is started without waiting.
     */
    @Override
    public void close() {
        if (Vertx.currentContext() != null && Vertx.currentContext().isEventLoopContext()) {
            logger.warn("Blocking close() called on event loop thread, closing asynchronously");
            closeReactive();
            return;
        }
        ReactiveUtils.await(closeReactive(), BLOCKING_TIMEOUT);
    }

    public JournalConfiguration getConfiguration() { return configuration; }
    public Vertx getVertx() { return vertx; }
    public Pool getPool() { return pool; }
    public MeterRegistry getMeterRegistry() { return meterRegistry; }
    public JournalMetrics getMetrics() { return metrics; }
    public boolean isStarted() { return started; }
}
