package dev.mars.journal.db.connection;

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

import dev.mars.journal.db.config.JournalConfiguration.DatabaseConfig;
import dev.mars.journal.db.config.JournalConfiguration.PoolConfig;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.vertx.core.Vertx;
import io.vertx.pgclient.PgBuilder;
import io.vertx.pgclient.PgConnectOptions;
import io.vertx.pgclient.SslMode;
import io.vertx.sqlclient.Pool;
import io.vertx.sqlclient.PoolOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Creates Vert.x reactive PostgreSQL pools from journal configuration.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public class PgPoolFactory {

    private static final Logger logger = LoggerFactory.getLogger(PgPoolFactory.class);

    static final String APPLICATION_NAME = "journal";

    private final Vertx vertx;
    private final MeterRegistry meterRegistry;

    public PgPoolFactory(Vertx vertx) {
        this(vertx, null);
    }

    /**
     * @param meterRegistry registry for pool lifecycle counters, may be null
     */
    public PgPoolFactory(Vertx vertx, MeterRegistry meterRegistry) {
        this.vertx = Objects.requireNonNull(vertx, "Vertx cannot be null");
        this.meterRegistry = meterRegistry;
    }

    /**
     * Builds a pool using {@link PgBuilder}. Connections are opened lazily on first use.
     */
    public Pool createPool(DatabaseConfig connectionConfig, PoolConfig poolConfig) {
        Objects.requireNonNull(connectionConfig, "connectionConfig");
        Objects.requireNonNull(poolConfig, "poolConfig");

        try {
            Pool pool = PgBuilder.pool()
                .with(toPoolOptions(poolConfig))
                .connectingTo(toConnectOptions(connectionConfig))
                .using(vertx)
                .build();

            logger.info("Created Vert.x reactive pool with host: {}, database: {}, maxSize: {}",
                connectionConfig.getHost(), connectionConfig.getDatabase(), poolConfig.getMaxSize());
            increment("journal.db.pool.created");
            return pool;
        } catch (RuntimeException e) {
            logger.error("Failed to create pool for {}: {}", connectionConfig.getDatabase(), e.getMessage());
            increment("journal.db.pool.create.failed");
            throw e;
        }
    }

    /**
     * The schema, when set, becomes the session's search_path so the store's unqualified table
     * names resolve to it. {@link DatabaseConfig} has already checked it is a plain identifier.
     */
    static PgConnectOptions toConnectOptions(DatabaseConfig config) {
        PgConnectOptions connectOptions = new PgConnectOptions()
            .setHost(config.getHost())
            .setPort(config.getPort())
            .setDatabase(config.getDatabase())
            .setUser(config.getUsername())
            .setPassword(config.getPassword())
            .setSslMode(config.isSslEnabled() ? SslMode.REQUIRE : SslMode.DISABLE);

        connectOptions.addProperty("application_name", APPLICATION_NAME);
        if (config.getSchema() != null) {
            connectOptions.addProperty("search_path", config.getSchema());
        }
        return connectOptions;
    }

    static PoolOptions toPoolOptions(PoolConfig poolConfig) {
        return new PoolOptions()
            .setMaxSize(poolConfig.getMaxSize())
            .setMaxWaitQueueSize(poolConfig.getMaxWaitQueueSize())
            .setConnectionTimeout(toMillis(poolConfig.getConnectionTimeout()))
            .setConnectionTimeoutUnit(TimeUnit.MILLISECONDS)
            .setIdleTimeout(toMillis(poolConfig.getIdleTimeout()))
            .setIdleTimeoutUnit(TimeUnit.MILLISECONDS)
            .setShared(poolConfig.isShared())
            .setName("journal-pool");
    }

    private static int toMillis(Duration duration) {
        return (int) Math.min(duration.toMillis(), Integer.MAX_VALUE);
    }

    private void increment(String name) {
        if (meterRegistry != null) {
            Counter.builder(name).register(meterRegistry).increment();
        }
    }
}
