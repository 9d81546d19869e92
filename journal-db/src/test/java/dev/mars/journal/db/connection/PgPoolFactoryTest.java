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
import dev.mars.journal.test.TestCategories;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.vertx.core.Vertx;
import io.vertx.pgclient.PgConnectOptions;
import io.vertx.pgclient.SslMode;
import io.vertx.sqlclient.Pool;
import io.vertx.sqlclient.PoolOptions;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class PgPoolFactoryTest {

    private static DatabaseConfig connection() {
        return new DatabaseConfig("db.example", 6432, "journal", "svc", "secret");
    }

    @Test
    void testConnectOptionsMapping() {
        PgConnectOptions options = PgPoolFactory.toConnectOptions(
            new DatabaseConfig("db.example", 6432, "journal", "svc", "secret", "ledger", true));

        assertEquals("db.example", options.getHost());
        assertEquals(6432, options.getPort());
        assertEquals("journal", options.getDatabase());
        assertEquals("svc", options.getUser());
        assertEquals("secret", options.getPassword());
        assertEquals(SslMode.REQUIRE, options.getSslMode());
        assertEquals("ledger", options.getProperties().get("search_path"));
        assertEquals(PgPoolFactory.APPLICATION_NAME, options.getProperties().get("application_name"));
    }

    @Test
    void testNoSearchPathWithoutSchema() {
        PgConnectOptions options = PgPoolFactory.toConnectOptions(connection());

        assertEquals(SslMode.DISABLE, options.getSslMode());
        assertFalse(options.getProperties().containsKey("search_path"));
    }

    @Test
    void testInvalidSchemaRejected() {
        assertThrows(IllegalArgumentException.class, () -> connection().withSchema("x; drop table y"));
    }

    @Test
    void testPoolOptionsMapping() {
        PoolOptions options = PgPoolFactory.toPoolOptions(
            new PoolConfig(4, 10, Duration.ofSeconds(5), Duration.ofMinutes(2), false));

        assertEquals(4, options.getMaxSize());
        assertEquals(10, options.getMaxWaitQueueSize());
        assertEquals(5000, options.getConnectionTimeout());
        assertEquals(TimeUnit.MILLISECONDS, options.getConnectionTimeoutUnit());
        assertEquals(120000, options.getIdleTimeout());
        assertEquals(TimeUnit.MILLISECONDS, options.getIdleTimeoutUnit());
        assertFalse(options.isShared());
    }

    @Test
    void testSubSecondTimeoutsKeepTheirValue() {
        PoolOptions options = PgPoolFactory.toPoolOptions(
            new PoolConfig(4, 10, Duration.ofMillis(250), Duration.ofMillis(750), false));

        assertEquals(250, options.getConnectionTimeout());
        assertEquals(750, options.getIdleTimeout());
    }

    @Test
    void testCreatePoolCountsCreation() throws Exception {
        Vertx vertx = Vertx.vertx();
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        try {
            Pool pool = new PgPoolFactory(vertx, registry)
                .createPool(connection(), PoolConfig.defaults());

            assertNotNull(pool);
            assertEquals(1.0, registry.get("journal.db.pool.created").counter().count());
            pool.close().toCompletionStage().toCompletableFuture().get(10, TimeUnit.SECONDS);
        } finally {
            vertx.close().toCompletionStage().toCompletableFuture().get(10, TimeUnit.SECONDS);
        }
    }
}
