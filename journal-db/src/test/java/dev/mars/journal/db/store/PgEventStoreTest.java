package dev.mars.journal.db.store;

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
import dev.mars.journal.api.EventStore;
import dev.mars.journal.api.Hash;
import dev.mars.journal.api.RefStore;
import dev.mars.journal.db.ReactiveUtils;
import dev.mars.journal.db.metrics.JournalMetrics;
import dev.mars.journal.test.EventStoreContractTest;
import dev.mars.journal.test.PostgreSQLTestConstants;
import dev.mars.journal.test.TestCategories;
import dev.mars.journal.test.TestEvent;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.vertx.sqlclient.Tuple;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

import static dev.mars.journal.test.Fixtures.await;
import static dev.mars.journal.test.Fixtures.awaitFailure;
import static dev.mars.journal.test.Fixtures.event;
import static dev.mars.journal.test.Fixtures.randomAggregateId;
import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.INTEGRATION)
@Testcontainers(disabledWithoutDocker = true)
class PgEventStoreTest extends EventStoreContractTest {

    @Container
    static PostgreSQLContainer<?> postgres = PostgreSQLTestConstants.createStandardContainer();

    private static PgTestDatabase database;

    private SimpleMeterRegistry registry;

    @Override
    protected EventStore createEventStore() {
        if (database == null) {
            database = PgTestDatabase.start(postgres);
        }
        database.truncate();
        registry = new SimpleMeterRegistry();
        JournalMetrics metrics = new JournalMetrics("pg-test");
        metrics.bindTo(registry);
        return new PgJournalStore(database.pool(), PgTestDatabase.codec(), metrics);
    }

    @Override
    protected RefStore refStoreOf(EventStore store) {
        return (PgJournalStore) store;
    }

    @AfterAll
    static void closeDatabase() {
        if (database != null) {
            database.close();
            database = null;
        }
    }

    @Test
    @DisplayName("A row with a corrupt payload is skipped, the rest of the query succeeds")
    void testCorruptRowSkipped() {
        String id = randomAggregateId();
        List<TestEvent> committed = commitChain(id, 1000, 3000);
        insertRaw("corrupt-1", id, 2000, TestEvent.TYPE, "{this is not json");
        insertRaw("unknown-1", id, 2500, "never.registered", "{}");

        List<Event> events = await(eventStore.events(id));

        assertEquals(List.of(committed.get(0), committed.get(1)), events);
        assertEquals(2.0, registry.get("journal.events.decode.failed").counter().count());
    }

    @Test
    void testGetAllEventsSkipsCorruptRowsLazily() {
        String id = randomAggregateId();
        List<TestEvent> committed = commitChain(id, 1000, 3000);
        insertRaw("corrupt-2", id, 2000, TestEvent.TYPE, "{\"id\":");

        List<Event> all = await(eventStore.getAllEvents()).collect(Collectors.toList());

        assertEquals(List.of(committed.get(0), committed.get(1)), all);
    }

    @Test
    @DisplayName("Cancelling a commit before it completes rolls it back")
    void testCancelledCommitRollsBack() {
        String id = randomAggregateId();
        CompletableFuture<Hash> commit = eventStore.commit(id, event(id, 1000, null), Hash.ZERO);
        commit.cancel(true);

        // succeeds only if the cancelled commit left neither event nor ref behind
        TestEvent next = event(id, 2000, null);
        assertEquals(next.hash(), await(eventStore.commit(id, next, Hash.ZERO)));
        assertEquals(List.of(next), await(eventStore.events(id)));
    }

    @Test
    void testCommitMetricsRecorded() {
        String id = randomAggregateId();
        Hash v1 = await(eventStore.commit(id, event(id, 1000, null), Hash.ZERO));
        await(eventStore.commit(id, event(id, 2000, v1), v1));
        awaitFailure(eventStore.commit(id, event(id, 3000, v1), v1), ConcurrencyException.class);

        assertEquals(2.0, registry.get("journal.commits.succeeded").counter().count());
        assertEquals(1.0, registry.get("journal.commits.conflicted").counter().count());
        assertEquals(3, registry.get("journal.commit.time").timer().count());
    }

    private void insertRaw(String eventId, String aggregateId, long timestamp, String type, String payload) {
        ReactiveUtils.await(database.pool()
            .preparedQuery("INSERT INTO journal_events (event_id, aggregate_id, event_timestamp, parent, event_type, payload, version) " +
                           "VALUES ($1, $2, $3, NULL, $4, $5, $6)")
            .execute(Tuple.of(eventId, aggregateId, timestamp, type, payload, Hash.sha256(eventId).toString())),
            Duration.ofSeconds(10));
    }
}
