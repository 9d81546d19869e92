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
import dev.mars.journal.api.EventStore;
import dev.mars.journal.api.Hash;
import dev.mars.journal.api.RefStore;
import dev.mars.journal.test.EventStoreContractTest;
import dev.mars.journal.test.TestCategories;
import dev.mars.journal.test.TestEvent;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static dev.mars.journal.test.Fixtures.await;
import static dev.mars.journal.test.Fixtures.awaitFailure;
import static dev.mars.journal.test.Fixtures.event;
import static dev.mars.journal.test.Fixtures.randomAggregateId;
import static dev.mars.journal.test.Fixtures.randomHash;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Tag(TestCategories.CORE)
class InMemoryEventStoreTest extends EventStoreContractTest {

    @Override
    protected EventStore createEventStore() {
        return new InMemoryEventStore();
    }

    @Override
    protected RefStore refStoreOf(EventStore store) {
        return ((InMemoryEventStore) store).getRefStore();
    }

    @Test
    void testInterruptedCommitLeavesNoTrace() throws Exception {
        String id = randomAggregateId();
        TestEvent e1 = event(id, 1000, null);
        AtomicReference<Throwable> failure = new AtomicReference<>();

        Thread committer = new Thread(() -> {
            Thread.currentThread().interrupt();
            failure.set(awaitFailure(eventStore.commit(id, e1, Hash.ZERO)));
        });
        committer.start();
        committer.join();

        assertTrue(failure.get() instanceof CancellationException, "got " + failure.get());
        assertTrue(await(eventStore.events(id)).isEmpty());
        assertEquals(Optional.empty(), await(refStore.read(id)));
    }

    @Test
    void testCommitAfterDirectRefSwapConflicts() {
        String id = randomAggregateId();
        TestEvent e1 = event(id, 1000, null);
        Hash v1 = await(eventStore.commit(id, e1, Hash.ZERO));

        // advance the ref behind the event store's back
        InMemoryRefStore refs = ((InMemoryEventStore) eventStore).getRefStore();
        Hash foreign = randomHash();
        await(refs.swap(id, foreign, v1));

        awaitFailure(eventStore.commit(id, event(id, 2000, v1), v1),
            ConcurrencyException.class);

        assertEquals(List.of(e1), await(eventStore.events(id)));
        assertEquals(Optional.of(foreign), await(refs.read(id)));
    }

    @Test
    void testLostSwapReleasesEventId() {
        AtomicBoolean interfere = new AtomicBoolean(true);
        InMemoryRefStore racingRefs = new InMemoryRefStore() {
            @Override
            void swapNow(String aggregateId, Hash newRef, Hash oldRef) {
                if (interfere.getAndSet(false)) {
                    // another writer creates the ref between the version check and the swap
                    super.swapNow(aggregateId, randomHash(), oldRef);
                }
                super.swapNow(aggregateId, newRef, oldRef);
            }
        };
        try (InMemoryEventStore store = new InMemoryEventStore(racingRefs)) {
            String id = randomAggregateId();
            TestEvent e1 = event(id, 1000, null);

            awaitFailure(store.commit(id, e1, Hash.ZERO), ConcurrencyException.class);
            assertTrue(await(store.history(id)).isEmpty());

            String other = randomAggregateId();
            TestEvent retry = new TestEvent(e1.getId(), other, 1000, null, "retry");
            assertEquals(retry.hash(), await(store.commit(other, retry, Hash.ZERO)));
        }
    }
}
