package dev.mars.journal.test;

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

import dev.mars.journal.api.Hash;

import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.fail;

/**
 * Factories for random hashes, ids and events, and helpers for waiting on futures.
 */
public final class Fixtures {

    public static final long TIMEOUT_SECONDS = 30;

    private Fixtures() {
        throw new UnsupportedOperationException("This is a utility class and cannot be instantiated");
    }

    public static Hash randomHash() {
        return Hash.sha256(UUID.randomUUID().toString());
    }

    public static String randomAggregateId() {
        return "aggregate-" + UUID.randomUUID();
    }

    public static TestEvent event(String aggregateId, long timestamp, Hash parent) {
        return event(aggregateId, timestamp, parent, TestEvent.TYPE);
    }

    public static TestEvent event(String aggregateId, long timestamp, Hash parent, String type) {
        return new TestEvent(UUID.randomUUID().toString(), aggregateId, timestamp, parent,
            "data-" + timestamp, type);
    }

    /**
     * Waits for a future and returns its value, failing the test on error or timeout.
     */
    public static <T> T await(CompletableFuture<T> future) {
        try {
            return future.get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            throw new AssertionError("Operation failed: " + unwrap(e.getCause()), unwrap(e.getCause()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AssertionError("Interrupted while waiting", e);
        } catch (TimeoutException e) {
            throw new AssertionError("Timed out after " + TIMEOUT_SECONDS + "s", e);
        }
    }

    /**
     * Waits for a future that is expected to fail and returns the failure, unwrapped.
     */
    public static Throwable awaitFailure(CompletableFuture<?> future) {
        try {
            Object value = future.get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
            return fail("Expected failure but completed with " + value);
        } catch (ExecutionException e) {
            return unwrap(e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AssertionError("Interrupted while waiting", e);
        } catch (TimeoutException e) {
            throw new AssertionError("Timed out after " + TIMEOUT_SECONDS + "s", e);
        }
    }

    /**
     * Waits for a failing future and asserts the failure type.
     */
    public static <X extends Throwable> X awaitFailure(CompletableFuture<?> future, Class<X> expected) {
        Throwable failure = awaitFailure(future);
        if (!expected.isInstance(failure)) {
            throw new AssertionError("Expected " + expected.getSimpleName() + " but got " + failure, failure);
        }
        return expected.cast(failure);
    }

    public static Throwable unwrap(Throwable t) {
        Throwable current = t;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
