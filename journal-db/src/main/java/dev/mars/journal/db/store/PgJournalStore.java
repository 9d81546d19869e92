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
import dev.mars.journal.api.EventFilter;
import dev.mars.journal.api.EventStore;
import dev.mars.journal.api.Hash;
import dev.mars.journal.api.JournalErrorCodes;
import dev.mars.journal.api.RefStore;
import dev.mars.journal.api.codec.EventCodec;
import dev.mars.journal.db.ReactiveUtils;
import dev.mars.journal.db.metrics.JournalMetrics;
import io.vertx.core.Future;
import io.vertx.pgclient.PgException;
import io.vertx.sqlclient.Pool;
import io.vertx.sqlclient.Row;
import io.vertx.sqlclient.RowSet;
import io.vertx.sqlclient.SqlClient;
import io.vertx.sqlclient.Tuple;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * PostgreSQL implementation of {@link EventStore} and {@link RefStore} on the Vert.x reactive client.
 *
 * <p>A commit runs in one transaction: read the ref, insert the event, then move the ref with a
 * predicated statement whose affected row count is the compare-and-swap result. Creating a ref is
 * an {@code INSERT ... ON CONFLICT DO NOTHING}; updating one is an {@code UPDATE ... WHERE version = ?}.
 * When the swap affects no row the transaction is rolled back, which removes the inserted event.</p>
 *
 * <p>Concurrent swaps on one aggregate serialize on the ref row. Under read committed isolation the
 * loser re-evaluates the predicate after the winner commits and sees zero affected rows.</p>
 *
 * <p>Rows whose payload cannot be decoded are logged, counted and skipped.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public class PgJournalStore implements EventStore, RefStore {

    private static final Logger logger = LoggerFactory.getLogger(PgJournalStore.class);

    private static final String UNIQUE_VIOLATION = "23505";

    private static final String SELECT_REF =
        "SELECT version FROM journal_refs WHERE aggregate_id = $1";
    private static final String CREATE_REF =
        "INSERT INTO journal_refs (aggregate_id, version, updated_at) VALUES ($1, $2, NOW()) " +
        "ON CONFLICT (aggregate_id) DO NOTHING";
    private static final String UPDATE_REF =
        "UPDATE journal_refs SET version = $1, updated_at = NOW() WHERE aggregate_id = $2 AND version = $3";
    private static final String INSERT_EVENT =
        "INSERT INTO journal_events (event_id, aggregate_id, event_timestamp, parent, event_type, payload, version) " +
        "VALUES ($1, $2, $3, $4, $5, $6, $7)";
    private static final String SELECT_EVENTS =
        "SELECT event_id, event_type, payload FROM journal_events";

    private final Pool pool;
    private final EventCodec codec;
    private final JournalMetrics metrics;
    private volatile boolean closed = false;

    public PgJournalStore(Pool pool, EventCodec codec) {
        this(pool, codec, new JournalMetrics("unbound"));
    }

    public PgJournalStore(Pool pool, EventCodec codec, JournalMetrics metrics) {
        this.pool = Objects.requireNonNull(pool, "Pool cannot be null");
        this.codec = Objects.requireNonNull(codec, "Event codec cannot be null");
        this.metrics = Objects.requireNonNull(metrics, "Metrics cannot be null");
        logger.info("Created PostgreSQL journal store");
    }

    // ---------------------------------------------------------------- RefStore

    @Override
    public CompletableFuture<Void> swap(String aggregateId, Hash newRef, Hash oldRef) {
        requireAggregateId(aggregateId);
        Objects.requireNonNull(newRef, "New ref cannot be null");
        if (closed) {
            return CompletableFuture.failedFuture(new IllegalStateException("Event store is closed"));
        }
        if (newRef.equals(oldRef)) {
            return CompletableFuture.completedFuture(null);
        }
        return ReactiveUtils.toCompletableFuture(
            pool.withTransaction(conn -> swapRef(conn, aggregateId, newRef, oldRef)));
    }

    @Override
    public CompletableFuture<Optional<Hash>> read(String aggregateId) {
        if (closed) {
            return CompletableFuture.failedFuture(new IllegalStateException("Event store is closed"));
        }
        if (aggregateId == null || aggregateId.isEmpty()) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        return ReactiveUtils.toCompletableFuture(readRef(pool, aggregateId));
    }

    private Future<Optional<Hash>> readRef(SqlClient client, String aggregateId) {
        return client.preparedQuery(SELECT_REF)
            .execute(Tuple.of(aggregateId))
            .map(rows -> rows.size() == 0
                ? Optional.<Hash>empty()
                : Optional.of(Hash.of(rows.iterator().next().getString("version"))));
    }

    /**
     * Compare-and-swap on the ref row. Fails with {@link ConcurrencyException} when no row is affected.
     */
    private Future<Void> swapRef(SqlClient client, String aggregateId, Hash newRef, Hash oldRef) {
        if (newRef.equals(oldRef)) {
            return Future.succeededFuture();
        }
        if (oldRef == null) {
            return client.preparedQuery(CREATE_REF)
                .execute(Tuple.of(aggregateId, newRef.toString()))
                .compose(result -> {
                    if (result.rowCount() == 0) {
                        return readRef(client, aggregateId).compose(actual -> Future.failedFuture(
                            ConcurrencyException.refExists(aggregateId, actual.orElse(null))));
                    }
                    logger.debug("Created ref for aggregate {} at {}", aggregateId, newRef);
                    return Future.succeededFuture();
                });
        }
        return client.preparedQuery(UPDATE_REF)
            .execute(Tuple.of(newRef.toString(), aggregateId, oldRef.toString()))
            .compose(result -> {
                if (result.rowCount() == 0) {
                    return readRef(client, aggregateId).compose(actual -> Future.failedFuture(
                        actual.isPresent()
                            ? ConcurrencyException.versionMismatch(aggregateId, oldRef, actual.get())
                            : ConcurrencyException.refMissing(aggregateId, oldRef)));
                }
                logger.debug("Advanced ref for aggregate {} from {} to {}", aggregateId, oldRef, newRef);
                return Future.succeededFuture();
            });
    }

    // -------------------------------------------------------------- EventStore

    @Override
    public CompletableFuture<Hash> commit(String aggregateId, Event event, Hash expectedVersion) {
        requireAggregateId(aggregateId);
        Objects.requireNonNull(event, "Event cannot be null");
        Objects.requireNonNull(expectedVersion, "Expected version cannot be null");
        if (!aggregateId.equals(event.getAggregateId())) {
            throw new IllegalArgumentException("Event " + event.getId() + " belongs to aggregate '" +
                event.getAggregateId() + "', not '" + aggregateId + "'");
        }
        if (closed) {
            return CompletableFuture.failedFuture(new IllegalStateException("Event store is closed"));
        }

        long start = System.nanoTime();
        CompletableFuture<Hash> result = new CompletableFuture<>();

        pool.withTransaction(conn -> readRef(conn, aggregateId)
            .compose(current -> {
                checkExpectedVersion(aggregateId, current, expectedVersion);
                requireLinked(event, expectedVersion);

                Hash newVersion = event.hash();
                String payload = codec.encode(event);
                Hash parent = event.getCurrentVersion();
                Tuple params = Tuple.tuple()
                    .addString(event.getId())
                    .addString(aggregateId)
                    .addLong(event.getTimestamp())
                    .addString(parent != null && !parent.isZero() ? parent.toString() : null)
                    .addString(event.getType())
                    .addString(payload)
                    .addString(newVersion.toString());

                return conn.preparedQuery(INSERT_EVENT).execute(params)
                    .compose(inserted -> swapRef(conn, aggregateId, newVersion, current.orElse(null)))
                    .compose(swapped -> {
                        // last point at which the transaction can still be rolled back
                        if (result.isCancelled()) {
                            return Future.<Hash>failedFuture(new CancellationException(
                                "Commit of event " + event.getId() + " cancelled"));
                        }
                        return Future.succeededFuture(newVersion);
                    });
            }))
            .recover(error -> Future.failedFuture(translate(error, aggregateId, event)))
            .onSuccess(version -> {
                metrics.recordCommitSucceeded(elapsedSince(start));
                logger.debug("Committed event {} to aggregate {} at version {}", event.getId(), aggregateId, version);
                result.complete(version);
            })
            .onFailure(error -> {
                if (error instanceof ConcurrencyException) {
                    metrics.recordCommitConflicted(elapsedSince(start));
                    logger.debug("Commit of event {} rejected: {}", event.getId(), error.getMessage());
                } else {
                    metrics.recordCommitFailed(elapsedSince(start));
                    if (!(error instanceof CancellationException) && !(error instanceof IllegalArgumentException)) {
                        logger.error("Failed to commit event {} to aggregate {}: {}",
                            event.getId(), aggregateId, error.getMessage(), error);
                    }
                }
                result.completeExceptionally(error);
            });

        return result;
    }

    /**
     * Throws when the stored ref does not match the expected version. Throwing inside a
     * {@code compose} fails the composed future and rolls the transaction back.
     */
    private static void checkExpectedVersion(String aggregateId, Optional<Hash> current, Hash expectedVersion) {
        if (current.isPresent() && !current.get().equals(expectedVersion)) {
            throw ConcurrencyException.versionMismatch(aggregateId, expectedVersion, current.get());
        }
        if (current.isEmpty() && !expectedVersion.isZero()) {
            throw ConcurrencyException.refMissing(aggregateId, expectedVersion);
        }
    }

    private static void requireLinked(Event event, Hash expectedVersion) {
        Hash parent = event.getCurrentVersion() != null ? event.getCurrentVersion() : Hash.ZERO;
        if (!parent.equals(expectedVersion)) {
            throw new IllegalArgumentException("Event " + event.getId() + " follows " + parent +
                " but was committed at expected version " + expectedVersion);
        }
    }

    private static Throwable translate(Throwable error, String aggregateId, Event event) {
        if (error instanceof PgException && UNIQUE_VIOLATION.equals(((PgException) error).getSqlState())) {
            return new ConcurrencyException(JournalErrorCodes.DUPLICATE_EVENT, aggregateId,
                "Event " + event.getId() + " has already been committed");
        }
        return error;
    }

    @Override
    public CompletableFuture<List<Event>> events(EventFilter filter) {
        Objects.requireNonNull(filter, "Filter cannot be null");
        if (closed) {
            return CompletableFuture.failedFuture(new IllegalStateException("Event store is closed"));
        }

        StringBuilder sql = new StringBuilder(SELECT_EVENTS).append(" WHERE aggregate_id = $1");
        List<Object> params = new ArrayList<>();
        params.add(filter.getAggregateId());

        filter.getType().ifPresent(type -> {
            params.add(type);
            sql.append(" AND event_type = $").append(params.size());
        });
        filter.getStart().ifPresent(start -> {
            params.add(start);
            sql.append(" AND event_timestamp >= $").append(params.size());
        });
        filter.getEnd().ifPresent(end -> {
            params.add(end);
            sql.append(" AND event_timestamp <= $").append(params.size());
        });
        sql.append(" ORDER BY event_timestamp ASC, seq ASC");

        return ReactiveUtils.toCompletableFuture(
            pool.preparedQuery(sql.toString())
                .execute(Tuple.from(params))
                .map(this::decodeAll));
    }

    @Override
    public CompletableFuture<List<Event>> history(String aggregateId) {
        Objects.requireNonNull(aggregateId, "Aggregate ID cannot be null");
        if (closed) {
            return CompletableFuture.failedFuture(new IllegalStateException("Event store is closed"));
        }
        return ReactiveUtils.toCompletableFuture(
            pool.preparedQuery(SELECT_EVENTS + " WHERE aggregate_id = $1 ORDER BY seq ASC")
                .execute(Tuple.of(aggregateId))
                .map(this::decodeAll));
    }

    @Override
    public CompletableFuture<Stream<Event>> getAllEvents() {
        if (closed) {
            return CompletableFuture.failedFuture(new IllegalStateException("Event store is closed"));
        }
        return ReactiveUtils.toCompletableFuture(
            pool.query(SELECT_EVENTS + " ORDER BY event_timestamp ASC, seq ASC")
                .execute()
                .map(rows -> StreamSupport.stream(rows.spliterator(), false)
                    .map(this::decodeRow)
                    .flatMap(Optional::stream)));
    }

    private List<Event> decodeAll(RowSet<Row> rows) {
        List<Event> events = new ArrayList<>(rows.size());
        for (Row row : rows) {
            decodeRow(row).ifPresent(events::add);
        }
        return events;
    }

    private Optional<Event> decodeRow(Row row) {
        String eventId = row.getString("event_id");
        try {
            return Optional.of(codec.decode(row.getString("event_type"), row.getString("payload")));
        } catch (RuntimeException e) {
            metrics.recordDecodeFailure();
            logger.warn("Failed to map row to event {}: {}", eventId, e.getMessage());
            return Optional.empty();
        }
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    private static void requireAggregateId(String aggregateId) {
        if (aggregateId == null || aggregateId.isEmpty()) {
            throw new IllegalArgumentException("Aggregate ID cannot be empty");
        }
    }

    /**
     * Marks the store closed. The pool belongs to the caller and stays open.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        logger.info("PostgreSQL journal store closed");
    }
}
