package dev.mars.journal.db.setup;

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

import io.vertx.core.Future;
import io.vertx.sqlclient.Pool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Creates the journal tables and indexes if they do not exist.
 *
 * Runs {@code /db/journal-schema.sql} statement by statement inside a single transaction.
 * Every statement in the script is idempotent, so it is safe to run on each startup.
 */
public class JournalSchemaInitializer {

    private static final Logger logger = LoggerFactory.getLogger(JournalSchemaInitializer.class);

    static final String SCHEMA_SCRIPT = "/db/journal-schema.sql";

    private final Pool pool;
    private final String schema;

    public JournalSchemaInitializer(Pool pool) {
        this(pool, null);
    }

    /**
     * @param schema schema to create before the tables, or null to use the connection's search_path as is
     */
    public JournalSchemaInitializer(Pool pool, String schema) {
        this.pool = Objects.requireNonNull(pool, "Pool cannot be null");
        if (schema != null && !schema.isBlank() && !schema.matches("[A-Za-z_][A-Za-z0-9_]*")) {
            throw new IllegalArgumentException("Invalid schema name: " + schema);
        }
        this.schema = schema;
    }

    public Future<Void> initializeSchema() {
        logger.info("Initializing journal schema");
        return loadSchemaScript()
            .compose(this::executeSchemaScript)
            .onSuccess(v -> logger.info("Journal schema initialized successfully"))
            .onFailure(error -> logger.error("Failed to initialize journal schema", error));
    }

    private Future<String> loadSchemaScript() {
        try {
            return Future.succeededFuture(loadResourceAsString(SCHEMA_SCRIPT));
        } catch (RuntimeException e) {
            return Future.failedFuture(e);
        }
    }

    private Future<Void> executeSchemaScript(String sql) {
        List<String> statements = new ArrayList<>();
        if (schema != null && !schema.isBlank()) {
            statements.add("CREATE SCHEMA IF NOT EXISTS " + schema);
        }
        statements.addAll(parseSqlStatements(sql));
        logger.debug("Executing {} schema statements", statements.size());

        return pool.withTransaction(conn -> {
            Future<Void> chain = Future.succeededFuture();
            for (String statement : statements) {
                chain = chain.compose(v -> {
                    logger.trace("Executing: {}...", statement.substring(0, Math.min(60, statement.length())));
                    return conn.query(statement).execute().<Void>mapEmpty();
                });
            }
            return chain;
        });
    }

    /**
     * Splits a script on semicolons, dropping {@code --} comment lines and blank statements.
     */
    static List<String> parseSqlStatements(String content) {
        String withoutComments = content.lines()
            .filter(line -> !line.trim().startsWith("--"))
            .collect(Collectors.joining("\n"));

        List<String> statements = new ArrayList<>();
        for (String part : withoutComments.split(";")) {
            String statement = part.trim();
            if (!statement.isEmpty()) {
                statements.add(statement);
            }
        }
        return statements;
    }

    private String loadResourceAsString(String resourcePath) {
        try (InputStream is = getClass().getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new IllegalStateException("Schema script not found: " + resourcePath);
            }
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8))) {
                return reader.lines().collect(Collectors.joining("\n"));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load resource: " + resourcePath, e);
        }
    }
}
