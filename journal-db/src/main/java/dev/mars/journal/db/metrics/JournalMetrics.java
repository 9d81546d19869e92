package dev.mars.journal.db.metrics;

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

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Micrometer metrics for journal commits and reads.
 *
 * Until {@link #bindTo(MeterRegistry)} is called every record method is a no-op, so a store
 * can always hold an instance whether or not metrics are enabled.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public class JournalMetrics implements MeterBinder {

    private static final Logger logger = LoggerFactory.getLogger(JournalMetrics.class);

    private final String instanceId;

    private Counter commitsSucceeded;
    private Counter commitsConflicted;
    private Counter commitsFailed;
    private Counter decodeFailures;
    private Timer commitTime;

    public JournalMetrics(String instanceId) {
        this.instanceId = Objects.requireNonNull(instanceId, "Instance ID cannot be null");
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        commitsSucceeded = Counter.builder("journal.commits.succeeded")
            .description("Total number of events committed")
            .tag("instance", instanceId)
            .register(registry);

        commitsConflicted = Counter.builder("journal.commits.conflicted")
            .description("Total number of commits rejected by a version conflict")
            .tag("instance", instanceId)
            .register(registry);

        commitsFailed = Counter.builder("journal.commits.failed")
            .description("Total number of commits that failed for reasons other than a conflict")
            .tag("instance", instanceId)
            .register(registry);

        decodeFailures = Counter.builder("journal.events.decode.failed")
            .description("Total number of stored events skipped because they could not be decoded")
            .tag("instance", instanceId)
            .register(registry);

        commitTime = Timer.builder("journal.commit.time")
            .description("Time taken to commit an event, including conflicts")
            .tag("instance", instanceId)
            .register(registry);

        logger.info("Journal metrics registered for instance: {}", instanceId);
    }

    public void recordCommitSucceeded(Duration elapsed) {
        if (commitsSucceeded != null) {
            commitsSucceeded.increment();
        }
        recordCommitTime(elapsed);
    }

    public void recordCommitConflicted(Duration elapsed) {
        if (commitsConflicted != null) {
            commitsConflicted.increment();
        }
        recordCommitTime(elapsed);
    }

    public void recordCommitFailed(Duration elapsed) {
        if (commitsFailed != null) {
            commitsFailed.increment();
        }
        recordCommitTime(elapsed);
    }

    public void recordDecodeFailure() {
        if (decodeFailures != null) {
            decodeFailures.increment();
        }
    }

    private void recordCommitTime(Duration elapsed) {
        if (commitTime != null) {
            commitTime.record(elapsed);
        }
    }

    public String getInstanceId() {
        return instanceId;
    }
}
