/*
 * Copyright 2026 the eventfold authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.eventfold.core.internal;

import org.eventfold.core.EventKind;
import org.eventfold.core.PersistedBundle;
import org.eventfold.core.Snapshot;
import org.eventfold.result.Result;
import org.eventfold.result.Stage;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.eventfold.core.SnapshotConfig.snapshotEvery;
import static org.eventfold.core.internal.Events.ones;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayNameGeneration(ReplaceUnderscores.class)
class QueryWorkflowTest {

    private static QueryWorkflow<Integer, Integer> workflow(RecordingPersistenceHandler persistenceHandler, Stage fetchErrorStage) {
        SnapshotPolicy<Integer> policy = new SnapshotPolicy<>(persistenceHandler, snapshotEvery(4, 1), EventKind.NAMED_PROJECTION);
        return new QueryWorkflow<>(0, new Hydrator<>((state, event) -> state + event.data()), policy, fetchErrorStage);
    }

    @Test
    void returns_default_state_when_nothing_is_stored() {
        // Given
        RecordingPersistenceHandler persistenceHandler = RecordingPersistenceHandler.returning(PersistedBundle.empty("1"));

        // When
        Result<Integer> result = workflow(persistenceHandler, Stage.PROJECTION).read("1", () -> persistenceHandler.get("1")).block();

        // Then
        assertAll(
                () -> assertThat(result).isEqualTo(Result.success(0)),
                () -> assertThat(persistenceHandler.snapshots).isEmpty()
        );
    }

    @Test
    void hydrates_from_snapshot_and_pending_events_and_snapshots_when_due() {
        // Given
        Snapshot<Integer> snapshot = new Snapshot<>("1", 3, 4, 1, EventKind.NAMED_PROJECTION);
        RecordingPersistenceHandler persistenceHandler = RecordingPersistenceHandler.returning(new PersistedBundle<>("1", snapshot, ones(5, 8)));

        // When
        Result<Integer> result = workflow(persistenceHandler, Stage.PROJECTION).read("1", () -> persistenceHandler.get("1")).block();

        // Then
        assertAll(
                () -> assertThat(result).isEqualTo(Result.success(7)),
                () -> assertThat(persistenceHandler.snapshots).containsExactly(new Snapshot<>("1", 7, 8, 1, EventKind.NAMED_PROJECTION))
        );
    }

    @Test
    void failing_snapshot_does_not_fail_the_read() {
        // Given
        RecordingPersistenceHandler persistenceHandler = new RecordingPersistenceHandler(Mono.just(Result.success(PersistedBundle.of("1", ones(2, 9)))), Mono.error(new IllegalStateException("boom")));

        // When
        Result<Integer> result = workflow(persistenceHandler, Stage.PROJECTION).read("1", () -> persistenceHandler.get("1")).block();

        // Then
        assertThat(result).isEqualTo(Result.success(8));
    }

    @Test
    void fetch_failure_is_returned_as_is() {
        // Given
        RecordingPersistenceHandler persistenceHandler = new RecordingPersistenceHandler(Mono.just(Result.failure(Stage.PERSISTENCE, "unavailable")), Mono.just(Result.success()));

        // When
        Result<Integer> result = workflow(persistenceHandler, Stage.PROJECTION).read("1", () -> persistenceHandler.get("1")).block();

        // Then
        assertThat(result).isEqualTo(Result.failure(Stage.PERSISTENCE, "unavailable"));
    }

    @Test
    void fetch_error_signal_is_converted_to_failure_of_configured_stage() {
        // Given
        RecordingPersistenceHandler persistenceHandler = new RecordingPersistenceHandler(Mono.error(new RuntimeException("connection refused")), Mono.just(Result.success()));

        // When
        Result<Integer> result = workflow(persistenceHandler, Stage.PROJECTION).read("1", () -> persistenceHandler.get("1")).block();

        // Then
        assertThat(result).isEqualTo(Result.failure(Stage.PROJECTION, "connection refused"));
    }

    @Test
    void fetch_that_completes_empty_is_converted_to_failure() {
        // Given
        RecordingPersistenceHandler persistenceHandler = new RecordingPersistenceHandler(Mono.empty(), Mono.just(Result.success()));

        // When
        Mono<Result<Integer>> result = workflow(persistenceHandler, Stage.PERSISTENCE).read("1", () -> persistenceHandler.get("1"));

        // Then
        StepVerifier.create(result)
                .assertNext(r -> assertThat(r.isFailure()).isTrue())
                .verifyComplete();
    }

    @Test
    void exception_thrown_when_fetching_is_converted_to_failure() {
        // Given
        RecordingPersistenceHandler persistenceHandler = RecordingPersistenceHandler.returning(PersistedBundle.empty("1"));

        // When
        Result<Integer> result = workflow(persistenceHandler, Stage.PERSISTENCE).read("1", () -> {
            throw new IllegalStateException("not connected");
        }).block();

        // Then
        assertThat(result).isEqualTo(Result.failure(Stage.PERSISTENCE, "not connected"));
    }
}
