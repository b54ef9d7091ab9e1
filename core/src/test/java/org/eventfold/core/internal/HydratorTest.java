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
import org.eventfold.core.PersistedEvent;
import org.eventfold.core.Snapshot;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.jspecify.annotations.Nullable;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.eventfold.core.internal.Events.event;
import static org.eventfold.core.internal.Events.ones;

@DisplayNameGeneration(ReplaceUnderscores.class)
class HydratorTest {

    // Records the order in which events are applied: state * 10 + value
    private final Hydrator<Integer, Integer> hydrator = new Hydrator<>((state, event) -> state * 10 + event.data());

    @Test
    void folds_events_onto_default_state_when_there_is_no_snapshot() {
        // When
        Integer state = hydrator.hydrate(0, null, 1, List.of(event(2, "1", 1), event(3, "1", 2), event(4, "1", 3)));

        // Then
        assertThat(state).isEqualTo(123);
    }

    @Test
    void folds_events_onto_snapshot_state_when_schema_version_matches() {
        // Given
        Snapshot<Integer> snapshot = new Snapshot<>("1", 9, 4, 1, EventKind.AGGREGATE_SNAPSHOT);

        // When
        Integer state = hydrator.hydrate(0, snapshot, 1, List.of(event(5, "1", 1)));

        // Then
        assertThat(state).isEqualTo(91);
    }

    @Test
    void ignores_snapshot_with_another_schema_version() {
        // Given
        Snapshot<Integer> snapshot = new Snapshot<>("1", 9, 4, 1, EventKind.AGGREGATE_SNAPSHOT);

        // When
        Integer state = hydrator.hydrate(0, snapshot, 2, List.of(event(5, "1", 1)));

        // Then
        assertThat(state).isEqualTo(1);
    }

    @Test
    void ignores_snapshot_when_no_schema_version_is_expected() {
        // Given
        Snapshot<Integer> snapshot = new Snapshot<>("1", 9, 4, 1, EventKind.AGGREGATE_SNAPSHOT);

        // When
        Integer state = hydrator.hydrate(0, snapshot, null, List.of());

        // Then
        assertThat(state).isZero();
    }

    @Test
    void ignores_empty_snapshot() {
        // Given
        Snapshot<Integer> snapshot = new Snapshot<>("1", null, 4, 1, EventKind.AGGREGATE_SNAPSHOT);

        // When
        Integer state = hydrator.hydrate(7, snapshot, 1, List.of(event(5, "1", 1)));

        // Then
        assertThat(state).isEqualTo(71);
    }

    @Test
    void applies_events_in_ascending_sequence_order() {
        // When
        Integer state = hydrator.hydrate(0, null, null, List.of(event(10, "1", 3), event(2, "1", 1), event(9, "1", 2)));

        // Then
        assertThat(state).isEqualTo(123);
    }

    @Test
    void events_of_different_subjects_with_the_same_sequence_keep_their_order() {
        // When
        Integer state = hydrator.hydrate(0, null, null, List.of(event(2, "b", 1), event(2, "a", 2), event(3, "a", 3)));

        // Then
        assertThat(state).isEqualTo(123);
    }

    @ParameterizedTest
    @MethodSource("baselinesAndEvents")
    void hydrating_the_same_baseline_and_events_twice_gives_the_same_state(@Nullable Snapshot<Integer> snapshot, List<PersistedEvent<Integer>> events) {
        // When
        Integer first = hydrator.hydrate(0, snapshot, 1, events);
        Integer second = hydrator.hydrate(0, snapshot, 1, events);

        // Then
        assertThat(first).isEqualTo(second);
    }

    static Stream<Arguments> baselinesAndEvents() {
        Snapshot<Integer> snapshot = new Snapshot<>("1", 4, 4, 1, EventKind.AGGREGATE_SNAPSHOT);
        Snapshot<Integer> staleSnapshot = new Snapshot<>("1", 4, 4, 2, EventKind.AGGREGATE_SNAPSHOT);
        return Stream.of(
                Arguments.of(null, List.of()),
                Arguments.of(null, ones(2, 8)),
                Arguments.of(snapshot, List.of(event(5, "1", 2), event(6, "1", 7))),
                Arguments.of(staleSnapshot, List.of(event(2, "1", 3), event(3, "1", 5))),
                Arguments.of(null, List.of(event(3, "a", 1), event(2, "b", 2), event(2, "a", 3)))
        );
    }

    @Test
    void folding_no_events_returns_the_given_state() {
        assertThat(hydrator.fold(42, List.<PersistedEvent<Integer>>of())).isEqualTo(42);
    }

    @Test
    void fold_continues_from_the_given_state() {
        assertThat(hydrator.fold(1, ones(2, 3))).isEqualTo(111);
    }
}
