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

package org.eventfold.core;

import org.jspecify.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * A cached state checkpoint. A snapshot is superseded by later snapshots, never modified.
 *
 * @param key                    The id of the aggregate or projection, or the projection name for global projections
 * @param state                  The state after folding all events up to and including {@code lastConsideredSequence}.
 *                               A snapshot without state is considered empty.
 * @param lastConsideredSequence The sequence of the last event that was folded into {@code state}. For global projections this
 *                               is the position, in the log of all subjects, of the last event that was folded.
 * @param schemaVersion          The version of the state model at the time the snapshot was taken. Snapshots with another
 *                               version than the currently expected one are ignored.
 * @param kind                   {@link EventKind#AGGREGATE_SNAPSHOT}, {@link EventKind#NAMED_PROJECTION} or {@link EventKind#GLOBAL_PROJECTION}
 * @param <S>                    The state type
 */
public record Snapshot<S>(String key, @Nullable S state, long lastConsideredSequence, int schemaVersion, EventKind kind) {

    public Snapshot {
        requireNonNull(key, "key cannot be null");
        requireNonNull(kind, EventKind.class.getSimpleName() + " cannot be null");
    }

    public boolean isEmpty() {
        return state == null;
    }

    /**
     * A snapshot can be used as hydration baseline only if it's non-empty and if a schema version is expected and matches
     * the {@code schemaVersion} of this snapshot.
     *
     * @param expectedSchemaVersion The schema version expected by the caller, {@code null} if no version check is requested.
     * @return {@code true} if the snapshot may be used, {@code false} if it's stale.
     */
    public boolean isUsableFor(@Nullable Integer expectedSchemaVersion) {
        return !isEmpty() && expectedSchemaVersion != null && expectedSchemaVersion == schemaVersion;
    }
}
