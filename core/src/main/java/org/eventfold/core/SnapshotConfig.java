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

/**
 * Snapshots are similar to caching of state. It's best to leave them out until the state model is stable.
 *
 * @param frequency     A new snapshot is written when at least this many events have been applied since the last snapshot
 * @param schemaVersion The version of the state model. Bump it when the model changes to invalidate existing snapshots.
 */
public record SnapshotConfig(long frequency, int schemaVersion) {

    public SnapshotConfig {
        if (frequency < 1) {
            throw new IllegalArgumentException("frequency must be at least 1 but was " + frequency);
        }
    }

    public static SnapshotConfig snapshotEvery(long frequency, int schemaVersion) {
        return new SnapshotConfig(frequency, schemaVersion);
    }
}
