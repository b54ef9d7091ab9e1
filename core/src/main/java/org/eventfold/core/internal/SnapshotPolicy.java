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
import org.eventfold.core.PersistenceHandler;
import org.eventfold.core.Snapshot;
import org.eventfold.core.SnapshotConfig;
import org.eventfold.result.Result;
import org.eventfold.result.Stage;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import static java.util.Objects.requireNonNull;

/**
 * Decides whether a new snapshot should be written and, if so, writes it using the persistence handler.
 * A snapshot is written when at least {@link SnapshotConfig#frequency()} events have been applied since the last snapshot.
 *
 * @param <S> The state type
 */
public class SnapshotPolicy<S> {
    private static final Logger log = LoggerFactory.getLogger(SnapshotPolicy.class);

    private final PersistenceHandler<S, ?> persistenceHandler;
    private final @Nullable SnapshotConfig config;
    private final EventKind kind;

    public SnapshotPolicy(PersistenceHandler<S, ?> persistenceHandler, @Nullable SnapshotConfig config, EventKind kind) {
        requireNonNull(persistenceHandler, PersistenceHandler.class.getSimpleName() + " cannot be null");
        requireNonNull(kind, EventKind.class.getSimpleName() + " cannot be null");
        this.persistenceHandler = persistenceHandler;
        this.config = config;
        this.kind = kind;
    }

    /**
     * @param key                  The key to store the snapshot under
     * @param state                The state to snapshot
     * @param lastAppliedSequence  The sequence of the last event that was applied to {@code state}
     * @param lastSnapshotSequence The sequence of the last snapshot, or the baseline sequence if there's none
     * @return A successful result if no snapshot was due or if it was written, a failure with stage {@link Stage#PERSISTENCE} otherwise
     */
    public Mono<Result<Void>> maybeSnapshot(String key, S state, long lastAppliedSequence, long lastSnapshotSequence) {
        requireNonNull(key, "key cannot be null");
        if (config == null || !isDue(config, lastAppliedSequence, lastSnapshotSequence)) {
            return Mono.just(Result.success());
        }

        Snapshot<S> snapshot = new Snapshot<>(key, state, lastAppliedSequence, config.schemaVersion(), kind);
        return CollaboratorCall.call(Stage.PERSISTENCE, "Writing " + kind.tag() + " snapshot for " + key, () -> persistenceHandler.snapshot(snapshot))
                .doOnNext(result -> {
                    if (result.isSuccess()) {
                        log.debug("Wrote {} snapshot for {} at sequence {}", kind.tag(), key, lastAppliedSequence);
                    }
                });
    }

    /**
     * @return The schema version that snapshots must have to be used when hydrating, or {@code null} if snapshots are disabled
     */
    public @Nullable Integer expectedSchemaVersion() {
        return config == null ? null : config.schemaVersion();
    }

    public static boolean isDue(SnapshotConfig config, long lastAppliedSequence, long lastSnapshotSequence) {
        requireNonNull(config, SnapshotConfig.class.getSimpleName() + " cannot be null");
        return lastAppliedSequence - lastSnapshotSequence >= config.frequency();
    }
}
