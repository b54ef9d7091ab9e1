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

import org.eventfold.core.PersistedBundle;
import org.eventfold.core.PersistedEvent;
import org.eventfold.core.PersistenceHandler;
import org.eventfold.core.Snapshot;
import org.eventfold.result.Result;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Returns a fixed bundle and records snapshots.
 */
class RecordingPersistenceHandler implements PersistenceHandler<Integer, Integer> {
    final List<Snapshot<Integer>> snapshots = new CopyOnWriteArrayList<>();
    private final Mono<Result<PersistedBundle<Integer, Integer>>> bundle;
    private final Mono<Result<Void>> snapshotOutcome;

    RecordingPersistenceHandler(Mono<Result<PersistedBundle<Integer, Integer>>> bundle, Mono<Result<Void>> snapshotOutcome) {
        this.bundle = bundle;
        this.snapshotOutcome = snapshotOutcome;
    }

    static RecordingPersistenceHandler returning(PersistedBundle<Integer, Integer> bundle) {
        return new RecordingPersistenceHandler(Mono.just(Result.success(bundle)), Mono.just(Result.success()));
    }

    @Override
    public Mono<Result<Void>> save(List<PersistedEvent<Integer>> events) {
        return Mono.just(Result.success());
    }

    @Override
    public Mono<Result<PersistedBundle<Integer, Integer>>> get(String id) {
        return bundle;
    }

    @Override
    public Mono<Result<PersistedBundle<Integer, Integer>>> getAll(String projectionName) {
        return bundle;
    }

    @Override
    public Mono<Result<Void>> snapshot(Snapshot<Integer> snapshot) {
        return snapshotOutcome.doOnNext(result -> {
            if (result.isSuccess()) {
                snapshots.add(snapshot);
            }
        });
    }
}
