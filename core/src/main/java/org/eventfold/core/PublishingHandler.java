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

import org.eventfold.result.Result;
import org.jspecify.annotations.NullMarked;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Publishes newly persisted events to downstream consumers after they have been written by the persistence handler.
 * <br><br>
 * Suggested behavior:
 * <ul>
 *     <li>use an outbox to ensure delivery and deduplication</li>
 *     <li>deliver each event at most once</li>
 *     <li>forward the whole event envelope, including tracing or custom data</li>
 * </ul>
 *
 * @param <S> The state type
 * @param <E> The domain event type
 */
@NullMarked
@FunctionalInterface
public interface PublishingHandler<S, E> {

    /**
     * @param state  The state after the events have been applied
     * @param events The events that were just persisted
     * @return A successful result, or a failure with stage {@link org.eventfold.result.Stage#PUBLISHING}
     */
    Mono<Result<Void>> publish(S state, List<PersistedEvent<E>> events);
}
