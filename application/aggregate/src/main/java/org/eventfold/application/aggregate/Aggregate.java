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

package org.eventfold.application.aggregate;

import org.eventfold.result.Result;
import org.jspecify.annotations.NullMarked;
import reactor.core.publisher.Mono;

/**
 * An event sourced aggregate. Commands are pushed to it and its state is rebuilt from events on every call.
 *
 * @param <S> The state type
 * @param <C> The command type
 */
@NullMarked
public interface Aggregate<S, C> {

    /**
     * Handle a command: fetch and hydrate the aggregate, invoke the command handler, persist the new events, and then
     * snapshot and publish them.
     *
     * @param id      The id of the aggregate
     * @param command The command to handle
     * @return The state after the new events have been applied, or a failure with the stage at which handling failed
     */
    Mono<Result<S>> push(String id, C command);

    /**
     * @param id The id of the aggregate
     * @return The current state of the aggregate. An aggregate without events has the default state.
     */
    Mono<Result<S>> get(String id);
}
