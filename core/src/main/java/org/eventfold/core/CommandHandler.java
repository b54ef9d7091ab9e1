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

import java.util.List;

/**
 * The business logic of an aggregate. Validates a command against the current state and decides which events, if any, it results in.
 * <p>
 * The handler is invoked once per command, but commands are not deduplicated, so it must be safe to invoke it with a command
 * that has already been handled.
 * </p>
 *
 * @param <S> The state type
 * @param <C> The command type
 * @param <E> The domain event type
 */
@NullMarked
@FunctionalInterface
public interface CommandHandler<S, C, E> {

    /**
     * @param state   The current state
     * @param command The command to handle
     * @return The new events, in order (possibly none), or a failure with stage {@link org.eventfold.result.Stage#COMMAND}
     * if the command is rejected.
     */
    Result<List<E>> handle(S state, C command);
}
