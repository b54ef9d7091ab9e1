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

package org.eventfold.application.projection;

import org.eventfold.result.Result;
import org.jspecify.annotations.NullMarked;
import reactor.core.publisher.Mono;

/**
 * A singular read model built from the events of all subjects, for example an operational report.
 * It should not be used to hold data of a specific user.
 *
 * @param <S> The projection state type
 */
@NullMarked
@FunctionalInterface
public interface GlobalProjection<S> {

    Mono<Result<S>> get();
}
