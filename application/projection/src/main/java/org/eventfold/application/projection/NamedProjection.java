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
 * A read model that is identified by an id, for example the price history of a product.
 *
 * @param <S> The projection state type
 */
@NullMarked
@FunctionalInterface
public interface NamedProjection<S> {

    /**
     * @param id The id of the projection, i.e. the subject of the events it's built from
     * @return The current state of the projection
     */
    Mono<Result<S>> get(String id);
}
