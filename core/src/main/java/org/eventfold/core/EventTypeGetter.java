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

import java.util.Objects;

/**
 * Gets the type discriminator of a domain event, for example {@code ProductCreated}.
 *
 * @param <E> The domain event type
 */
@FunctionalInterface
public interface EventTypeGetter<E> {

    String getEventType(E event);

    /**
     * @return An {@link EventTypeGetter} that uses the simple name of the class of the domain event
     */
    static <E> EventTypeGetter<E> simpleClassName() {
        return event -> Objects.requireNonNull(event, "Domain event cannot be null").getClass().getSimpleName();
    }
}
