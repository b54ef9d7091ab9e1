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

package org.eventfold.publishing.cloudevents;

import io.cloudevents.CloudEvent;
import org.jspecify.annotations.NullMarked;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Stores cloud events until they have been delivered to downstream consumers. Implementations should deduplicate events
 * by id and source so that an event is delivered at most once.
 */
@NullMarked
@FunctionalInterface
public interface CloudEventOutbox {

    /**
     * @param cloudEvents The cloud events to enqueue, in order
     * @return A {@link Mono} that completes when the events are stored in the outbox
     */
    Mono<Void> enqueue(List<CloudEvent> cloudEvents);
}
