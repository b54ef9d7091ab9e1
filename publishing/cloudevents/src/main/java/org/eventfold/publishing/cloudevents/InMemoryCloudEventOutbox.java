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
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * A {@link CloudEventOutbox} that keeps enqueued cloud events in memory until they are drained. An event with the same
 * id and source as an event that has been enqueued before is ignored. Mainly useful for testing.
 */
public class InMemoryCloudEventOutbox implements CloudEventOutbox {

    private final List<CloudEvent> pending = new ArrayList<>();
    private final Set<String> seen = new HashSet<>();

    @Override
    public Mono<Void> enqueue(List<CloudEvent> cloudEvents) {
        requireNonNull(cloudEvents, "cloudEvents cannot be null");
        return Mono.fromRunnable(() -> {
            synchronized (this) {
                for (CloudEvent cloudEvent : cloudEvents) {
                    if (seen.add(cloudEvent.getSource() + " " + cloudEvent.getId())) {
                        pending.add(cloudEvent);
                    }
                }
            }
        });
    }

    /**
     * @return The cloud events that are enqueued but not yet drained, in the order they were enqueued
     */
    public synchronized List<CloudEvent> pending() {
        return List.copyOf(pending);
    }

    /**
     * Remove and return all pending cloud events. Drained events are still remembered so they are not enqueued again.
     */
    public synchronized List<CloudEvent> drain() {
        List<CloudEvent> drained = List.copyOf(pending);
        pending.clear();
        return drained;
    }
}
