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
import org.eventfold.core.EventKind;
import org.eventfold.core.PersistedEvent;
import org.eventfold.core.PublishingHandler;
import org.eventfold.result.Result;
import org.eventfold.result.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * A {@link PublishingHandler} that converts new events to cloud events, marked as {@link EventKind#PUBLIC_EVENT}, and
 * enqueues them in a {@link CloudEventOutbox}. Conversion and outbox errors are returned as {@link Stage#PUBLISHING} failures.
 *
 * @param <S> The state type, not used
 * @param <E> The domain event type
 */
public class CloudEventPublishingHandler<S, E> implements PublishingHandler<S, E> {
    private static final Logger log = LoggerFactory.getLogger(CloudEventPublishingHandler.class);

    private final JacksonPersistedEventConverter<E> converter;
    private final CloudEventOutbox outbox;

    public CloudEventPublishingHandler(JacksonPersistedEventConverter<E> converter, CloudEventOutbox outbox) {
        requireNonNull(converter, JacksonPersistedEventConverter.class.getSimpleName() + " cannot be null");
        requireNonNull(outbox, CloudEventOutbox.class.getSimpleName() + " cannot be null");
        this.converter = converter;
        this.outbox = outbox;
    }

    @Override
    public Mono<Result<Void>> publish(S state, List<PersistedEvent<E>> events) {
        requireNonNull(events, "events cannot be null");
        return Mono.defer(() -> {
                    List<CloudEvent> cloudEvents = events.stream()
                            .map(event -> event.withMetadata(event.metadata().withKind(EventKind.PUBLIC_EVENT)))
                            .map(converter::toCloudEvent)
                            .collect(Collectors.toList());
                    return outbox.enqueue(cloudEvents).thenReturn(Result.success());
                })
                .onErrorResume(throwable -> {
                    log.warn("Failed to publish {} events: {}", events.size(), throwable.getMessage(), throwable);
                    return Mono.just(Result.<Void>failure(Stage.PUBLISHING, String.valueOf(throwable.getMessage())));
                });
    }
}
