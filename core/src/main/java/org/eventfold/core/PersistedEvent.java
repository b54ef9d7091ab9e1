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

import java.time.OffsetDateTime;

import static java.util.Objects.requireNonNull;

/**
 * A domain event that has been assigned an {@link EventSequenceId} and the envelope attributes required to store and
 * publish it. The attributes follow the <a href="https://github.com/cloudevents/spec">CloudEvents</a> specification,
 * version {@value #SPEC_VERSION}. Instances are created by the event sequencer and are never modified afterwards.
 *
 * @param id              The sequence identifier, which also carries the subject
 * @param type            The type discriminator of the domain event, for example {@code ProductCreated}
 * @param data            The domain event
 * @param time            When the event was created
 * @param dataContentType The content type of {@code data} once serialized
 * @param specVersion     The CloudEvents spec version
 * @param source          The name of the service that produced the event
 * @param metadata        The library metadata block
 * @param <E>             The type of the domain event
 */
public record PersistedEvent<E>(EventSequenceId id, String type, E data, OffsetDateTime time, String dataContentType,
                                String specVersion, String source, EventMetadata metadata) {
    public static final String SPEC_VERSION = "1.0";
    public static final String DEFAULT_CONTENT_TYPE = "application/json";

    public PersistedEvent {
        requireNonNull(id, "id cannot be null");
        requireNonNull(type, "type cannot be null");
        requireNonNull(data, "data cannot be null");
        requireNonNull(time, "time cannot be null");
        requireNonNull(dataContentType, "dataContentType cannot be null");
        requireNonNull(specVersion, "specVersion cannot be null");
        requireNonNull(source, "source cannot be null");
        requireNonNull(metadata, EventMetadata.class.getSimpleName() + " cannot be null");
    }

    public String subject() {
        return id.subject();
    }

    public long sequence() {
        return id.sequence();
    }

    public PersistedEvent<E> withMetadata(EventMetadata metadata) {
        return new PersistedEvent<>(id, type, data, time, dataContentType, specVersion, source, metadata);
    }
}
