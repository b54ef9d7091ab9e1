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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.cloudevents.CloudEvent;
import io.cloudevents.CloudEventData;
import io.cloudevents.core.builder.CloudEventBuilder;
import io.cloudevents.core.data.PojoCloudEventData;
import org.eventfold.cloudevents.EventFoldCloudEventExtension;
import org.eventfold.cloudevents.EventFoldExtensionGetter;
import org.eventfold.core.EventKind;
import org.eventfold.core.EventMetadata;
import org.eventfold.core.EventSequenceId;
import org.eventfold.core.PersistedEvent;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.util.Arrays;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * Converts a {@link PersistedEvent} to and from a {@link CloudEvent}. The domain event is serialized to JSON using a Jackson
 * {@link ObjectMapper} and the library metadata is added as an {@link EventFoldCloudEventExtension}.
 * <br><br>
 * <table>
 *     <tr><th>{@link PersistedEvent}</th><th>{@link CloudEvent}</th></tr>
 *     <tr><td>{@code id}</td><td>id, in the {@code <sequence>_<subject>} format</td></tr>
 *     <tr><td>{@code source}</td><td>source</td></tr>
 *     <tr><td>{@code type}</td><td>type</td></tr>
 *     <tr><td>{@code subject()}</td><td>subject</td></tr>
 *     <tr><td>{@code time}</td><td>time</td></tr>
 *     <tr><td>{@code dataContentType}</td><td>datacontenttype</td></tr>
 *     <tr><td>{@code data}</td><td>data</td></tr>
 *     <tr><td>{@code metadata}</td><td>{@value EventFoldCloudEventExtension#VERSION} and {@value EventFoldCloudEventExtension#KIND}</td></tr>
 * </table>
 *
 * @param <E> The domain event type
 */
public class JacksonPersistedEventConverter<E> {

    private final ObjectMapper objectMapper;
    private final Function<String, Class<? extends E>> typeResolver;

    /**
     * @param objectMapper The ObjectMapper instance to use
     * @param typeResolver Resolves the class of the domain event from the cloud event type, returns {@code null} if the type is unknown
     */
    public JacksonPersistedEventConverter(ObjectMapper objectMapper, Function<String, Class<? extends E>> typeResolver) {
        requireNonNull(objectMapper, ObjectMapper.class.getSimpleName() + " cannot be null");
        requireNonNull(typeResolver, "typeResolver cannot be null");
        this.objectMapper = objectMapper;
        this.typeResolver = typeResolver;
    }

    /**
     * Create a converter for a sealed domain event type whose cloud event types are the simple names of its permitted subclasses.
     *
     * @param objectMapper The ObjectMapper instance to use
     * @param sealedType   The sealed domain event interface or class
     */
    public static <E> JacksonPersistedEventConverter<E> forSealedType(ObjectMapper objectMapper, Class<E> sealedType) {
        requireNonNull(sealedType, "sealedType cannot be null");
        if (!sealedType.isSealed()) {
            throw new IllegalArgumentException(sealedType.getName() + " is not sealed");
        }
        Map<String, Class<? extends E>> types = Arrays.stream(sealedType.getPermittedSubclasses())
                .map(type -> type.asSubclass(sealedType))
                .collect(Collectors.toUnmodifiableMap(Class::getSimpleName, Function.identity()));
        return new JacksonPersistedEventConverter<>(objectMapper, types::get);
    }

    public CloudEvent toCloudEvent(PersistedEvent<E> event) {
        requireNonNull(event, PersistedEvent.class.getSimpleName() + " cannot be null");
        // @formatter:off
        PojoCloudEventData<Map<String, Object>> cloudEventData = PojoCloudEventData.wrap(objectMapper.convertValue(event.data(), new TypeReference<Map<String, Object>>() {}), objectMapper::writeValueAsBytes);
        // @formatter:on
        return CloudEventBuilder.v1()
                .withId(event.id().toString())
                .withSource(URI.create(event.source()))
                .withType(event.type())
                .withSubject(event.subject())
                .withTime(event.time())
                .withDataContentType(event.dataContentType())
                .withData(cloudEventData)
                .withExtension(new EventFoldCloudEventExtension(event.metadata().version(), event.metadata().kind().tag()))
                .build();
    }

    /**
     * @throws IllegalArgumentException If the cloud event id is malformed, if its subject doesn't match the id, if the type is
     *                                  unknown, or if the eventfold extension is missing.
     */
    @SuppressWarnings("unchecked")
    public PersistedEvent<E> toPersistedEvent(CloudEvent cloudEvent) {
        requireNonNull(cloudEvent, CloudEvent.class.getSimpleName() + " cannot be null");
        EventSequenceId id = EventSequenceId.parse(cloudEvent.getId());
        if (cloudEvent.getSubject() != null && !Objects.equals(cloudEvent.getSubject(), id.subject())) {
            throw new IllegalArgumentException("Subject " + cloudEvent.getSubject() + " doesn't match the subject of event id " + id);
        }

        Class<? extends E> domainEventType = typeResolver.apply(cloudEvent.getType());
        if (domainEventType == null) {
            throw new IllegalArgumentException("Unknown event type " + cloudEvent.getType());
        }

        CloudEventData data = cloudEvent.getData();
        final E domainEvent;
        if (data instanceof PojoCloudEventData && ((PojoCloudEventData<Object>) data).getValue() instanceof Map) {
            Map<String, Object> value = (Map<String, Object>) ((PojoCloudEventData<?>) data).getValue();
            domainEvent = objectMapper.convertValue(value, domainEventType);
        } else {
            try {
                domainEvent = objectMapper.readValue(requireNonNull(data, "cloud event data cannot be null").toBytes(), domainEventType);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }

        EventMetadata metadata = new EventMetadata(EventFoldExtensionGetter.getVersion(cloudEvent), EventKind.fromTag(EventFoldExtensionGetter.getKind(cloudEvent)));
        String dataContentType = cloudEvent.getDataContentType() == null ? PersistedEvent.DEFAULT_CONTENT_TYPE : cloudEvent.getDataContentType();
        return new PersistedEvent<>(id, cloudEvent.getType(), domainEvent, requireNonNull(cloudEvent.getTime(), "cloud event time cannot be null"),
                dataContentType, cloudEvent.getSpecVersion().toString(), cloudEvent.getSource().toString(), metadata);
    }
}
