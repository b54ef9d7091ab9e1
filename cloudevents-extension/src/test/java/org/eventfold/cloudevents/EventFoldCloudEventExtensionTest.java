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

package org.eventfold.cloudevents;

import io.cloudevents.CloudEvent;
import io.cloudevents.core.v1.CloudEventBuilder;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.OffsetDateTime;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayNameGeneration(ReplaceUnderscores.class)
class EventFoldCloudEventExtensionTest {

    @Test
    void extension_values_can_be_read_back_from_the_cloud_event() {
        // Given
        CloudEvent cloudEvent = cloudEventBuilder()
                .withExtension(EventFoldCloudEventExtension.eventfold(1, "PrivateEvent"))
                .build();

        // Then
        assertAll(
                () -> assertThat(EventFoldExtensionGetter.getVersion(cloudEvent)).isEqualTo(1),
                () -> assertThat(EventFoldExtensionGetter.getKind(cloudEvent)).isEqualTo("PrivateEvent"),
                () -> assertThat(cloudEvent.getExtensionNames()).contains(EventFoldCloudEventExtension.VERSION, EventFoldCloudEventExtension.KIND)
        );
    }

    @Test
    void getter_throws_iae_when_extension_is_missing() {
        // Given
        CloudEvent cloudEvent = cloudEventBuilder().build();

        // When
        Throwable throwable = catchThrowable(() -> EventFoldExtensionGetter.getKind(cloudEvent));

        // Then
        assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class).hasMessageContaining(EventFoldCloudEventExtension.KIND);
    }

    @Test
    void version_cannot_be_less_than_one() {
        // When
        Throwable throwable = catchThrowable(() -> new EventFoldCloudEventExtension(0, "PrivateEvent"));

        // Then
        assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class);
    }

    private static CloudEventBuilder cloudEventBuilder() {
        return new CloudEventBuilder()
                .withId("2_1")
                .withTime(OffsetDateTime.now())
                .withSource(URI.create("urn:test"))
                .withSubject("1")
                .withType("ProductCreated")
                .withData("application/json", "{}".getBytes(UTF_8));
    }
}
