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

import static org.eventfold.cloudevents.EventFoldCloudEventExtension.KIND;
import static org.eventfold.cloudevents.EventFoldCloudEventExtension.VERSION;

/**
 * Utility class that helps get eventfold extension values, and converts them to the correct type, from a {@link CloudEvent}.
 */
public class EventFoldExtensionGetter {

    /**
     * Get the metadata version from a {@link CloudEvent} that has {@link EventFoldCloudEventExtension} applied.
     *
     * @param cloudEvent The cloud event
     * @return the metadata version
     */
    public static int getVersion(CloudEvent cloudEvent) {
        if (!cloudEvent.getExtensionNames().contains(VERSION)) {
            throw new IllegalArgumentException(CloudEvent.class.getSimpleName() + " does not contain the " + VERSION + " key");
        }

        Object version = cloudEvent.getExtension(VERSION);
        if (!(version instanceof Number)) {
            throw new IllegalArgumentException(CloudEvent.class.getSimpleName() + " does not contain a " + VERSION + " value that is an instance of " + Number.class.getSimpleName());
        }
        return ((Number) version).intValue();
    }

    /**
     * Get the kind from a {@link CloudEvent} that has {@link EventFoldCloudEventExtension} applied.
     *
     * @param cloudEvent The cloud event
     * @return the kind, for example {@code PrivateEvent}
     */
    public static String getKind(CloudEvent cloudEvent) {
        if (!cloudEvent.getExtensionNames().contains(KIND)) {
            throw new IllegalArgumentException(CloudEvent.class.getSimpleName() + " does not contain the " + KIND + " key");
        }

        Object kind = cloudEvent.getExtension(KIND);
        if (!(kind instanceof String)) {
            throw new IllegalArgumentException(CloudEvent.class.getSimpleName() + " does not contain a " + KIND + " value that is an instance of " + String.class.getSimpleName());
        }
        return (String) kind;
    }
}
