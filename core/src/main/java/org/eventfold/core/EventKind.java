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

import java.util.Arrays;

/**
 * Distinguishes what a stored or published record represents.
 */
public enum EventKind {
    /**
     * An event that is internal to the service that produced it
     */
    PRIVATE_EVENT("PrivateEvent"),
    /**
     * An event that has been published to other services
     */
    PUBLIC_EVENT("PublicEvent"),
    NAMED_PROJECTION("NamedProjection"),
    GLOBAL_PROJECTION("GlobalProjection"),
    AGGREGATE_SNAPSHOT("AggregateSnapshot");

    private final String tag;

    EventKind(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public static EventKind fromTag(String tag) {
        return Arrays.stream(values())
                .filter(kind -> kind.tag.equals(tag))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown event kind \"" + tag + "\""));
    }
}
