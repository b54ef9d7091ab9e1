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

import static java.util.Objects.requireNonNull;

/**
 * The library metadata block attached to every {@link PersistedEvent}.
 *
 * @param version The version of the metadata format
 * @param kind    What the event represents
 */
public record EventMetadata(int version, EventKind kind) {
    public static final int CURRENT_VERSION = 1;

    public EventMetadata {
        requireNonNull(kind, EventKind.class.getSimpleName() + " cannot be null");
        if (version < 1) {
            throw new IllegalArgumentException("version cannot be less than 1");
        }
    }

    public static EventMetadata privateEvent() {
        return new EventMetadata(CURRENT_VERSION, EventKind.PRIVATE_EVENT);
    }

    public EventMetadata withKind(EventKind kind) {
        return new EventMetadata(version, kind);
    }
}
