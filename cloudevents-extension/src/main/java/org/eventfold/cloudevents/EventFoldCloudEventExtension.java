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
import io.cloudevents.CloudEventExtension;
import io.cloudevents.CloudEventExtensions;

import java.util.Objects;
import java.util.Set;

/**
 * A {@link CloudEvent} {@link CloudEventExtension} that carries the eventfold library metadata block. The keys are:<br><br>
 *
 * <table>
 *     <tr><th>Key</th><th>Description</th></tr>
 *     <tr><td>{@value #VERSION}</td><td>The version of the eventfold metadata format that produced the event</td></tr>
 *     <tr><td>{@value #KIND}</td><td>What the event represents, for example {@code PrivateEvent} or {@code PublicEvent}</td></tr>
 * </table>
 */
public class EventFoldCloudEventExtension implements CloudEventExtension {
    public static final String VERSION = "eventfoldversion";
    public static final String KIND = "eventfoldkind";

    static final Set<String> KEYS = Set.of(VERSION, KIND);

    private int version;
    private String kind;

    public EventFoldCloudEventExtension(int version, String kind) {
        Objects.requireNonNull(kind, "kind cannot be null");
        if (version < 1) {
            throw new IllegalArgumentException("version cannot be less than 1");
        }
        this.version = version;
        this.kind = kind;
    }

    public static EventFoldCloudEventExtension eventfold(int version, String kind) {
        return new EventFoldCloudEventExtension(version, kind);
    }

    @Override
    public void readFrom(CloudEventExtensions extensions) {
        Object version = extensions.getExtension(VERSION);
        if (version instanceof Number) {
            this.version = ((Number) version).intValue();
        }

        Object kind = extensions.getExtension(KIND);
        if (kind != null) {
            this.kind = kind.toString();
        }
    }

    @Override
    public Object getValue(String key) throws IllegalArgumentException {
        if (VERSION.equals(key)) {
            return this.version;
        } else if (KIND.equals(key)) {
            return this.kind;
        }
        throw new IllegalArgumentException(this.getClass().getSimpleName() + " doesn't expect the attribute key \"" + key + "\"");
    }

    @Override
    public Set<String> getKeys() {
        return KEYS;
    }
}
