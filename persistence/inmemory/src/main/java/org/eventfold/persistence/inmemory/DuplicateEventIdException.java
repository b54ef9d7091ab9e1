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

package org.eventfold.persistence.inmemory;

import org.eventfold.core.EventSequenceId;

import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * An exception thrown if events are appended whose identifiers already exist in the {@link InMemoryEventLog}. This typically
 * happens when two commands for the same subject are handled concurrently.
 */
public class DuplicateEventIdException extends RuntimeException {
    private final String subject;
    private final List<EventSequenceId> duplicateIds;

    public DuplicateEventIdException(String subject, List<EventSequenceId> duplicateIds) {
        super("Duplicate event ids detected for subject " + subject + ": " + duplicateIds);
        this.subject = subject;
        this.duplicateIds = List.copyOf(duplicateIds);
    }

    public String getSubject() {
        return subject;
    }

    public List<EventSequenceId> getDuplicateIds() {
        return duplicateIds;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DuplicateEventIdException)) return false;
        DuplicateEventIdException that = (DuplicateEventIdException) o;
        return Objects.equals(subject, that.subject) && Objects.equals(duplicateIds, that.duplicateIds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(subject, duplicateIds);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", DuplicateEventIdException.class.getSimpleName() + "[", "]")
                .add("subject='" + subject + "'")
                .add("duplicateIds=" + duplicateIds)
                .toString();
    }
}
