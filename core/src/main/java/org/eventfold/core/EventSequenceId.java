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

import java.util.Comparator;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * The identifier of a {@link PersistedEvent}. It's an ordered composite key made up of a per-subject {@code sequence} number
 * and the {@code subject} (for example the id of an aggregate). Events of the same subject are totally ordered by {@code sequence}.
 * <p>
 * On the wire the identifier is represented as a string, {@code <sequence>_<subject>}, for example {@code 7_product-1}. Use
 * {@link #toString()} to get the wire representation and {@link #parse(String)} to get it back.
 * </p>
 *
 * @param sequence The sequence number, always positive
 * @param subject  The subject that the event belongs to
 */
public record EventSequenceId(long sequence, String subject) implements Comparable<EventSequenceId> {
    public static final String SEPARATOR = "_";

    /**
     * The sequence number that is assumed when a subject has neither events nor a snapshot. The first event of a subject
     * is thus assigned sequence {@code BASELINE_SEQUENCE + 1}.
     */
    public static final long BASELINE_SEQUENCE = 1;

    private static final Comparator<EventSequenceId> COMPARATOR = Comparator.comparingLong(EventSequenceId::sequence).thenComparing(EventSequenceId::subject);

    public EventSequenceId {
        requireNonNull(subject, "subject cannot be null");
        if (sequence < 1) {
            throw new IllegalArgumentException("sequence must be positive but was " + sequence);
        }
        if (subject.isEmpty()) {
            throw new IllegalArgumentException("subject cannot be empty");
        }
    }

    /**
     * Parse the wire representation of an identifier.
     *
     * @param id The identifier, for example {@code 7_product-1}
     * @return The parsed {@link EventSequenceId}
     * @throws IllegalArgumentException If {@code id} is malformed, i.e. if the separator is missing, the subject is empty or
     *                                  if the prefix is not a positive integer.
     */
    public static EventSequenceId parse(String id) {
        return tryParse(id).orElseThrow(() -> new IllegalArgumentException("Malformed event id \"" + id + "\", expected <positive sequence>" + SEPARATOR + "<subject>"));
    }

    /**
     * Like {@link #parse(String)} but returns {@link Optional#empty()} instead of throwing when {@code id} is malformed.
     */
    public static Optional<EventSequenceId> tryParse(String id) {
        if (id == null) {
            return Optional.empty();
        }
        int separatorIndex = id.indexOf(SEPARATOR);
        if (separatorIndex < 1 || separatorIndex == id.length() - SEPARATOR.length()) {
            return Optional.empty();
        }

        String prefix = id.substring(0, separatorIndex);
        for (int i = 0; i < prefix.length(); i++) {
            char c = prefix.charAt(i);
            if (c < '0' || c > '9') {
                return Optional.empty();
            }
        }

        final long sequence;
        try {
            sequence = Long.parseLong(prefix);
        } catch (NumberFormatException e) {
            // Overflow
            return Optional.empty();
        }

        if (sequence < 1) {
            return Optional.empty();
        }
        return Optional.of(new EventSequenceId(sequence, id.substring(separatorIndex + SEPARATOR.length())));
    }

    /**
     * @return The identifier that follows this one for the same subject
     */
    public EventSequenceId next() {
        return new EventSequenceId(Math.addExact(sequence, 1), subject);
    }

    @Override
    public int compareTo(EventSequenceId other) {
        return COMPARATOR.compare(this, other);
    }

    /**
     * @return The wire representation, {@code <sequence>_<subject>}
     */
    @Override
    public String toString() {
        return sequence + SEPARATOR + subject;
    }
}
