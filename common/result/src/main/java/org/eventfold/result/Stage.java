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

package org.eventfold.result;

import java.util.Arrays;
import java.util.Objects;

/**
 * The stage at which an operation failed. Every {@link Result.Failure} carries exactly one stage.
 * <br><br>
 * <table>
 *     <tr><th>Stage</th><th>Tag</th><th>Description</th></tr>
 *     <tr><td>{@link #MANY}</td><td>{@code Many}</td><td>Several failures were combined into one</td></tr>
 *     <tr><td>{@link #PERSISTENCE}</td><td>{@code Persistance}</td><td>Fetching, saving or snapshotting through the persistence handler failed</td></tr>
 *     <tr><td>{@link #COMMAND}</td><td>{@code Command}</td><td>The command handler rejected the command</td></tr>
 *     <tr><td>{@link #PROJECTION}</td><td>{@code Projection}</td><td>Reading a projection failed</td></tr>
 *     <tr><td>{@link #PUBLISHING}</td><td>{@code Publishing}</td><td>The publishing handler failed</td></tr>
 * </table>
 */
public enum Stage {
    MANY("Many"),
    PERSISTENCE("Persistance"),
    COMMAND("Command"),
    PROJECTION("Projection"),
    PUBLISHING("Publishing");

    private final String tag;

    Stage(String tag) {
        this.tag = tag;
    }

    /**
     * @return The tag of this stage as it appears on the wire and in external tooling.
     */
    public String tag() {
        return tag;
    }

    /**
     * Find the stage that has the given {@code tag}.
     *
     * @param tag The tag, for example {@code Persistance}
     * @return The matching {@link Stage}
     * @throws IllegalArgumentException If no stage has the given tag
     */
    public static Stage fromTag(String tag) {
        Objects.requireNonNull(tag, "tag cannot be null");
        return Arrays.stream(values())
                .filter(stage -> stage.tag.equals(tag))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown stage tag \"" + tag + "\""));
    }
}
