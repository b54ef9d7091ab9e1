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

package org.eventfold.domain;

import org.eventfold.core.EventHandler;
import org.eventfold.core.PersistedEvent;
import org.jspecify.annotations.Nullable;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * A named projection that lists all events of a product together with the time of the latest one.
 */
public record ProductHistory(List<ProductEvent> events, @Nullable OffsetDateTime lastChangedAt) {

    public ProductHistory {
        events = List.copyOf(events);
    }

    public static ProductHistory empty() {
        return new ProductHistory(List.of(), null);
    }

    public ProductHistory append(PersistedEvent<ProductEvent> event) {
        List<ProductEvent> newEvents = new ArrayList<>(events);
        newEvents.add(event.data());
        return new ProductHistory(newEvents, event.time());
    }

    public static EventHandler<ProductHistory, ProductEvent> eventHandler() {
        return ProductHistory::append;
    }
}
