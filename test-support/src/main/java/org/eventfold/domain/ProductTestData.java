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

import org.eventfold.core.EventMetadata;
import org.eventfold.core.EventSequenceId;
import org.eventfold.core.PersistedEvent;
import org.eventfold.domain.ProductEvent.ProductCreated;
import org.eventfold.domain.ProductEvent.ProductPriceChanged;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.eventfold.core.PersistedEvent.DEFAULT_CONTENT_TYPE;
import static org.eventfold.core.PersistedEvent.SPEC_VERSION;

/**
 * Seven stored events for product "1" with sequences 2 to 8: a creation followed by six price changes (200 to 205),
 * one minute apart.
 */
public final class ProductTestData {
    public static final String SOURCE = "eventfold-tests";
    public static final String PRODUCT_ID = "1";
    public static final OffsetDateTime FIRST_EVENT_TIME = OffsetDateTime.parse("2024-04-19T13:37:50.937Z");

    private ProductTestData() {
    }

    public static List<PersistedEvent<ProductEvent>> storedEvents() {
        List<PersistedEvent<ProductEvent>> events = new ArrayList<>();
        events.add(persisted(2, new ProductCreated(PRODUCT_ID, "test")));
        for (int i = 0; i < 6; i++) {
            events.add(persisted(3 + i, new ProductPriceChanged(PRODUCT_ID, 200 + i)));
        }
        return List.copyOf(events);
    }

    public static PersistedEvent<ProductEvent> lastStoredEvent() {
        List<PersistedEvent<ProductEvent>> events = storedEvents();
        return events.get(events.size() - 1);
    }

    public static PersistedEvent<ProductEvent> persisted(long sequence, ProductEvent event) {
        return new PersistedEvent<>(new EventSequenceId(sequence, event.productId()), event.getClass().getSimpleName(), event,
                FIRST_EVENT_TIME.plusMinutes(sequence - 2), DEFAULT_CONTENT_TYPE, SPEC_VERSION, SOURCE, EventMetadata.privateEvent());
    }
}
