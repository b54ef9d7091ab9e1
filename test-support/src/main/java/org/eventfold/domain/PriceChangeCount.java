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
import org.eventfold.domain.ProductEvent.ProductPriceChanged;

/**
 * A global projection that counts price changes across all products.
 */
public record PriceChangeCount(int count) {

    public static PriceChangeCount zero() {
        return new PriceChangeCount(0);
    }

    public static EventHandler<PriceChangeCount, ProductEvent> eventHandler() {
        return (state, event) -> event.data() instanceof ProductPriceChanged ? new PriceChangeCount(state.count + 1) : state;
    }
}
