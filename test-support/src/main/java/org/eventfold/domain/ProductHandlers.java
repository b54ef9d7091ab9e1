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

import org.eventfold.core.CommandHandler;
import org.eventfold.core.EventHandler;

public final class ProductHandlers {

    private ProductHandlers() {
    }

    public static CommandHandler<Product, ProductCommand, ProductEvent> commandHandler() {
        return (product, command) -> command.decide(product);
    }

    public static EventHandler<Product, ProductEvent> eventHandler() {
        return (product, event) -> event.data().applyTo(product);
    }
}
