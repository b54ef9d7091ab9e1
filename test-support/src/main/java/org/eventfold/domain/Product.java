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

import static java.util.Objects.requireNonNull;

/**
 * The state of the product aggregate.
 */
public record Product(String id, String name, long price, boolean listed) {

    public Product {
        requireNonNull(id, "id cannot be null");
        requireNonNull(name, "name cannot be null");
    }

    public static Product empty() {
        return new Product("", "", 0, false);
    }

    public boolean exists() {
        return !name.isEmpty();
    }

    Product created(String id, String name) {
        return new Product(id, name, price, listed);
    }

    Product withPrice(long price) {
        return new Product(id, name, price, listed);
    }

    Product publiclyAvailable() {
        return new Product(id, name, price, true);
    }
}
