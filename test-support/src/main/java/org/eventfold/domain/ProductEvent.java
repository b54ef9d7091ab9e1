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

/**
 * Events of the product aggregate. Every variant implements {@link #applyTo(Product)} so that the compiler rejects an
 * event that can't be applied.
 */
public sealed interface ProductEvent permits ProductEvent.ProductCreated, ProductEvent.ProductPriceChanged, ProductEvent.ProductIsPubliclyAvailable {

    String productId();

    Product applyTo(Product product);

    record ProductCreated(String productId, String name) implements ProductEvent {
        @Override
        public Product applyTo(Product product) {
            return product.created(productId, name);
        }
    }

    record ProductPriceChanged(String productId, long price) implements ProductEvent {
        @Override
        public Product applyTo(Product product) {
            return product.withPrice(price);
        }
    }

    record ProductIsPubliclyAvailable(String productId) implements ProductEvent {
        @Override
        public Product applyTo(Product product) {
            return product.publiclyAvailable();
        }
    }
}
