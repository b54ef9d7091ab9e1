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

import org.eventfold.domain.ProductEvent.ProductCreated;
import org.eventfold.domain.ProductEvent.ProductIsPubliclyAvailable;
import org.eventfold.domain.ProductEvent.ProductPriceChanged;
import org.eventfold.result.Result;
import org.eventfold.result.Stage;

import java.util.List;

/**
 * Commands of the product aggregate. Each variant decides which events it results in given the current {@link Product}.
 */
public sealed interface ProductCommand permits ProductCommand.AddProduct, ProductCommand.AddListedProduct, ProductCommand.ChangeProductPrice {
    String PRODUCT_ALREADY_EXISTS = "product already exists";

    String productId();

    Result<List<ProductEvent>> decide(Product product);

    record AddProduct(String productId, String name) implements ProductCommand {
        @Override
        public Result<List<ProductEvent>> decide(Product product) {
            if (product.exists()) {
                return Result.failure(Stage.COMMAND, PRODUCT_ALREADY_EXISTS);
            }
            return Result.success(List.of(new ProductCreated(productId, name)));
        }
    }

    record AddListedProduct(String productId, String name) implements ProductCommand {
        @Override
        public Result<List<ProductEvent>> decide(Product product) {
            if (product.exists()) {
                return Result.failure(Stage.COMMAND, PRODUCT_ALREADY_EXISTS);
            }
            return Result.success(List.of(new ProductCreated(productId, name), new ProductIsPubliclyAvailable(productId)));
        }
    }

    record ChangeProductPrice(String productId, long price) implements ProductCommand {
        @Override
        public Result<List<ProductEvent>> decide(Product product) {
            // Setting the price that the product already has is a no-op
            if (product.exists() && product.price() == price) {
                return Result.success(List.of());
            }
            return Result.success(List.of(new ProductPriceChanged(productId, price)));
        }
    }
}
