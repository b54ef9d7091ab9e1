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

import org.eventfold.core.EventKind;
import org.eventfold.core.PersistedBundle;
import org.eventfold.core.PersistedEvent;
import org.eventfold.core.Snapshot;
import org.eventfold.domain.Product;
import org.eventfold.domain.ProductEvent;
import org.eventfold.domain.ProductEvent.ProductCreated;
import org.eventfold.domain.ProductEvent.ProductPriceChanged;
import org.eventfold.result.Result;
import org.eventfold.result.Stage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.eventfold.domain.ProductTestData.persisted;
import static org.eventfold.domain.ProductTestData.storedEvents;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayNameGeneration(ReplaceUnderscores.class)
class InMemoryPersistenceHandlerTest {

    private InMemoryEventLog<ProductEvent> eventLog;
    private InMemoryPersistenceHandler<Product, ProductEvent> persistenceHandler;

    @BeforeEach
    void create_persistence_handler() {
        eventLog = new InMemoryEventLog<>();
        persistenceHandler = new InMemoryPersistenceHandler<>(eventLog);
    }

    @Nested
    class Save {

        @Test
        void stores_events_by_subject() {
            // When
            Result<Void> result = persistenceHandler.save(storedEvents()).block();

            // Then
            assertAll(
                    () -> assertThat(result.isSuccess()).isTrue(),
                    () -> assertThat(eventLog.read("1")).isEqualTo(storedEvents()),
                    () -> assertThat(eventLog.count()).isEqualTo(7)
            );
        }

        @Test
        void rejects_events_whose_ids_are_already_stored() {
            // Given
            persistenceHandler.save(List.of(persisted(2, new ProductCreated("1", "test")))).block();

            // When
            Result<Void> result = persistenceHandler.save(List.of(persisted(2, new ProductCreated("1", "other")))).block();

            // Then
            assertAll(
                    () -> assertThat(result.isFailure()).isTrue(),
                    () -> assertThat(((Result.Failure<Void>) result).stage()).isEqualTo(Stage.PERSISTENCE),
                    () -> assertThat(eventLog.read("1")).hasSize(1)
            );
        }

        @Test
        void rejects_the_whole_append_if_one_id_collides() {
            // Given
            persistenceHandler.save(List.of(persisted(2, new ProductCreated("1", "test")), persisted(3, new ProductPriceChanged("1", 10)))).block();

            // When
            Result<Void> result = persistenceHandler.save(List.of(persisted(3, new ProductPriceChanged("1", 20)), persisted(4, new ProductPriceChanged("1", 30)))).block();

            // Then
            assertAll(
                    () -> assertThat(result.isFailure()).isTrue(),
                    () -> assertThat(eventLog.read("1")).extracting(PersistedEvent::sequence).containsExactly(2L, 3L)
            );
        }

        @Test
        void listener_is_invoked_with_appended_events() {
            // Given
            List<PersistedEvent<ProductEvent>> appended = new CopyOnWriteArrayList<>();
            InMemoryPersistenceHandler<Product, ProductEvent> handler = new InMemoryPersistenceHandler<>(new InMemoryEventLog<ProductEvent>(appended::addAll));

            // When
            handler.save(storedEvents()).block();

            // Then
            assertThat(appended).isEqualTo(storedEvents());
        }
    }

    @Nested
    class Get {

        @Test
        void returns_empty_bundle_for_unknown_id() {
            // When
            PersistedBundle<Product, ProductEvent> bundle = persistenceHandler.get("unknown").block().get();

            // Then
            assertAll(
                    () -> assertThat(bundle.snapshot()).isNull(),
                    () -> assertThat(bundle.events()).isEmpty(),
                    () -> assertThat(bundle.key()).isEqualTo("unknown")
            );
        }

        @Test
        void returns_latest_snapshot_and_only_events_after_it() {
            // Given
            persistenceHandler.save(storedEvents()).block();
            persistenceHandler.snapshot(new Snapshot<>("1", Product.empty(), 4, 1, EventKind.AGGREGATE_SNAPSHOT)).block();
            Snapshot<Product> latest = new Snapshot<>("1", Product.empty(), 6, 1, EventKind.AGGREGATE_SNAPSHOT);
            persistenceHandler.snapshot(latest).block();

            // When
            PersistedBundle<Product, ProductEvent> bundle = persistenceHandler.get("1").block().get();

            // Then
            assertAll(
                    () -> assertThat(bundle.snapshot()).isEqualTo(latest),
                    () -> assertThat(bundle.events()).extracting(PersistedEvent::sequence).containsExactly(7L, 8L),
                    () -> assertThat(persistenceHandler.snapshots("1")).hasSize(2)
            );
        }

        @Test
        void returns_all_events_when_latest_snapshot_has_another_schema_version_than_the_accepted_one() {
            // Given
            InMemoryPersistenceHandler<Product, ProductEvent> handler = new InMemoryPersistenceHandler<>(eventLog, 2);
            handler.save(storedEvents()).block();
            handler.snapshot(new Snapshot<>("1", Product.empty(), 6, 1, EventKind.AGGREGATE_SNAPSHOT)).block();

            // When
            PersistedBundle<Product, ProductEvent> bundle = handler.get("1").block().get();

            // Then
            assertAll(
                    () -> assertThat(bundle.snapshot()).isNotNull(),
                    () -> assertThat(bundle.events()).hasSize(7)
            );
        }

        @Test
        void get_all_returns_events_of_every_subject() {
            // Given
            persistenceHandler.save(storedEvents()).block();
            persistenceHandler.save(List.of(persisted(2, new ProductCreated("2", "other")))).block();

            // When
            PersistedBundle<Product, ProductEvent> bundle = persistenceHandler.getAll("PriceChangeCount").block().get();

            // Then
            assertAll(
                    () -> assertThat(bundle.key()).isEqualTo("PriceChangeCount"),
                    () -> assertThat(bundle.events()).hasSize(8),
                    () -> assertThat(bundle.events()).extracting(PersistedEvent::subject).containsOnly("1", "2")
            );
        }

        @Test
        void get_all_carries_the_log_position_of_the_last_appended_event() {
            // Given
            persistenceHandler.save(storedEvents()).block();
            persistenceHandler.save(List.of(persisted(2, new ProductCreated("2", "other")))).block();

            // When
            PersistedBundle<Product, ProductEvent> bundle = persistenceHandler.getAll("PriceChangeCount").block().get();

            // Then
            assertAll(
                    () -> assertThat(bundle.logPosition()).isEqualTo(9L),
                    () -> assertThat(bundle.checkpoint()).isEqualTo(9),
                    () -> assertThat(bundle.lastEventSequence()).isEqualTo(2)
            );
        }

        @Test
        void get_all_returns_events_appended_after_the_snapshot_position_whatever_their_sequence() {
            // Given
            persistenceHandler.save(storedEvents()).block();
            persistenceHandler.save(List.of(persisted(2, new ProductCreated("2", "other")))).block();
            persistenceHandler.snapshot(new Snapshot<>("PriceChangeCount", Product.empty(), 9, 1, EventKind.GLOBAL_PROJECTION)).block();
            persistenceHandler.save(List.of(persisted(3, new ProductPriceChanged("2", 100)))).block();

            // When
            PersistedBundle<Product, ProductEvent> bundle = persistenceHandler.getAll("PriceChangeCount").block().get();

            // Then
            assertAll(
                    () -> assertThat(bundle.events()).extracting(event -> event.id().toString()).containsExactly("3_2"),
                    () -> assertThat(bundle.checkpoint()).isEqualTo(10)
            );
        }

        @Test
        void get_all_returns_every_event_when_global_snapshot_has_another_schema_version_than_the_accepted_one() {
            // Given
            InMemoryPersistenceHandler<Product, ProductEvent> handler = new InMemoryPersistenceHandler<>(eventLog, 2);
            handler.save(storedEvents()).block();
            handler.snapshot(new Snapshot<>("PriceChangeCount", Product.empty(), 8, 1, EventKind.GLOBAL_PROJECTION)).block();

            // When
            PersistedBundle<Product, ProductEvent> bundle = handler.getAll("PriceChangeCount").block().get();

            // Then
            assertAll(
                    () -> assertThat(bundle.snapshot()).isNotNull(),
                    () -> assertThat(bundle.events()).hasSize(7),
                    () -> assertThat(bundle.checkpoint()).isEqualTo(8)
            );
        }

        @Test
        void snapshots_are_kept_per_key() {
            // Given
            persistenceHandler.snapshot(new Snapshot<>("1", Product.empty(), 4, 1, EventKind.AGGREGATE_SNAPSHOT)).block();
            persistenceHandler.snapshot(new Snapshot<>("2", Product.empty(), 4, 1, EventKind.AGGREGATE_SNAPSHOT)).block();

            // Then
            assertAll(
                    () -> assertThat(persistenceHandler.snapshotCount()).isEqualTo(2),
                    () -> assertThat(persistenceHandler.latestSnapshot("3")).isEmpty()
            );
        }
    }
}
