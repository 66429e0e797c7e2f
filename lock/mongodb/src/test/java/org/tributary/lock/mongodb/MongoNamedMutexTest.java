/*
 * Copyright 2024 The Tributary Authors
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

package org.tributary.lock.mongodb;

import com.mongodb.ConnectionString;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import org.bson.Document;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.tributary.lock.LockGuard;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertAll;

@Testcontainers(disabledWithoutDocker = true)
@DisplayNameGeneration(ReplaceUnderscores.class)
@Timeout(30)
class MongoNamedMutexTest {

    @Container
    private static final MongoDBContainer mongoDBContainer = new MongoDBContainer("mongo:4.2.8");

    private MongoClient mongoClient;
    private MongoNamedMutex mutex;
    private String collectionName;

    @BeforeEach
    void create_mutex() {
        mongoClient = MongoClients.create(new ConnectionString(mongoDBContainer.getReplicaSetUrl()));
        collectionName = "locks-" + UUID.randomUUID();
        MongoNamedMutexConfig config = new MongoNamedMutexConfig()
                .withCollectionName(collectionName)
                .withLeaseTime(Duration.ofSeconds(2))
                .withPollInterval(Duration.ofMillis(20));
        mutex = new MongoNamedMutex(mongoClient.getDatabase("test"), config);
    }

    @AfterEach
    void close_mutex() {
        mutex.close();
        mongoClient.close();
    }

    @Test
    void only_one_guard_can_hold_a_named_lock() {
        // Given
        Optional<LockGuard> first = mutex.tryAcquire("catchup", Duration.ZERO);

        // When
        Optional<LockGuard> second = mutex.tryAcquire("catchup", Duration.ofMillis(200));

        // Then
        assertAll(
                () -> assertThat(first).isPresent(),
                () -> assertThat(second).isEmpty()
        );
    }

    @Test
    void waiting_acquirer_gets_the_lock_with_a_greater_fencing_token_when_the_holder_releases() throws Exception {
        // Given
        LockGuard first = mutex.tryAcquire("catchup", Duration.ZERO).orElseThrow();
        CompletableFuture<Optional<LockGuard>> waiting = CompletableFuture.supplyAsync(() -> mutex.tryAcquire("catchup", Duration.ofSeconds(10)));

        // When
        Thread.sleep(200);
        first.release();

        // Then
        Optional<LockGuard> second = waiting.get(10, TimeUnit.SECONDS);
        assertAll(
                () -> assertThat(second).isPresent(),
                () -> assertThat(second.orElseThrow().fencingToken()).isGreaterThan(first.fencingToken()),
                () -> assertThat(first.refresh()).isFalse()
        );
    }

    @Test
    void held_lock_is_refreshed_in_the_background_beyond_the_lease_time() {
        // Given
        LockGuard first = mutex.tryAcquire("catchup", Duration.ZERO).orElseThrow();

        // When
        await().pollDelay(Duration.ofSeconds(3)).atMost(Duration.ofSeconds(5)).until(() -> true);

        // Then
        assertAll(
                () -> assertThat(mutex.tryAcquire("catchup", Duration.ZERO)).isEmpty(),
                () -> assertThat(first.refresh()).isTrue()
        );
    }

    @Test
    void a_guard_whose_lock_was_taken_over_is_marked_as_no_longer_held_by_the_background_refresh() {
        // Given
        LockGuard first = mutex.tryAcquire("catchup", Duration.ZERO).orElseThrow();
        mongoClient.getDatabase("test").getCollection(collectionName).deleteMany(new Document());
        LockGuard second = mutex.tryAcquire("catchup", Duration.ZERO).orElseThrow();

        // When
        await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> assertThat(first.isHeld()).isFalse());

        // Then
        assertAll(
                () -> assertThat(first.isReleased()).isFalse(),
                () -> assertThat(first.refresh()).isFalse(),
                () -> assertThat(second.isHeld()).isTrue()
        );
    }
}
