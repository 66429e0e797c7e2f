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

package org.tributary.lock.mongodb.internal;

import com.mongodb.ErrorCategory;
import com.mongodb.MongoCommandException;
import com.mongodb.WriteConcern;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.FindOneAndUpdateOptions;
import com.mongodb.client.model.ReturnDocument;
import com.mongodb.client.result.UpdateResult;
import org.bson.BsonDocument;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.jspecify.annotations.NullMarked;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tributary.retry.RetryStrategy;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.OptionalLong;

import static com.mongodb.ErrorCategory.DUPLICATE_KEY;
import static com.mongodb.client.model.Filters.and;
import static com.mongodb.client.model.Filters.eq;
import static com.mongodb.client.model.Filters.exists;
import static com.mongodb.client.model.Filters.lte;
import static com.mongodb.client.model.Filters.not;
import static com.mongodb.client.model.Filters.or;
import static com.mongodb.client.model.Projections.include;
import static com.mongodb.client.model.Updates.combine;
import static com.mongodb.client.model.Updates.set;
import static java.util.Arrays.asList;
import static java.util.Collections.singletonList;

/**
 * Operations on the lock documents. Each lock is stored as {@code {_id: <lock name>, owner, version, expiresAt}}.
 */
@NullMarked
public class MongoLockDocuments {
    private static final Logger log = LoggerFactory.getLogger(MongoLockDocuments.class);

    /**
     * Acquire the lock {@code lockName} for {@code owner}, or refresh it if {@code owner} already holds it.
     * The version is incremented whenever the lock changes owner and is used as fencing token.
     *
     * @return The version of the lock if {@code owner} holds it, otherwise empty.
     */
    public static OptionalLong acquireOrRefresh(MongoCollection<BsonDocument> collection, Clock clock, RetryStrategy retryStrategy, Duration leaseTime,
                                                String lockName, String owner) {
        return retryStrategy.execute(() -> {
            try {
                logDebug("acquireOrRefresh (owner={}, lockName={})", owner, lockName);
                BsonDocument found = collection
                        .withWriteConcern(WriteConcern.MAJORITY)
                        .findOneAndUpdate(
                                and(eq("_id", lockName), or(lockIsExpired(clock), eq("owner", owner))),
                                singletonList(combine(
                                        set("owner", owner),
                                        set("version", sameIfRefreshOtherwiseIncrement(owner)),
                                        set("expiresAt", clock.instant().plus(leaseTime)))),
                                new FindOneAndUpdateOptions()
                                        .projection(include("version"))
                                        .returnDocument(ReturnDocument.AFTER)
                                        .upsert(true));

                if (found == null) {
                    throw new IllegalStateException("No lock document upserted for " + lockName + ", but none found.");
                }
                long version = found.getNumber("version").longValue();
                logDebug("Holding lock {} (owner={}, version={})", lockName, owner, version);
                return OptionalLong.of(version);
            } catch (MongoCommandException e) {
                ErrorCategory errorCategory = ErrorCategory.fromErrorCode(e.getErrorCode());
                if (errorCategory.equals(DUPLICATE_KEY)) {
                    // Held by someone else, the upsert collided with the existing document
                    return OptionalLong.empty();
                }
                throw e;
            }
        });
    }

    /**
     * Extend the lease of a lock held by {@code owner}.
     *
     * @return {@code false} if {@code owner} no longer holds the lock.
     */
    public static boolean refresh(MongoCollection<BsonDocument> collection, Clock clock, RetryStrategy retryStrategy, Duration leaseTime, String lockName, String owner) {
        return retryStrategy.execute(() -> {
            UpdateResult result = collection
                    .withWriteConcern(WriteConcern.MAJORITY)
                    .updateOne(and(eq("_id", lockName), eq("owner", owner)), set("expiresAt", clock.instant().plus(leaseTime)));
            boolean stillHeld = result.getMatchedCount() != 0;
            logDebug("Refreshed lock {} (owner={}, stillHeld={})", lockName, owner, stillHeld);
            return stillHeld;
        });
    }

    /**
     * Release the lock by setting it as expired. The document is kept so that the version keeps increasing.
     */
    public static void release(MongoCollection<BsonDocument> collection, RetryStrategy retryStrategy, String lockName, String owner) {
        retryStrategy.execute(() -> {
            logDebug("Releasing lock {} (owner={})", lockName, owner);
            collection.withWriteConcern(WriteConcern.MAJORITY)
                    .updateOne(and(eq("_id", lockName), eq("owner", owner)), set("expiresAt", null));
        });
    }

    private static Bson lockIsExpired(Clock clock) {
        return or(
                eq("expiresAt", null),
                not(exists("expiresAt")),
                lte("expiresAt", clock.instant()));
    }

    private static Document sameIfRefreshOtherwiseIncrement(String owner) {
        Map<String, Object> map = new HashMap<>();
        map.put("if", new Document("$ne", asList("$owner", owner)));
        map.put("then", new Document("$ifNull", asList(new Document("$add", asList("$version", 1)), 0)));
        map.put("else", "$version");
        return new Document("$cond", new Document(map));
    }

    private static void logDebug(String message, Object... params) {
        if (log.isDebugEnabled()) {
            log.debug(message, params);
        }
    }
}
