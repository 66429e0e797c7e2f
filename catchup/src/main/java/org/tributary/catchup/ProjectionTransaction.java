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

package org.tributary.catchup;

/**
 * The transaction a catchup opens around the delivery of a single event. Projector side effects registered with
 * {@link #onCommit(Runnable)} are applied together with the progress of all subscribed projectors.
 * If any projector throws while handling the event, the transaction is rolled back and nothing registered for the event is applied.
 * <p>
 * Side effects run at commit in the order they were registered. A side effect that throws fails the projector that registered it:
 * its remaining side effects are skipped and the failure is recorded against it, while the other projectors' side effects still apply.
 * </p>
 */
public interface ProjectionTransaction {

    /**
     * Register a side effect that is applied when, and only if, the transaction commits.
     */
    void onCommit(Runnable sideEffect);

    /**
     * @return A view of this transaction that registers side effects on behalf of the projector named {@code owner}
     */
    default ProjectionTransaction ownedBy(String owner) {
        return this;
    }
}
