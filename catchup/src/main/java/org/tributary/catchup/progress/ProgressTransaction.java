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

package org.tributary.catchup.progress;

import org.tributary.catchup.ProjectionTransaction;

import java.util.List;

/**
 * A {@link ProjectionTransaction} that also stages projector progress. Closing a transaction that hasn't been committed rolls it back.
 */
public interface ProgressTransaction extends ProjectionTransaction, AutoCloseable {

    void save(ProjectorProgress progress);

    /**
     * Apply the registered side effects and the saved progress. A throwing side effect doesn't prevent the commit, the
     * remaining side effects of its owner are skipped.
     *
     * @return The side effects that threw, empty if all of them were applied
     */
    List<SideEffectFailure> commit();

    @Override
    void close();
}
