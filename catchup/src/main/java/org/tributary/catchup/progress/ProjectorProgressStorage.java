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

import java.util.Collection;
import java.util.List;

/**
 * Stores {@link ProjectorProgress}. Returned instances are copies, changes are persisted through a {@link ProgressTransaction}.
 */
public interface ProjectorProgressStorage {

    /**
     * Load the progress of the given projectors. Projectors without progress are not included.
     */
    List<ProjectorProgress> load(Collection<String> names);

    /**
     * Load the progress of the given projectors, creating (and persisting) empty progress for those that have none.
     */
    List<ProjectorProgress> loadOrCreate(Collection<String> names);

    List<ProjectorProgress> loadAll();

    ProgressTransaction beginTransaction();
}
