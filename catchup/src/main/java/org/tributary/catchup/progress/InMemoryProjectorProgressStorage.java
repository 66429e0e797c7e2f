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

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tributary.catchup.ProjectionTransaction;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * Keeps projector progress in memory. A commit runs the registered side effects and then stores the saved progress while holding
 * the storage lock, so readers never see the progress of an event without the side effects of the same event.
 * A side effect that throws stops the remaining side effects of its owner only.
 */
public class InMemoryProjectorProgressStorage implements ProjectorProgressStorage {
    private static final Logger log = LoggerFactory.getLogger(InMemoryProjectorProgressStorage.class);

    private final Map<String, ProjectorProgress> rows = new LinkedHashMap<>();

    @Override
    public List<ProjectorProgress> load(Collection<String> names) {
        requireNonNull(names, "Names cannot be null");
        synchronized (rows) {
            return names.stream().map(rows::get).filter(Objects::nonNull).map(ProjectorProgress::copy).collect(Collectors.toList());
        }
    }

    @Override
    public List<ProjectorProgress> loadOrCreate(Collection<String> names) {
        requireNonNull(names, "Names cannot be null");
        synchronized (rows) {
            return names.stream().map(name -> rows.computeIfAbsent(name, ProjectorProgress::new).copy()).collect(Collectors.toList());
        }
    }

    @Override
    public List<ProjectorProgress> loadAll() {
        synchronized (rows) {
            return rows.values().stream().map(ProjectorProgress::copy).collect(Collectors.toList());
        }
    }

    @Override
    public ProgressTransaction beginTransaction() {
        return new InMemoryProgressTransaction();
    }

    private class InMemoryProgressTransaction implements ProgressTransaction {
        private final List<SideEffect> sideEffects = new ArrayList<>();
        private final List<ProjectorProgress> saved = new ArrayList<>();
        private boolean completed;

        @Override
        public void onCommit(Runnable sideEffect) {
            register(null, sideEffect);
        }

        @Override
        public ProjectionTransaction ownedBy(String owner) {
            requireNonNull(owner, "Owner cannot be null");
            return sideEffect -> register(owner, sideEffect);
        }

        @Override
        public void save(ProjectorProgress progress) {
            requireNonNull(progress, ProjectorProgress.class.getSimpleName() + " cannot be null");
            requireActive();
            saved.add(progress.copy());
        }

        @Override
        public List<SideEffectFailure> commit() {
            requireActive();
            completed = true;
            List<SideEffectFailure> failures = new ArrayList<>();
            Set<String> failedOwners = new HashSet<>();
            synchronized (rows) {
                for (SideEffect sideEffect : sideEffects) {
                    if (sideEffect.owner != null && failedOwners.contains(sideEffect.owner)) {
                        continue;
                    }
                    try {
                        sideEffect.action.run();
                    } catch (RuntimeException e) {
                        log.warn("Side effect registered by {} failed on commit", sideEffect.owner, e);
                        failures.add(new SideEffectFailure(sideEffect.owner, e));
                        if (sideEffect.owner != null) {
                            failedOwners.add(sideEffect.owner);
                        }
                    }
                }
                saved.forEach(progress -> rows.put(progress.getName(), progress));
            }
            return failures;
        }

        @Override
        public void close() {
            if (!completed) {
                completed = true;
                if (!sideEffects.isEmpty() || !saved.isEmpty()) {
                    log.debug("Rolling back transaction with {} side effects and {} progress updates", sideEffects.size(), saved.size());
                }
                sideEffects.clear();
                saved.clear();
            }
        }

        private void register(@Nullable String owner, Runnable sideEffect) {
            requireNonNull(sideEffect, "Side effect cannot be null");
            requireActive();
            sideEffects.add(new SideEffect(owner, sideEffect));
        }

        private void requireActive() {
            if (completed) {
                throw new IllegalStateException("Transaction is already completed");
            }
        }
    }

    private static class SideEffect {
        private final @Nullable String owner;
        private final Runnable action;

        private SideEffect(@Nullable String owner, Runnable action) {
            this.owner = owner;
            this.action = action;
        }
    }
}
