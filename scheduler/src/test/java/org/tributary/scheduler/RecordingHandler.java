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

package org.tributary.scheduler;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Records deliveries. Fails while {@link #failWith} returns an exception.
 */
class RecordingHandler implements ScheduledCommandHandler {
    final List<CommandDelivery> deliveries = new CopyOnWriteArrayList<>();
    final List<CommandFailed> failures = new CopyOnWriteArrayList<>();
    volatile FailurePolicy failWith = __ -> null;
    volatile Consumer<CommandFailed> onFailure = __ -> {
    };

    @Override
    public void deliver(CommandDelivery delivery) throws Exception {
        deliveries.add(delivery);
        Exception exception = failWith.exceptionFor(delivery);
        if (exception != null) {
            throw exception;
        }
    }

    @Override
    public void onFailure(CommandFailed failure) {
        failures.add(failure);
        onFailure.accept(failure);
    }

    long deliveriesOf(ScheduledCommandKey key) {
        return deliveries.stream().filter(delivery -> delivery.command().key().equals(key)).count();
    }

    @FunctionalInterface
    interface FailurePolicy {
        Exception exceptionFor(CommandDelivery delivery);
    }
}
