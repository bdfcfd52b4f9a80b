/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements. See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership. The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License. You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied. See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package io.sshlite.client.session;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Runs the delayed reconnection attempts of a {@link SessionRegistry}. Every scheduled attempt is represented by a
 * handle that can be cancelled before it runs.
 */
@FunctionalInterface
public interface ReconnectScheduler {
    /**
     * @param  task  The attempt to run
     * @param  delay Delay before running it
     * @return       A handle for cancelling the attempt
     */
    ScheduledTask schedule(Runnable task, Duration delay);

    /**
     * Handle of a scheduled attempt
     */
    @FunctionalInterface
    interface ScheduledTask {
        /**
         * @return {@code true} if the task was cancelled before it ran
         */
        boolean cancel();
    }

    /**
     * @param  executor The executor used to run the attempts
     * @return          A scheduler delegating to the executor
     */
    static ReconnectScheduler of(ScheduledExecutorService executor) {
        Objects.requireNonNull(executor, "No executor");
        return (task, delay) -> {
            ScheduledFuture<?> future = executor.schedule(task, delay.toMillis(), TimeUnit.MILLISECONDS);
            return () -> future.cancel(false);
        };
    }
}
