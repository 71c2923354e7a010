package me.golemcore.narrator.port.outbound;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import java.time.Duration;

/**
 * Port for deferred and recurring work. Every scheduled task is owned by the
 * caller, which cancels it when it is no longer needed.
 */
public interface SchedulerPort {

    /**
     * Run {@code task} once after {@code delay}.
     */
    ScheduledTask schedule(Runnable task, Duration delay);

    /**
     * Run {@code task} every {@code period}, first after one period.
     */
    ScheduledTask scheduleAtFixedRate(Runnable task, Duration period);

    /**
     * Cancellable handle of scheduled work.
     */
    interface ScheduledTask {

        /**
         * Cancel future runs. A run already in progress is not interrupted.
         */
        void cancel();

        boolean isDone();
    }
}
