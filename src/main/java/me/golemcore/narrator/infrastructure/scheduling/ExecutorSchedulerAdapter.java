package me.golemcore.narrator.infrastructure.scheduling;

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

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.narrator.port.outbound.SchedulerPort;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * {@link SchedulerPort} backed by a single daemon thread, so scheduled tasks
 * never run in parallel with each other.
 */
@Component
@Slf4j
public class ExecutorSchedulerAdapter implements SchedulerPort {

    private static final String THREAD_NAME = "narrator-scheduler";

    private final ScheduledExecutorService scheduler;

    public ExecutorSchedulerAdapter() {
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, THREAD_NAME);
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public ScheduledTask schedule(Runnable task, Duration delay) {
        ScheduledFuture<?> future = scheduler.schedule(guard(task), delay.toMillis(), TimeUnit.MILLISECONDS);
        return new FutureTask(future);
    }

    @Override
    public ScheduledTask scheduleAtFixedRate(Runnable task, Duration period) {
        long periodMillis = period.toMillis();
        ScheduledFuture<?> future = scheduler.scheduleAtFixedRate(guard(task), periodMillis, periodMillis,
                TimeUnit.MILLISECONDS);
        return new FutureTask(future);
    }

    @PreDestroy
    public void shutdown() {
        scheduler.shutdownNow();
        log.debug("[Scheduler] Shut down");
    }

    // An escaping exception would silently cancel a fixed-rate task.
    private Runnable guard(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) { // NOSONAR - keep the scheduler thread alive
                log.error("[Scheduler] Scheduled task failed: {}", e.getMessage(), e);
            }
        };
    }

    private record FutureTask(ScheduledFuture<?> future) implements ScheduledTask {

        @Override
        public void cancel() {
            future.cancel(false);
        }

        @Override
        public boolean isDone() {
            return future.isDone();
        }
    }
}
