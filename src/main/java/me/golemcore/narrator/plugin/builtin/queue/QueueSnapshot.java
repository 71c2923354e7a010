package me.golemcore.narrator.plugin.builtin.queue;

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

import me.golemcore.narrator.domain.model.NarrationSession;

import java.time.Instant;
import java.util.List;

/**
 * Read-only view of the queue manager. {@code currentSession} is a copy.
 */
public record QueueSnapshot(
        NarrationSession currentSession,
        List<QueueEntry> pending,
        long totalProcessed,
        long totalStopped,
        long totalErrors,
        long totalRejected,
        Instant lastActivity,
        boolean stopPrevious
) {

    public int queueLength() {
        return pending.size();
    }
}
