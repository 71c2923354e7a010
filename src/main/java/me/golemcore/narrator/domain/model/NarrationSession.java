package me.golemcore.narrator.domain.model;

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

import lombok.Builder;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;

/**
 * One synthesis/playback attempt from request to terminal outcome.
 *
 * <p>
 * Only the queue manager mutates a session. Everything handed to observers is
 * a {@link #snapshot()} copy.
 */
@Getter
@Builder(toBuilder = true)
public class NarrationSession {

    private final String sessionId;
    private final String sourceId;
    private final String text;
    private final String voiceId;
    private final double speed;
    private final Instant startTime;

    @Builder.Default
    private SessionStatus status = SessionStatus.QUEUED;

    private StopReason stopReason;
    private int progress;
    private Instant pausedTime;
    private Instant resumeTime;
    private Instant endTime;

    public boolean isActive() {
        return !status.isTerminal();
    }

    public Duration age(Instant now) {
        return Duration.between(startTime, now);
    }

    public void markPlaying(Instant now) {
        SessionStatus previous = status;
        transitionTo(SessionStatus.PLAYING);
        if (previous == SessionStatus.PAUSED) {
            resumeTime = now;
        }
    }

    public void markPaused(Instant now) {
        transitionTo(SessionStatus.PAUSED);
        pausedTime = now;
    }

    public void markCompleted(Instant now) {
        transitionTo(SessionStatus.COMPLETED);
        progress = 100;
        endTime = now;
    }

    public void markStopped(StopReason reason, Instant now) {
        transitionTo(SessionStatus.STOPPED);
        stopReason = reason;
        endTime = now;
    }

    public void updateProgress(int value) {
        progress = Math.max(0, Math.min(100, value));
    }

    public NarrationSession snapshot() {
        return toBuilder().build();
    }

    private void transitionTo(SessionStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalStateException(
                    "Illegal session transition " + status + " -> " + target + " for " + sessionId);
        }
        status = target;
    }
}
