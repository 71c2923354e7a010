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

/**
 * Notification that a session left the current slot early.
 *
 * @param sessionId
 *            stopped session
 * @param reason
 *            stop cause
 * @param error
 *            collaborator error message, set only for {@link StopReason#ERROR}
 */
public record SessionStopped(String sessionId, StopReason reason, String error) {

    public static SessionStopped of(String sessionId, StopReason reason) {
        return new SessionStopped(sessionId, reason, null);
    }
}
