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

/**
 * Incoming request to speak a piece of text.
 *
 * @param id
 *            request id, reused as the session id when admitted
 * @param text
 *            text to synthesize
 * @param voice
 *            voice identifier, {@code null} for the configured default
 * @param speed
 *            playback rate, {@code null} for 1.0
 * @param sourceId
 *            originating tab or source
 * @param priority
 *            ordering tier used when requests are queued
 */
@Builder(toBuilder = true)
public record SpeechRequest(
        String id,
        String text,
        String voice,
        Double speed,
        String sourceId,
        RequestPriority priority
) {

    public RequestPriority effectivePriority() {
        return priority != null ? priority : RequestPriority.NORMAL;
    }
}
