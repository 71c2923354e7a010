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

import me.golemcore.narrator.domain.model.RequestPriority;
import me.golemcore.narrator.domain.model.SpeechRequest;

import java.time.Instant;

/**
 * A request waiting behind the active session.
 *
 * @param request
 *            waiting request
 * @param priority
 *            ordering tier
 * @param timestamp
 *            arrival time
 * @param sequence
 *            arrival counter, breaks timestamp ties
 */
public record QueueEntry(SpeechRequest request, RequestPriority priority, Instant timestamp, long sequence) {
}
