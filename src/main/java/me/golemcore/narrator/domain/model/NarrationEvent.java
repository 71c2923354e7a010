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

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable bus event. Pipeline plugins that need to change an event return a
 * copy built with {@link #withPayload(Object)}; delivery never mutates it.
 *
 * @param id
 *            unique event id
 * @param topic
 *            channel the event travels on
 * @param payload
 *            topic-typed payload
 * @param timestamp
 *            creation time
 * @param <T>
 *            payload generic type
 */
public record NarrationEvent<T>(
        String id,
        Topic<T> topic,
        T payload,
        Instant timestamp
) {

    public NarrationEvent {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(topic, "topic must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
    }

    public String type() {
        return topic.name();
    }

    public boolean isOn(Topic<?> candidate) {
        return topic.equals(candidate);
    }

    public NarrationEvent<T> withPayload(T newPayload) {
        return new NarrationEvent<>(id, topic, newPayload, timestamp);
    }

    /**
     * Narrow a wildcard event to the expected topic.
     *
     * @throws IllegalArgumentException
     *             if the event travels on another topic
     */
    @SuppressWarnings("unchecked")
    public <P> NarrationEvent<P> as(Topic<P> expected) {
        if (!isOn(expected)) {
            throw new IllegalArgumentException("Event " + id + " is on " + topic + ", not " + expected);
        }
        return (NarrationEvent<P>) this;
    }
}
