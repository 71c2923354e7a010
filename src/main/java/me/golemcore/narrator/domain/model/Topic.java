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

import java.util.Objects;

/**
 * Typed bus channel. Handlers subscribed to a topic receive events whose
 * payload is an instance of {@code payloadType}.
 *
 * @param name
 *            wire name, namespaced as {@code area:action}
 * @param payloadType
 *            payload contract
 * @param <T>
 *            payload generic type
 */
public record Topic<T>(String name, Class<T> payloadType) {

    public Topic {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(payloadType, "payloadType must not be null");
        if (name.isBlank() || name.contains("*")) {
            throw new IllegalArgumentException("Invalid topic name: " + name);
        }
    }

    public static <T> Topic<T> of(String name, Class<T> payloadType) {
        return new Topic<>(name, payloadType);
    }

    @Override
    public String toString() {
        return name;
    }
}
