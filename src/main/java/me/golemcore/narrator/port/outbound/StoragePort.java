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

import java.util.concurrent.CompletableFuture;

/**
 * Port for persistent key/value storage. All operations are asynchronous;
 * callers on latency-sensitive paths never wait on the returned futures.
 */
public interface StoragePort {

    /**
     * Read a value.
     *
     * @param key
     *            storage key
     * @param type
     *            value type to deserialize into
     * @return future completing with the value, or {@code null} if absent
     */
    <T> CompletableFuture<T> get(String key, Class<T> type);

    /**
     * Write a value, replacing any previous one. Implementations must never
     * leave a partially written value behind.
     */
    CompletableFuture<Void> set(String key, Object value);

    /**
     * Delete a value if present.
     */
    CompletableFuture<Void> delete(String key);
}
