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

/**
 * The pending queue is full and the request cannot be accepted.
 */
public class QueueOverflowException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String requestId;
    private final int maxQueueSize;

    public QueueOverflowException(String requestId, int maxQueueSize) {
        super("Queue full (" + maxQueueSize + "), rejected request " + requestId);
        this.requestId = requestId;
        this.maxQueueSize = maxQueueSize;
    }

    public String getRequestId() {
        return requestId;
    }

    public int getMaxQueueSize() {
        return maxQueueSize;
    }
}
