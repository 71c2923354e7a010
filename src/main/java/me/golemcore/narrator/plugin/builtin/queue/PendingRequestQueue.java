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

import me.golemcore.narrator.domain.model.SpeechRequest;
import me.golemcore.narrator.infrastructure.config.NarratorProperties.OverflowPolicy;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.PriorityQueue;

/**
 * Bounded priority queue of waiting requests: higher priority first, then
 * arrival order within a tier. Not thread-safe; the owner serializes access.
 */
public class PendingRequestQueue {

    static final Comparator<QueueEntry> PROMOTION_ORDER = Comparator
            .comparingInt((QueueEntry entry) -> entry.priority().getRank()).reversed()
            .thenComparing(QueueEntry::timestamp)
            .thenComparingLong(QueueEntry::sequence);

    private final PriorityQueue<QueueEntry> entries = new PriorityQueue<>(PROMOTION_ORDER);
    private final int capacity;
    private final OverflowPolicy overflowPolicy;
    private long nextSequence;

    public PendingRequestQueue(int capacity, OverflowPolicy overflowPolicy) {
        this.capacity = Math.max(0, capacity);
        this.overflowPolicy = overflowPolicy != null ? overflowPolicy : OverflowPolicy.REJECT;
    }

    /**
     * Insert a request.
     *
     * @throws QueueOverflowException
     *             if the queue is full and no entry can be evicted for it
     */
    public Offer offer(SpeechRequest request, Instant timestamp) {
        QueueEntry entry = new QueueEntry(request, request.effectivePriority(), timestamp, nextSequence++);
        QueueEntry evicted = null;

        if (entries.size() >= capacity) {
            evicted = findEvictionCandidate(entry)
                    .orElseThrow(() -> new QueueOverflowException(request.id(), capacity));
            entries.remove(evicted);
        }

        entries.add(entry);
        int position = (int) entries.stream()
                .filter(other -> PROMOTION_ORDER.compare(other, entry) < 0)
                .count();
        return new Offer(entry, position, Optional.ofNullable(evicted));
    }

    public Optional<QueueEntry> poll() {
        return Optional.ofNullable(entries.poll());
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public void clear() {
        entries.clear();
    }

    public int capacity() {
        return capacity;
    }

    /**
     * Entries in promotion order.
     */
    public List<QueueEntry> snapshot() {
        List<QueueEntry> ordered = new ArrayList<>(entries);
        ordered.sort(PROMOTION_ORDER);
        return Collections.unmodifiableList(ordered);
    }

    private Optional<QueueEntry> findEvictionCandidate(QueueEntry newcomer) {
        if (overflowPolicy != OverflowPolicy.EVICT_LOWEST || entries.isEmpty()) {
            return Optional.empty();
        }
        QueueEntry last = Collections.max(entries, PROMOTION_ORDER);
        boolean newcomerOutranks = newcomer.priority().getRank() > last.priority().getRank();
        return newcomerOutranks ? Optional.of(last) : Optional.empty();
    }

    /**
     * Result of a successful insert.
     *
     * @param entry
     *            the inserted entry
     * @param position
     *            zero-based position in promotion order
     * @param evicted
     *            entry dropped to make room, if any
     */
    public record Offer(QueueEntry entry, int position, Optional<QueueEntry> evicted) {
    }
}
