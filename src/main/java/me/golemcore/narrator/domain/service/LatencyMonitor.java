package me.golemcore.narrator.domain.service;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.narrator.infrastructure.config.NarratorProperties;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Records operation timings against latency budgets.
 *
 * <p>
 * Samples are kept per category in a bounded window. A sample above the
 * category budget is logged at WARN. Categories without a budget are only
 * recorded.
 */
@Service
@Slf4j
public class LatencyMonitor {

    public static final String ADMISSION = "queue.admission";
    public static final String CANCELLATION = "queue.cancellation";
    public static final String STAGE_PREFIX = "pipeline.stage.";

    private final Map<String, Deque<Long>> samplesByCategory = new ConcurrentHashMap<>();
    private final NarratorProperties.LatencyProperties properties;

    public LatencyMonitor(NarratorProperties properties) {
        this.properties = properties.getLatency();
    }

    /**
     * Record the time elapsed since {@code startNanos} (a
     * {@link System#nanoTime()} reading).
     *
     * @return the recorded duration
     */
    public Duration recordSince(String category, long startNanos) {
        Duration duration = Duration.ofNanos(System.nanoTime() - startNanos);
        record(category, duration);
        return duration;
    }

    public void record(String category, Duration duration) {
        Deque<Long> samples = samplesByCategory.computeIfAbsent(category, key -> new ArrayDeque<>());
        synchronized (samples) {
            samples.addLast(duration.toNanos());
            while (samples.size() > Math.max(1, properties.getMaxSamples())) {
                samples.removeFirst();
            }
        }

        budgetFor(category).ifPresent(budget -> {
            if (duration.compareTo(budget) > 0) {
                log.warn("[Latency] {} took {}ms (budget {}ms)", category,
                        duration.toNanos() / 1_000_000.0, budget.toMillis());
            }
        });
    }

    public Optional<Duration> budgetFor(String category) {
        if (ADMISSION.equals(category)) {
            return Optional.of(properties.getAdmissionBudget());
        }
        if (CANCELLATION.equals(category)) {
            return Optional.of(properties.getCancellationBudget());
        }
        if (category.startsWith(STAGE_PREFIX)) {
            return Optional.of(properties.getStageBudget());
        }
        return Optional.empty();
    }

    public Optional<LatencyStats> getStats(String category) {
        Deque<Long> samples = samplesByCategory.get(category);
        if (samples == null) {
            return Optional.empty();
        }
        List<Long> sorted;
        synchronized (samples) {
            sorted = new ArrayList<>(samples);
        }
        if (sorted.isEmpty()) {
            return Optional.empty();
        }
        sorted.sort(Long::compare);

        long total = 0;
        for (long sample : sorted) {
            total += sample;
        }
        int p95Index = Math.min(sorted.size() - 1, (int) Math.floor(sorted.size() * 0.95));
        return Optional.of(new LatencyStats(
                sorted.size(),
                Duration.ofNanos(sorted.get(0)),
                Duration.ofNanos(sorted.get(sorted.size() - 1)),
                Duration.ofNanos(total / sorted.size()),
                Duration.ofNanos(sorted.get(p95Index))));
    }

    public Map<String, LatencyStats> getAllStats() {
        Map<String, LatencyStats> result = new ConcurrentHashMap<>();
        for (String category : samplesByCategory.keySet()) {
            getStats(category).ifPresent(stats -> result.put(category, stats));
        }
        return Map.copyOf(result);
    }

    public void reset() {
        samplesByCategory.clear();
    }

    /**
     * Summary of one category's sample window.
     */
    public record LatencyStats(int count, Duration min, Duration max, Duration mean, Duration p95) {
    }
}
