package me.golemcore.narrator.plugin.context;

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
import me.golemcore.narrator.domain.model.NarrationEvent;
import me.golemcore.narrator.domain.model.NarrationTopics;
import me.golemcore.narrator.domain.model.PipelineFailure;
import me.golemcore.narrator.domain.model.PluginRegistered;
import me.golemcore.narrator.domain.service.LatencyMonitor;
import me.golemcore.narrator.plugin.api.NarratorPlugin;
import me.golemcore.narrator.plugin.api.PipelineContext;
import me.golemcore.narrator.plugin.api.PluginContext;
import me.golemcore.narrator.plugin.api.PluginDescriptor;
import me.golemcore.narrator.plugin.api.PluginHealth;
import me.golemcore.narrator.plugin.api.PluginInitializationException;
import me.golemcore.narrator.plugin.api.PluginProcessException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Plugin host: registers plugins, runs events through them in
 * (stage, priority) order and owns their lifecycle.
 *
 * <p>
 * Failure policy:
 * <ul>
 * <li>init: a required plugin failure aborts startup with
 * {@link PluginInitializationException}; an optional plugin failure excludes
 * the plugin.</li>
 * <li>process: a required plugin failure aborts the event and emits
 * {@code pipeline:error}; an optional plugin failure is logged and skipped.</li>
 * <li>cleanup: reverse initialization order, every plugin gets an
 * attempt.</li>
 * </ul>
 */
@Component
@Slf4j
public class PluginPipeline {

    private static final Comparator<PluginEntry> EXECUTION_ORDER = Comparator
            .comparing((PluginEntry entry) -> entry.descriptor.stage())
            .thenComparing(Comparator.comparingInt((PluginEntry entry) -> entry.descriptor.priority()).reversed())
            .thenComparingLong(entry -> entry.sequence);

    private final LatencyMonitor latencyMonitor;

    private final List<PluginEntry> entries = new ArrayList<>();
    private final List<PluginEntry> initializationOrder = new ArrayList<>();
    private long nextSequence;
    private PluginContext context;
    private boolean initialized;

    public PluginPipeline(LatencyMonitor latencyMonitor) {
        this.latencyMonitor = latencyMonitor;
    }

    /**
     * Add a plugin. After {@link #init(PluginContext)} the plugin is
     * initialized immediately.
     *
     * @throws IllegalStateException
     *             on a duplicate plugin id
     */
    public synchronized void register(NarratorPlugin plugin) {
        Objects.requireNonNull(plugin, "plugin must not be null");
        PluginDescriptor descriptor = Objects.requireNonNull(plugin.descriptor(), "descriptor must not be null");
        boolean duplicate = entries.stream().anyMatch(entry -> entry.descriptor.id().equals(descriptor.id()));
        if (duplicate) {
            throw new IllegalStateException("Duplicate plugin id: " + descriptor.id());
        }

        PluginEntry entry = new PluginEntry(plugin, descriptor, nextSequence++);
        entries.add(entry);
        entries.sort(EXECUTION_ORDER);
        log.debug("[Pipeline] Registered plugin {} (stage={}, priority={}, optional={})",
                descriptor.id(), descriptor.stage().getValue(), descriptor.priority(), descriptor.optional());

        if (initialized) {
            initializePlugin(entry);
        }
    }

    /**
     * Initialize all registered plugins sequentially in execution order.
     *
     * @throws PluginInitializationException
     *             if a required plugin fails; plugins initialized so far are
     *             cleaned up first
     */
    public synchronized void init(PluginContext pluginContext) {
        if (initialized) {
            return;
        }
        this.context = Objects.requireNonNull(pluginContext, "context must not be null");
        if (pluginContext.eventBus() == null) {
            throw new PluginInitializationException("pipeline", "EventBus is required");
        }

        try {
            for (PluginEntry entry : List.copyOf(entries)) {
                initializePlugin(entry);
            }
        } catch (PluginInitializationException e) {
            cleanupInitialized();
            throw e;
        }
        initialized = true;

        log.info("[Pipeline] Initialized {} of {} plugins: {}",
                initializationOrder.size(), entries.size(), getActivePluginIds());
    }

    /**
     * Run an event through every active plugin that accepts it.
     *
     * @throws IllegalStateException
     *             if the pipeline has not been initialized
     */
    public PipelineResult process(NarrationEvent<?> event) {
        Objects.requireNonNull(event, "event must not be null");
        List<PluginEntry> active;
        synchronized (this) {
            if (!initialized) {
                throw new IllegalStateException("Pipeline not initialized");
            }
            active = entries.stream().filter(PluginEntry::isActive).toList();
        }

        PipelineContext pipelineContext = new PipelineContext();
        NarrationEvent<?> current = event;
        for (PluginEntry entry : active) {
            String pluginId = entry.descriptor.id();
            long start = System.nanoTime();
            try {
                if (!entry.plugin.accepts(current)) {
                    continue;
                }
                pipelineContext.enter(pluginId);
                NarrationEvent<?> result = entry.plugin.process(current, pipelineContext);
                if (result != null) {
                    current = result;
                }
                pipelineContext.markCompleted(pluginId);
                latencyMonitor.recordSince(LatencyMonitor.STAGE_PREFIX + pluginId, start);
            } catch (RuntimeException e) { // NOSONAR - plugin failures are converted, never rethrown
                pipelineContext.markFailed(pluginId);
                if (entry.descriptor.optional()) {
                    log.warn("[Pipeline] Optional plugin {} failed on {}: {}", pluginId, event.type(),
                            e.getMessage());
                    continue;
                }
                return abort(entry, event, current, pipelineContext, e);
            }

            if (pipelineContext.isHalted()) {
                log.debug("[Pipeline] Event {} halted by {}: {}", event.id(), pipelineContext.getHaltedBy(),
                        pipelineContext.getHaltReason());
                return PipelineResult.halted(current, pipelineContext);
            }
        }
        return PipelineResult.completed(current, pipelineContext);
    }

    /**
     * Collect every plugin's self-reported health. Required plugins decide
     * the overall verdict.
     */
    public PipelineHealth healthCheck() {
        List<PluginEntry> snapshot;
        synchronized (this) {
            snapshot = List.copyOf(entries);
        }

        Map<String, PluginHealth> result = new LinkedHashMap<>();
        boolean healthy = true;
        for (PluginEntry entry : snapshot) {
            PluginHealth health = entryHealth(entry);
            result.put(entry.descriptor.id(), health);
            if (!health.healthy() && !entry.descriptor.optional()) {
                healthy = false;
            }
        }
        return new PipelineHealth(healthy, result);
    }

    /**
     * Tear plugins down in reverse initialization order.
     */
    public synchronized void cleanup() {
        cleanupInitialized();
        initialized = false;
        log.info("[Pipeline] Cleaned up");
    }

    public synchronized boolean isInitialized() {
        return initialized;
    }

    public synchronized List<PluginDescriptor> getActiveDescriptors() {
        return entries.stream()
                .filter(PluginEntry::isActive)
                .map(entry -> entry.descriptor)
                .toList();
    }

    public synchronized List<String> getActivePluginIds() {
        return getActiveDescriptors().stream().map(PluginDescriptor::id).toList();
    }

    public synchronized Optional<NarratorPlugin> getPlugin(String pluginId) {
        return entries.stream()
                .filter(entry -> entry.descriptor.id().equals(pluginId))
                .map(entry -> entry.plugin)
                .findFirst();
    }

    private void initializePlugin(PluginEntry entry) {
        PluginDescriptor descriptor = entry.descriptor;
        long start = System.nanoTime();
        boolean ok;
        try {
            ok = entry.plugin.init(context);
        } catch (RuntimeException e) { // NOSONAR - policy depends on the optional flag
            handleInitFailure(entry, e.getMessage(), e);
            return;
        }
        if (!ok) {
            handleInitFailure(entry, "init returned false", null);
            return;
        }

        entry.state = PluginState.ACTIVE;
        initializationOrder.add(entry);
        long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        log.info("[Pipeline] Plugin {} v{} initialized at stage {} in {}ms",
                descriptor.id(), descriptor.version(), descriptor.stage().getValue(), durationMs);
        context.eventBus().emit(NarrationTopics.PLUGIN_REGISTERED,
                new PluginRegistered(descriptor.id(), descriptor.version(), descriptor.stage(), durationMs));
    }

    private void handleInitFailure(PluginEntry entry, String message, Throwable cause) {
        entry.state = PluginState.FAILED;
        entry.failure = message;
        if (entry.descriptor.optional()) {
            log.warn("[Pipeline] Optional plugin {} failed to initialize and is excluded: {}",
                    entry.descriptor.id(), message);
            return;
        }
        log.error("[Pipeline] Required plugin {} failed to initialize: {}", entry.descriptor.id(), message);
        if (cause instanceof PluginInitializationException initializationException) {
            throw initializationException;
        }
        throw new PluginInitializationException(entry.descriptor.id(), message, cause);
    }

    private PipelineResult abort(PluginEntry entry, NarrationEvent<?> original, NarrationEvent<?> current,
            PipelineContext pipelineContext, RuntimeException cause) {
        String pluginId = entry.descriptor.id();
        PluginProcessException failure = new PluginProcessException(pluginId, original.id(), cause);
        log.error("[Pipeline] Required plugin {} failed on {} ({}): {}",
                pluginId, original.type(), original.id(), cause.getMessage(), cause);
        context.eventBus().emit(NarrationTopics.PIPELINE_ERROR,
                new PipelineFailure(original.id(), original.type(), pluginId, String.valueOf(cause.getMessage())));
        return PipelineResult.failed(current, failure, pipelineContext);
    }

    private PluginHealth entryHealth(PluginEntry entry) {
        if (entry.state == PluginState.FAILED) {
            return new PluginHealth(false, PluginHealth.STATUS_FAILED, Map.of("error", String.valueOf(entry.failure)));
        }
        if (entry.state != PluginState.ACTIVE) {
            return new PluginHealth(false, entry.state.name().toLowerCase(Locale.ROOT), Map.of());
        }
        try {
            PluginHealth health = entry.plugin.healthCheck();
            return health != null ? health : PluginHealth.ok();
        } catch (RuntimeException e) { // NOSONAR - a throwing health check is an unhealthy plugin
            return PluginHealth.unhealthy(e.getMessage());
        }
    }

    private void cleanupInitialized() {
        for (int i = initializationOrder.size() - 1; i >= 0; i--) {
            PluginEntry entry = initializationOrder.get(i);
            try {
                entry.plugin.cleanup();
                log.debug("[Pipeline] Plugin {} cleaned up", entry.descriptor.id());
            } catch (RuntimeException e) { // NOSONAR - remaining plugins still get their cleanup
                log.error("[Pipeline] Plugin {} cleanup failed: {}", entry.descriptor.id(), e.getMessage(), e);
            }
            entry.state = PluginState.CLEANED;
        }
        initializationOrder.clear();
    }

    private enum PluginState {
        REGISTERED, ACTIVE, FAILED, CLEANED
    }

    private static final class PluginEntry {

        private final NarratorPlugin plugin;
        private final PluginDescriptor descriptor;
        private final long sequence;
        private PluginState state = PluginState.REGISTERED;
        private String failure;

        private PluginEntry(NarratorPlugin plugin, PluginDescriptor descriptor, long sequence) {
            this.plugin = plugin;
            this.descriptor = descriptor;
            this.sequence = sequence;
        }

        private boolean isActive() {
            return state == PluginState.ACTIVE;
        }
    }
}
