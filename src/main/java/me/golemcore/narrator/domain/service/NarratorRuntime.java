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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.narrator.domain.model.CoreInitialized;
import me.golemcore.narrator.domain.model.NarrationEvent;
import me.golemcore.narrator.domain.model.NarrationTopics;
import me.golemcore.narrator.domain.model.SpeechRequest;
import me.golemcore.narrator.infrastructure.config.NarratorProperties;
import me.golemcore.narrator.infrastructure.event.EventBus;
import me.golemcore.narrator.plugin.api.NarratorPlugin;
import me.golemcore.narrator.plugin.api.PluginHealth;
import me.golemcore.narrator.plugin.context.HostPluginContext;
import me.golemcore.narrator.plugin.context.PipelineHealth;
import me.golemcore.narrator.plugin.context.PipelineResult;
import me.golemcore.narrator.plugin.context.PluginPipeline;
import me.golemcore.narrator.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Runtime context of the narrator core.
 *
 * <p>
 * Builds the {@link HostPluginContext} handed to every plugin, registers the
 * enabled plugins with the {@link PluginPipeline} and initializes them on
 * {@link #start()}. Submitted requests run through the pipeline and, unless a
 * plugin halts or fails them, are published on the bus where the queue
 * manager picks them up.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class NarratorRuntime {

    private final PluginPipeline pipeline;
    private final EventBus eventBus;
    private final StoragePort storage;
    private final NarratorProperties properties;
    private final LatencyMonitor latencyMonitor;

    private volatile boolean started;

    public NarratorRuntime(PluginPipeline pipeline, EventBus eventBus, StoragePort storage,
            NarratorProperties properties, LatencyMonitor latencyMonitor, List<NarratorPlugin> plugins) {
        this.pipeline = pipeline;
        this.eventBus = eventBus;
        this.storage = storage;
        this.properties = properties;
        this.latencyMonitor = latencyMonitor;

        for (NarratorPlugin plugin : plugins) {
            String pluginId = plugin.descriptor().id();
            if (!properties.pluginProperties(pluginId).isEnabled()) {
                log.info("[Runtime] Plugin {} disabled by configuration", pluginId);
                continue;
            }
            pipeline.register(plugin);
        }
    }

    /**
     * Initialize every registered plugin and announce readiness.
     *
     * @throws me.golemcore.narrator.plugin.api.PluginInitializationException
     *             if a required plugin cannot start
     */
    @PostConstruct
    public synchronized void start() {
        if (started) {
            return;
        }
        long startNanos = System.nanoTime();
        pipeline.init(new HostPluginContext(eventBus, storage, properties));
        started = true;

        long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        List<String> pluginIds = pipeline.getActivePluginIds();
        eventBus.emit(NarrationTopics.CORE_INITIALIZED, new CoreInitialized(pluginIds, durationMs));
        log.info("[Runtime] Narrator core started with {} plugins in {}ms", pluginIds.size(), durationMs);
    }

    @PreDestroy
    public synchronized void stop() {
        if (!started) {
            return;
        }
        started = false;
        pipeline.cleanup();
        log.info("[Runtime] Narrator core stopped");
    }

    public boolean isStarted() {
        return started;
    }

    /**
     * Run a request through the pipeline and publish it.
     *
     * @throws IllegalStateException
     *             if the runtime has not been started
     */
    public SubmissionResult submit(SpeechRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        if (!started) {
            throw new IllegalStateException("Narrator runtime not started");
        }

        NarrationEvent<SpeechRequest> event = eventBus.createEvent(NarrationTopics.REQUEST, request);
        PipelineResult result = pipeline.process(event);
        if (!result.isCompleted()) {
            String reason = result.status() == PipelineResult.Status.HALTED
                    ? result.haltReason()
                    : result.failure().getMessage();
            log.debug("[Runtime] Request {} not published ({}): {}", event.id(), result.status(), reason);
            return new SubmissionResult(false, event.id(), requestId(result.event()), result.status(), reason);
        }

        eventBus.publish(result.event());
        return new SubmissionResult(true, event.id(), requestId(result.event()), result.status(), null);
    }

    public RuntimeHealth health() {
        PipelineHealth pipelineHealth = pipeline.healthCheck();
        return new RuntimeHealth(
                started && pipelineHealth.healthy(),
                started,
                pipelineHealth.plugins(),
                latencyMonitor.getAllStats());
    }

    private static String requestId(NarrationEvent<?> event) {
        if (event.payload() instanceof SpeechRequest request) {
            return request.id();
        }
        return null;
    }

    /**
     * Outcome of {@link #submit(SpeechRequest)}.
     *
     * @param accepted
     *            whether the request was published on the bus
     * @param eventId
     *            id of the request event
     * @param requestId
     *            request id after normalization
     * @param status
     *            how the pipeline pass ended
     * @param reason
     *            halt reason or failure message when not accepted
     */
    public record SubmissionResult(
            boolean accepted,
            String eventId,
            String requestId,
            PipelineResult.Status status,
            String reason
    ) {
    }

    /**
     * Aggregated health of the runtime.
     */
    public record RuntimeHealth(
            boolean healthy,
            boolean started,
            Map<String, PluginHealth> plugins,
            Map<String, LatencyMonitor.LatencyStats> latency
    ) {
    }
}
