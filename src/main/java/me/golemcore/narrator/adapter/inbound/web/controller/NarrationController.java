package me.golemcore.narrator.adapter.inbound.web.controller;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.narrator.adapter.inbound.web.dto.ControlResponse;
import me.golemcore.narrator.adapter.inbound.web.dto.HealthResponse;
import me.golemcore.narrator.adapter.inbound.web.dto.QueueStateDto;
import me.golemcore.narrator.adapter.inbound.web.dto.SessionDto;
import me.golemcore.narrator.adapter.inbound.web.dto.SpeechRequestDto;
import me.golemcore.narrator.adapter.inbound.web.dto.SubmissionResponse;
import me.golemcore.narrator.domain.model.NarrationSession;
import me.golemcore.narrator.domain.model.RequestPriority;
import me.golemcore.narrator.domain.model.SpeechRequest;
import me.golemcore.narrator.domain.service.LatencyMonitor;
import me.golemcore.narrator.domain.service.NarratorRuntime;
import me.golemcore.narrator.plugin.api.PluginHealth;
import me.golemcore.narrator.plugin.builtin.queue.QueueEntry;
import me.golemcore.narrator.plugin.builtin.queue.QueueSnapshot;
import me.golemcore.narrator.plugin.builtin.queue.SessionQueueManager;
import me.golemcore.narrator.plugin.context.PipelineResult;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Narration endpoints for out-of-process collaborators: submit requests,
 * control the current session, read queue state and health.
 */
@RestController
@RequestMapping("/api/narration")
@RequiredArgsConstructor
@Slf4j
public class NarrationController {

    private final NarratorRuntime runtime;
    private final SessionQueueManager queueManager;

    @PostMapping("/requests")
    public Mono<ResponseEntity<SubmissionResponse>> submit(@RequestBody SpeechRequestDto request) {
        RequestPriority priority;
        try {
            priority = RequestPriority.parse(request.getPriority());
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
        }

        SpeechRequest speechRequest = SpeechRequest.builder()
                .id(request.getId())
                .text(request.getText())
                .voice(request.getVoice())
                .speed(request.getSpeed())
                .sourceId(request.getSourceId())
                .priority(priority)
                .build();

        NarratorRuntime.SubmissionResult result;
        try {
            result = runtime.submit(speechRequest);
        } catch (IllegalStateException e) {
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage());
        }

        if (result.status() == PipelineResult.Status.HALTED) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Request rejected: " + result.reason());
        }

        SubmissionResponse response = SubmissionResponse.builder()
                .accepted(result.accepted())
                .eventId(result.eventId())
                .requestId(result.requestId())
                .status(result.status().name().toLowerCase(Locale.ROOT))
                .reason(result.reason())
                .build();
        if (!result.accepted()) {
            log.warn("[Narration] Request {} failed in pipeline: {}", result.eventId(), result.reason());
            return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response));
        }
        return Mono.just(ResponseEntity.status(HttpStatus.ACCEPTED).body(response));
    }

    @PostMapping("/current/stop")
    public Mono<ResponseEntity<ControlResponse>> stop() {
        return control("stop", queueManager::stopCurrent);
    }

    @PostMapping("/current/pause")
    public Mono<ResponseEntity<ControlResponse>> pause() {
        return control("pause", queueManager::pauseCurrent);
    }

    @PostMapping("/current/resume")
    public Mono<ResponseEntity<ControlResponse>> resume() {
        return control("resume", queueManager::resumeCurrent);
    }

    @GetMapping("/state")
    public Mono<ResponseEntity<QueueStateDto>> state() {
        QueueSnapshot snapshot = queueManager.getQueueState();
        QueueStateDto dto = QueueStateDto.builder()
                .currentSession(snapshot.currentSession() != null ? toDto(snapshot.currentSession()) : null)
                .queueLength(snapshot.queueLength())
                .pending(snapshot.pending().stream().map(NarrationController::toPendingDto).toList())
                .totalProcessed(snapshot.totalProcessed())
                .totalStopped(snapshot.totalStopped())
                .totalErrors(snapshot.totalErrors())
                .totalRejected(snapshot.totalRejected())
                .lastActivity(snapshot.lastActivity())
                .mode(snapshot.stopPrevious() ? "stop-previous" : "queue")
                .build();
        return Mono.just(ResponseEntity.ok(dto));
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<HealthResponse>> health() {
        NarratorRuntime.RuntimeHealth health = runtime.health();

        Map<String, HealthResponse.PluginStatus> plugins = new LinkedHashMap<>();
        for (Map.Entry<String, PluginHealth> entry : health.plugins().entrySet()) {
            PluginHealth pluginHealth = entry.getValue();
            plugins.put(entry.getKey(), HealthResponse.PluginStatus.builder()
                    .healthy(pluginHealth.healthy())
                    .status(pluginHealth.status())
                    .details(pluginHealth.details())
                    .build());
        }

        Map<String, HealthResponse.LatencySummary> latency = new LinkedHashMap<>();
        health.latency().forEach((category, stats) -> latency.put(category, toSummary(stats)));

        HealthResponse response = HealthResponse.builder()
                .status(health.healthy() ? "UP" : "DOWN")
                .started(health.started())
                .plugins(plugins)
                .latency(latency)
                .build();
        HttpStatus status = health.healthy() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return Mono.just(ResponseEntity.status(status).body(response));
    }

    private Mono<ResponseEntity<ControlResponse>> control(String action, Supplier<Optional<String>> command) {
        Optional<String> sessionId = command.get();
        log.debug("[Narration] {} requested, applied={}", action, sessionId.isPresent());
        return Mono.just(ResponseEntity.ok(ControlResponse.builder()
                .action(action)
                .applied(sessionId.isPresent())
                .sessionId(sessionId.orElse(null))
                .build()));
    }

    private static SessionDto toDto(NarrationSession session) {
        return SessionDto.builder()
                .sessionId(session.getSessionId())
                .sourceId(session.getSourceId())
                .status(session.getStatus().getValue())
                .stopReason(session.getStopReason() != null ? session.getStopReason().getValue() : null)
                .voiceId(session.getVoiceId())
                .speed(session.getSpeed())
                .progress(session.getProgress())
                .startTime(session.getStartTime())
                .endTime(session.getEndTime())
                .build();
    }

    private static QueueStateDto.PendingRequestDto toPendingDto(QueueEntry entry) {
        return QueueStateDto.PendingRequestDto.builder()
                .requestId(entry.request().id())
                .sourceId(entry.request().sourceId())
                .priority(entry.priority().getValue())
                .queuedAt(entry.timestamp())
                .build();
    }

    private static HealthResponse.LatencySummary toSummary(LatencyMonitor.LatencyStats stats) {
        return HealthResponse.LatencySummary.builder()
                .count(stats.count())
                .minMs(toMillis(stats.min()))
                .maxMs(toMillis(stats.max()))
                .meanMs(toMillis(stats.mean()))
                .p95Ms(toMillis(stats.p95()))
                .build();
    }

    private static double toMillis(Duration duration) {
        return duration.toNanos() / 1_000_000.0;
    }
}
