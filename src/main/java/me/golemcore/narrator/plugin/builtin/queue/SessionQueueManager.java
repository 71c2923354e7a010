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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.narrator.domain.model.NarrationEvent;
import me.golemcore.narrator.domain.model.NarrationSession;
import me.golemcore.narrator.domain.model.NarrationTopics;
import me.golemcore.narrator.domain.model.PipelineStage;
import me.golemcore.narrator.domain.model.QueueFailure;
import me.golemcore.narrator.domain.model.RequestQueued;
import me.golemcore.narrator.domain.model.RequestRejected;
import me.golemcore.narrator.domain.model.SessionError;
import me.golemcore.narrator.domain.model.SessionProgress;
import me.golemcore.narrator.domain.model.SessionRef;
import me.golemcore.narrator.domain.model.SessionStarted;
import me.golemcore.narrator.domain.model.SessionStatus;
import me.golemcore.narrator.domain.model.SessionStopped;
import me.golemcore.narrator.domain.model.SpeechRequest;
import me.golemcore.narrator.domain.model.StopReason;
import me.golemcore.narrator.domain.model.SynthesisRequest;
import me.golemcore.narrator.domain.service.LatencyMonitor;
import me.golemcore.narrator.infrastructure.config.NarratorProperties;
import me.golemcore.narrator.infrastructure.event.EventBus;
import me.golemcore.narrator.infrastructure.event.Subscription;
import me.golemcore.narrator.plugin.api.NarratorPlugin;
import me.golemcore.narrator.plugin.api.PluginContext;
import me.golemcore.narrator.plugin.api.PluginDescriptor;
import me.golemcore.narrator.plugin.api.PluginHealth;
import me.golemcore.narrator.plugin.api.PluginInitializationException;
import me.golemcore.narrator.port.outbound.SchedulerPort;
import me.golemcore.narrator.port.outbound.SchedulerPort.ScheduledTask;
import me.golemcore.narrator.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Arbitrates which single speech request is currently active.
 *
 * <p>
 * Supports:
 * </p>
 * <ul>
 * <li>Stop-previous mode (default): every new request supersedes the current
 * session, which is revoked and told to stop before the newcomer is
 * installed.</li>
 * <li>Queue mode: requests arriving while a session is active wait in a
 * bounded priority queue and are promoted when the slot frees.</li>
 * <li>Stale-signal tolerance: lifecycle events for any session other than the
 * current one are ignored.</li>
 * <li>Best-effort persistence of aggregate counters, restored at startup.</li>
 * </ul>
 *
 * <p>
 * Every transition runs under one monitor and completes before any
 * asynchronous work starts, so bus handlers, control calls and scheduled tasks
 * never interleave. The current session is revoked before anything is emitted
 * about it. Requests raised by handlers of those emissions are deferred until
 * the transition in progress has finished, so the latest request wins.
 */
@Component
@Slf4j
public class SessionQueueManager implements NarratorPlugin {

    public static final String PLUGIN_ID = "queue-manager";
    public static final String STATE_KEY = "queue-manager-state";

    private static final String NAME = "QueueManager";
    private static final String VERSION = "1.0.0";
    private static final int RECENT_SESSION_ID_LIMIT = 1024;

    private final NarratorProperties.QueueProperties config;
    private final String defaultVoice;
    private final Clock clock;
    private final SchedulerPort scheduler;
    private final LatencyMonitor latencyMonitor;
    private final PendingRequestQueue pendingQueue;

    private final Object lock = new Object();
    private final List<Subscription> subscriptions = new ArrayList<>();
    private final Deque<SpeechRequest> deferredRequests = new ArrayDeque<>();
    private final Set<String> recentSessionIds = Collections.newSetFromMap(new LinkedHashMap<String, Boolean>() {
        private static final long serialVersionUID = 1L;

        @Override
        protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
            return size() > RECENT_SESSION_ID_LIMIT;
        }
    });

    private EventBus eventBus;
    private StoragePort storage;
    private boolean initialized;
    private int transitionDepth;
    private boolean persistPending;

    private NarrationSession currentSession;
    private long totalProcessed;
    private long totalStopped;
    private long totalErrors;
    private long totalRejected;
    private Instant lastActivity;

    private ScheduledTask clearTask;
    private ScheduledTask sweepTask;
    private ScheduledTask persistTask;

    public SessionQueueManager(NarratorProperties properties, Clock clock, SchedulerPort scheduler,
            LatencyMonitor latencyMonitor) {
        this.config = properties.getQueue();
        this.defaultVoice = properties.getRequest().getDefaultVoice();
        this.clock = clock;
        this.scheduler = scheduler;
        this.latencyMonitor = latencyMonitor;
        this.pendingQueue = new PendingRequestQueue(config.getMaxQueueSize(), config.getOverflowPolicy());
        this.lastActivity = Instant.now(clock);
    }

    @Override
    public PluginDescriptor descriptor() {
        Map<String, Object> settings = new LinkedHashMap<>();
        settings.put("maxQueueSize", config.getMaxQueueSize());
        settings.put("stopPrevious", config.isStopPrevious());
        settings.put("sessionTimeoutMs", config.getSessionTimeout().toMillis());
        settings.put("persistState", config.isPersistState());
        return new PluginDescriptor(PLUGIN_ID, NAME, VERSION, PipelineStage.QUEUE, 0, false, settings);
    }

    @Override
    public boolean init(PluginContext context) {
        if (context == null || context.eventBus() == null) {
            throw new PluginInitializationException(PLUGIN_ID, "EventBus is required for plugin initialization");
        }
        if (context.storage() == null) {
            throw new PluginInitializationException(PLUGIN_ID, "Storage is required for plugin initialization");
        }

        synchronized (lock) {
            if (initialized) {
                return true;
            }
            this.eventBus = context.eventBus();
            this.storage = context.storage();

            // Counters must be in place before the first event can arrive.
            if (config.isPersistState()) {
                restoreState();
            }

            subscriptions.add(eventBus.subscribe(NarrationTopics.REQUEST, this::onRequest));
            subscriptions.add(eventBus.subscribe(NarrationTopics.STARTED, this::onStarted));
            subscriptions.add(eventBus.subscribe(NarrationTopics.PROGRESS, this::onProgress));
            subscriptions.add(eventBus.subscribe(NarrationTopics.COMPLETED, this::onCompleted));
            subscriptions.add(eventBus.subscribe(NarrationTopics.ERROR, this::onError));

            sweepTask = scheduler.scheduleAtFixedRate(
                    () -> runGuarded("sweep", this::sweepStaleSessions), config.getSweepInterval());
            initialized = true;
        }

        log.info("[QueueManager] {} v{} initialized at stage {} (mode={})", NAME, VERSION,
                PipelineStage.QUEUE.getValue(), config.isStopPrevious() ? "stop-previous" : "queue");
        return true;
    }

    // ==================== ADMISSION ====================

    /**
     * Admit a request. In stop-previous mode the current session is
     * superseded; in queue mode the request waits while a session is active.
     * Persistence is only scheduled, never awaited.
     */
    public AdmissionResult enqueue(SpeechRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        long start = System.nanoTime();
        AdmissionResult result;
        synchronized (lock) {
            requireInitialized();
            if (transitionDepth > 0) {
                deferredRequests.add(request);
                log.debug("[QueueManager] Deferred request {} raised during a transition", request.id());
                return AdmissionResult.DEFERRED;
            }
            result = callTransition(() -> admitOrQueue(request));
        }
        latencyMonitor.recordSince(LatencyMonitor.ADMISSION, start);
        return result;
    }

    private AdmissionResult admitOrQueue(SpeechRequest request) {
        AdmissionResult result;
        if (!config.isStopPrevious() && hasActiveSession()) {
            result = queueRequest(request);
        } else {
            admit(request);
            result = AdmissionResult.ADMITTED;
        }
        touch();
        schedulePersist();
        return result;
    }

    private void admit(SpeechRequest request) {
        if (currentSession != null && currentSession.isActive()) {
            retire(StopReason.SUPERSEDED, null);
        } else if (currentSession != null) {
            cancel(clearTask);
            clearTask = null;
            currentSession = null;
        }

        NarrationSession session = createSession(request);
        currentSession = session;
        eventBus.emit(NarrationTopics.QUEUE_STARTED,
                new SessionStarted(session.getSessionId(), session.getSourceId(), session.getStatus()));
        eventBus.emit(NarrationTopics.SYNTHESIZE, new SynthesisRequest(session.getSessionId(), session.getText(),
                session.getVoiceId(), session.getSpeed()));
        totalProcessed++;
        log.debug("[QueueManager] Admitted session {} (source={})", session.getSessionId(), session.getSourceId());
    }

    private AdmissionResult queueRequest(SpeechRequest request) {
        try {
            PendingRequestQueue.Offer offer = pendingQueue.offer(request, Instant.now(clock));
            offer.evicted().ifPresent(evicted -> {
                totalRejected++;
                log.warn("[QueueManager] Queue full ({}), evicted request {} for {}",
                        pendingQueue.capacity(), evicted.request().id(), request.id());
                eventBus.emit(NarrationTopics.QUEUE_REJECTED, new RequestRejected(evicted.request().id(),
                        RequestRejected.REASON_EVICTED, pendingQueue.capacity()));
            });
            eventBus.emit(NarrationTopics.QUEUE_ENQUEUED,
                    new RequestQueued(request.id(), offer.position(), pendingQueue.size()));
            log.debug("[QueueManager] Queued request {} at position {} ({} pending)",
                    request.id(), offer.position(), pendingQueue.size());
            return AdmissionResult.QUEUED;
        } catch (QueueOverflowException e) {
            totalRejected++;
            log.warn("[QueueManager] {}", e.getMessage());
            eventBus.emit(NarrationTopics.QUEUE_REJECTED,
                    new RequestRejected(e.getRequestId(), RequestRejected.REASON_OVERFLOW, e.getMaxQueueSize()));
            return AdmissionResult.REJECTED;
        }
    }

    private NarrationSession createSession(SpeechRequest request) {
        String voice = request.voice() != null && !request.voice().isBlank() ? request.voice() : defaultVoice;
        return NarrationSession.builder()
                .sessionId(resolveSessionId(request.id()))
                .sourceId(request.sourceId())
                .text(request.text() != null ? request.text() : "")
                .voiceId(voice)
                .speed(request.speed() != null ? request.speed() : 1.0)
                .startTime(Instant.now(clock))
                .status(SessionStatus.QUEUED)
                .build();
    }

    private String resolveSessionId(String requestId) {
        String sessionId = requestId;
        if (sessionId == null || sessionId.isBlank()) {
            sessionId = generateSessionId();
        } else if (recentSessionIds.contains(sessionId)) {
            String fresh = generateSessionId();
            log.warn("[QueueManager] Session id {} already used, assigned {}", sessionId, fresh);
            sessionId = fresh;
        }
        recentSessionIds.add(sessionId);
        return sessionId;
    }

    private static String generateSessionId() {
        return "session-" + UUID.randomUUID();
    }

    // ==================== LIFECYCLE SIGNALS ====================

    /**
     * Synthesis started: queued becomes playing.
     */
    public void handleStarted(String sessionId) {
        synchronized (lock) {
            NarrationSession session = matchCurrent(sessionId, "started");
            if (session == null || session.getStatus() != SessionStatus.QUEUED) {
                return;
            }
            session.markPlaying(Instant.now(clock));
            touch();
            schedulePersist();
        }
    }

    public void handleProgress(String sessionId, int progress) {
        synchronized (lock) {
            NarrationSession session = matchCurrent(sessionId, "progress");
            if (session == null || !session.isActive()) {
                return;
            }
            session.updateProgress(progress);
        }
    }

    /**
     * Playback finished. The session stays readable for the grace window
     * unless a queued request is promoted right away.
     */
    public void handleCompleted(String sessionId) {
        synchronized (lock) {
            NarrationSession session = matchCurrent(sessionId, "completed");
            if (session == null || !session.isActive()) {
                return;
            }
            runTransition(() -> {
                session.markCompleted(Instant.now(clock));
                eventBus.emit(NarrationTopics.QUEUE_COMPLETED, new SessionRef(sessionId));
                if (!promoteNext()) {
                    scheduleClear(sessionId);
                }
                touch();
                schedulePersist();
            });
        }
    }

    /**
     * Collaborator failure: the session is stopped with reason
     * {@link StopReason#ERROR}.
     */
    public void handleError(String sessionId, String error) {
        synchronized (lock) {
            NarrationSession session = matchCurrent(sessionId, "error");
            if (session == null || !session.isActive()) {
                return;
            }
            log.warn("[QueueManager] Session {} failed: {}", sessionId, error);
            runTransition(() -> {
                retire(StopReason.ERROR, error);
                promoteNext();
                touch();
                schedulePersist();
            });
        }
    }

    // ==================== CONTROLS ====================

    /**
     * Stop the active session.
     *
     * @return id of the stopped session, or empty without emitting anything
     *         if nothing is active
     */
    public Optional<String> stopCurrent() {
        synchronized (lock) {
            if (!hasActiveSession()) {
                return Optional.empty();
            }
            String sessionId = currentSession.getSessionId();
            runTransition(() -> {
                retire(StopReason.MANUAL, null);
                promoteNext();
                touch();
                schedulePersist();
            });
            return Optional.of(sessionId);
        }
    }

    /**
     * Pause a playing session; a no-op in any other status.
     *
     * @return id of the paused session
     */
    public Optional<String> pauseCurrent() {
        synchronized (lock) {
            if (currentSession == null || currentSession.getStatus() != SessionStatus.PLAYING) {
                return Optional.empty();
            }
            NarrationSession session = currentSession;
            runTransition(() -> {
                session.markPaused(Instant.now(clock));
                eventBus.emit(NarrationTopics.AUDIO_PAUSE, new SessionRef(session.getSessionId()));
                eventBus.emit(NarrationTopics.QUEUE_PAUSED, new SessionRef(session.getSessionId()));
                touch();
                schedulePersist();
            });
            return Optional.of(session.getSessionId());
        }
    }

    /**
     * Resume a paused session; a no-op in any other status.
     *
     * @return id of the resumed session
     */
    public Optional<String> resumeCurrent() {
        synchronized (lock) {
            if (currentSession == null || currentSession.getStatus() != SessionStatus.PAUSED) {
                return Optional.empty();
            }
            NarrationSession session = currentSession;
            runTransition(() -> {
                session.markPlaying(Instant.now(clock));
                eventBus.emit(NarrationTopics.AUDIO_RESUME, new SessionRef(session.getSessionId()));
                eventBus.emit(NarrationTopics.QUEUE_RESUMED, new SessionRef(session.getSessionId()));
                touch();
                schedulePersist();
            });
            return Optional.of(session.getSessionId());
        }
    }

    /**
     * Remove the next pending request without admitting it.
     */
    public Optional<QueueEntry> dequeue() {
        synchronized (lock) {
            return pendingQueue.poll();
        }
    }

    /**
     * Drop all pending requests. The current session is left alone.
     */
    public void clear() {
        synchronized (lock) {
            int dropped = pendingQueue.size();
            pendingQueue.clear();
            log.info("[QueueManager] Queue cleared ({} dropped)", dropped);
        }
    }

    // ==================== STATE ====================

    public Optional<NarrationSession> getCurrentSession() {
        synchronized (lock) {
            return Optional.ofNullable(currentSession).map(NarrationSession::snapshot);
        }
    }

    public int getQueueLength() {
        synchronized (lock) {
            return pendingQueue.size();
        }
    }

    public QueueSnapshot getQueueState() {
        synchronized (lock) {
            return new QueueSnapshot(
                    currentSession != null ? currentSession.snapshot() : null,
                    pendingQueue.snapshot(),
                    totalProcessed,
                    totalStopped,
                    totalErrors,
                    totalRejected,
                    lastActivity,
                    config.isStopPrevious());
        }
    }

    @Override
    public PluginHealth healthCheck() {
        synchronized (lock) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("stage", PipelineStage.QUEUE.getValue());
            if (currentSession != null) {
                details.put("currentSession", Map.of(
                        "sessionId", currentSession.getSessionId(),
                        "status", currentSession.getStatus().getValue()));
            }
            details.put("queueLength", pendingQueue.size());
            details.put("totalProcessed", totalProcessed);
            details.put("totalStopped", totalStopped);
            details.put("totalErrors", totalErrors);
            details.put("lastActivity", lastActivity.toString());
            if (!initialized) {
                return new PluginHealth(false, "not-initialized", details);
            }
            return PluginHealth.ok(details);
        }
    }

    // ==================== TEARDOWN ====================

    @Override
    public void cleanup() {
        synchronized (lock) {
            if (!initialized) {
                return;
            }
            cancel(sweepTask);
            cancel(clearTask);
            cancel(persistTask);
            sweepTask = null;
            clearTask = null;
            persistTask = null;
            persistPending = false;

            transitionDepth++;
            try {
                if (hasActiveSession()) {
                    retire(StopReason.MANUAL, null);
                }
            } finally {
                transitionDepth--;
            }
            if (!deferredRequests.isEmpty()) {
                log.debug("[QueueManager] Dropping {} requests raised during shutdown", deferredRequests.size());
                deferredRequests.clear();
            }
            currentSession = null;
            pendingQueue.clear();

            subscriptions.forEach(Subscription::unsubscribe);
            subscriptions.clear();
            initialized = false;
        }

        if (config.isPersistState()) {
            awaitFlush();
        }
        log.info("[QueueManager] {} cleaned up", NAME);
    }

    // ==================== INTERNALS ====================

    void sweepStaleSessions() {
        synchronized (lock) {
            if (!initialized || !hasActiveSession()) {
                return;
            }
            Instant now = Instant.now(clock);
            if (currentSession.age(now).compareTo(config.getSessionTimeout()) <= 0) {
                return;
            }
            log.warn("[QueueManager] Cleaning up stale session {} (age {}s)",
                    currentSession.getSessionId(), currentSession.age(now).toSeconds());
            runTransition(() -> {
                retire(StopReason.TIMEOUT, null);
                promoteNext();
                touch();
                schedulePersist();
            });
        }
    }

    /**
     * Write the counters now. The returned future never completes
     * exceptionally; failures are logged.
     */
    public CompletableFuture<Void> flushState() {
        QueueManagerState state;
        StoragePort target;
        synchronized (lock) {
            target = storage;
            state = new QueueManagerState(totalProcessed, totalStopped, lastActivity);
        }
        if (target == null) {
            return CompletableFuture.completedFuture(null);
        }
        try {
            return target.set(STATE_KEY, state).handle((ignored, error) -> {
                if (error != null) {
                    log.warn("[QueueManager] Failed to persist state: {}", error.getMessage());
                } else {
                    log.debug("[QueueManager] Persisted state: {} processed, {} stopped",
                            state.totalProcessed(), state.totalStopped());
                }
                return null;
            });
        } catch (RuntimeException e) { // NOSONAR - best-effort persistence
            log.warn("[QueueManager] Failed to persist state: {}", e.getMessage());
            return CompletableFuture.completedFuture(null);
        }
    }

    private void retire(StopReason reason, String error) {
        long start = System.nanoTime();
        NarrationSession session = currentSession;
        currentSession = null;
        cancel(clearTask);
        clearTask = null;
        session.markStopped(reason, Instant.now(clock));

        String sessionId = session.getSessionId();
        eventBus.emit(NarrationTopics.AUDIO_STOP, new SessionRef(sessionId));
        if (reason == StopReason.ERROR) {
            totalErrors++;
        } else {
            totalStopped++;
        }
        eventBus.emit(NarrationTopics.QUEUE_STOPPED, new SessionStopped(sessionId, reason, error));

        latencyMonitor.recordSince(LatencyMonitor.CANCELLATION, start);
        log.info("[QueueManager] Stopped session {} ({})", sessionId, reason.getValue());
    }

    private boolean promoteNext() {
        if (config.isStopPrevious() || hasActiveSession()) {
            return false;
        }
        Optional<QueueEntry> next = pendingQueue.poll();
        if (next.isEmpty()) {
            return false;
        }
        QueueEntry entry = next.get();
        log.info("[QueueManager] Promoting queued request {} (priority {}, {} still pending)",
                entry.request().id(), entry.priority().getValue(), pendingQueue.size());
        admit(entry.request());
        return true;
    }

    private NarrationSession matchCurrent(String sessionId, String signal) {
        if (currentSession == null || !currentSession.getSessionId().equals(sessionId)) {
            log.debug("[QueueManager] Ignoring {} for non-current session {}", signal, sessionId);
            return null;
        }
        return currentSession;
    }

    private boolean hasActiveSession() {
        return currentSession != null && currentSession.isActive();
    }

    private void scheduleClear(String sessionId) {
        cancel(clearTask);
        clearTask = scheduler.schedule(() -> runGuarded("clear", () -> clearFinished(sessionId)),
                config.getClearDelay());
    }

    private void clearFinished(String sessionId) {
        synchronized (lock) {
            if (currentSession != null && !currentSession.isActive()
                    && currentSession.getSessionId().equals(sessionId)) {
                currentSession = null;
                clearTask = null;
                log.debug("[QueueManager] Cleared finished session {}", sessionId);
            }
        }
    }

    private void schedulePersist() {
        if (!config.isPersistState() || storage == null || persistPending) {
            return;
        }
        persistPending = true;
        persistTask = scheduler.schedule(this::runScheduledFlush, config.getPersistDebounce());
    }

    private void runScheduledFlush() {
        synchronized (lock) {
            // Anything changed after the snapshot below needs a write of its own.
            persistPending = false;
            persistTask = null;
        }
        flushState();
    }

    private void restoreState() {
        try {
            QueueManagerState state = storage.get(STATE_KEY, QueueManagerState.class)
                    .get(config.getRestoreTimeout().toMillis(), TimeUnit.MILLISECONDS);
            if (state == null) {
                return;
            }
            totalProcessed = Math.max(0, state.totalProcessed());
            totalStopped = Math.max(0, state.totalStopped());
            if (state.lastActivity() != null) {
                lastActivity = state.lastActivity();
            }
            log.info("[QueueManager] Restored queue state: {} processed, {} stopped", totalProcessed, totalStopped);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[QueueManager] Interrupted while restoring state");
        } catch (ExecutionException | TimeoutException | RuntimeException e) { // NOSONAR - start from zero
            log.warn("[QueueManager] Failed to restore state, starting from zero: {}", e.getMessage());
        }
    }

    private void awaitFlush() {
        try {
            flushState().get(config.getRestoreTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[QueueManager] Interrupted while flushing state");
        } catch (ExecutionException | TimeoutException e) {
            log.warn("[QueueManager] Final state flush failed: {}", e.getMessage());
        }
    }

    private void onRequest(NarrationEvent<SpeechRequest> event) {
        runGuarded("request", () -> enqueue(event.payload()));
    }

    private void onStarted(NarrationEvent<SessionRef> event) {
        runGuarded("started", () -> handleStarted(event.payload().sessionId()));
    }

    private void onProgress(NarrationEvent<SessionProgress> event) {
        runGuarded("progress", () -> handleProgress(event.payload().sessionId(), event.payload().progress()));
    }

    private void onCompleted(NarrationEvent<SessionRef> event) {
        runGuarded("completed", () -> handleCompleted(event.payload().sessionId()));
    }

    private void onError(NarrationEvent<SessionError> event) {
        runGuarded("error", () -> handleError(event.payload().sessionId(), event.payload().error()));
    }

    private void runTransition(Runnable transition) {
        callTransition(() -> {
            transition.run();
            return null;
        });
    }

    private <T> T callTransition(Supplier<T> transition) {
        transitionDepth++;
        try {
            return transition.get();
        } finally {
            transitionDepth--;
            if (transitionDepth == 0) {
                admitDeferred();
            }
        }
    }

    private void admitDeferred() {
        while (!deferredRequests.isEmpty()) {
            SpeechRequest request = deferredRequests.poll();
            transitionDepth++;
            try {
                runGuarded("request", () -> admitOrQueue(request));
            } finally {
                transitionDepth--;
            }
        }
    }

    private void runGuarded(String operation, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) { // NOSONAR - converted into a queue:error event
            log.error("[QueueManager] {} handling failed: {}", operation, e.getMessage(), e);
            EventBus bus = eventBus;
            if (bus != null) {
                bus.emit(NarrationTopics.QUEUE_ERROR, new QueueFailure(operation, String.valueOf(e.getMessage())));
            }
        }
    }

    private void requireInitialized() {
        if (!initialized) {
            throw new IllegalStateException("Queue manager not initialized");
        }
    }

    private void touch() {
        lastActivity = Instant.now(clock);
    }

    private static void cancel(ScheduledTask task) {
        if (task != null) {
            task.cancel();
        }
    }
}
