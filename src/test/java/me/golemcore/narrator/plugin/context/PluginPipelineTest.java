package me.golemcore.narrator.plugin.context;

import me.golemcore.narrator.domain.model.NarrationEvent;
import me.golemcore.narrator.domain.model.NarrationTopics;
import me.golemcore.narrator.domain.model.PipelineFailure;
import me.golemcore.narrator.domain.model.PipelineStage;
import me.golemcore.narrator.domain.model.PluginRegistered;
import me.golemcore.narrator.domain.model.SpeechRequest;
import me.golemcore.narrator.domain.service.LatencyMonitor;
import me.golemcore.narrator.infrastructure.config.NarratorProperties;
import me.golemcore.narrator.infrastructure.event.EventBus;
import me.golemcore.narrator.plugin.api.NarratorPlugin;
import me.golemcore.narrator.plugin.api.PipelineContext;
import me.golemcore.narrator.plugin.api.PluginContext;
import me.golemcore.narrator.plugin.api.PluginDescriptor;
import me.golemcore.narrator.plugin.api.PluginHealth;
import me.golemcore.narrator.plugin.api.PluginInitializationException;
import me.golemcore.narrator.testsupport.EventRecorder;
import me.golemcore.narrator.testsupport.InMemoryStorageAdapter;
import me.golemcore.narrator.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class PluginPipelineTest {

    private EventBus eventBus;
    private NarratorProperties properties;
    private LatencyMonitor latencyMonitor;
    private PluginPipeline pipeline;
    private PluginContext context;
    private EventRecorder recorder;
    private List<String> calls;

    @BeforeEach
    void setUp() {
        MutableClock clock = MutableClock.startingAt("2026-01-01T10:00:00Z");
        eventBus = new EventBus(clock, null, 50);
        properties = new NarratorProperties();
        latencyMonitor = new LatencyMonitor(properties);
        pipeline = new PluginPipeline(latencyMonitor);
        context = new HostPluginContext(eventBus, new InMemoryStorageAdapter(), properties);
        recorder = new EventRecorder(eventBus);
        calls = new ArrayList<>();
    }

    private NarrationEvent<SpeechRequest> requestEvent(String text) {
        return eventBus.createEvent(NarrationTopics.REQUEST, SpeechRequest.builder().id("r1").text(text).build());
    }

    // ==================== registration and ordering ====================

    @Test
    void runsPluginsByStageThenPriorityThenRegistration() {
        pipeline.register(new RecordingPlugin("render", PipelineStage.RENDERING, 0, false));
        pipeline.register(new RecordingPlugin("prep-low", PipelineStage.PREPARATION, 1, false));
        pipeline.register(new RecordingPlugin("queue", PipelineStage.QUEUE, 0, false));
        pipeline.register(new RecordingPlugin("prep-high", PipelineStage.PREPARATION, 5, false));
        pipeline.register(new RecordingPlugin("prep-low-2", PipelineStage.PREPARATION, 1, false));
        pipeline.init(context);

        PipelineResult result = pipeline.process(requestEvent("hello"));

        assertTrue(result.isCompleted());
        assertEquals(List.of("prep-high", "prep-low", "prep-low-2", "queue", "render"), calls);
        assertEquals(calls, result.completed());
        assertEquals(List.of("prep-high", "prep-low", "prep-low-2", "queue", "render"),
                pipeline.getActivePluginIds());
    }

    @Test
    void duplicateIdIsRejected() {
        pipeline.register(new RecordingPlugin("dup", PipelineStage.QUEUE, 0, false));

        RecordingPlugin duplicate = new RecordingPlugin("dup", PipelineStage.PLAYBACK, 0, false);
        assertThrows(IllegalStateException.class, () -> pipeline.register(duplicate));
    }

    @Test
    void lateRegistrationIsInitializedImmediately() {
        pipeline.init(context);
        RecordingPlugin late = new RecordingPlugin("late", PipelineStage.PLAYBACK, 0, false);

        pipeline.register(late);

        assertTrue(late.initialized);
        assertEquals(List.of("late"), pipeline.getActivePluginIds());
        assertTrue(pipeline.getPlugin("late").isPresent());
    }

    // ==================== init ====================

    @Test
    void initEmitsPluginRegisteredPerPlugin() {
        pipeline.register(new RecordingPlugin("a", PipelineStage.PREPARATION, 0, false));
        pipeline.register(new RecordingPlugin("b", PipelineStage.QUEUE, 0, false));

        pipeline.init(context);
        pipeline.init(context);

        List<PluginRegistered> registered = recorder.payloads(NarrationTopics.PLUGIN_REGISTERED);
        assertEquals(List.of("a", "b"), registered.stream().map(PluginRegistered::pluginId).toList());
        assertEquals(PipelineStage.QUEUE, registered.get(1).stage());
        assertTrue(pipeline.isInitialized());
    }

    @Test
    void initRequiresEventBus() {
        PluginContext withoutBus = new HostPluginContext(null, new InMemoryStorageAdapter(), properties);

        assertThrows(PluginInitializationException.class, () -> pipeline.init(withoutBus));
        assertFalse(pipeline.isInitialized());
    }

    @Test
    void requiredInitFailureAbortsAndCleansUpStartedPlugins() {
        RecordingPlugin first = new RecordingPlugin("first", PipelineStage.PREPARATION, 0, false);
        NarratorPlugin broken = mock(NarratorPlugin.class);
        when(broken.descriptor()).thenReturn(descriptor("broken", PipelineStage.QUEUE, false));
        when(broken.init(any())).thenThrow(new IllegalStateException("no device"));
        pipeline.register(first);
        pipeline.register(broken);

        PluginInitializationException error = assertThrows(PluginInitializationException.class,
                () -> pipeline.init(context));

        assertEquals("broken", error.getPluginId());
        assertTrue(first.cleanedUp);
        assertFalse(pipeline.isInitialized());
    }

    @Test
    void requiredInitReturningFalseAbortsStartup() {
        NarratorPlugin refusing = mock(NarratorPlugin.class);
        when(refusing.descriptor()).thenReturn(descriptor("refusing", PipelineStage.QUEUE, false));
        when(refusing.init(any())).thenReturn(false);
        pipeline.register(refusing);

        assertThrows(PluginInitializationException.class, () -> pipeline.init(context));
    }

    @Test
    void optionalInitFailureExcludesPlugin() {
        NarratorPlugin broken = mock(NarratorPlugin.class);
        when(broken.descriptor()).thenReturn(descriptor("broken", PipelineStage.RENDERING, true));
        when(broken.init(any())).thenThrow(new IllegalStateException("no display"));
        pipeline.register(broken);
        pipeline.register(new RecordingPlugin("ok", PipelineStage.QUEUE, 0, false));

        pipeline.init(context);

        assertEquals(List.of("ok"), pipeline.getActivePluginIds());
        PipelineHealth health = pipeline.healthCheck();
        assertTrue(health.healthy());
        assertEquals(PluginHealth.STATUS_FAILED, health.plugins().get("broken").status());
        verify(broken, never()).process(any(), any());
    }

    // ==================== process ====================

    @Test
    void processBeforeInitFails() {
        NarrationEvent<SpeechRequest> event = requestEvent("hello");

        assertThrows(IllegalStateException.class, () -> pipeline.process(event));
    }

    @Test
    void pluginsSeeTransformedEvent() {
        pipeline.register(new RecordingPlugin("upper", PipelineStage.PREPARATION, 0, false, (event, ctx) -> {
            NarrationEvent<SpeechRequest> request = event.as(NarrationTopics.REQUEST);
            return request.withPayload(request.payload().toBuilder()
                    .text(request.payload().text().toUpperCase())
                    .build());
        }));
        List<String> seen = new ArrayList<>();
        pipeline.register(new RecordingPlugin("observer", PipelineStage.QUEUE, 0, false, (event, ctx) -> {
            seen.add(event.as(NarrationTopics.REQUEST).payload().text());
            return event;
        }));
        pipeline.init(context);

        NarrationEvent<SpeechRequest> original = requestEvent("hello");
        PipelineResult result = pipeline.process(original);

        assertEquals(List.of("HELLO"), seen);
        assertEquals("HELLO", result.event().as(NarrationTopics.REQUEST).payload().text());
        assertEquals("hello", original.payload().text());
        assertEquals(original.id(), result.event().id());
    }

    @Test
    void haltStopsRemainingPlugins() {
        pipeline.register(new RecordingPlugin("gate", PipelineStage.PREPARATION, 0, false, (event, ctx) -> {
            ctx.halt("blocked");
            return event;
        }));
        pipeline.register(new RecordingPlugin("after", PipelineStage.QUEUE, 0, false));
        pipeline.init(context);

        PipelineResult result = pipeline.process(requestEvent("hello"));

        assertEquals(PipelineResult.Status.HALTED, result.status());
        assertEquals("blocked", result.haltReason());
        assertEquals("gate", result.haltedBy());
        assertEquals(List.of("gate"), calls);
    }

    @Test
    void optionalProcessFailureIsSkipped() {
        pipeline.register(new RecordingPlugin("flaky", PipelineStage.PREPARATION, 0, true, (event, ctx) -> {
            throw new IllegalStateException("flaky");
        }));
        pipeline.register(new RecordingPlugin("after", PipelineStage.QUEUE, 0, false));
        pipeline.init(context);

        PipelineResult result = pipeline.process(requestEvent("hello"));

        assertTrue(result.isCompleted());
        assertEquals(List.of("flaky"), result.failed());
        assertEquals(List.of("after"), result.completed());
        assertEquals(0, recorder.count(NarrationTopics.PIPELINE_ERROR));
    }

    @Test
    void requiredProcessFailureAbortsAndEmitsPipelineError() {
        pipeline.register(new RecordingPlugin("strict", PipelineStage.PREPARATION, 0, false, (event, ctx) -> {
            throw new IllegalArgumentException("bad input");
        }));
        pipeline.register(new RecordingPlugin("after", PipelineStage.QUEUE, 0, false));
        pipeline.init(context);

        NarrationEvent<SpeechRequest> event = requestEvent("hello");
        PipelineResult result = assertDoesNotThrow(() -> pipeline.process(event));

        assertEquals(PipelineResult.Status.FAILED, result.status());
        assertEquals("strict", result.failure().getPluginId());
        assertEquals(List.of("strict"), calls);

        PipelineFailure failure = recorder.payloads(NarrationTopics.PIPELINE_ERROR).get(0);
        assertEquals(event.id(), failure.eventId());
        assertEquals("tts:request", failure.topic());
        assertEquals("strict", failure.pluginId());
        assertEquals("bad input", failure.error());
    }

    @Test
    void pluginsCanDeclineEvents() {
        RecordingPlugin picky = new RecordingPlugin("picky", PipelineStage.PREPARATION, 0, false);
        picky.acceptsEvents = false;
        pipeline.register(picky);
        pipeline.init(context);

        PipelineResult result = pipeline.process(requestEvent("hello"));

        assertTrue(result.isCompleted());
        assertTrue(calls.isEmpty());
        assertTrue(result.completed().isEmpty());
    }

    @Test
    void recordsStageLatencyPerPlugin() {
        pipeline.register(new RecordingPlugin("timed", PipelineStage.PREPARATION, 0, false));
        pipeline.init(context);

        pipeline.process(requestEvent("hello"));

        assertTrue(latencyMonitor.getStats(LatencyMonitor.STAGE_PREFIX + "timed").isPresent());
    }

    // ==================== health and cleanup ====================

    @Test
    void unhealthyRequiredPluginMakesPipelineUnhealthy() {
        RecordingPlugin sick = new RecordingPlugin("sick", PipelineStage.PLAYBACK, 0, false);
        sick.health = PluginHealth.unhealthy("device lost");
        RecordingPlugin optionalSick = new RecordingPlugin("optional-sick", PipelineStage.RENDERING, 0, true);
        optionalSick.health = PluginHealth.unhealthy("no display");
        pipeline.register(optionalSick);
        pipeline.init(context);

        assertTrue(pipeline.healthCheck().healthy());

        pipeline.register(sick);
        PipelineHealth health = pipeline.healthCheck();
        assertFalse(health.healthy());
        assertEquals("device lost", health.plugins().get("sick").details().get("error"));
    }

    @Test
    void throwingHealthCheckCountsAsUnhealthy() {
        NarratorPlugin plugin = mock(NarratorPlugin.class);
        when(plugin.descriptor()).thenReturn(descriptor("throwing", PipelineStage.QUEUE, false));
        when(plugin.init(any())).thenReturn(true);
        when(plugin.healthCheck()).thenThrow(new IllegalStateException("health check failed"));
        pipeline.register(plugin);
        pipeline.init(context);

        assertFalse(pipeline.healthCheck().plugins().get("throwing").healthy());
    }

    @Test
    void cleanupRunsInReverseOrderAndToleratesFailures() {
        RecordingPlugin first = new RecordingPlugin("first", PipelineStage.PREPARATION, 0, false);
        RecordingPlugin second = new RecordingPlugin("second", PipelineStage.QUEUE, 0, false);
        second.failOnCleanup = true;
        RecordingPlugin third = new RecordingPlugin("third", PipelineStage.PLAYBACK, 0, false);
        pipeline.register(first);
        pipeline.register(second);
        pipeline.register(third);
        pipeline.init(context);
        calls.clear();

        assertDoesNotThrow(() -> pipeline.cleanup());

        assertEquals(List.of("cleanup:third", "cleanup:second", "cleanup:first"), calls);
        assertFalse(pipeline.isInitialized());
        assertTrue(pipeline.getActivePluginIds().isEmpty());
    }

    private static PluginDescriptor descriptor(String id, PipelineStage stage, boolean optional) {
        return new PluginDescriptor(id, id, "1.0.0", stage, 0, optional, Map.of());
    }

    private final class RecordingPlugin implements NarratorPlugin {

        private final PluginDescriptor descriptor;
        private final BiFunction<NarrationEvent<?>, PipelineContext, NarrationEvent<?>> behavior;
        private boolean acceptsEvents = true;
        private boolean initialized;
        private boolean cleanedUp;
        private boolean failOnCleanup;
        private PluginHealth health = PluginHealth.ok();

        private RecordingPlugin(String id, PipelineStage stage, int priority, boolean optional) {
            this(id, stage, priority, optional, (event, ctx) -> event);
        }

        private RecordingPlugin(String id, PipelineStage stage, int priority, boolean optional,
                BiFunction<NarrationEvent<?>, PipelineContext, NarrationEvent<?>> behavior) {
            this.descriptor = new PluginDescriptor(id, id, "1.0.0", stage, priority, optional, Map.of());
            this.behavior = behavior;
        }

        @Override
        public PluginDescriptor descriptor() {
            return descriptor;
        }

        @Override
        public boolean init(PluginContext pluginContext) {
            initialized = true;
            return true;
        }

        @Override
        public boolean accepts(NarrationEvent<?> event) {
            return acceptsEvents;
        }

        @Override
        public NarrationEvent<?> process(NarrationEvent<?> event, PipelineContext pipelineContext) {
            calls.add(descriptor.id());
            return behavior.apply(event, pipelineContext);
        }

        @Override
        public void cleanup() {
            calls.add("cleanup:" + descriptor.id());
            cleanedUp = true;
            if (failOnCleanup) {
                throw new IllegalStateException("cleanup failed");
            }
        }

        @Override
        public PluginHealth healthCheck() {
            return health;
        }
    }
}
