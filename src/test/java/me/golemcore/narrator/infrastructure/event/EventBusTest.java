package me.golemcore.narrator.infrastructure.event;

import me.golemcore.narrator.domain.model.NarrationEvent;
import me.golemcore.narrator.domain.model.NarrationTopics;
import me.golemcore.narrator.domain.model.SessionRef;
import me.golemcore.narrator.domain.model.Topic;
import me.golemcore.narrator.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class EventBusTest {

    private static final Topic<String> GREETING = Topic.of("test:greeting", String.class);
    private static final Topic<String> OTHER = Topic.of("other:greeting", String.class);

    private MutableClock clock;
    private ApplicationEventPublisher publisher;
    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-01-01T10:00:00Z");
        publisher = mock(ApplicationEventPublisher.class);
        eventBus = new EventBus(clock, publisher, 3);
    }

    // ==================== delivery ====================

    @Test
    void deliversPayloadToTopicSubscribers() {
        List<String> received = new ArrayList<>();
        eventBus.subscribe(GREETING, event -> received.add(event.payload()));

        DeliveryReport report = eventBus.emit(GREETING, "hello");

        assertEquals(List.of("hello"), received);
        assertEquals(1, report.handled());
        assertEquals(0, report.failed());
        assertEquals("test:greeting", report.event().type());
        assertEquals(Instant.parse("2026-01-01T10:00:00Z"), report.event().timestamp());
        assertNotNull(report.event().id());
    }

    @Test
    void handlersRunInSubscriptionOrder() {
        List<String> calls = new ArrayList<>();
        eventBus.subscribe(GREETING, event -> calls.add("first"));
        eventBus.subscribe(GREETING, event -> calls.add("second"));
        eventBus.subscribePattern("*", event -> calls.add("wildcard"));
        eventBus.subscribePattern("test:*", event -> calls.add("namespace"));

        eventBus.emit(GREETING, "hi");

        assertEquals(List.of("first", "second", "wildcard", "namespace"), calls);
    }

    @Test
    void otherTopicsAreNotDelivered() {
        AtomicInteger count = new AtomicInteger();
        eventBus.subscribe(GREETING, event -> count.incrementAndGet());
        eventBus.subscribePattern("test:*", event -> count.incrementAndGet());

        DeliveryReport report = eventBus.emit(OTHER, "hi");

        assertEquals(0, count.get());
        assertEquals(0, report.handled());
    }

    @Test
    void failingHandlerDoesNotStopOthersOrReachEmitter() {
        List<String> calls = new ArrayList<>();
        List<HandlerFailure> failures = new ArrayList<>();
        eventBus.onError(failures::add);
        eventBus.subscribe(GREETING, event -> {
            throw new IllegalStateException("boom");
        });
        eventBus.subscribe(GREETING, event -> calls.add("after"));

        DeliveryReport report = assertDoesNotThrow(() -> eventBus.emit(GREETING, "hi"));

        assertEquals(List.of("after"), calls);
        assertEquals(2, report.handled());
        assertEquals(1, report.failed());
        assertEquals(1, failures.size());
        assertEquals("test:greeting", failures.get(0).subscriptionKey());
        assertEquals("boom", failures.get(0).error().getMessage());
    }

    @Test
    void failingErrorListenerIsTolerated() {
        eventBus.onError(failure -> {
            throw new IllegalArgumentException("listener broke");
        });
        eventBus.subscribe(GREETING, event -> {
            throw new IllegalStateException("boom");
        });

        assertDoesNotThrow(() -> eventBus.emit(GREETING, "hi"));
    }

    @Test
    void unsubscribeStopsDelivery() {
        AtomicInteger count = new AtomicInteger();
        Subscription subscription = eventBus.subscribe(GREETING, event -> count.incrementAndGet());

        eventBus.emit(GREETING, "one");
        subscription.unsubscribe();
        eventBus.emit(GREETING, "two");

        assertEquals(1, count.get());
        assertEquals(0, eventBus.getSubscriberCount());
        assertFalse(eventBus.getSubscribedTopics().contains("test:greeting"));
    }

    @Test
    void handlerMayUnsubscribeDuringDelivery() {
        List<String> calls = new ArrayList<>();
        Subscription[] holder = new Subscription[1];
        holder[0] = eventBus.subscribe(GREETING, event -> {
            calls.add("self-removing");
            holder[0].unsubscribe();
        });
        eventBus.subscribe(GREETING, event -> calls.add("other"));

        eventBus.emit(GREETING, "one");
        eventBus.emit(GREETING, "two");

        assertEquals(List.of("self-removing", "other", "other"), calls);
    }

    @Test
    void reentrantEmitIsDeliveredSynchronously() {
        List<String> calls = new ArrayList<>();
        eventBus.subscribe(GREETING, event -> {
            calls.add("greeting");
            eventBus.emit(NarrationTopics.AUDIO_STOP, new SessionRef("s1"));
            calls.add("greeting-done");
        });
        eventBus.subscribe(NarrationTopics.AUDIO_STOP, event -> calls.add("stop:" + event.payload().sessionId()));

        eventBus.emit(GREETING, "hi");

        assertEquals(List.of("greeting", "stop:s1", "greeting-done"), calls);
    }

    // ==================== patterns ====================

    @Test
    void rejectsUnsupportedPatterns() {
        assertThrows(IllegalArgumentException.class, () -> eventBus.subscribePattern("tts", event -> {
        }));
        assertThrows(IllegalArgumentException.class, () -> eventBus.subscribePattern("*:greeting", event -> {
        }));
        assertThrows(IllegalArgumentException.class, () -> eventBus.subscribePattern(":*", event -> {
        }));
    }

    @Test
    void namespacePatternSeesEveryTopicInNamespace() {
        List<String> types = new ArrayList<>();
        eventBus.subscribePattern("queue:*", event -> types.add(event.type()));

        eventBus.emit(NarrationTopics.QUEUE_PAUSED, new SessionRef("s1"));
        eventBus.emit(NarrationTopics.AUDIO_PAUSE, new SessionRef("s1"));
        eventBus.emit(NarrationTopics.QUEUE_RESUMED, new SessionRef("s1"));

        assertEquals(List.of("queue:paused", "queue:resumed"), types);
    }

    // ==================== history ====================

    @Test
    void historyIsBoundedAndFilterable() {
        eventBus.emit(GREETING, "1");
        eventBus.emit(OTHER, "2");
        eventBus.emit(GREETING, "3");
        eventBus.emit(GREETING, "4");

        List<NarrationEvent<?>> history = eventBus.getHistory();
        assertEquals(3, history.size());
        assertEquals("2", history.get(0).payload());
        assertEquals(2, eventBus.getHistory(GREETING).size());
    }

    @Test
    void clearDropsEverything() {
        eventBus.subscribe(GREETING, event -> {
        });
        eventBus.emit(GREETING, "1");

        eventBus.clear();

        assertEquals(0, eventBus.getSubscriberCount());
        assertTrue(eventBus.getHistory().isEmpty());
    }

    // ==================== application events ====================

    @Test
    void forwardsEventsToApplicationContext() {
        eventBus.emit(GREETING, "hello");

        verify(publisher).publishEvent(any(NarrationEvent.class));
    }

    @Test
    void applicationListenerFailureDoesNotBreakDelivery() {
        doThrow(new IllegalStateException("listener")).when(publisher).publishEvent(any(Object.class));
        AtomicInteger count = new AtomicInteger();
        eventBus.subscribe(GREETING, event -> count.incrementAndGet());

        assertDoesNotThrow(() -> eventBus.emit(GREETING, "hello"));
        assertEquals(1, count.get());
    }

    @Test
    void worksWithoutApplicationPublisher() {
        EventBus standalone = new EventBus(clock, null, 0);
        AtomicInteger count = new AtomicInteger();
        standalone.subscribe(GREETING, event -> count.incrementAndGet());

        standalone.emit(GREETING, "hello");

        assertEquals(1, count.get());
        assertTrue(standalone.getHistory().isEmpty());
    }

    @Test
    void topicNamesMustBeConcrete() {
        assertThrows(IllegalArgumentException.class, () -> Topic.of("tts:*", String.class));
        assertThrows(IllegalArgumentException.class, () -> Topic.of(" ", String.class));
    }
}
