package me.golemcore.narrator.infrastructure.event;

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
import me.golemcore.narrator.domain.model.Topic;
import me.golemcore.narrator.infrastructure.config.NarratorProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Typed publish/subscribe hub through which all core components communicate.
 *
 * <p>
 * Delivery is synchronous on the emitting thread. Handlers of one topic run in
 * subscription order, followed by {@code "*"} and {@code "namespace:*"}
 * pattern handlers. A failing handler is logged and reported to
 * {@link #onError(Consumer) error listeners}; it never prevents the remaining
 * handlers from running and its exception never reaches the emitter.
 *
 * <p>
 * Usage:
 *
 * <pre>{@code
 * eventBus.subscribe(NarrationTopics.STARTED, event -> onStarted(event.payload()));
 * eventBus.emit(NarrationTopics.STARTED, new SessionRef("tts-1"));
 * }</pre>
 *
 * <p>
 * Every delivered event is also forwarded to Spring's
 * {@link ApplicationEventPublisher}, so beans may observe it with
 * {@code @EventListener}.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class EventBus {

    private static final String WILDCARD = "*";
    private static final String NAMESPACE_WILDCARD_SUFFIX = ":*";

    private final Clock clock;
    private final ApplicationEventPublisher eventPublisher;
    private final int historySize;

    private final Map<String, List<Registration>> registrations = new ConcurrentHashMap<>();
    private final List<Consumer<HandlerFailure>> errorListeners = new CopyOnWriteArrayList<>();
    private final Deque<NarrationEvent<?>> history = new ArrayDeque<>();

    @Autowired
    public EventBus(Clock clock, ApplicationEventPublisher eventPublisher, NarratorProperties properties) {
        this(clock, eventPublisher, properties.getEventBus().getHistorySize());
    }

    public EventBus(Clock clock, ApplicationEventPublisher eventPublisher, int historySize) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.eventPublisher = eventPublisher;
        this.historySize = Math.max(0, historySize);
    }

    /**
     * Register a handler for one topic. Past events are not replayed.
     */
    public <T> Subscription subscribe(Topic<T> topic, EventHandler<T> handler) {
        Objects.requireNonNull(topic, "topic must not be null");
        Objects.requireNonNull(handler, "handler must not be null");
        return register(topic.name(), event -> handler.onEvent(event.as(topic)));
    }

    /**
     * Register a handler for {@code "*"} (every topic) or
     * {@code "namespace:*"} (every topic of a namespace).
     */
    public Subscription subscribePattern(String pattern, Consumer<NarrationEvent<?>> handler) {
        Objects.requireNonNull(handler, "handler must not be null");
        if (pattern == null || !(WILDCARD.equals(pattern) || isNamespacePattern(pattern))) {
            throw new IllegalArgumentException("Unsupported subscription pattern: " + pattern);
        }
        return register(pattern, handler);
    }

    /**
     * Observe handler failures.
     */
    public Subscription onError(Consumer<HandlerFailure> listener) {
        Objects.requireNonNull(listener, "listener must not be null");
        errorListeners.add(listener);
        return () -> errorListeners.remove(listener);
    }

    public <T> NarrationEvent<T> createEvent(Topic<T> topic, T payload) {
        return new NarrationEvent<>(UUID.randomUUID().toString(), topic, payload, Instant.now(clock));
    }

    /**
     * Build an event and deliver it to the current handlers of {@code topic}.
     */
    public <T> DeliveryReport emit(Topic<T> topic, T payload) {
        return publish(createEvent(topic, payload));
    }

    /**
     * Deliver a pre-built event, e.g. the output of the processing pipeline.
     */
    public DeliveryReport publish(NarrationEvent<?> event) {
        Objects.requireNonNull(event, "event must not be null");
        recordHistory(event);

        List<Registration> targets = resolveRegistrations(event.type());
        int failed = 0;
        for (Registration registration : targets) {
            try {
                registration.handler().accept(event);
            } catch (RuntimeException e) { // NOSONAR - isolate handlers from each other
                failed++;
                log.error("[EventBus] Handler '{}' failed on {}: {}",
                        registration.key(), event.type(), e.getMessage(), e);
                notifyErrorListeners(new HandlerFailure(event, registration.key(), e));
            }
        }

        forwardToApplicationContext(event);
        log.debug("[EventBus] Delivered {} ({}) to {} handlers, {} failed",
                event.type(), event.id(), targets.size(), failed);
        return new DeliveryReport(event, targets.size(), failed);
    }

    public List<NarrationEvent<?>> getHistory() {
        synchronized (history) {
            return List.copyOf(history);
        }
    }

    public List<NarrationEvent<?>> getHistory(Topic<?> topic) {
        synchronized (history) {
            return history.stream()
                    .filter(event -> event.isOn(topic))
                    .toList();
        }
    }

    public int getSubscriberCount() {
        return registrations.values().stream().mapToInt(List::size).sum();
    }

    public int getSubscriberCount(String topicOrPattern) {
        List<Registration> list = registrations.get(topicOrPattern);
        return list != null ? list.size() : 0;
    }

    public Set<String> getSubscribedTopics() {
        return Set.copyOf(registrations.keySet());
    }

    /**
     * Drop all subscriptions, error listeners and history.
     */
    public void clear() {
        registrations.clear();
        errorListeners.clear();
        synchronized (history) {
            history.clear();
        }
    }

    private Subscription register(String key, Consumer<NarrationEvent<?>> handler) {
        Registration registration = new Registration(key, handler);
        registrations.computeIfAbsent(key, k -> new CopyOnWriteArrayList<>()).add(registration);
        log.debug("[EventBus] Subscribed to {}", key);
        return () -> unregister(registration);
    }

    private void unregister(Registration registration) {
        registrations.computeIfPresent(registration.key(), (key, list) -> {
            list.remove(registration);
            return list.isEmpty() ? null : list;
        });
    }

    private List<Registration> resolveRegistrations(String topicName) {
        List<Registration> resolved = new ArrayList<>();
        addAll(resolved, topicName);
        addAll(resolved, WILDCARD);

        int separator = topicName.indexOf(':');
        while (separator > 0) {
            addAll(resolved, topicName.substring(0, separator) + NAMESPACE_WILDCARD_SUFFIX);
            separator = topicName.indexOf(':', separator + 1);
        }
        return resolved;
    }

    private void addAll(List<Registration> target, String key) {
        List<Registration> list = registrations.get(key);
        if (list != null) {
            target.addAll(list);
        }
    }

    private void recordHistory(NarrationEvent<?> event) {
        if (historySize == 0) {
            return;
        }
        synchronized (history) {
            history.addLast(event);
            while (history.size() > historySize) {
                history.removeFirst();
            }
        }
    }

    private void notifyErrorListeners(HandlerFailure failure) {
        for (Consumer<HandlerFailure> listener : errorListeners) {
            try {
                listener.accept(failure);
            } catch (RuntimeException e) { // NOSONAR - error listeners are best effort
                log.warn("[EventBus] Error listener failed: {}", e.getMessage());
            }
        }
    }

    private void forwardToApplicationContext(NarrationEvent<?> event) {
        if (eventPublisher == null) {
            return;
        }
        try {
            eventPublisher.publishEvent(event);
        } catch (RuntimeException e) { // NOSONAR - application listeners must not break delivery
            log.warn("[EventBus] Application listener failed on {}: {}", event.type(), e.getMessage());
        }
    }

    private static boolean isNamespacePattern(String pattern) {
        return pattern.length() > NAMESPACE_WILDCARD_SUFFIX.length()
                && pattern.endsWith(NAMESPACE_WILDCARD_SUFFIX)
                && pattern.indexOf('*') == pattern.length() - 1;
    }

    private record Registration(String key, Consumer<NarrationEvent<?>> handler) {
    }
}
