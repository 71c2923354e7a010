package me.golemcore.narrator.testsupport;

import me.golemcore.narrator.domain.model.NarrationEvent;
import me.golemcore.narrator.domain.model.Topic;
import me.golemcore.narrator.infrastructure.event.EventBus;
import me.golemcore.narrator.infrastructure.event.Subscription;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;

/**
 * Records every event delivered on a bus, in delivery order.
 */
public class EventRecorder {

    private final List<NarrationEvent<?>> events = new CopyOnWriteArrayList<>();
    private final Subscription subscription;

    public EventRecorder(EventBus eventBus) {
        this.subscription = eventBus.subscribePattern("*", events::add);
    }

    public List<NarrationEvent<?>> all() {
        return List.copyOf(events);
    }

    public List<String> types() {
        return events.stream().map(NarrationEvent::type).toList();
    }

    public <T> List<T> payloads(Topic<T> topic) {
        return events.stream()
                .filter(event -> event.isOn(topic))
                .map(event -> event.as(topic).payload())
                .toList();
    }

    public int count(Topic<?> topic) {
        return (int) events.stream().filter(event -> event.isOn(topic)).count();
    }

    /**
     * Index of the first event on {@code topic} matching the payload, or -1.
     */
    public <T> int indexOf(Topic<T> topic, Predicate<T> matcher) {
        for (int i = 0; i < events.size(); i++) {
            NarrationEvent<?> event = events.get(i);
            if (event.isOn(topic) && matcher.test(event.as(topic).payload())) {
                return i;
            }
        }
        return -1;
    }

    public void clear() {
        events.clear();
    }

    public void close() {
        subscription.unsubscribe();
    }
}
