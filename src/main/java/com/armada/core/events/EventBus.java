package com.armada.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory implementation of {@link EventPublisher}.
 * <p>
 * Three kinds of subscription: per mission, per event-type prefix ({@code "quota."}
 * matches every quota notification) and global. Delivery is synchronous on the
 * publishing thread, so a subscriber must not call back into the component that
 * published. Subscriber failures are logged and never reach the publisher.
 */
public class EventBus implements EventPublisher {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<ArmadaEvent>>> byMission =
            new ConcurrentHashMap<>();

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<ArmadaEvent>>> byTypePrefix =
            new ConcurrentHashMap<>();

    /** Receives every event, including pool and quota events that carry no mission. */
    private final CopyOnWriteArrayList<Consumer<ArmadaEvent>> global = new CopyOnWriteArrayList<>();

    @Override
    public void publish(ArmadaEvent event) {
        log.trace("{} mission={} subject={}", event.eventType(), event.missionId(), event.subjectId());

        if (event.missionId() != null) {
            deliverAll(byMission.get(event.missionId()), event);
        }
        byTypePrefix.forEach((prefix, subscribers) -> {
            if (event.eventType().startsWith(prefix)) {
                deliverAll(subscribers, event);
            }
        });
        deliverAll(global, event);
    }

    /**
     * Subscribe to the events of one mission.
     *
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String missionId, Consumer<ArmadaEvent> consumer) {
        return register(byMission, missionId, consumer);
    }

    /**
     * Subscribe to every event whose type starts with {@code prefix}, whatever its mission.
     */
    public Subscription subscribeType(String prefix, Consumer<ArmadaEvent> consumer) {
        if (prefix == null || prefix.isEmpty()) {
            throw new IllegalArgumentException("Event type prefix must not be empty");
        }
        return register(byTypePrefix, prefix, consumer);
    }

    public Subscription subscribeAll(Consumer<ArmadaEvent> consumer) {
        global.add(consumer);
        return () -> global.remove(consumer);
    }

    /**
     * Number of live subscriptions of all kinds.
     */
    public int subscriberCount() {
        int count = global.size();
        for (List<Consumer<ArmadaEvent>> subscribers : byMission.values()) {
            count += subscribers.size();
        }
        for (List<Consumer<ArmadaEvent>> subscribers : byTypePrefix.values()) {
            count += subscribers.size();
        }
        return count;
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private static Subscription register(ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<ArmadaEvent>>> index,
                                         String key, Consumer<ArmadaEvent> consumer) {
        index.computeIfAbsent(key, k -> new CopyOnWriteArrayList<>()).add(consumer);
        return () -> index.computeIfPresent(key, (k, subscribers) -> {
            subscribers.remove(consumer);
            return subscribers.isEmpty() ? null : subscribers;
        });
    }

    private void deliverAll(List<Consumer<ArmadaEvent>> subscribers, ArmadaEvent event) {
        if (subscribers == null) {
            return;
        }
        for (Consumer<ArmadaEvent> subscriber : subscribers) {
            try {
                subscriber.accept(event);
            } catch (Exception e) {
                log.warn("Subscriber failed on {} for mission {}: {}",
                        event.eventType(), event.missionId(), e.getMessage(), e);
            }
        }
    }
}
