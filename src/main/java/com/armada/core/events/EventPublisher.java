package com.armada.core.events;

/**
 * Outbound notification channel. Publishing never blocks on, or changes behaviour
 * because of, whoever is listening.
 */
@FunctionalInterface
public interface EventPublisher {

    EventPublisher NOOP = event -> { };

    void publish(ArmadaEvent event);
}
