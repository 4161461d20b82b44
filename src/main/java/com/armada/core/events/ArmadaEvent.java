package com.armada.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * A notification emitted by the orchestration core, consumed by observers such as the CLI.
 *
 * @param eventType dotted event name (e.g. "task.started", "quota.exceeded")
 * @param missionId the mission this event belongs to (nullable for pool and quota events)
 * @param subjectId the task, agent, branch or provider the event is about (nullable)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record ArmadaEvent(
    String eventType,
    String missionId,
    String subjectId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static ArmadaEvent of(String eventType, String missionId, String subjectId,
                                 Map<String, Object> payload) {
        return new ArmadaEvent(eventType, missionId, subjectId, payload, Instant.now());
    }
}
