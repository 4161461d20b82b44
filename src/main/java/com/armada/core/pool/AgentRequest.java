package com.armada.core.pool;

import com.armada.core.model.HierarchyTier;

import java.util.List;
import java.util.UUID;

/**
 * One unit of work for an agent.
 *
 * @param id            request identifier, echoed in the response
 * @param prompt        task text
 * @param systemContext rendered as the {@code <system>} block (nullable)
 * @param context       rendered as the {@code <context>} block, empty when null
 * @param tier          hierarchy tier the call is accounted to, WORKER when null
 * @param missionId     owning mission for logging and events (nullable)
 * @param taskId        originating task for logging and events (nullable)
 * @param maxTokens     completion ceiling, 4096 when null
 * @param temperature   sampling temperature, 0.7 when null
 * @param stopSequences stop sequences, empty when null
 */
public record AgentRequest(
    String id,
    String prompt,
    String systemContext,
    List<ContextItem> context,
    HierarchyTier tier,
    String missionId,
    String taskId,
    Integer maxTokens,
    Double temperature,
    List<String> stopSequences
) {

    public static final int DEFAULT_MAX_TOKENS = 4096;
    public static final double DEFAULT_TEMPERATURE = 0.7;

    public AgentRequest {
        id = id != null ? id : "req-" + UUID.randomUUID();
        context = context != null ? List.copyOf(context) : List.of();
        tier = tier != null ? tier : HierarchyTier.WORKER;
        maxTokens = maxTokens != null ? maxTokens : DEFAULT_MAX_TOKENS;
        temperature = temperature != null ? temperature : DEFAULT_TEMPERATURE;
        stopSequences = stopSequences != null ? List.copyOf(stopSequences) : List.of();
    }

    public static AgentRequest of(String prompt) {
        return new AgentRequest(null, prompt, null, List.of(), HierarchyTier.WORKER, null, null, null, null, null);
    }

    public static AgentRequest forTask(String missionId, String taskId, HierarchyTier tier, String systemContext,
                                       List<ContextItem> context, String prompt) {
        return new AgentRequest(null, prompt, systemContext, context, tier, missionId, taskId, null, null, null);
    }
}
