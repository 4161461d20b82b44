package com.armada.core.engine;

import com.armada.core.model.HierarchyTier;
import com.armada.core.model.TaskPriority;
import com.armada.core.model.TaskType;

import java.util.List;

/**
 * One task of an execution plan. Dependencies name other tasks of the same plan by key;
 * scheduler ids only exist once the run creates the tasks.
 *
 * @param key          plan-local name, unique within the plan
 * @param prompt       instructions sent to the agent; the description when null
 * @param dependsOn    keys of tasks that must complete first
 * @param contextFiles workspace paths handed to the agent as context
 */
public record PlannedTask(
    String key,
    TaskType type,
    String description,
    String prompt,
    TaskPriority priority,
    List<String> dependsOn,
    HierarchyTier tier,
    List<String> contextFiles
) {

    public PlannedTask {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Planned task key must not be blank");
        }
        type = type != null ? type : TaskType.IMPLEMENT;
        priority = priority != null ? priority : TaskPriority.NORMAL;
        dependsOn = dependsOn != null ? List.copyOf(dependsOn) : List.of();
        tier = tier != null ? tier : HierarchyTier.WORKER;
        contextFiles = contextFiles != null ? List.copyOf(contextFiles) : List.of();
    }

    public static PlannedTask of(String key, TaskType type, String description, String... dependsOn) {
        return new PlannedTask(key, type, description, null, null, List.of(dependsOn), null, null);
    }

    public String effectivePrompt() {
        return prompt != null && !prompt.isBlank() ? prompt : description;
    }
}
