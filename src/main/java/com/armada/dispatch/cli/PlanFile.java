package com.armada.dispatch.cli;

import com.armada.core.engine.ExecutionPlan;
import com.armada.core.engine.PlannedTask;
import com.armada.core.model.FileChange;
import com.armada.core.model.MissionConfig;
import com.armada.core.model.TaskPriority;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * JSON document accepted by {@code armada run}.
 * <pre>
 * {
 *   "title": "Add login",
 *   "priority": "high",
 *   "tasks": [
 *     {"key": "api", "description": "Add the login endpoint", "contextFiles": ["src/api.ts"]},
 *     {"key": "tests", "type": "test", "description": "Cover login", "dependsOn": ["api"]}
 *   ]
 * }
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PlanFile(
    String title,
    String description,
    TaskPriority priority,
    List<PlannedTask> tasks,
    List<FileChange> changes,
    List<String> paths
) {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
            .build();

    public static PlanFile read(Path file) throws IOException {
        PlanFile plan = MAPPER.readValue(file.toFile(), PlanFile.class);
        if (plan.tasks() == null || plan.tasks().isEmpty()) {
            throw new IOException("Plan " + file + " has no tasks");
        }
        return plan;
    }

    public MissionConfig missionConfig(String fallbackTitle) {
        String name = title != null && !title.isBlank() ? title : fallbackTitle;
        return new MissionConfig(name, description != null ? description : name, priority);
    }

    public ExecutionPlan toExecutionPlan(String missionId) {
        return new ExecutionPlan(missionId, tasks, changes, paths);
    }
}
