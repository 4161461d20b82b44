package com.armada.dispatch.cli;

import com.armada.core.concurrent.CancellationToken;
import com.armada.core.engine.ExecutionCoordinator;
import com.armada.core.engine.ExecutionResult;
import com.armada.core.error.ArmadaException;
import com.armada.core.events.EventBus;
import com.armada.core.mission.MissionStateMachine;
import com.armada.core.model.Mission;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: armada run &lt;plan.json&gt;
 * <p>
 * Creates a mission from a JSON plan and drives it through every phase,
 * printing progress and the final result.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Execute a mission plan")
@Component
public class RunCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Path to the JSON plan file")
    private Path planPath;

    @Option(names = {"--verbose", "-v"}, description = "Print every mission event")
    private boolean verbose;

    private final MissionStateMachine missions;
    private final ExecutionCoordinator coordinator;
    private final EventBus eventBus;

    public RunCommand(MissionStateMachine missions, ExecutionCoordinator coordinator, EventBus eventBus) {
        this.missions = missions;
        this.coordinator = coordinator;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        PlanFile planFile;
        try {
            planFile = PlanFile.read(planPath);
        } catch (IOException e) {
            ConsoleOutput.error("Cannot read plan: " + e.getMessage());
            return 2;
        }

        Mission mission = missions.create(planFile.missionConfig(planPath.getFileName().toString()));
        ConsoleOutput.info("Mission " + mission.id() + ": " + mission.title()
                + " (" + planFile.tasks().size() + " task" + (planFile.tasks().size() != 1 ? "s" : "") + ")");

        EventBus.Subscription progress = coordinator.onProgress(p -> {
            if (mission.id().equals(p.missionId())) {
                ConsoleOutput.progress(p);
            }
        });
        EventBus.Subscription events = verbose ? eventBus.subscribe(mission.id(), ConsoleOutput::event) : null;

        ExecutionResult result;
        try {
            result = coordinator.execute(planFile.toExecutionPlan(mission.id()), CancellationToken.create());
        } catch (ArmadaException e) {
            ConsoleOutput.error("Execution rejected (" + e.kind() + "): " + e.getMessage());
            return 1;
        } finally {
            progress.unsubscribe();
            if (events != null) {
                events.unsubscribe();
            }
        }

        ConsoleOutput.result(result);
        System.out.println();
        switch (result.status()) {
            case COMPLETED -> ConsoleOutput.success("Mission complete.");
            case CANCELLED -> ConsoleOutput.error("Mission cancelled: " + result.message());
            default -> ConsoleOutput.error("Mission failed: " + result.message());
        }
        return result.success() ? 0 : 1;
    }
}
