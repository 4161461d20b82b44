package com.armada.dispatch.cli;

import com.armada.core.quota.QuotaStatus;
import com.armada.core.quota.QuotaTracker;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.Map;

/**
 * CLI command: armada quota
 * <p>
 * Shows the usage window of every known provider.
 */
@Command(name = "quota", mixinStandardHelpOptions = true, description = "Show provider quota usage")
@Component
public class QuotaCommand implements Runnable {

    private final QuotaTracker quotaTracker;

    public QuotaCommand(QuotaTracker quotaTracker) {
        this.quotaTracker = quotaTracker;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        Map<String, QuotaStatus> statuses = quotaTracker.getAllStatuses();
        if (statuses.isEmpty()) {
            ConsoleOutput.info("No providers tracked");
            return;
        }
        statuses.values().forEach(ConsoleOutput::quota);
        long blocked = statuses.values().stream().filter(s -> !s.canExecute()).count();
        if (blocked > 0) {
            ConsoleOutput.error(blocked + " provider(s) over quota");
        }
    }
}
