package com.armada.dispatch.cli;

import com.armada.core.error.ArmadaException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with the Spring Boot lifecycle. Commands are created through the
 * Spring-aware factory; an exception escaping a command is reported on the console
 * and turned into exit code 1 instead of a stack trace.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CliRunner.class);

    private final ArmadaCommand armadaCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(ArmadaCommand armadaCommand, IFactory factory) {
        this.armadaCommand = armadaCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        exitCode = commandLine().execute(args);
    }

    CommandLine commandLine() {
        return new CommandLine(armadaCommand, factory)
                .setCaseInsensitiveEnumValuesAllowed(true)
                .setExecutionExceptionHandler((ex, cmd, parseResult) -> {
                    if (ex instanceof ArmadaException armada) {
                        ConsoleOutput.error(cmd.getCommandName() + " failed (" + armada.kind().code() + "): "
                                + armada.getMessage());
                    } else {
                        ConsoleOutput.error(cmd.getCommandName() + " failed: " + ex.getMessage());
                    }
                    log.debug("Command {} failed", cmd.getCommandName(), ex);
                    return 1;
                });
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
