package com.whereq.evtfilter.cli;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import picocli.CommandLine;

/**
 * Runs {@link EvtFilterCommand} with the process arguments and exposes its exit code.
 */
@Component
@ConditionalOnProperty(prefix = "evtfilter.cli", name = "enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class EvtFilterRunner implements CommandLineRunner, ExitCodeGenerator {

    private final EvtFilterCommand command;

    private int exitCode;

    @Override
    public void run(String... args) {
        exitCode = new CommandLine(command).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
