package com.socmind.dispatch.cli;

import com.socmind.SocmindApplication;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Runs the picocli command tree once the Spring context is up and reports its exit code.
 * Serve mode is left to the embedded web server.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final SocmindCommand rootCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(SocmindCommand rootCommand, IFactory factory) {
        this.rootCommand = rootCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        if (SocmindApplication.isServeCommand(args)) {
            return;
        }
        exitCode = new CommandLine(rootCommand, factory)
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
