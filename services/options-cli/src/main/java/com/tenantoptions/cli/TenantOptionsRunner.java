package com.tenantoptions.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Runs the command line once the context is up and hands its status to {@code SpringApplication.exit}. */
@Component
@ConditionalOnProperty(prefix = "tenant-options.cli", name = "enabled", havingValue = "true", matchIfMissing = true)
public class TenantOptionsRunner implements CommandLineRunner, ExitCodeGenerator {

    private final TenantOptionsCli cli;
    private int exitCode;

    public TenantOptionsRunner(TenantOptionsCli cli) {
        this.cli = cli;
    }

    @Override
    public void run(String... args) {
        exitCode = cli.execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
