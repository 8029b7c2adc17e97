package com.tenantoptions.cli;

import com.tenantoptions.database.OperatorConsole;
import com.tenantoptions.database.StreamConsole;
import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import picocli.CommandLine.Model.CommandSpec;

/** Operator consoles writing to a command's output streams. */
public final class Consoles {

    private Consoles() {}

    public static OperatorConsole forCommand(CommandSpec spec) {
        return new StreamConsole(
                spec.commandLine().getOut(),
                spec.commandLine().getErr(),
                new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
    }
}
