package com.tenantoptions.cli;

import ch.qos.logback.classic.Level;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Raises logging to DEBUG for {@code --verbose} runs. */
public final class Verbosity {

    private Verbosity() {}

    public static void apply(boolean verbose) {
        if (!verbose) {
            return;
        }
        ((ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME)).setLevel(Level.DEBUG);
        ((ch.qos.logback.classic.Logger) LoggerFactory.getLogger("com.tenantoptions")).setLevel(Level.DEBUG);
    }
}
