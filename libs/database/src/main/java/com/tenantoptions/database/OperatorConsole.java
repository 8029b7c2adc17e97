package com.tenantoptions.database;

/**
 * Operator-facing output of the migration tools, and the yes/no prompt of interactive runs.
 * <p>
 * Diagnostics go through SLF4J; this interface carries only what the operator is meant to read.
 */
public interface OperatorConsole {

    void info(String message);

    void success(String message);

    void warning(String message);

    void error(String message);

    /**
     * Asks a yes/no question.
     *
     * @return true only for an answer starting with {@code y} or {@code Y}
     */
    boolean confirm(String question);
}
