package com.tenantoptions.database;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.util.Locale;

/**
 * {@link OperatorConsole} over writers. Warnings and errors go to the error writer; a closed input
 * answers every question with no.
 */
public class StreamConsole implements OperatorConsole {

    private final PrintWriter out;
    private final PrintWriter err;
    private final BufferedReader in;

    public StreamConsole(PrintWriter out, PrintWriter err, BufferedReader in) {
        this.out = out;
        this.err = err;
        this.in = in;
    }

    @Override
    public void info(String message) {
        out.println(message);
        out.flush();
    }

    @Override
    public void success(String message) {
        out.println(message);
        out.flush();
    }

    @Override
    public void warning(String message) {
        err.println("WARNING: " + message);
        err.flush();
    }

    @Override
    public void error(String message) {
        err.println("ERROR: " + message);
        err.flush();
    }

    @Override
    public boolean confirm(String question) {
        out.print(question + " ");
        out.flush();
        try {
            String answer = in.readLine();
            return answer != null && answer.trim().toLowerCase(Locale.ROOT).startsWith("y");
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read the answer", e);
        }
    }
}
