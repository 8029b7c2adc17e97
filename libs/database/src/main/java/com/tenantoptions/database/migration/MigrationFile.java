package com.tenantoptions.database.migration;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * A Flyway versioned SQL file, {@code V{version}__{description}.sql}.
 *
 * @param path location on disk (the file may not exist yet)
 * @param version numeric version
 * @param description the part after the double underscore
 */
public record MigrationFile(Path path, int version, String description) {

    private static final Pattern NAME = Pattern.compile("V(\\d+)__(\\w+)\\.sql");

    /** Description used by trigger removal migrations. */
    public static final String REMOVE_TRIGGERS = "remove_triggers";

    /** Parses a file name, returning empty for anything that is not a versioned migration. */
    public static Optional<MigrationFile> parse(Path path) {
        var matcher = NAME.matcher(path.getFileName().toString());
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return Optional.of(new MigrationFile(path, Integer.parseInt(matcher.group(1)), matcher.group(2)));
    }

    /** Formats a file name with a four digit version, e.g. {@code V0007__auto_trigger_taskstatus.sql}. */
    public static String fileName(int version, String description) {
        return "V%04d__%s.sql".formatted(version, description);
    }

    public String fileName() {
        return path.getFileName().toString();
    }

    public boolean isRemoval() {
        return REMOVE_TRIGGERS.equals(description);
    }

    public String read() {
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read migration " + path, e);
        }
    }
}
