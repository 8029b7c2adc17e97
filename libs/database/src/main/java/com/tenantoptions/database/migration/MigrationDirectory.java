package com.tenantoptions.database.migration;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/** One app's migration directory. A missing directory reads as empty and is created on write. */
public final class MigrationDirectory {

    private final Path root;

    public MigrationDirectory(Path root) {
        this.root = root;
    }

    public Path path() {
        return root;
    }

    /** Versioned migrations, oldest first. */
    public List<MigrationFile> files() {
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        try (Stream<Path> entries = Files.list(root)) {
            return entries.filter(Files::isRegularFile)
                    .map(MigrationFile::parse)
                    .flatMap(Optional::stream)
                    .sorted(Comparator.comparingInt(MigrationFile::version))
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Could not list migrations in " + root, e);
        }
    }

    public Optional<MigrationFile> latest() {
        List<MigrationFile> files = files();
        return files.isEmpty() ? Optional.empty() : Optional.of(files.get(files.size() - 1));
    }

    public int highestVersion() {
        return latest().map(MigrationFile::version).orElse(0);
    }

    /** Resolves the file for a version without touching the disk. */
    public MigrationFile file(int version, String description) {
        return new MigrationFile(root.resolve(MigrationFile.fileName(version, description)), version, description);
    }

    /**
     * Writes a migration, creating the directory when needed.
     *
     * @throws IllegalStateException if the file already exists
     */
    public MigrationFile write(MigrationFile file, String content) {
        try {
            Files.createDirectories(root);
            if (Files.exists(file.path())) {
                throw new IllegalStateException("Migration " + file.path() + " already exists");
            }
            Files.writeString(file.path(), content, StandardCharsets.UTF_8);
            return file;
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write migration " + file.path(), e);
        }
    }
}
