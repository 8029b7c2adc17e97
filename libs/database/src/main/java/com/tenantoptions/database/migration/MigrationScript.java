package com.tenantoptions.database.migration;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Renders generated migration files.
 *
 * <pre>{@code
 * -- Generated by tenant-options on 2026-03-01T10:15:30Z
 * -- Depends on: V0003__create_tables.sql
 *
 * -- Operation 1: create trigger tasks_..._4be21f0c9a
 * -- Trigger: tasks_..._4be21f0c9a
 * -- Reverse:
 * --   DROP TRIGGER IF EXISTS "tasks_..._4be21f0c9a";
 * DROP TRIGGER IF EXISTS "tasks_..._4be21f0c9a";
 * CREATE TRIGGER ...
 * }</pre>
 *
 * @param generatedAt generation time, rendered to the second
 * @param dependsOn file name of the previous migration of the app, null for the first one
 * @param triggers trigger names, one per operation
 * @param operations operations in execution order
 */
public record MigrationScript(
        Instant generatedAt, String dependsOn, List<String> triggers, List<MigrationOperation> operations) {

    public MigrationScript {
        triggers = List.copyOf(triggers);
        operations = List.copyOf(operations);
        if (triggers.size() != operations.size()) {
            throw new IllegalArgumentException("Every operation needs exactly one trigger name");
        }
    }

    public String render() {
        var out = new StringBuilder();
        out.append("-- Generated by tenant-options on ")
                .append(generatedAt.truncatedTo(ChronoUnit.SECONDS))
                .append('\n');
        out.append("-- Depends on: ").append(dependsOn == null ? "(none)" : dependsOn).append('\n');
        for (int i = 0; i < operations.size(); i++) {
            MigrationOperation operation = operations.get(i);
            out.append('\n');
            out.append("-- Operation ").append(i + 1).append(": ").append(operation.description()).append('\n');
            out.append("-- Trigger: ").append(triggers.get(i)).append('\n');
            if (operation.isReversible()) {
                out.append("-- Reverse:\n");
                operation.reverseSql().strip().lines().forEach(line -> out.append("--   ").append(line).append('\n'));
            } else {
                out.append("-- Reverse: no-op\n");
            }
            out.append(operation.sql().strip()).append('\n');
        }
        return out.toString();
    }
}
