package com.tenantoptions.database.migration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("MigrationScript")
class MigrationScriptTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:15:30.123Z");

    @Test
    @DisplayName("should render header, reverse and statements")
    void shouldRender() {
        var operation = new MigrationOperation("create trigger trg", "CREATE TRIGGER trg ...;\n", "DROP TRIGGER IF EXISTS trg;");

        String content = new MigrationScript(NOW, "V0001__init.sql", List.of("trg"), List.of(operation)).render();

        assertThat(content).isEqualTo("""
                -- Generated by tenant-options on 2026-03-01T10:15:30Z
                -- Depends on: V0001__init.sql

                -- Operation 1: create trigger trg
                -- Trigger: trg
                -- Reverse:
                --   DROP TRIGGER IF EXISTS trg;
                CREATE TRIGGER trg ...;
                """);
    }

    @Test
    @DisplayName("should mark the first migration and irreversible operations")
    void shouldRenderFirstIrreversible() {
        var operation = MigrationOperation.irreversible("remove trigger trg", "DROP TRIGGER IF EXISTS trg;");

        String content = new MigrationScript(NOW, null, List.of("trg"), List.of(operation)).render();

        assertThat(content).contains("-- Depends on: (none)").contains("-- Reverse: no-op");
    }

    @Test
    @DisplayName("should require one trigger name per operation")
    void shouldRequireMatchingTriggers() {
        var operation = MigrationOperation.irreversible("x", "SELECT 1;");

        assertThatThrownBy(() -> new MigrationScript(NOW, null, List.of(), List.of(operation)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
