package com.tenantoptions.database.migration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tenantoptions.database.testing.RecordingConsole;
import com.tenantoptions.database.trigger.GenerationResult;
import com.tenantoptions.database.trigger.JdbcTriggerCatalog;
import com.tenantoptions.database.trigger.TriggerCommandOptions;
import com.tenantoptions.database.trigger.TriggerMigrationGenerator;
import com.tenantoptions.database.trigger.TriggerRemovalGenerator;
import com.tenantoptions.model.DatabaseVendor;
import com.tenantoptions.model.ModelRegistry;
import com.tenantoptions.model.testing.TestModels;
import com.tenantoptions.store.testing.SqliteTestDatabase;
import java.nio.file.Path;
import java.time.Clock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.dao.DataIntegrityViolationException;

@DisplayName("FlywayMigrationRunner")
class FlywayMigrationRunnerTest {

    @TempDir
    Path dbDir;

    @TempDir
    Path migrations;

    private ModelRegistry registry;
    private SqliteTestDatabase db;
    private MigrationLocations locations;
    private JdbcMigrationHistory history;
    private FlywayMigrationRunner runner;

    @BeforeEach
    void setUp() {
        registry = TestModels.registry();
        db = SqliteTestDatabase.create(dbDir).install(registry);
        db.insertTenant(1L);
        db.insertTenant(2L);
        locations = new MigrationLocations(new MigrationProperties(migrations.toString(), null));
        history = new JdbcMigrationHistory(db.jdbc(), locations);
        runner = new FlywayMigrationRunner(db.dataSource(), locations);
    }

    private GenerationResult makeTriggers() {
        return new TriggerMigrationGenerator(registry, history, locations, Clock.systemUTC())
                .generate(TriggerCommandOptions.builder(DatabaseVendor.SQLITE).build(), new RecordingConsole());
    }

    @Nested
    @DisplayName("Migrating")
    class Migrating {

        @Test
        @DisplayName("should install generated triggers into the database")
        void shouldInstallTriggers() {
            GenerationResult generated = makeTriggers();

            FlywayMigrationRunner.MigrationStatus status = runner.migrate("tasks", null);

            assertThat(Integer.parseInt(status.currentVersion())).isEqualTo(2);
            assertThat(status.pendingMigrations()).isZero();
            var catalog = new JdbcTriggerCatalog(db.jdbc(), DatabaseVendor.SQLITE);
            assertThat(generated.triggers()).allMatch(catalog::exists);

            db.execute("INSERT INTO tasks_taskstatus (id, name, option_type, tenant_id) VALUES (5, 'Mine', 'cu', 1)");
            assertThatThrownBy(() -> db.execute(
                            "INSERT INTO tasks_taskstatusselection (tenant_id, option_id) VALUES (2, 5)"))
                    .isInstanceOf(DataIntegrityViolationException.class);
        }

        @Test
        @DisplayName("should record migrations in the app's history table")
        void shouldRecordHistory() {
            makeTriggers();
            runner.migrate("tasks", null);

            assertThat(history.applied("tasks"))
                    .extracting(AppliedMigration::script)
                    .contains(
                            "V0001__auto_trigger_taskpriorityselection.sql",
                            "V0002__auto_trigger_taskstatusselection.sql");
            assertThat(runner.migrations("tasks", null))
                    .extracting(FlywayMigrationRunner.MigrationInfo::description)
                    .contains("auto trigger taskpriorityselection", "auto trigger taskstatusselection");
        }

        @Test
        @DisplayName("should drop triggers through a removal migration")
        void shouldRemoveTriggers() {
            GenerationResult generated = makeTriggers();
            runner.migrate("tasks", null);
            var catalog = new JdbcTriggerCatalog(db.jdbc(), DatabaseVendor.SQLITE);

            new TriggerRemovalGenerator(registry, history, locations, Clock.systemUTC())
                    .generate(TriggerCommandOptions.builder(DatabaseVendor.SQLITE).verify(true).build(),
                            catalog, new RecordingConsole());
            runner.migrate("tasks", null);

            assertThat(generated.triggers()).noneMatch(catalog::exists);
        }

        @Test
        @DisplayName("should report pending migrations without applying them")
        void shouldReportStatus() {
            makeTriggers();

            FlywayMigrationRunner.MigrationStatus status = runner.status("tasks", null);

            assertThat(status.pendingMigrations()).isEqualTo(2);
            assertThat(status.location()).isEqualTo(migrations.resolve("tasks").toString());
        }
    }

    @Nested
    @DisplayName("History")
    class History {

        @Test
        @DisplayName("should read an absent history table as empty")
        void shouldReadMissingTableAsEmpty() {
            assertThat(history.applied("tasks")).isEmpty();
        }

        @Test
        @DisplayName("should number new migrations after applied ones whose files are gone")
        void shouldNumberAfterApplied() {
            makeTriggers();
            runner.migrate("tasks", null);
            var directory = locations.directoryFor("tasks", null);
            directory.files().forEach(file -> file.path().toFile().delete());

            var slot = new MigrationSequence(history).next("tasks", directory, "next");

            assertThat(slot.file().version()).isEqualTo(3);
            assertThat(slot.dependsOn()).isEqualTo("V0002__auto_trigger_taskstatusselection.sql");
        }
    }
}
