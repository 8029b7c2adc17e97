package com.tenantoptions.database.trigger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tenantoptions.database.migration.MigrationFile;
import com.tenantoptions.database.migration.MigrationHistory;
import com.tenantoptions.database.migration.MigrationLocations;
import com.tenantoptions.database.migration.MigrationProperties;
import com.tenantoptions.database.testing.RecordingConsole;
import com.tenantoptions.model.DatabaseVendor;
import com.tenantoptions.model.testing.TestModels;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("TriggerRemovalGenerator")
class TriggerRemovalGeneratorTest {

    private static final DatabaseVendor VENDOR = DatabaseVendor.SQLITE;
    private static final String PRIORITY_TRIGGER = TriggerNames.triggerName("tasks_taskpriorityselection", VENDOR);
    private static final String STATUS_TRIGGER = TriggerNames.triggerName("tasks_taskstatusselection", VENDOR);

    @TempDir
    Path root;

    private MigrationLocations locations;
    private RecordingConsole console;
    private TriggerRemovalGenerator remover;

    @BeforeEach
    void setUp() {
        locations = new MigrationLocations(new MigrationProperties(root.toString(), null));
        console = new RecordingConsole();
        remover = new TriggerRemovalGenerator(
                TestModels.registry(), MigrationHistory.none(), locations, Clock.systemUTC());
        new TriggerMigrationGenerator(TestModels.registry(), MigrationHistory.none(), locations, Clock.systemUTC())
                .generate(options().build(), new RecordingConsole());
    }

    private static TriggerCommandOptions.Builder options() {
        return TriggerCommandOptions.builder(VENDOR);
    }

    @Nested
    @DisplayName("Removal")
    class Removal {

        @Test
        @DisplayName("should group every trigger of an app into one migration")
        void shouldGroupByApp() throws IOException {
            GenerationResult result = remover.generate(options().build(), null, console);

            assertThat(result.migrations()).extracting(MigrationFile::fileName)
                    .containsExactly("V0003__remove_triggers.sql");
            assertThat(result.triggers()).containsExactly(PRIORITY_TRIGGER, STATUS_TRIGGER);

            String content = Files.readString(root.resolve("tasks/V0003__remove_triggers.sql"));
            assertThat(content)
                    .contains("-- Depends on: V0002__auto_trigger_taskstatusselection.sql")
                    .contains("DROP TRIGGER IF EXISTS \"" + PRIORITY_TRIGGER + "\";")
                    .contains("DROP TRIGGER IF EXISTS \"" + STATUS_TRIGGER + "\";")
                    .contains("-- Reverse: no-op");
            assertThat(console.lines()).contains("Created migration: " + root.resolve("tasks/V0003__remove_triggers.sql"));
        }

        @Test
        @DisplayName("should find nothing on a second run")
        void shouldBeIdempotent() {
            remover.generate(options().build(), null, console);

            var second = new RecordingConsole();
            GenerationResult result = remover.generate(options().build(), null, second);

            assertThat(result.migrations()).isEmpty();
            assertThat(second.lines()).containsExactly("No triggers found to remove.");
        }

        @Test
        @DisplayName("should limit removal to one model")
        void shouldLimitToModel() {
            GenerationResult result =
                    remover.generate(options().model(TestModels.STATUS_SELECTION).build(), null, console);

            assertThat(result.triggers()).containsExactly(STATUS_TRIGGER);
            GenerationResult rest = remover.generate(options().build(), null, console);
            assertThat(rest.triggers()).containsExactly(PRIORITY_TRIGGER);
        }

        @Test
        @DisplayName("should skip non-selection models with a warning")
        void shouldSkipOptionModels() {
            GenerationResult result = remover.generate(options().model(TestModels.PRIORITY).build(), null, console);

            assertThat(result.migrations()).isEmpty();
            assertThat(console.lines()).containsExactly(
                    "WARNING: Model tasks.TaskPriority is not a selection model. Skipping...",
                    "No triggers found to remove.");
        }

        @Test
        @DisplayName("should pick up hand-written trigger migrations named after the model")
        void shouldReadHandWrittenFiles(@TempDir Path other) throws IOException {
            Files.writeString(
                    other.resolve("V0001__trigger_for_taskstatusselection.sql"),
                    "DROP TRIGGER IF EXISTS custom_guard;\nCREATE TRIGGER custom_guard BEFORE INSERT ON x BEGIN SELECT 1; END;\n");

            GenerationResult result = remover.generate(
                    options().model(TestModels.STATUS_SELECTION).migrationDir(other).build(), null, console);

            assertThat(result.triggers()).containsExactly("custom_guard");
        }
    }

    @Nested
    @DisplayName("Dry run, interaction and verification")
    class Options {

        @Test
        @DisplayName("should describe the migration without writing it")
        void shouldDryRun() {
            GenerationResult result = remover.generate(options().dryRun(true).build(), null, console);

            assertThat(root.resolve("tasks/V0003__remove_triggers.sql")).doesNotExist();
            assertThat(result.migrations()).hasSize(1);
            assertThat(console.lines()).contains(
                    "[DRY RUN] Would create migration: " + root.resolve("tasks/V0003__remove_triggers.sql"),
                    "[DRY RUN] Would remove triggers: " + PRIORITY_TRIGGER + ", " + STATUS_TRIGGER);
        }

        @Test
        @DisplayName("should leave the app alone when the operator declines")
        void shouldHonourDecline() {
            GenerationResult result = remover.generate(options().interactive(true).build(), null, console);

            assertThat(console.questions()).singleElement().asString()
                    .startsWith("Will remove the following triggers from tasks: ")
                    .endsWith("Proceed? (y/n)");
            assertThat(result.migrations()).isEmpty();
            assertThat(result.skipped()).containsExactly(PRIORITY_TRIGGER, STATUS_TRIGGER);
        }

        @Test
        @DisplayName("should skip triggers missing from the live database when verifying")
        void shouldVerify() {
            TriggerCatalog catalog = Set.of(STATUS_TRIGGER)::contains;

            GenerationResult result = remover.generate(options().verify(true).build(), catalog, console);

            assertThat(result.triggers()).containsExactly(STATUS_TRIGGER);
            assertThat(result.skipped()).containsExactly(PRIORITY_TRIGGER);
        }

        @Test
        @DisplayName("should require a catalog to verify")
        void shouldRequireCatalog() {
            assertThatThrownBy(() -> remover.generate(options().verify(true).build(), null, console))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
