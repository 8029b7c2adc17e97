package com.tenantoptions.database.trigger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tenantoptions.model.DatabaseVendor;
import com.tenantoptions.model.ModelLabel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("TriggerDialects")
class TriggerDialectsTest {

    private static TriggerTarget target(DatabaseVendor vendor) {
        return new TriggerTarget(
                ModelLabel.parse("tasks.TaskPrioritySelection"),
                "tasks_taskpriorityselection",
                "tasks_taskpriority",
                TriggerNames.triggerName("tasks_taskpriorityselection", vendor));
    }

    @Test
    @DisplayName("should reject a null vendor")
    void shouldRejectNullVendor() {
        assertThatThrownBy(() -> TriggerDialects.forVendor(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Nested
    @DisplayName("SQLite")
    class Sqlite {

        private final TriggerDialect dialect = TriggerDialects.forVendor(DatabaseVendor.SQLITE);

        @Test
        @DisplayName("should compare against the option table and raise FAIL")
        void shouldCompareAgainstOptions() {
            String script = dialect.createScript(target(DatabaseVendor.SQLITE));

            assertThat(script)
                    .contains("BEFORE INSERT ON \"tasks_taskpriorityselection\"")
                    .contains("SELECT tenant_id FROM \"tasks_taskpriority\" WHERE id = NEW.option_id")
                    .contains("RAISE(FAIL, 'Tenant mismatch between options and selections')")
                    .startsWith("DROP TRIGGER IF EXISTS");
        }

        @Test
        @DisplayName("should drop with IF EXISTS")
        void shouldDrop() {
            assertThat(dialect.dropScript("trg", "sel")).isEqualTo("DROP TRIGGER IF EXISTS \"trg\";\n");
        }
    }

    @Nested
    @DisplayName("PostgreSQL")
    class Postgres {

        private final TriggerDialect dialect = TriggerDialects.forVendor(DatabaseVendor.POSTGRESQL);

        @Test
        @DisplayName("should install a PL/pgSQL function and attach it")
        void shouldUseFunction() {
            TriggerTarget target = target(DatabaseVendor.POSTGRESQL);
            String script = dialect.createScript(target);

            assertThat(script)
                    .contains("CREATE OR REPLACE FUNCTION \"" + target.triggerName() + "_func\"() RETURNS TRIGGER")
                    .contains("LANGUAGE plpgsql")
                    .contains("FROM \"tasks_taskpriority\" WHERE id = NEW.option_id")
                    .contains("USING ERRCODE = '23514'")
                    .contains("EXECUTE FUNCTION \"" + target.triggerName() + "_func\"()");
            assertThat(dialect.createStatements(target)).hasSize(3);
        }

        @Test
        @DisplayName("should drop the trigger and its function")
        void shouldDropBoth() {
            assertThat(dialect.dropScript("trg", "sel"))
                    .contains("DROP TRIGGER IF EXISTS \"trg\" ON \"sel\";")
                    .contains("DROP FUNCTION IF EXISTS \"trg_func\"();");
        }
    }

    @Nested
    @DisplayName("MySQL")
    class MySql {

        private final TriggerDialect dialect = TriggerDialects.forVendor(DatabaseVendor.MYSQL);

        @Test
        @DisplayName("should signal SQLSTATE 45000 inside a delimiter block")
        void shouldSignal() {
            String script = dialect.createScript(target(DatabaseVendor.MYSQL));

            assertThat(script)
                    .contains("SIGNAL SQLSTATE '45000' SET MESSAGE_TEXT = 'Tenant mismatch between options and selections'")
                    .contains("DELIMITER //")
                    .contains("END//\nDELIMITER ;")
                    .contains("FROM `tasks_taskpriority`");
        }
    }

    @Nested
    @DisplayName("Oracle")
    class Oracle {

        private final TriggerDialect dialect = TriggerDialects.forVendor(DatabaseVendor.ORACLE);

        @Test
        @DisplayName("should raise application error -20001")
        void shouldRaiseApplicationError() {
            String script = dialect.createScript(target(DatabaseVendor.ORACLE));

            assertThat(script)
                    .startsWith("CREATE OR REPLACE TRIGGER")
                    .contains("RAISE_APPLICATION_ERROR(-20001, 'Tenant mismatch between options and selections')")
                    .contains(":NEW.option_id")
                    .endsWith("END;\n/\n");
        }

        @Test
        @DisplayName("should ignore a missing trigger on drop")
        void shouldIgnoreMissingTrigger() {
            assertThat(dialect.dropScript("trg", "sel"))
                    .contains("EXECUTE IMMEDIATE 'DROP TRIGGER \"trg\"'")
                    .contains("SQLCODE != -4080");
        }
    }
}
