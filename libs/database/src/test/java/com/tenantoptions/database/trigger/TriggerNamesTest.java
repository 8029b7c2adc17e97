package com.tenantoptions.database.trigger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tenantoptions.model.DatabaseVendor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("TriggerNames")
class TriggerNamesTest {

    private static final String TABLE = "tasks_taskpriorityselection";

    @Nested
    @DisplayName("Trigger names")
    class Names {

        @Test
        @DisplayName("should be deterministic")
        void shouldBeDeterministic() {
            assertThat(TriggerNames.triggerName(TABLE, DatabaseVendor.POSTGRESQL))
                    .isEqualTo(TriggerNames.triggerName(TABLE, DatabaseVendor.POSTGRESQL));
        }

        @Test
        @DisplayName("should keep the full base name when it fits")
        void shouldKeepShortNames() {
            String name = TriggerNames.triggerName(TABLE, DatabaseVendor.SQLITE);

            assertThat(name).startsWith(TABLE + "_tenant_check_");
            assertThat(name).matches(".*_[0-9a-f]{10}");
        }

        @ParameterizedTest
        @EnumSource(DatabaseVendor.class)
        @DisplayName("should respect the vendor's identifier limit")
        void shouldRespectLimit(DatabaseVendor vendor) {
            String table = "a".repeat(250);

            assertThat(TriggerNames.triggerName(table, vendor)).hasSizeLessThanOrEqualTo(vendor.maxIdentifierLength());
        }

        @Test
        @DisplayName("should truncate before the hash on Oracle")
        void shouldTruncateForOracle() {
            String name = TriggerNames.triggerName(TABLE, DatabaseVendor.ORACLE);

            assertThat(name).hasSize(30);
            assertThat(name).startsWith("tasks_taskprioritys_");
        }

        @Test
        @DisplayName("should hash the untruncated name so long tables stay distinct")
        void shouldStayDistinct() {
            String first = TriggerNames.triggerName("x".repeat(40) + "_one", DatabaseVendor.ORACLE);
            String second = TriggerNames.triggerName("x".repeat(40) + "_two", DatabaseVendor.ORACLE);

            assertThat(first.substring(0, 19)).isEqualTo(second.substring(0, 19));
            assertThat(first).isNotEqualTo(second);
        }

        @ParameterizedTest
        @ValueSource(strings = {"_private_selection", "2024_selection"})
        @DisplayName("should prefix names starting with a digit or underscore in place of the last character")
        void shouldPrefix(String table) {
            String name = TriggerNames.triggerName(table, DatabaseVendor.POSTGRESQL);

            assertThat(name).startsWith("t" + table + "_tenant_chec_");
            assertThat(name).hasSize(("t" + table + "_tenant_chec_").length() + TriggerNames.HASH_LENGTH);
        }

        @Test
        @DisplayName("should replace dots and strip quotes")
        void shouldNormalize() {
            assertThat(TriggerNames.triggerName("\"public\".\"sel\"", DatabaseVendor.POSTGRESQL))
                    .isEqualTo(TriggerNames.triggerName("public_sel", DatabaseVendor.POSTGRESQL));
        }

        @ParameterizedTest
        @ValueSource(strings = {"sel; DROP TABLE x", "sel-table", "sel table", ""})
        @DisplayName("should reject unsafe identifiers")
        void shouldRejectUnsafe(String table) {
            assertThatThrownBy(() -> TriggerNames.triggerName(table, DatabaseVendor.SQLITE))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Quoting")
    class Quoting {

        @Test
        @DisplayName("should quote each part with double quotes")
        void shouldQuoteParts() {
            assertThat(TriggerNames.quote("public.sel", DatabaseVendor.POSTGRESQL)).isEqualTo("\"public\".\"sel\"");
        }

        @Test
        @DisplayName("should use backticks on MySQL")
        void shouldUseBackticks() {
            assertThat(TriggerNames.quote("sel", DatabaseVendor.MYSQL)).isEqualTo("`sel`");
        }
    }
}
