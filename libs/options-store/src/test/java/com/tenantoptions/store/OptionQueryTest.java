package com.tenantoptions.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tenantoptions.model.OptionType;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("OptionQuery")
class OptionQueryTest {

    @Test
    @DisplayName("should compile to an empty clause when unfiltered")
    void shouldCompileEmpty() {
        var criteria = OptionQuery.all().compile();

        assertThat(criteria.where()).isEmpty();
        assertThat(criteria.params()).isEmpty();
        assertThat(criteria.whereAnd("deleted IS NULL")).isEqualTo(" WHERE deleted IS NULL");
    }

    @Test
    @DisplayName("should apply criteria in fixed priority order regardless of chaining")
    void shouldApplyInPriorityOrder() {
        var chained = OptionQuery.all().named("High").ownedBy(7L).customOptions().active().compile();
        var ordered = OptionQuery.all().active().customOptions().ownedBy(7L).named("High").compile();

        assertThat(chained).isEqualTo(ordered);
        assertThat(chained.where()).isEqualTo(
                " WHERE deleted IS NULL AND option_type IN (:p0) AND tenant_id = :p1 AND name IN (:p2)");
        assertThat(chained.params()).containsEntry("p0", List.of("cu")).containsEntry("p1", 7L);
    }

    @Test
    @DisplayName("should let a later criterion of the same kind replace an earlier one")
    void shouldReplaceSameKind() {
        var where = OptionQuery.all().deleted().active().compile().where();

        assertThat(where).isEqualTo(" WHERE deleted IS NULL");
    }

    @Test
    @DisplayName("should lower-case names for case-insensitive matching")
    void shouldMatchIgnoringCase() {
        var criteria = OptionQuery.all().namedIgnoreCase("HiGh").compile();

        assertThat(criteria.where()).isEqualTo(" WHERE lower(name) IN (:p0)");
        assertThat(criteria.params()).containsEntry("p0", List.of("high"));
    }

    @Test
    @DisplayName("should match nothing for an empty id set")
    void shouldMatchNothingForEmptyIds() {
        assertThat(OptionQuery.all().withIds(List.of()).compile().where()).isEqualTo(" WHERE 1 = 0");
    }

    @Test
    @DisplayName("should require at least one option type")
    void shouldRequireType() {
        assertThatThrownBy(() -> OptionQuery.all().ofTypes()).isInstanceOf(IllegalArgumentException.class);
    }

    @Nested
    @DisplayName("Tenant resolution")
    class TenantResolution {

        @Test
        @DisplayName("should offer defaults plus the tenant's custom options")
        void shouldScopeOptionsForTenant() {
            var criteria = OptionQuery.optionsForTenant(3L, false).compile();

            assertThat(criteria.where()).isEqualTo(" WHERE deleted IS NULL AND "
                    + "(option_type IN ('dm', 'do') OR (option_type = 'cu' AND tenant_id = :p0))");
            assertThat(OptionQuery.optionsForTenant(3L, true).compile().where()).doesNotContain("deleted");
        }

        @Test
        @DisplayName("should keep only mandatory options when nothing is selected")
        void shouldFallBackToMandatory() {
            var criteria = OptionQuery.selectedOptionsForTenant(3L, List.of(), false).compile();

            assertThat(criteria.where()).isEqualTo(" WHERE deleted IS NULL AND option_type = 'dm'");
        }

        @Test
        @DisplayName("should add selected optional and owned custom options to the mandatory ones")
        void shouldIncludeSelected() {
            var criteria = OptionQuery.selectedOptionsForTenant(3L, List.of(10L), false).compile();

            assertThat(criteria.where()).contains("option_type = 'dm' OR (id IN (:p0)");
            assertThat(criteria.params()).containsEntry("p0", List.of(10L)).containsEntry("p1", 3L);
        }

        @Test
        @DisplayName("should select default types only")
        void shouldSelectDefaults() {
            var criteria = OptionQuery.all().defaultOptions().compile();

            assertThat(criteria.params().get("p0")).isEqualTo(List.of(
                    OptionType.MANDATORY.code(), OptionType.OPTIONAL.code()));
        }
    }

    @Nested
    @DisplayName("SelectionQuery")
    class Selections {

        @Test
        @DisplayName("should compile tenant, option and option-state filters")
        void shouldCompile() {
            var criteria = SelectionQuery.all().active().forTenant(2L).forOption(5L)
                    .pointingToDeletedOptions("tasks_taskpriority")
                    .compile();

            assertThat(criteria.where()).isEqualTo(" WHERE deleted IS NULL AND tenant_id = :p0 AND option_id IN (:p1)"
                    + " AND option_id IN (SELECT id FROM tasks_taskpriority WHERE deleted IS NOT NULL)");
        }

        @Test
        @DisplayName("should refuse an unsafe table name")
        void shouldRejectUnsafeTable() {
            assertThatThrownBy(() -> SelectionQuery.all().pointingToDeletedOptions("x; DROP TABLE y"))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
