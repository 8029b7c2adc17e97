package com.tenantoptions.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tenantoptions.model.DatabaseVendor;
import com.tenantoptions.model.OptionModel;
import com.tenantoptions.model.testing.TestModels;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SchemaDdl")
class SchemaDdlTest {

    @Test
    @DisplayName("should render the option table with its check constraint and unique index")
    void shouldRenderOptionTable() {
        var statements = SchemaDdl.forOptionModel(TestModels.priority(), DatabaseVendor.POSTGRESQL);

        assertThat(statements).hasSize(2);
        assertThat(statements.get(0))
                .startsWith("CREATE TABLE IF NOT EXISTS tasks_taskpriority (")
                .contains("id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY")
                .contains("name VARCHAR(100) NOT NULL")
                .contains("tenant_id BIGINT REFERENCES tenants_tenant (id) ON DELETE CASCADE")
                .contains("CONSTRAINT tasks_taskpriority_tenant_check CHECK");
        assertThat(statements.get(1)).isEqualTo("CREATE UNIQUE INDEX IF NOT EXISTS tasks_taskpriority_unique_name "
                + "ON tasks_taskpriority (lower(name), COALESCE(tenant_id, -1)) WHERE deleted IS NULL");
    }

    @Test
    @DisplayName("should render the selection table referencing its option table")
    void shouldRenderSelectionTable() {
        var statements = SchemaDdl.forSelectionModel(
                TestModels.prioritySelection(), "tasks_taskpriority", DatabaseVendor.SQLITE);

        assertThat(statements.get(0))
                .contains("id INTEGER PRIMARY KEY AUTOINCREMENT")
                .contains("option_id BIGINT NOT NULL REFERENCES tasks_taskpriority (id) ON DELETE CASCADE")
                .contains("CONSTRAINT tasks_taskpriorityselection_option_not_null CHECK (option_id IS NOT NULL)")
                .contains("CONSTRAINT tasks_taskpriorityselection_tenant_not_null CHECK (tenant_id IS NOT NULL)");
        assertThat(statements.get(1)).contains("(tenant_id, option_id) WHERE deleted IS NULL");
    }

    @Test
    @DisplayName("should omit constraints the model does not declare")
    void shouldOmitUndeclaredConstraints() {
        var model = OptionModel.builder(TestModels.PRIORITY).constraints(Set.of()).build();

        var statements = SchemaDdl.forOptionModel(model, DatabaseVendor.SQLITE);

        assertThat(statements).hasSize(1);
        assertThat(statements.get(0)).doesNotContain("CONSTRAINT").doesNotContain("REFERENCES");
    }

    @Test
    @DisplayName("should render option tables before selection tables")
    void shouldOrderRegistry() {
        var statements = SchemaDdl.forRegistry(TestModels.registry(), DatabaseVendor.SQLITE);

        assertThat(statements).hasSize(8);
        assertThat(statements.get(0)).contains("tasks_taskpriority (");
        assertThat(statements.get(4)).contains("tasks_taskpriorityselection (");
    }

    @Test
    @DisplayName("should refuse vendors without partial expression indexes")
    void shouldRejectUnsupportedVendor() {
        assertThatThrownBy(() -> SchemaDdl.forOptionModel(TestModels.priority(), DatabaseVendor.MYSQL))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
