package com.tenantoptions.database.trigger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tenantoptions.model.DatabaseVendor;
import com.tenantoptions.model.ModelLabel;
import com.tenantoptions.model.ModelRegistry;
import com.tenantoptions.model.OptionModel;
import com.tenantoptions.model.SelectionModel;
import com.tenantoptions.model.testing.TestModels;
import com.tenantoptions.store.testing.SqliteTestDatabase;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.dao.DataIntegrityViolationException;

@DisplayName("SQLite tenant consistency trigger")
class SqliteTriggerTest {

    @TempDir
    Path dir;

    private SqliteTestDatabase db;
    private TriggerTarget target;

    @BeforeEach
    void setUp() {
        ModelRegistry registry = TestModels.registry();
        db = SqliteTestDatabase.create(dir).install(registry);
        db.insertTenant(1L);
        db.insertTenant(2L);
        SelectionModel selection = registry.selectionModel(ModelLabel.parse(TestModels.PRIORITY_SELECTION)).orElseThrow();
        OptionModel option = registry.optionModelFor(selection).orElseThrow();
        target = TriggerTarget.of(selection, option, DatabaseVendor.SQLITE);
        TriggerDialects.forVendor(DatabaseVendor.SQLITE).createStatements(target).forEach(db::execute);

        db.execute("INSERT INTO tasks_taskpriority (id, name, option_type, tenant_id) VALUES (1, 'Critical', 'dm', NULL)");
        db.execute("INSERT INTO tasks_taskpriority (id, name, option_type, tenant_id) VALUES (2, 'Mine', 'cu', 1)");
    }

    private void select(long tenant, long option) {
        db.jdbc().sql("INSERT INTO tasks_taskpriorityselection (tenant_id, option_id) VALUES (?, ?)")
                .params(tenant, option)
                .update();
    }

    @Test
    @DisplayName("should reject a selection of another tenant's custom option")
    void shouldRejectCrossTenantInsert() {
        assertThatThrownBy(() -> select(2L, 2L))
                .isInstanceOf(DataIntegrityViolationException.class)
                .hasMessageContaining(TriggerDialect.MISMATCH_MESSAGE);
    }

    @Test
    @DisplayName("should accept the owner's custom option and tenant-less options")
    void shouldAcceptConsistentInserts() {
        select(1L, 2L);
        select(2L, 1L);

        Long rows = db.jdbc().sql("SELECT COUNT(*) FROM tasks_taskpriorityselection").query(Long.class).single();
        assertThat(rows).isEqualTo(2L);
    }

    @Test
    @DisplayName("should be visible in the catalog and gone after the drop statements")
    void shouldAppearInCatalog() {
        var catalog = new JdbcTriggerCatalog(db.jdbc(), DatabaseVendor.SQLITE);
        assertThat(catalog.exists(target.triggerName())).isTrue();

        TriggerDialects.forVendor(DatabaseVendor.SQLITE)
                .dropStatements(target.triggerName(), target.selectionTable())
                .forEach(db::execute);

        assertThat(catalog.exists(target.triggerName())).isFalse();
        select(2L, 2L);
    }
}
