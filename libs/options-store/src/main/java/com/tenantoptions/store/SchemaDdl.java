package com.tenantoptions.store;

import com.tenantoptions.model.CatalogModel;
import com.tenantoptions.model.ConstraintNames;
import com.tenantoptions.model.DatabaseVendor;
import com.tenantoptions.model.FieldDefinition;
import com.tenantoptions.model.FieldKind;
import com.tenantoptions.model.ModelRegistry;
import com.tenantoptions.model.OptionModel;
import com.tenantoptions.model.SelectionModel;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders {@code CREATE TABLE} and {@code CREATE UNIQUE INDEX} statements for option and
 * selection models.
 * <p>
 * Only the constraints a model declares are rendered, so a model that leaves one out gets a table
 * without it (and a warning from the configuration auditor).
 *
 * <h2>Supported vendors</h2>
 *
 * <p>SQLite and PostgreSQL. Both support the partial expression indexes the uniqueness rules need.
 */
public final class SchemaDdl {

    private SchemaDdl() {
    }

    /** Statements for every model in the registry, option tables before selection tables. */
    public static List<String> forRegistry(ModelRegistry registry, DatabaseVendor vendor) {
        var statements = new ArrayList<String>();
        registry.optionModels().forEach(m -> statements.addAll(forOptionModel(m, vendor)));
        for (SelectionModel selection : registry.selectionModels()) {
            String optionTable = registry.optionModelFor(selection).map(OptionModel::table).orElse(null);
            statements.addAll(forSelectionModel(selection, optionTable, vendor));
        }
        return statements;
    }

    public static List<String> forOptionModel(OptionModel model, DatabaseVendor vendor) {
        requireSupported(vendor);
        var body = new ArrayList<String>(columns(model, null, vendor));
        String tenantCheck = model.constraint(ConstraintNames.TENANT_CHECK);
        if (model.constraints().contains(tenantCheck)) {
            body.add("CONSTRAINT %s CHECK ((option_type = 'cu' AND tenant_id IS NOT NULL) "
                    .formatted(tenantCheck) + "OR (option_type IN ('dm', 'do') AND tenant_id IS NULL))");
        }
        var statements = new ArrayList<String>();
        statements.add(createTable(model.table(), body));
        String uniqueName = model.constraint(ConstraintNames.UNIQUE_NAME);
        if (model.constraints().contains(uniqueName)) {
            statements.add("CREATE UNIQUE INDEX IF NOT EXISTS %s ON %s (lower(name), COALESCE(tenant_id, -1)) "
                    .formatted(uniqueName, model.table()) + "WHERE deleted IS NULL");
        }
        return statements;
    }

    /**
     * @param optionTable table of the referenced option model, or null to render the column
     *        without a foreign key
     */
    public static List<String> forSelectionModel(SelectionModel model, String optionTable, DatabaseVendor vendor) {
        requireSupported(vendor);
        var body = new ArrayList<String>(columns(model, optionTable, vendor));
        String optionNotNull = model.constraint(ConstraintNames.OPTION_NOT_NULL);
        if (model.constraints().contains(optionNotNull)) {
            body.add("CONSTRAINT %s CHECK (option_id IS NOT NULL)".formatted(optionNotNull));
        }
        String tenantNotNull = model.constraint(ConstraintNames.TENANT_NOT_NULL);
        if (model.constraints().contains(tenantNotNull)) {
            body.add("CONSTRAINT %s CHECK (tenant_id IS NOT NULL)".formatted(tenantNotNull));
        }
        var statements = new ArrayList<String>();
        statements.add(createTable(model.table(), body));
        String uniqueActive = model.constraint(ConstraintNames.UNIQUE_ACTIVE_SELECTION);
        if (model.constraints().contains(uniqueActive)) {
            statements.add("CREATE UNIQUE INDEX IF NOT EXISTS %s ON %s (tenant_id, option_id) WHERE deleted IS NULL"
                    .formatted(uniqueActive, model.table()));
        }
        return statements;
    }

    // ── Private Helpers ──

    private static void requireSupported(DatabaseVendor vendor) {
        if (vendor != DatabaseVendor.SQLITE && vendor != DatabaseVendor.POSTGRESQL) {
            throw new IllegalArgumentException("Schema DDL is not available for database vendor: " + vendor);
        }
    }

    private static String createTable(String table, List<String> body) {
        return "CREATE TABLE IF NOT EXISTS %s (\n    %s\n)".formatted(table, String.join(",\n    ", body));
    }

    private static List<String> columns(CatalogModel model, String optionTable, DatabaseVendor vendor) {
        return model.definition().fields().stream()
                .map(field -> field.column() + " " + columnType(field, model, optionTable, vendor))
                .toList();
    }

    private static String columnType(FieldDefinition field, CatalogModel model, String optionTable,
                                     DatabaseVendor vendor) {
        String type = switch (field.kind()) {
            case PRIMARY_KEY -> vendor == DatabaseVendor.SQLITE
                    ? "INTEGER PRIMARY KEY AUTOINCREMENT"
                    : "BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY";
            case TEXT, CHOICE -> "VARCHAR(%d)".formatted(field.maxLength());
            case FOREIGN_KEY -> "BIGINT";
            case TIMESTAMP -> vendor == DatabaseVendor.SQLITE ? "TIMESTAMP" : "TIMESTAMP WITH TIME ZONE";
        };
        if (field.kind() == FieldKind.PRIMARY_KEY) {
            return type;
        }
        var sql = new StringBuilder(type);
        if (!field.nullable()) {
            sql.append(" NOT NULL");
        }
        String target = switch (field.references()) {
            case TENANT -> model.tenantTable();
            case OPTION -> optionTable;
            case NONE -> null;
        };
        if (target != null) {
            sql.append(" REFERENCES ").append(target).append(" (id) ON DELETE CASCADE");
        }
        return sql.toString();
    }
}
