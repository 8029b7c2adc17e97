package com.tenantoptions.model;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Definition of one concrete selection table and the option model whose rows it selects.
 */
public final class SelectionModel implements CatalogModel {

    private static final EntityDefinition DEFINITION = SchemaBuilder.compose(SelectionTrait.INSTANCE);

    private final ModelLabel label;
    private final String table;
    private final ModelLabel tenantModel;
    private final String tenantTable;
    private final ModelLabel optionModel;
    private final Set<String> constraints;

    private SelectionModel(Builder builder) {
        this.label = builder.label;
        this.table = builder.table != null ? builder.table : label.defaultTable();
        this.tenantModel = builder.tenantModel;
        this.tenantTable = builder.tenantTable != null
                ? builder.tenantTable
                : tenantModel != null ? tenantModel.defaultTable() : null;
        this.optionModel = builder.optionModel;
        this.constraints = builder.constraints != null
                ? Set.copyOf(builder.constraints)
                : Set.copyOf(ConstraintNames.expectedForSelection(label));
    }

    public static Builder builder(String label) {
        return new Builder(ModelLabel.parse(label));
    }

    @Override
    public ModelLabel label() {
        return label;
    }

    @Override
    public String table() {
        return table;
    }

    @Override
    public ModelLabel tenantModel() {
        return tenantModel;
    }

    @Override
    public String tenantTable() {
        return tenantTable;
    }

    /** Label of the option model this selection references, or null when not configured. */
    public ModelLabel optionModel() {
        return optionModel;
    }

    @Override
    public Set<String> constraints() {
        return constraints;
    }

    @Override
    public EntityDefinition definition() {
        return DEFINITION;
    }

    public String constraint(String template) {
        return ConstraintNames.resolve(template, label);
    }

    @Override
    public String toString() {
        return label.toString();
    }

    public static final class Builder {

        private final ModelLabel label;
        private String table;
        private ModelLabel tenantModel;
        private String tenantTable;
        private ModelLabel optionModel;
        private Set<String> constraints;

        private Builder(ModelLabel label) {
            this.label = label;
        }

        public Builder table(String table) {
            this.table = table;
            return this;
        }

        public Builder tenantModel(String tenantModel) {
            this.tenantModel = tenantModel == null ? null : ModelLabel.parse(tenantModel);
            return this;
        }

        public Builder tenantTable(String tenantTable) {
            this.tenantTable = tenantTable;
            return this;
        }

        public Builder optionModel(String optionModel) {
            this.optionModel = optionModel == null ? null : ModelLabel.parse(optionModel);
            return this;
        }

        public Builder constraints(Set<String> constraints) {
            this.constraints = new LinkedHashSet<>(constraints);
            return this;
        }

        public SelectionModel build() {
            return new SelectionModel(this);
        }
    }
}
