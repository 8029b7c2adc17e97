package com.tenantoptions.model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Definition of one concrete option table: its label, storage, tenant model, the selection model
 * paired with it and its static default-options table.
 * <p>
 * Built through {@link #builder(String)}. Unset tenant and selection references are allowed so
 * that the configuration auditor can report them.
 */
public final class OptionModel implements CatalogModel {

    private static final EntityDefinition DEFINITION = SchemaBuilder.compose(OptionTrait.INSTANCE);

    private final ModelLabel label;
    private final String table;
    private final ModelLabel tenantModel;
    private final String tenantTable;
    private final ModelLabel selectionModel;
    private final List<DefaultOption> defaultOptions;
    private final Set<String> constraints;

    private OptionModel(Builder builder) {
        this.label = builder.label;
        this.table = builder.table != null ? builder.table : label.defaultTable();
        this.tenantModel = builder.tenantModel;
        this.tenantTable = builder.tenantTable != null
                ? builder.tenantTable
                : tenantModel != null ? tenantModel.defaultTable() : null;
        this.selectionModel = builder.selectionModel;
        this.defaultOptions = List.copyOf(builder.defaultOptions);
        this.constraints = builder.constraints != null
                ? Set.copyOf(builder.constraints)
                : Set.copyOf(ConstraintNames.expectedForOption(label));
    }

    public static Builder builder(String label) {
        return new Builder(ModelLabel.parse(label));
    }

    public static Builder builder(ModelLabel label) {
        return new Builder(label);
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

    /** Label of the paired selection model, or null when not configured. */
    public ModelLabel selectionModel() {
        return selectionModel;
    }

    /** Default options in declaration order. */
    public List<DefaultOption> defaultOptions() {
        return defaultOptions;
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
        private ModelLabel selectionModel;
        private final List<DefaultOption> defaultOptions = new ArrayList<>();
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

        public Builder selectionModel(String selectionModel) {
            this.selectionModel = selectionModel == null ? null : ModelLabel.parse(selectionModel);
            return this;
        }

        public Builder defaultOption(String name, OptionType type) {
            defaultOptions.add(new DefaultOption(name, type));
            return this;
        }

        public Builder defaultOptions(List<DefaultOption> options) {
            defaultOptions.addAll(options);
            return this;
        }

        /** Overrides the declared constraint names; by default every expected name is declared. */
        public Builder constraints(Set<String> constraints) {
            this.constraints = new LinkedHashSet<>(constraints);
            return this;
        }

        public OptionModel build() {
            return new OptionModel(this);
        }
    }
}
