package com.tenantoptions.model;

import java.util.List;
import java.util.Optional;

/**
 * Ordered, immutable column layout of an option or selection table.
 *
 * @param fields the columns in declaration order
 */
public record EntityDefinition(List<FieldDefinition> fields) {

    public EntityDefinition {
        fields = List.copyOf(fields);
    }

    public Optional<FieldDefinition> field(String column) {
        return fields.stream().filter(f -> f.column().equals(column)).findFirst();
    }

    public List<String> columns() {
        return fields.stream().map(FieldDefinition::column).toList();
    }
}
