package com.tenantoptions.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Composes traits into an {@link EntityDefinition}.
 * <p>
 * Each column may be contributed once. Applying the same trait twice, or two traits that share a
 * column, fails with {@link IllegalStateException}.
 */
public final class SchemaBuilder {

    private final Map<String, FieldDefinition> fields = new LinkedHashMap<>();

    public static EntityDefinition compose(EntityTrait... traits) {
        var builder = new SchemaBuilder();
        for (EntityTrait trait : traits) {
            builder.apply(trait);
        }
        return builder.build();
    }

    public SchemaBuilder apply(EntityTrait trait) {
        if (trait == null) {
            throw new IllegalArgumentException("trait must not be null");
        }
        trait.contribute(this);
        return this;
    }

    public SchemaBuilder field(FieldDefinition field) {
        if (fields.containsKey(field.column())) {
            throw new IllegalStateException("Field '%s' is already registered".formatted(field.column()));
        }
        fields.put(field.column(), field);
        return this;
    }

    public EntityDefinition build() {
        return new EntityDefinition(new ArrayList<>(fields.values()));
    }
}
