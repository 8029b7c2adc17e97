package com.tenantoptions.model;

/**
 * A reusable bundle of fields. Traits are composed into an {@link EntityDefinition} by a
 * {@link SchemaBuilder}, which refuses a field contributed twice.
 */
public interface EntityTrait {

    /** Adds this trait's fields to the builder. */
    void contribute(SchemaBuilder builder);
}
