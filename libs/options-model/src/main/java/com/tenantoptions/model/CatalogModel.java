package com.tenantoptions.model;

import java.util.Set;

/** What option and selection models have in common. */
public interface CatalogModel {

    ModelLabel label();

    String table();

    /** Label of the host application's tenant model, or null when not configured. */
    ModelLabel tenantModel();

    /** Table holding tenants; defaults to the tenant model's conventional table. */
    String tenantTable();

    /** Constraint names this model declares. */
    Set<String> constraints();

    EntityDefinition definition();
}
