package com.tenantoptions.model;

import com.tenantoptions.model.FieldDefinition.Reference;

/** Fields shared by every selection table. */
public final class SelectionTrait implements EntityTrait {

    public static final SelectionTrait INSTANCE = new SelectionTrait();

    private SelectionTrait() {
    }

    @Override
    public void contribute(SchemaBuilder builder) {
        builder.field(FieldDefinition.primaryKey("id"))
                .field(FieldDefinition.foreignKey("tenant_id", Reference.TENANT, false))
                .field(FieldDefinition.foreignKey("option_id", Reference.OPTION, false))
                .field(FieldDefinition.timestamp("deleted", true));
    }
}
