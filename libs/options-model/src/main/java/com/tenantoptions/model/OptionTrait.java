package com.tenantoptions.model;

import com.tenantoptions.model.FieldDefinition.Reference;

/** Fields shared by every option table. */
public final class OptionTrait implements EntityTrait {

    public static final int MAX_NAME_LENGTH = 100;
    public static final int OPTION_TYPE_LENGTH = 2;

    public static final OptionTrait INSTANCE = new OptionTrait();

    private OptionTrait() {
    }

    @Override
    public void contribute(SchemaBuilder builder) {
        builder.field(FieldDefinition.primaryKey("id"))
                .field(FieldDefinition.text("name", MAX_NAME_LENGTH))
                .field(FieldDefinition.choice("option_type", OPTION_TYPE_LENGTH))
                .field(FieldDefinition.foreignKey("tenant_id", Reference.TENANT, true))
                .field(FieldDefinition.timestamp("deleted", true));
    }
}
