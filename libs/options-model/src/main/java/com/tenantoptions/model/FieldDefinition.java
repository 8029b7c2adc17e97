package com.tenantoptions.model;

/**
 * One column of an option or selection table.
 *
 * @param column column name
 * @param kind storage shape
 * @param nullable whether NULL is allowed
 * @param maxLength maximum length for TEXT and CHOICE columns, 0 otherwise
 * @param references for FOREIGN_KEY columns, which side of the pairing is referenced
 */
public record FieldDefinition(String column, FieldKind kind, boolean nullable, int maxLength,
                              Reference references) {

    /** Target of a foreign key, resolved to a table per model. */
    public enum Reference {
        NONE,
        TENANT,
        OPTION
    }

    public FieldDefinition {
        if (column == null || column.isBlank()) {
            throw new IllegalArgumentException("column must not be null or blank");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind must not be null");
        }
        if (references == null) {
            references = Reference.NONE;
        }
        if (kind == FieldKind.FOREIGN_KEY && references == Reference.NONE) {
            throw new IllegalArgumentException("foreign key column '%s' needs a reference".formatted(column));
        }
    }

    public static FieldDefinition primaryKey(String column) {
        return new FieldDefinition(column, FieldKind.PRIMARY_KEY, false, 0, Reference.NONE);
    }

    public static FieldDefinition text(String column, int maxLength) {
        return new FieldDefinition(column, FieldKind.TEXT, false, maxLength, Reference.NONE);
    }

    public static FieldDefinition choice(String column, int maxLength) {
        return new FieldDefinition(column, FieldKind.CHOICE, false, maxLength, Reference.NONE);
    }

    public static FieldDefinition foreignKey(String column, Reference target, boolean nullable) {
        return new FieldDefinition(column, FieldKind.FOREIGN_KEY, nullable, 0, target);
    }

    public static FieldDefinition timestamp(String column, boolean nullable) {
        return new FieldDefinition(column, FieldKind.TIMESTAMP, nullable, 0, Reference.NONE);
    }
}
