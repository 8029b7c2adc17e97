package com.tenantoptions.model;

/**
 * An active option already holds the requested name in the same tenant scope. Raised before the
 * insert reaches the unique index.
 */
public class NameConflictException extends OptionIntegrityException {

    private final String name;

    public NameConflictException(String modelLabel, String name) {
        super("%s already has an active option named '%s'".formatted(modelLabel, name));
        this.name = name;
    }

    public String name() {
        return name;
    }
}
