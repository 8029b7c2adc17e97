package com.tenantoptions.model;

/** Storage shape of a column contributed by a trait. */
public enum FieldKind {
    PRIMARY_KEY,
    TEXT,
    CHOICE,
    FOREIGN_KEY,
    TIMESTAMP
}
