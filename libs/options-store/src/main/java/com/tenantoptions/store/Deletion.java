package com.tenantoptions.store;

/** Deletion-state filter shared by option and selection queries. */
enum Deletion {
    ANY,
    ACTIVE,
    DELETED;

    void apply(WhereClause where) {
        if (this == ACTIVE) {
            where.add("deleted IS NULL");
        } else if (this == DELETED) {
            where.add("deleted IS NOT NULL");
        }
    }
}
