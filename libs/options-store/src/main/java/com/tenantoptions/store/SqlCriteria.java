package com.tenantoptions.store;

import java.util.Map;

/**
 * A compiled WHERE clause and its named parameters.
 *
 * @param where the clause including the leading {@code WHERE}, or empty when unfiltered
 * @param params named parameter values, collections expanded by the JDBC layer
 */
public record SqlCriteria(String where, Map<String, Object> params) {

    public SqlCriteria {
        params = Map.copyOf(params);
    }

    /** Appends a further condition, AND-ed with the existing ones. */
    public String whereAnd(String condition) {
        return where.isEmpty() ? " WHERE " + condition : where + " AND " + condition;
    }
}
