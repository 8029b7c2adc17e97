package com.tenantoptions.store;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Collects conditions in the order they are added and generates unique parameter names. */
final class WhereClause {

    private final List<String> conditions = new ArrayList<>();
    private final Map<String, Object> params = new HashMap<>();

    WhereClause add(String condition) {
        conditions.add(condition);
        return this;
    }

    /** Adds a condition containing {@code ?}, replaced by a fresh named parameter bound to value. */
    WhereClause add(String condition, Object value) {
        String name = "p" + params.size();
        params.put(name, value);
        conditions.add(condition.replace("?", ":" + name));
        return this;
    }

    WhereClause add(String condition, Object first, Object second) {
        String a = "p" + params.size();
        params.put(a, first);
        String b = "p" + params.size();
        params.put(b, second);
        conditions.add(condition.replaceFirst("\\?", ":" + a).replaceFirst("\\?", ":" + b));
        return this;
    }

    SqlCriteria build() {
        String where = conditions.isEmpty() ? "" : " WHERE " + String.join(" AND ", conditions);
        return new SqlCriteria(where, params);
    }
}
