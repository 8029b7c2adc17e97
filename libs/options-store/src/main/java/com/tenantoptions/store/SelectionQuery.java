package com.tenantoptions.store;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Immutable filter over a selection table. Criteria compile in the order deletion state, tenant,
 * options, option state.
 */
public final class SelectionQuery {

    private static final Pattern TABLE = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final SelectionQuery ALL = new SelectionQuery(Deletion.ANY, null, null, null);

    private final Deletion deletion;
    private final Long tenant;
    private final Set<Long> optionIds;
    private final String deletedOptionTable;

    private SelectionQuery(Deletion deletion, Long tenant, Set<Long> optionIds, String deletedOptionTable) {
        this.deletion = deletion;
        this.tenant = tenant;
        this.optionIds = optionIds;
        this.deletedOptionTable = deletedOptionTable;
    }

    public static SelectionQuery all() {
        return ALL;
    }

    public SelectionQuery active() {
        return new SelectionQuery(Deletion.ACTIVE, tenant, optionIds, deletedOptionTable);
    }

    public SelectionQuery deleted() {
        return new SelectionQuery(Deletion.DELETED, tenant, optionIds, deletedOptionTable);
    }

    public SelectionQuery forTenant(long tenantId) {
        return new SelectionQuery(deletion, tenantId, optionIds, deletedOptionTable);
    }

    public SelectionQuery forOption(long optionId) {
        return forOptions(List.of(optionId));
    }

    public SelectionQuery forOptions(Collection<Long> ids) {
        return new SelectionQuery(deletion, tenant, Set.copyOf(ids), deletedOptionTable);
    }

    /** Selections whose option row in {@code optionTable} is soft-deleted. */
    public SelectionQuery pointingToDeletedOptions(String optionTable) {
        if (optionTable == null || !TABLE.matcher(optionTable).matches()) {
            throw new IllegalArgumentException("Invalid option table name: " + optionTable);
        }
        return new SelectionQuery(deletion, tenant, optionIds, optionTable);
    }

    public SqlCriteria compile() {
        var where = new WhereClause();
        deletion.apply(where);
        if (tenant != null) {
            where.add("tenant_id = ?", tenant);
        }
        if (optionIds != null) {
            if (optionIds.isEmpty()) {
                where.add("1 = 0");
            } else {
                where.add("option_id IN (?)", List.copyOf(optionIds));
            }
        }
        if (deletedOptionTable != null) {
            where.add("option_id IN (SELECT id FROM %s WHERE deleted IS NOT NULL)".formatted(deletedOptionTable));
        }
        return where.build();
    }

    @Override
    public String toString() {
        return "SelectionQuery" + compile();
    }
}
