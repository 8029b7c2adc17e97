package com.tenantoptions.store;

import com.tenantoptions.model.OptionType;
import java.util.Arrays;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Immutable, composable filter over an option table.
 * <p>
 * Each method returns a new query; calling a method of the same kind again replaces the earlier
 * criterion. Criteria are compiled in a fixed order whatever order they were chained in:
 * deletion state, option type, tenant scope, ids, names.
 *
 * <pre>{@code
 * OptionQuery.all().active().customOptions().ownedBy(42L)
 * OptionQuery.optionsForTenant(42L, false)
 * }</pre>
 */
public final class OptionQuery {

    private enum ScopeKind {
        TENANTLESS,
        OWNED_BY,
        AVAILABLE_TO,
        SELECTED_BY
    }

    private record TenantScope(ScopeKind kind, Long tenant, Set<Long> selectedIds) {
    }

    private static final OptionQuery ALL =
            new OptionQuery(Deletion.ANY, Set.of(), null, null, null, false, Set.of());

    private final Deletion deletion;
    private final Set<OptionType> types;
    private final TenantScope scope;
    private final Set<Long> ids;
    private final Set<String> names;
    private final boolean namesIgnoreCase;
    private final Set<String> excludedNames;

    private OptionQuery(Deletion deletion, Set<OptionType> types, TenantScope scope, Set<Long> ids,
                        Set<String> names, boolean namesIgnoreCase, Set<String> excludedNames) {
        this.deletion = deletion;
        this.types = types;
        this.scope = scope;
        this.ids = ids;
        this.names = names;
        this.namesIgnoreCase = namesIgnoreCase;
        this.excludedNames = excludedNames;
    }

    /** Every row, deleted or not. */
    public static OptionQuery all() {
        return ALL;
    }

    /**
     * Options a tenant can see: every MANDATORY and OPTIONAL option plus the tenant's own CUSTOM
     * options.
     */
    public static OptionQuery optionsForTenant(long tenant, boolean includeDeleted) {
        var query = ALL.withScope(new TenantScope(ScopeKind.AVAILABLE_TO, tenant, Set.of()));
        return includeDeleted ? query : query.active();
    }

    /**
     * Options a tenant has in effect: every MANDATORY option plus the OPTIONAL options and the
     * tenant's CUSTOM options whose id is among {@code selectedIds}.
     */
    public static OptionQuery selectedOptionsForTenant(long tenant, Collection<Long> selectedIds,
                                                       boolean includeDeleted) {
        var query = ALL.withScope(
                new TenantScope(ScopeKind.SELECTED_BY, tenant, Set.copyOf(selectedIds)));
        return includeDeleted ? query : query.active();
    }

    public OptionQuery active() {
        return new OptionQuery(Deletion.ACTIVE, types, scope, ids, names, namesIgnoreCase, excludedNames);
    }

    public OptionQuery deleted() {
        return new OptionQuery(Deletion.DELETED, types, scope, ids, names, namesIgnoreCase, excludedNames);
    }

    public OptionQuery includingDeleted() {
        return new OptionQuery(Deletion.ANY, types, scope, ids, names, namesIgnoreCase, excludedNames);
    }

    public OptionQuery ofTypes(OptionType... optionTypes) {
        if (optionTypes.length == 0) {
            throw new IllegalArgumentException("at least one option type is required");
        }
        var set = EnumSet.copyOf(Arrays.asList(optionTypes));
        return new OptionQuery(deletion, Set.copyOf(set), scope, ids, names, namesIgnoreCase, excludedNames);
    }

    public OptionQuery customOptions() {
        return ofTypes(OptionType.CUSTOM);
    }

    /** MANDATORY and OPTIONAL options. */
    public OptionQuery defaultOptions() {
        return ofTypes(OptionType.MANDATORY, OptionType.OPTIONAL);
    }

    public OptionQuery ownedBy(long tenant) {
        return withScope(new TenantScope(ScopeKind.OWNED_BY, tenant, Set.of()));
    }

    /** Rows without a tenant, i.e. MANDATORY and OPTIONAL options. */
    public OptionQuery tenantless() {
        return withScope(new TenantScope(ScopeKind.TENANTLESS, null, Set.of()));
    }

    public OptionQuery withIds(Collection<Long> optionIds) {
        return new OptionQuery(deletion, types, scope, Set.copyOf(optionIds), names, namesIgnoreCase, excludedNames);
    }

    public OptionQuery withIds(Long... optionIds) {
        return withIds(List.of(optionIds));
    }

    /** Exact, case-sensitive name match. */
    public OptionQuery named(String... optionNames) {
        return new OptionQuery(deletion, types, scope, ids, orderedSet(List.of(optionNames)), false, excludedNames);
    }

    /** Case-insensitive name match, as the unique-name index compares. */
    public OptionQuery namedIgnoreCase(String... optionNames) {
        var lowered = Arrays.stream(optionNames).map(n -> n.toLowerCase(Locale.ROOT)).toList();
        return new OptionQuery(deletion, types, scope, ids, orderedSet(lowered), true, excludedNames);
    }

    public OptionQuery excludingNames(Collection<String> optionNames) {
        return new OptionQuery(deletion, types, scope, ids, names, namesIgnoreCase, orderedSet(optionNames));
    }

    /** Compiles the criteria into a WHERE clause. */
    public SqlCriteria compile() {
        var where = new WhereClause();
        deletion.apply(where);
        if (!types.isEmpty()) {
            where.add("option_type IN (?)", types.stream().map(OptionType::code).sorted().toList());
        }
        if (scope != null) {
            applyScope(where);
        }
        if (ids != null) {
            if (ids.isEmpty()) {
                where.add("1 = 0");
            } else {
                where.add("id IN (?)", List.copyOf(ids));
            }
        }
        if (names != null) {
            if (names.isEmpty()) {
                where.add("1 = 0");
            } else {
                where.add((namesIgnoreCase ? "lower(name)" : "name") + " IN (?)", List.copyOf(names));
            }
        }
        if (!excludedNames.isEmpty()) {
            where.add("name NOT IN (?)", List.copyOf(excludedNames));
        }
        return where.build();
    }

    @Override
    public String toString() {
        return "OptionQuery" + compile();
    }

    // ── Private Helpers ──

    private OptionQuery withScope(TenantScope newScope) {
        return new OptionQuery(deletion, types, newScope, ids, names, namesIgnoreCase, excludedNames);
    }

    private void applyScope(WhereClause where) {
        switch (scope.kind()) {
            case TENANTLESS -> where.add("tenant_id IS NULL");
            case OWNED_BY -> where.add("tenant_id = ?", scope.tenant());
            case AVAILABLE_TO -> where.add(
                    "(option_type IN ('dm', 'do') OR (option_type = 'cu' AND tenant_id = ?))", scope.tenant());
            case SELECTED_BY -> {
                if (scope.selectedIds().isEmpty()) {
                    where.add("option_type = 'dm'");
                } else {
                    where.add("(option_type = 'dm' OR (id IN (?) AND (option_type = 'do' "
                            + "OR (option_type = 'cu' AND tenant_id = ?))))",
                            List.copyOf(scope.selectedIds()), scope.tenant());
                }
            }
            default -> throw new IllegalStateException("Unknown scope " + scope.kind());
        }
    }

    private static Set<String> orderedSet(Collection<String> values) {
        return new LinkedHashSet<>(values);
    }
}
