package com.tenantoptions.store;

import com.tenantoptions.model.NoTenantProvidedException;
import com.tenantoptions.model.Option;
import com.tenantoptions.model.OptionIntegrityException;
import com.tenantoptions.model.OptionType;
import com.tenantoptions.model.Selection;
import com.tenantoptions.model.SelectionModel;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;

/**
 * JDBC-backed {@link SelectionManager}.
 * <p>
 * Selecting an option inserts a new row even when the tenant selected it before; deselecting
 * soft-deletes the active row, so a tenant's selection history is kept.
 */
public class SelectionRepository implements SelectionManager {

    private static final Logger log = LoggerFactory.getLogger(SelectionRepository.class);

    private static final String COLUMNS = "id, tenant_id, option_id, deleted";

    private final SelectionModel model;
    private final OptionManager options;
    private final StoreContext context;

    public SelectionRepository(SelectionModel model, OptionManager options, StoreContext context) {
        if (model == null || options == null || context == null) {
            throw new IllegalArgumentException("model, options and context must not be null");
        }
        this.model = model;
        this.options = options;
        this.context = context;
    }

    @Override
    public SelectionModel model() {
        return model;
    }

    @Override
    public OptionManager options() {
        return options;
    }

    @Override
    public List<Selection> find(SelectionQuery query) {
        SqlCriteria criteria = query.compile();
        return context.jdbc()
                .sql("SELECT " + COLUMNS + " FROM " + model.table() + criteria.where() + " ORDER BY id")
                .params(criteria.params())
                .query(SelectionRepository::mapRow)
                .list();
    }

    @Override
    public long count(SelectionQuery query) {
        SqlCriteria criteria = query.compile();
        return context.jdbc()
                .sql("SELECT COUNT(*) FROM " + model.table() + criteria.where())
                .params(criteria.params())
                .query(Long.class)
                .single();
    }

    @Override
    public Selection select(Long tenantId, Long optionId) {
        return write("select option %s for tenant %s".formatted(optionId, tenantId), () -> {
            validate(tenantId, optionId);
            return insert(tenantId, optionId);
        });
    }

    @Override
    public boolean deselect(Long tenantId, long optionId) {
        if (tenantId == null) {
            throw new NoTenantProvidedException("deselect");
        }
        int stamped = write("deselect option %d for tenant %d".formatted(optionId, tenantId),
                () -> stampDeleted(SelectionQuery.all().forTenant(tenantId).forOption(optionId)));
        log.debug("Deselected {} option {} for tenant {}: {} row(s)", model.label(), optionId, tenantId, stamped);
        return stamped > 0;
    }

    @Override
    public Set<Long> selectedOptionIds(long tenantId) {
        return new LinkedHashSet<>(context.jdbc()
                .sql("SELECT option_id FROM " + model.table()
                        + " WHERE tenant_id = :tenant AND deleted IS NULL ORDER BY option_id")
                .param("tenant", tenantId)
                .query(Long.class)
                .list());
    }

    /**
     * Replaces the tenant's OPTIONAL and CUSTOM selections with {@code optionIds} in one
     * transaction. MANDATORY options in the request are ignored; they never need a selection row.
     * <p>
     * A store integrity failure rolls the whole change back and is logged and reported in the
     * result rather than thrown. Validation failures still throw.
     */
    @Override
    public SelectionUpdate updateSelections(Long tenantId, Collection<Long> optionIds) {
        if (tenantId == null) {
            throw new NoTenantProvidedException("updateSelections");
        }
        Set<Long> requested = new LinkedHashSet<>(optionIds);
        try {
            return context.transactions().execute(status -> {
                Set<Long> current = selectedOptionIds(tenantId);
                Set<Long> wanted = withoutMandatory(requested);

                Set<Long> removed = new LinkedHashSet<>(current);
                removed.removeAll(wanted);
                if (!removed.isEmpty()) {
                    stampDeleted(SelectionQuery.all().forTenant(tenantId).forOptions(removed));
                }

                Set<Long> added = new LinkedHashSet<>(wanted);
                added.removeAll(current);
                for (Long optionId : added) {
                    validate(tenantId, optionId);
                    insert(tenantId, optionId);
                }
                log.debug("Updated {} for tenant {}: added {}, removed {}", model.label(), tenantId, added, removed);
                return SelectionUpdate.applied(added, removed);
            });
        } catch (DataIntegrityViolationException | OptionIntegrityException e) {
            String reason = e instanceof DataIntegrityViolationException dive
                    ? dive.getMostSpecificCause().getMessage()
                    : e.getMessage();
            log.warn("Problem creating or deleting {} selections for tenant {}: {}", model.label(), tenantId, reason);
            return SelectionUpdate.rolledBack(reason);
        }
    }

    @Override
    public Selection softDelete(Selection selection) {
        if (!selection.isActive()) {
            return selection;
        }
        return write("soft-delete selection %d".formatted(selection.id()), () -> {
            context.jdbc()
                    .sql("UPDATE " + model.table() + " SET deleted = :stamp WHERE id = :id AND deleted IS NULL")
                    .param("stamp", context.now())
                    .param("id", selection.id())
                    .update();
            return context.jdbc()
                    .sql("SELECT " + COLUMNS + " FROM " + model.table() + " WHERE id = :id")
                    .param("id", selection.id())
                    .query(SelectionRepository::mapRow)
                    .single();
        });
    }

    @Override
    public void delete(Selection selection, boolean override) {
        if (override) {
            write("delete selection %d".formatted(selection.id()), () -> context.jdbc()
                    .sql("DELETE FROM " + model.table() + " WHERE id = :id")
                    .param("id", selection.id())
                    .update());
        } else {
            softDelete(selection);
        }
    }

    @Override
    public int delete(SelectionQuery query, boolean override) {
        if (override) {
            SqlCriteria criteria = query.compile();
            return write("delete selections", () -> context.jdbc()
                    .sql("DELETE FROM " + model.table() + criteria.where())
                    .params(criteria.params())
                    .update());
        }
        return write("soft-delete selections", () -> stampDeleted(query));
    }

    @Override
    public int undelete(SelectionQuery query) {
        SqlCriteria criteria = query.compile();
        return write("undelete selections", () -> context.jdbc()
                .sql("UPDATE " + model.table() + " SET deleted = NULL" + criteria.whereAnd("deleted IS NOT NULL"))
                .params(criteria.params())
                .update());
    }

    @Override
    public String toString() {
        return "SelectionRepository[" + model.label() + "]";
    }

    // ── Private Helpers ──

    private void validate(Long tenantId, Long optionId) {
        Option option = optionId == null ? null : options.findById(optionId).orElse(null);
        SelectionValidator.validate(tenantId, optionId, option, context.policy(),
                        () -> options.count(OptionQuery.optionsForTenant(tenantId, false)))
                .orThrow("selection");
    }

    private Set<Long> withoutMandatory(Set<Long> requested) {
        if (requested.isEmpty()) {
            return requested;
        }
        Set<Long> mandatory = new LinkedHashSet<>();
        options.find(OptionQuery.all().ofTypes(OptionType.MANDATORY).withIds(requested))
                .forEach(o -> mandatory.add(o.id()));
        Set<Long> wanted = new LinkedHashSet<>(requested);
        wanted.removeAll(mandatory);
        return wanted;
    }

    private Selection insert(long tenantId, long optionId) {
        long id = context.insertReturningId(
                "INSERT INTO " + model.table() + " (tenant_id, option_id) VALUES (:tenantId, :optionId)",
                Map.of("tenantId", tenantId, "optionId", optionId));
        log.debug("Tenant {} selected {} option {}", tenantId, model.label(), optionId);
        return new Selection(id, tenantId, optionId, null);
    }

    private int stampDeleted(SelectionQuery query) {
        SqlCriteria criteria = query.compile();
        return context.jdbc()
                .sql("UPDATE " + model.table() + " SET deleted = :stamp" + criteria.whereAnd("deleted IS NULL"))
                .params(criteria.params())
                .param("stamp", context.now())
                .update();
    }

    private <T> T write(String action, Supplier<T> work) {
        try {
            return context.transactions().execute(status -> work.get());
        } catch (DataIntegrityViolationException e) {
            throw new OptionIntegrityException("Could not %s for %s: %s"
                    .formatted(action, model.label(), e.getMostSpecificCause().getMessage()), e);
        }
    }

    static Selection mapRow(ResultSet rs, int rowNum) throws SQLException {
        Timestamp deleted = rs.getTimestamp("deleted");
        return new Selection(rs.getLong("id"), rs.getLong("tenant_id"), rs.getLong("option_id"),
                deleted == null ? null : deleted.toInstant());
    }
}
