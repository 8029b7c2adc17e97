package com.tenantoptions.store;

import com.tenantoptions.model.DefaultOption;
import com.tenantoptions.model.InvalidDefaultOptionException;
import com.tenantoptions.model.NameConflictException;
import com.tenantoptions.model.NoTenantProvidedException;
import com.tenantoptions.model.Option;
import com.tenantoptions.model.OptionIntegrityException;
import com.tenantoptions.model.OptionModel;
import com.tenantoptions.model.OptionType;
import com.tenantoptions.model.OptionValidationException;
import com.tenantoptions.model.SelectionModel;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;

/**
 * JDBC-backed {@link OptionManager}.
 * <p>
 * Every write runs validation first and then a single transaction. Store constraint failures
 * arrive as {@link DataIntegrityViolationException} and leave as {@link OptionIntegrityException}.
 * <p>
 * Hard-deleting an option purges its selections first, in the same transaction.
 */
public class OptionRepository implements OptionManager {

    private static final Logger log = LoggerFactory.getLogger(OptionRepository.class);

    private static final String COLUMNS = "id, name, option_type, tenant_id, deleted";

    private final OptionModel model;
    private final SelectionModel selectionModel;
    private final StoreContext context;

    /**
     * @param model the option model
     * @param selectionModel the paired selection model, or null when none is configured
     * @param context shared store collaborators
     */
    public OptionRepository(OptionModel model, SelectionModel selectionModel, StoreContext context) {
        if (model == null || context == null) {
            throw new IllegalArgumentException("model and context must not be null");
        }
        this.model = model;
        this.selectionModel = selectionModel;
        this.context = context;
    }

    @Override
    public OptionModel model() {
        return model;
    }

    @Override
    public List<Option> find(OptionQuery query) {
        SqlCriteria criteria = query.compile();
        return context.jdbc()
                .sql("SELECT " + COLUMNS + " FROM " + model.table() + criteria.where() + " ORDER BY id")
                .params(criteria.params())
                .query(OptionRepository::mapRow)
                .list();
    }

    @Override
    public Optional<Option> findById(long id) {
        return find(OptionQuery.all().withIds(id)).stream().findFirst();
    }

    @Override
    public long count(OptionQuery query) {
        SqlCriteria criteria = query.compile();
        return context.jdbc()
                .sql("SELECT COUNT(*) FROM " + model.table() + criteria.where())
                .params(criteria.params())
                .query(Long.class)
                .single();
    }

    @Override
    public Option createMandatory(String name) {
        return createDefault(name, OptionType.MANDATORY);
    }

    @Override
    public Option createOptional(String name) {
        return createDefault(name, OptionType.OPTIONAL);
    }

    @Override
    public Option createForTenant(Long tenantId, String name) {
        if (tenantId == null) {
            throw new IllegalArgumentException("tenant must not be null when creating a custom option");
        }
        return write("create custom option '%s'".formatted(name), () -> {
            OptionValidator.validate(name, OptionType.CUSTOM, tenantId, defaultNames()).orThrow("option");
            return insert(name, OptionType.CUSTOM, tenantId);
        });
    }

    @Override
    public Option renameCustomOption(Option option, String name) {
        if (!option.isCustom()) {
            throw new OptionValidationException("option",
                    List.of("option_type: only custom options can be renamed, '%s' is %s"
                            .formatted(option.name(), option.optionType().label())));
        }
        return write("rename option %d".formatted(option.id()), () -> {
            OptionValidator.validate(name, OptionType.CUSTOM, option.tenantId(), defaultNames()).orThrow("option");
            context.jdbc()
                    .sql("UPDATE " + model.table() + " SET name = :name WHERE id = :id")
                    .param("name", name)
                    .param("id", option.id())
                    .update();
            log.debug("Renamed {} option {} from '{}' to '{}'", model.label(), option.id(), option.name(), name);
            return require(option.id());
        });
    }

    @Override
    public SyncReport syncDefaultOptions() {
        for (DefaultOption candidate : model.defaultOptions()) {
            if (!candidate.optionType().isDefaultType()) {
                throw new InvalidDefaultOptionException(model.label().toString(), candidate);
            }
        }
        SyncReport report = write("sync default options", this::applyDefaults);
        log.info("Synced default options of {}: {} created, {} restored, {} verified, {} deleted",
                model.label(),
                report.namesWith(SyncAction.CREATED).size(),
                report.namesWith(SyncAction.RESTORED).size(),
                report.namesWith(SyncAction.VERIFIED).size(),
                report.namesWith(SyncAction.DELETED).size());
        return report;
    }

    @Override
    public List<Option> optionsForTenant(Long tenantId, boolean includeDeleted) {
        if (tenantId == null) {
            throw new NoTenantProvidedException("optionsForTenant");
        }
        return find(OptionQuery.optionsForTenant(tenantId, includeDeleted));
    }

    @Override
    public List<Option> selectedOptionsForTenant(Long tenantId, boolean includeDeleted) {
        if (tenantId == null) {
            throw new NoTenantProvidedException("selectedOptionsForTenant");
        }
        log.debug("Resolving selected {} options for tenant {} (includeDeleted={})",
                model.label(), tenantId, includeDeleted);
        if (selectionModel == null) {
            log.warn("{} has no selection model; no selected options can be resolved", model.label());
            return List.of();
        }
        List<Long> selectedIds = context.jdbc()
                .sql("SELECT option_id FROM " + selectionModel.table()
                        + " WHERE tenant_id = :tenant AND deleted IS NULL")
                .param("tenant", tenantId)
                .query(Long.class)
                .list();
        return find(OptionQuery.selectedOptionsForTenant(tenantId, selectedIds, includeDeleted));
    }

    @Override
    public Option softDelete(Option option) {
        if (!option.isActive()) {
            return option;
        }
        return write("soft-delete option %d".formatted(option.id()), () -> {
            stampDeleted(option.id());
            return require(option.id());
        });
    }

    @Override
    public void delete(Option option, boolean override) {
        if (override) {
            write("delete option %d".formatted(option.id()), () -> purge(List.of(option.id())));
        } else {
            softDelete(option);
        }
    }

    @Override
    public int delete(OptionQuery query, boolean override) {
        SqlCriteria criteria = query.compile();
        if (override) {
            return write("delete options", () -> {
                List<Long> ids = context.jdbc()
                        .sql("SELECT id FROM " + model.table() + criteria.where())
                        .params(criteria.params())
                        .query(Long.class)
                        .list();
                return purge(ids);
            });
        }
        return write("soft-delete options", () -> context.jdbc()
                .sql("UPDATE " + model.table() + " SET deleted = :stamp" + criteria.whereAnd("deleted IS NULL"))
                .params(criteria.params())
                .param("stamp", context.now())
                .update());
    }

    @Override
    public int undelete(OptionQuery query) {
        SqlCriteria criteria = query.compile();
        int restored = write("undelete options", () -> context.jdbc()
                .sql("UPDATE " + model.table() + " SET deleted = NULL" + criteria.whereAnd("deleted IS NOT NULL"))
                .params(criteria.params())
                .update());
        log.debug("Undeleted {} {} options", restored, model.label());
        return restored;
    }

    @Override
    public List<String> duplicateDefaultNames() {
        return context.jdbc()
                .sql("""
                        SELECT lower(name) FROM %s
                        WHERE tenant_id IS NULL AND deleted IS NULL
                        GROUP BY lower(name)
                        HAVING COUNT(*) > 1
                        ORDER BY lower(name)
                        """.formatted(model.table()))
                .query(String.class)
                .list();
    }

    @Override
    public String toString() {
        return "OptionRepository[" + model.label() + "]";
    }

    // ── Private Helpers ──

    private Option createDefault(String name, OptionType type) {
        return write("create %s option '%s'".formatted(type.label(), name), () -> {
            OptionValidator.validate(name, type, null, List.of()).orThrow("option");
            if (count(OptionQuery.all().active().tenantless().namedIgnoreCase(name)) > 0) {
                throw new NameConflictException(model.label().toString(), name);
            }
            return insert(name, type, null);
        });
    }

    private SyncReport applyDefaults() {
        var actions = new LinkedHashMap<String, SyncAction>();
        var declared = new LinkedHashSet<String>();
        for (DefaultOption candidate : model.defaultOptions()) {
            declared.add(candidate.name());
            actions.put(candidate.name(), upsertDefault(candidate));
        }
        for (Option retired : find(OptionQuery.all().active().defaultOptions().excludingNames(declared))) {
            stampDeleted(retired.id());
            actions.put(retired.name(), SyncAction.DELETED);
            log.debug("Retired {} option '{}'", model.label(), retired.name());
        }
        return new SyncReport(model.label(), actions);
    }

    private SyncAction upsertDefault(DefaultOption candidate) {
        List<Option> matches = find(OptionQuery.all().tenantless()
                .ofTypes(candidate.optionType())
                .named(candidate.name()));
        Optional<Option> active = matches.stream().filter(Option::isActive).findFirst();
        if (active.isPresent()) {
            return SyncAction.VERIFIED;
        }
        Long keep = matches.stream().max(Comparator.comparingLong(Option::id)).map(Option::id).orElse(null);
        for (Option holder : find(OptionQuery.all().active().tenantless().namedIgnoreCase(candidate.name()))) {
            if (keep == null || holder.id() != keep) {
                stampDeleted(holder.id());
                log.debug("Retired {} option '{}' ({}) to make room for '{}'",
                        model.label(), holder.name(), holder.optionType(), candidate.name());
            }
        }
        if (keep != null) {
            context.jdbc()
                    .sql("UPDATE " + model.table() + " SET deleted = NULL WHERE id = :id")
                    .param("id", keep)
                    .update();
            return SyncAction.RESTORED;
        }
        insert(candidate.name(), candidate.optionType(), null);
        return SyncAction.CREATED;
    }

    private Option insert(String name, OptionType type, Long tenantId) {
        Map<String, Object> params = new HashMap<>();
        params.put("name", name);
        params.put("optionType", type.code());
        params.put("tenantId", tenantId);
        long id = context.insertReturningId(
                "INSERT INTO " + model.table() + " (name, option_type, tenant_id) VALUES (:name, :optionType, :tenantId)",
                params);
        log.debug("Created {} option {} '{}' ({})", model.label(), id, name, type.label());
        return new Option(id, name, type, tenantId, null);
    }

    private void stampDeleted(long id) {
        context.jdbc()
                .sql("UPDATE " + model.table() + " SET deleted = :stamp WHERE id = :id AND deleted IS NULL")
                .param("stamp", context.now())
                .param("id", id)
                .update();
    }

    private int purge(List<Long> ids) {
        if (ids.isEmpty()) {
            return 0;
        }
        if (selectionModel != null) {
            int selections = context.jdbc()
                    .sql("DELETE FROM " + selectionModel.table() + " WHERE option_id IN (:ids)")
                    .param("ids", ids)
                    .update();
            log.debug("Purged {} {} rows referencing {} options", selections, selectionModel.label(), ids.size());
        }
        int purged = context.jdbc()
                .sql("DELETE FROM " + model.table() + " WHERE id IN (:ids)")
                .param("ids", ids)
                .update();
        log.debug("Purged {} {} options", purged, model.label());
        return purged;
    }

    private List<String> defaultNames() {
        return context.jdbc()
                .sql("SELECT name FROM " + model.table() + " WHERE option_type IN ('dm', 'do')")
                .query(String.class)
                .list();
    }

    private Option require(long id) {
        return findById(id).orElseThrow(() -> new IllegalStateException(
                "%s option %d disappeared during the write".formatted(model.label(), id)));
    }

    private <T> T write(String action, Supplier<T> work) {
        try {
            return context.transactions().execute(status -> work.get());
        } catch (DataIntegrityViolationException e) {
            throw new OptionIntegrityException("Could not %s for %s: %s"
                    .formatted(action, model.label(), e.getMostSpecificCause().getMessage()), e);
        }
    }

    static Option mapRow(ResultSet rs, int rowNum) throws SQLException {
        long tenant = rs.getLong("tenant_id");
        Long tenantId = rs.wasNull() ? null : tenant;
        String code = rs.getString("option_type");
        OptionType type = OptionType.fromCode(code)
                .orElseThrow(() -> new IllegalStateException("Unknown option_type '%s'".formatted(code)));
        Timestamp deleted = rs.getTimestamp("deleted");
        return new Option(rs.getLong("id"), rs.getString("name"), type, tenantId,
                deleted == null ? null : deleted.toInstant());
    }
}
