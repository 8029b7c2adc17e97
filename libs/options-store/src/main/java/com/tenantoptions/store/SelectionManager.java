package com.tenantoptions.store;

import com.tenantoptions.model.Option;
import com.tenantoptions.model.Selection;
import com.tenantoptions.model.SelectionModel;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Read and write operations on one selection model.
 */
public interface SelectionManager {

    SelectionModel model();

    /** The option manager of the option model this selection model references. */
    OptionManager options();

    List<Selection> find(SelectionQuery query);

    long count(SelectionQuery query);

    Selection select(Long tenantId, Long optionId);

    /** Soft-deletes the tenant's active selection of the option; false if there was none. */
    boolean deselect(Long tenantId, long optionId);

    Set<Long> selectedOptionIds(long tenantId);

    SelectionUpdate updateSelections(Long tenantId, Collection<Long> optionIds);

    Selection softDelete(Selection selection);

    void delete(Selection selection, boolean override);

    int delete(SelectionQuery query, boolean override);

    int undelete(SelectionQuery query);

    default List<Option> optionsForTenant(Long tenantId, boolean includeDeleted) {
        return options().optionsForTenant(tenantId, includeDeleted);
    }

    default List<Option> selectedOptionsForTenant(Long tenantId, boolean includeDeleted) {
        return options().selectedOptionsForTenant(tenantId, includeDeleted);
    }
}
