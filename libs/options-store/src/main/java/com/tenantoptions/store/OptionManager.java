package com.tenantoptions.store;

import com.tenantoptions.model.Option;
import com.tenantoptions.model.OptionModel;
import java.util.List;
import java.util.Optional;

/**
 * Read and write operations on one option model.
 */
public interface OptionManager {

    OptionModel model();

    List<Option> find(OptionQuery query);

    Optional<Option> findById(long id);

    long count(OptionQuery query);

    /** Creates a tenant-less MANDATORY option. */
    Option createMandatory(String name);

    /** Creates a tenant-less OPTIONAL option. */
    Option createOptional(String name);

    /** Creates a CUSTOM option owned by the tenant. */
    Option createForTenant(Long tenantId, String name);

    Option renameCustomOption(Option option, String name);

    /** Brings the stored MANDATORY and OPTIONAL options in line with the model's defaults. */
    SyncReport syncDefaultOptions();

    List<Option> optionsForTenant(Long tenantId, boolean includeDeleted);

    default List<Option> optionsForTenant(Long tenantId) {
        return optionsForTenant(tenantId, false);
    }

    List<Option> selectedOptionsForTenant(Long tenantId, boolean includeDeleted);

    default List<Option> selectedOptionsForTenant(Long tenantId) {
        return selectedOptionsForTenant(tenantId, false);
    }

    Option softDelete(Option option);

    /** Soft-deletes the option, or purges it when {@code override} is true. */
    void delete(Option option, boolean override);

    int delete(OptionQuery query, boolean override);

    int undelete(OptionQuery query);

    /** Lower-cased names held by more than one active tenant-less option. */
    List<String> duplicateDefaultNames();
}
