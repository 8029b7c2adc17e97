package com.tenantoptions.model;

import java.time.Instant;

/**
 * A stored choice value.
 *
 * @param id primary key
 * @param name display name, unique per tenant scope (case-insensitive) among active rows
 * @param optionType MANDATORY, OPTIONAL or CUSTOM
 * @param tenantId owning tenant for CUSTOM options, null otherwise
 * @param deleted soft-delete timestamp, null while active
 */
public record Option(long id, String name, OptionType optionType, Long tenantId, Instant deleted) {

    public boolean isActive() {
        return deleted == null;
    }

    public boolean isCustom() {
        return optionType == OptionType.CUSTOM;
    }

    public LifecycleState state() {
        return LifecycleState.of(deleted);
    }

    /** Whether a tenant may see this option: defaults are global, custom options are owned. */
    public boolean isAvailableTo(long tenant) {
        return tenantId == null || tenantId == tenant;
    }

    @Override
    public String toString() {
        return name;
    }
}
