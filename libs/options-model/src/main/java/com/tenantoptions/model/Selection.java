package com.tenantoptions.model;

import java.time.Instant;

/**
 * A tenant's recorded choice of an option. Deselecting soft-deletes the row; selecting again
 * creates a new row, so the history of a tenant's choices is kept.
 *
 * @param id primary key
 * @param tenantId the selecting tenant
 * @param optionId the selected option
 * @param deleted soft-delete timestamp, null while active
 */
public record Selection(long id, long tenantId, long optionId, Instant deleted) {

    public boolean isActive() {
        return deleted == null;
    }

    public LifecycleState state() {
        return LifecycleState.of(deleted);
    }
}
