package com.tenantoptions.model;

import java.time.Instant;

/**
 * Lifecycle of an option or selection row.
 *
 * <pre>
 *   create -> ACTIVE --soft delete--> SOFT_DELETED --undelete--> ACTIVE
 *                \                         |
 *                 +------hard delete-------+--------> PURGED
 * </pre>
 */
public enum LifecycleState {
    ACTIVE,
    SOFT_DELETED,
    PURGED;

    /** Derives the state of a stored row from its {@code deleted} column. */
    public static LifecycleState of(Instant deleted) {
        return deleted == null ? ACTIVE : SOFT_DELETED;
    }
}
