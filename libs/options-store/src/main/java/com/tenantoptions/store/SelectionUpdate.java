package com.tenantoptions.store;

import java.util.Set;

/**
 * Result of replacing a tenant's selections in one step.
 *
 * @param added option ids newly selected
 * @param removed option ids deselected
 * @param applied false if the store rejected the change and it was rolled back
 * @param failure the store's message when not applied, null otherwise
 */
public record SelectionUpdate(Set<Long> added, Set<Long> removed, boolean applied, String failure) {

    public SelectionUpdate {
        added = Set.copyOf(added);
        removed = Set.copyOf(removed);
    }

    public static SelectionUpdate applied(Set<Long> added, Set<Long> removed) {
        return new SelectionUpdate(added, removed, true, null);
    }

    public static SelectionUpdate rolledBack(String failure) {
        return new SelectionUpdate(Set.of(), Set.of(), false, failure);
    }

    public boolean changed() {
        return applied && !(added.isEmpty() && removed.isEmpty());
    }
}
