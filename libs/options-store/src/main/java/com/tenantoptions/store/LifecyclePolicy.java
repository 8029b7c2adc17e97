package com.tenantoptions.store;

/**
 * Switches for lifecycle rules that deployments disagree on.
 *
 * @param allowDeletedOptionSelection whether a tenant may select a soft-deleted option
 */
public record LifecyclePolicy(boolean allowDeletedOptionSelection) {

    public static LifecyclePolicy defaults() {
        return new LifecyclePolicy(false);
    }
}
