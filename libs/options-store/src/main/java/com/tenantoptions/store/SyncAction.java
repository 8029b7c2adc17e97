package com.tenantoptions.store;

/** What sync did to one default option. */
public enum SyncAction {
    CREATED,
    VERIFIED,
    RESTORED,
    DELETED
}
