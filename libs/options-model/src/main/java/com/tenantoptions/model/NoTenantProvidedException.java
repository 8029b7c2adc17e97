package com.tenantoptions.model;

/** A tenant-scoped operation was invoked without tenant context. */
public class NoTenantProvidedException extends TenantOptionsException {

    public NoTenantProvidedException(String operation) {
        super("No tenant was provided to " + operation);
    }
}
