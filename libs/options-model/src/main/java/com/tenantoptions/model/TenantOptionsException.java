package com.tenantoptions.model;

/** Root of the tenant-options exception hierarchy. */
public class TenantOptionsException extends RuntimeException {

    public TenantOptionsException(String message) {
        super(message);
    }

    public TenantOptionsException(String message, Throwable cause) {
        super(message, cause);
    }
}
