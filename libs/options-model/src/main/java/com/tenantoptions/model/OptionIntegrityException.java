package com.tenantoptions.model;

/**
 * The relational store rejected a write: a unique index, check constraint or consistency trigger
 * fired. Not retried automatically.
 */
public class OptionIntegrityException extends TenantOptionsException {

    public OptionIntegrityException(String message) {
        super(message);
    }

    public OptionIntegrityException(String message, Throwable cause) {
        super(message, cause);
    }
}
