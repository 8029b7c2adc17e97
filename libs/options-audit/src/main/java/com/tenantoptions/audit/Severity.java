package com.tenantoptions.audit;

/** How much an audit finding matters. */
public enum Severity {

    /** The model cannot work as configured; the audit fails. */
    FATAL,

    /** The model works but something looks wrong. */
    WARNING,

    /** Progress detail, printed for orientation only. */
    NOTE
}
