package com.tenantoptions.audit;

import java.util.List;

/**
 * Everything one audit run found, in discovery order.
 *
 * @param findings all findings, notes included
 */
public record AuditReport(List<AuditFinding> findings) {

    public AuditReport {
        findings = List.copyOf(findings);
    }

    public List<AuditFinding> errors() {
        return ofSeverity(Severity.FATAL);
    }

    public List<AuditFinding> warnings() {
        return ofSeverity(Severity.WARNING);
    }

    public List<AuditFinding> notes() {
        return ofSeverity(Severity.NOTE);
    }

    public boolean hasErrors() {
        return !errors().isEmpty();
    }

    /** True when there is neither an error nor a warning. */
    public boolean isClean() {
        return errors().isEmpty() && warnings().isEmpty();
    }

    /** Process exit code for command line use: 1 when any error was found. */
    public int exitCode() {
        return hasErrors() ? 1 : 0;
    }

    private List<AuditFinding> ofSeverity(Severity severity) {
        return findings.stream().filter(f -> f.severity() == severity).toList();
    }
}
