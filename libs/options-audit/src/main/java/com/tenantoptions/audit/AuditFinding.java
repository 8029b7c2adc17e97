package com.tenantoptions.audit;

import com.tenantoptions.model.ModelLabel;

/**
 * One observation of the auditor.
 *
 * @param severity how much it matters
 * @param model model it concerns, null for registry-wide findings
 * @param message human readable description
 */
public record AuditFinding(Severity severity, ModelLabel model, String message) {

    public static AuditFinding fatal(ModelLabel model, String message) {
        return new AuditFinding(Severity.FATAL, model, message);
    }

    public static AuditFinding warning(ModelLabel model, String message) {
        return new AuditFinding(Severity.WARNING, model, message);
    }

    public static AuditFinding note(ModelLabel model, String message) {
        return new AuditFinding(Severity.NOTE, model, message);
    }

    @Override
    public String toString() {
        return model == null ? message : model + ": " + message;
    }
}
