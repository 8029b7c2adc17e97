package com.tenantoptions.cli.command;

import com.tenantoptions.audit.AuditFinding;
import com.tenantoptions.audit.AuditReport;
import com.tenantoptions.audit.ConfigurationAuditor;
import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;
import org.springframework.beans.factory.config.ConfigurableBeanFactory;
import org.springframework.context.annotation.Scope;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Audits the model configuration and prints errors and warnings. Exits with status 1 when any
 * error is found so the command can gate a CI pipeline.
 */
@Component
@Scope(ConfigurableBeanFactory.SCOPE_PROTOTYPE)
@Command(
        name = "validate-options",
        mixinStandardHelpOptions = true,
        description = "Validate that all option and selection models are properly configured")
public class ValidateOptionsCommand implements Callable<Integer> {

    private static final String RULE = "=".repeat(70);

    @Spec
    CommandSpec spec;

    private final ConfigurationAuditor auditor;

    public ValidateOptionsCommand(ConfigurationAuditor auditor) {
        this.auditor = auditor;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        out.println(RULE);
        out.println("  Tenant Options Configuration Validation");
        out.println(RULE);

        AuditReport report = auditor.audit();
        report.notes().forEach(note -> out.println("  " + note));

        out.println(RULE);
        printNumbered(out, "ERRORS FOUND:", report.errors());
        printNumbered(out, "WARNINGS:", report.warnings());
        if (report.isClean()) {
            out.println();
            out.println("All validations passed!");
            out.println("Your tenant-options configuration is properly set up.");
        }
        out.println(RULE);
        return report.exitCode();
    }

    private static void printNumbered(PrintWriter out, String heading, List<AuditFinding> findings) {
        if (findings.isEmpty()) {
            return;
        }
        out.println();
        out.println(heading);
        for (int i = 0; i < findings.size(); i++) {
            out.printf("%d. %s%n", i + 1, findings.get(i));
        }
    }
}
