package org.example.questionnaire.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import org.example.questionnaire.Logger;

/**
 * Accumulates findings across all passes of one conversion and applies the
 * {@link ValidationPolicy} for the configured level. Check sites only report;
 * this class alone decides whether to abort.
 */
public class FindingCollector {

    private final ValidationLevel level;
    private final List<Finding> findings = new ArrayList<>();

    public FindingCollector(ValidationLevel level) {
        this.level = level;
    }

    public ValidationLevel getLevel() {
        return level;
    }

    /**
     * Records a finding, then aborts with a {@link DiagramValidationException}
     * if the policy says so. Identical findings are recorded once.
     */
    public void report(Severity severity, String message, String location) {
        report(new Finding(severity, message, location), null);
    }

    public void critical(String message, String location, Throwable cause) {
        report(new Finding(Severity.CRITICAL, message, location), cause);
    }

    public void error(String message, String location) {
        report(Severity.ERROR, message, location);
    }

    public void warning(String message, String location) {
        report(Severity.WARNING, message, location);
    }

    private void report(Finding finding, Throwable cause) {
        if (!findings.contains(finding)) {
            findings.add(finding);
        }
        Logger.debug("%s", finding);

        ValidationPolicy.Action action = ValidationPolicy.decide(level, finding.severity());
        if (action == ValidationPolicy.Action.LOG_AND_ABORT) {
            Logger.error("%s", finding);
        }
        if (action.aborts()) {
            throw cause == null
                ? new DiagramValidationException(finding, findings)
                : new DiagramValidationException(finding, findings, cause);
        }
    }

    public List<Finding> getFindings() {
        return Collections.unmodifiableList(findings);
    }

    public List<Finding> getFindings(Severity severity) {
        return findings.stream().filter(f -> f.severity() == severity).collect(Collectors.toList());
    }

    public boolean hasErrors() {
        return findings.stream().anyMatch(f -> f.severity() != Severity.WARNING);
    }
}
