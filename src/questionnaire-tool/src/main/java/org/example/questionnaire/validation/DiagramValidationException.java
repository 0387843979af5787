package org.example.questionnaire.validation;

import java.util.List;

/** Raised when the validation policy turns a finding into an abort. */
public class DiagramValidationException extends RuntimeException {

    private final Finding finding;
    private final List<Finding> findings;

    public DiagramValidationException(Finding finding, List<Finding> findings) {
        super(finding.toString());
        this.finding = finding;
        this.findings = List.copyOf(findings);
    }

    public DiagramValidationException(Finding finding, List<Finding> findings, Throwable cause) {
        super(finding.toString(), cause);
        this.finding = finding;
        this.findings = List.copyOf(findings);
    }

    /** The finding that triggered the abort. */
    public Finding getFinding() {
        return finding;
    }

    /** Every finding recorded up to and including the triggering one. */
    public List<Finding> getFindings() {
        return findings;
    }
}
