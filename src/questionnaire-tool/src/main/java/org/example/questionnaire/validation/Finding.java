package org.example.questionnaire.validation;

/**
 * One validation finding. {@code location} is the id of the node, edge or
 * group concerned, or {@code null} for diagram-wide findings.
 */
public record Finding(Severity severity, String message, String location) {

    @Override
    public String toString() {
        return location == null
            ? String.format("%s: %s", severity, message)
            : String.format("%s: %s (element %s)", severity, message, location);
    }
}
