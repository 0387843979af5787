package org.example.questionnaire;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.example.questionnaire.logic.LogicExpr;
import org.example.questionnaire.model.Diagram;
import org.example.questionnaire.validation.Finding;
import org.example.questionnaire.validation.Severity;

/**
 * Outcome of converting one page.
 *
 * @param built     the diagram as drawn, before simplification
 * @param diagram   the simplified logic graph
 * @param nodeLogic display condition per node id of {@code diagram}
 * @param findings  everything reported, in order
 * @param converged whether simplification settled within its round limit
 */
public record ConversionResult(
        Diagram built,
        Diagram diagram,
        Map<String, LogicExpr> nodeLogic,
        List<Finding> findings,
        boolean converged) {

    public ConversionResult {
        nodeLogic = Collections.unmodifiableMap(new LinkedHashMap<>(nodeLogic));
        findings = List.copyOf(findings);
    }

    public String pageId() {
        return diagram.pageId();
    }

    public boolean hasErrors() {
        return findings.stream().anyMatch(f -> f.severity() != Severity.WARNING);
    }
}
