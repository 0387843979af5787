package org.example.questionnaire.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.example.questionnaire.logic.LogicExpr;

/** A directed connection; {@code logic} is the traversal condition, {@code null} when unconditioned. */
public record Edge(
        String id,
        String sourceId,
        String targetId,
        String label,
        LogicExpr logic,
        Map<String, String> style) {

    public Edge {
        label = label == null ? "" : label;
        style = Collections.unmodifiableMap(new LinkedHashMap<>(style));
    }

    public static Edge of(String id, String sourceId, String targetId, String label) {
        return new Edge(id, sourceId, targetId, label, null, Map.of());
    }

    public Edge withSource(String newSource) {
        return new Edge(id, newSource, targetId, label, logic, style);
    }

    public Edge withTarget(String newTarget) {
        return new Edge(id, sourceId, newTarget, label, logic, style);
    }

    public Edge withLogic(LogicExpr newLogic) {
        return new Edge(id, sourceId, targetId, label, newLogic, style);
    }
}
