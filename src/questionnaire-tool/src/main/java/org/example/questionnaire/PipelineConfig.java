package org.example.questionnaire;

import org.example.questionnaire.logic.ExternalReferences;
import org.example.questionnaire.simplify.GraphSimplifier;
import org.example.questionnaire.validation.ValidationLevel;

/**
 * Settings of one conversion.
 *
 * @param level         how strictly findings abort the conversion
 * @param entryNodeId   node the questionnaire starts at, {@code null} to infer it
 * @param maxIterations cap on simplification rounds
 * @param externals     names decision points may reference without a node
 */
public record PipelineConfig(
        ValidationLevel level,
        String entryNodeId,
        int maxIterations,
        ExternalReferences externals) {

    public PipelineConfig {
        level = level == null ? ValidationLevel.NORMAL : level;
        externals = externals == null ? ExternalReferences.empty() : externals;
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be at least 1, got " + maxIterations);
        }
    }

    public static PipelineConfig defaults() {
        return new PipelineConfig(ValidationLevel.NORMAL, null, GraphSimplifier.DEFAULT_MAX_ITERATIONS,
            ExternalReferences.empty());
    }

    public PipelineConfig withLevel(ValidationLevel newLevel) {
        return new PipelineConfig(newLevel, entryNodeId, maxIterations, externals);
    }

    public PipelineConfig withEntryNode(String newEntryNodeId) {
        return new PipelineConfig(level, newEntryNodeId, maxIterations, externals);
    }
}
