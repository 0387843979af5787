package org.example.questionnaire.simplify;

import java.util.List;

import org.example.questionnaire.Logger;
import org.example.questionnaire.model.Diagram;

/**
 * Runs the setup passes once, then applies the round passes in a fixed order,
 * round after round, until a whole round leaves the diagram unchanged. A diagram that is still changing after
 * {@code maxIterations} rounds is returned as is, with a warning.
 */
public class GraphSimplifier {

    public static final int DEFAULT_MAX_ITERATIONS = 25;

    public record Result(Diagram diagram, int rounds, boolean converged) {}

    private final List<SimplificationPass> setupPasses;
    private final List<SimplificationPass> passes;
    private final int maxIterations;

    public GraphSimplifier() {
        this(DEFAULT_MAX_ITERATIONS);
    }

    public GraphSimplifier(int maxIterations) {
        this(setupPasses(), defaultPasses(), maxIterations);
    }

    public GraphSimplifier(List<SimplificationPass> passes, int maxIterations) {
        this(List.of(), passes, maxIterations);
    }

    public GraphSimplifier(List<SimplificationPass> setupPasses, List<SimplificationPass> passes, int maxIterations) {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be at least 1, got " + maxIterations);
        }
        this.setupPasses = List.copyOf(setupPasses);
        this.passes = List.copyOf(passes);
        this.maxIterations = maxIterations;
    }

    /** Passes that read the diagram as drawn; they run once, before the first round. */
    public static List<SimplificationPass> setupPasses() {
        return List.of(new AnnotationClassificationPass());
    }

    public static List<SimplificationPass> defaultPasses() {
        return List.of(
            new TypeConsolidationPass(),
            new HelpHintFoldingPass(),
            new EdgeLogicPass(),
            new OptionFlatteningPass(),
            new GotoFoldingPass(),
            new DecisionPointEliminationPass(),
            new NoteMergingPass());
    }

    public Result simplify(Diagram diagram, SimplificationContext context) {
        Diagram current = diagram;
        for (SimplificationPass pass : setupPasses) {
            current = pass.apply(current, context);
        }
        for (int round = 1; round <= maxIterations; round++) {
            Diagram before = current;
            for (SimplificationPass pass : passes) {
                Diagram next = pass.apply(current, context);
                if (Logger.isDebugEnabled() && !next.equals(current)) {
                    Logger.debug("Round %d, %s: %s -> %s", round, pass.name(), current, next);
                }
                current = next;
            }
            if (current.equals(before)) {
                Logger.info("Simplification of page '%s' settled after %d round(s)", diagram.pageId(), round);
                return new Result(current, round, true);
            }
        }
        context.findings().warning(String.format("Simplification did not settle within %d rounds", maxIterations),
            diagram.pageId());
        return new Result(current, maxIterations, false);
    }
}
