package org.example.questionnaire;

import java.util.List;
import java.util.Map;

import org.example.questionnaire.build.DiagramBuilder;
import org.example.questionnaire.logic.LogicEngine;
import org.example.questionnaire.logic.LogicExpr;
import org.example.questionnaire.model.CellRecord;
import org.example.questionnaire.model.Diagram;
import org.example.questionnaire.simplify.GraphSimplifier;
import org.example.questionnaire.simplify.SimplificationContext;
import org.example.questionnaire.validation.DiagramValidationException;
import org.example.questionnaire.validation.DiagramValidator;
import org.example.questionnaire.validation.FindingCollector;

/**
 * Converts the cells of one page into a simplified logic graph:
 *
 *   build -> structural checks -> simplify -> final checks -> node logic
 *
 * Instances hold no per-conversion state and may convert pages concurrently.
 */
public class QuestionnairePipeline {

    private final PipelineConfig config;
    private final LogicEngine engine;
    private final DiagramValidator validator;
    private final GraphSimplifier simplifier;

    public QuestionnairePipeline(PipelineConfig config) {
        this.config = config;
        this.engine = new LogicEngine(config.externals());
        this.validator = new DiagramValidator(config.externals());
        this.simplifier = new GraphSimplifier(config.maxIterations());
    }

    public PipelineConfig getConfig() {
        return config;
    }

    /**
     * @throws DiagramValidationException when a finding aborts under the configured level
     */
    public ConversionResult convert(String pageId, List<CellRecord> cells) {
        return convert(pageId, cells, new FindingCollector(config.level()));
    }

    /** As {@link #convert(String, List)}, adding to findings already collected, e.g. by the reader. */
    public ConversionResult convert(String pageId, List<CellRecord> cells, FindingCollector findings) {
        Logger.info("Converting page '%s' (level %s)", pageId, config.level());

        Diagram built = DiagramBuilder.build(pageId, cells, findings);
        validator.validateStructure(built, findings);

        GraphSimplifier.Result simplified = simplifier.simplify(built, new SimplificationContext(engine, findings));
        Diagram diagram = simplified.diagram();
        validator.validateFinal(diagram, config.entryNodeId(), findings);

        Map<String, LogicExpr> nodeLogic = engine.deriveNodeLogic(diagram, findings);
        Logger.info("Page '%s': %d node(s), %d edge(s), %d finding(s)",
            pageId, diagram.nodes().size(), diagram.edges().size(), findings.getFindings().size());
        return new ConversionResult(built, diagram, nodeLogic, findings.getFindings(), simplified.converged());
    }
}
