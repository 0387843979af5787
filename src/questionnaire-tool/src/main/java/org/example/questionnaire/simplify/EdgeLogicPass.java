package org.example.questionnaire.simplify;

import org.example.questionnaire.logic.LogicExpr;
import org.example.questionnaire.model.Diagram;
import org.example.questionnaire.model.Edge;

/** Attaches the source-derived traversal condition to every edge that has none yet. */
public class EdgeLogicPass implements SimplificationPass {

    @Override
    public String name() {
        return "edge-logic";
    }

    @Override
    public Diagram apply(Diagram diagram, SimplificationContext context) {
        Diagram.Builder out = diagram.toBuilder();
        for (Edge e : diagram.edges()) {
            if (e.logic() != null) continue;
            LogicExpr logic = context.engine().edgeLogic(diagram, e, context.findings());
            if (logic != null) out.replaceEdge(e.withLogic(logic));
        }
        return out.build();
    }
}
