package org.example.questionnaire.simplify;

import java.util.List;

import org.example.questionnaire.logic.LogicExpr;
import org.example.questionnaire.model.Diagram;
import org.example.questionnaire.model.Edge;
import org.example.questionnaire.model.NodeType;

/**
 * Replaces each decision point by direct edges: for every incoming edge
 * {@code i} and outgoing edge {@code o} a new edge {@code i.source -> o.target}
 * with id {@code <i.id>_<o.id>} and the conjunction of both conditions.
 * Parallel edges between the same pair of nodes are kept apart, since their
 * conditions differ.
 */
public class DecisionPointEliminationPass implements SimplificationPass {

    @Override
    public String name() {
        return "decision-point-elimination";
    }

    @Override
    public Diagram apply(Diagram diagram, SimplificationContext context) {
        Diagram.Builder out = diagram.toBuilder();
        for (String id : diagram.nodes().keySet()) {
            if (diagram.node(id).type() != NodeType.DECISION_POINT) continue;
            // Chained decision points are eliminated in order, so read the current edges.
            List<Edge> in = out.incoming(id);
            List<Edge> outgoing = out.outgoing(id);
            for (Edge i : in) {
                if (i.sourceId().equals(id)) continue;
                for (Edge o : outgoing) {
                    if (o.targetId().equals(id)) continue;
                    out.addEdge(new Edge(i.id() + "_" + o.id(), i.sourceId(), o.targetId(), o.label(),
                        LogicExpr.conjoin(i.logic(), o.logic()), i.style()));
                }
            }
            out.removeNode(id);
        }
        return out.build();
    }
}
