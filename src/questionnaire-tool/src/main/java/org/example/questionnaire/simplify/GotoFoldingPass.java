package org.example.questionnaire.simplify;

import java.util.List;
import java.util.Optional;

import org.example.questionnaire.logic.LogicExpr;
import org.example.questionnaire.model.Diagram;
import org.example.questionnaire.model.Edge;
import org.example.questionnaire.model.Node;
import org.example.questionnaire.model.NodeType;

/**
 * Removes goto connectors. A goto passed through by exactly one edge in and
 * one edge out becomes a single edge carrying both conditions. A goto without
 * an outgoing edge jumps to the node carrying its {@code name}; its incoming
 * edges are pointed there directly.
 */
public class GotoFoldingPass implements SimplificationPass {

    @Override
    public String name() {
        return "goto-folding";
    }

    @Override
    public Diagram apply(Diagram diagram, SimplificationContext context) {
        Diagram.Builder out = diagram.toBuilder();
        for (Node g : diagram.nodesOfType(NodeType.GOTO)) {
            List<Edge> in = out.incoming(g.id());
            List<Edge> outgoing = out.outgoing(g.id());

            if (in.size() == 1 && outgoing.size() == 1) {
                Edge i = in.get(0);
                Edge o = outgoing.get(0);
                out.replaceEdge(i.withTarget(o.targetId()).withLogic(LogicExpr.conjoin(i.logic(), o.logic())));
                out.removeNode(g.id());
            } else if (outgoing.isEmpty() && g.name() != null) {
                Optional<Node> target = diagram.findByName(g.name(), g.id());
                if (target.isEmpty()) {
                    context.findings().warning(String.format("Goto target '%s' names no node", g.name()), g.id());
                    continue;
                }
                for (Edge e : in) {
                    out.replaceEdge(e.withTarget(target.get().id()));
                }
                out.removeNode(g.id());
            }
        }
        return out.build();
    }
}
