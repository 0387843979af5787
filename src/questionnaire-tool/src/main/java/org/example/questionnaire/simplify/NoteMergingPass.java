package org.example.questionnaire.simplify;

import java.util.List;

import org.example.questionnaire.model.Diagram;
import org.example.questionnaire.model.Edge;
import org.example.questionnaire.model.Node;
import org.example.questionnaire.model.NodeType;

/**
 * Merges a note into the note before it when the two are joined by a single
 * unconditioned edge and neither branches there. Labels are joined by a blank
 * line; the second note's outgoing edges leave the first.
 */
public class NoteMergingPass implements SimplificationPass {

    @Override
    public String name() {
        return "note-merging";
    }

    @Override
    public Diagram apply(Diagram diagram, SimplificationContext context) {
        Diagram.Builder out = diagram.toBuilder();
        boolean merged = true;
        while (merged) {
            merged = false;
            for (Node first : List.copyOf(out.nodes())) {
                Edge link = mergeableLink(out, first);
                if (link == null) continue;
                Node second = out.node(link.targetId());
                out.updateNode(first.id(), n -> n.withLabel(n.label() + "\n\n" + second.label()));
                for (Edge e : out.outgoing(second.id())) {
                    out.replaceEdge(e.withSource(first.id()));
                }
                out.removeNode(second.id());
                merged = true;
                break;
            }
        }
        return out.build();
    }

    private static Edge mergeableLink(Diagram.Builder diagram, Node first) {
        if (first.type() != NodeType.NOTE) return null;
        List<Edge> outgoing = diagram.outgoing(first.id());
        if (outgoing.size() != 1) return null;
        Edge link = outgoing.get(0);
        if (link.logic() != null || link.targetId().equals(first.id())) return null;
        Node second = diagram.node(link.targetId());
        if (second == null || second.type() != NodeType.NOTE) return null;
        return diagram.incoming(second.id()).size() == 1 ? link : null;
    }
}
