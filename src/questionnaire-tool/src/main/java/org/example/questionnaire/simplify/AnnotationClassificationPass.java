package org.example.questionnaire.simplify;

import java.util.List;

import org.example.questionnaire.model.Diagram;
import org.example.questionnaire.model.Edge;
import org.example.questionnaire.model.Node;
import org.example.questionnaire.model.NodeType;
import org.example.questionnaire.style.ColorRange;

/**
 * Marks annotation notes on the diagram as drawn: a note nobody points at that
 * points somewhere is a help text when filled green and a hint when filled
 * grey. Runs once, before the simplification rounds, so a note whose only
 * predecessor was an annotation stays a note after the annotation is folded.
 */
public class AnnotationClassificationPass implements SimplificationPass {

    @Override
    public String name() {
        return "annotation-classification";
    }

    @Override
    public Diagram apply(Diagram diagram, SimplificationContext context) {
        Diagram.Builder out = diagram.toBuilder();
        for (Node n : diagram.nodes().values()) {
            NodeType type = annotationType(diagram, n);
            if (type != null) out.putNode(n.withType(type));
        }
        return out.build();
    }

    private static NodeType annotationType(Diagram diagram, Node n) {
        if (n.type() != NodeType.NOTE) return null;
        List<Edge> outgoing = diagram.outgoing(n.id());
        if (outgoing.isEmpty() || !diagram.incoming(n.id()).isEmpty()) return null;
        // Yes/No branches make the note a question.
        if (TypeConsolidationPass.branchesOnYesNo(outgoing)) return null;
        String fill = n.metadataString(Node.FILL_COLOR);
        if (ColorRange.GREEN.matches(fill)) return NodeType.HELP;
        if (ColorRange.GREY.matches(fill)) return NodeType.HINT;
        return null;
    }
}
