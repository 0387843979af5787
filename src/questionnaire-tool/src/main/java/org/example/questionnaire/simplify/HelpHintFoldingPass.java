package org.example.questionnaire.simplify;

import java.util.List;

import org.example.questionnaire.model.Diagram;
import org.example.questionnaire.model.Edge;
import org.example.questionnaire.model.Node;
import org.example.questionnaire.model.NodeType;

/** Moves help and hint texts onto the nodes they point at and removes the annotation nodes. */
public class HelpHintFoldingPass implements SimplificationPass {

    @Override
    public String name() {
        return "help-hint-folding";
    }

    @Override
    public Diagram apply(Diagram diagram, SimplificationContext context) {
        Diagram.Builder out = diagram.toBuilder();
        for (Node n : diagram.nodes().values()) {
            if (n.type() != NodeType.HELP && n.type() != NodeType.HINT) continue;
            String key = n.type() == NodeType.HELP ? Node.HELP_TEXT : Node.HINT_TEXT;
            List<Edge> targets = out.outgoing(n.id());
            if (targets.isEmpty()) {
                context.findings().warning(String.format("%s text points at no node and is dropped", n.type().wireName()), n.id());
            }
            for (Edge e : targets) {
                out.updateNode(e.targetId(), t -> t.withMetadata(key, append(t.metadataString(key), n.label())));
            }
            out.removeNode(n.id());
        }
        return out.build();
    }

    private static String append(String existing, String text) {
        return existing == null || existing.isEmpty() ? text : existing + "\n\n" + text;
    }
}
