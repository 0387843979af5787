package org.example.questionnaire.simplify;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

import org.example.questionnaire.model.Diagram;
import org.example.questionnaire.model.Edge;
import org.example.questionnaire.model.Node;
import org.example.questionnaire.model.NodeType;

/**
 * Collapses drawing variants into the canonical types:
 * <ul>
 *   <li>calculate and diagnosis become flag, with {@code is_diagnosis}</li>
 *   <li>a select_one offering exactly Yes and No becomes yes_no</li>
 *   <li>a note whose outgoing edges are all labelled Yes or No becomes yes_no</li>
 *   <li>numeric_integer and numeric_decimal become numeric, with {@code subtype}</li>
 * </ul>
 * Help and hint notes are recognised once, up front, by {@link AnnotationClassificationPass}.
 */
public class TypeConsolidationPass implements SimplificationPass {

    private static final Set<String> YES_NO = Set.of("yes", "no");

    @Override
    public String name() {
        return "type-consolidation";
    }

    @Override
    public Diagram apply(Diagram diagram, SimplificationContext context) {
        Diagram.Builder out = diagram.toBuilder();
        for (Node n : diagram.nodes().values()) {
            Node changed = consolidate(diagram, n);
            if (changed != n) out.putNode(changed);
        }
        return out.build();
    }

    private Node consolidate(Diagram diagram, Node n) {
        switch (n.type()) {
            case CALCULATE:
                return n.withType(NodeType.FLAG).withMetadata(Node.IS_DIAGNOSIS, Boolean.FALSE);
            case DIAGNOSIS:
                return n.withType(NodeType.FLAG).withMetadata(Node.IS_DIAGNOSIS, Boolean.TRUE);
            case NUMERIC_INTEGER:
                return n.withType(NodeType.NUMERIC).withMetadata(Node.SUBTYPE, "integer");
            case NUMERIC_DECIMAL:
                return n.withType(NodeType.NUMERIC).withMetadata(Node.SUBTYPE, "decimal");
            case SELECT_ONE:
                return offersOnlyYesNo(diagram, n) ? n.withType(NodeType.YES_NO) : n;
            case NOTE:
                return branchesOnYesNo(diagram.outgoing(n.id())) ? n.withType(NodeType.YES_NO) : n;
            default:
                return n;
        }
    }

    private static boolean offersOnlyYesNo(Diagram diagram, Node list) {
        if (list.options().size() != 2) return false;
        Set<String> labels = list.options().stream()
            .map(diagram::node)
            .map(o -> o == null ? "" : o.label().trim().toLowerCase(Locale.ROOT))
            .collect(Collectors.toSet());
        return labels.equals(YES_NO);
    }

    static boolean branchesOnYesNo(List<Edge> outgoing) {
        return !outgoing.isEmpty()
            && outgoing.stream().allMatch(e -> YES_NO.contains(e.label().trim().toLowerCase(Locale.ROOT)));
    }
}
