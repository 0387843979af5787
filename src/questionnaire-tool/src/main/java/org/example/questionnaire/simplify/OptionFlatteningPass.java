package org.example.questionnaire.simplify;

import java.util.ArrayList;
import java.util.List;

import org.example.questionnaire.logic.LogicExpr;
import org.example.questionnaire.model.Diagram;
import org.example.questionnaire.model.Edge;
import org.example.questionnaire.model.Node;

/**
 * Removes option nodes. An edge leaving an option now leaves the list itself
 * and carries the condition that the option was chosen, conjoined with
 * whatever condition it already had. The option labels stay on the list as
 * {@link Node#CHOICES}.
 */
public class OptionFlatteningPass implements SimplificationPass {

    @Override
    public String name() {
        return "option-flattening";
    }

    @Override
    public Diagram apply(Diagram diagram, SimplificationContext context) {
        Diagram.Builder out = diagram.toBuilder();
        for (Node list : diagram.nodes().values()) {
            if (list.options().isEmpty()) continue;

            List<String> choices = new ArrayList<>();
            for (String optionId : list.options()) {
                Node option = diagram.node(optionId);
                if (option == null) continue;
                choices.add(option.label());

                LogicExpr chosen = context.engine().optionCondition(list, option);
                for (Edge e : diagram.outgoing(optionId)) {
                    out.replaceEdge(e.withSource(list.id()).withLogic(LogicExpr.conjoin(chosen, e.logic())));
                }
                for (Edge e : diagram.incoming(optionId)) {
                    context.findings().warning("Edge into an answer option is dropped", e.id());
                }
                out.removeNode(optionId);
            }
            out.updateNode(list.id(), n -> n.withOptions(List.of()).withMetadata(Node.CHOICES, List.copyOf(choices)));
        }
        return out.build();
    }
}
