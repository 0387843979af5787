package org.example.questionnaire.simplify;

import org.example.questionnaire.model.Diagram;

/**
 * One rewrite of the graph. A pass returns a new diagram and leaves its input
 * untouched; applied to its own output it changes nothing further. Every pass
 * keeps all edge endpoints resolvable.
 */
public interface SimplificationPass {

    String name();

    Diagram apply(Diagram diagram, SimplificationContext context);
}
