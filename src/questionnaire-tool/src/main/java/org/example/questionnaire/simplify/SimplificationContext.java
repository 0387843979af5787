package org.example.questionnaire.simplify;

import org.example.questionnaire.logic.LogicEngine;
import org.example.questionnaire.validation.FindingCollector;

/** What passes need besides the diagram: condition building and finding reporting. */
public record SimplificationContext(LogicEngine engine, FindingCollector findings) {
}
