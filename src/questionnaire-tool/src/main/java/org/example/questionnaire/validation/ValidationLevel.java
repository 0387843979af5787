package org.example.questionnaire.validation;

/** How strictly findings are acted upon; see {@link ValidationPolicy}. */
public enum ValidationLevel {
    STRICT, NORMAL, LENIENT
}
