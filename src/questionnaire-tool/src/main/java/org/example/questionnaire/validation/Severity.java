package org.example.questionnaire.validation;

public enum Severity {
    /** Malformed source or missing document structure. Always fatal. */
    CRITICAL,
    /** Broken reference, missing required attribute, cycle. Fatal unless lenient. */
    ERROR,
    /** Style inconsistency, unreachable branch, iteration cap. Never fatal. */
    WARNING
}
