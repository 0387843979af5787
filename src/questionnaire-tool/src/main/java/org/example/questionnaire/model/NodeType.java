package org.example.questionnaire.model;

/** Closed set of node types. {@link #wireName()} is the name used in JSON output. */
public enum NodeType {
    SELECT_ONE("select_one"),
    SELECT_MULTIPLE("select_multiple"),
    NUMERIC_INTEGER("numeric_integer"),
    NUMERIC_DECIMAL("numeric_decimal"),
    NUMERIC("numeric"),
    YES_NO("yes_no"),
    FLAG("flag"),
    CALCULATE("calculate"),
    DIAGNOSIS("diagnosis"),
    NOTE("note"),
    HELP("help"),
    HINT("hint"),
    TEXT("text"),
    DECISION_POINT("decision_point"),
    GOTO("goto"),
    SELECT_OPTION("select_option");

    private final String wireName;

    NodeType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /** Lists whose answer is chosen from option children. */
    public boolean isList() {
        return this == SELECT_ONE || this == SELECT_MULTIPLE;
    }

    public boolean isNumeric() {
        return this == NUMERIC || this == NUMERIC_INTEGER || this == NUMERIC_DECIMAL;
    }
}
