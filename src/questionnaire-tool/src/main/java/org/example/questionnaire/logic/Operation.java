package org.example.questionnaire.logic;

import java.util.Arrays;

/** Comparison operations a {@link LogicExpr.Condition} may apply to its subject. */
public enum Operation {
    EQ("="),
    GT(">"),
    LT("<"),
    GE(">="),
    LE("<="),
    NE("!="),
    IN("in");

    private final String symbol;

    Operation(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public boolean isLowerBound() {
        return this == GT || this == GE;
    }

    public boolean isUpperBound() {
        return this == LT || this == LE;
    }

    public boolean isBound() {
        return isLowerBound() || isUpperBound();
    }

    /** Logical complement, or {@code null} for {@code in} which has no single-operation complement. */
    public Operation negate() {
        return switch (this) {
            case EQ -> NE;
            case NE -> EQ;
            case GT -> LE;
            case LE -> GT;
            case LT -> GE;
            case GE -> LT;
            case IN -> null;
        };
    }

    public static Operation fromSymbol(String symbol) {
        String s = "==".equals(symbol) ? "=" : symbol;
        return Arrays.stream(values())
            .filter(op -> op.symbol.equals(s))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown operation: " + symbol));
    }
}
