package org.example.questionnaire.logic;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Condition tree attached to edges (traversal condition) and nodes (display
 * condition). Trees are immutable values.
 *
 * <p>The constants are encoded without a third variant: {@link #TRUE} is the
 * empty conjunction and {@link #FALSE} the empty disjunction.
 */
public sealed interface LogicExpr permits LogicExpr.Condition, LogicExpr.Operator {

    /** Subject of conditions on automatically raised flags. */
    String FLAGS = "flags";

    Operator TRUE = new Operator(Connective.AND, List.of());
    Operator FALSE = new Operator(Connective.OR, List.of());

    default boolean isTrue() {
        return TRUE.equals(this);
    }

    default boolean isFalse() {
        return FALSE.equals(this);
    }

    /**
     * {@code subject operation value}. The subject is a node id, an external
     * reference name or {@link #FLAGS}.
     */
    record Condition(String subject, Operation operation, Object value) implements LogicExpr {
        public Condition {
            Objects.requireNonNull(subject, "subject");
            Objects.requireNonNull(operation, "operation");
            value = normalizeValue(value);
        }

        public boolean isNumeric() {
            return value instanceof BigDecimal;
        }

        public BigDecimal number() {
            return (BigDecimal) value;
        }

        @Override
        public String toString() {
            String v = value instanceof String s ? "\"" + s + "\"" : String.valueOf(value);
            if (value instanceof BigDecimal d) v = d.toPlainString();
            return subject + " " + operation.symbol() + " " + v;
        }
    }

    record Operator(Connective operation, List<LogicExpr> children) implements LogicExpr {
        public Operator {
            Objects.requireNonNull(operation, "operation");
            children = List.copyOf(children);
            if (operation == Connective.NOT && children.size() != 1) {
                throw new IllegalArgumentException("NOT takes exactly one child, got " + children.size());
            }
        }

        @Override
        public String toString() {
            if (operation == Connective.AND && children.isEmpty()) return "true";
            if (operation == Connective.OR && children.isEmpty()) return "false";
            if (operation == Connective.NOT) return "NOT(" + children.get(0) + ")";
            StringBuilder sb = new StringBuilder(operation.name()).append('(');
            for (int i = 0; i < children.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(children.get(i));
            }
            return sb.append(')').toString();
        }
    }

    static Condition condition(String subject, Operation operation, Object value) {
        return new Condition(subject, operation, value);
    }

    static Operator and(LogicExpr... children) {
        return new Operator(Connective.AND, Arrays.asList(children));
    }

    static Operator or(LogicExpr... children) {
        return new Operator(Connective.OR, Arrays.asList(children));
    }

    static Operator not(LogicExpr child) {
        return new Operator(Connective.NOT, List.of(child));
    }

    /**
     * Conjunction of the present operands: {@code null} when all are absent,
     * the operand itself when only one is present.
     */
    static LogicExpr conjoin(LogicExpr... operands) {
        List<LogicExpr> present = new ArrayList<>();
        for (LogicExpr e : operands) {
            if (e != null) present.add(e);
        }
        if (present.isEmpty()) return null;
        if (present.size() == 1) return present.get(0);
        return new Operator(Connective.AND, present);
    }

    /**
     * Numbers become {@link BigDecimal}s without trailing zeros, so {@code 5},
     * {@code 5.0} and {@code "5.00"} parsed as decimals compare equal.
     */
    static Object normalizeValue(Object value) {
        if (value instanceof BigDecimal d) return normalize(d);
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return normalize(BigDecimal.valueOf(((Number) value).longValue()));
        }
        if (value instanceof Number n) return normalize(new BigDecimal(n.toString()));
        return value;
    }

    private static BigDecimal normalize(BigDecimal d) {
        BigDecimal n = d.stripTrailingZeros();
        return n.scale() < 0 ? n.setScale(0) : n;
    }
}
