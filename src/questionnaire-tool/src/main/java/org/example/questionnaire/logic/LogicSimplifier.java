package org.example.questionnaire.logic;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

import org.example.questionnaire.Logger;
import org.example.questionnaire.logic.LogicExpr.Condition;
import org.example.questionnaire.logic.LogicExpr.Operator;
import org.example.questionnaire.validation.FindingCollector;

/**
 * Rewrites a condition tree bottom-up until nothing changes:
 *
 * <ul>
 *   <li>nested AND/AND and OR/OR are flattened</li>
 *   <li>AND with a false child is false, OR with a true child is true,
 *       identity constants are dropped, single-child AND/OR collapse</li>
 *   <li>NOT(NOT x) is x, NOT of a constant is the other constant, NOT of a
 *       negatable comparison is the complementary comparison</li>
 *   <li>duplicate children are removed (idempotence)</li>
 *   <li>AND(x, OR(x, y)) is x and OR(x, AND(x, y)) is x (absorption)</li>
 *   <li>numeric bounds on one subject fold: the tighter bounds under AND
 *       (emitted as an ordered lower/upper range, false when empty), the
 *       looser bounds under OR</li>
 * </ul>
 *
 * {@code in} conditions are only ever de-duplicated. A simplified tree is a
 * fixed point: simplifying it again returns an equal tree.
 */
public class LogicSimplifier {

    private static final int DEFAULT_MAX_ROUNDS = 64;

    private final int maxRounds;

    public LogicSimplifier() {
        this(DEFAULT_MAX_ROUNDS);
    }

    public LogicSimplifier(int maxRounds) {
        this.maxRounds = maxRounds;
    }

    public LogicExpr simplify(LogicExpr expr) {
        return simplify(expr, null, null);
    }

    /**
     * Simplifies {@code expr}; a tree still changing after the round limit is
     * returned as is and reported as a warning at {@code location}.
     */
    public LogicExpr simplify(LogicExpr expr, FindingCollector findings, String location) {
        if (expr == null) return null;
        LogicExpr current = expr;
        for (int round = 0; round < maxRounds; round++) {
            LogicExpr next = rewrite(current);
            if (next.equals(current)) return current;
            current = next;
        }
        String message = String.format("Logic simplification did not settle within %d rounds: %s", maxRounds, current);
        if (findings != null) {
            findings.warning(message, location);
        } else {
            Logger.warn("%s", message);
        }
        return current;
    }

    private LogicExpr rewrite(LogicExpr expr) {
        if (expr instanceof Condition) return expr;
        Operator op = (Operator) expr;

        List<LogicExpr> children = new ArrayList<>(op.children().size());
        for (LogicExpr child : op.children()) {
            children.add(rewrite(child));
        }

        if (op.operation() == Connective.NOT) {
            return rewriteNot(children.get(0));
        }
        return rewriteJunction(op.operation(), children);
    }

    private LogicExpr rewriteNot(LogicExpr child) {
        if (child instanceof Operator inner && inner.operation() == Connective.NOT) {
            return inner.children().get(0);
        }
        if (child.isTrue()) return LogicExpr.FALSE;
        if (child.isFalse()) return LogicExpr.TRUE;
        if (child instanceof Condition c && c.operation().negate() != null) {
            return new Condition(c.subject(), c.operation().negate(), c.value());
        }
        return LogicExpr.not(child);
    }

    private LogicExpr rewriteJunction(Connective connective, List<LogicExpr> rewritten) {
        boolean isAnd = connective == Connective.AND;

        // Flattening also drops the identity constant, which is the empty junction of the same kind.
        List<LogicExpr> flat = new ArrayList<>();
        for (LogicExpr child : rewritten) {
            if (child instanceof Operator inner && inner.operation() == connective) {
                flat.addAll(inner.children());
            } else {
                flat.add(child);
            }
        }

        for (LogicExpr child : flat) {
            if (isAnd ? child.isFalse() : child.isTrue()) {
                return isAnd ? LogicExpr.FALSE : LogicExpr.TRUE;
            }
        }

        List<LogicExpr> unique = new ArrayList<>(new LinkedHashSet<>(flat));
        List<LogicExpr> absorbed = absorb(connective, unique);
        List<LogicExpr> folded = foldBounds(isAnd, absorbed);
        if (folded == null) return LogicExpr.FALSE;

        if (folded.size() == 1) return folded.get(0);
        return new Operator(connective, folded);
    }

    /** Drops a child of the dual connective that contains one of its siblings. */
    private List<LogicExpr> absorb(Connective connective, List<LogicExpr> children) {
        Connective dual = connective == Connective.AND ? Connective.OR : Connective.AND;
        List<LogicExpr> out = new ArrayList<>(children.size());
        for (LogicExpr child : children) {
            boolean absorbedBySibling = false;
            if (child instanceof Operator inner && inner.operation() == dual && !inner.children().isEmpty()) {
                for (LogicExpr sibling : children) {
                    if (sibling != child && inner.children().contains(sibling)) {
                        absorbedBySibling = true;
                        break;
                    }
                }
            }
            if (!absorbedBySibling) out.add(child);
        }
        return out;
    }

    /**
     * Folds numeric comparisons per subject. Returns {@code null} when an AND
     * is found unsatisfiable.
     */
    private List<LogicExpr> foldBounds(boolean isAnd, List<LogicExpr> children) {
        Map<String, Bounds> bySubject = new LinkedHashMap<>();
        for (LogicExpr child : children) {
            if (child instanceof Condition c && c.isNumeric() && (c.operation().isBound() || (isAnd && c.operation() == Operation.EQ))) {
                bySubject.computeIfAbsent(c.subject(), s -> new Bounds()).add(c, isAnd);
            }
        }

        List<LogicExpr> out = new ArrayList<>(children.size());
        for (LogicExpr child : children) {
            Bounds bounds = child instanceof Condition c ? bySubject.get(c.subject()) : null;
            if (bounds == null || !bounds.covers((Condition) child)) {
                out.add(child);
                continue;
            }
            if (bounds.emitted) continue;
            bounds.emitted = true;
            List<Condition> replacement = isAnd ? bounds.conjunction() : bounds.disjunction();
            if (replacement == null) return null;
            out.addAll(replacement);
        }
        return out;
    }

    /** Numeric constraints collected for one subject within one junction. */
    private static final class Bounds {
        Condition lower;
        Condition upper;
        final List<Condition> equalities = new ArrayList<>();
        boolean emitted;

        void add(Condition c, boolean isAnd) {
            if (c.operation() == Operation.EQ) {
                equalities.add(c);
            } else if (c.operation().isLowerBound()) {
                lower = lower == null ? c : pickLower(lower, c, isAnd);
            } else {
                upper = upper == null ? c : pickUpper(upper, c, isAnd);
            }
        }

        boolean covers(Condition c) {
            return c.isNumeric() && (c.operation().isBound() || equalities.contains(c));
        }

        /** Tightest range; {@code null} if nothing can satisfy it. */
        List<Condition> conjunction() {
            if (!equalities.isEmpty()) {
                Condition eq = equalities.get(0);
                for (Condition other : equalities) {
                    if (other.number().compareTo(eq.number()) != 0) return null;
                }
                if (lower != null && !satisfiesLower(eq.number(), lower)) return null;
                if (upper != null && !satisfiesUpper(eq.number(), upper)) return null;
                return List.of(eq);
            }
            if (lower != null && upper != null) {
                int cmp = lower.number().compareTo(upper.number());
                if (cmp > 0) return null;
                if (cmp == 0) {
                    if (lower.operation() == Operation.GE && upper.operation() == Operation.LE) {
                        return List.of(new Condition(lower.subject(), Operation.EQ, lower.value()));
                    }
                    return null;
                }
            }
            return present();
        }

        List<Condition> disjunction() {
            return present();
        }

        private List<Condition> present() {
            List<Condition> out = new ArrayList<>(2);
            if (lower != null) out.add(lower);
            if (upper != null) out.add(upper);
            return out;
        }

        private static Condition pickLower(Condition a, Condition b, boolean tighter) {
            int cmp = a.number().compareTo(b.number());
            if (cmp == 0) {
                // At equal value ">" is the tighter and ">=" the looser bound.
                boolean aStrict = a.operation() == Operation.GT;
                return aStrict == tighter ? a : b;
            }
            return (cmp > 0) == tighter ? a : b;
        }

        private static Condition pickUpper(Condition a, Condition b, boolean tighter) {
            int cmp = a.number().compareTo(b.number());
            if (cmp == 0) {
                boolean aStrict = a.operation() == Operation.LT;
                return aStrict == tighter ? a : b;
            }
            return (cmp < 0) == tighter ? a : b;
        }

        private static boolean satisfiesLower(BigDecimal v, Condition lower) {
            int cmp = v.compareTo(lower.number());
            return lower.operation() == Operation.GT ? cmp > 0 : cmp >= 0;
        }

        private static boolean satisfiesUpper(BigDecimal v, Condition upper) {
            int cmp = v.compareTo(upper.number());
            return upper.operation() == Operation.LT ? cmp < 0 : cmp <= 0;
        }
    }
}
