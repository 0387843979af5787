package org.example.questionnaire.logic;

import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.example.questionnaire.Logger;
import org.example.questionnaire.model.Diagram;
import org.example.questionnaire.model.Edge;
import org.example.questionnaire.model.Node;
import org.example.questionnaire.model.NodeType;
import org.example.questionnaire.validation.FindingCollector;

/**
 * Builds traversal conditions for edges and display conditions for nodes.
 *
 * <p>Edge conditions depend on the type of the edge's source:
 * <pre>
 *   select_multiple option  -> list in option
 *   select_one option       -> list = option
 *   yes_no                  -> node = true | false
 *   decision_point          -> comparison on the referenced node
 *   everything else         -> unconditioned
 * </pre>
 */
public class LogicEngine {

    private static final Pattern NUMERIC_COMPARISON =
        Pattern.compile("(>=|<=|!=|==|=|>|<)\\s*(-?\\d+(?:[.,]\\d+)?)");
    private static final Pattern BRACKETED = Pattern.compile("\\[(.*?)\\]");

    private enum ReferenceKind { NUMERIC, SELECT_ONE, SELECT_MULTIPLE, YES_NO, FLAG, UNKNOWN }

    private final ExternalReferences externals;
    private final LogicSimplifier simplifier;

    public LogicEngine() {
        this(ExternalReferences.empty());
    }

    public LogicEngine(ExternalReferences externals) {
        this.externals = externals;
        this.simplifier = new LogicSimplifier();
    }

    // ── Edge logic ───────────────────────────────────────────────────────────

    /**
     * Condition contributed by the edge's source node, or {@code null} when
     * traversal is unconditioned. Option edges are handled by
     * {@link #optionCondition(Node, Node)} when options are flattened.
     */
    public LogicExpr edgeLogic(Diagram diagram, Edge edge, FindingCollector findings) {
        Node source = diagram.node(edge.sourceId());
        if (source == null) return null;

        return switch (source.type()) {
            case YES_NO -> yesNoLogic(source, edge, findings);
            case DECISION_POINT -> decisionLogic(diagram, source, edge, findings);
            default -> null;
        };
    }

    /** Condition under which the option of {@code list} is chosen. */
    public LogicExpr optionCondition(Node list, Node option) {
        String value = option.label().trim();
        return switch (list.type()) {
            case SELECT_MULTIPLE -> LogicExpr.condition(list.id(), Operation.IN, value);
            case YES_NO -> {
                Boolean yes = yesNo(value);
                yield LogicExpr.condition(list.id(), Operation.EQ, yes != null ? yes : value);
            }
            default -> LogicExpr.condition(list.id(), Operation.EQ, value);
        };
    }

    private LogicExpr yesNoLogic(Node source, Edge edge, FindingCollector findings) {
        Boolean yes = yesNo(edge.label());
        if (yes == null) {
            findings.warning(String.format("Edge leaving yes/no question '%s' is labelled '%s' instead of Yes or No",
                source.label(), edge.label()), edge.id());
            return null;
        }
        return LogicExpr.condition(source.id(), Operation.EQ, yes);
    }

    private LogicExpr decisionLogic(Diagram diagram, Node decision, Edge edge, FindingCollector findings) {
        String name = decision.name();
        Optional<Node> reference = diagram.findByName(decision.name(), decision.id());
        ReferenceKind kind = reference.map(n -> kindOf(n.type())).orElseGet(() -> externalKind(name));
        String subject = reference.map(Node::id).orElse(name != null ? name : decision.id());

        Boolean yes = yesNo(edge.label());
        if (yes == null) {
            findings.warning(String.format("Edge leaving decision point '%s' is labelled '%s' instead of Yes or No; read as Yes",
                decision.label(), edge.label()), edge.id());
            yes = Boolean.TRUE;
        }

        String label = decision.label();
        switch (kind) {
            case NUMERIC: {
                Matcher m = NUMERIC_COMPARISON.matcher(label);
                if (m.find()) {
                    Operation op = Operation.fromSymbol(m.group(1));
                    BigDecimal literal = new BigDecimal(m.group(2).replace(',', '.'));
                    return LogicExpr.condition(subject, yes ? op : op.negate(), literal);
                }
                findings.warning(String.format("Decision point '%s' compares a numeric value but has no 'op number' in its label",
                    label), decision.id());
                return LogicExpr.condition(subject, Operation.EQ, yes);
            }
            case SELECT_ONE:
                return LogicExpr.condition(subject, yes ? Operation.EQ : Operation.NE, optionFromLabel(label));
            case SELECT_MULTIPLE: {
                LogicExpr in = LogicExpr.condition(subject, Operation.IN, optionFromLabel(label));
                return yes ? in : LogicExpr.not(in);
            }
            case FLAG: {
                LogicExpr raised = LogicExpr.condition(LogicExpr.FLAGS, Operation.IN, name);
                return yes ? raised : LogicExpr.not(raised);
            }
            case YES_NO:
                return LogicExpr.condition(subject, Operation.EQ, yes);
            default:
                findings.warning(String.format("Decision point '%s' references '%s', which is neither a node nor an external reference",
                    label, name), decision.id());
                return LogicExpr.condition(subject, Operation.EQ, yes);
        }
    }

    private static ReferenceKind kindOf(NodeType type) {
        return switch (type) {
            case NUMERIC, NUMERIC_INTEGER, NUMERIC_DECIMAL -> ReferenceKind.NUMERIC;
            case SELECT_ONE -> ReferenceKind.SELECT_ONE;
            case SELECT_MULTIPLE -> ReferenceKind.SELECT_MULTIPLE;
            case YES_NO -> ReferenceKind.YES_NO;
            case FLAG, CALCULATE, DIAGNOSIS -> ReferenceKind.FLAG;
            default -> ReferenceKind.UNKNOWN;
        };
    }

    private ReferenceKind externalKind(String name) {
        if (name == null) return ReferenceKind.UNKNOWN;
        if (externals.isFlag(name)) return ReferenceKind.FLAG;
        if (externals.isNumeric(name)) return ReferenceKind.NUMERIC;
        return ReferenceKind.UNKNOWN;
    }

    private static String optionFromLabel(String label) {
        Matcher m = BRACKETED.matcher(label);
        return m.find() ? m.group(1).trim() : label.trim();
    }

    static Boolean yesNo(String label) {
        if (label == null) return null;
        String l = label.trim().toLowerCase(Locale.ROOT);
        if (l.equals("yes")) return Boolean.TRUE;
        if (l.equals("no")) return Boolean.FALSE;
        return null;
    }

    // ── Node logic ───────────────────────────────────────────────────────────

    /**
     * Display condition of every node: entry nodes are always shown, any other
     * node is shown when one of its incoming edges is traversable from a shown
     * source. Computed in one topological sweep, so diamonds cost no more than
     * chains. Nodes on or after a cycle never become ready and are reported.
     */
    public Map<String, LogicExpr> deriveNodeLogic(Diagram diagram, FindingCollector findings) {
        Map<String, Integer> inDegree = new LinkedHashMap<>();
        Map<String, List<Edge>> incoming = new HashMap<>();
        Map<String, List<Edge>> outgoing = new HashMap<>();
        for (String id : diagram.nodes().keySet()) {
            inDegree.put(id, 0);
        }
        for (Edge e : diagram.edges()) {
            inDegree.merge(e.targetId(), 1, Integer::sum);
            incoming.computeIfAbsent(e.targetId(), k -> new ArrayList<>()).add(e);
            outgoing.computeIfAbsent(e.sourceId(), k -> new ArrayList<>()).add(e);
        }

        Deque<String> ready = new ArrayDeque<>();
        inDegree.forEach((id, degree) -> {
            if (degree == 0) ready.add(id);
        });

        Map<String, LogicExpr> resolved = new HashMap<>();
        while (!ready.isEmpty()) {
            String id = ready.poll();
            resolved.put(id, nodeLogic(id, incoming.getOrDefault(id, List.of()), resolved, findings));
            for (Edge e : outgoing.getOrDefault(id, List.of())) {
                if (inDegree.merge(e.targetId(), -1, Integer::sum) == 0) {
                    ready.add(e.targetId());
                }
            }
        }

        Map<String, LogicExpr> result = new LinkedHashMap<>();
        for (String id : diagram.nodes().keySet()) {
            LogicExpr logic = resolved.get(id);
            if (logic == null) {
                String where = onCycle(id, outgoing) ? "lies on a cycle" : "follows a cycle";
                findings.warning(String.format("Node %s; its display logic cannot be derived and is set to false", where), id);
                logic = LogicExpr.FALSE;
            }
            result.put(id, logic);
        }
        Logger.debug("Derived display logic for %d node(s)", result.size());
        return result;
    }

    /** Whether {@code id} can reach itself. */
    private static boolean onCycle(String id, Map<String, List<Edge>> outgoing) {
        Set<String> seen = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(id);
        while (!queue.isEmpty()) {
            for (Edge e : outgoing.getOrDefault(queue.poll(), List.of())) {
                if (e.targetId().equals(id)) return true;
                if (seen.add(e.targetId())) queue.add(e.targetId());
            }
        }
        return false;
    }

    private LogicExpr nodeLogic(String id, List<Edge> incoming, Map<String, LogicExpr> resolved,
                                FindingCollector findings) {
        if (incoming.isEmpty()) return LogicExpr.TRUE;
        List<LogicExpr> paths = new ArrayList<>(incoming.size());
        for (Edge e : incoming) {
            LogicExpr sourceLogic = resolved.getOrDefault(e.sourceId(), LogicExpr.TRUE);
            paths.add(LogicExpr.conjoin(e.logic(), sourceLogic));
        }
        return simplifier.simplify(new LogicExpr.Operator(Connective.OR, paths), findings, id);
    }
}
