package org.example.questionnaire.validation;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.example.questionnaire.Logger;
import org.example.questionnaire.logic.ExternalReferences;
import org.example.questionnaire.model.Diagram;
import org.example.questionnaire.model.Edge;
import org.example.questionnaire.model.Group;
import org.example.questionnaire.model.Node;
import org.example.questionnaire.model.NodeType;

/**
 * Whole-diagram checks. Per-element problems are reported by the builder
 * while it resolves cells; the checks here need the complete graph.
 */
public class DiagramValidator {

    private final ExternalReferences externals;

    public DiagramValidator() {
        this(ExternalReferences.empty());
    }

    public DiagramValidator(ExternalReferences externals) {
        this.externals = externals;
    }

    // ── After build ──────────────────────────────────────────────────────────

    public void validateStructure(Diagram diagram, FindingCollector findings) {
        Logger.debug("Structural checks on page '%s'", diagram.pageId());
        checkAcyclic(diagram, findings);
        checkGroups(diagram, findings);
        for (Node n : diagram.nodes().values()) {
            if (n.type().isList() && n.options().isEmpty()) {
                findings.error("Select list has no options", n.id());
            }
            if (n.type() == NodeType.DECISION_POINT && n.name() != null && !referenceResolves(diagram, n)) {
                findings.warning(String.format("Decision point references '%s', which names no node", n.name()), n.id());
            }
        }
    }

    private void checkGroups(Diagram diagram, FindingCollector findings) {
        for (Group g : diagram.groups().values()) {
            if (g.containedIds().isEmpty()) {
                findings.warning("Group contains no nodes", g.id());
            }
            for (String member : g.containedIds()) {
                Node n = diagram.node(member);
                if (n == null) {
                    findings.error(String.format("Group lists unknown member '%s'", member), g.id());
                } else if (!g.id().equals(n.groupId())) {
                    findings.error(String.format("Group lists '%s', which belongs to '%s'", member, n.groupId()), g.id());
                }
            }
        }
        for (Node n : diagram.nodes().values()) {
            if (n.groupId() == null) continue;
            Group g = diagram.groups().get(n.groupId());
            if (g == null || !g.containedIds().contains(n.id())) {
                findings.error(String.format("Node claims group '%s', which does not list it", n.groupId()), n.id());
            }
        }
    }

    private boolean referenceResolves(Diagram diagram, Node decision) {
        String name = decision.name();
        if (externals.isNumeric(name) || externals.isFlag(name)) return true;
        return diagram.findByName(name, decision.id()).isPresent();
    }

    // ── After simplification ─────────────────────────────────────────────────

    /**
     * Checks the simplified graph. {@code entryNodeId} may be {@code null}, in
     * which case the single node without incoming edges is the entry.
     */
    public void validateFinal(Diagram diagram, String entryNodeId, FindingCollector findings) {
        Logger.debug("Final checks on page '%s'", diagram.pageId());
        checkAcyclic(diagram, findings);

        for (Edge e : diagram.edges()) {
            if (!diagram.hasNode(e.sourceId()) || !diagram.hasNode(e.targetId())) {
                findings.error(String.format("Edge %s -> %s has a missing endpoint", e.sourceId(), e.targetId()), e.id());
            }
        }
        for (Node n : diagram.nodesOfType(NodeType.SELECT_OPTION)) {
            if (diagram.listOwning(n.id()).isEmpty()) {
                findings.error("Option belongs to no select list", n.id());
            }
        }

        List<String> starts = entryNodes(diagram, entryNodeId, findings);
        if (!starts.isEmpty()) {
            Set<String> reached = reachableFrom(diagram, starts);
            for (Node n : diagram.nodes().values()) {
                if (!reached.contains(n.id()) && n.type() != NodeType.SELECT_OPTION) {
                    findings.warning("Node is not reachable from the entry point", n.id());
                }
            }
        }

        if (diagram.nodes().size() > 1) {
            for (Node n : diagram.nodes().values()) {
                if (n.type() != NodeType.SELECT_OPTION
                        && diagram.incoming(n.id()).isEmpty() && diagram.outgoing(n.id()).isEmpty()) {
                    findings.warning("Node is isolated", n.id());
                }
            }
        }
    }

    private List<String> entryNodes(Diagram diagram, String entryNodeId, FindingCollector findings) {
        if (entryNodeId != null) {
            if (!diagram.hasNode(entryNodeId)) {
                findings.error("Declared entry node does not exist", entryNodeId);
                return List.of();
            }
            return List.of(entryNodeId);
        }
        List<String> entries = diagram.entryPoints();
        if (entries.isEmpty()) {
            findings.error("Diagram has no entry point", diagram.pageId());
        } else if (entries.size() > 1) {
            findings.warning(String.format("Diagram has %d entry points: %s", entries.size(), entries), diagram.pageId());
        }
        return entries;
    }

    private static Set<String> reachableFrom(Diagram diagram, List<String> starts) {
        Map<String, List<String>> successors = successors(diagram);
        Set<String> seen = new HashSet<>(starts);
        Deque<String> queue = new ArrayDeque<>(starts);
        while (!queue.isEmpty()) {
            String id = queue.poll();
            List<String> next = new ArrayList<>(successors.getOrDefault(id, List.of()));
            // Options are reached through their list.
            Node n = diagram.node(id);
            if (n != null) next.addAll(n.options());
            for (String target : next) {
                if (seen.add(target)) queue.add(target);
            }
        }
        return seen;
    }

    // ── Cycles ───────────────────────────────────────────────────────────────

    private static void checkAcyclic(Diagram diagram, FindingCollector findings) {
        List<String> cycle = findCycle(diagram);
        if (!cycle.isEmpty()) {
            findings.error("Diagram contains a cycle: " + String.join(" -> ", cycle), cycle.get(0));
        }
    }

    /**
     * One cycle as a closed node path ({@code a -> b -> a}), or an empty list
     * when the graph is acyclic.
     */
    public static List<String> findCycle(Diagram diagram) {
        Map<String, List<String>> successors = successors(diagram);
        Map<String, Integer> colour = new HashMap<>(); // absent = unvisited, 1 = on stack, 2 = done
        for (String root : diagram.nodes().keySet()) {
            if (colour.containsKey(root)) continue;
            // Iterative DFS, a path entry is (node, index of next successor).
            Deque<String> path = new ArrayDeque<>();
            Deque<int[]> cursor = new ArrayDeque<>();
            path.push(root);
            cursor.push(new int[] {0});
            colour.put(root, 1);
            while (!path.isEmpty()) {
                String node = path.peek();
                List<String> next = successors.getOrDefault(node, List.of());
                int[] i = cursor.peek();
                if (i[0] < next.size()) {
                    String child = next.get(i[0]++);
                    Integer c = colour.get(child);
                    if (c == null) {
                        colour.put(child, 1);
                        path.push(child);
                        cursor.push(new int[] {0});
                    } else if (c == 1) {
                        return closePath(path, child);
                    }
                } else {
                    colour.put(node, 2);
                    path.pop();
                    cursor.pop();
                }
            }
        }
        return List.of();
    }

    private static List<String> closePath(Deque<String> stack, String repeated) {
        List<String> bottomUp = new ArrayList<>(stack);
        Collections.reverse(bottomUp);
        List<String> cycle = new ArrayList<>(bottomUp.subList(bottomUp.indexOf(repeated), bottomUp.size()));
        cycle.add(repeated);
        return cycle;
    }

    private static Map<String, List<String>> successors(Diagram diagram) {
        Map<String, List<String>> out = new HashMap<>();
        for (Edge e : diagram.edges()) {
            out.computeIfAbsent(e.sourceId(), k -> new ArrayList<>()).add(e.targetId());
        }
        // LinkedHashSet keeps a stable order without repeated targets.
        out.replaceAll((k, v) -> new ArrayList<>(new LinkedHashSet<>(v)));
        return out;
    }
}
