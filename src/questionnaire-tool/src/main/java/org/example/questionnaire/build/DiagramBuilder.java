package org.example.questionnaire.build;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.example.questionnaire.Logger;
import org.example.questionnaire.model.CellRecord;
import org.example.questionnaire.model.Diagram;
import org.example.questionnaire.model.Edge;
import org.example.questionnaire.model.Geometry;
import org.example.questionnaire.model.Group;
import org.example.questionnaire.model.Node;
import org.example.questionnaire.model.NodeType;
import org.example.questionnaire.style.ColorRange;
import org.example.questionnaire.style.ShapeClassifier;
import org.example.questionnaire.style.ShapeTag;
import org.example.questionnaire.validation.FindingCollector;

/**
 * Turns the flat cell list of one draw.io page into a {@link Diagram}.
 *
 * FOUR PASSES
 * ===========
 *
 * A cell may reference a parent that appears later in the document, so the
 * cells are walked once per kind, each pass relying on the previous one:
 *
 *   Pass 1 - groups: swimlanes without child layout become empty groups.
 *   Pass 2 - lists:  stack-layout swimlanes become select_one (rounded) or
 *            select_multiple nodes, joining their parent group.
 *   Pass 3 - nodes:  every other vertex becomes a typed node. Children of a
 *            list become its options, children of a group join the group.
 *   Pass 4 - edges:  edges whose endpoints both resolve are kept. An edge into
 *            a group is redirected to the group's entry node.
 *
 * Calling a pass out of order is a programming error and throws
 * {@link IllegalStateException}. Problems in the cells themselves are reported
 * to the {@link FindingCollector}, which decides whether to abort.
 */
public class DiagramBuilder {

    public enum State { EMPTY, GROUPS_RESOLVED, LISTS_RESOLVED, NODES_RESOLVED, EDGES_RESOLVED }

    private final String pageId;
    private final FindingCollector findings;
    private final Map<String, CellRecord> cells = new LinkedHashMap<>();
    private final Set<String> layerIds = new HashSet<>();
    private final Set<String> consumed = new HashSet<>();
    private final Diagram.Builder diagram;
    private State state = State.EMPTY;

    public DiagramBuilder(String pageId, List<CellRecord> cells, FindingCollector findings) {
        this.pageId = pageId;
        this.findings = findings;
        this.diagram = Diagram.builder(pageId);
        if (cells == null) {
            findings.critical("No cell collection supplied for page", pageId, null);
            return;
        }
        index(cells);
    }

    /** Runs all four passes. */
    public static Diagram build(String pageId, List<CellRecord> cells, FindingCollector findings) {
        return new DiagramBuilder(pageId, cells, findings)
            .resolveGroups()
            .resolveLists()
            .resolveNodes()
            .resolveEdges()
            .build();
    }

    public State getState() {
        return state;
    }

    private void index(List<CellRecord> list) {
        for (CellRecord cell : list) {
            if (cell.id() == null || cell.id().isBlank()) {
                findings.error("Cell without id", null);
                continue;
            }
            if (cells.containsKey(cell.id())) {
                findings.error("Duplicate cell id; later occurrence ignored", cell.id());
                continue;
            }
            cells.put(cell.id(), cell);
            if (!cell.isVertex() && !cell.isEdge()) {
                layerIds.add(cell.id());
            }
        }
        Logger.debug("Page '%s': %d cell(s), %d layer(s)", pageId, cells.size(), layerIds.size());
    }

    private void require(State expected, State next) {
        if (state != expected) {
            throw new IllegalStateException(String.format(
                "Cannot move to %s: builder is in state %s, expected %s", next, state, expected));
        }
    }

    // ── Pass 1: groups ───────────────────────────────────────────────────────

    public DiagramBuilder resolveGroups() {
        require(State.EMPTY, State.GROUPS_RESOLVED);
        for (CellRecord cell : cells.values()) {
            if (!ShapeClassifier.isGroup(cell)) continue;
            diagram.putGroup(new Group(cell.id(), LabelText.clean(cell.rawLabel()), Set.of(), geometryOf(cell)));
            consumed.add(cell.id());
        }
        Logger.debug("Pass 1: %d group(s)", consumed.size());
        state = State.GROUPS_RESOLVED;
        return this;
    }

    // ── Pass 2: lists ────────────────────────────────────────────────────────

    public DiagramBuilder resolveLists() {
        require(State.GROUPS_RESOLVED, State.LISTS_RESOLVED);
        int count = 0;
        for (CellRecord cell : cells.values()) {
            if (!ShapeClassifier.isList(cell)) continue;
            Node list = baseNode(cell, ShapeClassifier.listType(cell.style()));
            if (list.label().isEmpty()) {
                findings.error("Select list has no label", cell.id());
            }
            consumed.add(cell.id());
            placeInParent(cell, list);
            count++;
        }
        Logger.debug("Pass 2: %d list(s)", count);
        state = State.LISTS_RESOLVED;
        return this;
    }

    /** Adds the node, joining the parent group if there is one. */
    private void placeInParent(CellRecord cell, Node node) {
        String parent = cell.parentId();
        if (parent == null || layerIds.contains(parent)) {
            diagram.putNode(node);
        } else if (diagram.hasGroup(parent)) {
            diagram.putNode(node.withGroup(parent));
            diagram.putGroup(diagram.group(parent).withMember(cell.id()));
        } else {
            findings.error(String.format("Parent '%s' is neither a layer nor a group", parent), cell.id());
            diagram.putNode(node);
        }
    }

    // ── Pass 3: regular nodes ────────────────────────────────────────────────

    public DiagramBuilder resolveNodes() {
        require(State.LISTS_RESOLVED, State.NODES_RESOLVED);
        int count = 0;
        for (CellRecord cell : cells.values()) {
            if (!cell.isVertex() || consumed.contains(cell.id())) continue;
            CellRecord parent = cell.parentId() == null ? null : cells.get(cell.parentId());
            if (parent != null && parent.isEdge()) continue; // edge label, read in pass 4
            if (ShapeClassifier.isEdgeLabel(cell)) {
                findings.warning("Edge label is attached to no edge and is dropped", cell.id());
                consumed.add(cell.id());
                continue;
            }

            Node listNode = parent == null ? null : diagram.node(parent.id());
            if (listNode != null && listNode.type().isList()) {
                addOption(cell, listNode);
            } else {
                Node node = regularNode(cell);
                checkRequired(node);
                placeInParent(cell, node);
            }
            consumed.add(cell.id());
            count++;
        }
        Logger.debug("Pass 3: %d node(s)", count);
        state = State.NODES_RESOLVED;
        return this;
    }

    private void addOption(CellRecord cell, Node list) {
        Node option = baseNode(cell, NodeType.SELECT_OPTION);
        if (list.groupId() != null) {
            option = option.withGroup(list.groupId());
            diagram.putGroup(diagram.group(list.groupId()).withMember(cell.id()));
        }
        diagram.putNode(option);
        List<String> options = new ArrayList<>(list.options());
        options.add(cell.id());
        diagram.putNode(list.withOptions(options));
    }

    private Node regularNode(CellRecord cell) {
        ShapeTag tag = ShapeClassifier.classify(cell);
        NodeType type = ShapeClassifier.nodeTypeFor(tag, cell.style());
        Node node = baseNode(cell, type);
        if (type == NodeType.DIAGNOSIS) {
            node = node.withMetadata(Node.SEVERITY, ShapeClassifier.severity(cell.style()));
        }
        node = node.withMetadata(Node.MIN_VALUE, decimalAttribute(cell, Node.MIN_VALUE))
                   .withMetadata(Node.MAX_VALUE, decimalAttribute(cell, Node.MAX_VALUE))
                   .withMetadata(Node.CONSTRAINT_MESSAGE, blankToNull(cell.attribute(Node.CONSTRAINT_MESSAGE)));
        return node;
    }

    private void checkRequired(Node node) {
        if (node.type() == NodeType.DECISION_POINT && node.name() == null) {
            findings.error("Decision point has no 'name' naming the node it compares", node.id());
        }
        boolean needsLabel = node.type() == NodeType.DECISION_POINT || node.type().isNumeric();
        if (needsLabel && node.label().isEmpty()) {
            findings.error(String.format("%s node has no label", node.type().wireName()), node.id());
        }
    }

    private Node baseNode(CellRecord cell, NodeType type) {
        Node node = new Node(cell.id(), type, LabelText.clean(cell.rawLabel()), geometryOf(cell),
            null, List.of(), Map.of());
        node = node.withMetadata(Node.NAME, blankToNull(cell.attribute(Node.NAME)));
        String fill = cell.style().get("fillColor");
        if (fill != null && !"none".equals(fill)) {
            node = node.withMetadata(Node.FILL_COLOR, fill);
        }
        if (ShapeClassifier.isRounded(cell.style())) {
            node = node.withMetadata(Node.ROUNDED, Boolean.TRUE);
        }
        return node;
    }

    private BigDecimal decimalAttribute(CellRecord cell, String name) {
        String raw = blankToNull(cell.attribute(name));
        if (raw == null) return null;
        try {
            return new BigDecimal(raw.replace(',', '.'));
        } catch (NumberFormatException e) {
            findings.warning(String.format("Attribute '%s' is not a number: '%s'", name, raw), cell.id());
            return null;
        }
    }

    private Geometry geometryOf(CellRecord cell) {
        Geometry g = cell.geometry();
        if (g == null) {
            findings.warning("Element has no geometry", cell.id());
            return Geometry.EMPTY;
        }
        if (!g.isSane()) {
            findings.warning(String.format("Element has malformed geometry %s", g), cell.id());
        }
        return g;
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }

    // ── Pass 4: edges ────────────────────────────────────────────────────────

    public DiagramBuilder resolveEdges() {
        require(State.NODES_RESOLVED, State.EDGES_RESOLVED);
        Map<String, List<String>> labelParts = edgeLabelParts();
        List<Edge> intoGroups = new ArrayList<>();
        int kept = 0;

        for (CellRecord cell : cells.values()) {
            if (!cell.isEdge()) continue;
            if (cell.geometry() != null && !cell.geometry().isSane()) {
                findings.warning(String.format("Edge has malformed geometry %s", cell.geometry()), cell.id());
            }
            boolean sourceKnown = diagram.hasNode(cell.sourceId());
            boolean targetIsGroup = cell.targetId() != null && diagram.hasGroup(cell.targetId());
            boolean targetKnown = diagram.hasNode(cell.targetId()) || targetIsGroup;

            if (!sourceKnown && !targetKnown) {
                findings.warning("Edge connects nothing and is dropped", cell.id());
                continue;
            }
            if (!sourceKnown || !targetKnown) {
                String missing = !sourceKnown ? "source '" + cell.sourceId() + "'" : "target '" + cell.targetId() + "'";
                findings.error(String.format("Edge %s does not resolve to a node; edge dropped", missing), cell.id());
                continue;
            }

            List<String> parts = new ArrayList<>();
            String own = LabelText.clean(cell.rawLabel());
            if (!own.isEmpty()) parts.add(own);
            parts.addAll(labelParts.getOrDefault(cell.id(), List.of()));
            Edge edge = new Edge(cell.id(), cell.sourceId(), cell.targetId(), String.join(" ", parts), null, cell.style());

            if (targetIsGroup) {
                intoGroups.add(edge);
            } else {
                diagram.addEdge(edge);
                kept++;
            }
        }

        // Group entries depend on the edges inside the group, so redirect last.
        for (Edge edge : intoGroups) {
            String entry = groupEntry(diagram.group(edge.targetId()));
            if (entry == null) {
                findings.error(String.format("Edge targets group '%s' which has no entry node; edge dropped",
                    edge.targetId()), edge.id());
                continue;
            }
            Logger.debug("Edge %s redirected from group %s to %s", edge.id(), edge.targetId(), entry);
            diagram.addEdge(edge.withTarget(entry));
            kept++;
        }

        Logger.debug("Pass 4: %d edge(s)", kept);
        state = State.EDGES_RESOLVED;
        return this;
    }

    /** Labels of {@code edgeLabel} child cells, keyed by the id of the edge holding them. */
    private Map<String, List<String>> edgeLabelParts() {
        Map<String, List<String>> parts = new LinkedHashMap<>();
        for (CellRecord cell : cells.values()) {
            if (cell.parentId() == null) continue;
            CellRecord parent = cells.get(cell.parentId());
            if (parent == null || !parent.isEdge()) continue;
            String text = LabelText.clean(cell.rawLabel());
            if (!text.isEmpty()) {
                parts.computeIfAbsent(parent.id(), k -> new ArrayList<>()).add(text);
            }
        }
        return parts;
    }

    /**
     * First member (in document order) without an incoming edge from another
     * member, skipping options and notes coloured as help or hint annotations.
     * Edges leaving such annotations do not count as incoming.
     * Falls back to the first eligible member.
     */
    private String groupEntry(Group group) {
        Set<String> members = group.containedIds();
        String fallback = null;
        for (String id : members) {
            Node n = diagram.node(id);
            if (n == null || n.type() == NodeType.SELECT_OPTION || looksLikeAnnotation(n)) continue;
            if (fallback == null) fallback = id;
            boolean fedFromInside = diagram.incoming(id).stream()
                .map(e -> diagram.node(e.sourceId()))
                .anyMatch(src -> src != null && members.contains(src.id()) && !looksLikeAnnotation(src));
            if (!fedFromInside) return id;
        }
        return fallback;
    }

    private boolean looksLikeAnnotation(Node n) {
        if (n.type() != NodeType.NOTE || !diagram.incoming(n.id()).isEmpty()) return false;
        String fill = n.metadataString(Node.FILL_COLOR);
        return ColorRange.GREEN.matches(fill) || ColorRange.GREY.matches(fill);
    }

    // ── Result ───────────────────────────────────────────────────────────────

    public Diagram build() {
        if (state != State.EDGES_RESOLVED) {
            throw new IllegalStateException("Cannot build: builder is in state " + state + ", expected " + State.EDGES_RESOLVED);
        }
        Diagram result = diagram.build();
        Logger.info("Built page '%s': %d node(s), %d edge(s), %d group(s)",
            pageId, result.nodes().size(), result.edges().size(), result.groups().size());
        return result;
    }
}
