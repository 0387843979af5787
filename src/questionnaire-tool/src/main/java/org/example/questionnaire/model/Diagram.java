package org.example.questionnaire.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Resolved questionnaire graph: nodes and groups addressed by id, edges in
 * document order.
 *
 * <p>A {@code Diagram} is a value. Rewrites copy it into a {@link Builder},
 * edit the copy and build a new instance, so a pass never observes a half
 * rewritten graph.
 */
public final class Diagram {

    private final String pageId;
    private final Map<String, Node> nodes;
    private final List<Edge> edges;
    private final Map<String, Group> groups;

    private Diagram(String pageId, Map<String, Node> nodes, List<Edge> edges, Map<String, Group> groups) {
        this.pageId = pageId;
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        this.edges = List.copyOf(edges);
        this.groups = Collections.unmodifiableMap(new LinkedHashMap<>(groups));
    }

    public static Builder builder(String pageId) {
        return new Builder(pageId);
    }

    public Builder toBuilder() {
        Builder b = new Builder(pageId);
        b.nodes.putAll(nodes);
        b.edges.addAll(edges);
        b.groups.putAll(groups);
        return b;
    }

    public String pageId() { return pageId; }

    public Map<String, Node> nodes() { return nodes; }

    public List<Edge> edges() { return edges; }

    public Map<String, Group> groups() { return groups; }

    public Node node(String id) {
        return nodes.get(id);
    }

    public boolean hasNode(String id) {
        return nodes.containsKey(id);
    }

    public List<Edge> incoming(String nodeId) {
        return edges.stream().filter(e -> e.targetId().equals(nodeId)).collect(Collectors.toList());
    }

    public List<Edge> outgoing(String nodeId) {
        return edges.stream().filter(e -> e.sourceId().equals(nodeId)).collect(Collectors.toList());
    }

    public List<Node> nodesOfType(NodeType type) {
        return nodes.values().stream().filter(n -> n.type() == type).collect(Collectors.toList());
    }

    /** Nodes without incoming edges, in insertion order. Option children are never entry points. */
    public List<String> entryPoints() {
        Set<String> targets = edges.stream().map(Edge::targetId).collect(Collectors.toSet());
        return nodes.values().stream()
            .filter(n -> n.type() != NodeType.SELECT_OPTION)
            .map(Node::id)
            .filter(id -> !targets.contains(id))
            .collect(Collectors.toList());
    }

    /**
     * First node carrying the given {@code name} metadata, skipping the node
     * asking. Gotos and decision points only refer to names and are never found.
     */
    public Optional<Node> findByName(String name, String excludeId) {
        if (name == null || name.isBlank()) return Optional.empty();
        return nodes.values().stream()
            .filter(n -> !n.id().equals(excludeId))
            .filter(n -> n.type() != NodeType.GOTO && n.type() != NodeType.DECISION_POINT)
            .filter(n -> name.equals(n.name()))
            .findFirst();
    }

    /** The select list whose option sequence contains {@code optionId}. */
    public Optional<Node> listOwning(String optionId) {
        return nodes.values().stream()
            .filter(n -> n.options().contains(optionId))
            .findFirst();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Diagram other)) return false;
        return Objects.equals(pageId, other.pageId)
            && nodes.equals(other.nodes)
            && edges.equals(other.edges)
            && groups.equals(other.groups);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pageId, nodes, edges, groups);
    }

    @Override
    public String toString() {
        return String.format("Diagram[%s: %d nodes, %d edges, %d groups]",
            pageId, nodes.size(), edges.size(), groups.size());
    }

    /**
     * Mutable working copy of a diagram. Removing a node removes its edges and
     * its group membership, so endpoints never dangle.
     */
    public static final class Builder {
        private final String pageId;
        private final Map<String, Node> nodes = new LinkedHashMap<>();
        private final List<Edge> edges = new ArrayList<>();
        private final Map<String, Group> groups = new LinkedHashMap<>();

        private Builder(String pageId) {
            this.pageId = pageId;
        }

        public Builder putNode(Node node) {
            nodes.put(node.id(), node);
            return this;
        }

        public Builder updateNode(String id, UnaryOperator<Node> change) {
            Node current = nodes.get(id);
            if (current != null) nodes.put(id, change.apply(current));
            return this;
        }

        public Node node(String id) {
            return nodes.get(id);
        }

        public boolean hasNode(String id) {
            return nodes.containsKey(id);
        }

        public Collection<Node> nodes() {
            return Collections.unmodifiableCollection(nodes.values());
        }

        public Builder removeNode(String id) {
            Node removed = nodes.remove(id);
            if (removed == null) return this;
            edges.removeIf(e -> e.sourceId().equals(id) || e.targetId().equals(id));
            if (removed.groupId() != null) {
                Group g = groups.get(removed.groupId());
                if (g != null) groups.put(g.id(), g.withoutMember(id));
            }
            for (Node n : List.copyOf(nodes.values())) {
                if (n.options().contains(id)) {
                    List<String> remaining = new ArrayList<>(n.options());
                    remaining.remove(id);
                    nodes.put(n.id(), n.withOptions(remaining));
                }
            }
            return this;
        }

        public Builder addEdge(Edge edge) {
            edges.add(edge);
            return this;
        }

        /** Replaces the edge with the same id in place, keeping its position. */
        public Builder replaceEdge(Edge edge) {
            for (int i = 0; i < edges.size(); i++) {
                if (edges.get(i).id().equals(edge.id())) {
                    edges.set(i, edge);
                    return this;
                }
            }
            edges.add(edge);
            return this;
        }

        public List<Edge> edges() {
            return Collections.unmodifiableList(edges);
        }

        public List<Edge> incoming(String nodeId) {
            return edges.stream().filter(e -> e.targetId().equals(nodeId)).collect(Collectors.toList());
        }

        public List<Edge> outgoing(String nodeId) {
            return edges.stream().filter(e -> e.sourceId().equals(nodeId)).collect(Collectors.toList());
        }

        public Builder putGroup(Group group) {
            groups.put(group.id(), group);
            return this;
        }

        public Group group(String id) {
            return groups.get(id);
        }

        public boolean hasGroup(String id) {
            return groups.containsKey(id);
        }

        public Diagram build() {
            return new Diagram(pageId, nodes, edges, groups);
        }
    }
}
