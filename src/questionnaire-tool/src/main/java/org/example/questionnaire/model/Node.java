package org.example.questionnaire.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A typed diagram node. Instances are immutable; the {@code with*} methods
 * return modified copies.
 *
 * <p>Metadata values are strings, booleans, {@link java.math.BigDecimal}s or,
 * for {@link #CHOICES}, a list of strings.
 */
public record Node(
        String id,
        NodeType type,
        String label,
        Geometry geometry,
        String groupId,
        List<String> options,
        Map<String, Object> metadata) {

    public static final String NAME = "name";
    public static final String SEVERITY = "severity";
    public static final String IS_DIAGNOSIS = "is_diagnosis";
    public static final String SUBTYPE = "subtype";
    public static final String HELP_TEXT = "help_text";
    public static final String HINT_TEXT = "hint_text";
    public static final String FILL_COLOR = "fill_color";
    public static final String ROUNDED = "rounded";
    public static final String MIN_VALUE = "min";
    public static final String MAX_VALUE = "max";
    public static final String CONSTRAINT_MESSAGE = "constraint_message";
    /** Option labels of a list, kept when its option nodes are flattened away. */
    public static final String CHOICES = "choices";

    public Node {
        label = label == null ? "" : label;
        options = List.copyOf(options);
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static Node of(String id, NodeType type, String label) {
        return new Node(id, type, label, Geometry.EMPTY, null, List.of(), Map.of());
    }

    public Node withType(NodeType newType) {
        return new Node(id, newType, label, geometry, groupId, options, metadata);
    }

    public Node withLabel(String newLabel) {
        return new Node(id, type, newLabel, geometry, groupId, options, metadata);
    }

    public Node withGroup(String newGroupId) {
        return new Node(id, type, label, geometry, newGroupId, options, metadata);
    }

    public Node withOptions(List<String> newOptions) {
        return new Node(id, type, label, geometry, groupId, newOptions, metadata);
    }

    public Node withMetadata(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(metadata);
        if (value == null) {
            copy.remove(key);
        } else {
            copy.put(key, value);
        }
        return new Node(id, type, label, geometry, groupId, options, copy);
    }

    /** The {@code name} a decision point or goto uses to refer to this node, if any. */
    public String name() {
        Object name = metadata.get(NAME);
        return name == null ? null : name.toString();
    }

    public String metadataString(String key) {
        Object v = metadata.get(key);
        return v == null ? null : v.toString();
    }
}
