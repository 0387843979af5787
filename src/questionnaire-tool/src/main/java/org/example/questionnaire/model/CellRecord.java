package org.example.questionnaire.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One raw draw.io cell as handed over by the XML layer.
 *
 * <p>{@code attributes} holds the cell's own attributes merged with those of a
 * wrapping {@code <object>}/{@code <UserObject>} element; {@code style} is the
 * already parsed style string. Edge endpoints are only set for edge cells.
 */
public record CellRecord(
        String id,
        Map<String, String> attributes,
        Map<String, String> style,
        Geometry geometry,
        String parentId,
        String sourceId,
        String targetId) {

    public CellRecord {
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        style = Collections.unmodifiableMap(new LinkedHashMap<>(style));
    }

    public boolean isVertex() {
        return "1".equals(attributes.get("vertex"));
    }

    public boolean isEdge() {
        return "1".equals(attributes.get("edge"));
    }

    /** Display text: the {@code label} of a wrapping object wins over the cell {@code value}. */
    public String rawLabel() {
        String label = attributes.get("label");
        if (label != null) return label;
        return attributes.getOrDefault("value", "");
    }

    public String attribute(String name) {
        return attributes.get(name);
    }

    public boolean hasStyle(String key) {
        return style.containsKey(key);
    }
}
