package org.example.questionnaire;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.example.questionnaire.model.CellRecord;
import org.example.questionnaire.model.Geometry;
import org.example.questionnaire.style.StyleParser;

/** Builds cell records the way the draw.io reader would hand them over. */
public final class TestCells {

    public static final Geometry BOX = new Geometry(0, 0, 120, 40);

    private TestCells() {
    }

    /** The two layer cells every draw.io page starts with. */
    public static List<CellRecord> layers() {
        return List.of(
            new CellRecord("0", Map.of("id", "0"), Map.of(), null, null, null, null),
            new CellRecord("1", Map.of("id", "1", "parent", "0"), Map.of(), null, "0", null, null));
    }

    public static CellRecord vertex(String id, String parent, String style, String label, String... extra) {
        Map<String, String> attrs = new LinkedHashMap<>();
        attrs.put("id", id);
        attrs.put("value", label);
        attrs.put("style", style);
        attrs.put("vertex", "1");
        attrs.put("parent", parent);
        for (int i = 0; i + 1 < extra.length; i += 2) {
            attrs.put(extra[i], extra[i + 1]);
        }
        return new CellRecord(id, attrs, StyleParser.parse(style), BOX, parent, null, null);
    }

    public static CellRecord edge(String id, String source, String target, String label) {
        Map<String, String> attrs = new LinkedHashMap<>();
        attrs.put("id", id);
        attrs.put("value", label);
        attrs.put("style", "edgeStyle=orthogonalEdgeStyle;html=1;");
        attrs.put("edge", "1");
        attrs.put("parent", "1");
        return new CellRecord(id, attrs, StyleParser.parse(attrs.get("style")), Geometry.EMPTY, "1", source, target);
    }

    public static CellRecord group(String id, String label) {
        return vertex(id, "1", "swimlane;whiteSpace=wrap;html=1;", label);
    }

    public static CellRecord list(String id, String parent, String label, boolean rounded) {
        return vertex(id, parent, "swimlane;childLayout=stackLayout;horizontal=1;rounded=" + (rounded ? 1 : 0) + ";", label);
    }

    public static CellRecord option(String id, String list, String label) {
        return vertex(id, list, "text;strokeColor=none;fillColor=none;align=left;", label);
    }

    public static CellRecord note(String id, String parent, String label) {
        return vertex(id, parent, "rounded=0;whiteSpace=wrap;html=1;", label);
    }
}
