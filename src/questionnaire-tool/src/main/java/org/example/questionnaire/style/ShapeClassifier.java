package org.example.questionnaire.style;

import java.util.Map;

import org.example.questionnaire.model.CellRecord;
import org.example.questionnaire.model.NodeType;

/**
 * Maps parsed cell styles to shape tags and node types. All methods are total:
 * an unrecognised style is a {@link ShapeTag#RECTANGLE}.
 */
public final class ShapeClassifier {

    public static final String SEVERE = "SEVERE";
    public static final String MODERATE = "MODERATE";
    public static final String BENIGN = "BENIGN";

    private ShapeClassifier() {
    }

    /**
     * First tag of {@link ShapeTag#MATCH_ORDER} that is either a key of the
     * style or the value of its {@code shape} entry.
     */
    public static ShapeTag classify(Map<String, String> style) {
        String shape = style.get("shape");
        for (ShapeTag tag : ShapeTag.MATCH_ORDER) {
            if (style.containsKey(tag.styleName()) || tag.styleName().equals(shape)) {
                return tag;
            }
        }
        return ShapeTag.RECTANGLE;
    }

    public static ShapeTag classify(CellRecord cell) {
        return classify(cell.style());
    }

    /** Swimlane without a child layout. */
    public static boolean isGroup(CellRecord cell) {
        return cell.isVertex() && cell.hasStyle("swimlane") && !cell.hasStyle("childLayout");
    }

    /** Swimlane stacking its option children. */
    public static boolean isList(CellRecord cell) {
        return cell.isVertex() && cell.hasStyle("swimlane")
            && "stackLayout".equals(cell.style().get("childLayout"));
    }

    /** Text cell attached to an edge, holding (part of) the edge's label. */
    public static boolean isEdgeLabel(CellRecord cell) {
        return cell.hasStyle("edgeLabel");
    }

    public static boolean isRounded(Map<String, String> style) {
        return "1".equals(style.get("rounded"));
    }

    public static NodeType listType(Map<String, String> style) {
        return isRounded(style) ? NodeType.SELECT_ONE : NodeType.SELECT_MULTIPLE;
    }

    /** Node type of a regular (non-group, non-list, non-option) vertex. */
    public static NodeType nodeTypeFor(ShapeTag tag, Map<String, String> style) {
        return switch (tag) {
            case RHOMBUS -> NodeType.DECISION_POINT;
            case HEXAGON -> NodeType.NUMERIC_INTEGER;
            case ELLIPSE -> NodeType.NUMERIC_DECIMAL;
            case CALLOUT -> NodeType.TEXT;
            case OFF_PAGE_CONNECTOR -> NodeType.GOTO;
            case SELECT_ONE -> NodeType.SELECT_ONE;
            case SELECT_MULTIPLE -> NodeType.SELECT_MULTIPLE;
            case RECTANGLE -> rectangleType(style);
        };
    }

    /**
     * Rounded rectangles are results: coloured ones are diagnoses, plain ones
     * calculations. Square rectangles are notes.
     */
    static NodeType rectangleType(Map<String, String> style) {
        if (!isRounded(style)) return NodeType.NOTE;
        return severity(style) != null ? NodeType.DIAGNOSIS : NodeType.CALCULATE;
    }

    /** Severity a diagnosis fill colour stands for, {@code null} if the colour is not a diagnosis colour. */
    public static String severity(Map<String, String> style) {
        String fill = style.get("fillColor");
        if (ColorRange.RED.matches(fill)) return SEVERE;
        if (ColorRange.ORANGE.matches(fill) || ColorRange.YELLOW.matches(fill)) return MODERATE;
        if (ColorRange.GREEN.matches(fill)) return BENIGN;
        return null;
    }
}
