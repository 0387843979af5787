package org.example.questionnaire.style;

import java.util.Map;

import org.junit.jupiter.api.Test;

import org.example.questionnaire.TestCells;
import org.example.questionnaire.model.NodeType;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tag detection per shape, the priority between tags, and the colour rules
 * for rectangles.
 */
public class ShapeClassifierTest {

    private static ShapeTag classify(String style) {
        return ShapeClassifier.classify(StyleParser.parse(style));
    }

    @Test
    void rhombusIsDetectedAsStyleKey() {
        assertEquals(ShapeTag.RHOMBUS, classify("rhombus;whiteSpace=wrap;html=1;"));
    }

    @Test
    void hexagonIsDetectedAsShapeValue() {
        assertEquals(ShapeTag.HEXAGON, classify("shape=hexagon;perimeter=hexagonPerimeter2;"));
    }

    @Test
    void ellipseIsDetected() {
        assertEquals(ShapeTag.ELLIPSE, classify("ellipse;whiteSpace=wrap;"));
    }

    @Test
    void calloutIsDetected() {
        assertEquals(ShapeTag.CALLOUT, classify("shape=callout;whiteSpace=wrap;"));
    }

    @Test
    void offPageConnectorIsDetected() {
        assertEquals(ShapeTag.OFF_PAGE_CONNECTOR, classify("shape=offPageConnector;whiteSpace=wrap;"));
    }

    @Test
    void unknownStyleFallsBackToRectangle() {
        assertEquals(ShapeTag.RECTANGLE, classify("rounded=1;whiteSpace=wrap;html=1;"));
        assertEquals(ShapeTag.RECTANGLE, classify(""));
        assertEquals(ShapeTag.RECTANGLE, classify("shape=cylinder3"));
    }

    @Test
    void listTagsAreNeverMatchedFromStyle() {
        assertEquals(ShapeTag.RECTANGLE, classify("select_one;select_multiple;"));
    }

    @Test
    void firstTagInPriorityOrderWins() {
        assertEquals(ShapeTag.RHOMBUS, classify("ellipse;rhombus"));
        assertEquals(ShapeTag.HEXAGON, classify("ellipse;shape=hexagon"));
        assertEquals(ShapeTag.ELLIPSE, classify("shape=offPageConnector;ellipse"));
    }

    @Test
    void groupAndListPredicates() {
        assertTrue(ShapeClassifier.isGroup(TestCells.group("g", "Page")));
        assertFalse(ShapeClassifier.isList(TestCells.group("g", "Page")));

        assertTrue(ShapeClassifier.isList(TestCells.list("l", "1", "Symptoms", false)));
        assertFalse(ShapeClassifier.isGroup(TestCells.list("l", "1", "Symptoms", false)));

        assertFalse(ShapeClassifier.isGroup(TestCells.note("n", "1", "Note")));
    }

    @Test
    void listTypeFollowsRounding() {
        assertEquals(NodeType.SELECT_ONE, ShapeClassifier.listType(Map.of("rounded", "1")));
        assertEquals(NodeType.SELECT_MULTIPLE, ShapeClassifier.listType(Map.of("rounded", "0")));
        assertEquals(NodeType.SELECT_MULTIPLE, ShapeClassifier.listType(Map.of()));
    }

    @Test
    void shapeTagsMapToNodeTypes() {
        Map<String, String> none = Map.of();
        assertEquals(NodeType.DECISION_POINT, ShapeClassifier.nodeTypeFor(ShapeTag.RHOMBUS, none));
        assertEquals(NodeType.NUMERIC_INTEGER, ShapeClassifier.nodeTypeFor(ShapeTag.HEXAGON, none));
        assertEquals(NodeType.NUMERIC_DECIMAL, ShapeClassifier.nodeTypeFor(ShapeTag.ELLIPSE, none));
        assertEquals(NodeType.TEXT, ShapeClassifier.nodeTypeFor(ShapeTag.CALLOUT, none));
        assertEquals(NodeType.GOTO, ShapeClassifier.nodeTypeFor(ShapeTag.OFF_PAGE_CONNECTOR, none));
        assertEquals(NodeType.NOTE, ShapeClassifier.nodeTypeFor(ShapeTag.RECTANGLE, none));
    }

    @Test
    void roundedRectanglesAreDiagnosesOrCalculations() {
        assertEquals(NodeType.DIAGNOSIS, ShapeClassifier.nodeTypeFor(ShapeTag.RECTANGLE,
            Map.of("rounded", "1", "fillColor", "#ff0000")));
        assertEquals(NodeType.CALCULATE, ShapeClassifier.nodeTypeFor(ShapeTag.RECTANGLE,
            Map.of("rounded", "1", "fillColor", "#dae8fc")));
        assertEquals(NodeType.CALCULATE, ShapeClassifier.nodeTypeFor(ShapeTag.RECTANGLE, Map.of("rounded", "1")));
        assertEquals(NodeType.NOTE, ShapeClassifier.nodeTypeFor(ShapeTag.RECTANGLE,
            Map.of("rounded", "0", "fillColor", "#ff0000")));
    }

    @Test
    void diagnosisSeverityFollowsFillColour() {
        assertEquals(ShapeClassifier.SEVERE, ShapeClassifier.severity(Map.of("fillColor", "#e51400")));
        assertEquals(ShapeClassifier.MODERATE, ShapeClassifier.severity(Map.of("fillColor", "#ffa500")));
        assertEquals(ShapeClassifier.MODERATE, ShapeClassifier.severity(Map.of("fillColor", "#ffff00")));
        assertEquals(ShapeClassifier.BENIGN, ShapeClassifier.severity(Map.of("fillColor", "#00cc00")));
        assertNull(ShapeClassifier.severity(Map.of("fillColor", "none")));
    }

    @Test
    void colourRangesAcceptShortHexAndRejectGarbage() {
        assertTrue(ColorRange.RED.matches("#f00"));
        assertTrue(ColorRange.GREY.matches("#808080"));
        assertTrue(ColorRange.GREY.matches("F5F5F5"));
        assertFalse(ColorRange.GREY.matches("#dae8fc"));
        assertFalse(ColorRange.RED.matches("red"));
        assertFalse(ColorRange.RED.matches(null));
        assertTrue(ColorRange.of("#zzzzzz").isEmpty());
    }
}
