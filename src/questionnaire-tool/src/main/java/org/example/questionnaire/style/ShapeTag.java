package org.example.questionnaire.style;

import java.util.List;

/** Shape tags recognised in a style. */
public enum ShapeTag {
    RHOMBUS("rhombus"),
    HEXAGON("hexagon"),
    ELLIPSE("ellipse"),
    CALLOUT("callout"),
    OFF_PAGE_CONNECTOR("offPageConnector"),
    SELECT_ONE("select_one"),
    SELECT_MULTIPLE("select_multiple"),
    RECTANGLE("rectangle");

    /** Tags tried against a style, most specific first. */
    public static final List<ShapeTag> MATCH_ORDER =
        List.of(RHOMBUS, HEXAGON, ELLIPSE, CALLOUT, OFF_PAGE_CONNECTOR);

    private final String styleName;

    ShapeTag(String styleName) {
        this.styleName = styleName;
    }

    public String styleName() {
        return styleName;
    }
}
