package org.example.questionnaire.model;

/** Position and size of a diagram element as drawn. */
public record Geometry(double x, double y, double width, double height) {

    public static final Geometry EMPTY = new Geometry(0, 0, 0, 0);

    /** Finite coordinates and non-negative dimensions. */
    public boolean isSane() {
        return Double.isFinite(x) && Double.isFinite(y)
            && Double.isFinite(width) && Double.isFinite(height)
            && width >= 0 && height >= 0;
    }
}
