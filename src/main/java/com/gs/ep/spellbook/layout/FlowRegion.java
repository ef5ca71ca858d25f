package com.gs.ep.spellbook.layout;

/**
 * Rectangle, in millimetres from the bottom-left corner of the page, inside which
 * content may be placed. A region whose bounds overlap is inert and receives no output.
 */
public final class FlowRegion {

    private final double xMin;
    private final double xMax;
    private final double yMin;
    private final double yMax;

    public FlowRegion(double xMin, double xMax, double yMin, double yMax) {
        this.xMin = xMin;
        this.xMax = xMax;
        this.yMin = yMin;
        this.yMax = yMax;
    }

    public double getXMin() {
        return xMin;
    }

    public double getXMax() {
        return xMax;
    }

    public double getYMin() {
        return yMin;
    }

    public double getYMax() {
        return yMax;
    }

    public double getWidth() {
        return xMax - xMin;
    }

    public double getHeight() {
        return yMax - yMin;
    }

    public boolean isInert() {
        return xMin >= xMax || yMin >= yMax;
    }

    @Override
    public String toString() {
        return String.format("FlowRegion[x=%.2f..%.2f, y=%.2f..%.2f]", xMin, xMax, yMin, yMax);
    }
}
