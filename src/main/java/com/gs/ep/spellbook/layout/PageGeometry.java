package com.gs.ep.spellbook.layout;

/**
 * Page size and text margins, in millimetres.
 */
public final class PageGeometry {

    private final double width;
    private final double height;
    private final double leftMargin;
    private final double rightMargin;
    private final double topMargin;
    private final double bottomMargin;

    public PageGeometry(double width, double height, double leftMargin, double rightMargin,
            double topMargin, double bottomMargin) {
        if (!isPositive(width)) {
            throw new ConfigurationException("Invalid page width: " + width);
        }
        if (!isPositive(height)) {
            throw new ConfigurationException("Invalid page height: " + height);
        }
        if (!isNonNegative(leftMargin) || !isNonNegative(rightMargin) || leftMargin + rightMargin >= width) {
            throw new ConfigurationException(
                    "Invalid horizontal page margins: left=" + leftMargin + ", right=" + rightMargin
                            + " for page width " + width);
        }
        if (!isNonNegative(topMargin) || !isNonNegative(bottomMargin) || topMargin + bottomMargin >= height) {
            throw new ConfigurationException(
                    "Invalid vertical page margins: top=" + topMargin + ", bottom=" + bottomMargin
                            + " for page height " + height);
        }
        this.width = width;
        this.height = height;
        this.leftMargin = leftMargin;
        this.rightMargin = rightMargin;
        this.topMargin = topMargin;
        this.bottomMargin = bottomMargin;
    }

    static boolean isPositive(double value) {
        return Double.isFinite(value) && value > 0;
    }

    static boolean isNonNegative(double value) {
        return Double.isFinite(value) && value >= 0;
    }

    public double getWidth() {
        return width;
    }

    public double getHeight() {
        return height;
    }

    public double getLeftMargin() {
        return leftMargin;
    }

    public double getRightMargin() {
        return rightMargin;
    }

    public double getTopMargin() {
        return topMargin;
    }

    public double getBottomMargin() {
        return bottomMargin;
    }

    /**
     * The area inside the margins.
     */
    public FlowRegion textRegion() {
        return new FlowRegion(leftMargin, width - rightMargin, bottomMargin, height - topMargin);
    }
}
