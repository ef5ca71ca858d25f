package com.gs.ep.spellbook.layout;

import java.awt.Color;

/**
 * Spacing and off-row shading of tables. Margins are in millimetres.
 * <p>
 * The shading line drawn for each line of an off row is {@code newlineAdvance * shadingHeightScalar}
 * thick and is raised by {@code fontSize * shadingYAdjustScalar} so it sits behind the glyphs
 * rather than on their baseline.
 */
public final class TableOptions {

    private final double columnMargin;
    private final double rowMargin;
    private final double outerHorizontalMargin;
    private final double outerVerticalMargin;
    private final Color offRowColor;
    private final double shadingHeightScalar;
    private final double shadingYAdjustScalar;

    public TableOptions(double columnMargin, double rowMargin, double outerHorizontalMargin,
            double outerVerticalMargin, Color offRowColor, double shadingHeightScalar,
            double shadingYAdjustScalar) {
        requireNonNegative("column margin", columnMargin);
        requireNonNegative("row margin", rowMargin);
        requireNonNegative("outer horizontal margin", outerHorizontalMargin);
        requireNonNegative("outer vertical margin", outerVerticalMargin);
        requireNonNegative("shading height scalar", shadingHeightScalar);
        requireNonNegative("shading y adjust scalar", shadingYAdjustScalar);
        this.columnMargin = columnMargin;
        this.rowMargin = rowMargin;
        this.outerHorizontalMargin = outerHorizontalMargin;
        this.outerVerticalMargin = outerVerticalMargin;
        this.offRowColor = offRowColor == null ? new Color(213, 209, 224) : offRowColor;
        this.shadingHeightScalar = shadingHeightScalar;
        this.shadingYAdjustScalar = shadingYAdjustScalar;
    }

    private static void requireNonNegative(String name, double value) {
        if (!PageGeometry.isNonNegative(value)) {
            throw new ConfigurationException("Invalid table " + name + ": " + value);
        }
    }

    public double getColumnMargin() {
        return columnMargin;
    }

    public double getRowMargin() {
        return rowMargin;
    }

    public double getOuterHorizontalMargin() {
        return outerHorizontalMargin;
    }

    public double getOuterVerticalMargin() {
        return outerVerticalMargin;
    }

    public Color getOffRowColor() {
        return offRowColor;
    }

    public double getShadingHeightScalar() {
        return shadingHeightScalar;
    }

    public double getShadingYAdjustScalar() {
        return shadingYAdjustScalar;
    }
}
