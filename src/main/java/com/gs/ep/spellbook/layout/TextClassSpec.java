package com.gs.ep.spellbook.layout;

import java.awt.Color;

/**
 * Font size (points), newline advance (millimetres) and colour of one {@link TextClass}.
 */
public final class TextClassSpec {

    private final double fontSize;
    private final double newlineAdvance;
    private final Color color;

    public TextClassSpec(double fontSize, double newlineAdvance, Color color) {
        if (!PageGeometry.isNonNegative(fontSize)) {
            throw new ConfigurationException("Invalid font size: " + fontSize);
        }
        if (!PageGeometry.isNonNegative(newlineAdvance)) {
            throw new ConfigurationException("Invalid newline advance: " + newlineAdvance);
        }
        this.fontSize = fontSize;
        this.newlineAdvance = newlineAdvance;
        this.color = color == null ? Color.BLACK : color;
    }

    public double getFontSize() {
        return fontSize;
    }

    public double getNewlineAdvance() {
        return newlineAdvance;
    }

    public Color getColor() {
        return color;
    }
}
