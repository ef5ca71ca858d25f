package com.gs.ep.spellbook.layout;

import java.awt.Color;

/**
 * How page numbers look and where they go. Numbers are placed in the bottom corner of
 * the page, {@code sideMargin} from the page edge and {@code bottomMargin} above it.
 */
public final class PageNumberOptions {

    public enum Side {
        LEFT,
        RIGHT;

        public Side flip() {
            return this == LEFT ? RIGHT : LEFT;
        }
    }

    private final Side startingSide;
    private final boolean flipsSides;
    private final int startingNumber;
    private final Style style;
    private final double fontSize;
    private final Color color;
    private final double sideMargin;
    private final double bottomMargin;

    public PageNumberOptions(Side startingSide, boolean flipsSides, int startingNumber, Style style,
            double fontSize, Color color, double sideMargin, double bottomMargin) {
        if (!PageGeometry.isNonNegative(fontSize)) {
            throw new ConfigurationException("Invalid page number font size: " + fontSize);
        }
        if (!PageGeometry.isNonNegative(sideMargin)) {
            throw new ConfigurationException("Invalid page number side margin: " + sideMargin);
        }
        if (!PageGeometry.isNonNegative(bottomMargin)) {
            throw new ConfigurationException("Invalid page number bottom margin: " + bottomMargin);
        }
        this.startingSide = startingSide == null ? Side.LEFT : startingSide;
        this.flipsSides = flipsSides;
        this.startingNumber = startingNumber;
        this.style = style == null ? Style.REGULAR : style;
        this.fontSize = fontSize;
        this.color = color == null ? Color.BLACK : color;
        this.sideMargin = sideMargin;
        this.bottomMargin = bottomMargin;
    }

    public Side getStartingSide() {
        return startingSide;
    }

    public boolean isFlipsSides() {
        return flipsSides;
    }

    public int getStartingNumber() {
        return startingNumber;
    }

    public Style getStyle() {
        return style;
    }

    public double getFontSize() {
        return fontSize;
    }

    public Color getColor() {
        return color;
    }

    public double getSideMargin() {
        return sideMargin;
    }

    public double getBottomMargin() {
        return bottomMargin;
    }

    /**
     * Side of the page the number of the {@code ordinal}-th numbered page (0-based) goes on.
     */
    public Side sideFor(int ordinal) {
        if (!flipsSides || ordinal % 2 == 0) {
            return startingSide;
        }
        return startingSide.flip();
    }
}
