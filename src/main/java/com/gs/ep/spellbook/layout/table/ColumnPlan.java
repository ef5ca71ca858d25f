package com.gs.ep.spellbook.layout.table;

import java.util.Arrays;

/**
 * Solved column layout of a table: width, left edge and alignment of every column.
 */
public final class ColumnPlan {

    private final double[] widths;
    private final double[] lefts;
    private final boolean[] centred;
    private final double tableWidth;

    ColumnPlan(double[] widths, double[] lefts, boolean[] centred, double tableWidth) {
        this.widths = widths.clone();
        this.lefts = lefts.clone();
        this.centred = centred.clone();
        this.tableWidth = tableWidth;
    }

    public int getColumnCount() {
        return widths.length;
    }

    public double width(int column) {
        return widths[column];
    }

    public double left(int column) {
        return lefts[column];
    }

    public double right(int column) {
        return lefts[column] + widths[column];
    }

    public boolean isCentred(int column) {
        return centred[column];
    }

    public double getTableWidth() {
        return tableWidth;
    }

    public double getTableLeft() {
        return lefts.length == 0 ? 0 : lefts[0];
    }

    public double getTableRight() {
        return lefts.length == 0 ? 0 : right(lefts.length - 1);
    }

    public double[] getWidths() {
        return widths.clone();
    }

    @Override
    public String toString() {
        return "ColumnPlan[widths=" + Arrays.toString(widths) + ", centred=" + Arrays.toString(centred)
                + ", tableWidth=" + tableWidth + "]";
    }
}
