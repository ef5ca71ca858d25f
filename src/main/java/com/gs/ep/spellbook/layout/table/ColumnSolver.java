package com.gs.ep.spellbook.layout.table;

import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.IntStream;

/**
 * Distributes a table's width over its columns. Columns are visited from the narrowest content
 * to the widest; a column whose content is narrower than the running equal share keeps its content
 * width and is centred, and the share it leaves unused is spread over the columns still unfixed.
 * Every other column gets the running share and is left aligned.
 */
public class ColumnSolver {

    private final double columnMargin;

    public ColumnSolver(double columnMargin) {
        this.columnMargin = columnMargin;
    }

    /**
     * @param contentWidths widest content of each column
     * @param nominalWidth width the table may take, margins between columns included
     * @param centreX horizontal centre the table is placed around
     */
    public ColumnPlan solve(double[] contentWidths, double nominalWidth, double centreX) {
        int count = contentWidths.length;
        double[] widths = new double[count];
        boolean[] centred = new boolean[count];
        if (count == 0) {
            return new ColumnPlan(widths, new double[0], centred, 0);
        }
        double margins = columnMargin * (count - 1);
        double defaultWidth = Math.max(0, (nominalWidth - margins) / count);
        int remaining = count;
        Integer[] order = IntStream.range(0, count).boxed().toArray(Integer[]::new);
        Arrays.sort(order, Comparator.comparingDouble(i -> contentWidths[i]));
        for (int column : order) {
            double content = contentWidths[column];
            if (content < defaultWidth) {
                widths[column] = content;
                centred[column] = true;
                remaining--;
                if (remaining > 0) {
                    defaultWidth += (defaultWidth - content) / remaining;
                }
            } else {
                widths[column] = defaultWidth;
            }
        }
        double tableWidth = Math.min(nominalWidth, Arrays.stream(widths).sum() + margins);
        double[] lefts = new double[count];
        double x = centreX - tableWidth / 2;
        for (int column = 0; column < count; column++) {
            lefts[column] = x;
            x += widths[column] + columnMargin;
        }
        return new ColumnPlan(widths, lefts, centred, tableWidth);
    }

    public double getColumnMargin() {
        return columnMargin;
    }
}
