package com.gs.ep.spellbook.layout.table;

import com.gs.ep.spellbook.layout.Style;
import org.eclipse.collections.api.list.ListIterable;

/**
 * Wrapped lines of every cell of one table row.
 */
public final class RowPlan {

    private final ListIterable<? extends ListIterable<String>> cellLines;
    private final Style style;
    private final int lineCount;
    private final double height;

    public RowPlan(ListIterable<? extends ListIterable<String>> cellLines, Style style, double height) {
        this.cellLines = cellLines;
        this.style = style;
        this.lineCount = cellLines.collectInt(ListIterable::size).maxIfEmpty(0);
        this.height = height;
    }

    public int getCellCount() {
        return cellLines.size();
    }

    public ListIterable<String> lines(int column) {
        return cellLines.get(column);
    }

    public Style getStyle() {
        return style;
    }

    /**
     * Line count of the tallest cell.
     */
    public int getLineCount() {
        return lineCount;
    }

    public double getHeight() {
        return height;
    }
}
