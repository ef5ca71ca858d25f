package com.gs.ep.spellbook.layout.table;

import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * A table ready for layout: an optional title and a rectangular grid of cell texts. When the table
 * has a header row it is row 0 of the grid.
 */
public final class ParsedTable {

    private static final Logger LOGGER = LoggerFactory.getLogger(ParsedTable.class);

    private final String title;
    private final boolean hasHeader;
    private final MutableList<MutableList<String>> grid;
    private final int columnCount;

    private ParsedTable(String title, boolean hasHeader, MutableList<MutableList<String>> grid) {
        this.title = title == null ? "" : title.trim();
        this.hasHeader = hasHeader;
        this.columnCount = grid.collectInt(List::size).maxIfEmpty(0);
        if (grid.anySatisfy(row -> row.size() != columnCount)) {
            LOGGER.warn("Jagged table '{}', padding rows to {} columns", this.title, columnCount);
        }
        for (MutableList<String> row : grid) {
            while (row.size() < columnCount) {
                row.add("");
            }
        }
        this.grid = grid;
    }

    /**
     * Builds a table from already separated cells. Rows shorter than the widest row are padded with
     * empty cells.
     *
     * @param columnLabels header cells, or an empty list for a table without a header
     */
    public static ParsedTable of(String title, List<String> columnLabels, List<? extends List<String>> rows) {
        MutableList<MutableList<String>> grid = Lists.mutable.empty();
        boolean hasHeader = columnLabels != null && !columnLabels.isEmpty();
        if (hasHeader) {
            grid.add(Lists.mutable.withAll(columnLabels));
        }
        if (rows != null) {
            for (List<String> row : rows) {
                grid.add(Lists.mutable.withAll(row));
            }
        }
        return new ParsedTable(title, hasHeader, grid);
    }

    public String getTitle() {
        return title;
    }

    public boolean hasTitle() {
        return !title.isEmpty();
    }

    public boolean hasHeader() {
        return hasHeader;
    }

    public int getColumnCount() {
        return columnCount;
    }

    public int getRowCount() {
        return grid.size();
    }

    public String cell(int row, int column) {
        return grid.get(row).get(column);
    }

    public ListIterable<String> row(int row) {
        return grid.get(row).asUnmodifiable();
    }

    public boolean isHeaderRow(int row) {
        return hasHeader && row == 0;
    }
}
