package com.gs.ep.spellbook.layout.table;

import com.gs.ep.spellbook.layout.FlowRegion;
import com.gs.ep.spellbook.layout.LayoutOptions;
import com.gs.ep.spellbook.layout.LineWrapper;
import com.gs.ep.spellbook.layout.MetricsAdapter;
import com.gs.ep.spellbook.layout.PageCursor;
import com.gs.ep.spellbook.layout.Style;
import com.gs.ep.spellbook.layout.TableOptions;
import com.gs.ep.spellbook.layout.TextClass;
import com.gs.ep.spellbook.layout.TextFlowEngine;
import com.gs.ep.spellbook.model.renderer.Renderer;
import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lays out a {@link ParsedTable} at the cursor: title, column widths, wrapped cells, then two walks
 * over the rows, the first drawing the off-row shading and the second the cell text.
 */
public class TableLayoutEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(TableLayoutEngine.class);

    private static final Style HEADER_STYLE = Style.BOLD;
    private static final Style BODY_STYLE = Style.REGULAR;
    private static final Style TITLE_STYLE = Style.BOLD;

    private final TextFlowEngine textEngine;
    private final MetricsAdapter metrics;
    private final LineWrapper wrapper;
    private final LayoutOptions options;
    private final TableOptions tableOptions;
    private final ColumnSolver solver;

    public TableLayoutEngine(TextFlowEngine textEngine) {
        this.textEngine = textEngine;
        this.metrics = textEngine.getMetrics();
        this.wrapper = textEngine.getWrapper();
        this.options = metrics.getOptions();
        this.tableOptions = options.getTableOptions();
        this.solver = new ColumnSolver(tableOptions.getColumnMargin());
    }

    /**
     * Writes the table with its first line on the cursor and leaves the cursor on the table's last line.
     *
     * @return the column plan used, or null when nothing was written
     */
    public ColumnPlan layout(PageCursor cursor, ParsedTable table) {
        FlowRegion region = cursor.getRegion();
        if (region.isInert() || (table.getColumnCount() == 0 && !table.hasTitle())) {
            return null;
        }
        double outer = tableOptions.getOuterHorizontalMargin();
        double nominalLeft = region.getXMin() + outer;
        double nominalRight = region.getXMax() - outer;
        double nominalWidth = Math.max(0, nominalRight - nominalLeft);

        ColumnPlan plan = solver.solve(contentWidths(table), nominalWidth, (region.getXMin() + region.getXMax()) / 2);
        LOGGER.debug("Column plan for table '{}': {}", table.getTitle(), plan);
        MutableList<RowPlan> rows = planRows(table, plan);

        MutableList<String> titleLines = table.hasTitle()
                ? wrapper.wrap(table.getTitle(), nominalWidth, TITLE_STYLE, TextClass.TABLE_TITLE)
                : Lists.mutable.empty();
        double titleHeight = metrics.textHeight(titleLines.size(), TITLE_STYLE, TextClass.TABLE_TITLE);
        double totalHeight = titleHeight + gridHeight(rows) + (titleLines.notEmpty() && rows.notEmpty()
                ? tableOptions.getRowMargin() : 0);
        if (fitsOnePageButNotHere(cursor, totalHeight) || fitsOnePageButNotHere(cursor, titleHeight)) {
            LOGGER.debug("Table '{}' ({} mm) does not fit the {} mm left on page {}, starting a new page",
                    table.getTitle(), totalHeight, cursor.remainingHeight(), cursor.getPageIndex());
            cursor.breakPage();
        }

        cursor.begin();
        if (titleLines.notEmpty()) {
            textEngine.flowCentered(cursor, table.getTitle(), TITLE_STYLE, TextClass.TABLE_TITLE, nominalLeft,
                    nominalRight);
            if (rows.isEmpty()) {
                return plan;
            }
            cursor.moveDown(tableOptions.getRowMargin());
        }

        RowLineWalker walker = new RowLineWalker(rows, options.newlineAdvance(TextClass.TABLE_BODY),
                tableOptions.getRowMargin());
        PageCursor.Snapshot start = cursor.snapshot();
        walker.walk(cursor, new ShadingVisitor(plan, rows.size()));
        cursor.restore(start);
        walker.walk(cursor, new TextVisitor(plan, rows));
        cursor.setX(region.getXMin());
        return plan;
    }

    private boolean fitsOnePageButNotHere(PageCursor cursor, double height) {
        return height > cursor.remainingHeight() && height <= cursor.getRegion().getHeight();
    }

    private double[] contentWidths(ParsedTable table) {
        double[] widths = new double[table.getColumnCount()];
        for (int row = 0; row < table.getRowCount(); row++) {
            Style style = styleOf(table, row);
            for (int column = 0; column < widths.length; column++) {
                for (String line : wrapper.wrap(table.cell(row, column), Double.POSITIVE_INFINITY, style,
                        TextClass.TABLE_BODY)) {
                    widths[column] = Math.max(widths[column], metrics.width(line, style, TextClass.TABLE_BODY));
                }
            }
        }
        return widths;
    }

    private MutableList<RowPlan> planRows(ParsedTable table, ColumnPlan plan) {
        MutableList<RowPlan> rows = Lists.mutable.empty();
        for (int row = 0; row < table.getRowCount(); row++) {
            Style style = styleOf(table, row);
            MutableList<MutableList<String>> cells = Lists.mutable.empty();
            for (int column = 0; column < table.getColumnCount(); column++) {
                cells.add(wrapper.wrap(table.cell(row, column), plan.width(column), style, TextClass.TABLE_BODY));
            }
            int lineCount = cells.collectInt(MutableList::size).maxIfEmpty(0);
            rows.add(new RowPlan(cells, style, metrics.textHeight(lineCount, style, TextClass.TABLE_BODY)));
        }
        return rows;
    }

    private double gridHeight(ListIterable<RowPlan> rows) {
        if (rows.isEmpty()) {
            return 0;
        }
        return rows.sumOfDouble(RowPlan::getHeight) + (rows.size() - 1) * tableOptions.getRowMargin();
    }

    private static Style styleOf(ParsedTable table, int row) {
        return table.isHeaderRow(row) ? HEADER_STYLE : BODY_STYLE;
    }

    /**
     * Grid rows with an odd index are off rows.
     */
    static boolean isOffRow(int row) {
        return row % 2 == 1;
    }

    private final class ShadingVisitor implements RowLineWalker.LineVisitor {

        private final ColumnPlan plan;
        private final int[] shadedLines;

        ShadingVisitor(ColumnPlan plan, int rowCount) {
            this.plan = plan;
            this.shadedLines = new int[rowCount];
        }

        @Override
        public void visit(int row, int column, int lineIndex, PageCursor cursor) {
            if (!isOffRow(row) || lineIndex < shadedLines[row]) {
                return;
            }
            shadedLines[row] = lineIndex + 1;
            double y = cursor.getY() + options.fontSize(TextClass.TABLE_BODY) * tableOptions.getShadingYAdjustScalar();
            double thickness = options.newlineAdvance(TextClass.TABLE_BODY) * tableOptions.getShadingHeightScalar();
            double outer = tableOptions.getOuterHorizontalMargin();
            Renderer renderer = cursor.getSequence().getRenderer();
            renderer.drawLineSegment(cursor.currentPage(), plan.getTableLeft() - outer, y,
                    plan.getTableRight() + outer, y, tableOptions.getOffRowColor(), thickness);
        }
    }

    private final class TextVisitor implements RowLineWalker.LineVisitor {

        private final ColumnPlan plan;
        private final ListIterable<RowPlan> rows;

        TextVisitor(ColumnPlan plan, ListIterable<RowPlan> rows) {
            this.plan = plan;
            this.rows = rows;
        }

        @Override
        public void visit(int row, int column, int lineIndex, PageCursor cursor) {
            RowPlan rowPlan = rows.get(row);
            String line = rowPlan.lines(column).get(lineIndex);
            if (line.isEmpty()) {
                return;
            }
            Style style = rowPlan.getStyle();
            double width = metrics.width(line, style, TextClass.TABLE_BODY);
            double x = plan.isCentred(column)
                    ? plan.left(column) + (plan.width(column) - width) / 2
                    : plan.left(column);
            cursor.setX(x + width);
            cursor.getSequence().getRenderer().drawText(cursor.currentPage(), x, cursor.getY(), line, style,
                    options.fontSize(TextClass.TABLE_BODY), options.color(TextClass.TABLE_BODY));
        }
    }
}
