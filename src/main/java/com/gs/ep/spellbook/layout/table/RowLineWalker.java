package com.gs.ep.spellbook.layout.table;

import com.gs.ep.spellbook.layout.PageCursor;
import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Walks every line of every cell of a table through a {@link PageCursor}. Each cell starts from the
 * top of its row and a row ends where its longest cell ends, so walking twice from the same cursor
 * snapshot visits identical positions. Shading and text are both drawn from such walks.
 */
public class RowLineWalker {

    /**
     * Called with the cursor placed on the line about to be drawn.
     */
    public interface LineVisitor {
        void visit(int row, int column, int lineIndex, PageCursor cursor);
    }

    private final ListIterable<RowPlan> rows;
    private final double newlineAdvance;
    private final double rowMargin;

    public RowLineWalker(ListIterable<RowPlan> rows, double newlineAdvance, double rowMargin) {
        this.rows = rows;
        this.newlineAdvance = newlineAdvance;
        this.rowMargin = rowMargin;
    }

    public ListIterable<RowTrace> walk(PageCursor cursor, LineVisitor visitor) {
        MutableList<RowTrace> traces = Lists.mutable.empty();
        for (int row = 0; row < rows.size(); row++) {
            if (row > 0) {
                cursor.moveDown(rowMargin);
            }
            cursor.begin();
            PageCursor.Snapshot rowStart = cursor.snapshot();
            PageCursor.Snapshot rowEnd = rowStart;
            int visited = 0;
            int firstPage = -1;
            RowPlan plan = rows.get(row);
            for (int column = 0; column < plan.getCellCount(); column++) {
                cursor.restore(rowStart);
                int lineCount = plan.lines(column).size();
                for (int line = 0; line < lineCount; line++) {
                    cursor.advanceLine(newlineAdvance);
                    if (firstPage < 0) {
                        firstPage = cursor.getPageIndex();
                    }
                    visitor.visit(row, column, line, cursor);
                    visited++;
                }
                if (lineCount > 0 && endsLater(cursor, rowEnd, rowStart)) {
                    rowEnd = cursor.snapshot();
                }
            }
            cursor.restore(rowEnd);
            traces.add(new RowTrace(visited, firstPage));
        }
        return traces;
    }

    private static boolean endsLater(PageCursor cursor, PageCursor.Snapshot rowEnd, PageCursor.Snapshot rowStart) {
        if (rowEnd == rowStart || cursor.getPageIndex() > rowEnd.getPageIndex()) {
            return true;
        }
        return cursor.getPageIndex() == rowEnd.getPageIndex() && cursor.getY() < rowEnd.getY();
    }

    /**
     * What one walk saw of a row: the lines visited over all its cells and the page of its first line,
     * or -1 for a row without lines.
     */
    public static final class RowTrace {

        private final int lineCount;
        private final int firstPageIndex;

        RowTrace(int lineCount, int firstPageIndex) {
            this.lineCount = lineCount;
            this.firstPageIndex = firstPageIndex;
        }

        public int getLineCount() {
            return lineCount;
        }

        public int getFirstPageIndex() {
            return firstPageIndex;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof RowTrace)) {
                return false;
            }
            RowTrace other = (RowTrace) o;
            return lineCount == other.lineCount && firstPageIndex == other.firstPageIndex;
        }

        @Override
        public int hashCode() {
            return 31 * lineCount + firstPageIndex;
        }

        @Override
        public String toString() {
            return "RowTrace[lines=" + lineCount + ", firstPage=" + firstPageIndex + "]";
        }
    }
}
