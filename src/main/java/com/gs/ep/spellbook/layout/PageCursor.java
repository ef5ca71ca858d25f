package com.gs.ep.spellbook.layout;

import com.gs.ep.spellbook.model.renderer.PageHandle;

/**
 * Current write position inside a {@link FlowRegion}, together with the {@link FlowSequence} of
 * pages it moves through. A cursor is owned by whoever is writing the current block.
 * <p>
 * The first line after {@link #begin()} is placed at the current position; every later line moves
 * down by the advance it is given. Falling below the bottom of the region moves the cursor to the
 * top of the next page of the sequence, creating that page when needed.
 */
public class PageCursor {

    private final FlowRegion region;
    private final FlowSequence sequence;
    private double x;
    private double y;
    private int pageIndex;
    private boolean started;
    private double hangingIndent;

    public PageCursor(FlowRegion region, FlowSequence sequence) {
        this.region = region;
        this.sequence = sequence;
        this.x = region.getXMin();
        this.y = region.getYMax();
    }

    /**
     * Marks the start of a new block: the next line lands on the current y.
     */
    public void begin() {
        this.started = false;
    }

    public void advanceLine(double advance) {
        if (started) {
            y -= advance;
        }
        started = true;
        checkForNewPage();
    }

    /**
     * Places the next line on the current visual line without moving down.
     */
    public void continueLine() {
        started = true;
        checkForNewPage();
    }

    /**
     * Moves down by {@code amount} and starts a new block at {@code newX}. The page break, if any,
     * happens when the next line is placed.
     */
    public void newLine(double amount, double newX) {
        y -= amount;
        x = newX;
        started = false;
    }

    public void moveDown(double amount) {
        y -= amount;
    }

    public void moveTo(double newX, double newY) {
        x = newX;
        y = newY;
        started = false;
    }

    /**
     * Continues at the top of the next page of the sequence.
     */
    public void breakPage() {
        pageIndex++;
        sequence.page(pageIndex);
        x = region.getXMin();
        y = region.getYMax();
        started = false;
    }

    private void checkForNewPage() {
        if (y < region.getYMin()) {
            pageIndex++;
            sequence.page(pageIndex);
            y = region.getYMax();
        }
    }

    /**
     * Starts a bullet list: wrapped lines return to {@code hangingIndent} right of the left edge
     * until {@link #endList()}.
     */
    public void startList(double hangingIndent) {
        this.hangingIndent = hangingIndent;
    }

    public void endList() {
        this.hangingIndent = 0;
    }

    public boolean isInList() {
        return hangingIndent > 0;
    }

    /**
     * X that wrapped lines return to.
     */
    public double getLineStart() {
        return region.getXMin() + hangingIndent;
    }

    public PageHandle currentPage() {
        return sequence.page(pageIndex);
    }

    public Snapshot snapshot() {
        return new Snapshot(x, y, pageIndex, started);
    }

    public void restore(Snapshot snapshot) {
        this.x = snapshot.x;
        this.y = snapshot.y;
        this.pageIndex = snapshot.pageIndex;
        this.started = snapshot.started;
    }

    /**
     * Space left on the current page before the cursor would cross the bottom of the region.
     */
    public double remainingHeight() {
        return y - region.getYMin();
    }

    public FlowRegion getRegion() {
        return region;
    }

    public FlowSequence getSequence() {
        return sequence;
    }

    public double getX() {
        return x;
    }

    public void setX(double x) {
        this.x = x;
    }

    public double getY() {
        return y;
    }

    public int getPageIndex() {
        return pageIndex;
    }

    public boolean isStarted() {
        return started;
    }

    /**
     * Saved cursor state a table pass or a table cell can be replayed from.
     */
    public static final class Snapshot {

        private final double x;
        private final double y;
        private final int pageIndex;
        private final boolean started;

        private Snapshot(double x, double y, int pageIndex, boolean started) {
            this.x = x;
            this.y = y;
            this.pageIndex = pageIndex;
            this.started = started;
        }

        public double getX() {
            return x;
        }

        public double getY() {
            return y;
        }

        public int getPageIndex() {
            return pageIndex;
        }

        public boolean isStarted() {
            return started;
        }
    }
}
