package com.gs.ep.spellbook.layout;

import com.gs.ep.spellbook.model.renderer.Renderer;
import org.eclipse.collections.api.list.MutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Color;

/**
 * Flows paragraph structured text through a {@link PageCursor}. Paragraphs are separated by
 * {@code '\n'}; every paragraph after the first starts on a new line indented by the tab amount.
 * Flowing resumes at the cursor, so text can continue on the same visual line as whatever was
 * written before it.
 * <p>
 * A paragraph whose first word is {@code •} or {@code -} is a bullet item; consecutive items form a
 * list that is separated from the surrounding paragraphs by an extra line.
 */
public class TextFlowEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(TextFlowEngine.class);

    static final String BULLET_DOT = "\u2022";
    static final String BULLET_DASH = "-";
    static final String BULLET = BULLET_DOT + " ";

    private final MetricsAdapter metrics;
    private final LineWrapper wrapper;
    private final LayoutOptions options;

    public TextFlowEngine(MetricsAdapter metrics) {
        this.metrics = metrics;
        this.wrapper = new LineWrapper(metrics);
        this.options = metrics.getOptions();
    }

    public void flow(PageCursor cursor, String text, Style style, TextClass textClass) {
        FlowRegion region = cursor.getRegion();
        if (region.isInert() || text.isEmpty()) {
            return;
        }
        double newline = options.newlineAdvance(textClass);
        double indent = region.getXMin() + options.getTabAmount();
        String[] paragraphs = text.split("\n", -1);
        if (cursor.getX() > region.getXMax()) {
            cursor.newLine(newline, cursor.isInList() ? cursor.getLineStart() : indent);
        }
        for (int p = 0; p < paragraphs.length; p++) {
            MutableList<String> tokens = LineWrapper.tokens(paragraphs[p]);
            if (tokens.isEmpty()) {
                continue;
            }
            boolean startsLine = p > 0 || !cursor.isStarted();
            if (startsLine && isBullet(tokens.getFirst())) {
                flowBulletItem(cursor, tokens, p > 0, style, textClass);
                continue;
            }
            if (startsLine && cursor.isInList()) {
                cursor.endList();
                cursor.moveDown(newline);
            }
            if (p > 0) {
                cursor.newLine(newline, indent);
            }
            MutableList<String> lines = wrapper.wrap(paragraphs[p], region.getXMax() - cursor.getX(),
                    region.getXMax() - cursor.getLineStart(), style, textClass);
            writeLines(cursor, lines, null, style, textClass);
        }
    }

    /**
     * A bullet item starts at the left edge with {@value #BULLET}, whichever bullet character the
     * markup used, and its wrapped lines hang under the text after the bullet. A list is set one
     * extra line apart from the paragraph before it.
     */
    private void flowBulletItem(PageCursor cursor, MutableList<String> tokens, boolean newParagraph, Style style,
            TextClass textClass) {
        FlowRegion region = cursor.getRegion();
        double newline = options.newlineAdvance(textClass);
        if (!cursor.isInList()) {
            cursor.startList(metrics.width(BULLET, style, textClass));
            if (newParagraph) {
                cursor.moveDown(newline);
            }
        }
        if (newParagraph) {
            cursor.newLine(newline, region.getXMin());
        } else {
            cursor.setX(region.getXMin());
        }
        double width = region.getXMax() - cursor.getLineStart();
        String rest = String.join(" ", tokens.subList(1, tokens.size()));
        writeLines(cursor, wrapper.wrap(rest, width, width, style, textClass), BULLET, style, textClass);
    }

    private void writeLines(PageCursor cursor, MutableList<String> lines, String prefix, Style style,
            TextClass textClass) {
        double newline = options.newlineAdvance(textClass);
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (i == 0) {
                cursor.continueLine();
                if (prefix != null) {
                    line = prefix + line;
                }
            } else {
                cursor.setX(cursor.getLineStart());
                cursor.advanceLine(newline);
            }
            draw(cursor, cursor.getX(), line, style, textClass);
            cursor.setX(cursor.getX() + metrics.width(line, style, textClass));
        }
        if (lines.isEmpty() && prefix != null) {
            cursor.continueLine();
            draw(cursor, cursor.getX(), prefix, style, textClass);
            cursor.setX(cursor.getX() + metrics.width(prefix, style, textClass));
        }
    }

    static boolean isBullet(String token) {
        return BULLET_DOT.equals(token) || BULLET_DASH.equals(token);
    }

    /**
     * Writes the text centred between {@code xMin} and {@code xMax}, one wrapped line under the other.
     * The first line lands on the cursor when the cursor has just begun a block.
     *
     * @return number of lines written
     */
    public int flowCentered(PageCursor cursor, String text, Style style, TextClass textClass, double xMin,
            double xMax) {
        if (cursor.getRegion().isInert() || xMin >= xMax) {
            return 0;
        }
        double newline = options.newlineAdvance(textClass);
        MutableList<String> lines = wrapper.wrap(text, xMax - xMin, style, textClass);
        for (String line : lines) {
            cursor.advanceLine(newline);
            double width = metrics.width(line, style, textClass);
            double x = xMin + (xMax - xMin - width) / 2;
            draw(cursor, x, line, style, textClass);
            cursor.setX(x + width);
        }
        return lines.size();
    }

    private void draw(PageCursor cursor, double x, String line, Style style, TextClass textClass) {
        if (line.isEmpty()) {
            return;
        }
        Renderer renderer = cursor.getSequence().getRenderer();
        Color color = options.color(textClass);
        LOGGER.trace("Line '{}' at ({}, {}) on page {}", line, x, cursor.getY(), cursor.getPageIndex());
        renderer.drawText(cursor.currentPage(), x, cursor.getY(), line, style, options.fontSize(textClass), color);
    }

    public LineWrapper getWrapper() {
        return wrapper;
    }

    public MetricsAdapter getMetrics() {
        return metrics;
    }
}
