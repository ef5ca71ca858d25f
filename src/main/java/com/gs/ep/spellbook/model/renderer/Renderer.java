package com.gs.ep.spellbook.model.renderer;

import com.gs.ep.spellbook.layout.Style;

import java.awt.Color;

/**
 * Drawing surface the layout engine writes to. Coordinates are millimetres measured from the
 * bottom-left corner of the page; text is positioned by its baseline.
 * <p>
 * Implementations report I/O failures as {@link java.io.UncheckedIOException}.
 */
public interface Renderer {

    /**
     * Appends a new page to the document, with the background image already drawn when one is configured.
     */
    PageHandle createPage(double width, double height);

    void drawText(PageHandle page, double x, double y, String text, Style style, double fontSize, Color color);

    void drawLineSegment(PageHandle page, double x1, double y1, double x2, double y2, Color color,
            double thickness);

    void addBookmark(String title, PageHandle page);

    int pageCount();
}
