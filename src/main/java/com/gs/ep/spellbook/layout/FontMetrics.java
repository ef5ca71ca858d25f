package com.gs.ep.spellbook.layout;

/**
 * Raw metrics of one loaded font. All values are in glyph space, i.e. thousandths of
 * an em, so they scale linearly with the font size.
 */
public interface FontMetrics {

    /**
     * Sum of the glyph advances of the string at zero tracking.
     */
    double advanceWidth(String text);

    double ascent();

    /**
     * Distance below the baseline, normally negative.
     */
    double descent();
}
