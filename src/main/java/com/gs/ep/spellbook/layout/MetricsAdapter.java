package com.gs.ep.spellbook.layout;

import java.util.EnumMap;
import java.util.Map;

/**
 * Converts raw font metrics into millimetres for a given {@link Style} and {@link TextClass}.
 * The per-style scalar of {@link LayoutOptions} turns points into millimetres and absorbs any
 * systematic difference between measured and rendered glyph widths.
 */
public class MetricsAdapter {

    private final LayoutOptions options;
    private final Map<Style, FontMetrics> metrics;

    /**
     * @throws MetricsUnavailableException if no metrics were supplied for one of the styles
     */
    public MetricsAdapter(LayoutOptions options, Map<Style, ? extends FontMetrics> metrics)
            throws MetricsUnavailableException {
        this.options = options;
        this.metrics = new EnumMap<>(Style.class);
        for (Style style : Style.values()) {
            FontMetrics fontMetrics = metrics.get(style);
            if (fontMetrics == null) {
                throw new MetricsUnavailableException(style, "No font metrics for style " + style.getDisplayName());
            }
            this.metrics.put(style, fontMetrics);
        }
    }

    public LayoutOptions getOptions() {
        return options;
    }

    public double width(String text, Style style, TextClass textClass) {
        return width(text, style, options.fontSize(textClass));
    }

    public double width(String text, Style style, double fontSize) {
        if (text.isEmpty()) {
            return 0;
        }
        return metrics.get(style).advanceWidth(text) / 1000.0 * fontSize * options.scalar(style);
    }

    public double spaceWidth(Style style, TextClass textClass) {
        return width(" ", style, textClass);
    }

    /**
     * Height of one line of text, without the spacing between lines.
     */
    public double lineHeight(Style style, TextClass textClass) {
        FontMetrics fontMetrics = metrics.get(style);
        return (fontMetrics.ascent() - fontMetrics.descent()) / 1000.0 * options.fontSize(textClass)
                * options.scalar(style);
    }

    /**
     * Height of {@code lineCount} stacked lines: the newline advances between them plus one line height.
     */
    public double textHeight(int lineCount, Style style, TextClass textClass) {
        if (lineCount <= 0) {
            return 0;
        }
        return (lineCount - 1) * options.newlineAdvance(textClass) + lineHeight(style, textClass);
    }
}
