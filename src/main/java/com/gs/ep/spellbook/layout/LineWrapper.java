package com.gs.ep.spellbook.layout;

import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Greedy word wrapping of whitespace separated tokens in a single style. Tokens are never broken,
 * so a token wider than the available width sits alone on its line.
 */
public class LineWrapper {

    private final MetricsAdapter metrics;

    public LineWrapper(MetricsAdapter metrics) {
        this.metrics = metrics;
    }

    public MutableList<String> wrap(String text, double width, Style style, TextClass textClass) {
        return wrap(text, width, width, style, textClass);
    }

    /**
     * Wraps the text, measuring the first line against {@code firstLineWidth} so a caller can resume
     * on a partly filled line. When the first token does not fit that remainder but would fit a full
     * line, an empty first line is returned ahead of it.
     */
    public MutableList<String> wrap(String text, double firstLineWidth, double width, Style style,
            TextClass textClass) {
        MutableList<String> lines = Lists.mutable.empty();
        StringBuilder line = null;
        double available = firstLineWidth;
        for (String token : tokens(text)) {
            String word = Escapes.unescape(token);
            if (line == null) {
                if (firstLineWidth < width && metrics.width(word, style, textClass) > firstLineWidth) {
                    lines.add("");
                    available = width;
                }
                line = new StringBuilder(word);
                continue;
            }
            if (metrics.width(line + " " + word, style, textClass) <= available) {
                line.append(' ').append(word);
            } else {
                lines.add(line.toString());
                line = new StringBuilder(word);
                available = width;
            }
        }
        if (line != null) {
            lines.add(line.toString());
        }
        return lines;
    }

    public static MutableList<String> tokens(String text) {
        MutableList<String> tokens = Lists.mutable.empty();
        for (String token : text.trim().split("\\s+")) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }
}
