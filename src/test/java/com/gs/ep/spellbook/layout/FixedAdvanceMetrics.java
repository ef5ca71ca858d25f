package com.gs.ep.spellbook.layout;

import java.util.EnumMap;
import java.util.Map;

/**
 * Every character advances by the same amount, ascent 700 and descent -200.
 */
public class FixedAdvanceMetrics implements FontMetrics {

    private final double advance;

    public FixedAdvanceMetrics(double advance) {
        this.advance = advance;
    }

    public static Map<Style, FontMetrics> forAllStyles(double advance) {
        Map<Style, FontMetrics> metrics = new EnumMap<>(Style.class);
        for (Style style : Style.values()) {
            metrics.put(style, new FixedAdvanceMetrics(advance));
        }
        return metrics;
    }

    @Override
    public double advanceWidth(String text) {
        return text.codePointCount(0, text.length()) * advance;
    }

    @Override
    public double ascent() {
        return 700;
    }

    @Override
    public double descent() {
        return -200;
    }
}
