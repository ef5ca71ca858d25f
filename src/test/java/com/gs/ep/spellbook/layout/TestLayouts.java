package com.gs.ep.spellbook.layout;

import java.awt.Color;

/**
 * Options under which one character of any style measures exactly 1 mm: every font is 8 pt and
 * every scalar 0.25, so with 500-unit advances a string is as wide as it is long. Lines are 5 mm apart.
 */
public final class TestLayouts {

    public static final double LINE_HEIGHT = 1.8;

    private TestLayouts() {
    }

    public static LayoutOptions.Builder builder() {
        LayoutOptions.Builder builder = LayoutOptions.builder();
        for (TextClass textClass : TextClass.values()) {
            builder.textClass(textClass, new TextClassSpec(8, 5, Color.BLACK));
        }
        for (Style style : Style.values()) {
            builder.scalar(style, 0.25);
        }
        return builder.tabAmount(4);
    }

    public static LayoutOptions options() {
        return builder().build();
    }

    public static MetricsAdapter metrics(LayoutOptions options) {
        try {
            return new MetricsAdapter(options, FixedAdvanceMetrics.forAllStyles(500));
        } catch (MetricsUnavailableException e) {
            throw new AssertionError(e);
        }
    }

    public static MetricsAdapter metrics() {
        return metrics(options());
    }

    public static PageCursor cursor(RecordingRenderer renderer, FlowRegion region) {
        FlowSequence sequence = FlowSequence.onNewPage(renderer, new PageGeometry(210, 297, 10, 10, 10, 10));
        return new PageCursor(region, sequence);
    }
}
