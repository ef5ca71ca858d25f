package com.gs.ep.spellbook.layout;

import java.awt.Color;
import java.util.EnumMap;
import java.util.Map;

/**
 * Everything the layout engine needs to know about a document's appearance. Built once through
 * {@link Builder} and shared read-only by every component for the lifetime of a document.
 */
public final class LayoutOptions {

    public static final double DEFAULT_SCALAR = 0.3528;
    public static final Color DEFAULT_HEADER_COLOR = new Color(115, 26, 26);

    private final PageGeometry pageGeometry;
    private final Map<TextClass, TextClassSpec> textClasses;
    private final Map<Style, Double> scalars;
    private final double tabAmount;
    private final TableOptions tableOptions;
    private final PageNumberOptions pageNumberOptions;
    private final String backgroundImagePath;

    private LayoutOptions(Builder builder) {
        this.pageGeometry = builder.pageGeometry;
        this.textClasses = new EnumMap<>(builder.textClasses);
        this.scalars = new EnumMap<>(builder.scalars);
        this.tabAmount = builder.tabAmount;
        this.tableOptions = builder.tableOptions;
        this.pageNumberOptions = builder.pageNumberOptions;
        this.backgroundImagePath = builder.backgroundImagePath;
    }

    public static LayoutOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public PageGeometry getPageGeometry() {
        return pageGeometry;
    }

    public FlowRegion textRegion() {
        return pageGeometry.textRegion();
    }

    public TextClassSpec textClass(TextClass textClass) {
        return textClasses.get(textClass);
    }

    public double fontSize(TextClass textClass) {
        return textClasses.get(textClass).getFontSize();
    }

    public double newlineAdvance(TextClass textClass) {
        return textClasses.get(textClass).getNewlineAdvance();
    }

    public Color color(TextClass textClass) {
        return textClasses.get(textClass).getColor();
    }

    public double scalar(Style style) {
        return scalars.get(style);
    }

    public double getTabAmount() {
        return tabAmount;
    }

    public TableOptions getTableOptions() {
        return tableOptions;
    }

    /**
     * @return page number options, or {@code null} when pages are not numbered
     */
    public PageNumberOptions getPageNumberOptions() {
        return pageNumberOptions;
    }

    /**
     * @return path of the image drawn behind every page, or {@code null} for plain pages
     */
    public String getBackgroundImagePath() {
        return backgroundImagePath;
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.pageGeometry = pageGeometry;
        builder.textClasses.putAll(textClasses);
        builder.scalars.putAll(scalars);
        builder.tabAmount = tabAmount;
        builder.tableOptions = tableOptions;
        builder.pageNumberOptions = pageNumberOptions;
        builder.backgroundImagePath = backgroundImagePath;
        return builder;
    }

    public static final class Builder {

        private PageGeometry pageGeometry = new PageGeometry(210, 297, 10, 10, 10, 10);
        private final Map<TextClass, TextClassSpec> textClasses = new EnumMap<>(TextClass.class);
        private final Map<Style, Double> scalars = new EnumMap<>(Style.class);
        private double tabAmount = 7.5;
        private TableOptions tableOptions =
                new TableOptions(10, 8, 4, 12, new Color(213, 209, 224), 1.4, 0.1075);
        private PageNumberOptions pageNumberOptions;
        private String backgroundImagePath;

        private Builder() {
            textClasses.put(TextClass.TITLE, new TextClassSpec(32, 12, Color.BLACK));
            textClasses.put(TextClass.HEADER, new TextClassSpec(24, 8, DEFAULT_HEADER_COLOR));
            textClasses.put(TextClass.BODY, new TextClassSpec(12, 5, Color.BLACK));
            textClasses.put(TextClass.TABLE_TITLE, new TextClassSpec(16, 6.4, Color.BLACK));
            textClasses.put(TextClass.TABLE_BODY, new TextClassSpec(12, 5, Color.BLACK));
            for (Style style : Style.values()) {
                scalars.put(style, DEFAULT_SCALAR);
            }
        }

        public Builder pageGeometry(PageGeometry pageGeometry) {
            this.pageGeometry = pageGeometry;
            return this;
        }

        public Builder textClass(TextClass textClass, TextClassSpec spec) {
            this.textClasses.put(textClass, spec);
            return this;
        }

        public Builder scalar(Style style, double scalar) {
            this.scalars.put(style, scalar);
            return this;
        }

        public Builder tabAmount(double tabAmount) {
            this.tabAmount = tabAmount;
            return this;
        }

        public Builder tableOptions(TableOptions tableOptions) {
            this.tableOptions = tableOptions;
            return this;
        }

        public Builder pageNumberOptions(PageNumberOptions pageNumberOptions) {
            this.pageNumberOptions = pageNumberOptions;
            return this;
        }

        public Builder backgroundImagePath(String backgroundImagePath) {
            this.backgroundImagePath = backgroundImagePath;
            return this;
        }

        /**
         * @throws ConfigurationException if a part is missing or a value is out of range
         */
        public LayoutOptions build() {
            if (pageGeometry == null) {
                throw new ConfigurationException("Page geometry is required");
            }
            if (tableOptions == null) {
                throw new ConfigurationException("Table options are required");
            }
            for (TextClass textClass : TextClass.values()) {
                if (textClasses.get(textClass) == null) {
                    throw new ConfigurationException("No settings for text class " + textClass);
                }
            }
            for (Style style : Style.values()) {
                Double scalar = scalars.get(style);
                if (scalar == null || !PageGeometry.isNonNegative(scalar)) {
                    throw new ConfigurationException("Invalid scalar for style " + style + ": " + scalar);
                }
            }
            if (!PageGeometry.isNonNegative(tabAmount)) {
                throw new ConfigurationException("Invalid tab amount: " + tabAmount);
            }
            return new LayoutOptions(this);
        }
    }
}
