package com.gs.ep.spellbook.layout;

import com.gs.ep.spellbook.model.renderer.FontPaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Color;
import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Properties;

/**
 * Loads layout settings from config.properties on the classpath. Every key is optional; missing
 * keys take the values of {@link LayoutOptions#defaults()}.
 */
public class LayoutConfig {

    private static final Logger LOGGER = LoggerFactory.getLogger(LayoutConfig.class);
    private static final String DEFAULT_CONFIG = "config.properties";
    public static final String DEFAULT_TITLE = "Spellbook";

    private final Properties properties = new Properties();

    public LayoutConfig() {
        this(DEFAULT_CONFIG);
    }

    public LayoutConfig(String configPath) {
        try (InputStream input = getClass().getClassLoader().getResourceAsStream(configPath)) {
            if (input == null) {
                LOGGER.warn("Unable to find {}, using default layout settings", configPath);
                return;
            }
            properties.load(input);
        } catch (IOException ex) {
            throw new ConfigurationException("Unable to read " + configPath, ex);
        }
    }

    public LayoutConfig(Properties properties) {
        this.properties.putAll(properties);
    }

    public String getTitle() {
        return properties.getProperty("spellbook.title", DEFAULT_TITLE);
    }

    public FontPaths getFontPaths() {
        FontPaths.Builder builder = FontPaths.builder();
        for (Style style : Style.values()) {
            String path = properties.getProperty("font.path." + key(style));
            if (path != null && !path.trim().isEmpty()) {
                builder.path(style, path.trim());
            }
        }
        return builder.build();
    }

    /**
     * @throws ConfigurationException if a value cannot be parsed or is out of range
     */
    public LayoutOptions toLayoutOptions() {
        LayoutOptions defaults = LayoutOptions.defaults();
        LayoutOptions.Builder builder = defaults.toBuilder();

        PageGeometry page = defaults.getPageGeometry();
        builder.pageGeometry(new PageGeometry(
                getDouble("page.width", page.getWidth()),
                getDouble("page.height", page.getHeight()),
                getDouble("page.margin.left", page.getLeftMargin()),
                getDouble("page.margin.right", page.getRightMargin()),
                getDouble("page.margin.top", page.getTopMargin()),
                getDouble("page.margin.bottom", page.getBottomMargin())));

        for (TextClass textClass : TextClass.values()) {
            String prefix = "text." + key(textClass) + ".";
            TextClassSpec spec = defaults.textClass(textClass);
            builder.textClass(textClass, new TextClassSpec(
                    getDouble(prefix + "size", spec.getFontSize()),
                    getDouble(prefix + "newline", spec.getNewlineAdvance()),
                    getColor(prefix + "color", spec.getColor())));
        }
        for (Style style : Style.values()) {
            builder.scalar(style, getDouble("scalar." + key(style), defaults.scalar(style)));
        }
        builder.tabAmount(getDouble("tab.amount", defaults.getTabAmount()));

        TableOptions table = defaults.getTableOptions();
        builder.tableOptions(new TableOptions(
                getDouble("table.margin.column", table.getColumnMargin()),
                getDouble("table.margin.row", table.getRowMargin()),
                getDouble("table.margin.outer.horizontal", table.getOuterHorizontalMargin()),
                getDouble("table.margin.outer.vertical", table.getOuterVerticalMargin()),
                getColor("table.offrow.color", table.getOffRowColor()),
                getDouble("table.offrow.height_scalar", table.getShadingHeightScalar()),
                getDouble("table.offrow.y_adjust_scalar", table.getShadingYAdjustScalar())));

        if (getBoolean("pagenumbers.enabled", false)) {
            builder.pageNumberOptions(new PageNumberOptions(
                    getSide("pagenumbers.side", PageNumberOptions.Side.LEFT),
                    getBoolean("pagenumbers.flip", true),
                    getInt("pagenumbers.start", 1),
                    Style.fromName(properties.getProperty("pagenumbers.style", Style.REGULAR.name())),
                    getDouble("pagenumbers.size", 12),
                    getColor("pagenumbers.color", Color.BLACK),
                    getDouble("pagenumbers.margin.side", 8),
                    getDouble("pagenumbers.margin.bottom", 5)));
        }
        String background = properties.getProperty("background.image");
        if (background != null && !background.trim().isEmpty()) {
            builder.backgroundImagePath(background.trim());
        }
        return builder.build();
    }

    private static String key(Enum<?> value) {
        return value.name().toLowerCase(Locale.ROOT);
    }

    private double getDouble(String key, double defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        double number;
        try {
            number = Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid number for " + key + ": " + value, e);
        }
        if (!Double.isFinite(number)) {
            throw new ConfigurationException("Invalid number for " + key + ": " + value);
        }
        return number;
    }

    private int getInt(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid integer for " + key + ": " + value, e);
        }
    }

    private boolean getBoolean(String key, boolean defaultValue) {
        return Boolean.parseBoolean(properties.getProperty(key, String.valueOf(defaultValue)).trim());
    }

    private PageNumberOptions.Side getSide(String key, PageNumberOptions.Side defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            return PageNumberOptions.Side.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid side for " + key + ": " + value, e);
        }
    }

    /**
     * Colours are written as {@code r,g,b} with components from 0 to 255.
     */
    private Color getColor(String key, Color defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        String[] parts = value.split(",");
        if (parts.length != 3) {
            throw new ConfigurationException("Invalid colour for " + key + ", expected r,g,b: " + value);
        }
        try {
            return new Color(Integer.parseInt(parts[0].trim()), Integer.parseInt(parts[1].trim()),
                    Integer.parseInt(parts[2].trim()));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid colour for " + key + ": " + value, e);
        }
    }
}
