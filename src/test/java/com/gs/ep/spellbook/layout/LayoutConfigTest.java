package com.gs.ep.spellbook.layout;

import com.gs.ep.spellbook.model.renderer.FontPaths;
import org.junit.jupiter.api.Test;

import java.awt.Color;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

public class LayoutConfigTest {

    @Test
    void toLayoutOptions_bundledConfig_matchesDefaultsWithPageNumbers() {
        LayoutConfig config = new LayoutConfig();
        LayoutOptions options = config.toLayoutOptions();
        LayoutOptions defaults = LayoutOptions.defaults();

        assertEquals(LayoutConfig.DEFAULT_TITLE, config.getTitle());
        for (TextClass textClass : TextClass.values()) {
            assertEquals(defaults.fontSize(textClass), options.fontSize(textClass), 1e-9);
            assertEquals(defaults.newlineAdvance(textClass), options.newlineAdvance(textClass), 1e-9);
        }
        assertEquals(defaults.getTableOptions().getOffRowColor(), options.getTableOptions().getOffRowColor());
        assertNotNull(options.getPageNumberOptions());
        assertEquals(PageNumberOptions.Side.LEFT, options.getPageNumberOptions().getStartingSide());
        assertTrue(config.getFontPaths().isEmpty());
    }

    @Test
    void toLayoutOptions_overridesOnlyConfiguredKeys() {
        LayoutConfig config = new LayoutConfig("test-config.properties");
        LayoutOptions options = config.toLayoutOptions();

        assertEquals("Grimoire of Tests", config.getTitle());
        assertEquals(148, options.getPageGeometry().getWidth(), 1e-9);
        assertEquals(12, options.textRegion().getXMin(), 1e-9);
        assertEquals(140, options.textRegion().getXMax(), 1e-9);
        assertEquals(195, options.textRegion().getYMax(), 1e-9);
        assertEquals(20, options.fontSize(TextClass.HEADER), 1e-9);
        assertEquals(new Color(10, 20, 30), options.color(TextClass.HEADER));
        assertEquals(4.5, options.newlineAdvance(TextClass.BODY), 1e-9);
        assertEquals(12, options.fontSize(TextClass.BODY), 1e-9);
        assertEquals(0.4, options.scalar(Style.BOLD), 1e-9);
        assertEquals(LayoutOptions.DEFAULT_SCALAR, options.scalar(Style.REGULAR), 1e-9);
        assertEquals(5, options.getTabAmount(), 1e-9);
        assertEquals(6, options.getTableOptions().getColumnMargin(), 1e-9);
        assertEquals(8, options.getTableOptions().getRowMargin(), 1e-9);
        assertEquals(new Color(200, 200, 200), options.getTableOptions().getOffRowColor());

        PageNumberOptions numbers = options.getPageNumberOptions();
        assertEquals(PageNumberOptions.Side.RIGHT, numbers.getStartingSide());
        assertFalse(numbers.isFlipsSides());
        assertEquals(3, numbers.getStartingNumber());
        assertEquals(Style.BOLD_ITALIC, numbers.getStyle());
    }

    @Test
    void getFontPaths_onlyConfiguredStyles() {
        FontPaths paths = new LayoutConfig("test-config.properties").getFontPaths();

        assertEquals("fonts/Italic.ttf", paths.get(Style.ITALIC));
        assertNull(paths.get(Style.REGULAR));
        assertFalse(paths.isEmpty());
    }

    @Test
    void constructor_missingResource_usesDefaults() {
        LayoutConfig config = new LayoutConfig("no-such-config.properties");

        assertEquals(LayoutConfig.DEFAULT_TITLE, config.getTitle());
        assertNull(config.toLayoutOptions().getPageNumberOptions());
    }

    @Test
    void toLayoutOptions_unparseableNumber_namesTheKey() {
        Properties properties = new Properties();
        properties.setProperty("table.margin.row", "eight");

        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> new LayoutConfig(properties).toLayoutOptions());
        assertTrue(e.getMessage().contains("table.margin.row"));
    }

    @Test
    void toLayoutOptions_nonFiniteNumber_namesTheKey() {
        Properties nan = new Properties();
        nan.setProperty("page.margin.top", "NaN");
        Properties infinite = new Properties();
        infinite.setProperty("page.width", "Infinity");

        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> new LayoutConfig(nan).toLayoutOptions());
        assertTrue(e.getMessage().contains("page.margin.top"));
        assertThrows(ConfigurationException.class, () -> new LayoutConfig(infinite).toLayoutOptions());
    }

    @Test
    void toLayoutOptions_invalidColourOrStyle_shouldThrow() {
        Properties colour = new Properties();
        colour.setProperty("text.body.color", "12,34");
        Properties style = new Properties();
        style.setProperty("pagenumbers.enabled", "true");
        style.setProperty("pagenumbers.style", "Gothic");
        Properties margins = new Properties();
        margins.setProperty("page.margin.left", "150");
        margins.setProperty("page.margin.right", "150");

        assertThrows(ConfigurationException.class, () -> new LayoutConfig(colour).toLayoutOptions());
        assertThrows(ConfigurationException.class, () -> new LayoutConfig(style).toLayoutOptions());
        assertThrows(ConfigurationException.class, () -> new LayoutConfig(margins).toLayoutOptions());
    }
}
