package com.gs.ep.spellbook.model.renderer;

import com.gs.ep.spellbook.layout.FontMetrics;
import com.gs.ep.spellbook.layout.MetricsUnavailableException;
import com.gs.ep.spellbook.layout.Style;
import org.apache.fontbox.util.BoundingBox;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDFontDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * {@link FontMetrics} read from a loaded PDFBox font, so text is measured with the same glyphs it is
 * drawn with.
 */
public class PdfBoxFontMetrics implements FontMetrics {

    private static final Logger LOGGER = LoggerFactory.getLogger(PdfBoxFontMetrics.class);

    /**
     * Advance used for characters the font cannot encode; the renderer draws those as '?'.
     */
    static final double FALLBACK_ADVANCE = 500;

    private final PDFont font;
    private final double ascent;
    private final double descent;

    public PdfBoxFontMetrics(Style style, PDFont font) throws MetricsUnavailableException {
        this.font = font;
        PDFontDescriptor descriptor = font.getFontDescriptor();
        if (descriptor != null && descriptor.getAscent() != 0) {
            this.ascent = descriptor.getAscent();
            this.descent = descriptor.getDescent();
        } else {
            try {
                BoundingBox box = font.getBoundingBox();
                this.ascent = box.getUpperRightY();
                this.descent = box.getLowerLeftY();
            } catch (IOException e) {
                throw new MetricsUnavailableException(style, "No vertical metrics in font " + font.getName(), e);
            }
        }
    }

    @Override
    public double advanceWidth(String text) {
        try {
            return font.getStringWidth(text);
        } catch (IllegalArgumentException | IOException e) {
            LOGGER.debug("Font {} cannot encode all of '{}', measuring per character", font.getName(), text);
        }
        double width = 0;
        for (int i = 0; i < text.length(); ) {
            int codePoint = text.codePointAt(i);
            String character = new String(Character.toChars(codePoint));
            width += characterWidth(character);
            i += Character.charCount(codePoint);
        }
        return width;
    }

    private double characterWidth(String character) {
        try {
            return font.getStringWidth(character);
        } catch (IllegalArgumentException | IOException e) {
            LOGGER.debug("No glyph for '{}' in font {}, using a width of half an em", character, font.getName());
            return FALLBACK_ADVANCE;
        }
    }

    @Override
    public double ascent() {
        return ascent;
    }

    @Override
    public double descent() {
        return descent;
    }
}
