package com.gs.ep.spellbook.model.renderer;

import com.gs.ep.spellbook.layout.FontMetrics;
import com.gs.ep.spellbook.layout.MetricsUnavailableException;
import com.gs.ep.spellbook.layout.Style;
import org.apache.pdfbox.cos.COSDictionary;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.interactive.documentnavigation.outline.PDDocumentOutline;
import org.apache.pdfbox.pdmodel.interactive.documentnavigation.outline.PDOutlineItem;
import org.apache.pdfbox.text.PDFTextStripper;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.awt.Color;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class PdfRendererTest {

    @TempDir
    Path folder;

    @Test
    void toByteArray_withTextAndShading_shouldProducePdfWithText() throws Exception {
        // 1. Draw two pages of content
        byte[] pdfBytes;
        try (PdfRenderer renderer = new PdfRenderer()) {
            PageHandle first = renderer.createPage(210, 297);
            PageHandle second = renderer.createPage(210, 297);
            renderer.drawLineSegment(first, 10, 250, 200, 250, new Color(213, 209, 224), 7);
            renderer.drawText(first, 20, 250, "Hello from PdfRendererTest", Style.REGULAR, 12, Color.BLACK);
            renderer.drawText(second, 20, 250, "Second page", Style.BOLD_ITALIC, 12, Color.RED);
            assertEquals(2, renderer.pageCount());

            // 2. Save
            pdfBytes = renderer.toByteArray();
        }

        // 3. Validate the output PDF
        assertEquals("%PDF-", new String(pdfBytes, 0, 5, StandardCharsets.US_ASCII));
        try (PDDocument document = PDDocument.load(new ByteArrayInputStream(pdfBytes))) {
            assertEquals(2, document.getNumberOfPages());
            assertEquals(595.0f, document.getPage(0).getMediaBox().getWidth(), 0.5f);
            String text = new PDFTextStripper().getText(document);
            assertTrue(text.contains("Hello from PdfRendererTest"), "Actual text: '" + text + "'");
            assertTrue(text.contains("Second page"), "Actual text: '" + text + "'");
        }
    }

    @Test
    void addBookmark_shouldBuildDocumentOutline() throws Exception {
        byte[] pdfBytes;
        try (PdfRenderer renderer = new PdfRenderer()) {
            PageHandle title = renderer.createPage(148, 210);
            PageHandle spell = renderer.createPage(148, 210);
            renderer.addBookmark("Title Page", title);
            renderer.addBookmark("Fireball", spell);
            pdfBytes = renderer.toByteArray();
        }

        try (PDDocument document = PDDocument.load(new ByteArrayInputStream(pdfBytes))) {
            PDDocumentOutline outline = document.getDocumentCatalog().getDocumentOutline();
            MutableList<String> titles = Lists.mutable.empty();
            for (PDOutlineItem item : outline.children()) {
                titles.add(item.getTitle());
            }
            assertEquals(Lists.mutable.of("Title Page", "Fireball"), titles);
            assertEquals(document.getPage(1), outline.getLastChild().findDestinationPage(document));
        }
    }

    @Test
    void fontMetrics_standardFonts_measureLikePdfBox() throws Exception {
        try (PdfRenderer renderer = new PdfRenderer()) {
            Map<Style, FontMetrics> metrics = renderer.fontMetrics();

            assertEquals(Style.values().length, metrics.size());
            assertEquals(PDType1Font.TIMES_BOLD.getStringWidth("Fireball"),
                    metrics.get(Style.BOLD).advanceWidth("Fireball"), 1e-6);
            assertTrue(metrics.get(Style.REGULAR).ascent() > 0);
            assertTrue(metrics.get(Style.REGULAR).descent() < 0);
        }
    }

    @Test
    void fontMetrics_unencodableCharacter_usesFallbackAdvance() throws Exception {
        FontMetrics metrics = new PdfBoxFontMetrics(Style.REGULAR, PDType1Font.TIMES_ROMAN);

        double plain = metrics.advanceWidth("ab");
        assertEquals(plain + PdfBoxFontMetrics.FALLBACK_ADVANCE, metrics.advanceWidth("a中b"), 1e-6);
    }

    @Test
    void fontMetrics_descriptorWithoutAscent_usesFontBoundingBox() throws Exception {
        COSDictionary descriptor = new COSDictionary();
        descriptor.setItem(COSName.TYPE, COSName.FONT_DESC);
        descriptor.setItem(COSName.FONT_BBOX, new PDRectangle(-100, -250, 1100, 1150).getCOSArray());
        COSDictionary fontDictionary = new COSDictionary();
        fontDictionary.setItem(COSName.TYPE, COSName.FONT);
        fontDictionary.setItem(COSName.SUBTYPE, COSName.TYPE1);
        fontDictionary.setName(COSName.BASE_FONT, "Times-Roman");
        fontDictionary.setItem(COSName.FONT_DESC, descriptor);
        PDType1Font font = new PDType1Font(fontDictionary);
        assertEquals(0, font.getFontDescriptor().getAscent(), 1e-6);

        FontMetrics metrics = new PdfBoxFontMetrics(Style.REGULAR, font);

        assertEquals(900, metrics.ascent(), 1e-6);
        assertEquals(-250, metrics.descent(), 1e-6);
    }

    @Test
    void encodable_replacesMissingGlyphs() {
        assertEquals("café", PdfRenderer.encodable(PDType1Font.TIMES_ROMAN, "café"));
        assertEquals("a?b", PdfRenderer.encodable(PDType1Font.TIMES_ROMAN, "a中b"));
    }

    @Test
    void constructor_missingFontFile_shouldThrowMetricsUnavailable() {
        FontPaths paths = FontPaths.builder().path(Style.ITALIC, folder.resolve("missing.ttf").toString()).build();

        MetricsUnavailableException e = assertThrows(MetricsUnavailableException.class,
                () -> new PdfRenderer(paths, null));
        assertEquals(Style.ITALIC, e.getStyle());
    }

    @Test
    void constructor_unparseableFontFile_shouldThrowMetricsUnavailable() throws Exception {
        Path font = folder.resolve("broken.ttf");
        Files.write(font, "not a font".getBytes(StandardCharsets.UTF_8));
        FontPaths paths = FontPaths.builder().path(Style.BOLD, font.toString()).build();

        MetricsUnavailableException e = assertThrows(MetricsUnavailableException.class,
                () -> new PdfRenderer(paths, null));
        assertEquals(Style.BOLD, e.getStyle());
    }

    @Test
    void createPage_afterSave_shouldThrow() throws Exception {
        try (PdfRenderer renderer = new PdfRenderer()) {
            renderer.createPage(210, 297);
            renderer.toByteArray();

            assertThrows(IllegalStateException.class, () -> renderer.createPage(210, 297));
        }
    }
}
