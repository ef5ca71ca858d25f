package com.gs.ep.spellbook.model.renderer;

import com.gs.ep.spellbook.layout.FontMetrics;
import com.gs.ep.spellbook.layout.MetricsUnavailableException;
import com.gs.ep.spellbook.layout.Style;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.PageMode;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType0Font;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.apache.pdfbox.pdmodel.interactive.documentnavigation.destination.PDPageFitWidthDestination;
import org.apache.pdfbox.pdmodel.interactive.documentnavigation.outline.PDDocumentOutline;
import org.apache.pdfbox.pdmodel.interactive.documentnavigation.outline.PDOutlineItem;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Color;
import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.util.EnumMap;
import java.util.Map;

/**
 * Renders pages into a PDF document with Apache PDFBox. Each page keeps one content stream open
 * until the document is saved. Millimetre coordinates are converted to PDF points.
 */
public class PdfRenderer implements Renderer, Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(PdfRenderer.class);
    private static final float POINTS_PER_MM = 72f / 25.4f;

    private final PDDocument document = new PDDocument();
    private final Map<Style, PDFont> fonts = new EnumMap<>(Style.class);
    private final MutableList<PDPage> pages = Lists.mutable.empty();
    private final MutableList<PDPageContentStream> contentStreams = Lists.mutable.empty();
    private final PDDocumentOutline outline = new PDDocumentOutline();
    private PDImageXObject background;
    private boolean finished;

    public PdfRenderer() throws IOException {
        this(FontPaths.none(), null);
    }

    /**
     * @param backgroundImagePath image drawn behind every page, or null
     * @throws MetricsUnavailableException if a configured font file is missing or cannot be parsed
     * @throws IOException if the background image cannot be read
     */
    public PdfRenderer(FontPaths fontPaths, String backgroundImagePath) throws IOException {
        try {
            loadFonts(fontPaths);
            if (backgroundImagePath != null) {
                this.background = PDImageXObject.createFromFile(backgroundImagePath, document);
                LOGGER.debug("Loaded background image {}", backgroundImagePath);
            }
        } catch (IOException e) {
            document.close();
            throw e;
        }
        document.getDocumentCatalog().setDocumentOutline(outline);
        document.getDocumentCatalog().setPageMode(PageMode.USE_OUTLINES);
    }

    private void loadFonts(FontPaths fontPaths) throws MetricsUnavailableException {
        for (Style style : Style.values()) {
            String path = fontPaths.get(style);
            if (path == null) {
                fonts.put(style, standardFont(style));
                continue;
            }
            File fontFile = new File(path);
            if (!fontFile.isFile()) {
                throw new MetricsUnavailableException(style, "Font file for " + style.getDisplayName()
                        + " not found: " + fontFile.getAbsolutePath());
            }
            try {
                fonts.put(style, PDType0Font.load(document, fontFile));
                LOGGER.debug("Loaded {} font from {}", style.getDisplayName(), fontFile);
            } catch (IOException e) {
                throw new MetricsUnavailableException(style, "Unable to parse font file " + fontFile, e);
            }
        }
    }

    private static PDFont standardFont(Style style) {
        switch (style) {
            case BOLD:
                return PDType1Font.TIMES_BOLD;
            case ITALIC:
                return PDType1Font.TIMES_ITALIC;
            case BOLD_ITALIC:
                return PDType1Font.TIMES_BOLD_ITALIC;
            default:
                return PDType1Font.TIMES_ROMAN;
        }
    }

    public FontMetrics fontMetrics(Style style) throws MetricsUnavailableException {
        return new PdfBoxFontMetrics(style, fonts.get(style));
    }

    /**
     * Metrics for every style, ready for a {@link com.gs.ep.spellbook.layout.MetricsAdapter}.
     */
    public Map<Style, FontMetrics> fontMetrics() throws MetricsUnavailableException {
        Map<Style, FontMetrics> metrics = new EnumMap<>(Style.class);
        for (Style style : Style.values()) {
            metrics.put(style, fontMetrics(style));
        }
        return metrics;
    }

    @Override
    public PageHandle createPage(double width, double height) {
        checkOpen();
        PDPage page = new PDPage(new PDRectangle(toPoints(width), toPoints(height)));
        document.addPage(page);
        try {
            PDPageContentStream contentStream = new PDPageContentStream(document, page);
            pages.add(page);
            contentStreams.add(contentStream);
            if (background != null) {
                contentStream.drawImage(background, 0, 0, toPoints(width), toPoints(height));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create page " + pages.size(), e);
        }
        return new PageHandle(pages.size() - 1);
    }

    @Override
    public void drawText(PageHandle page, double x, double y, String text, Style style, double fontSize,
            Color color) {
        PDFont font = fonts.get(style);
        PDPageContentStream contentStream = stream(page);
        try {
            contentStream.beginText();
            contentStream.setFont(font, (float) fontSize);
            contentStream.setNonStrokingColor(color);
            contentStream.newLineAtOffset(toPoints(x), toPoints(y));
            contentStream.showText(encodable(font, text));
            contentStream.endText();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to draw text on page " + page.getIndex(), e);
        }
    }

    @Override
    public void drawLineSegment(PageHandle page, double x1, double y1, double x2, double y2, Color color,
            double thickness) {
        PDPageContentStream contentStream = stream(page);
        try {
            contentStream.setStrokingColor(color);
            contentStream.setLineWidth(toPoints(thickness));
            contentStream.moveTo(toPoints(x1), toPoints(y1));
            contentStream.lineTo(toPoints(x2), toPoints(y2));
            contentStream.stroke();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to draw line on page " + page.getIndex(), e);
        }
    }

    @Override
    public void addBookmark(String title, PageHandle page) {
        PDPageFitWidthDestination destination = new PDPageFitWidthDestination();
        destination.setPage(pages.get(page.getIndex()));
        PDOutlineItem item = new PDOutlineItem();
        item.setTitle(title);
        item.setDestination(destination);
        outline.addLast(item);
    }

    @Override
    public int pageCount() {
        return pages.size();
    }

    public void save(OutputStream out) throws IOException {
        finish();
        document.save(out);
    }

    public byte[] toByteArray() throws IOException {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        save(baos);
        return baos.toByteArray();
    }

    @Override
    public void close() throws IOException {
        try {
            finish();
        } finally {
            document.close();
        }
    }

    private void finish() throws IOException {
        if (finished) {
            return;
        }
        finished = true;
        for (PDPageContentStream contentStream : contentStreams) {
            contentStream.close();
        }
    }

    private PDPageContentStream stream(PageHandle page) {
        checkOpen();
        return contentStreams.get(page.getIndex());
    }

    private void checkOpen() {
        if (finished) {
            throw new IllegalStateException("The document has already been saved");
        }
    }

    /**
     * Replaces characters the font has no glyph for with '?'.
     */
    static String encodable(PDFont font, String text) {
        if (canEncode(font, text)) {
            return text;
        }
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); ) {
            int codePoint = text.codePointAt(i);
            String character = new String(Character.toChars(codePoint));
            sb.append(canEncode(font, character) ? character : "?");
            i += Character.charCount(codePoint);
        }
        return sb.toString();
    }

    private static boolean canEncode(PDFont font, String text) {
        try {
            font.encode(text);
            return true;
        } catch (IllegalArgumentException | IOException e) {
            return false;
        }
    }

    private static float toPoints(double millimetres) {
        return (float) (millimetres * POINTS_PER_MM);
    }
}
