package com.gs.ep.spellbook.app;

import com.gs.ep.spellbook.layout.LayoutConfig;
import com.gs.ep.spellbook.layout.LayoutOptions;
import com.gs.ep.spellbook.layout.SpellbookWriter;
import com.gs.ep.spellbook.model.Spell;
import com.gs.ep.spellbook.model.SpellFiles;
import com.gs.ep.spellbook.model.renderer.FontPaths;
import com.gs.ep.spellbook.model.renderer.PdfRenderer;
import org.eclipse.collections.api.list.ListIterable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.OutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class SpellbookMaker {

    private static final Logger LOGGER = LoggerFactory.getLogger(SpellbookMaker.class);
    private final LayoutOptions options;
    private final FontPaths fontPaths;

    public SpellbookMaker(LayoutOptions options, FontPaths fontPaths) {
        this.options = options;
        this.fontPaths = fontPaths == null ? FontPaths.none() : fontPaths;
        LOGGER.info("SpellbookMaker initialized. Custom fonts configured: {}", !this.fontPaths.isEmpty());
    }

    public byte[] makeSpellbook(String title, ListIterable<Spell> spells) throws IOException {
        LOGGER.info("Creating spellbook '{}' with {} spells", title, spells.size());
        try (PdfRenderer renderer = new PdfRenderer(fontPaths, options.getBackgroundImagePath())) {
            SpellbookWriter writer = new SpellbookWriter(options, renderer, renderer.fontMetrics());
            writer.addTitlePage(title);
            for (Spell spell : spells) {
                LOGGER.debug("Adding spell '{}'", spell.getName());
                writer.addSpell(spell);
            }
            writer.finish();
            byte[] pdfBytes = renderer.toByteArray();
            LOGGER.info("Spellbook rendered successfully. {} pages, {} bytes.", renderer.pageCount(), pdfBytes.length);
            return pdfBytes;
        }
    }

    public static void main(String[] args) {
        if (args.length < 2) {
            LOGGER.error("Usage: SpellbookMaker <spellFolder> <outputPdfPath> [title]");
            System.err.println("Usage: SpellbookMaker <spellFolder> <outputPdfPath> [title]");
            System.exit(2);
            return;
        }

        Path spellFolder = Paths.get(args[0]);
        Path outputPdfPath = Paths.get(args[1]);

        LOGGER.info("SpellbookMaker CLI started.");
        LOGGER.info("Spell folder: {}", spellFolder);
        LOGGER.info("Output PDF: {}", outputPdfPath);

        try {
            LayoutConfig config = new LayoutConfig();
            String title = args.length > 2 ? args[2] : config.getTitle();
            ListIterable<Spell> spells = SpellFiles.readFolder(spellFolder);
            SpellbookMaker maker = new SpellbookMaker(config.toLayoutOptions(), config.getFontPaths());
            byte[] pdfBytes = maker.makeSpellbook(title, spells);

            try (OutputStream out = Files.newOutputStream(outputPdfPath)) {
                out.write(pdfBytes);
                LOGGER.info("Spellbook successfully written to {}", outputPdfPath);
            }
        } catch (Exception e) {
            LOGGER.error("Error while making the spellbook: ", e);
            System.err.println("Error: " + e.getMessage());
            System.exit(1);
        }
    }
}
