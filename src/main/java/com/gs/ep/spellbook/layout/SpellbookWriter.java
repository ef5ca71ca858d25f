package com.gs.ep.spellbook.layout;

import com.gs.ep.spellbook.layout.table.ParsedTable;
import com.gs.ep.spellbook.layout.table.TableLayoutEngine;
import com.gs.ep.spellbook.model.Spell;
import com.gs.ep.spellbook.model.Table;
import com.gs.ep.spellbook.model.renderer.PageHandle;
import com.gs.ep.spellbook.model.renderer.Renderer;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Map;

/**
 * Assembles a spellbook: an optional title page, then every spell starting on a page of its own,
 * then page numbers once all pages exist.
 */
public class SpellbookWriter {

    private static final Logger LOGGER = LoggerFactory.getLogger(SpellbookWriter.class);

    public static final String TITLE_PAGE_BOOKMARK = "Title Page";
    static final String LEVELED_UPCAST_PREFIX = "Using a Higher-Level Spell Slot";
    static final String CANTRIP_UPCAST_PREFIX = "Cantrip Upgrade";

    private final LayoutOptions options;
    private final Renderer renderer;
    private final MetricsAdapter metrics;
    private final TextFlowEngine textEngine;
    private final TagStateMachine stateMachine;
    private final FlowRegion region;
    private PageHandle titlePage;
    private int spellCount;
    private boolean finished;

    /**
     * @throws MetricsUnavailableException if metrics are missing for a style
     */
    public SpellbookWriter(LayoutOptions options, Renderer renderer, Map<Style, ? extends FontMetrics> fontMetrics)
            throws MetricsUnavailableException {
        this.options = options;
        this.renderer = renderer;
        this.metrics = new MetricsAdapter(options, fontMetrics);
        this.textEngine = new TextFlowEngine(metrics);
        this.stateMachine = new TagStateMachine(textEngine, new TableLayoutEngine(textEngine));
        this.region = options.textRegion();
    }

    /**
     * Adds a page with the title centred on it. A blank title uses {@link LayoutConfig#DEFAULT_TITLE}.
     */
    public void addTitlePage(String title) throws IOException {
        String text = title == null || title.trim().isEmpty() ? LayoutConfig.DEFAULT_TITLE : title;
        try {
            FlowSequence sequence = FlowSequence.onNewPage(renderer, options.getPageGeometry());
            titlePage = sequence.lastPage();
            renderer.addBookmark(TITLE_PAGE_BOOKMARK, titlePage);
            PageCursor cursor = new PageCursor(region, sequence);
            double newline = options.newlineAdvance(TextClass.TITLE);
            int lineCount = textEngine.getWrapper().wrap(text, region.getWidth(), Style.REGULAR, TextClass.TITLE).size();
            double y = (lineCount - 1) * newline > region.getHeight()
                    ? region.getYMax()
                    : (region.getYMin() + region.getYMax()) / 2 + (lineCount - 1) / 2.0 * newline;
            cursor.moveTo(region.getXMin(), y);
            textEngine.flowCentered(cursor, text, Style.REGULAR, TextClass.TITLE, region.getXMin(), region.getXMax());
            LOGGER.debug("Title page '{}' written over {} lines", text, lineCount);
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    public void addSpell(Spell spell) throws IOException {
        try {
            FlowSequence sequence = FlowSequence.onNewPage(renderer, options.getPageGeometry());
            renderer.addBookmark(spell.getName(), sequence.page(0));
            PageCursor cursor = new PageCursor(region, sequence);
            ImmutableList<ParsedTable> tables = Lists.immutable.withAll(spell.getTables()).collect(SpellbookWriter::toParsedTable);
            double headerNewline = options.newlineAdvance(TextClass.HEADER);
            double bodyNewline = options.newlineAdvance(TextClass.BODY);
            double xMin = region.getXMin();

            stateMachine.write(cursor, spell.getName(), Style.REGULAR, TextClass.HEADER, tables);
            cursor.newLine(headerNewline, xMin);
            stateMachine.write(cursor, spell.levelSchoolText(), Style.ITALIC, TextClass.BODY, tables);

            cursor.newLine(headerNewline, xMin);
            stateMachine.write(cursor, "Casting Time: <r> " + spell.getCastingTime().asText(), Style.BOLD,
                    TextClass.BODY, tables);
            cursor.newLine(bodyNewline, xMin);
            stateMachine.write(cursor, "Range: <r> " + spell.getRange().asText(), Style.BOLD, TextClass.BODY, tables);
            cursor.newLine(bodyNewline, xMin);
            stateMachine.write(cursor, "Components: <r> " + spell.getComponents().asText(), Style.BOLD,
                    TextClass.BODY, tables);
            cursor.newLine(bodyNewline, xMin);
            stateMachine.write(cursor, "Duration: <r> " + spell.getDuration().asText(), Style.BOLD, TextClass.BODY,
                    tables);

            cursor.newLine(headerNewline, xMin);
            stateMachine.write(cursor, fullDescription(spell), Style.REGULAR, TextClass.BODY, tables);
            spellCount++;
            LOGGER.debug("Spell '{}' written on {} pages", spell.getName(), sequence.size());
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    /**
     * The description followed, when the spell has one, by the upcast description as a new paragraph.
     */
    static String fullDescription(Spell spell) {
        String upcast = spell.getUpcastDescription();
        if (upcast == null || upcast.trim().isEmpty()) {
            return spell.getDescription();
        }
        String prefix = spell.isCantrip() ? CANTRIP_UPCAST_PREFIX : LEVELED_UPCAST_PREFIX;
        return spell.getDescription() + "\n<bi> " + prefix + ". <r> " + upcast;
    }

    static ParsedTable toParsedTable(Table table) {
        return ParsedTable.of(table.getTitle(), table.getColumnLabels(), table.getCells());
    }

    /**
     * Draws the page numbers. No content may be added afterwards.
     */
    public void finish() throws IOException {
        if (finished) {
            return;
        }
        finished = true;
        PageNumberOptions numbers = options.getPageNumberOptions();
        try {
            if (numbers != null) {
                drawPageNumbers(numbers);
            }
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
        LOGGER.info("Spellbook finished: {} spells on {} pages", spellCount, renderer.pageCount());
    }

    private void drawPageNumbers(PageNumberOptions numbers) {
        PageGeometry page = options.getPageGeometry();
        int ordinal = 0;
        for (int index = 0; index < renderer.pageCount(); index++) {
            PageHandle handle = new PageHandle(index);
            if (handle.equals(titlePage)) {
                continue;
            }
            String text = String.valueOf(numbers.getStartingNumber() + ordinal);
            double x = numbers.sideFor(ordinal) == PageNumberOptions.Side.LEFT
                    ? numbers.getSideMargin()
                    : page.getWidth() - numbers.getSideMargin()
                            - metrics.width(text, numbers.getStyle(), numbers.getFontSize());
            renderer.drawText(handle, x, numbers.getBottomMargin(), text, numbers.getStyle(), numbers.getFontSize(),
                    numbers.getColor());
            ordinal++;
        }
    }

    public int getSpellCount() {
        return spellCount;
    }
}
