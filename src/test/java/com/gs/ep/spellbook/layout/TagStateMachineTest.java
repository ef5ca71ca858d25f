package com.gs.ep.spellbook.layout;

import com.gs.ep.spellbook.layout.table.ParsedTable;
import com.gs.ep.spellbook.layout.table.TableLayoutEngine;
import org.eclipse.collections.impl.factory.Lists;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

public class TagStateMachineTest {

    private final RecordingRenderer renderer = new RecordingRenderer();
    private final PageCursor cursor = TestLayouts.cursor(renderer, new FlowRegion(10, 110, 20, 280));
    private final TagStateMachine machine;

    public TagStateMachineTest() {
        TextFlowEngine textEngine = new TextFlowEngine(TestLayouts.metrics());
        this.machine = new TagStateMachine(textEngine, new TableLayoutEngine(textEngine));
    }

    @Test
    void write_styleChangeMidLine_addsSpaceOfOutgoingStyle() {
        Style last = machine.write(cursor, "Hello <b> world", Style.REGULAR, TextClass.BODY);

        assertEquals(Style.BOLD, last);
        assertEquals(Style.REGULAR, renderer.text("Hello").style);
        RecordingRenderer.DrawnText world = renderer.text("world");
        assertEquals(Style.BOLD, world.style);
        assertEquals(16, world.x, 1e-9);
        assertEquals(280, world.y, 1e-9);
    }

    @Test
    void write_styleChangeInsideBulletItem_keepsHangingIndent() {
        PageCursor narrow = TestLayouts.cursor(renderer, new FlowRegion(10, 40, 20, 280));

        machine.write(narrow, "Pick:\n\u2022 aaaa <b> bbbbbbbbbb cccccccccc dddddddddd", Style.REGULAR,
                TextClass.BODY);

        assertEquals(10, renderer.text("\u2022 aaaa").x, 1e-9);
        assertEquals(270, renderer.text("\u2022 aaaa").y, 1e-9);
        RecordingRenderer.DrawnText bold = renderer.text("bbbbbbbbbb cccccccccc");
        assertEquals(Style.BOLD, bold.style);
        assertEquals(17, bold.x, 1e-9);
        assertEquals(270, bold.y, 1e-9);
        assertEquals(12, renderer.text("dddddddddd").x, 1e-9);
        assertEquals(265, renderer.text("dddddddddd").y, 1e-9);
    }

    @Test
    void write_tableAfterBulletList_endsTheList() {
        machine.write(cursor, "\u2022 item\n<table> A | B <table>\nAfter", Style.REGULAR, TextClass.BODY);

        assertFalse(cursor.isInList());
        assertEquals(10, renderer.text("After").x, 1e-9);
    }

    @Test
    void write_paragraphs_startIndentedOnNewLines() {
        machine.write(cursor, "one\ntwo", Style.REGULAR, TextClass.BODY);

        assertEquals(10, renderer.text("one").x, 1e-9);
        assertEquals(14, renderer.text("two").x, 1e-9);
        assertEquals(275, renderer.text("two").y, 1e-9);
    }

    @Test
    void write_styleChangeAfterParagraphBreak_startsIndentedParagraph() {
        machine.write(cursor, "one\n<i> two", Style.REGULAR, TextClass.BODY);

        RecordingRenderer.DrawnText two = renderer.text("two");
        assertEquals(Style.ITALIC, two.style);
        assertEquals(14, two.x, 1e-9);
        assertEquals(275, two.y, 1e-9);
    }

    @Test
    void write_escapedTag_isWrittenLiterally() {
        Style last = machine.write(cursor, "\\<b> stays regular", Style.REGULAR, TextClass.BODY);

        assertEquals(Style.REGULAR, last);
        assertEquals(Style.REGULAR, renderer.text("<b> stays regular").style);
    }

    @Test
    void write_inlineTable_isSurroundedByVerticalMargins() {
        Style last = machine.write(cursor, "Before\n<table> A | B <row> 1 | 2 <table>\nAfter", Style.ITALIC,
                TextClass.BODY);

        assertEquals(Style.REGULAR, last);
        assertEquals(Style.ITALIC, renderer.text("Before").style);
        RecordingRenderer.DrawnText header = renderer.text("A");
        assertEquals(Style.BOLD, header.style);
        assertEquals(268, header.y, 1e-9);
        assertEquals(54, header.x, 1e-9);
        assertEquals(65, renderer.text("B").x, 1e-9);
        assertEquals(Style.REGULAR, renderer.text("1").style);
        assertEquals(260, renderer.text("1").y, 1e-9);

        RecordingRenderer.DrawnText after = renderer.text("After");
        assertEquals(Style.REGULAR, after.style);
        assertEquals(10, after.x, 1e-9);
        assertEquals(248, after.y, 1e-9);
    }

    @Test
    void write_inlineTable_shadesOnlyTheOffRow() {
        machine.write(cursor, "<table> A | B <row> 1 | 2 <row> 3 | 4 <table>", Style.REGULAR, TextClass.BODY);

        assertEquals(1, renderer.lines.size());
        RecordingRenderer.DrawnLine line = renderer.lines.getFirst();
        assertEquals(272 + 8 * 0.1075, line.y1, 1e-9);
        assertEquals(line.y1, line.y2, 1e-9);
        assertEquals(50, line.x1, 1e-9);
        assertEquals(70, line.x2, 1e-9);
        assertEquals(7, line.thickness, 1e-9);
    }

    @Test
    void write_fontTagsInsideTable_areCellText() {
        machine.write(cursor, "<table> <b> | <i> <table>", Style.REGULAR, TextClass.BODY);

        assertEquals(Style.BOLD, renderer.text("<b>").style);
        assertEquals(Style.BOLD, renderer.text("<i>").style);
    }

    @Test
    void write_tableReference_laysOutTableRecord() {
        ParsedTable table = ParsedTable.of("Damage", Lists.mutable.of("Level", "Dice"),
                Collections.singletonList(Lists.mutable.of("1", "1d6")));

        machine.write(cursor, "[table][0]", Style.REGULAR, TextClass.BODY, Lists.immutable.of(table));

        RecordingRenderer.DrawnText title = renderer.text("Damage");
        assertEquals(Style.BOLD, title.style);
        assertEquals(57, title.x, 1e-9);
        assertEquals(280, title.y, 1e-9);
        assertEquals(272, renderer.text("Level").y, 1e-9);
        assertEquals(264, renderer.text("1d6").y, 1e-9);
    }

    @Test
    void write_unterminatedTable_isLaidOutAtTheEnd() {
        machine.write(cursor, "<table> x | y", Style.REGULAR, TextClass.BODY);

        assertEquals(280, renderer.text("x").y, 1e-9);
        assertEquals(280, renderer.text("y").y, 1e-9);
        assertEquals(268, cursor.getY(), 1e-9);
    }

    @Test
    void write_inertRegion_writesNothing() {
        PageCursor inert = TestLayouts.cursor(renderer, new FlowRegion(10, 110, 280, 20));

        assertEquals(Style.BOLD, machine.write(inert, "<b> text", Style.BOLD, TextClass.BODY));
        assertTrue(renderer.texts.isEmpty());
    }
}
