package com.gs.ep.spellbook.layout;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TextFlowEngineTest {

    private final RecordingRenderer renderer = new RecordingRenderer();
    private final TextFlowEngine engine = new TextFlowEngine(TestLayouts.metrics());
    private final PageCursor cursor = TestLayouts.cursor(renderer, new FlowRegion(10, 40, 20, 280));

    @Test
    void flow_singleLine_isDrawnAtCursorAndMovesX() {
        engine.flow(cursor, "aaa bbb", Style.BOLD, TextClass.BODY);

        RecordingRenderer.DrawnText text = renderer.text("aaa bbb");
        assertEquals(10, text.x, 1e-9);
        assertEquals(280, text.y, 1e-9);
        assertEquals(Style.BOLD, text.style);
        assertEquals(8, text.fontSize, 1e-9);
        assertEquals(17, cursor.getX(), 1e-9);
    }

    @Test
    void flow_secondCall_continuesOnTheSameLine() {
        engine.flow(cursor, "aaa", Style.REGULAR, TextClass.BODY);
        cursor.setX(cursor.getX() + 1);
        engine.flow(cursor, "bbb ccc", Style.ITALIC, TextClass.BODY);

        assertEquals(14, renderer.text("bbb ccc").x, 1e-9);
        assertEquals(280, renderer.text("bbb ccc").y, 1e-9);
    }

    @Test
    void flow_wrappedLines_restartAtLeftEdge() {
        engine.flow(cursor, "aaaaaaaaaa bbbbbbbbbb cccccccccc dddddddddd", Style.REGULAR, TextClass.BODY);

        assertEquals(280, renderer.text("aaaaaaaaaa bbbbbbbbbb").y, 1e-9);
        assertEquals(10, renderer.text("cccccccccc dddddddddd").x, 1e-9);
        assertEquals(275, renderer.text("cccccccccc dddddddddd").y, 1e-9);
    }

    @Test
    void flow_laterParagraphs_startIndentedOnNewLine() {
        engine.flow(cursor, "one\n\ntwo", Style.REGULAR, TextClass.BODY);

        assertEquals(2, renderer.texts.size());
        assertEquals(10, renderer.text("one").x, 1e-9);
        assertEquals(14, renderer.text("two").x, 1e-9);
        assertEquals(275, renderer.text("two").y, 1e-9);
    }

    @Test
    void flow_firstWordNotFittingRestOfLine_movesToNextLine() {
        engine.flow(cursor, "aaaaaaaaaaaaaaaaaaaaaaaaa", Style.REGULAR, TextClass.BODY);
        engine.flow(cursor, "bbbbbbbbbb", Style.REGULAR, TextClass.BODY);

        assertEquals(10, renderer.text("bbbbbbbbbb").x, 1e-9);
        assertEquals(275, renderer.text("bbbbbbbbbb").y, 1e-9);
    }

    @Test
    void flow_cursorPastRightEdge_startsNewIndentedLine() {
        cursor.continueLine();
        cursor.setX(45);

        engine.flow(cursor, "late", Style.REGULAR, TextClass.BODY);

        assertEquals(14, renderer.text("late").x, 1e-9);
        assertEquals(275, renderer.text("late").y, 1e-9);
    }

    @Test
    void flow_bulletItem_startsAtLeftEdgeWithHangingIndent() {
        engine.flow(cursor, "Pick one:\n\u2022 alpha beta gamma delta epsilon zeta", Style.REGULAR, TextClass.BODY);

        assertEquals(280, renderer.text("Pick one:").y, 1e-9);
        RecordingRenderer.DrawnText item = renderer.text("\u2022 alpha beta gamma delta");
        assertEquals(10, item.x, 1e-9);
        assertEquals(270, item.y, 1e-9);
        RecordingRenderer.DrawnText hanging = renderer.text("epsilon zeta");
        assertEquals(12, hanging.x, 1e-9);
        assertEquals(265, hanging.y, 1e-9);
    }

    @Test
    void flow_dashItems_drawDotsAndListIsSetApart() {
        engine.flow(cursor, "Intro\n- one\n- two\nAfter", Style.REGULAR, TextClass.BODY);

        assertEquals(10, renderer.text("\u2022 one").x, 1e-9);
        assertEquals(270, renderer.text("\u2022 one").y, 1e-9);
        assertEquals(10, renderer.text("\u2022 two").x, 1e-9);
        assertEquals(265, renderer.text("\u2022 two").y, 1e-9);
        assertEquals(14, renderer.text("After").x, 1e-9);
        assertEquals(255, renderer.text("After").y, 1e-9);
        assertFalse(cursor.isInList());
    }

    @Test
    void flow_listOpeningBlock_hasNoGapAbove() {
        engine.flow(cursor, "\u2022 first\nSecond", Style.REGULAR, TextClass.BODY);

        assertEquals(280, renderer.text("\u2022 first").y, 1e-9);
        assertEquals(270, renderer.text("Second").y, 1e-9);
        assertEquals(14, renderer.text("Second").x, 1e-9);
    }

    @Test
    void flow_escapedBullet_isOrdinaryText() {
        engine.flow(cursor, "Intro\n\\- not a bullet", Style.REGULAR, TextClass.BODY);

        assertEquals(14, renderer.text("- not a bullet").x, 1e-9);
        assertEquals(275, renderer.text("- not a bullet").y, 1e-9);
    }

    @Test
    void flow_inertRegion_drawsNothing() {
        PageCursor inert = TestLayouts.cursor(renderer, new FlowRegion(40, 10, 20, 280));

        engine.flow(inert, "nothing to see", Style.REGULAR, TextClass.BODY);

        assertTrue(renderer.texts.isEmpty());
    }

    @Test
    void flowCentered_centresEachLineBetweenBounds() {
        int lines = engine.flowCentered(cursor, "abcd", Style.BOLD, TextClass.TABLE_TITLE, 10, 40);

        assertEquals(1, lines);
        assertEquals(23, renderer.text("abcd").x, 1e-9);
        assertEquals(280, renderer.text("abcd").y, 1e-9);
    }

    @Test
    void flow_usesColourOfTheTextClass() throws Exception {
        LayoutOptions options = TestLayouts.builder()
                .textClass(TextClass.HEADER, new TextClassSpec(8, 5, LayoutOptions.DEFAULT_HEADER_COLOR))
                .build();
        TextFlowEngine coloured = new TextFlowEngine(TestLayouts.metrics(options));

        coloured.flow(cursor, "Fireball", Style.REGULAR, TextClass.HEADER);

        assertEquals(LayoutOptions.DEFAULT_HEADER_COLOR, renderer.text("Fireball").color);
    }
}
