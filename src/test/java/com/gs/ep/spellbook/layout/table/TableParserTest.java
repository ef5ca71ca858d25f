package com.gs.ep.spellbook.layout.table;

import org.eclipse.collections.impl.factory.Lists;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TableParserTest {

    private static List<String> tokens(String markup) {
        return Lists.mutable.of(markup.split(" "));
    }

    @Test
    void parse_titleHeaderAndRows() {
        ParsedTable table = TableParser.parse(tokens("<title> Spell Slots <title> Level | Slots <row> 1st | 2 <row> 2nd | 3"));

        assertEquals("Spell Slots", table.getTitle());
        assertTrue(table.hasHeader());
        assertEquals(2, table.getColumnCount());
        assertEquals(3, table.getRowCount());
        assertEquals("Level", table.cell(0, 0));
        assertEquals("Slots", table.cell(0, 1));
        assertEquals("2nd", table.cell(2, 0));
        assertEquals("3", table.cell(2, 1));
        assertTrue(table.isHeaderRow(0));
        assertFalse(table.isHeaderRow(1));
    }

    @Test
    void parse_multiWordCells() {
        ParsedTable table = TableParser.parse(tokens("Die roll | Effect <row> 1 | You fall prone"));

        assertEquals("Die roll", table.cell(0, 0));
        assertEquals("You fall prone", table.cell(1, 1));
    }

    @Test
    void parse_leadingRowTag_meansNoHeader() {
        ParsedTable table = TableParser.parse(tokens("<row> a | b <row> c | d"));

        assertFalse(table.hasHeader());
        assertFalse(table.hasTitle());
        assertEquals(2, table.getRowCount());
        assertEquals("a", table.cell(0, 0));
    }

    @Test
    void parse_escapedDelimiters_areCellText() {
        ParsedTable table = TableParser.parse(tokens("a \\| b | \\<row> c"));

        assertEquals(1, table.getRowCount());
        assertEquals(2, table.getColumnCount());
        assertEquals("a \\| b", table.cell(0, 0));
        assertEquals("<row> c", table.cell(0, 1));
    }

    @Test
    void parse_escapedTitleTag_isHeaderText() {
        ParsedTable table = TableParser.parse(tokens("\\<title> | b"));

        assertFalse(table.hasTitle());
        assertEquals("<title>", table.cell(0, 0));
    }

    @Test
    void parse_unterminatedTitle_takesRemainingTokens() {
        ParsedTable table = TableParser.parse(tokens("<title> Lonely title"));

        assertEquals("Lonely title", table.getTitle());
        assertEquals(0, table.getColumnCount());
        assertEquals(0, table.getRowCount());
    }

    @Test
    void parse_jaggedRows_arePadded() {
        ParsedTable table = TableParser.parse(tokens("a | b | c <row> d <row> <row> e | f"));

        assertEquals(3, table.getRowCount());
        assertEquals(3, table.getColumnCount());
        assertEquals("", table.cell(1, 1));
        assertEquals("", table.cell(2, 2));
        assertEquals("f", table.cell(2, 1));
    }

    @Test
    void parse_noTokens_isEmptyTable() {
        ParsedTable table = TableParser.parse(Collections.emptyList());

        assertEquals(0, table.getRowCount());
        assertFalse(table.hasHeader());
    }
}
