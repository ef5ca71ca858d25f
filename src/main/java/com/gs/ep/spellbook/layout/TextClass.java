package com.gs.ep.spellbook.layout;

/**
 * Semantic role of a piece of text. Each class has its own font size, newline advance
 * and colour, independent of the {@link Style} it is written in.
 */
public enum TextClass {
    TITLE,
    HEADER,
    BODY,
    TABLE_TITLE,
    TABLE_BODY
}
