package com.gs.ep.spellbook.layout;

/**
 * One token of a marked-up description.
 */
public final class MarkupToken {

    public enum Kind {
        STYLE_CHANGE,
        TABLE_TOGGLE,
        TABLE_REFERENCE,
        ESCAPED,
        PLAIN,
        PARAGRAPH_BREAK
    }

    private static final MarkupToken PARAGRAPH_BREAK = new MarkupToken(Kind.PARAGRAPH_BREAK, "\n", null, -1);

    private final Kind kind;
    private final String text;
    private final Style style;
    private final int tableIndex;

    private MarkupToken(Kind kind, String text, Style style, int tableIndex) {
        this.kind = kind;
        this.text = text;
        this.style = style;
        this.tableIndex = tableIndex;
    }

    public static MarkupToken styleChange(String tag, Style style) {
        return new MarkupToken(Kind.STYLE_CHANGE, tag, style, -1);
    }

    public static MarkupToken tableToggle(String tag) {
        return new MarkupToken(Kind.TABLE_TOGGLE, tag, null, -1);
    }

    public static MarkupToken tableReference(String token, int tableIndex) {
        return new MarkupToken(Kind.TABLE_REFERENCE, token, null, tableIndex);
    }

    public static MarkupToken escaped(String token) {
        return new MarkupToken(Kind.ESCAPED, token, null, -1);
    }

    public static MarkupToken plain(String token) {
        return new MarkupToken(Kind.PLAIN, token, null, -1);
    }

    public static MarkupToken paragraphBreak() {
        return PARAGRAPH_BREAK;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * The token exactly as written, escape included.
     */
    public String getText() {
        return text;
    }

    /**
     * The text the token stands for when it is written out as plain text.
     */
    public String literal() {
        return Escapes.unescape(text);
    }

    public Style getStyle() {
        return style;
    }

    public int getTableIndex() {
        return tableIndex;
    }

    @Override
    public String toString() {
        switch (kind) {
            case STYLE_CHANGE:
                return "StyleChange(" + style + ")";
            case TABLE_REFERENCE:
                return "TableReference(" + tableIndex + ")";
            case PARAGRAPH_BREAK:
                return "ParagraphBreak";
            default:
                return kind + "(" + text + ")";
        }
    }
}
