package com.gs.ep.spellbook.layout;

import com.gs.ep.spellbook.layout.table.ParsedTable;
import com.gs.ep.spellbook.layout.table.TableLayoutEngine;
import com.gs.ep.spellbook.layout.table.TableParser;
import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes a marked-up description. Text between tags is collected and flowed in the current style;
 * font tags switch the style and {@code <table>} tags bracket an inline table.
 * <p>
 * Inside a table font tags are ordinary text. After a table the style is back to regular and the
 * text continues at the left margin below it.
 */
public class TagStateMachine {

    private static final Logger LOGGER = LoggerFactory.getLogger(TagStateMachine.class);

    public enum State {
        TEXT,
        TABLE
    }

    private final TextFlowEngine textEngine;
    private final TableLayoutEngine tableEngine;
    private final LayoutOptions options;

    public TagStateMachine(TextFlowEngine textEngine, TableLayoutEngine tableEngine) {
        this.textEngine = textEngine;
        this.tableEngine = tableEngine;
        this.options = textEngine.getMetrics().getOptions();
    }

    /**
     * Writes the markup at the cursor.
     *
     * @param tables table records that {@code [table][N]} paragraphs refer to
     * @return the style in effect at the end of the markup
     */
    public Style write(PageCursor cursor, String markup, Style style, TextClass textClass,
            ListIterable<ParsedTable> tables) {
        if (cursor.getRegion().isInert()) {
            return style;
        }
        Run run = new Run(cursor, style, textClass, tables);
        for (MarkupToken token : new MarkupTokenizer(tables.size()).tokenize(markup)) {
            run.accept(token);
        }
        return run.finish();
    }

    public Style write(PageCursor cursor, String markup, Style style, TextClass textClass) {
        return write(cursor, markup, style, textClass, Lists.immutable.empty());
    }

    /**
     * State of one pass over a description.
     */
    private final class Run {

        private final PageCursor cursor;
        private final TextClass textClass;
        private final ListIterable<ParsedTable> tables;
        private final StringBuilder buffer = new StringBuilder();
        private final MutableList<String> tableTokens = Lists.mutable.empty();
        private State state = State.TEXT;
        private Style style;
        private boolean afterTable;

        Run(PageCursor cursor, Style style, TextClass textClass, ListIterable<ParsedTable> tables) {
            this.cursor = cursor;
            this.style = style;
            this.textClass = textClass;
            this.tables = tables;
        }

        void accept(MarkupToken token) {
            if (state == State.TABLE) {
                acceptInTable(token);
                return;
            }
            switch (token.getKind()) {
                case STYLE_CHANGE:
                    changeStyle(token.getStyle());
                    break;
                case TABLE_TOGGLE:
                    flush();
                    state = State.TABLE;
                    break;
                case TABLE_REFERENCE:
                    flush();
                    writeTable(tables.get(token.getTableIndex()));
                    break;
                case PARAGRAPH_BREAK:
                    if (!(afterTable && buffer.length() == 0)) {
                        buffer.append('\n');
                    }
                    break;
                case ESCAPED:
                case PLAIN:
                    append(token.literal());
                    break;
                default:
                    throw new IllegalStateException("Unexpected token " + token);
            }
        }

        private void acceptInTable(MarkupToken token) {
            switch (token.getKind()) {
                case TABLE_TOGGLE:
                    state = State.TEXT;
                    writeTable(TableParser.parse(tableTokens));
                    tableTokens.clear();
                    break;
                case PARAGRAPH_BREAK:
                    break;
                default:
                    tableTokens.add(token.getText());
                    break;
            }
        }

        private void append(String word) {
            if (buffer.length() > 0 && buffer.charAt(buffer.length() - 1) != '\n') {
                buffer.append(' ');
            }
            buffer.append(word);
            afterTable = false;
        }

        private void changeStyle(Style newStyle) {
            String text = buffer.toString();
            flush();
            if (text.endsWith("\n")) {
                cursor.newLine(options.newlineAdvance(textClass), cursor.getRegion().getXMin() + options.getTabAmount());
            } else if (!text.isEmpty()) {
                cursor.setX(cursor.getX() + textEngine.getMetrics().spaceWidth(style, textClass));
            }
            style = newStyle;
        }

        private void flush() {
            if (buffer.length() > 0) {
                textEngine.flow(cursor, buffer.toString(), style, textClass);
                buffer.setLength(0);
            }
        }

        private void writeTable(ParsedTable table) {
            double margin = options.getTableOptions().getOuterVerticalMargin();
            // The margin above a table only separates it from text already on the block; a table
            // opening a block (or following another table) sits at the cursor.
            if (cursor.isStarted()) {
                cursor.moveDown(margin);
            }
            cursor.endList();
            tableEngine.layout(cursor, table);
            cursor.moveDown(margin);
            cursor.setX(cursor.getRegion().getXMin());
            cursor.begin();
            style = Style.REGULAR;
            afterTable = true;
        }

        Style finish() {
            if (state == State.TABLE) {
                LOGGER.warn("Unterminated table with {} tokens, laying it out as if closed", tableTokens.size());
                state = State.TEXT;
                writeTable(TableParser.parse(tableTokens));
            }
            flush();
            return style;
        }
    }
}
