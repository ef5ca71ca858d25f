package com.gs.ep.spellbook.layout.table;

import com.gs.ep.spellbook.layout.Escapes;
import com.gs.ep.spellbook.layout.LineWrapper;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Turns the tokens collected between two {@code <table>} tags into a {@link ParsedTable}.
 * <pre>
 * &lt;title&gt; Table title &lt;title&gt; Header 1 | Header 2 &lt;row&gt; a | b &lt;row&gt; c | d
 * </pre>
 * The optional title comes first. Rows are separated by {@code <row>} tokens and cells by {@code |}.
 * A non-empty segment before the first {@code <row>} is the header row. Escaped delimiters such as
 * {@code \<row>} or {@code \|} are cell text.
 */
public final class TableParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(TableParser.class);

    public static final String TITLE_TAG = "<title>";
    public static final String ROW_TAG = "<row>";
    public static final String COLUMN_DELIMITER = "|";

    private TableParser() {
    }

    public static ParsedTable parse(List<String> tokens) {
        int start = 0;
        String title = "";
        if (!tokens.isEmpty() && TITLE_TAG.equals(tokens.get(0))) {
            int end = tokens.subList(1, tokens.size()).indexOf(TITLE_TAG) + 1;
            if (end == 0) {
                LOGGER.warn("Unterminated table title, using the remaining {} tokens as the title", tokens.size() - 1);
                end = tokens.size();
            }
            title = cellText(tokens.subList(1, end));
            start = Math.min(end + 1, tokens.size());
        }

        MutableList<MutableList<String>> segments = Lists.mutable.empty();
        MutableList<String> current = Lists.mutable.empty();
        for (String token : tokens.subList(start, tokens.size())) {
            if (ROW_TAG.equals(token)) {
                segments.add(current);
                current = Lists.mutable.empty();
            } else {
                current.add(token);
            }
        }
        segments.add(current);

        MutableList<String> header = Lists.mutable.empty();
        MutableList<MutableList<String>> rows = Lists.mutable.empty();
        for (int i = 0; i < segments.size(); i++) {
            MutableList<String> cells = cells(segments.get(i));
            if (i == 0) {
                header = cells;
            } else if (!cells.isEmpty()) {
                rows.add(cells);
            }
        }
        return ParsedTable.of(title, header, rows);
    }

    /**
     * Splits one row into cells. A row with no tokens has no cells.
     */
    private static MutableList<String> cells(List<String> rowTokens) {
        MutableList<String> cells = Lists.mutable.empty();
        if (rowTokens.isEmpty()) {
            return cells;
        }
        for (String cell : String.join(" ", rowTokens).split("(?<!\\\\)\\" + COLUMN_DELIMITER, -1)) {
            cells.add(cellText(LineWrapper.tokens(cell)));
        }
        return cells;
    }

    private static String cellText(List<String> tokens) {
        if (tokens.isEmpty()) {
            return "";
        }
        MutableList<String> words = Lists.mutable.withAll(tokens);
        words.set(0, Escapes.unescape(words.get(0)));
        return words.makeString(" ");
    }
}
