package com.gs.ep.spellbook.layout;

import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a marked-up description into {@link MarkupToken}s. Every input line is a paragraph and is
 * followed by a paragraph break token. A paragraph made of a single {@code [table][N]} token refers
 * to the item's N-th table record.
 */
public class MarkupTokenizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(MarkupTokenizer.class);

    public static final String TABLE_TAG = "<table>";
    private static final Pattern TABLE_REFERENCE = Pattern.compile("\\[table]\\[(\\d+)]");

    private final int tableCount;

    /**
     * @param tableCount number of table records the description may refer to
     */
    public MarkupTokenizer(int tableCount) {
        this.tableCount = tableCount;
    }

    public MutableList<MarkupToken> tokenize(String markup) {
        MutableList<MarkupToken> tokens = Lists.mutable.empty();
        for (String paragraph : markup.split("\n", -1)) {
            MutableList<String> words = LineWrapper.tokens(paragraph);
            MarkupToken reference = words.size() == 1 ? tableReference(words.getFirst()) : null;
            if (reference != null) {
                tokens.add(reference);
            } else {
                for (String word : words) {
                    tokens.add(classify(word));
                }
            }
            tokens.add(MarkupToken.paragraphBreak());
        }
        return tokens;
    }

    private MarkupToken tableReference(String word) {
        Matcher matcher = TABLE_REFERENCE.matcher(word);
        if (!matcher.matches()) {
            return null;
        }
        int index;
        try {
            index = Integer.parseInt(matcher.group(1));
        } catch (NumberFormatException e) {
            index = -1;
        }
        if (index < 0 || index >= tableCount) {
            LOGGER.warn("Table reference {} does not match any of the {} tables, writing it as text", word, tableCount);
            return null;
        }
        return MarkupToken.tableReference(word, index);
    }

    static MarkupToken classify(String word) {
        Style style = Style.fromTag(word);
        if (style != null) {
            return MarkupToken.styleChange(word, style);
        }
        if (TABLE_TAG.equals(word)) {
            return MarkupToken.tableToggle(word);
        }
        if (Escapes.isEscaped(word)) {
            return MarkupToken.escaped(word);
        }
        return MarkupToken.plain(word);
    }
}
