package com.gs.ep.spellbook.layout;

/**
 * The markup escape rule: a token starting with exactly one backslash followed by any other character
 * is literal text, and that one backslash is dropped. Tokens starting with two or more backslashes are
 * left untouched, so unescaping is idempotent.
 */
public final class Escapes {

    public static final char ESCAPE = '\\';

    private Escapes() {
    }

    public static boolean isEscaped(String token) {
        return token.length() > 1 && token.charAt(0) == ESCAPE && token.charAt(1) != ESCAPE;
    }

    public static String unescape(String token) {
        return isEscaped(token) ? token.substring(1) : token;
    }
}
