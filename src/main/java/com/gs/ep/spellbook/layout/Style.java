package com.gs.ep.spellbook.layout;

/**
 * Font variant used for a run of text. The markup tags that select each variant
 * are {@code <r>}, {@code <b>}, {@code <i>} and {@code <bi>} / {@code <ib>}.
 */
public enum Style {
    REGULAR("Regular"),
    BOLD("Bold"),
    ITALIC("Italic"),
    BOLD_ITALIC("Bold Italic");

    private final String displayName;

    Style(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Returns the style selected by a font tag such as {@code <bi>}, or null when the
     * string is not a font tag.
     */
    public static Style fromTag(String tag) {
        switch (tag) {
            case "<r>":
                return REGULAR;
            case "<b>":
                return BOLD;
            case "<i>":
                return ITALIC;
            case "<bi>":
            case "<ib>":
                return BOLD_ITALIC;
            default:
                return null;
        }
    }

    public static Style fromName(String name) {
        for (Style style : values()) {
            if (style.name().equalsIgnoreCase(name) || style.displayName.equalsIgnoreCase(name)) {
                return style;
            }
        }
        throw new ConfigurationException("Unknown font style: " + name);
    }
}
