package com.gs.ep.spellbook.layout;

import java.io.IOException;

/**
 * A font needed for measuring or drawing text could not be loaded. Raised before any
 * page is produced.
 */
public class MetricsUnavailableException extends IOException {

    private final Style style;

    public MetricsUnavailableException(Style style, String message) {
        super(message);
        this.style = style;
    }

    public MetricsUnavailableException(Style style, String message, Throwable cause) {
        super(message, cause);
        this.style = style;
    }

    public Style getStyle() {
        return style;
    }
}
