package com.gs.ep.spellbook.model.renderer;

import com.gs.ep.spellbook.layout.Style;

import java.util.EnumMap;
import java.util.Map;

/**
 * Font file to embed for each style. Styles without a file fall back to the standard Times faces.
 */
public final class FontPaths {

    private final Map<Style, String> paths;

    private FontPaths(Map<Style, String> paths) {
        this.paths = paths;
    }

    public static FontPaths none() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return the configured path, or null when the style uses a standard font
     */
    public String get(Style style) {
        return paths.get(style);
    }

    public boolean isEmpty() {
        return paths.isEmpty();
    }

    public static final class Builder {

        private final Map<Style, String> paths = new EnumMap<>(Style.class);

        private Builder() {
        }

        public Builder path(Style style, String path) {
            paths.put(style, path);
            return this;
        }

        public FontPaths build() {
            return new FontPaths(new EnumMap<>(paths));
        }
    }
}
