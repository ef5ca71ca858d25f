package com.gs.ep.spellbook.model;

import java.nio.file.Path;

public class SpellFileException extends Exception {

    private final Path path;

    public SpellFileException(Path path, String message) {
        super(message + ": " + path);
        this.path = path;
    }

    public SpellFileException(Path path, String message, Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
