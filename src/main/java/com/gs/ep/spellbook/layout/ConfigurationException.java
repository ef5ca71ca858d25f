package com.gs.ep.spellbook.layout;

/**
 * Raised while building layout options from invalid values: negative sizes or margins,
 * margins that leave no room on the page, or configuration entries that cannot be parsed.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
