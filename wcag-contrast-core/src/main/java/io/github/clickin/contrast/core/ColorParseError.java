package io.github.clickin.contrast.core;

/**
 * Reasons a hex color string can fail to parse, in the order they are checked.
 */
public enum ColorParseError {
    EMPTY_INPUT("color must not be empty"),
    NON_ASCII_INPUT("color contains non-ASCII characters"),
    INVALID_LENGTH("color must be RRGGBB or #RRGGBB"),
    INVALID_CHANNEL("color contains an invalid channel");

    private final String message;

    ColorParseError(String message) {
        this.message = message;
    }

    String describe(String input) {
        if (input == null || input.isEmpty()) return message;
        return message + ": \"" + input + "\"";
    }
}
