package io.github.clickin.contrast.core;

/**
 * Reasons a hex digit pair can fail to decode.
 */
public enum HexDecodeError {
    /** Input is not exactly two characters long. */
    INVALID_LENGTH("hex byte must be exactly 2 characters"),

    /** First character is not a hexadecimal digit. */
    INVALID_LEFT_DIGIT("left character is not a hex digit"),

    /** Second character is not a hexadecimal digit. */
    INVALID_RIGHT_DIGIT("right character is not a hex digit"),

    /** First digit decoded to a nibble above 15. */
    LEFT_DIGIT_OUT_OF_RANGE("left digit exceeds 0xf"),

    /** Second digit decoded to a nibble above 15. */
    RIGHT_DIGIT_OUT_OF_RANGE("right digit exceeds 0xf");

    private final String message;

    HexDecodeError(String message) {
        this.message = message;
    }

    String describe(String input) {
        return message + ": " + (input == null ? "null" : "\"" + input + "\"");
    }
}
