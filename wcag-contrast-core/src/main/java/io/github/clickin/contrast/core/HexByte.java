package io.github.clickin.contrast.core;

/**
 * Conversion between a byte value and its two-digit hexadecimal form.
 */
public final class HexByte {
    private static final char[] DIGITS = "0123456789abcdef".toCharArray();

    private HexByte() {}

    /**
     * Decodes a two-character hex digit pair, high nibble first.
     *
     * <p>Digits are case-insensitive. Only ASCII {@code 0-9}, {@code a-f} and {@code A-F}
     * are accepted.
     *
     * @param pair the two hex digits
     * @return the decoded value, between 0 and 255
     * @throws WcagContrastException.InvalidHexByte if the pair is not two hex digits
     */
    public static int decode(String pair) {
        if (pair == null || pair.length() != 2) {
            throw new WcagContrastException.InvalidHexByte(HexDecodeError.INVALID_LENGTH, pair);
        }
        char left = pair.charAt(0);
        char right = pair.charAt(1);

        if (!isHexDigit(left)) {
            throw new WcagContrastException.InvalidHexByte(HexDecodeError.INVALID_LEFT_DIGIT, pair);
        }
        if (!isHexDigit(right)) {
            throw new WcagContrastException.InvalidHexByte(HexDecodeError.INVALID_RIGHT_DIGIT, pair);
        }

        int high = Character.digit(left, 16);
        int low = Character.digit(right, 16);

        // Only reachable if isHexDigit and Character.digit ever disagree.
        if (high < 0 || high > 15) {
            throw new WcagContrastException.InvalidHexByte(HexDecodeError.LEFT_DIGIT_OUT_OF_RANGE, pair);
        }
        if (low < 0 || low > 15) {
            throw new WcagContrastException.InvalidHexByte(HexDecodeError.RIGHT_DIGIT_OUT_OF_RANGE, pair);
        }

        return high * 16 + low;
    }

    /**
     * Encodes a byte value as two lowercase hex digits.
     *
     * @param value a value between 0 and 255
     * @return the two-digit hex form
     */
    public static String encode(int value) {
        if (value < 0 || value > 255) {
            throw new IllegalArgumentException("value must be within [0, 255]: " + value);
        }
        return new String(new char[] {DIGITS[value >>> 4], DIGITS[value & 0xf]});
    }

    static boolean isHexDigit(char c) {
        return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }
}
