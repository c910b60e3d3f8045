package io.github.clickin.contrast.core;

import java.util.Locale;

/**
 * Immutable sRGB color with three floating-point channels.
 *
 * <p>Colors built from 8-bit input hold channels in [0, 255]; {@link #normalize()} yields
 * a new color with channels in [0, 1]. Channels outside [0, 255], and non-finite channels,
 * are rejected at construction.
 */
public final class Color {

    private final double red;
    private final double green;
    private final double blue;

    private Color(double red, double green, double blue) {
        this.red = checkChannel(Channel.RED, red);
        this.green = checkChannel(Channel.GREEN, green);
        this.blue = checkChannel(Channel.BLUE, blue);
    }

    /**
     * Creates a color from 8-bit channel values.
     *
     * @param red the red channel, 0 to 255
     * @param green the green channel, 0 to 255
     * @param blue the blue channel, 0 to 255
     * @return the color
     * @throws WcagContrastException.InvalidChannel if a channel is outside 0..255
     */
    public static Color of(int red, int green, int blue) {
        return new Color(red, green, blue);
    }

    /**
     * Parses a color from {@code RRGGBB} or {@code #RRGGBB}.
     *
     * <p>Checks run in a fixed order: empty input, then non-ASCII characters, then length
     * (after lowercasing and stripping surrounding whitespace), then each channel's digits.
     *
     * @param hex the hex color
     * @return the parsed color
     * @throws WcagContrastException.InvalidColor if the input is not a 6-digit hex color
     */
    public static Color fromHex(String hex) {
        if (hex == null || hex.isEmpty()) {
            throw new WcagContrastException.InvalidColor(ColorParseError.EMPTY_INPUT, hex);
        }
        for (int i = 0; i < hex.length(); i++) {
            if (hex.charAt(i) > 0x7f) {
                throw new WcagContrastException.InvalidColor(ColorParseError.NON_ASCII_INPUT, hex);
            }
        }

        String digits = hex.toLowerCase(Locale.ROOT).strip();
        boolean prefixed = digits.length() == 7 && digits.charAt(0) == '#';
        if (digits.length() != 6 && !prefixed) {
            throw new WcagContrastException.InvalidColor(ColorParseError.INVALID_LENGTH, hex);
        }
        if (prefixed) {
            digits = digits.substring(1);
        }

        int r = decodeChannel(Channel.RED, digits.substring(0, 2), hex);
        int g = decodeChannel(Channel.GREEN, digits.substring(2, 4), hex);
        int b = decodeChannel(Channel.BLUE, digits.substring(4, 6), hex);
        return new Color(r, g, b);
    }

    private static int decodeChannel(Channel channel, String pair, String input) {
        try {
            return HexByte.decode(pair);
        } catch (WcagContrastException.InvalidHexByte e) {
            throw new WcagContrastException.InvalidColor(channel, input, e);
        }
    }

    private static double checkChannel(Channel channel, double value) {
        if (!(value >= 0.0 && value <= 255.0)) {
            throw new WcagContrastException.InvalidChannel(channel, value);
        }
        return value;
    }

    /**
     * Returns a new color with every channel divided by 255.
     *
     * @return the normalized color
     */
    public Color normalize() {
        return new Color(red / 255.0, green / 255.0, blue / 255.0);
    }

    public double red() {
        return red;
    }

    public double green() {
        return green;
    }

    public double blue() {
        return blue;
    }

    /**
     * Formats this color as lowercase {@code #rrggbb}, rounding each channel to the nearest
     * integer.
     *
     * @return the hex form
     */
    public String toHex() {
        return "#" + HexByte.encode((int) Math.round(red))
                + HexByte.encode((int) Math.round(green))
                + HexByte.encode((int) Math.round(blue));
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof Color)) return false;
        Color o = (Color) other;
        return Double.compare(red, o.red) == 0
                && Double.compare(green, o.green) == 0
                && Double.compare(blue, o.blue) == 0;
    }

    @Override
    public int hashCode() {
        int h = Double.hashCode(red);
        h = 31 * h + Double.hashCode(green);
        return 31 * h + Double.hashCode(blue);
    }

    @Override
    public String toString() {
        return "(r: " + red + ", g: " + green + ", b: " + blue + ")";
    }
}
