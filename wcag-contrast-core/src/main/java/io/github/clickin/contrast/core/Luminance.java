package io.github.clickin.contrast.core;

import java.util.Objects;

/**
 * Relative luminance of sRGB colors as defined by WCAG 2.1.
 *
 * <p>See <a href="https://www.w3.org/TR/WCAG21/#dfn-relative-luminance">relative luminance</a>.
 */
public final class Luminance {
    private Luminance() {}

    // sRGB inverse transfer function
    static final double LINEAR_THRESHOLD = 0.04045;
    static final double LINEAR_SLOPE = 12.92;
    static final double OFFSET = 0.055;
    static final double SCALE = 1.055;
    static final double GAMMA = 2.4;

    // Luminosity coefficients of the sRGB primaries
    static final double RED_WEIGHT = 0.2126;
    static final double GREEN_WEIGHT = 0.7152;
    static final double BLUE_WEIGHT = 0.0722;

    /**
     * Converts a normalized sRGB channel to linear light.
     *
     * @param channel a channel value in [0, 1]
     * @return the linear-light value
     */
    public static double linearize(double channel) {
        if (channel <= LINEAR_THRESHOLD) {
            return channel / LINEAR_SLOPE;
        }
        return Math.pow((channel + OFFSET) / SCALE, GAMMA);
    }

    /**
     * Computes the relative luminance of a color whose channels are in [0, 255].
     *
     * @param color the color
     * @return the luminance, 0 for black and 1 for white
     */
    public static double of(Color color) {
        Objects.requireNonNull(color, "color");
        Color normalized = color.normalize();
        return RED_WEIGHT * linearize(normalized.red())
                + GREEN_WEIGHT * linearize(normalized.green())
                + BLUE_WEIGHT * linearize(normalized.blue());
    }
}
