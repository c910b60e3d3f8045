package io.github.clickin.contrast.core;

/**
 * WCAG 2.1 contrast ratio between two colors.
 *
 * <p>The lighter luminance always goes in the numerator, so the result lies in [1, 21]
 * and does not depend on argument order.
 *
 * <p>See <a href="https://www.w3.org/TR/WCAG21/#dfn-contrast-ratio">contrast ratio</a>.
 */
public final class ContrastRatio {
    private ContrastRatio() {}

    static final double FLARE = 0.05;

    /** Lowest possible ratio, between two colors of equal luminance. */
    public static final double MIN = 1.0;

    /** Highest possible ratio, between black and white. */
    public static final double MAX = 21.0;

    public static double between(Color a, Color b) {
        return of(Luminance.of(a), Luminance.of(b));
    }

    /**
     * Contrast ratio of two precomputed relative luminances.
     *
     * @param luminanceA the first luminance
     * @param luminanceB the second luminance
     * @return the ratio
     */
    public static double of(double luminanceA, double luminanceB) {
        double lighter = Math.max(luminanceA, luminanceB);
        double darker = Math.min(luminanceA, luminanceB);
        return (lighter + FLARE) / (darker + FLARE);
    }
}
