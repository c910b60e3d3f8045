package io.github.clickin.contrast.core;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Luminance and contrast of a foreground/background color pair.
 *
 * @param foreground the foreground color
 * @param background the background color
 * @param foregroundLuminance relative luminance of the foreground
 * @param backgroundLuminance relative luminance of the background
 * @param ratio the contrast ratio
 * @param levels conformance levels met by the ratio
 */
public record ContrastReport(
        Color foreground,
        Color background,
        double foregroundLuminance,
        double backgroundLuminance,
        double ratio,
        Set<ContrastLevel> levels) {

    public ContrastReport {
        Objects.requireNonNull(foreground, "foreground");
        Objects.requireNonNull(background, "background");
        levels = (levels == null || levels.isEmpty())
                ? Collections.unmodifiableSet(EnumSet.noneOf(ContrastLevel.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(levels));
    }

    public static ContrastReport of(Color foreground, Color background) {
        double fg = Luminance.of(foreground);
        double bg = Luminance.of(background);
        double ratio = ContrastRatio.of(fg, bg);
        return new ContrastReport(foreground, background, fg, bg, ratio, ContrastLevel.metBy(ratio));
    }

    public boolean meets(ContrastLevel level) {
        return levels.contains(level);
    }
}
