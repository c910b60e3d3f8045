package io.github.clickin.contrast.core;

import java.util.EnumSet;
import java.util.Set;

/**
 * WCAG 2.1 contrast conformance levels and their minimum ratios.
 */
public enum ContrastLevel {
    /** Level AA for large-scale text (success criterion 1.4.3). */
    AA_LARGE_TEXT(3.0),

    /** Level AA for normal text (success criterion 1.4.3). */
    AA(4.5),

    /** Level AAA for large-scale text (success criterion 1.4.6). */
    AAA_LARGE_TEXT(4.5),

    /** Level AAA for normal text (success criterion 1.4.6). */
    AAA(7.0);

    private final double minimumRatio;

    ContrastLevel(double minimumRatio) {
        this.minimumRatio = minimumRatio;
    }

    public double minimumRatio() {
        return minimumRatio;
    }

    public boolean isMetBy(double ratio) {
        return ratio >= minimumRatio;
    }

    /**
     * Returns every level satisfied by the given ratio.
     *
     * @param ratio a contrast ratio
     * @return the satisfied levels, possibly empty
     */
    public static Set<ContrastLevel> metBy(double ratio) {
        EnumSet<ContrastLevel> met = EnumSet.noneOf(ContrastLevel.class);
        for (ContrastLevel level : values()) {
            if (level.isMetBy(ratio)) met.add(level);
        }
        return met;
    }
}
