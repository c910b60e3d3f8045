package io.github.clickin.contrast.runner;

import io.github.clickin.contrast.core.Color;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Command-line options of {@link ContrastRunner}.
 *
 * @param foreground the foreground argument, or {@code null} to run the demo
 * @param background the background argument, or {@code null} to run the demo
 * @param json whether to print the report as JSON
 * @param help whether usage was requested
 */
record RunnerOptions(String foreground, String background, boolean json, boolean help) {

    static final String USAGE = """
            Usage: wcag-contrast [--json] [<foreground> <background>]

              <foreground>, <background>
                A hex color (RRGGBB or #RRGGBB) or an r,g,b triple (e.g. 242,108,167).
                Without colors, the contrast of 242,108,167 against #FFFFFF is shown.

              --json
                Print the contrast report as JSON.

              --help
                Print this message.
            """;

    static RunnerOptions parse(String[] args) {
        Objects.requireNonNull(args, "args");
        boolean json = false;
        boolean help = false;
        List<String> colors = new ArrayList<>();
        for (String arg : args) {
            switch (arg) {
                case "--json" -> json = true;
                case "--help", "-h" -> help = true;
                default -> {
                    if (arg.startsWith("--")) {
                        throw new IllegalArgumentException("unknown option: " + arg);
                    }
                    colors.add(arg);
                }
            }
        }
        if (!colors.isEmpty() && colors.size() != 2) {
            throw new IllegalArgumentException("expected a foreground and a background color, got " + colors.size());
        }
        return colors.isEmpty()
                ? new RunnerOptions(null, null, json, help)
                : new RunnerOptions(colors.get(0), colors.get(1), json, help);
    }

    boolean demo() {
        return foreground == null;
    }

    /**
     * Parses a color argument, either a hex color or an {@code r,g,b} triple.
     */
    static Color parseColor(String arg) {
        if (arg.indexOf(',') < 0) {
            return Color.fromHex(arg);
        }
        String[] parts = arg.split(",", -1);
        if (parts.length != 3) {
            throw new IllegalArgumentException("rgb color must have 3 channels: " + arg);
        }
        try {
            return Color.of(
                    Integer.parseInt(parts[0].trim()),
                    Integer.parseInt(parts[1].trim()),
                    Integer.parseInt(parts[2].trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("rgb channels must be integers: " + arg, e);
        }
    }
}
