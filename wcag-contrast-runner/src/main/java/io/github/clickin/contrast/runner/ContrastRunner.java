package io.github.clickin.contrast.runner;

import io.github.clickin.contrast.core.Color;
import io.github.clickin.contrast.core.ContrastLevel;
import io.github.clickin.contrast.core.ContrastRatio;
import io.github.clickin.contrast.core.ContrastReport;
import io.github.clickin.contrast.core.Luminance;
import io.github.clickin.contrast.core.WcagContrastException;
import io.github.clickin.contrast.json.jackson.JacksonReportCodec;
import io.github.clickin.contrast.json.jackson.ReportCodecException;

import java.io.PrintStream;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Prints the luminance and contrast ratio of two colors.
 */
public final class ContrastRunner {
    private static final Logger logger = Logger.getLogger(ContrastRunner.class.getName());

    static final int EXIT_OK = 0;
    static final int EXIT_OUTPUT_FAILED = 1;
    static final int EXIT_INVALID_INPUT = 2;

    static final String DEMO_BACKGROUND = "#FFFFFF";
    static final Color DEMO_FOREGROUND = Color.of(242, 108, 167);

    private final PrintStream out;
    private final PrintStream err;
    private final JacksonReportCodec codec;

    ContrastRunner(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
        this.codec = new JacksonReportCodec().pretty();
    }

    public static void main(String[] args) {
        int status = new ContrastRunner(System.out, System.err).run(args);
        if (status != EXIT_OK) {
            System.exit(status);
        }
    }

    int run(String[] args) {
        RunnerOptions options;
        try {
            options = RunnerOptions.parse(args);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.print(RunnerOptions.USAGE);
            return EXIT_INVALID_INPUT;
        }
        if (options.help()) {
            out.print(RunnerOptions.USAGE);
            return EXIT_OK;
        }

        String foregroundArg = options.demo() ? null : options.foreground();
        String backgroundArg = options.demo() ? DEMO_BACKGROUND : options.background();
        Color foreground;
        Color background;
        try {
            foreground = foregroundArg == null ? DEMO_FOREGROUND : RunnerOptions.parseColor(foregroundArg);
            background = RunnerOptions.parseColor(backgroundArg);
        } catch (WcagContrastException | IllegalArgumentException e) {
            logger.log(Level.FINE, "Rejected color input", e);
            err.println("invalid color: " + e.getMessage());
            return EXIT_INVALID_INPUT;
        }

        ContrastReport report = ContrastReport.of(foreground, background);
        logger.fine(() -> "Compared " + report.foreground() + " with " + report.background());
        if (options.json()) {
            try {
                out.println(codec.writeString(report));
            } catch (ReportCodecException e) {
                logger.log(Level.SEVERE, "Could not write contrast report", e);
                err.println(e.getMessage());
                return EXIT_OUTPUT_FAILED;
            }
        } else if (options.demo()) {
            printDemo(background, foreground);
        } else {
            printReport(report);
        }
        return EXIT_OK;
    }

    private void printDemo(Color white, Color target) {
        out.println("white from hex: " + white);
        out.println("target from rgb: " + target);
        out.println("luminance of white is " + Luminance.of(white));
        out.println("luminance of target is " + Luminance.of(target));
        out.println("contrast target, white is " + ContrastRatio.between(target, white));
        out.println("contrast white, target is " + ContrastRatio.between(white, target));
    }

    private void printReport(ContrastReport report) {
        out.println(String.format(Locale.ROOT, "foreground %s %s luminance %.4f",
                report.foreground().toHex(), report.foreground(), report.foregroundLuminance()));
        out.println(String.format(Locale.ROOT, "background %s %s luminance %.4f",
                report.background().toHex(), report.background(), report.backgroundLuminance()));
        out.println(String.format(Locale.ROOT, "contrast ratio %.2f:1", report.ratio()));
        for (ContrastLevel level : ContrastLevel.values()) {
            out.println(String.format(Locale.ROOT, "  %-15s %s (>= %.1f)",
                    level, report.meets(level) ? "pass" : "fail", level.minimumRatio()));
        }
    }
}
