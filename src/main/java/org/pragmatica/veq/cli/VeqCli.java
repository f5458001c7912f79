package org.pragmatica.veq.cli;

import org.pragmatica.veq.Expression;
import org.pragmatica.veq.Veq;
import org.pragmatica.veq.error.Diagnostic;
import org.pragmatica.veq.error.SyntaxError;
import org.pragmatica.veq.plot.CurveSampler;
import org.pragmatica.veq.plot.Interval;
import org.pragmatica.veq.plot.Viewport;
import org.pragmatica.veq.tree.Variable;

import java.io.PrintStream;
import java.util.Locale;

/**
 * Command line front end: parses an equation, samples it across the
 * requested viewport and prints the resulting polylines.
 */
public final class VeqCli {
    static final int EXIT_OK = 0;
    static final int EXIT_SYNTAX_ERROR = 1;
    static final int EXIT_USAGE = 2;

    private final PrintStream out;
    private final PrintStream err;

    VeqCli(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(new VeqCli(System.out, System.err).run(args));
    }

    int run(String... args) {
        CliOptions options;
        try {
            options = CliOptions.parse(args);
        } catch (IllegalArgumentException e) {
            err.println("veq: " + e.getMessage());
            err.print(CliOptions.USAGE);
            return EXIT_USAGE;
        }

        if (options.help()) {
            out.print(CliOptions.USAGE);
            return EXIT_OK;
        }

        return Veq.parse(options.equation())
                  .fold(error -> reportSyntaxError(options.equation(), error),
                        expression -> plot(expression, options));
    }

    private int reportSyntaxError(String equation, SyntaxError error) {
        err.print(Diagnostic.of(error).format(equation, "equation"));
        return EXIT_SYNTAX_ERROR;
    }

    private int plot(Expression expression, CliOptions options) {
        var viewport = Viewport.of(options.domain(), options.range());
        var polylines = CurveSampler.create(options.width(), options.height(), true)
                                    .sample(expression, viewport, options.time());
        var precision = options.precision();

        out.println("Equation: y = " + expression);
        out.println("Domain: " + format(viewport.domain(), precision));
        out.println("Range: " + format(viewport.range(), precision));
        if (expression.dependsOn(Variable.T)) {
            out.println("Time: t = " + format(options.time(), precision));
        }

        int index = 1;
        for (var polyline : polylines) {
            out.println("Polyline " + index++ + " (" + polyline.size() + " points)");
            for (var sample : polyline.samples()) {
                out.println("  " + format(sample.x(), precision) + " " + format(sample.y(), precision));
            }
        }
        if (polylines.isEmpty()) {
            out.println("Nothing to draw in this viewport");
        }
        return EXIT_OK;
    }

    private static String format(Interval interval, int precision) {
        return "[" + format(interval.min(), precision) + ", " + format(interval.max(), precision) + "]";
    }

    private static String format(double value, int precision) {
        return String.format(Locale.ROOT, "%." + precision + "f", value);
    }
}
