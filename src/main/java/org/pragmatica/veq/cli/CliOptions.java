package org.pragmatica.veq.cli;

import org.pragmatica.veq.plot.Interval;

import java.util.Locale;

/**
 * Command line options of the {@code veq} tool.
 */
public record CliOptions(
    String equation,
    Interval domain,
    Interval range,
    int width,
    int height,
    double time,
    int precision,
    boolean help
) {
    static final String USAGE = """
        usage: veq [options] <equation>

        Plot y = f(x, t) as text.

        options:
          -d, --domain [a, b]   initial domain (default [-1, 1])
          -r, --range [a, b]    initial range (default [-1, 1])
          -w, --width n         surface width in pixels (default 900)
              --height n        surface height in pixels (default 900)
          -t, --time v          value of t (default 0)
          -p, --precision n     digits after the decimal point (default 2)
          -h, --help            show this message
          --                    treat the next argument as the equation
        """;

    private static final int DEFAULT_SIZE = 900;
    private static final int DEFAULT_PRECISION = 2;

    /**
     * Parse arguments. The equation is lower-cased.
     *
     * @throws IllegalArgumentException describing the first invalid argument
     */
    public static CliOptions parse(String... args) {
        String equation = null;
        var domain = Interval.UNIT;
        var range = Interval.UNIT;
        int width = DEFAULT_SIZE;
        int height = DEFAULT_SIZE;
        double time = 0;
        int precision = DEFAULT_PRECISION;

        for (int i = 0; i < args.length; i++) {
            var arg = args[i];
            switch (arg) {
                case "-h", "--help" -> {
                    return new CliOptions("", domain, range, width, height, time, precision, true);
                }
                case "-d", "--domain" -> domain = interval(arg, valueAfter(args, ++i, arg));
                case "-r", "--range" -> range = interval(arg, valueAfter(args, ++i, arg));
                case "-w", "--width" -> width = positive(arg, integer(arg, valueAfter(args, ++i, arg)));
                case "--height" -> height = positive(arg, integer(arg, valueAfter(args, ++i, arg)));
                case "-t", "--time" -> time = number(arg, valueAfter(args, ++i, arg));
                case "-p", "--precision" -> {
                    precision = integer(arg, valueAfter(args, ++i, arg));
                    if (precision < 0) {
                        throw new IllegalArgumentException("Minimum precision is zero.");
                    }
                }
                case "--" -> {
                    equation = equation(equation, valueAfter(args, ++i, arg));
                }
                default -> {
                    // Single-dash arguments that are not options are equations such as -x^2
                    if (arg.startsWith("--")) {
                        throw new IllegalArgumentException("Unknown option: " + arg);
                    }
                    equation = equation(equation, arg);
                }
            }
        }

        if (equation == null) {
            throw new IllegalArgumentException("Missing equation");
        }
        return new CliOptions(equation, domain, range, width, height, time, precision, false);
    }

    private static String equation(String previous, String arg) {
        if (previous != null) {
            throw new IllegalArgumentException("Unexpected argument: " + arg);
        }
        return arg.toLowerCase(Locale.ROOT);
    }

    private static String valueAfter(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new IllegalArgumentException("Missing value for " + option);
        }
        return args[index];
    }

    private static Interval interval(String option, String value) {
        return Interval.parse(value)
                       .orElseThrow(() -> new IllegalArgumentException("Invalid " + option + " format: " + value));
    }

    private static int integer(String option, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + option + " value: " + value, e);
        }
    }

    private static double number(String option, String value) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + option + " value: " + value, e);
        }
    }

    private static int positive(String option, int value) {
        if (value <= 0) {
            throw new IllegalArgumentException(option + " must be positive, got " + value);
        }
        return value;
    }
}
