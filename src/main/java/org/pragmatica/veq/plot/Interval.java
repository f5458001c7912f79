package org.pragmatica.veq.plot;

import java.util.Optional;
import java.util.regex.Pattern;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Closed interval {@code [min, max]} of one plot axis.
 */
public record Interval(double min, double max) {
    private static final Pattern INTERVAL_PATTERN =
        Pattern.compile("^\\[(-?\\d+\\.?\\d*),\\s*(-?\\d+\\.?\\d*)]$");

    public static final Interval UNIT = new Interval(-1, 1);

    public Interval {
        checkArgument(min < max, "Interval bounds must be ascending, got [%s, %s]", min, max);
    }

    public static Interval of(double min, double max) {
        return new Interval(min, max);
    }

    /**
     * Parse the {@code [min, max]} form used on the command line.
     * Empty when the text is malformed or the bounds are not ascending.
     */
    public static Optional<Interval> parse(String text) {
        var matcher = INTERVAL_PATTERN.matcher(text.trim());
        if (!matcher.matches()) {
            return Optional.empty();
        }
        double min = Double.parseDouble(matcher.group(1));
        double max = Double.parseDouble(matcher.group(2));
        if (!(min < max)) {
            return Optional.empty();
        }
        return Optional.of(new Interval(min, max));
    }

    public double width() {
        return max - min;
    }

    public Interval shift(double delta) {
        return new Interval(min + delta, max + delta);
    }

    /**
     * Widen by {@code by / 2} on each side. Negative values narrow.
     */
    public Interval widen(double by) {
        return new Interval(min - by / 2, max + by / 2);
    }

    public boolean canWiden(double by) {
        return min - by / 2 < max + by / 2;
    }

    @Override
    public String toString() {
        return "[" + min + ", " + max + "]";
    }
}
