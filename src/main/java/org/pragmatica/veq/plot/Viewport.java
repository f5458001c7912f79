package org.pragmatica.veq.plot;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Visible part of the plane: domain along x, range along y.
 */
public record Viewport(Interval domain, Interval range) {

    public static final Viewport DEFAULT = new Viewport(Interval.UNIT, Interval.UNIT);

    public Viewport {
        checkNotNull(domain, "domain");
        checkNotNull(range, "range");
    }

    public static Viewport of(Interval domain, Interval range) {
        return new Viewport(domain, range);
    }

    /**
     * Widen both axes by {@code by / 2} on each side; negative values zoom in.
     * Zooming in past an empty interval leaves the viewport unchanged.
     */
    public Viewport zoom(double by) {
        if (domain.canWiden(by) && range.canWiden(by)) {
            return new Viewport(domain.widen(by), range.widen(by));
        }
        return this;
    }

    public Viewport shift(double dx, double dy) {
        return new Viewport(domain.shift(dx), range.shift(dy));
    }

    /**
     * Width of the domain covered by one pixel column.
     */
    public double unitsPerPixel(int width) {
        checkArgument(width > 0, "width must be positive, got %s", width);
        return domain.width() / width;
    }

    /**
     * Pixel row of {@code y}; row 0 is the top of a surface {@code height} pixels tall.
     */
    public double toPixelRow(double y, int height) {
        return height - height / range.width() * (y - range.min());
    }
}
