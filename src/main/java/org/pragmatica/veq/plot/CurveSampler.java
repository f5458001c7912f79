package org.pragmatica.veq.plot;

import com.google.common.collect.ImmutableList;
import org.pragmatica.veq.Expression;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Samples an expression once per pixel column across the visible domain
 * and splits the result into drawable polylines.
 *
 * <p>A polyline ends at any sample that is NaN, infinite, or more than
 * {@value #OFFSCREEN_FACTOR} surface heights away from the top edge.
 * Non-finite samples are dropped; far off-screen ones open the next polyline.
 * Polylines with fewer than two samples are discarded.
 */
public final class CurveSampler {
    static final int OFFSCREEN_FACTOR = 4;

    private final int width;
    private final int height;
    private final boolean parallel;

    private CurveSampler(int width, int height, boolean parallel) {
        this.width = width;
        this.height = height;
        this.parallel = parallel;
    }

    public static CurveSampler create(int width, int height) {
        return create(width, height, false);
    }

    /**
     * @param parallel evaluate columns on the common fork-join pool
     */
    public static CurveSampler create(int width, int height, boolean parallel) {
        checkArgument(width > 0, "width must be positive, got %s", width);
        checkArgument(height > 0, "height must be positive, got %s", height);
        return new CurveSampler(width, height, parallel);
    }

    public List<Polyline> sample(Expression expression, Viewport viewport, double t) {
        checkNotNull(expression, "expression");
        checkNotNull(viewport, "viewport");

        var left = viewport.domain().min();
        var dx = viewport.unitsPerPixel(width);
        var values = evaluateColumns(expression, left, dx, t);

        var polylines = ImmutableList.<Polyline>builder();
        var current = new ArrayList<Polyline.Sample>();
        for (int column = 0; column < width; column++) {
            var x = left + dx * column;
            var y = values[column];
            var row = viewport.toPixelRow(y, height);

            if (!Double.isFinite(y) || Math.abs(row) > (double) height * OFFSCREEN_FACTOR) {
                flush(current, polylines);
                if (!Double.isFinite(y)) {
                    continue;
                }
            }
            current.add(new Polyline.Sample(column, x, y, row));
        }
        flush(current, polylines);
        return polylines.build();
    }

    private double[] evaluateColumns(Expression expression, double left, double dx, double t) {
        var columns = IntStream.range(0, width);
        if (parallel) {
            columns = columns.parallel();
        }
        return columns.mapToDouble(column -> expression.evaluate(left + dx * column, t))
                      .toArray();
    }

    private static void flush(List<Polyline.Sample> current, ImmutableList.Builder<Polyline> polylines) {
        if (current.size() >= 2) {
            polylines.add(new Polyline(current));
        }
        current.clear();
    }
}
