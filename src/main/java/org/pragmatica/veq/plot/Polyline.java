package org.pragmatica.veq.plot;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Connected run of curve samples, ordered by pixel column.
 */
public record Polyline(List<Sample> samples) {

    public Polyline {
        samples = ImmutableList.copyOf(samples);
    }

    /**
     * One evaluated point.
     *
     * @param column   pixel column
     * @param x        domain value at the column
     * @param y        expression value
     * @param pixelRow pixel row of {@code y}, may lie outside the surface
     */
    public record Sample(int column, double x, double y, double pixelRow) {}

    public int size() {
        return samples.size();
    }
}
