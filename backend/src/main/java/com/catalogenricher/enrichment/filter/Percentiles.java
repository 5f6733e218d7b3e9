package com.catalogenricher.enrichment.filter;

import java.util.Collection;
import java.util.OptionalDouble;

/**
 * Linear-interpolation percentiles: position {@code p/100 * (n-1)} in the sorted sample, interpolated between
 * neighbours.
 */
public final class Percentiles {

    private Percentiles() {
    }

    /**
     * @param percentile in [0, 100]
     * @return empty for an empty sample
     */
    public static OptionalDouble linear(Collection<Double> values, double percentile) {
        if (percentile < 0 || percentile > 100 || Double.isNaN(percentile)) {
            throw new IllegalArgumentException("percentile must be within [0, 100]: " + percentile);
        }
        double[] sorted = values.stream().filter(v -> v != null && !v.isNaN()).mapToDouble(Double::doubleValue).sorted().toArray();
        if (sorted.length == 0) {
            return OptionalDouble.empty();
        }
        if (sorted.length == 1) {
            return OptionalDouble.of(sorted[0]);
        }
        double position = percentile / 100.0 * (sorted.length - 1);
        int lower = (int) Math.floor(position);
        int upper = Math.min(lower + 1, sorted.length - 1);
        double fraction = position - lower;
        return OptionalDouble.of(lerp(sorted[lower], sorted[upper], fraction));
    }

    private static double lerp(double a, double b, double t) {
        double diff = b - a;
        return t >= 0.5 ? b - diff * (1 - t) : a + diff * t;
    }
}
