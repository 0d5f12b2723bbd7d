package com.leaksentinel.core.model;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Immutable numeric description of a window.
 *
 * <p>
 * Extracted vectors always have {@link #DIMENSION} entries in the order of
 * {@link #NAMES}; scaled or transformed vectors keep that order.
 * </p>
 *
 * @since 1.0.0
 */
public final class FeatureVector {

    /** Feature names, in vector order. */
    public static final List<String> NAMES = List.of(
            "pressure_mean", "pressure_std", "pressure_min", "pressure_max",
            "pressure_median", "pressure_q25", "pressure_q75",
            "frequency_mean", "frequency_std", "frequency_min", "frequency_max",
            "frequency_median",
            "pressure_slope", "frequency_slope",
            "pressure_variance", "frequency_variance",
            "pressure_frequency_correlation");

    public static final int DIMENSION = NAMES.size();

    private final double[] values;

    public FeatureVector(double[] values) {
        Objects.requireNonNull(values, "values must not be null");
        this.values = values.clone();
    }

    public double get(int i) {
        return values[i];
    }

    public int dimension() {
        return values.length;
    }

    /**
     * @return a copy of the raw values
     */
    public double[] toArray() {
        return values.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof FeatureVector that))
            return false;
        return Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "FeatureVector" + Arrays.toString(values);
    }
}
