package dev.multiverse.model;

import java.util.Arrays;

/**
 * A discretized distribution: quantiles {@code x} paired with cumulative probabilities {@code y}.
 */
public record CdfSample(double[] x, double[] y) {

    public CdfSample {
        if (x.length != y.length) {
            throw new IllegalArgumentException(
                "cdf.x and cdf.y differ in length: %d vs %d".formatted(x.length, y.length));
        }
        x = x.clone();
        y = y.clone();
    }

    @Override
    public double[] x() {
        return x.clone();
    }

    @Override
    public double[] y() {
        return y.clone();
    }

    public int size() {
        return x.length;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof CdfSample other && Arrays.equals(x, other.x) && Arrays.equals(y, other.y);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(x) + Arrays.hashCode(y);
    }

    @Override
    public String toString() {
        return "CdfSample[x=" + Arrays.toString(x) + ", y=" + Arrays.toString(y) + "]";
    }
}
