package dev.multiverse.model;

/**
 * Evenly spaced cumulative-probability levels {@code i / (resolution + 1)} for {@code i = 1..resolution}.
 * The default resolution of 99 gives the 1st through 99th percentiles.
 */
public record CdfGrid(int resolution) {

    public static final int DEFAULT_RESOLUTION = 99;

    public CdfGrid {
        if (resolution < 1) {
            throw new IllegalArgumentException("Grid resolution must be at least 1, got " + resolution);
        }
    }

    public static CdfGrid defaults() {
        return new CdfGrid(DEFAULT_RESOLUTION);
    }

    public double[] levels() {
        double[] levels = new double[resolution];
        for (int i = 0; i < resolution; i++) {
            levels[i] = (i + 1) / (double) (resolution + 1);
        }
        return levels;
    }
}
