package dev.multiverse.model;

import java.time.Duration;

/**
 * Execution limits for a multiverse run.
 */
public record EngineSettings(
    int concurrency,
    Duration universeTimeout, // nullable, no timeout
    int gridResolution
) {
    public static final int DEFAULT_CONCURRENCY = Runtime.getRuntime().availableProcessors();
    public static final Duration DEFAULT_UNIVERSE_TIMEOUT = null;
    public static final int DEFAULT_GRID_RESOLUTION = CdfGrid.DEFAULT_RESOLUTION;

    public EngineSettings {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be at least 1, got " + concurrency);
        }
        if (universeTimeout != null && (universeTimeout.isNegative() || universeTimeout.isZero())) {
            throw new IllegalArgumentException("universe timeout must be positive, got " + universeTimeout);
        }
        if (gridResolution < 1) {
            throw new IllegalArgumentException("grid resolution must be at least 1, got " + gridResolution);
        }
    }

    public static EngineSettings defaults() {
        return new EngineSettings(DEFAULT_CONCURRENCY, DEFAULT_UNIVERSE_TIMEOUT, DEFAULT_GRID_RESOLUTION);
    }

    public CdfGrid grid() {
        return new CdfGrid(gridResolution);
    }

    public EngineSettings withConcurrency(int concurrency) {
        return new EngineSettings(concurrency, universeTimeout, gridResolution);
    }

    public EngineSettings withUniverseTimeout(Duration universeTimeout) {
        return new EngineSettings(concurrency, universeTimeout, gridResolution);
    }

    public EngineSettings withGridResolution(int gridResolution) {
        return new EngineSettings(concurrency, universeTimeout, gridResolution);
    }
}
