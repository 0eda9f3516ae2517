package com.esgcredit.forecast;

import com.esgcredit.config.Config;
import com.esgcredit.core.ConfigurationException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * Ensemble size, tree shape, seed and band width of the forecaster.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class ForecastSettings {
    public final long seed;
    public final int members;
    public final int trees;
    public final int maxDepth;
    public final int nodeSize;
    public final double z;

    public static ForecastSettings fromConfig(Config config) {
        ForecastSettings settings = new ForecastSettings(
                config.getLong("forecast.seed", 42L),
                config.getInt("forecast.members", 5),
                config.getInt("forecast.trees", 40),
                config.getInt("forecast.max_depth", 8),
                config.getInt("forecast.node_size", 3),
                config.getDouble("forecast.z", 1.96)
        );
        settings.validate();
        return settings;
    }

    public static ForecastSettings defaults() {
        return new ForecastSettings(42L, 5, 40, 8, 3, 1.96);
    }

    public void validate() {
        if (members < 1 || trees < 1 || maxDepth < 2 || nodeSize < 2) {
            throw new ConfigurationException("forecast", "members and trees must be >= 1, max_depth and node_size >= 2");
        }
        if (seed < 0L) {
            throw new ConfigurationException("forecast.seed", "seed must be >= 0, got " + seed);
        }
        if (!Double.isFinite(z) || z <= 0.0) {
            throw new ConfigurationException("forecast.z", "z must be a positive number, got " + z);
        }
    }

    int minForestSamples() {
        return 2 * nodeSize;
    }
}
