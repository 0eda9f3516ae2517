package com.esgcredit.scoring;

import com.esgcredit.config.Config;
import com.esgcredit.core.ConfigurationException;
import com.esgcredit.model.Pillar;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Pillar weights of the composite score plus the improvement threshold.
 */
public final class ScoringPolicy {
    private static final double WEIGHT_TOLERANCE = 1e-9;

    private final Map<Pillar, Double> weights;
    private final double improvementThreshold;

    public ScoringPolicy(Map<Pillar, Double> weights, double improvementThreshold) {
        double sum = 0.0;
        Map<Pillar, Double> copy = new EnumMap<>(Pillar.class);
        for (Pillar pillar : Pillar.values()) {
            Double w = weights == null ? null : weights.get(pillar);
            if (w == null || !Double.isFinite(w) || w < 0.0) {
                throw new ConfigurationException("score.weight." + pillar.key(), "weight must be a finite value >= 0, got " + w);
            }
            copy.put(pillar, w);
            sum += w;
        }
        if (Math.abs(sum - 1.0) > WEIGHT_TOLERANCE) {
            throw new ConfigurationException("score.weight", String.format(Locale.US, "weights sum to %.6f, expected 1", sum));
        }
        this.weights = Collections.unmodifiableMap(copy);
        this.improvementThreshold = improvementThreshold;
    }

    public static ScoringPolicy fromConfig(Config config) {
        Map<Pillar, Double> weights = new EnumMap<>(Pillar.class);
        for (Pillar pillar : Pillar.values()) {
            weights.put(pillar, config.getDouble("score.weight." + pillar.key(), Double.NaN));
        }
        return new ScoringPolicy(weights, config.getDouble("score.improvement_threshold", 70.0));
    }

    public double weight(Pillar pillar) {
        return weights.get(pillar);
    }

    public double improvementThreshold() {
        return improvementThreshold;
    }
}
