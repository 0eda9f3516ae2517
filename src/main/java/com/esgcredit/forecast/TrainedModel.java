package com.esgcredit.forecast;

import com.esgcredit.model.HistoricalSeries;
import com.esgcredit.model.Pillar;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Fitted state of {@link ForecastModel}: the training history and one regressor per metric.
 * Immutable, so concurrent {@code predict} calls may share it.
 */
public final class TrainedModel {
    private final HistoricalSeries history;
    private final Map<Pillar, MetricRegressor> regressors;
    private final long seed;

    TrainedModel(HistoricalSeries history, Map<Pillar, MetricRegressor> regressors, long seed) {
        this.history = history;
        this.regressors = Collections.unmodifiableMap(new EnumMap<>(regressors));
        this.seed = seed;
    }

    public HistoricalSeries history() {
        return history;
    }

    public long seed() {
        return seed;
    }

    public int trainingSize(Pillar pillar) {
        return regressors.get(pillar).trainingSize();
    }

    public boolean usesForest(Pillar pillar) {
        return regressors.get(pillar).usesForest();
    }

    MetricRegressor regressor(Pillar pillar) {
        return regressors.get(pillar);
    }
}
