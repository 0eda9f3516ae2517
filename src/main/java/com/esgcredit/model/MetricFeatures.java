package com.esgcredit.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * Per-metric feature columns of one period. {@code NaN} marks a window without enough history.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class MetricFeatures {
    public final double value;
    public final double rollingMean3;
    public final double rollingMean6;
    public final double rollingStd6;
    public final double momentum3;
    public final double seasonalMean;

    public boolean complete() {
        return !Double.isNaN(rollingMean3)
                && !Double.isNaN(rollingMean6)
                && !Double.isNaN(rollingStd6)
                && !Double.isNaN(momentum3);
    }
}
