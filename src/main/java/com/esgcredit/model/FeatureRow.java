package com.esgcredit.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.YearMonth;
import java.util.Map;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class FeatureRow {
    public final YearMonth period;
    public final int month;
    public final int quarter;
    public final int year;
    public final double esgBalance;
    public final Map<Pillar, MetricFeatures> metrics;

    public MetricFeatures metric(Pillar pillar) {
        return metrics.get(pillar);
    }

    /**
     * False while any rolling window of any metric still lacks history.
     */
    public boolean complete() {
        for (MetricFeatures f : metrics.values()) {
            if (!f.complete()) {
                return false;
            }
        }
        return true;
    }
}
