package com.esgcredit.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * One {@link FeatureRow} per historical period, plus the series the rows were built from.
 */
public final class FeatureVector {
    public static final List<String> METRIC_COLUMNS = List.of(
            "value", "ma3", "ma6", "std6", "momentum3", "seasonal_mean"
    );
    public static final List<String> SHARED_COLUMNS = List.of(
            "month", "quarter", "year", "esg_balance"
    );

    public final HistoricalSeries series;
    public final List<FeatureRow> rows;

    public FeatureVector(HistoricalSeries series, List<FeatureRow> rows) {
        this.series = series;
        this.rows = rows == null ? List.of() : List.copyOf(rows);
    }

    public int size() {
        return rows.size();
    }

    public List<FeatureRow> completeRows() {
        List<FeatureRow> out = new ArrayList<>();
        for (FeatureRow row : rows) {
            if (row.complete()) {
                out.add(row);
            }
        }
        return out;
    }

    /**
     * Column names of the regression input for one metric, e.g. {@code e_ma3}.
     */
    public static List<String> columnNames(Pillar pillar) {
        String prefix = pillar.code().toLowerCase(Locale.ROOT) + "_";
        List<String> out = new ArrayList<>(METRIC_COLUMNS.size() + SHARED_COLUMNS.size());
        for (String c : METRIC_COLUMNS) {
            out.add(prefix + c);
        }
        out.addAll(SHARED_COLUMNS);
        return out;
    }

    /**
     * Values in {@link #columnNames(Pillar)} order.
     */
    public static double[] columns(FeatureRow row, Pillar pillar) {
        MetricFeatures m = row.metric(pillar);
        return new double[]{
                m.value,
                m.rollingMean3,
                m.rollingMean6,
                m.rollingStd6,
                m.momentum3,
                m.seasonalMean,
                row.month,
                row.quarter,
                row.year,
                row.esgBalance
        };
    }
}
