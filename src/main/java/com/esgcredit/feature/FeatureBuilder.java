package com.esgcredit.feature;

import com.esgcredit.model.FeatureRow;
import com.esgcredit.model.FeatureVector;
import com.esgcredit.model.HistoricalSeries;
import com.esgcredit.model.MetricFeatures;
import com.esgcredit.model.Pillar;
import com.esgcredit.model.SeriesPoint;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 模块说明：FeatureBuilder（class）。
 * 主要职责：把月度 E/S/G 序列转换为特征矩阵：滚动均值、滚动标准差、动量、季节均值、日历列与 ESG 均衡度。
 * 使用建议：历史不足的窗口填 NaN 并保留该行，是否丢弃由调用方决定；本类不会因序列过短而抛错。
 */
public final class FeatureBuilder {
    public static final int SHORT_WINDOW = 3;
    public static final int LONG_WINDOW = 6;
    public static final int MOMENTUM_LAG = 3;

/**
 * 方法说明：build，负责构建特征矩阵。
 * 处理流程：每个指标独立计算滚动统计，季节均值按整段序列同季度取均值，均衡度取当期三项分数的样本标准差。
 * 维护提示：每行列顺序由 FeatureVector.columns 决定，调整列时需同步预测模型。
 */
    public FeatureVector build(HistoricalSeries series) {
        int size = series.size();
        Map<Pillar, double[]> values = new EnumMap<>(Pillar.class);
        Map<Pillar, double[]> seasonal = new EnumMap<>(Pillar.class);
        for (Pillar pillar : Pillar.values()) {
            double[] v = series.values(pillar);
            values.put(pillar, v);
            seasonal.put(pillar, seasonalMeans(series, v));
        }

        List<FeatureRow> rows = new ArrayList<>(size);
        for (int t = 0; t < size; t++) {
            SeriesPoint point = series.points.get(t);
            int quarter = quarterOf(point);
            Map<Pillar, MetricFeatures> metrics = new EnumMap<>(Pillar.class);
            for (Pillar pillar : Pillar.values()) {
                double[] v = values.get(pillar);
                metrics.put(pillar, new MetricFeatures(
                        v[t],
                        rollingMean(v, t, SHORT_WINDOW),
                        rollingMean(v, t, LONG_WINDOW),
                        rollingStd(v, t, LONG_WINDOW),
                        momentum(v, t, MOMENTUM_LAG),
                        seasonal.get(pillar)[quarter - 1]
                ));
            }
            rows.add(FeatureRow.builder()
                    .period(point.period)
                    .month(point.period.getMonthValue())
                    .quarter(quarter)
                    .year(point.period.getYear())
                    .esgBalance(sampleStd(point.environmental, point.social, point.governance))
                    .metrics(Collections.unmodifiableMap(metrics))
                    .build());
        }
        return new FeatureVector(series, rows);
    }

    static double rollingMean(double[] values, int t, int window) {
        if (t + 1 < window) {
            return Double.NaN;
        }
        double sum = 0.0;
        for (int i = t - window + 1; i <= t; i++) {
            sum += values[i];
        }
        return sum / window;
    }

    static double rollingStd(double[] values, int t, int window) {
        if (t + 1 < window) {
            return Double.NaN;
        }
        DescriptiveStatistics stats = new DescriptiveStatistics();
        for (int i = t - window + 1; i <= t; i++) {
            stats.addValue(values[i]);
        }
        return stats.getStandardDeviation();
    }

    /**
     * Fractional change against the value {@code lag} periods back; 0 when that base value is 0.
     */
    static double momentum(double[] values, int t, int lag) {
        if (t < lag) {
            return Double.NaN;
        }
        double base = values[t - lag];
        if (base == 0.0) {
            return 0.0;
        }
        return values[t] / base - 1.0;
    }

    private static double[] seasonalMeans(HistoricalSeries series, double[] values) {
        double[] sums = new double[4];
        int[] counts = new int[4];
        for (int i = 0; i < values.length; i++) {
            int q = quarterOf(series.points.get(i)) - 1;
            sums[q] += values[i];
            counts[q]++;
        }
        double[] out = new double[4];
        for (int q = 0; q < 4; q++) {
            out[q] = counts[q] == 0 ? Double.NaN : sums[q] / counts[q];
        }
        return out;
    }

    private static double sampleStd(double... values) {
        DescriptiveStatistics stats = new DescriptiveStatistics(values);
        return stats.getStandardDeviation();
    }

    private static int quarterOf(SeriesPoint point) {
        return (point.period.getMonthValue() - 1) / 3 + 1;
    }
}
