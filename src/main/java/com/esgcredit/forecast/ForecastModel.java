package com.esgcredit.forecast;

import com.esgcredit.config.Config;
import com.esgcredit.core.InsufficientHistoryException;
import com.esgcredit.core.ValidationException;
import com.esgcredit.feature.FeatureBuilder;
import com.esgcredit.model.ConfidenceBand;
import com.esgcredit.model.FeatureRow;
import com.esgcredit.model.FeatureVector;
import com.esgcredit.model.ForecastResult;
import com.esgcredit.model.HistoricalSeries;
import com.esgcredit.model.Pillar;
import com.esgcredit.model.SeriesPoint;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 模块说明：ForecastModel（class）。
 * 主要职责：为 E/S/G 各训练一个集成回归器，并以递归方式生成未来 horizon 个月的轨迹与置信区间。
 * 使用建议：同一输入与种子重复训练必须得到完全相同的预测；训练结果 TrainedModel 只读，可跨线程共享。
 */
public final class ForecastModel {
    private static final Logger LOG = LogManager.getLogger(ForecastModel.class);

    /** Largest rolling window plus one. */
    public static final int MIN_HISTORY = FeatureBuilder.LONG_WINDOW + 1;

    private final ForecastSettings settings;
    private final FeatureBuilder featureBuilder;

    public ForecastModel(ForecastSettings settings, FeatureBuilder featureBuilder) {
        settings.validate();
        this.settings = settings;
        this.featureBuilder = featureBuilder;
    }

    public static ForecastModel fromConfig(Config config) {
        return new ForecastModel(ForecastSettings.fromConfig(config), new FeatureBuilder());
    }

/**
 * 方法说明：fit，负责训练三个指标的回归器。
 * 处理流程：丢弃历史不足的特征行，以 (t 期特征, t+1 期取值) 组成训练样本，各指标使用独立种子。
 * 维护提示：期数少于 MIN_HISTORY 直接抛出 InsufficientHistoryException，不退化为更短的回看窗口。
 */
    public TrainedModel fit(FeatureVector features) {
        HistoricalSeries series = features.series;
        if (series.size() < MIN_HISTORY) {
            throw new InsufficientHistoryException(series.company, series.size(), MIN_HISTORY);
        }

        List<FeatureRow> rows = features.rows;
        Map<Pillar, MetricRegressor> regressors = new EnumMap<>(Pillar.class);
        for (Pillar pillar : Pillar.values()) {
            List<double[]> xs = new ArrayList<>();
            List<Double> ys = new ArrayList<>();
            for (int t = 0; t + 1 < rows.size(); t++) {
                FeatureRow row = rows.get(t);
                if (!row.complete()) {
                    continue;
                }
                xs.add(FeatureVector.columns(row, pillar));
                ys.add(rows.get(t + 1).metric(pillar).value);
            }
            if (xs.isEmpty()) {
                throw new InsufficientHistoryException(series.company, series.size(), MIN_HISTORY);
            }
            double[] y = new double[ys.size()];
            for (int i = 0; i < y.length; i++) {
                y[i] = ys.get(i);
            }
            long pillarSeed = settings.seed + (long) pillar.ordinal() * settings.members * settings.trees;
            regressors.put(pillar, MetricRegressor.fit(
                    pillar,
                    FeatureVector.columnNames(pillar),
                    xs.toArray(new double[0][]),
                    y,
                    settings,
                    pillarSeed
            ));
            LOG.debug("fitted {} regressor for {}: samples={} forest={}",
                    pillar.code(), series.company, y.length, regressors.get(pillar).usesForest());
        }
        return new TrainedModel(series, regressors, settings.seed);
    }

/**
 * 方法说明：predict，负责递归生成多步预测。
 * 处理流程：每一步都以“原始历史 + 已有预测”重新构建特征，取最后一行预测下一期，预测值截断到 [0,100] 后并入累积序列。
 * 维护提示：区间半宽按累积方差计算且不截断，因此宽度随步数单调不减。
 */
    public ForecastResult predict(TrainedModel model, int horizonMonths) {
        HistoricalSeries history = model.history();
        if (horizonMonths < 1) {
            throw new ValidationException(history.company, "horizon must be >= 1, got " + horizonMonths);
        }

        Map<Pillar, List<Double>> predictions = new EnumMap<>(Pillar.class);
        Map<Pillar, List<ConfidenceBand>> bands = new EnumMap<>(Pillar.class);
        Map<Pillar, Double> cumulativeVariance = new EnumMap<>(Pillar.class);
        for (Pillar pillar : Pillar.values()) {
            predictions.put(pillar, new ArrayList<>(horizonMonths));
            bands.put(pillar, new ArrayList<>(horizonMonths));
            cumulativeVariance.put(pillar, 0.0);
        }
        List<YearMonth> periods = new ArrayList<>(horizonMonths);
        List<SeriesPoint> predicted = new ArrayList<>(horizonMonths);

        YearMonth period = history.last().period;
        for (int step = 0; step < horizonMonths; step++) {
            FeatureRow origin = lastRow(history, predicted);
            period = period.plusMonths(1);
            double[] next = new double[Pillar.values().length];
            for (Pillar pillar : Pillar.values()) {
                MetricRegressor regressor = model.regressor(pillar);
                double[] members = regressor.memberPredictions(FeatureVector.columns(origin, pillar));
                double mean = 0.0;
                for (double v : members) {
                    mean += v;
                }
                mean /= members.length;
                double value = clamp(mean, 0.0, 100.0);

                double variance = cumulativeVariance.get(pillar)
                        + MetricRegressor.memberVariance(members)
                        + regressor.residualVariance();
                cumulativeVariance.put(pillar, variance);
                double halfWidth = settings.z * Math.sqrt(variance);

                predictions.get(pillar).add(value);
                bands.get(pillar).add(new ConfidenceBand(value - halfWidth, value + halfWidth));
                next[pillar.ordinal()] = value;
            }
            periods.add(period);
            predicted.add(new SeriesPoint(period, next[0], next[1], next[2]));
        }
        return new ForecastResult(horizonMonths, periods, predictions, bands);
    }

    /**
     * Features of the newest period of history extended by the predictions made so far.
     */
    private FeatureRow lastRow(HistoricalSeries history, List<SeriesPoint> predicted) {
        List<SeriesPoint> points = new ArrayList<>(history.size() + predicted.size());
        points.addAll(history.points);
        points.addAll(predicted);
        FeatureVector vector = featureBuilder.build(new HistoricalSeries(history.company, points));
        return vector.rows.get(vector.size() - 1);
    }

    public ForecastSettings settings() {
        return settings;
    }

    private static double clamp(double v, double min, double max) {
        if (v < min) return min;
        if (v > max) return max;
        return v;
    }
}
