package com.esgcredit.model;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 模块说明：ForecastResult（class）。
 * 主要职责：每个指标未来 horizon 个月的预测值及置信区间。
 * 使用建议：修改该类型时应同步关注上下游调用，避免影响整体流程稳定性。
 */
public final class ForecastResult {
    public final int horizon;
    public final List<YearMonth> periods;
    public final Map<Pillar, List<Double>> predictions;
    public final Map<Pillar, List<ConfidenceBand>> bands;

    public ForecastResult(
            int horizon,
            List<YearMonth> periods,
            Map<Pillar, List<Double>> predictions,
            Map<Pillar, List<ConfidenceBand>> bands
    ) {
        if (periods.size() != horizon) {
            throw new IllegalArgumentException("periods=" + periods.size() + " horizon=" + horizon);
        }
        Map<Pillar, List<Double>> p = new EnumMap<>(Pillar.class);
        Map<Pillar, List<ConfidenceBand>> b = new EnumMap<>(Pillar.class);
        for (Pillar pillar : Pillar.values()) {
            List<Double> values = predictions.get(pillar);
            List<ConfidenceBand> ranges = bands.get(pillar);
            if (values == null || values.size() != horizon || ranges == null || ranges.size() != horizon) {
                throw new IllegalArgumentException("forecast for " + pillar + " does not span horizon " + horizon);
            }
            p.put(pillar, List.copyOf(values));
            b.put(pillar, List.copyOf(ranges));
        }
        this.horizon = horizon;
        this.periods = List.copyOf(periods);
        this.predictions = Collections.unmodifiableMap(p);
        this.bands = Collections.unmodifiableMap(b);
    }

    public List<Double> predictions(Pillar pillar) {
        return predictions.get(pillar);
    }

    public List<ConfidenceBand> bands(Pillar pillar) {
        return bands.get(pillar);
    }

    public double finalValue(Pillar pillar) {
        List<Double> values = predictions.get(pillar);
        return values.get(values.size() - 1);
    }

    public double meanValue(Pillar pillar) {
        double sum = 0.0;
        for (double v : predictions.get(pillar)) {
            sum += v;
        }
        return sum / horizon;
    }

    public List<Double> widths(Pillar pillar) {
        List<Double> out = new ArrayList<>(horizon);
        for (ConfidenceBand band : bands.get(pillar)) {
            out.add(band.width());
        }
        return out;
    }
}
