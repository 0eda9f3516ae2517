package com.esgcredit.scoring;

import com.esgcredit.config.Config;
import com.esgcredit.core.ConfigurationException;
import com.esgcredit.core.ValidationException;
import com.esgcredit.model.Pillar;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 模块说明：IndicatorNormalizer（class）。
 * 主要职责：把原始子指标（比例、计数、分数）线性映射到 [0,100]，越低越好的指标做反向映射。
 * 使用建议：原始值超出允许范围时抛出 ValidationException，映射本身不会失败。
 */
public final class IndicatorNormalizer {
    private final double defaultMin;
    private final double defaultMax;
    private final Map<String, double[]> ranges;
    private final Set<String> inverse;
    private final Map<Pillar, List<String>> required;

    public IndicatorNormalizer(
            double defaultMin,
            double defaultMax,
            Map<String, double[]> ranges,
            Set<String> inverse,
            Map<Pillar, List<String>> required
    ) {
        checkRange("indicator.raw", defaultMin, defaultMax);
        Map<String, double[]> rangeCopy = new HashMap<>();
        if (ranges != null) {
            for (Map.Entry<String, double[]> entry : ranges.entrySet()) {
                double[] r = entry.getValue();
                if (r == null || r.length != 2) {
                    throw new ConfigurationException("indicator.range." + entry.getKey(), "expected min,max");
                }
                checkRange("indicator.range." + entry.getKey(), r[0], r[1]);
                rangeCopy.put(entry.getKey(), r.clone());
            }
        }
        Map<Pillar, List<String>> requiredCopy = new EnumMap<>(Pillar.class);
        for (Pillar pillar : Pillar.values()) {
            List<String> names = required == null ? null : required.get(pillar);
            requiredCopy.put(pillar, names == null ? List.of() : List.copyOf(names));
        }
        this.defaultMin = defaultMin;
        this.defaultMax = defaultMax;
        this.ranges = Collections.unmodifiableMap(rangeCopy);
        this.inverse = inverse == null ? Set.of() : Set.copyOf(inverse);
        this.required = Collections.unmodifiableMap(requiredCopy);
    }

    public static IndicatorNormalizer identity() {
        return new IndicatorNormalizer(0.0, 100.0, Map.of(), Set.of(), Map.of());
    }

/**
 * 方法说明：fromConfig，负责根据配置构建归一化器。
 * 处理流程：indicator.range.&lt;name&gt;=min,max 覆盖默认区间，indicator.inverse 列出越低越好的指标。
 * 维护提示：区间格式错误属于配置错误，启动时即失败。
 */
    public static IndicatorNormalizer fromConfig(Config config) {
        Map<String, double[]> ranges = new HashMap<>();
        for (Map.Entry<String, String> entry : config.withPrefix("indicator.range.").entrySet()) {
            String[] parts = entry.getValue().split(",");
            if (parts.length != 2) {
                throw new ConfigurationException("indicator.range." + entry.getKey(), "expected min,max, got '" + entry.getValue() + "'");
            }
            try {
                ranges.put(entry.getKey(), new double[]{
                        Double.parseDouble(parts[0].trim()),
                        Double.parseDouble(parts[1].trim())
                });
            } catch (NumberFormatException e) {
                throw new ConfigurationException("indicator.range." + entry.getKey(), "not a number: " + entry.getValue(), e);
            }
        }
        Map<Pillar, List<String>> required = new EnumMap<>(Pillar.class);
        for (Pillar pillar : Pillar.values()) {
            required.put(pillar, config.getList("indicator.required." + pillar.key()));
        }
        return new IndicatorNormalizer(
                config.getDouble("indicator.raw.min", 0.0),
                config.getDouble("indicator.raw.max", 100.0),
                ranges,
                new HashSet<>(config.getList("indicator.inverse")),
                required
        );
    }

    public double normalize(String company, Pillar pillar, String indicator, double raw) {
        String subject = company + "/" + pillar.key() + "." + indicator;
        if (!Double.isFinite(raw)) {
            throw new ValidationException(subject, "indicator value is not a finite number: " + raw);
        }
        double[] range = ranges.get(indicator);
        double min = range == null ? defaultMin : range[0];
        double max = range == null ? defaultMax : range[1];
        if (raw < min || raw > max) {
            throw new ValidationException(subject, String.format(Locale.US,
                    "indicator value %.4f outside allowed range [%.4f, %.4f]", raw, min, max));
        }
        double scaled = (raw - min) * 100.0 / (max - min);
        return inverse.contains(indicator) ? 100.0 - scaled : scaled;
    }

    public List<String> required(Pillar pillar) {
        return required.get(pillar);
    }

    private static void checkRange(String key, double min, double max) {
        if (!Double.isFinite(min) || !Double.isFinite(max) || min >= max) {
            throw new ConfigurationException(key, "invalid raw range " + min + ".." + max);
        }
    }
}
