package com.esgcredit.scoring;

import com.esgcredit.config.Config;
import com.esgcredit.core.ValidationException;
import com.esgcredit.model.IndicatorRecord;
import com.esgcredit.model.Pillar;
import com.esgcredit.model.ScoreBreakdown;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * 模块说明：ScoreEngine（class）。
 * 主要职责：按固定权重汇总 E/S/G 子分数，计算总分、等级与利率优惠。
 * 使用建议：引擎不持有可变状态，同一输入始终得到相同的 ScoreBreakdown。
 */
public final class ScoreEngine {
    private final ScoringPolicy policy;
    private final GradeTable gradeTable;
    private final IndicatorNormalizer normalizer;
    private final List<String> complianceFrameworks;

    public ScoreEngine(ScoringPolicy policy, GradeTable gradeTable, IndicatorNormalizer normalizer) {
        this(policy, gradeTable, normalizer, List.of());
    }

    public ScoreEngine(
            ScoringPolicy policy,
            GradeTable gradeTable,
            IndicatorNormalizer normalizer,
            List<String> complianceFrameworks
    ) {
        this.policy = policy;
        this.gradeTable = gradeTable;
        this.normalizer = normalizer;
        List<String> frameworks = new ArrayList<>();
        for (String framework : complianceFrameworks) {
            String key = framework.trim().toLowerCase(Locale.ROOT);
            if (!key.isEmpty() && !frameworks.contains(key)) {
                frameworks.add(key);
            }
        }
        this.complianceFrameworks = List.copyOf(frameworks);
    }

    public static ScoreEngine fromConfig(Config config) {
        return new ScoreEngine(
                ScoringPolicy.fromConfig(config),
                GradeTable.fromConfig(config),
                IndicatorNormalizer.fromConfig(config),
                config.getList("compliance.frameworks")
        );
    }

    public ScoreBreakdown evaluate(IndicatorRecord record) {
        return evaluate(record, 0.0);
    }

/**
 * 方法说明：evaluate，负责计算企业 ESG 评分。
 * 处理流程：各支柱取归一化子指标均值并截断到 [0,100]，环境分扣减供应链调整后不低于 0，再按权重求总分并查等级表。
 * 维护提示：等级按四舍五入到两位小数后的总分查表，边界值归入较高等级。
 */
    public ScoreBreakdown evaluate(IndicatorRecord record, double scopeAdjustment) {
        if (record == null) {
            throw new ValidationException("", "indicator record is null");
        }
        String company = safeText(record.name);
        if (!Double.isFinite(scopeAdjustment) || scopeAdjustment < 0.0) {
            throw new ValidationException(company, "scope adjustment must be a finite value >= 0, got " + scopeAdjustment);
        }

        Map<String, Double> normalized = new LinkedHashMap<>();
        List<String> missing = new ArrayList<>();
        Map<Pillar, Double> scores = new EnumMap<>(Pillar.class);
        for (Pillar pillar : Pillar.values()) {
            scores.put(pillar, pillarScore(company, record, pillar, normalized, missing));
        }

        double e = round2(Math.max(0.0, scores.get(Pillar.ENVIRONMENTAL) - scopeAdjustment));
        double s = round2(scores.get(Pillar.SOCIAL));
        double g = round2(scores.get(Pillar.GOVERNANCE));
        double total = round2(clamp(
                policy.weight(Pillar.ENVIRONMENTAL) * e
                        + policy.weight(Pillar.SOCIAL) * s
                        + policy.weight(Pillar.GOVERNANCE) * g,
                0.0,
                100.0
        ));
        GradeBucket bucket = gradeTable.resolve(total);

        List<Pillar> improvement = new ArrayList<>();
        double[] finalScores = {e, s, g};
        for (Pillar pillar : Pillar.values()) {
            if (finalScores[pillar.ordinal()] < policy.improvementThreshold()) {
                improvement.add(pillar);
            }
        }

        Map<String, Boolean> compliance = compliance(record);
        return ScoreBreakdown.builder()
                .company(company)
                .industry(safeText(record.industry))
                .sizeClass(safeText(record.sizeClass))
                .environmental(e)
                .social(s)
                .governance(g)
                .total(total)
                .grade(bucket.grade)
                .discountPct(bucket.discountPct)
                .scopeAdjustment(scopeAdjustment)
                .normalizedIndicators(Collections.unmodifiableMap(normalized))
                .missingIndicators(List.copyOf(missing))
                .improvementAreas(List.copyOf(improvement))
                .compliance(compliance)
                .complianceRatio(complianceRatio(compliance))
                .build();
    }

    /**
     * Declared compliance per configured framework. Framework ids are matched case-insensitively;
     * frameworks the record does not mention, or marks null, count as not complied with.
     */
    private Map<String, Boolean> compliance(IndicatorRecord record) {
        Map<String, Boolean> declared = new LinkedHashMap<>();
        if (record.compliance != null) {
            for (Map.Entry<String, Boolean> entry : record.compliance.entrySet()) {
                if (entry.getKey() != null) {
                    declared.put(entry.getKey().trim().toLowerCase(Locale.ROOT), Boolean.TRUE.equals(entry.getValue()));
                }
            }
        }
        Map<String, Boolean> out = new LinkedHashMap<>();
        for (String framework : complianceFrameworks) {
            out.put(framework, declared.getOrDefault(framework, false));
        }
        return Collections.unmodifiableMap(out);
    }

    private static double complianceRatio(Map<String, Boolean> compliance) {
        if (compliance.isEmpty()) {
            return 0.0;
        }
        int met = 0;
        for (boolean ok : compliance.values()) {
            if (ok) {
                met++;
            }
        }
        return Math.round(met * 1000.0 / compliance.size()) / 10.0;
    }

    public GradeTable gradeTable() {
        return gradeTable;
    }

    private double pillarScore(
            String company,
            IndicatorRecord record,
            Pillar pillar,
            Map<String, Double> normalized,
            List<String> missing
    ) {
        Map<String, Double> values = new TreeMap<>();
        for (Map.Entry<String, Double> entry : record.indicators(pillar).entrySet()) {
            String name = entry.getKey() == null ? "" : entry.getKey().trim();
            if (name.isEmpty()) {
                throw new ValidationException(company, "blank indicator name under " + pillar.key());
            }
            Double raw = entry.getValue();
            if (raw == null) {
                missing.add(pillar.key() + "." + name);
                values.put(name, 0.0);
            } else {
                values.put(name, normalizer.normalize(company, pillar, name, raw));
            }
        }
        for (String name : normalizer.required(pillar)) {
            if (!values.containsKey(name)) {
                missing.add(pillar.key() + "." + name);
                values.put(name, 0.0);
            }
        }
        if (values.isEmpty()) {
            missing.add(pillar.key() + ".*");
            return 0.0;
        }

        double sum = 0.0;
        for (Map.Entry<String, Double> entry : values.entrySet()) {
            normalized.put(pillar.key() + "." + entry.getKey(), round2(entry.getValue()));
            sum += entry.getValue();
        }
        return clamp(sum / values.size(), 0.0, 100.0);
    }

    private static double clamp(double v, double min, double max) {
        if (v < min) return min;
        if (v > max) return max;
        return v;
    }

    static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }

    private static String safeText(String text) {
        return text == null ? "" : text.trim();
    }
}
