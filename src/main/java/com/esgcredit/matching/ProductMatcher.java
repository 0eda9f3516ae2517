package com.esgcredit.matching;

import com.esgcredit.config.Config;
import com.esgcredit.core.ValidationException;
import com.esgcredit.model.EligibilityCondition;
import com.esgcredit.model.ForecastResult;
import com.esgcredit.model.Grade;
import com.esgcredit.model.MatchResult;
import com.esgcredit.model.Pillar;
import com.esgcredit.model.ProductSpec;
import com.esgcredit.model.ProjectionMode;
import com.esgcredit.model.ScoreBreakdown;
import com.esgcredit.scoring.GradeTable;
import com.esgcredit.scoring.ScoringPolicy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 模块说明：ProductMatcher（class）。
 * 主要职责：按登记表逐条检查金融产品的资格条件，计算优惠后利率并按利率排序。
 * 使用建议：缺少预测时，引用预测值的条件视为不满足并记录在 failedConditions 中，而不是跳过。
 */
public final class ProductMatcher {
    private static final Comparator<MatchResult> ORDER = Comparator
            .comparingDouble((MatchResult r) -> r.effectiveRate)
            .thenComparing(r -> r.productId);

    private final ConditionRegistry registry;
    private final ScoringPolicy policy;
    private final GradeTable gradeTable;
    private final double rateFloor;

    public ProductMatcher(ConditionRegistry registry, ScoringPolicy policy, GradeTable gradeTable, double rateFloor) {
        this.registry = registry;
        this.policy = policy;
        this.gradeTable = gradeTable;
        this.rateFloor = rateFloor;
    }

    public static ProductMatcher fromConfig(Config config) {
        return new ProductMatcher(
                ConditionRegistry.standard(),
                ScoringPolicy.fromConfig(config),
                GradeTable.fromConfig(config),
                config.getDouble("match.rate_floor", 0.0)
        );
    }

/**
 * 方法说明：match，负责匹配企业与金融产品目录。
 * 处理流程：每个产品的全部条件取合取；满足且带 ESG 优惠时扣减等级优惠（产品自带等级优惠表时以其为准），利率不低于下限。
 * 维护提示：结果包含全部产品，按优惠后利率升序、产品 id 升序排列。
 */
    public List<MatchResult> match(ScoreBreakdown breakdown, ForecastResult forecast, List<ProductSpec> catalog) {
        if (catalog == null || catalog.isEmpty()) {
            return List.of();
        }
        List<MatchResult> out = new ArrayList<>(catalog.size());
        for (ProductSpec product : catalog) {
            out.add(matchOne(breakdown, forecast, product));
        }
        out.sort(ORDER);
        return Collections.unmodifiableList(out);
    }

    public List<MatchResult> eligibleOnly(List<MatchResult> results) {
        List<MatchResult> out = new ArrayList<>();
        for (MatchResult r : results) {
            if (r.eligible) {
                out.add(r);
            }
        }
        return out;
    }

/**
 * 方法说明：simulateUpgrade，负责模拟等级提升后的产品与利率变化。
 * 处理流程：保持各项分数不变，仅把等级及其等级表优惠替换为目标等级，重新匹配后对比两次的可用产品与最大优惠。
 * 维护提示：目标等级低于当前等级时抛出 ValidationException。
 */
    public UpgradeSimulation simulateUpgrade(
            ScoreBreakdown breakdown,
            ForecastResult forecast,
            List<ProductSpec> catalog,
            Grade targetGrade
    ) {
        if (targetGrade == null || !targetGrade.atLeast(breakdown.grade)) {
            throw new ValidationException(breakdown.company,
                    "upgrade target " + targetGrade + " is below current grade " + breakdown.grade);
        }
        ScoreBreakdown upgraded = breakdown.toBuilder()
                .grade(targetGrade)
                .discountPct(gradeTable.discountFor(targetGrade))
                .build();
        List<MatchResult> current = eligibleOnly(match(breakdown, forecast, catalog));
        List<MatchResult> target = eligibleOnly(match(upgraded, forecast, catalog));

        List<String> currentIds = ids(current);
        List<String> newProducts = new ArrayList<>();
        for (MatchResult r : target) {
            if (!currentIds.contains(r.productId)) {
                newProducts.add(r.productId);
            }
        }
        double bestCurrent = bestDiscount(current);
        double bestTarget = bestDiscount(target);
        return UpgradeSimulation.builder()
                .currentGrade(breakdown.grade)
                .targetGrade(targetGrade)
                .currentEligible(currentIds)
                .targetEligible(ids(target))
                .newProducts(List.copyOf(newProducts))
                .bestCurrentDiscount(bestCurrent)
                .bestTargetDiscount(bestTarget)
                .rateImprovement(round4(bestTarget - bestCurrent))
                .build();
    }

    private static List<String> ids(List<MatchResult> results) {
        List<String> out = new ArrayList<>(results.size());
        for (MatchResult r : results) {
            out.add(r.productId);
        }
        return List.copyOf(out);
    }

    private static double bestDiscount(List<MatchResult> results) {
        double best = 0.0;
        for (MatchResult r : results) {
            best = Math.max(best, r.discount);
        }
        return best;
    }

    MatchResult matchOne(ScoreBreakdown breakdown, ForecastResult forecast, ProductSpec product) {
        if (product == null || product.id == null || product.id.trim().isEmpty()) {
            throw new ValidationException("", "product without id");
        }
        if (!Double.isFinite(product.baseRate) || product.baseRate < 0.0) {
            throw new ValidationException(product.id, "base rate must be a finite value >= 0, got " + product.baseRate);
        }

        Set<String> failed = new LinkedHashSet<>();
        List<EligibilityCondition> conditions = product.conditions == null ? List.of() : product.conditions;
        for (EligibilityCondition condition : conditions) {
            ConditionDefinition def = registry.require(product.id, condition.name);
            if (!satisfied(product.id, def, condition, breakdown, forecast)) {
                failed.add(condition.name);
            }
        }
        boolean eligible = failed.isEmpty();

        double discount = 0.0;
        if (eligible && product.esgDiscount) {
            discount = discountFor(product, breakdown);
        }
        double effective = Math.max(rateFloor, product.baseRate - discount);
        return MatchResult.builder()
                .productId(product.id)
                .productName(product.name == null ? product.id : product.name)
                .eligible(eligible)
                .failedConditions(Collections.unmodifiableSet(failed))
                .baseRate(product.baseRate)
                .discount(discount)
                .effectiveRate(round4(effective))
                .build();
    }

    private boolean satisfied(
            String productId,
            ConditionDefinition def,
            EligibilityCondition condition,
            ScoreBreakdown breakdown,
            ForecastResult forecast
    ) {
        switch (def.source) {
            case GRADE:
                if (condition.grade == null) {
                    throw new ValidationException(productId, def.name + " needs a grade label");
                }
                return breakdown.grade.atLeast(condition.grade);
            case CURRENT_SCORE:
                return compare(def, currentScore(def.pillar, breakdown), condition.threshold);
            case INDICATOR:
                Double indicator = breakdown.normalizedIndicators.get(def.indicatorKey);
                return indicator != null && compare(def, indicator, condition.threshold);
            case SCOPE_ADJUSTMENT:
                return compare(def, breakdown.scopeAdjustment, condition.threshold);
            case COMPLIANCE_RATIO:
                return compare(def, breakdown.complianceRatio, condition.threshold);
            case SEGMENT:
                return inSegments(condition, breakdown);
            case PROJECTED_SCORE:
                if (forecast == null) {
                    return false;
                }
                return compare(def, projectedScore(def.pillar, forecast, condition.projection), condition.threshold);
            default:
                throw new IllegalStateException("unhandled condition source " + def.source);
        }
    }

    private static boolean compare(ConditionDefinition def, double actual, double threshold) {
        if (Double.isNaN(threshold)) {
            return false;
        }
        if (def.comparison == ConditionDefinition.Comparison.AT_MOST) {
            return actual <= threshold;
        }
        return actual >= threshold;
    }

    private static boolean inSegments(EligibilityCondition condition, ScoreBreakdown breakdown) {
        if (condition.segments == null) {
            return false;
        }
        String industry = lower(breakdown.industry);
        String sizeClass = lower(breakdown.sizeClass);
        for (String segment : condition.segments) {
            String s = lower(segment);
            if (s.isEmpty()) {
                continue;
            }
            if ("*".equals(s) || "all".equals(s) || s.equals(industry) || s.equals(sizeClass)) {
                return true;
            }
        }
        return false;
    }

    private static String lower(String text) {
        return text == null ? "" : text.trim().toLowerCase(Locale.ROOT);
    }

    private static double currentScore(Pillar pillar, ScoreBreakdown breakdown) {
        return pillar == null ? breakdown.total : breakdown.score(pillar);
    }

    private double projectedScore(Pillar pillar, ForecastResult forecast, ProjectionMode mode) {
        if (pillar != null) {
            return projected(forecast, pillar, mode);
        }
        double total = 0.0;
        for (Pillar p : Pillar.values()) {
            total += policy.weight(p) * projected(forecast, p, mode);
        }
        return total;
    }

    private static double projected(ForecastResult forecast, Pillar pillar, ProjectionMode mode) {
        if (mode == ProjectionMode.HORIZON_MEAN) {
            return forecast.meanValue(pillar);
        }
        return forecast.finalValue(pillar);
    }

    private static double discountFor(ProductSpec product, ScoreBreakdown breakdown) {
        if (product.gradeDiscounts != null && !product.gradeDiscounts.isEmpty()) {
            Double d = product.gradeDiscounts.get(breakdown.grade);
            return d == null ? 0.0 : d;
        }
        return breakdown.discountPct;
    }

    private static double round4(double v) {
        return Math.round(v * 10000.0) / 10000.0;
    }
}
