package com.esgcredit.matching;

import com.esgcredit.config.Config;
import com.esgcredit.core.ValidationException;
import com.esgcredit.model.ConfidenceBand;
import com.esgcredit.model.EligibilityCondition;
import com.esgcredit.model.ForecastResult;
import com.esgcredit.model.Grade;
import com.esgcredit.model.MatchResult;
import com.esgcredit.model.Pillar;
import com.esgcredit.model.ProductSpec;
import com.esgcredit.model.ProjectionMode;
import com.esgcredit.model.ScoreBreakdown;
import org.junit.jupiter.api.Test;

import java.time.YearMonth;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProductMatcherTest {
    private final ProductMatcher matcher = ProductMatcher.fromConfig(Config.defaults());

    private static ScoreBreakdown breakdown(double e, Grade grade, double discount) {
        return ScoreBreakdown.builder()
                .company("acme")
                .industry("manufacturing")
                .environmental(e)
                .social(70.0)
                .governance(90.0)
                .total(80.0)
                .grade(grade)
                .discountPct(discount)
                .scopeAdjustment(6.5)
                .normalizedIndicators(Map.of("environmental.renewable_energy_ratio", 60.0))
                .missingIndicators(List.of())
                .improvementAreas(List.of())
                .build();
    }

    private static ProductSpec product(String id, double baseRate, boolean esgDiscount, EligibilityCondition... conditions) {
        return ProductSpec.builder()
                .id(id)
                .name(id)
                .type("loan")
                .baseRate(baseRate)
                .esgDiscount(esgDiscount)
                .conditions(List.of(conditions))
                .gradeDiscounts(Map.of())
                .build();
    }

    private static ForecastResult forecastWithEnvironmental(double... values) {
        Map<Pillar, List<Double>> predictions = new EnumMap<>(Pillar.class);
        Map<Pillar, List<ConfidenceBand>> bands = new EnumMap<>(Pillar.class);
        for (Pillar pillar : Pillar.values()) {
            Double[] boxed = new Double[values.length];
            ConfidenceBand[] ranges = new ConfidenceBand[values.length];
            for (int i = 0; i < values.length; i++) {
                boxed[i] = pillar == Pillar.ENVIRONMENTAL ? values[i] : 70.0;
                ranges[i] = new ConfidenceBand(boxed[i] - 1.0 - i, boxed[i] + 1.0 + i);
            }
            predictions.put(pillar, List.of(boxed));
            bands.put(pillar, List.of(ranges));
        }
        YearMonth[] periods = new YearMonth[values.length];
        for (int i = 0; i < values.length; i++) {
            periods[i] = YearMonth.of(2025, i + 1);
        }
        return new ForecastResult(values.length, List.of(periods), predictions, bands);
    }

    @Test
    void match_shouldTreatProjectedConditionsAsFailedWithoutForecast() {
        ProductSpec current = product("CURRENT", 4.5, true, EligibilityCondition.numeric("min_e_score", 75.0));
        ProductSpec projected = product("PROJECTED", 4.0, true,
                EligibilityCondition.projected("projected_e_score", 85.0, ProjectionMode.FINAL_STEP));

        List<MatchResult> results = matcher.match(breakdown(80.0, Grade.A_MINUS, 1.8), null, List.of(current, projected));

        MatchResult currentResult = find(results, "CURRENT");
        assertTrue(currentResult.eligible);
        assertTrue(currentResult.failedConditions.isEmpty());
        assertEquals(2.7, currentResult.effectiveRate, 1e-9);

        MatchResult projectedResult = find(results, "PROJECTED");
        assertFalse(projectedResult.eligible);
        assertEquals(Set.of("projected_e_score"), projectedResult.failedConditions);
        assertEquals(4.0, projectedResult.effectiveRate, 1e-9);
    }

    @Test
    void match_shouldNeverAcceptScoreJustBelowMinimum() {
        ProductSpec product = product("LOAN", 4.5, true, EligibilityCondition.numeric("min_e_score", 75.0));

        MatchResult below = matcher.match(breakdown(74.9, Grade.B_PLUS, 1.3), null, List.of(product)).get(0);
        MatchResult exact = matcher.match(breakdown(75.0, Grade.B_PLUS, 1.3), null, List.of(product)).get(0);

        assertFalse(below.eligible);
        assertEquals(Set.of("min_e_score"), below.failedConditions);
        assertEquals(4.5, below.effectiveRate, 1e-9);
        assertTrue(exact.eligible);
    }

    @Test
    void match_shouldOrderByEffectiveRateThenProductId() {
        List<MatchResult> results = matcher.match(breakdown(80.0, Grade.A_MINUS, 1.8), null, List.of(
                product("C", 5.0, false),
                product("B", 4.8, true),
                product("A", 3.0, false),
                product("D", 3.0, false)
        ));

        assertEquals(List.of("A", "B", "D", "C"), ids(results));
        assertEquals(3.0, results.get(0).effectiveRate, 1e-9);
    }

    @Test
    void match_shouldIgnoreGradeWhenProductHasNoEsgDiscount() {
        MatchResult result = matcher.match(breakdown(80.0, Grade.A_MINUS, 1.8), null,
                List.of(product("PLAIN", 5.2, false, EligibilityCondition.numeric("min_total_score", 50.0)))).get(0);
        assertTrue(result.eligible);
        assertEquals(0.0, result.discount, 1e-9);
        assertEquals(5.2, result.effectiveRate, 1e-9);
    }

    @Test
    void match_shouldApplyProductGradeDiscountTable() {
        ProductSpec tiered = product("TIERED", 4.0, true).toBuilder()
                .gradeDiscounts(Map.of(Grade.A_MINUS, 0.6, Grade.B_PLUS, 0.4))
                .build();
        assertEquals(3.4, matcher.match(breakdown(80.0, Grade.A_MINUS, 1.8), null, List.of(tiered))
                .get(0).effectiveRate, 1e-9);
        assertEquals(4.0, matcher.match(breakdown(60.0, Grade.C, 0.4), null, List.of(tiered))
                .get(0).effectiveRate, 1e-9);
    }

    @Test
    void match_shouldFloorEffectiveRateAtZero() {
        MatchResult result = matcher.match(breakdown(80.0, Grade.A_MINUS, 1.8), null,
                List.of(product("CHEAP", 1.0, true))).get(0);
        assertEquals(0.0, result.effectiveRate, 1e-9);
    }

    @Test
    void match_shouldCheckGradeIndicatorAndPenaltyConditions() {
        ProductSpec product = product("MIXED", 4.0, true,
                EligibilityCondition.minGrade("min_grade", Grade.B),
                EligibilityCondition.numeric("min_renewable_ratio", 65.0),
                EligibilityCondition.numeric("max_supply_chain_penalty", 5.0));

        MatchResult result = matcher.match(breakdown(80.0, Grade.A_MINUS, 1.8), null, List.of(product)).get(0);

        assertEquals(Set.of("min_renewable_ratio", "max_supply_chain_penalty"), result.failedConditions);
        assertFalse(matcher.match(breakdown(60.0, Grade.C, 0.4), null, List.of(product(
                "GRADE", 4.0, true, EligibilityCondition.minGrade("min_grade", Grade.B_MINUS)))).get(0).eligible);
    }

    @Test
    void match_shouldUseConfiguredProjectionMode() {
        ForecastResult forecast = forecastWithEnvironmental(80.0, 86.0);
        ProductSpec finalStep = product("FINAL", 4.0, true,
                EligibilityCondition.projected("projected_e_score", 85.0, ProjectionMode.FINAL_STEP));
        ProductSpec horizonMean = product("MEAN", 4.0, true,
                EligibilityCondition.projected("projected_e_score", 85.0, ProjectionMode.HORIZON_MEAN));

        List<MatchResult> results = matcher.match(breakdown(80.0, Grade.A_MINUS, 1.8), forecast,
                List.of(finalStep, horizonMean));

        assertTrue(find(results, "FINAL").eligible);
        assertFalse(find(results, "MEAN").eligible);
    }

    @Test
    void match_shouldWeightProjectedTotalWithPillarWeights() {
        ForecastResult forecast = forecastWithEnvironmental(90.0);
        // 0.30 * 90 + 0.35 * 70 + 0.35 * 70 = 76
        ProductSpec pass = product("PASS", 4.0, true,
                EligibilityCondition.projected("projected_total_score", 75.9, ProjectionMode.FINAL_STEP));
        ProductSpec fail = product("FAIL", 4.0, true,
                EligibilityCondition.projected("projected_total_score", 76.1, ProjectionMode.FINAL_STEP));

        List<MatchResult> results = matcher.match(breakdown(80.0, Grade.A_MINUS, 1.8), forecast, List.of(pass, fail));

        assertTrue(find(results, "PASS").eligible);
        assertFalse(find(results, "FAIL").eligible);
    }

    @Test
    void match_shouldReturnEmptyListForEmptyCatalog() {
        assertTrue(matcher.match(breakdown(80.0, Grade.A_MINUS, 1.8), null, List.of()).isEmpty());
        assertTrue(matcher.match(breakdown(80.0, Grade.A_MINUS, 1.8), null, null).isEmpty());
    }

    @Test
    void match_shouldRejectUnknownConditionName() {
        ProductSpec bad = product("BAD", 4.0, true, EligibilityCondition.numeric("min_luck", 1.0));
        ValidationException error = assertThrows(ValidationException.class,
                () -> matcher.match(breakdown(80.0, Grade.A_MINUS, 1.8), null, List.of(bad)));
        assertEquals("BAD", error.subject());
    }

    @Test
    void eligibleOnly_shouldKeepRateOrder() {
        List<MatchResult> results = matcher.match(breakdown(80.0, Grade.A_MINUS, 1.8), null, List.of(
                product("X", 5.0, false),
                product("Y", 4.0, false, EligibilityCondition.numeric("min_e_score", 95.0)),
                product("Z", 3.0, false)
        ));
        assertEquals(List.of("Z", "X"), ids(matcher.eligibleOnly(results)));
    }

    @Test
    void match_shouldAdmitCompanyByIndustryOrSizeSegment() {
        ScoreBreakdown sme = breakdown(80.0, Grade.A_MINUS, 1.8).toBuilder().sizeClass("SME").build();

        List<MatchResult> results = matcher.match(sme, null, List.of(
                product("BY-INDUSTRY", 4.0, false, EligibilityCondition.segments("target_segments", List.of("Manufacturing"))),
                product("BY-SIZE", 4.1, false, EligibilityCondition.segments("target_segments", List.of("retail", "sme"))),
                product("EVERYONE", 4.2, false, EligibilityCondition.segments("target_segments", List.of("all"))),
                product("ELSEWHERE", 4.3, false, EligibilityCondition.segments("target_segments", List.of("retail", "large")))
        ));

        assertTrue(find(results, "BY-INDUSTRY").eligible);
        assertTrue(find(results, "BY-SIZE").eligible);
        assertTrue(find(results, "EVERYONE").eligible);
        assertEquals(Set.of("target_segments"), find(results, "ELSEWHERE").failedConditions);
    }

    @Test
    void match_shouldCompareComplianceRatio() {
        ScoreBreakdown declared = breakdown(80.0, Grade.A_MINUS, 1.8).toBuilder().complianceRatio(66.7).build();

        List<MatchResult> results = matcher.match(declared, null, List.of(
                product("LENIENT", 4.0, false, EligibilityCondition.numeric("min_compliance_ratio", 60.0)),
                product("STRICT", 4.0, false, EligibilityCondition.numeric("min_compliance_ratio", 100.0))
        ));

        assertTrue(find(results, "LENIENT").eligible);
        assertEquals(Set.of("min_compliance_ratio"), find(results, "STRICT").failedConditions);
    }

    @Test
    void simulateUpgrade_shouldListProductsUnlockedByNextGrade() {
        List<ProductSpec> catalog = List.of(
                product("GRADE-B", 4.0, true, EligibilityCondition.minGrade("min_grade", Grade.B)),
                product("OPEN", 5.0, true)
        );
        ScoreBreakdown current = breakdown(80.0, Grade.B_MINUS, 0.8);

        UpgradeSimulation upgrade = matcher.simulateUpgrade(current, null, catalog, current.grade.better());

        assertEquals(Grade.B, upgrade.targetGrade);
        assertEquals(List.of("OPEN"), upgrade.currentEligible);
        assertEquals(List.of("GRADE-B", "OPEN"), upgrade.targetEligible);
        assertEquals(List.of("GRADE-B"), upgrade.newProducts);
        assertEquals(0.8, upgrade.bestCurrentDiscount, 1e-9);
        assertEquals(1.2, upgrade.bestTargetDiscount, 1e-9);
        assertEquals(0.4, upgrade.rateImprovement, 1e-9);
    }

    @Test
    void simulateUpgrade_shouldRejectTargetBelowCurrentGrade() {
        ValidationException error = assertThrows(ValidationException.class, () -> matcher.simulateUpgrade(
                breakdown(80.0, Grade.B_PLUS, 1.3), null, List.of(), Grade.C));
        assertEquals("acme", error.subject());
        assertEquals(null, Grade.A_PLUS.better());
    }

    private static MatchResult find(List<MatchResult> results, String id) {
        for (MatchResult r : results) {
            if (r.productId.equals(id)) {
                return r;
            }
        }
        throw new AssertionError("no result for " + id);
    }

    private static List<String> ids(List<MatchResult> results) {
        return results.stream().map(r -> r.productId).collect(Collectors.toList());
    }
}
