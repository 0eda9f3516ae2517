package com.esgcredit.runner;

import com.esgcredit.config.Config;
import com.esgcredit.core.diagnostics.CauseCode;
import com.esgcredit.core.diagnostics.Outcome;
import com.esgcredit.data.CatalogLoader;
import com.esgcredit.matching.ConditionRegistry;
import com.esgcredit.model.CompanyProfile;
import com.esgcredit.model.Grade;
import com.esgcredit.model.HistoricalSeries;
import com.esgcredit.model.IndicatorRecord;
import com.esgcredit.model.MatchResult;
import com.esgcredit.model.Pillar;
import com.esgcredit.model.PipelineResult;
import com.esgcredit.model.ProductSpec;
import com.esgcredit.model.SupplierRiskLevel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EsgPipelineTest {
    static final Config CONFIG = Config.fromMap(Map.of(
            "indicator.range.board_independence", "0,1",
            "indicator.inverse", "carbon_intensity",
            "forecast.members", "3",
            "forecast.trees", "10",
            "forecast.max_depth", "4"
    ));

    private final EsgPipeline pipeline = EsgPipeline.fromConfig(CONFIG);
    private List<CompanyProfile> companies;
    private List<ProductSpec> products;

    @BeforeEach
    void loadFixtures() throws Exception {
        CatalogLoader loader = new CatalogLoader(ConditionRegistry.standard());
        companies = loader.loadCompanies(resource("companies.json"));
        products = loader.loadProducts(resource("products.json"));
    }

    static Path resource(String name) throws Exception {
        return Path.of(EsgPipelineTest.class.getClassLoader().getResource(name).toURI());
    }

    @Test
    void run_shouldApplySupplyChainPenaltyToEnvironmentalScore() {
        Outcome<PipelineResult> outcome = pipeline.run(companies.get(0), products, 3);

        assertTrue(outcome.success, outcome.message);
        PipelineResult result = outcome.value;
        assertEquals("Green Steel Co", result.company);
        assertEquals(920.0, result.supplyChain.scope3Estimate, 1e-9);
        assertEquals(6.5, result.supplyChain.riskPropagation, 1e-9);
        assertEquals(SupplierRiskLevel.HIGH, result.supplyChain.riskLevels.get("SUP-C"));
        assertEquals(73.5, result.score.environmental, 1e-9);
        assertEquals(6.5, result.score.scopeAdjustment, 1e-9);
        assertEquals(78.05, result.score.total, 1e-9);
        assertEquals(Grade.B_PLUS, result.score.grade);
    }

    @Test
    void run_shouldForecastAndMatchWithEnoughHistory() {
        PipelineResult result = pipeline.run(companies.get(0), products, 3).value;

        assertTrue(result.forecastAvailable());
        assertEquals(CauseCode.NONE, result.forecastCause);
        assertEquals(3, result.forecast.horizon);
        for (Pillar pillar : Pillar.values()) {
            for (double v : result.forecast.predictions(pillar)) {
                assertTrue(v >= 0.0 && v <= 100.0);
            }
        }

        assertEquals(List.of("TIERED-LOAN", "FUTURE-BOND", "GREEN-LOAN", "SME-LOAN"), ids(result.matches));
        MatchResult tiered = result.matches.get(0);
        assertTrue(tiered.eligible);
        assertEquals(3.6, tiered.effectiveRate, 1e-9);
        MatchResult green = result.matches.get(2);
        assertEquals(Set.of("min_e_score"), green.failedConditions);
        assertEquals(4.5, green.effectiveRate, 1e-9);

        assertEquals(List.of("TIERED-LOAN", "SME-LOAN"),
                result.loanTerms.stream().map(t -> t.productId).collect(Collectors.toList()));
    }

    @Test
    void run_shouldKeepScoreAndMatchesWhenHistoryIsShort() {
        Outcome<PipelineResult> outcome = pipeline.run(companies.get(1), products, 3);

        assertTrue(outcome.success);
        PipelineResult result = outcome.value;
        assertNull(result.forecast);
        assertEquals(CauseCode.HISTORY_SHORT, result.forecastCause);
        assertFalse(result.forecastMessage.isEmpty());
        assertEquals(20.0, result.score.environmental, 1e-9);
        assertEquals(55.0, result.score.total, 1e-9);
        assertEquals(Grade.C, result.score.grade);
        assertTrue(result.score.missingIndicators.contains("environmental.carbon_intensity"));

        assertEquals(List.of("FUTURE-BOND", "TIERED-LOAN", "GREEN-LOAN", "SME-LOAN"), ids(result.matches));
        assertEquals(Set.of("projected_e_score"), result.matches.get(0).failedConditions);
        assertTrue(result.matches.get(3).eligible);
        assertTrue(result.loanTerms.isEmpty());
    }

    @Test
    void run_shouldRejectNonPositiveHorizon() {
        Outcome<PipelineResult> outcome = pipeline.run(companies.get(0), products, 0);

        assertFalse(outcome.success);
        assertEquals(CauseCode.VALIDATION_FAILED, outcome.causeCode);
        assertEquals("Green Steel Co", outcome.owner);
    }

    @Test
    void run_shouldReportOutOfRangeIndicatorUnderCompanyName() {
        CompanyProfile broken = companies.get(0).toBuilder()
                .indicators(IndicatorRecord.builder()
                        .name("Broken Co")
                        .industry("retail")
                        .sizeClass("small")
                        .environmental(Map.of("renewable_energy_ratio", 140.0))
                        .social(Map.of("safety_score", 70.0))
                        .governance(Map.of("ethics_compliance", 70.0))
                        .build())
                .history(new HistoricalSeries("Broken Co", List.of()))
                .build();

        Outcome<PipelineResult> outcome = pipeline.run(broken, products, 3);

        assertEquals(CauseCode.VALIDATION_FAILED, outcome.causeCode);
        assertEquals("Broken Co", outcome.owner);
        assertEquals("Broken Co/environmental.renewable_energy_ratio", outcome.details.get("subject"));
    }

    @Test
    void run_shouldBeReproducibleForSameSeed() {
        PipelineResult first = pipeline.run(companies.get(0), products, 4).value;
        PipelineResult second = EsgPipeline.fromConfig(CONFIG).run(companies.get(0), products, 4).value;

        assertNotNull(first.forecast);
        for (Pillar pillar : Pillar.values()) {
            assertEquals(first.forecast.predictions(pillar), second.forecast.predictions(pillar));
            assertEquals(first.forecast.bands(pillar), second.forecast.bands(pillar));
        }
    }

    @Test
    void run_shouldSimulateUpgradeToNextGrade() {
        PipelineResult green = pipeline.run(companies.get(0), products, 3).value;

        assertEquals(Grade.A_MINUS, green.upgrade.targetGrade);
        assertEquals(List.of("TIERED-LOAN", "SME-LOAN"), green.upgrade.currentEligible);
        assertTrue(green.upgrade.newProducts.isEmpty());
        assertEquals(0.2, green.upgrade.rateImprovement, 1e-9);

        PipelineResult young = pipeline.run(companies.get(1), products, 3).value;

        assertEquals(Grade.B_MINUS, young.upgrade.targetGrade);
        assertEquals(List.of("SME-LOAN"), young.upgrade.currentEligible);
        assertEquals(List.of("TIERED-LOAN"), young.upgrade.newProducts);
        assertEquals(0.2, young.upgrade.rateImprovement, 1e-9);
    }

    @Test
    void run_shouldReportComplianceRatioAndSizeClass() {
        PipelineResult green = pipeline.run(companies.get(0), products, 3).value;
        assertEquals(66.7, green.score.complianceRatio, 1e-9);
        assertEquals("large", green.score.sizeClass);

        PipelineResult young = pipeline.run(companies.get(1), products, 3).value;
        assertEquals(0.0, young.score.complianceRatio, 1e-9);
    }

    private static List<String> ids(List<MatchResult> results) {
        return results.stream().map(r -> r.productId).collect(Collectors.toList());
    }
}
