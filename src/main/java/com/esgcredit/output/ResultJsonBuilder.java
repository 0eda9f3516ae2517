package com.esgcredit.output;

import com.esgcredit.core.diagnostics.Outcome;
import com.esgcredit.matching.LoanTerms;
import com.esgcredit.matching.UpgradeSimulation;
import com.esgcredit.model.ConfidenceBand;
import com.esgcredit.model.ForecastResult;
import com.esgcredit.model.MatchResult;
import com.esgcredit.model.Pillar;
import com.esgcredit.model.PipelineResult;
import com.esgcredit.model.ScopeAggregate;
import com.esgcredit.model.ScoreBreakdown;
import org.json.JSONArray;
import org.json.JSONObject;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;

/**
 * 模块说明：ResultJsonBuilder（class）。
 * 主要职责：把流程结果序列化为 JSON，供看板、报告等外部协作方读取。
 * 使用建议：字段名使用下划线风格，调整字段时需同步外部消费方。
 */
public final class ResultJsonBuilder {

    public String build(List<Outcome<PipelineResult>> outcomes) {
        JSONArray array = new JSONArray();
        for (Outcome<PipelineResult> outcome : outcomes) {
            array.put(toJson(outcome));
        }
        JSONObject root = new JSONObject();
        root.put("results", array);
        return root.toString(2);
    }

/**
 * 方法说明：toJson，负责构建单个企业的输出对象。
 * 处理流程：失败时只输出 cause_code 与 message；成功时依次输出供应链、评分、预测、产品匹配与贷款条件。
 * 维护提示：预测缺失时 forecast 为 null，并给出 forecast_cause。
 */
    public JSONObject toJson(Outcome<PipelineResult> outcome) {
        JSONObject root = new JSONObject();
        root.put("company", outcome.owner);
        root.put("success", outcome.success);
        if (outcome.failed()) {
            root.put("cause_code", outcome.causeCode.name());
            root.put("message", outcome.message);
            root.put("details", new JSONObject(outcome.details));
            return root;
        }
        PipelineResult result = outcome.value;
        root.put("supply_chain", supplyChain(result.supplyChain));
        root.put("score", score(result.score));
        root.put("forecast", result.forecast == null ? JSONObject.NULL : forecast(result.forecast));
        root.put("forecast_cause", result.forecastCause.name());
        if (!result.forecastMessage.isEmpty()) {
            root.put("forecast_message", result.forecastMessage);
        }
        JSONArray matches = new JSONArray();
        for (MatchResult match : result.matches) {
            matches.put(match(match));
        }
        root.put("matches", matches);
        JSONArray loans = new JSONArray();
        for (LoanTerms terms : result.loanTerms) {
            loans.put(loan(terms));
        }
        root.put("loan_terms", loans);
        root.put("upgrade", result.upgrade == null ? JSONObject.NULL : upgrade(result.upgrade));
        root.put("timings_ms", new JSONObject(result.timingsMs));
        return root;
    }

    JSONObject score(ScoreBreakdown score) {
        JSONObject obj = new JSONObject();
        obj.put("industry", score.industry);
        obj.put("environmental", score.environmental);
        obj.put("social", score.social);
        obj.put("governance", score.governance);
        obj.put("total", score.total);
        obj.put("grade", score.grade.label());
        obj.put("discount_pct", score.discountPct);
        obj.put("scope_adjustment", score.scopeAdjustment);
        obj.put("normalized_indicators", new JSONObject(score.normalizedIndicators));
        obj.put("missing_indicators", new JSONArray(score.missingIndicators));
        List<String> areas = new ArrayList<>();
        for (Pillar pillar : score.improvementAreas) {
            areas.add(pillar.key());
        }
        obj.put("improvement_areas", new JSONArray(areas));
        obj.put("size_class", score.sizeClass);
        obj.put("compliance", score.compliance == null ? new JSONObject() : new JSONObject(score.compliance));
        obj.put("compliance_ratio", score.complianceRatio);
        return obj;
    }

    JSONObject supplyChain(ScopeAggregate supply) {
        JSONObject obj = new JSONObject();
        obj.put("supplier_count", supply.supplierCount);
        obj.put("scope3_estimate", supply.scope3Estimate);
        obj.put("risk_propagation", supply.riskPropagation);
        obj.put("weighted_esg_score", supply.weightedEsgScore);
        obj.put("top_concentration_pct", supply.topConcentrationPct);
        obj.put("grade", supply.supplyChainGrade);
        obj.put("high_risk_suppliers", new JSONArray(supply.highRiskSuppliers));
        JSONObject levels = new JSONObject();
        supply.riskLevels.forEach((id, level) -> levels.put(id, level.name()));
        obj.put("risk_levels", levels);
        return obj;
    }

    JSONObject forecast(ForecastResult forecast) {
        JSONObject obj = new JSONObject();
        obj.put("horizon", forecast.horizon);
        JSONArray periods = new JSONArray();
        for (YearMonth period : forecast.periods) {
            periods.put(period.toString());
        }
        obj.put("periods", periods);
        for (Pillar pillar : Pillar.values()) {
            JSONObject metric = new JSONObject();
            JSONArray values = new JSONArray();
            JSONArray lower = new JSONArray();
            JSONArray upper = new JSONArray();
            for (int i = 0; i < forecast.horizon; i++) {
                ConfidenceBand band = forecast.bands(pillar).get(i);
                values.put(round2(forecast.predictions(pillar).get(i)));
                lower.put(round2(band.lower));
                upper.put(round2(band.upper));
            }
            metric.put("predictions", values);
            metric.put("lower", lower);
            metric.put("upper", upper);
            obj.put(pillar.key(), metric);
        }
        return obj;
    }

    JSONObject match(MatchResult match) {
        JSONObject obj = new JSONObject();
        obj.put("product_id", match.productId);
        obj.put("product_name", match.productName);
        obj.put("eligible", match.eligible);
        obj.put("failed_conditions", new JSONArray(match.failedConditions));
        obj.put("base_rate", match.baseRate);
        obj.put("discount", match.discount);
        obj.put("effective_rate", match.effectiveRate);
        return obj;
    }

    JSONObject upgrade(UpgradeSimulation upgrade) {
        JSONObject obj = new JSONObject();
        obj.put("current_grade", upgrade.currentGrade.label());
        obj.put("target_grade", upgrade.targetGrade.label());
        obj.put("current_eligible", new JSONArray(upgrade.currentEligible));
        obj.put("target_eligible", new JSONArray(upgrade.targetEligible));
        obj.put("new_products", new JSONArray(upgrade.newProducts));
        obj.put("rate_improvement", upgrade.rateImprovement);
        return obj;
    }

    JSONObject loan(LoanTerms terms) {
        JSONObject obj = new JSONObject();
        obj.put("product_id", terms.productId);
        obj.put("amount", terms.amount);
        obj.put("term_years", terms.termYears);
        obj.put("effective_rate", terms.effectiveRate);
        obj.put("monthly_payment", terms.monthlyPayment);
        obj.put("total_interest", terms.totalInterest);
        obj.put("savings_vs_base", terms.savingsVsBase);
        return obj;
    }

    private static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }
}
