package com.esgcredit.supply;

import com.esgcredit.config.Config;
import com.esgcredit.core.ValidationException;
import com.esgcredit.model.ScopeAggregate;
import com.esgcredit.model.SupplierRecord;
import com.esgcredit.model.SupplierRiskLevel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 模块说明：SupplyChainAnalyzer（class）。
 * 主要职责：汇总供应商排放与 ESG 缺口，得到 Scope 3 估算和传导给环境分的风险扣分。
 * 使用建议：结果只依赖供应商集合本身，与传入顺序无关。
 */
public final class SupplyChainAnalyzer {
    private static final Logger LOG = LogManager.getLogger(SupplyChainAnalyzer.class);

    private static final Comparator<SupplierRecord> CANONICAL_ORDER = Comparator
            .comparing((SupplierRecord s) -> s.id)
            .thenComparingDouble(s -> s.emissions)
            .thenComparingDouble(s -> s.esgScore)
            .thenComparingDouble(s -> s.weight);

    private final double targetEsgScore;
    private final double riskScale;
    private final double highRiskScore;
    private final int concentrationTopN;

    public SupplyChainAnalyzer(double targetEsgScore, double riskScale, double highRiskScore, int concentrationTopN) {
        this.targetEsgScore = targetEsgScore;
        this.riskScale = riskScale;
        this.highRiskScore = highRiskScore;
        this.concentrationTopN = Math.max(1, concentrationTopN);
    }

    public static SupplyChainAnalyzer fromConfig(Config config) {
        return new SupplyChainAnalyzer(
                config.getDouble("supply.target_esg_score", 70.0),
                config.getDouble("supply.risk_scale", 0.5),
                config.getDouble("supply.high_risk_score", 40.0),
                config.getInt("supply.concentration_top_n", 5)
        );
    }

/**
 * 方法说明：aggregate，负责汇总供应链排放与风险。
 * 处理流程：校验记录，按规范顺序排序后归一化权重，再计算加权排放、加权 ESG 缺口及集中度。
 * 维护提示：权重全为 0 时按等权处理，空列表返回零值汇总而非报错。
 */
    public ScopeAggregate aggregate(List<SupplierRecord> suppliers) {
        if (suppliers == null || suppliers.isEmpty()) {
            return ScopeAggregate.empty();
        }
        List<SupplierRecord> ordered = new ArrayList<>(suppliers.size());
        Set<String> ids = new HashSet<>();
        for (SupplierRecord supplier : suppliers) {
            validate(supplier);
            if (!ids.add(supplier.id)) {
                throw new ValidationException(supplier.id, "duplicate supplier id");
            }
            ordered.add(supplier);
        }
        ordered.sort(CANONICAL_ORDER);

        int n = ordered.size();
        double weightSum = 0.0;
        for (SupplierRecord supplier : ordered) {
            weightSum += supplier.weight;
        }
        double[] weights = new double[n];
        for (int i = 0; i < n; i++) {
            weights[i] = weightSum > 0.0 ? ordered.get(i).weight / weightSum : 1.0 / n;
        }

        double scope3 = 0.0;
        double deficit = 0.0;
        double weightedEsg = 0.0;
        Map<String, SupplierRiskLevel> levels = new LinkedHashMap<>();
        List<String> highRisk = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            SupplierRecord supplier = ordered.get(i);
            scope3 += weights[i] * supplier.emissions;
            deficit += weights[i] * Math.max(0.0, targetEsgScore - supplier.esgScore);
            weightedEsg += weights[i] * supplier.esgScore;

            SupplierRiskLevel level = riskLevel(supplier.esgScore);
            levels.put(supplier.id, level);
            if (level == SupplierRiskLevel.HIGH) {
                highRisk.add(supplier.id);
            }
        }

        double[] sortedWeights = weights.clone();
        Arrays.sort(sortedWeights);
        double top = 0.0;
        for (int i = 0; i < Math.min(concentrationTopN, n); i++) {
            top += sortedWeights[n - 1 - i];
        }

        double risk = clamp(deficit * riskScale, 0.0, 100.0);
        ScopeAggregate aggregate = ScopeAggregate.builder()
                .supplierCount(n)
                .scope3Estimate(round2(scope3))
                .riskPropagation(round2(risk))
                .weightedEsgScore(round2(weightedEsg))
                .topConcentrationPct(round2(top * 100.0))
                .supplyChainGrade(supplyChainGrade(weightedEsg))
                .riskLevels(Collections.unmodifiableMap(levels))
                .highRiskSuppliers(List.copyOf(highRisk))
                .build();
        LOG.debug("supply chain aggregate: suppliers={} scope3={} risk={} high_risk={}",
                n, aggregate.scope3Estimate, aggregate.riskPropagation, highRisk.size());
        return aggregate;
    }

    public SupplierRiskLevel riskLevel(double esgScore) {
        if (esgScore < highRiskScore) {
            return SupplierRiskLevel.HIGH;
        }
        if (esgScore < targetEsgScore) {
            return SupplierRiskLevel.MEDIUM;
        }
        return SupplierRiskLevel.LOW;
    }

    static String supplyChainGrade(double weightedEsg) {
        if (weightedEsg >= 85.0) return "A";
        if (weightedEsg >= 75.0) return "B+";
        if (weightedEsg >= 65.0) return "B";
        if (weightedEsg >= 55.0) return "B-";
        if (weightedEsg >= 45.0) return "C";
        return "D";
    }

    private static void validate(SupplierRecord supplier) {
        if (supplier == null) {
            throw new ValidationException("", "supplier record is null");
        }
        if (supplier.id == null || supplier.id.trim().isEmpty()) {
            throw new ValidationException("", "supplier id is blank");
        }
        if (!Double.isFinite(supplier.emissions) || supplier.emissions < 0.0) {
            throw new ValidationException(supplier.id, "emissions must be a finite value >= 0, got " + supplier.emissions);
        }
        if (!Double.isFinite(supplier.esgScore) || supplier.esgScore < 0.0 || supplier.esgScore > 100.0) {
            throw new ValidationException(supplier.id, "esg score must be within [0,100], got " + supplier.esgScore);
        }
        if (!Double.isFinite(supplier.weight) || supplier.weight < 0.0) {
            throw new ValidationException(supplier.id, "weight must be a finite value >= 0, got " + supplier.weight);
        }
    }

    private static double clamp(double v, double min, double max) {
        if (v < min) return min;
        if (v > max) return max;
        return v;
    }

    private static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }
}
