package com.esgcredit.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * 模块说明：ScopeAggregate（class）。
 * 主要职责：供应链 Scope 3 估算与风险传导分数，riskPropagation 即 ScoreEngine 的环境扣分。
 * 使用建议：修改该类型时应同步关注上下游调用，避免影响整体流程稳定性。
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class ScopeAggregate {
    public final int supplierCount;
    public final double scope3Estimate;
    public final double riskPropagation;
    public final double weightedEsgScore;
    public final double topConcentrationPct;
    public final String supplyChainGrade;
    public final Map<String, SupplierRiskLevel> riskLevels;
    public final List<String> highRiskSuppliers;

    public static ScopeAggregate empty() {
        return new ScopeAggregate(0, 0.0, 0.0, 0.0, 0.0, "N/A", Map.of(), List.of());
    }
}
