package com.esgcredit.matching;

import com.esgcredit.model.Grade;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * What the catalog would offer if the company reached {@link #targetGrade} with its scores unchanged.
 * Discounts and the improvement are in rate points.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class UpgradeSimulation {
    public final Grade currentGrade;
    public final Grade targetGrade;
    public final List<String> currentEligible;
    public final List<String> targetEligible;
    /** Eligible at the target grade but not today, in match order. */
    public final List<String> newProducts;
    public final double bestCurrentDiscount;
    public final double bestTargetDiscount;
    public final double rateImprovement;
}
