package com.esgcredit.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class ProductSpec {
    public final String id;
    public final String name;
    public final String type;
    public final double baseRate;
    public final boolean esgDiscount;
    public final List<EligibilityCondition> conditions;
    /** Optional per-grade discount points replacing the grade table discount. */
    public final Map<Grade, Double> gradeDiscounts;
}
