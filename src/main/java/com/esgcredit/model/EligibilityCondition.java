package com.esgcredit.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * One named threshold of a product. Grade conditions carry {@link #grade}, segment conditions
 * {@link #segments}, numeric ones {@link #threshold}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class EligibilityCondition {
    public final String name;
    public final double threshold;
    public final Grade grade;
    @Builder.Default
    public final ProjectionMode projection = ProjectionMode.FINAL_STEP;
    /** Industries or size classes the product targets; {@code all} or {@code *} admits every company. */
    @Builder.Default
    public final List<String> segments = List.of();

    public static EligibilityCondition numeric(String name, double threshold) {
        return new EligibilityCondition(name, threshold, null, ProjectionMode.FINAL_STEP, List.of());
    }

    public static EligibilityCondition projected(String name, double threshold, ProjectionMode projection) {
        return new EligibilityCondition(name, threshold, null, projection, List.of());
    }

    public static EligibilityCondition minGrade(String name, Grade grade) {
        return new EligibilityCondition(name, Double.NaN, grade, ProjectionMode.FINAL_STEP, List.of());
    }

    public static EligibilityCondition segments(String name, List<String> segments) {
        return new EligibilityCondition(name, Double.NaN, null, ProjectionMode.FINAL_STEP, List.copyOf(segments));
    }
}
