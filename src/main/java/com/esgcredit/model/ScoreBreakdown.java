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
public final class ScoreBreakdown {
    public final String company;
    public final String industry;
    public final String sizeClass;
    public final double environmental;
    public final double social;
    public final double governance;
    public final double total;
    public final Grade grade;
    public final double discountPct;
    public final double scopeAdjustment;
    /** Normalized sub-indicator values keyed {@code pillar.indicator}. */
    public final Map<String, Double> normalizedIndicators;
    public final List<String> missingIndicators;
    public final List<Pillar> improvementAreas;
    /** Configured reporting frameworks and whether the company complies; absent declarations are false. */
    public final Map<String, Boolean> compliance;
    /** Share of configured frameworks complied with, 0..100, one decimal. */
    public final double complianceRatio;

    public double score(Pillar pillar) {
        switch (pillar) {
            case ENVIRONMENTAL:
                return environmental;
            case SOCIAL:
                return social;
            default:
                return governance;
        }
    }
}
