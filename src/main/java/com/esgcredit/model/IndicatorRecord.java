package com.esgcredit.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One company's raw E/S/G sub-indicators. A {@code null} value marks an indicator reported as missing.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class IndicatorRecord {
    public final String name;
    public final String industry;
    public final String sizeClass;
    public final Map<String, Double> environmental;
    public final Map<String, Double> social;
    public final Map<String, Double> governance;
    /** Reporting frameworks the company declares compliance with, keyed by framework id. May be null. */
    public final Map<String, Boolean> compliance;

    public Map<String, Double> indicators(Pillar pillar) {
        Map<String, Double> raw;
        switch (pillar) {
            case ENVIRONMENTAL:
                raw = environmental;
                break;
            case SOCIAL:
                raw = social;
                break;
            default:
                raw = governance;
                break;
        }
        if (raw == null) {
            return Map.of();
        }
        // LinkedHashMap keeps insertion order and tolerates null values
        return Collections.unmodifiableMap(new LinkedHashMap<>(raw));
    }
}
