package com.esgcredit.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.Set;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class MatchResult {
    public final String productId;
    public final String productName;
    public final boolean eligible;
    public final Set<String> failedConditions;
    public final double baseRate;
    public final double discount;
    public final double effectiveRate;
}
