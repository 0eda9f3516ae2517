package com.esgcredit.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class ConfidenceBand {
    public final double lower;
    public final double upper;

    public double width() {
        return upper - lower;
    }
}
