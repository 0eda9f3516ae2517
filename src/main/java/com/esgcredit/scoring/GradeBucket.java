package com.esgcredit.scoring;

import com.esgcredit.model.Grade;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * One score range of the grade table. {@code lower} belongs to this bucket, {@code upper} to the one above it
 * (except the top bucket, which includes 100).
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class GradeBucket {
    public final Grade grade;
    public final double lower;
    public final double upper;
    public final double discountPct;
}
