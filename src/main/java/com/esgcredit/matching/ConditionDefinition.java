package com.esgcredit.matching;

import com.esgcredit.model.Pillar;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * Fixed meaning of one eligibility condition name: what it reads and how it compares.
 * {@code pillar == null} on a score source means the total score.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class ConditionDefinition {
    public enum Comparison {
        AT_LEAST,
        AT_MOST,
        /** The company's industry or size class is one of the listed segments. */
        ANY_OF
    }

    public enum Source {
        CURRENT_SCORE,
        PROJECTED_SCORE,
        GRADE,
        INDICATOR,
        SCOPE_ADJUSTMENT,
        COMPLIANCE_RATIO,
        SEGMENT
    }

    public final String name;
    public final Comparison comparison;
    public final Source source;
    public final Pillar pillar;
    /** Normalized indicator key, {@code pillar.indicator}, for {@link Source#INDICATOR}. */
    public final String indicatorKey;

    public boolean projected() {
        return source == Source.PROJECTED_SCORE;
    }

    public boolean numeric() {
        return source != Source.GRADE && source != Source.SEGMENT;
    }
}
