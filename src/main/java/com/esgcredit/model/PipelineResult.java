package com.esgcredit.model;

import com.esgcredit.core.diagnostics.CauseCode;
import com.esgcredit.matching.LoanTerms;
import com.esgcredit.matching.UpgradeSimulation;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Everything one company's pipeline run produced. {@code forecast} is null when forecasting failed;
 * {@code forecastCause} and {@code forecastMessage} then say why.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class PipelineResult {
    public final String company;
    public final ScopeAggregate supplyChain;
    public final ScoreBreakdown score;
    public final ForecastResult forecast;
    public final CauseCode forecastCause;
    public final String forecastMessage;
    public final List<MatchResult> matches;
    public final List<LoanTerms> loanTerms;
    /** Offer at the next grade up; null when the company already holds the top grade. */
    public final UpgradeSimulation upgrade;
    public final Map<String, Long> timingsMs;

    public boolean forecastAvailable() {
        return forecast != null;
    }
}
