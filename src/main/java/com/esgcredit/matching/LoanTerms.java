package com.esgcredit.matching;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class LoanTerms {
    public final String productId;
    public final double amount;
    public final int termYears;
    public final double baseRate;
    public final double effectiveRate;
    public final double monthlyPayment;
    public final double totalPayment;
    public final double totalInterest;
    /** Interest saved against the same loan at the base rate. */
    public final double savingsVsBase;
}
