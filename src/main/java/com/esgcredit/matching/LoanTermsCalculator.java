package com.esgcredit.matching;

import com.esgcredit.config.Config;
import com.esgcredit.core.ValidationException;
import com.esgcredit.model.MatchResult;

/**
 * Equal-instalment amortisation of a loan at a match's effective rate. Rates are annual percentages.
 */
public final class LoanTermsCalculator {
    private final int termYears;

    public LoanTermsCalculator(int termYears) {
        this.termYears = Math.max(1, termYears);
    }

    public static LoanTermsCalculator fromConfig(Config config) {
        return new LoanTermsCalculator(config.getInt("loan.term_years", 5));
    }

    public LoanTerms calculate(MatchResult match, double amount) {
        if (!Double.isFinite(amount) || amount <= 0.0) {
            throw new ValidationException(match.productId, "loan amount must be > 0, got " + amount);
        }
        int payments = termYears * 12;
        double monthly = monthlyPayment(amount, match.effectiveRate, payments);
        double total = monthly * payments;
        double interest = total - amount;
        double baseInterest = monthlyPayment(amount, match.baseRate, payments) * payments - amount;
        return LoanTerms.builder()
                .productId(match.productId)
                .amount(amount)
                .termYears(termYears)
                .baseRate(match.baseRate)
                .effectiveRate(match.effectiveRate)
                .monthlyPayment(round2(monthly))
                .totalPayment(round2(total))
                .totalInterest(round2(interest))
                .savingsVsBase(round2(baseInterest - interest))
                .build();
    }

    static double monthlyPayment(double amount, double annualRatePct, int payments) {
        double r = annualRatePct / 12.0 / 100.0;
        if (r <= 0.0) {
            return amount / payments;
        }
        double factor = Math.pow(1.0 + r, payments);
        return amount * r * factor / (factor - 1.0);
    }

    private static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }
}
