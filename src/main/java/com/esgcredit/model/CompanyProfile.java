package com.esgcredit.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * A company catalog entry: indicators, monthly history and suppliers.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class CompanyProfile {
    public final IndicatorRecord indicators;
    public final HistoricalSeries history;
    public final List<SupplierRecord> suppliers;
    public final double targetLoanAmount;

    public String name() {
        return indicators.name;
    }
}
