package ru.fundingengine.dto.funding;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class FundingRateComparison {
    String symbol;
    List<ExchangeFundingRate> rates;
    ExchangeFundingRate highestRate;
    ExchangeFundingRate lowestRate;
    //highest - lowest
    double spread;
    Instant timestamp;
}
