package ru.fundingengine.dto.funding;

import lombok.Builder;
import lombok.Value;
import ru.fundingengine.dto.exchanges.ExchangeType;

import java.time.Instant;

@Value
@Builder
public class ExchangeFundingRate {
    ExchangeType exchange;
    //Normalized symbol, e.g. "ETH"
    String symbol;
    //Hourly rate as decimal (0.0001 = 0.01%)
    double currentRate;
    double predictedRate;
    //0 when unavailable
    double markPrice;
    //USD, 0 when unavailable
    double openInterest;
    Instant timestamp;
}
