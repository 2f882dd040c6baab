package ru.fundingengine.dto.funding;

import lombok.Builder;
import lombok.Value;
import ru.fundingengine.dto.exchanges.ExchangeType;

import java.time.Instant;

/**
 * Live long/short pair as reported by the exchanges. Read each cycle, never owned here.
 */
@Value
@Builder
public class OpenPositionPair {
    String symbol;
    //Either leg may be null for a broken (single-leg) pair
    ExchangeType longExchange;
    ExchangeType shortExchange;
    double notionalSize;
    int leverage;
    Instant entryTimestamp;
    double entrySpread;
    double currentValue;
    double currentCollateral;

    public boolean isPaired() {
        return longExchange != null && shortExchange != null;
    }

    public boolean matches(ArbitrageOpportunity opportunity) {
        return opportunity.getLongExchange() == longExchange
                && opportunity.getShortExchange() == shortExchange;
    }

    public String getKey() {
        return symbol + "-" + longExchange + "-" + shortExchange;
    }
}
