package ru.fundingengine.dto.funding;

import lombok.Builder;
import lombok.Value;
import ru.fundingengine.dto.exchanges.ExchangeType;
import ru.fundingengine.exceptions.ArbitrageInvariantException;

import java.time.Instant;

/**
 * A long/short pairing of two exchanges for one symbol.
 * Long leg receives funding when its rate is negative, short leg when its rate is positive.
 */
@Value
public class ArbitrageOpportunity {

    public static final double HOURS_PER_YEAR = 24 * 365;

    String symbol;
    ExchangeType longExchange;
    ExchangeType shortExchange;
    double longRate;
    double shortRate;
    //Hourly, absolute
    double spread;
    //Annualized: spread * HOURS_PER_YEAR
    double expectedReturn;
    Double longMarkPrice;
    Double shortMarkPrice;
    Double longOpenInterest;
    Double shortOpenInterest;
    Instant timestamp;

    @Builder(toBuilder = true)
    public ArbitrageOpportunity(String symbol,
                                ExchangeType longExchange,
                                ExchangeType shortExchange,
                                double longRate,
                                double shortRate,
                                double spread,
                                double expectedReturn,
                                Double longMarkPrice,
                                Double shortMarkPrice,
                                Double longOpenInterest,
                                Double shortOpenInterest,
                                Instant timestamp) {
        if (longExchange == null || shortExchange == null) {
            throw new ArbitrageInvariantException("Opportunity " + symbol + " is missing an exchange leg");
        }
        if (longExchange == shortExchange) {
            throw new ArbitrageInvariantException(
                    "Opportunity " + symbol + " uses " + longExchange + " for both legs");
        }
        this.symbol = symbol;
        this.longExchange = longExchange;
        this.shortExchange = shortExchange;
        this.longRate = longRate;
        this.shortRate = shortRate;
        this.spread = spread;
        this.expectedReturn = expectedReturn;
        this.longMarkPrice = longMarkPrice;
        this.shortMarkPrice = shortMarkPrice;
        this.longOpenInterest = longOpenInterest;
        this.shortOpenInterest = shortOpenInterest;
        this.timestamp = timestamp;
    }

    /**
     * Signed spread in the long-minus-short convention used by predictions.
     * Negative for a profitable pairing (long pays less than short).
     */
    public double getSignedSpread() {
        return longRate - shortRate;
    }

    public double getMinOpenInterest() {
        double longOi = longOpenInterest != null ? longOpenInterest : 0.0;
        double shortOi = shortOpenInterest != null ? shortOpenInterest : 0.0;
        return Math.min(longOi, shortOi);
    }

    public double getAverageMarkPrice() {
        if (longMarkPrice != null && shortMarkPrice != null) {
            return (longMarkPrice + shortMarkPrice) / 2;
        }
        if (longMarkPrice != null) {
            return longMarkPrice;
        }
        return shortMarkPrice != null ? shortMarkPrice : 0.0;
    }

    public String getPairKey() {
        return symbol + "-" + longExchange + "-" + shortExchange;
    }
}
