package ru.fundingengine.dto.exchanges;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BidAsk {
    private ExchangeType exchange;
    private String symbol;
    private double bid;
    private double ask;

    public double getSpread() {
        return ask - bid;
    }

    /**
     * Spread as a fraction of mid price (0.001 = 0.1%)
     */
    public double getSpreadFraction() {
        double mid = getMidPrice();
        return mid > 0 ? (ask - bid) / mid : 0.0;
    }

    public double getMidPrice() {
        return (bid + ask) / 2.0;
    }

    public boolean isValid() {
        return bid > 0 && ask > 0 && ask >= bid;
    }
}
