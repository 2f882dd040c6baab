package ru.fundingengine.dto.exchanges;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One open perpetual leg as reported by an exchange.
 */
@Value
@Builder
public class Position {
    ExchangeType exchange;
    //Exchange-specific symbol, e.g. ETHUSDT
    String symbol;
    Direction side;
    //Base asset units
    double size;
    double entryPrice;
    double markPrice;
    int leverage;
    //USD; 0 when the exchange does not report it
    double margin;
    //Null when the exchange does not report it
    Instant openedAt;

    public double getNotionalUsd() {
        double price = markPrice > 0 ? markPrice : entryPrice;
        return Math.abs(size) * price;
    }
}
