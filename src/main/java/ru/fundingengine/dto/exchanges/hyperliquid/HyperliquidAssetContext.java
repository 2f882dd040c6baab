package ru.fundingengine.dto.exchanges.hyperliquid;

import lombok.Builder;
import lombok.Value;

/**
 * One row of the Hyperliquid {@code metaAndAssetCtxs} response, joined with its universe entry.
 */
@Value
@Builder
public class HyperliquidAssetContext {
    String coin;
    //Hourly funding rate
    double funding;
    double markPrice;
    double midPrice;
    //Base asset units
    double openInterest;
    double[] impactPrices;

    public double getOpenInterestUsd() {
        return openInterest * markPrice;
    }
}
