package ru.fundingengine.dto.funding;

import lombok.Builder;
import lombok.Value;

/**
 * Costs in USD for one proposed trade size.
 */
@Value
@Builder
public class TradeCosts {
    double fees;
    double slippage;
    double basisRiskCost;
    double total;

    public static TradeCosts of(double fees, double slippage, double basisRiskCost) {
        return new TradeCosts(fees, slippage, basisRiskCost, fees + slippage + basisRiskCost);
    }
}
