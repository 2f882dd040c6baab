package ru.fundingengine.dto.funding;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SelectedOpportunity {
    ArbitrageOpportunity opportunity;
    ExecutionPlan plan;
    //Target notional after this allocation
    Double maxPositionSizeUsd;
    boolean existing;
    Double currentValue;
    Double currentCollateral;
    //Collateral added by this allocation
    double additionalCollateral;
    boolean fullyFilled;
    String reason;
}
