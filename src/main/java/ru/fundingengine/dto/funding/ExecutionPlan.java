package ru.fundingengine.dto.funding;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ExecutionPlan {
    ArbitrageOpportunity opportunity;
    double positionSizeUsd;
    int leverage;
    TradeCosts costs;
    //First-period return: hourly funding minus round-trip costs; > 0 means instantly profitable
    double expectedNetReturn;

    public double getEntryFees() {
        return costs.getFees() / 2;
    }

    public double getExitFees() {
        return costs.getFees() / 2;
    }

    public double getHourlyReturnUsd() {
        return opportunity.getExpectedReturn() / ArbitrageOpportunity.HOURS_PER_YEAR * positionSizeUsd;
    }
}
