package ru.fundingengine.dto.funding;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class LadderAllocationResult {
    List<SelectedOpportunity> selectedOpportunities;
    double remainingCapital;
    double cumulativeCapitalUsed;

    public static LadderAllocationResult empty(double capital) {
        return new LadderAllocationResult(List.of(), capital, 0.0);
    }
}
