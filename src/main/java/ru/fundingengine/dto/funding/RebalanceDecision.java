package ru.fundingengine.dto.funding;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RebalanceDecision {
    boolean shouldRebalance;
    String reason;
    //Null when the pair never breaks even
    Double currentBreakEvenHours;
    Double newBreakEvenHours;
}
