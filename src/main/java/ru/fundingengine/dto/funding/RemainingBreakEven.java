package ru.fundingengine.dto.funding;

import lombok.Builder;
import lombok.Value;

/**
 * Sunk-cost view of an open pair: costs paid so far minus funding already earned.
 */
@Value
@Builder
public class RemainingBreakEven {
    //Infinity when the current funding never recovers the remaining cost
    double remainingBreakEvenHours;
    //<= 0 means the pair has already paid for itself
    double remainingCost;
    double feesEarnedSoFar;
    double hoursHeld;

    public static RemainingBreakEven untracked() {
        return new RemainingBreakEven(Double.POSITIVE_INFINITY, Double.POSITIVE_INFINITY, 0.0, 0.0);
    }

    public boolean isUntracked() {
        return remainingBreakEvenHours == Double.POSITIVE_INFINITY
                && remainingCost == Double.POSITIVE_INFINITY
                && hoursHeld == 0.0;
    }
}
