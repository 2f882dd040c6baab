package ru.fundingengine.dto.funding;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class HistoricalEvaluation {
    Double breakEvenHours;
    HistoricalMetrics longMetrics;
    HistoricalMetrics shortMetrics;
    //Null when plan or metrics are missing, or historical minimums never pay
    Double worstCaseBreakEvenHours;
    double consistencyScore;

    public double getAverageHistoricalRate() {
        if (longMetrics == null || shortMetrics == null) {
            return 0.0;
        }
        return (longMetrics.getAverageRate() + shortMetrics.getAverageRate()) / 2;
    }
}
