package ru.fundingengine.dto.funding;

import lombok.Builder;
import lombok.Value;
import lombok.With;

@Value
@With
@Builder
public class EvaluatedOpportunity {
    ArbitrageOpportunity opportunity;
    //Null when the trade is economically infeasible at the evaluated size
    ExecutionPlan plan;
    double netReturn;
    double positionValueUsd;
    Double breakEvenHours;
    //Theoretical max position size (USD) at the target APY, null when unknown
    Double maxPositionSizeUsd;
    PredictedBreakEven predictedBreakEven;
    OpportunityScore score;
    HistoricalEvaluation historical;

    public boolean hasPlan() {
        return plan != null;
    }

    public Recommendation getRecommendation() {
        return score != null ? score.getRecommendation() : null;
    }
}
