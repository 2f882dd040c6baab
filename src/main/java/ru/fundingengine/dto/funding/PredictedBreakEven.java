package ru.fundingengine.dto.funding;

import lombok.Builder;
import lombok.Value;

/**
 * Break-even estimates for one opportunity. Hours are {@link Double#POSITIVE_INFINITY}
 * when the spread never covers the costs.
 */
@Value
@Builder
public class PredictedBreakEven {
    double predictedBreakEvenHours;
    double confidence;
    //long - short
    double predictedSpread;
    double worstCaseBreakEvenHours;
    double bestCaseBreakEvenHours;
    double reliableHorizonHours;
    double confidenceAdjustedBreakEvenHours;
    boolean predictionReliable;
    RatePrediction longPrediction;
    RatePrediction shortPrediction;
}
