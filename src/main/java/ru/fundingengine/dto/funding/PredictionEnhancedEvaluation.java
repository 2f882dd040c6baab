package ru.fundingengine.dto.funding;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PredictionEnhancedEvaluation {
    HistoricalEvaluation historicalEvaluation;
    //Null when no predictor is configured or it had nothing for this pair
    PredictionEvaluation predictionEvaluation;
    //0..1
    double combinedScore;

    @Value
    @Builder
    public static class PredictionEvaluation {
        double predictedSpread;
        double predictionConfidence;
        Double predictedBreakEvenHours;
        MarketRegime regime;
        double regimeConfidence;
    }
}
