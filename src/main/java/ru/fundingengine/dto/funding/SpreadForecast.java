package ru.fundingengine.dto.funding;

import lombok.Builder;
import lombok.Value;

/**
 * Predictions for both legs of a pair. Missing legs fall back to current rates.
 */
@Value
@Builder
public class SpreadForecast {
    RatePrediction longPrediction;
    RatePrediction shortPrediction;
    double confidence;
    boolean fromPredictor;
}
