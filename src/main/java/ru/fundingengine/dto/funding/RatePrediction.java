package ru.fundingengine.dto.funding;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RatePrediction {
    double rate;
    double lowerBound;
    double upperBound;
    //0..1
    double confidence;
    MarketRegime regime;
    double regimeConfidence;

    public boolean hasFiniteRate() {
        return Double.isFinite(rate);
    }

    public boolean hasFiniteBounds() {
        return Double.isFinite(lowerBound) && Double.isFinite(upperBound);
    }
}
