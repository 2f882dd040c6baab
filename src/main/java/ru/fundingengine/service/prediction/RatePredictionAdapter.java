package ru.fundingengine.service.prediction;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import ru.fundingengine.dto.exchanges.ExchangeType;
import ru.fundingengine.dto.funding.ArbitrageOpportunity;
import ru.fundingengine.dto.funding.HistoricalMetrics;
import ru.fundingengine.dto.funding.RatePrediction;
import ru.fundingengine.dto.funding.SpreadForecast;

import java.util.Optional;

/**
 * Single entry point to the optional predictor and historical metrics source.
 * Every caller gets a usable answer: when a collaborator is absent or fails, current
 * rates stand in at {@link #FALLBACK_CONFIDENCE}.
 */
@Slf4j
@Component
public class RatePredictionAdapter {

    public static final double FALLBACK_CONFIDENCE = 0.5;

    private final EnsembleRatePredictor predictor;
    private final HistoricalMetricsProvider historicalMetricsProvider;

    @Autowired
    public RatePredictionAdapter(ObjectProvider<EnsembleRatePredictor> predictor,
                                 ObjectProvider<HistoricalMetricsProvider> historicalMetricsProvider) {
        this(predictor.getIfAvailable(), historicalMetricsProvider.getIfAvailable());
    }

    public RatePredictionAdapter(EnsembleRatePredictor predictor,
                                 HistoricalMetricsProvider historicalMetricsProvider) {
        this.predictor = predictor;
        this.historicalMetricsProvider = historicalMetricsProvider;
    }

    public static RatePredictionAdapter withoutCollaborators() {
        return new RatePredictionAdapter((EnsembleRatePredictor) null, null);
    }

    public boolean hasPredictor() {
        return predictor != null;
    }

    public boolean hasHistoricalMetrics() {
        return historicalMetricsProvider != null;
    }

    public Optional<RatePrediction> predict(String symbol, ExchangeType exchange) {
        if (predictor == null) {
            return Optional.empty();
        }
        try {
            return predictor.predict(symbol, exchange).filter(RatePrediction::hasFiniteRate);
        } catch (RuntimeException e) {
            log.debug("[Prediction] Predictor failed for {} on {}: {}", symbol, exchange, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Both legs of an opportunity. Confidence is the mean of the legs that were predicted,
     * or the fallback when neither was.
     */
    public SpreadForecast forecast(ArbitrageOpportunity opportunity) {
        Optional<RatePrediction> longPrediction = predict(opportunity.getSymbol(), opportunity.getLongExchange());
        Optional<RatePrediction> shortPrediction = predict(opportunity.getSymbol(), opportunity.getShortExchange());

        double confidence;
        if (longPrediction.isPresent() && shortPrediction.isPresent()) {
            confidence = (longPrediction.get().getConfidence() + shortPrediction.get().getConfidence()) / 2;
        } else if (longPrediction.isPresent()) {
            confidence = longPrediction.get().getConfidence();
        } else if (shortPrediction.isPresent()) {
            confidence = shortPrediction.get().getConfidence();
        } else {
            confidence = FALLBACK_CONFIDENCE;
        }

        return SpreadForecast.builder()
                .longPrediction(longPrediction.orElseGet(() -> fallback(opportunity.getLongRate())))
                .shortPrediction(shortPrediction.orElseGet(() -> fallback(opportunity.getShortRate())))
                .confidence(confidence)
                .fromPredictor(longPrediction.isPresent() || shortPrediction.isPresent())
                .build();
    }

    public Optional<HistoricalMetrics> getHistoricalMetrics(String symbol, ExchangeType exchange) {
        if (historicalMetricsProvider == null) {
            return Optional.empty();
        }
        try {
            return historicalMetricsProvider.getHistoricalMetrics(symbol, exchange);
        } catch (RuntimeException e) {
            log.debug("[Prediction] Historical metrics failed for {} on {}: {}", symbol, exchange, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Historical metrics for one leg. Without a configured provider the current rate stands in
     * for min, average and max at fallback consistency; with a provider, missing data stays empty.
     */
    public Optional<HistoricalMetrics> getHistoricalMetrics(String symbol, ExchangeType exchange, double currentRate) {
        if (historicalMetricsProvider == null) {
            return Optional.of(HistoricalMetrics.builder()
                    .minRate(currentRate)
                    .averageRate(currentRate)
                    .maxRate(currentRate)
                    .consistencyScore(FALLBACK_CONFIDENCE)
                    .build());
        }
        return getHistoricalMetrics(symbol, exchange);
    }

    //Current rate as a point forecast; NaN bounds mark "no interval"
    private static RatePrediction fallback(double currentRate) {
        return RatePrediction.builder()
                .rate(currentRate)
                .lowerBound(Double.NaN)
                .upperBound(Double.NaN)
                .confidence(FALLBACK_CONFIDENCE)
                .build();
    }
}
