package ru.fundingengine.service.prediction;

import ru.fundingengine.dto.exchanges.ExchangeType;
import ru.fundingengine.dto.funding.RatePrediction;

import java.util.Optional;

/**
 * Forecast of the next hourly funding rate. Model fitting lives outside this application;
 * only the output contract is consumed.
 */
public interface EnsembleRatePredictor {

    Optional<RatePrediction> predict(String symbol, ExchangeType exchange);
}
