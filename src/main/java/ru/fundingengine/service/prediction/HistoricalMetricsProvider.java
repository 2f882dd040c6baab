package ru.fundingengine.service.prediction;

import ru.fundingengine.dto.exchanges.ExchangeType;
import ru.fundingengine.dto.funding.HistoricalMetrics;

import java.util.Optional;

public interface HistoricalMetricsProvider {

    Optional<HistoricalMetrics> getHistoricalMetrics(String symbol, ExchangeType exchange);
}
