package ru.fundingengine.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ru.fundingengine.config.FundingConfig;
import ru.fundingengine.dto.exchanges.ExchangeType;
import ru.fundingengine.dto.funding.ExchangeFundingRate;
import ru.fundingengine.dto.funding.OpenPositionPair;
import ru.fundingengine.dto.funding.PositionFilterResult;
import ru.fundingengine.dto.funding.StickinessEvaluationResult;
import ru.fundingengine.service.tracking.PositionTimeTracker;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Hysteresis over open pairs: keeps positions unless the spread turns against them or a
 * replacement beats them by more than the cost of churning.
 */
@Slf4j
@Service
public class PositionStickinessManager {

    //Absorbs rounding when the improvement lands exactly on the churn threshold
    private static final double THRESHOLD_EPSILON = 1e-12;

    private final FundingRateAggregator aggregator;
    private final PositionTimeTracker timeTracker;
    private final FundingConfig fundingConfig;

    public PositionStickinessManager(FundingRateAggregator aggregator,
                                     PositionTimeTracker timeTracker,
                                     FundingConfig fundingConfig) {
        this.aggregator = aggregator;
        this.timeTracker = timeTracker;
        this.fundingConfig = fundingConfig;
    }

    public void recordPositionOpen(String symbol, ExchangeType longExchange, ExchangeType shortExchange) {
        timeTracker.recordOpen(positionKey(symbol, longExchange, shortExchange));
    }

    public void recordPositionClose(String symbol, ExchangeType longExchange, ExchangeType shortExchange) {
        timeTracker.removeOpen(positionKey(symbol, longExchange, shortExchange));
    }

    public OptionalDouble getPositionAgeHours(String symbol, ExchangeType longExchange, ExchangeType shortExchange) {
        return timeTracker.ageHours(positionKey(symbol, longExchange, shortExchange));
    }

    /**
     * Short rate minus long rate; empty when either leg is unavailable
     */
    public OptionalDouble getCurrentSpreadForPosition(String symbol, ExchangeType longExchange, ExchangeType shortExchange) {
        try {
            List<ExchangeFundingRate> rates = aggregator.getFundingRates(symbol);
            Optional<ExchangeFundingRate> longRate = rates.stream()
                    .filter(r -> r.getExchange() == longExchange).findFirst();
            Optional<ExchangeFundingRate> shortRate = rates.stream()
                    .filter(r -> r.getExchange() == shortExchange).findFirst();

            if (longRate.isEmpty() || shortRate.isEmpty()) {
                log.debug("[Stickiness] Cannot get current spread for {}: long={}, short={}", symbol,
                        longRate.map(r -> String.valueOf(r.getCurrentRate())).orElse("missing"),
                        shortRate.map(r -> String.valueOf(r.getCurrentRate())).orElse("missing"));
                return OptionalDouble.empty();
            }

            return OptionalDouble.of(shortRate.get().getCurrentRate() - longRate.get().getCurrentRate());
        } catch (RuntimeException e) {
            log.debug("[Stickiness] Error getting current spread for {}: {}", symbol, e.getMessage());
            return OptionalDouble.empty();
        }
    }

    /**
     * @param bestAlternativeSpread spread of the best new opportunity, null when there is none
     */
    public StickinessEvaluationResult shouldKeepPosition(String symbol,
                                                         ExchangeType longExchange,
                                                         ExchangeType shortExchange,
                                                         Double bestAlternativeSpread) {
        OptionalDouble spread = getCurrentSpreadForPosition(symbol, longExchange, shortExchange);
        OptionalDouble age = getPositionAgeHours(symbol, longExchange, shortExchange);

        FundingConfig.StickinessConfig config = fundingConfig.getStickiness();
        double closeThreshold = config.getCloseThreshold();
        double churnCost = (fundingConfig.getMakerFeeRate(longExchange) + fundingConfig.getMakerFeeRate(shortExchange)) * 2;

        log.debug("[Stickiness] Evaluating {} ({}/{}): spread={}, age={}", symbol, longExchange, shortExchange,
                spread.isPresent() ? pct(spread.getAsDouble()) : "unknown",
                age.isPresent() ? String.format("%.1fh", age.getAsDouble()) : "unknown");

        if (spread.isEmpty()) {
            return StickinessEvaluationResult.keep(
                    "Cannot determine current spread for " + symbol + " - keeping position");
        }
        double currentSpread = spread.getAsDouble();

        if (currentSpread < closeThreshold * 2) {
            return StickinessEvaluationResult.close(
                    symbol + " spread (" + pct(currentSpread) + ") is severely negative - closing");
        }

        if (age.isPresent() && age.getAsDouble() < config.getMinHoldHours()) {
            if (currentSpread > 0) {
                return StickinessEvaluationResult.keep(symbol + " is young ("
                        + String.format("%.1f", age.getAsDouble()) + "h) and profitable - keeping");
            }
            if (currentSpread > closeThreshold) {
                return StickinessEvaluationResult.keep(symbol + " is young and spread > close threshold - keeping");
            }
        }

        if (currentSpread > closeThreshold) {
            if (bestAlternativeSpread != null) {
                double improvement = bestAlternativeSpread - currentSpread;
                double required = churnCost * config.getChurnCostMultiplier();

                if (improvement >= required - THRESHOLD_EPSILON) {
                    return StickinessEvaluationResult.replace(symbol + " - new opportunity is " + pct(improvement)
                            + " better, reaching churn threshold " + pct(required) + " - replacing");
                }
            }

            return StickinessEvaluationResult.keep(
                    symbol + " spread (" + pct(currentSpread) + ") > close threshold - keeping");
        }

        return StickinessEvaluationResult.close(
                symbol + " spread (" + pct(currentSpread) + ") <= close threshold - closing");
    }

    /**
     * Splits close candidates into those to close and those stickiness keeps.
     * A symbol without both legs is always closed.
     */
    public PositionFilterResult filterPositionsToCloseWithStickiness(List<OpenPositionPair> candidates,
                                                                     Map<String, OpenPositionPair> pairsBySymbol,
                                                                     Double bestOpportunitySpread) {
        List<OpenPositionPair> toClose = new ArrayList<>();
        List<OpenPositionPair> toKeep = new ArrayList<>();
        Map<String, String> reasons = new LinkedHashMap<>();

        Set<String> symbols = new LinkedHashSet<>();
        for (OpenPositionPair candidate : candidates) {
            symbols.add(candidate.getSymbol());
        }

        for (String symbol : symbols) {
            List<OpenPositionPair> forSymbol = candidates.stream()
                    .filter(p -> p.getSymbol().equals(symbol))
                    .toList();

            OpenPositionPair pair = pairsBySymbol.get(symbol);
            if (pair == null || !pair.isPaired()) {
                toClose.addAll(forSymbol);
                reasons.put(symbol, "Single-leg position - handled separately");
                continue;
            }

            StickinessEvaluationResult result = shouldKeepPosition(symbol,
                    pair.getLongExchange(), pair.getShortExchange(), bestOpportunitySpread);
            reasons.put(symbol, result.getReason());

            if (result.shouldKeep()) {
                toKeep.addAll(forSymbol);
                log.info("[Stickiness] KEEPING {}: {}", symbol, result.getReason());
            } else {
                toClose.addAll(forSymbol);
                log.info("[Stickiness] {} {}: {}", result.getAction(), symbol, result.getReason());
            }
        }

        return PositionFilterResult.builder()
                .toClose(toClose)
                .toKeep(toKeep)
                .reasons(reasons)
                .build();
    }

    public static String positionKey(String symbol, ExchangeType longExchange, ExchangeType shortExchange) {
        return symbol + "-" + longExchange + "-" + shortExchange;
    }

    private static String pct(double value) {
        return String.format("%.4f%%", value * 100);
    }
}
