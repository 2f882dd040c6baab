package ru.fundingengine.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ru.fundingengine.config.FundingConfig;
import ru.fundingengine.dto.exchanges.BidAsk;
import ru.fundingengine.dto.exchanges.ExchangeType;
import ru.fundingengine.dto.exchanges.OrderType;
import ru.fundingengine.dto.funding.ArbitrageOpportunity;
import ru.fundingengine.dto.funding.EvaluatedOpportunity;
import ru.fundingengine.dto.funding.ExchangeFundingRate;
import ru.fundingengine.dto.funding.ExecutionPlan;
import ru.fundingengine.dto.funding.HistoricalEvaluation;
import ru.fundingengine.dto.funding.HistoricalMetrics;
import ru.fundingengine.dto.funding.MarketRegime;
import ru.fundingengine.dto.funding.OpenPositionPair;
import ru.fundingengine.dto.funding.OpportunityScore;
import ru.fundingengine.dto.funding.PredictedBreakEven;
import ru.fundingengine.dto.funding.PredictionEnhancedEvaluation;
import ru.fundingengine.dto.funding.RebalanceDecision;
import ru.fundingengine.dto.funding.Recommendation;
import ru.fundingengine.dto.funding.RemainingBreakEven;
import ru.fundingengine.dto.funding.SelectedOpportunity;
import ru.fundingengine.dto.funding.SpreadForecast;
import ru.fundingengine.dto.funding.TradeCosts;
import ru.fundingengine.service.prediction.RatePredictionAdapter;
import ru.fundingengine.service.tracking.PositionLossTracker;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Scores and ranks evaluated opportunities, picks the most robust one and decides whether an
 * open pair is worth abandoning for a new one.
 */
@Slf4j
@Service
public class OpportunityEvaluator {

    private static final double HOURS_PER_WEEK = 24 * 7;
    private static final int BISECTION_STEPS = 60;

    private final CostCalculator costCalculator;
    private final PredictedBreakEvenCalculator breakEvenCalculator;
    private final RatePredictionAdapter predictionAdapter;
    private final PositionLossTracker lossTracker;
    private final FundingRateAggregator aggregator;
    private final FundingConfig fundingConfig;

    public OpportunityEvaluator(CostCalculator costCalculator,
                                PredictedBreakEvenCalculator breakEvenCalculator,
                                RatePredictionAdapter predictionAdapter,
                                PositionLossTracker lossTracker,
                                FundingRateAggregator aggregator,
                                FundingConfig fundingConfig) {
        this.costCalculator = costCalculator;
        this.breakEvenCalculator = breakEvenCalculator;
        this.predictionAdapter = predictionAdapter;
        this.lossTracker = lossTracker;
        this.aggregator = aggregator;
        this.fundingConfig = fundingConfig;
    }

    /**
     * Empty when the trade is economically infeasible at this size: below the minimum position
     * size, or the spread returns nothing.
     */
    public Optional<ExecutionPlan> buildPlan(ArbitrageOpportunity opportunity, double positionSizeUsd,
                                             int leverage, BidAsk longBook, BidAsk shortBook) {
        if (positionSizeUsd < fundingConfig.getLadder().getMinPositionSizeUsd()) {
            log.debug("[Evaluator] {} rejected: size ${} below minimum", opportunity.getSymbol(),
                    String.format("%.2f", positionSizeUsd));
            return Optional.empty();
        }

        double hourlyReturn = opportunity.getExpectedReturn() / ArbitrageOpportunity.HOURS_PER_YEAR * positionSizeUsd;
        if (hourlyReturn <= 0) {
            log.debug("[Evaluator] {} rejected: no funding return", opportunity.getSymbol());
            return Optional.empty();
        }

        TradeCosts costs = roundTripCosts(opportunity, positionSizeUsd, longBook, shortBook);

        return Optional.of(ExecutionPlan.builder()
                .opportunity(opportunity)
                .positionSizeUsd(positionSizeUsd)
                .leverage(leverage)
                .costs(costs)
                .expectedNetReturn(hourlyReturn - costs.getTotal())
                .build());
    }

    /**
     * Attaches costs, break-even, prediction score, historical view and capacity to one opportunity.
     * Without a plan one is built at the configured plan size.
     */
    public EvaluatedOpportunity evaluate(ArbitrageOpportunity opportunity, ExecutionPlan plan) {
        Map<ExchangeType, BidAsk> books = aggregator.getOrderBooks(opportunity.getSymbol(),
                List.of(opportunity.getLongExchange(), opportunity.getShortExchange()));
        BidAsk longBook = books.get(opportunity.getLongExchange());
        BidAsk shortBook = books.get(opportunity.getShortExchange());

        ExecutionPlan effectivePlan = plan != null
                ? plan
                : buildPlan(opportunity, fundingConfig.getCycle().getPlanSizeUsd(),
                fundingConfig.getLadder().getLeverage(), longBook, shortBook).orElse(null);

        double sizeUsd = effectivePlan != null ? effectivePlan.getPositionSizeUsd() : fundingConfig.getCycle().getPlanSizeUsd();
        TradeCosts costs = effectivePlan != null
                ? effectivePlan.getCosts()
                : roundTripCosts(opportunity, sizeUsd, longBook, shortBook);

        double hourlyReturn = opportunity.getExpectedReturn() / ArbitrageOpportunity.HOURS_PER_YEAR * sizeUsd;
        OptionalDouble breakEven = costCalculator.breakEvenHours(costs.getTotal(), hourlyReturn);

        PredictedBreakEven predicted = breakEvenCalculator.calculatePredictedBreakEven(opportunity, sizeUsd, costs.getTotal());
        OpportunityScore score = breakEvenCalculator.scoreOpportunity(opportunity, predicted);
        OptionalDouble maxSize = estimateMaxPositionSizeUsd(opportunity, longBook, shortBook);

        return EvaluatedOpportunity.builder()
                .opportunity(opportunity)
                .plan(effectivePlan)
                .netReturn(effectivePlan != null ? effectivePlan.getExpectedNetReturn() : hourlyReturn - costs.getTotal())
                .positionValueUsd(sizeUsd)
                .breakEvenHours(breakEven.isPresent() ? breakEven.getAsDouble() : null)
                .maxPositionSizeUsd(maxSize.isPresent() ? maxSize.getAsDouble() : null)
                .predictedBreakEven(predicted)
                .score(score)
                .historical(evaluateOpportunityWithHistory(opportunity, effectivePlan))
                .build();
    }

    public HistoricalEvaluation evaluateOpportunityWithHistory(ArbitrageOpportunity opportunity, ExecutionPlan plan) {
        HistoricalMetrics longMetrics = predictionAdapter
                .getHistoricalMetrics(opportunity.getSymbol(), opportunity.getLongExchange(), opportunity.getLongRate())
                .orElse(null);
        HistoricalMetrics shortMetrics = predictionAdapter
                .getHistoricalMetrics(opportunity.getSymbol(), opportunity.getShortExchange(), opportunity.getShortRate())
                .orElse(null);

        double consistency;
        if (longMetrics != null && shortMetrics != null) {
            consistency = (longMetrics.getConsistencyScore() + shortMetrics.getConsistencyScore()) / 2;
        } else if (longMetrics != null) {
            consistency = longMetrics.getConsistencyScore();
        } else if (shortMetrics != null) {
            consistency = shortMetrics.getConsistencyScore();
        } else {
            consistency = 0.0;
        }

        //Historical minimums on both legs instead of current rates
        Double worstCaseHours = null;
        if (plan != null && longMetrics != null && shortMetrics != null) {
            double worstCaseSpread = Math.abs(shortMetrics.getMinRate() - longMetrics.getMinRate());
            double worstCaseHourlyReturn = worstCaseSpread * plan.getPositionSizeUsd();
            if (worstCaseHourlyReturn > 0) {
                worstCaseHours = plan.getCosts().getTotal() / worstCaseHourlyReturn;
            }
        }

        Double breakEvenHours = null;
        if (plan != null) {
            OptionalDouble be = costCalculator.breakEvenHours(plan.getCosts().getTotal(), plan.getHourlyReturnUsd());
            breakEvenHours = be.isPresent() ? be.getAsDouble() : null;
        }

        return HistoricalEvaluation.builder()
                .breakEvenHours(breakEvenHours)
                .longMetrics(longMetrics)
                .shortMetrics(shortMetrics)
                .worstCaseBreakEvenHours(worstCaseHours)
                .consistencyScore(consistency)
                .build();
    }

    /**
     * Highest {@code consistency x |avg historical rate| x liquidity / worst-case break-even};
     * empty when nothing has a plan or the pick needs more than the configured days to break even.
     */
    public Optional<SelectedOpportunity> selectWorstCaseOpportunity(List<EvaluatedOpportunity> candidates) {
        List<ScoredCandidate> scored = new ArrayList<>();

        for (EvaluatedOpportunity candidate : candidates) {
            if (!candidate.hasPlan()) {
                continue;
            }
            HistoricalEvaluation historical = candidate.getHistorical() != null
                    ? candidate.getHistorical()
                    : evaluateOpportunityWithHistory(candidate.getOpportunity(), candidate.getPlan());

            double worstCase = historical.getWorstCaseBreakEvenHours() != null
                    ? historical.getWorstCaseBreakEvenHours()
                    : Double.POSITIVE_INFINITY;

            double score = Double.isFinite(worstCase) && worstCase > 0
                    ? historical.getConsistencyScore()
                    * Math.abs(historical.getAverageHistoricalRate())
                    * selectionLiquidityScore(candidate.getOpportunity())
                    / worstCase
                    : 0.0;

            scored.add(new ScoredCandidate(candidate, historical, score));
        }

        if (scored.isEmpty()) {
            return Optional.empty();
        }

        scored.sort(Comparator.comparingDouble((ScoredCandidate c) -> c.score).reversed());
        ScoredCandidate best = scored.get(0);

        double worstCaseDays = best.historical.getWorstCaseBreakEvenHours() != null
                ? best.historical.getWorstCaseBreakEvenHours() / 24
                : Double.POSITIVE_INFINITY;
        double maxDays = fundingConfig.getPrediction().getMaxWorstCaseBreakEvenDays();

        if (worstCaseDays > maxDays) {
            log.warn("[Evaluator] Best candidate {} has worst-case break-even > {} days, skipping",
                    best.candidate.getOpportunity().getSymbol(), maxDays);
            return Optional.empty();
        }

        String reason = "Worst-case selection: consistency " + String.format("%.1f", best.historical.getConsistencyScore() * 100)
                + "%, worst-case break-even " + String.format("%.1f", worstCaseDays)
                + " days, score " + String.format("%.6f", best.score);

        log.info("[Evaluator] Selected {} {}/{} - {}",
                best.candidate.getOpportunity().getSymbol(),
                best.candidate.getOpportunity().getLongExchange(),
                best.candidate.getOpportunity().getShortExchange(),
                reason);

        return Optional.of(SelectedOpportunity.builder()
                .opportunity(best.candidate.getOpportunity())
                .plan(best.candidate.getPlan())
                .maxPositionSizeUsd(best.candidate.getMaxPositionSizeUsd())
                .existing(false)
                .reason(reason)
                .build());
    }

    /**
     * Compares the remaining time-to-break-even of the held pair with the time the new pair needs
     * to recover everything a switch would cost, including the held pair's unrecovered costs.
     */
    public RebalanceDecision shouldRebalance(OpenPositionPair currentPosition,
                                             ArbitrageOpportunity newOpportunity,
                                             ExecutionPlan newPlan,
                                             double cumulativeLoss) {
        double currentHourlyRate = currentHourlyRate(currentPosition);
        double positionValueUsd = currentPosition.getCurrentValue() > 0
                ? currentPosition.getCurrentValue()
                : currentPosition.getNotionalSize();

        RemainingBreakEven remaining = lossTracker.getRemainingBreakEvenHours(currentPosition, currentHourlyRate, positionValueUsd);

        //Untracked means already closed: nothing left to recover
        double p1Outstanding = (remaining.isUntracked() ? 0.0 : remaining.getRemainingCost()) + cumulativeLoss;
        double currentHours = remaining.getRemainingBreakEvenHours();

        double newHourlyReturn = newOpportunity.getExpectedReturn() / ArbitrageOpportunity.HOURS_PER_YEAR
                * newPlan.getPositionSizeUsd();
        double p2Costs = p1Outstanding + newPlan.getEntryFees() + newPlan.getExitFees() + newPlan.getCosts().getSlippage();
        double p2Hours = newHourlyReturn <= 0 ? Double.POSITIVE_INFINITY : p2Costs / newHourlyReturn;

        Double currentOrNull = Double.isInfinite(currentHours) ? null : currentHours;
        Double newOrNull = Double.isInfinite(p2Hours) ? null : p2Hours;

        if (newPlan.getExpectedNetReturn() > 0) {
            log.info("[Evaluator] Rebalance approved: {} is instantly profitable (net ${}/period)",
                    newOpportunity.getSymbol(), String.format("%.4f", newPlan.getExpectedNetReturn()));
            return decision(true, "New opportunity is instantly profitable", currentOrNull, null);
        }

        if (remaining.getRemainingCost() <= 0) {
            log.info("[Evaluator] Rebalance skipped: {} already profitable (earned ${})",
                    currentPosition.getKey(), String.format("%.4f", remaining.getFeesEarnedSoFar()));
            return decision(false, "Current position already profitable, new position not instantly profitable", 0.0, newOrNull);
        }

        if (Double.isInfinite(currentHours)) {
            if (Double.isFinite(p2Hours)) {
                log.info("[Evaluator] Rebalance approved: {} never breaks even, new TTBE {}h",
                        currentPosition.getKey(), String.format("%.2f", p2Hours));
                return decision(true, "Current position never breaks even, new position has finite break-even time", null, p2Hours);
            }
            log.info("[Evaluator] Rebalance skipped: neither position breaks even");
            return decision(false, "Both positions never break even", null, null);
        }

        if (Double.isInfinite(p2Hours)) {
            log.info("[Evaluator] Rebalance skipped: {} never breaks even", newOpportunity.getSymbol());
            return decision(false, "New position never breaks even", currentHours, null);
        }

        if (p2Hours < currentHours) {
            log.info("[Evaluator] Rebalance approved: P2 TTBE {}h < P1 remaining {}h",
                    String.format("%.2f", p2Hours), String.format("%.2f", currentHours));
            return decision(true, "P2 TTBE (" + String.format("%.2f", p2Hours) + "h) < P1 remaining TTBE ("
                    + String.format("%.2f", currentHours) + "h)", currentHours, p2Hours);
        }

        log.info("[Evaluator] Rebalance skipped: P1 remaining {}h <= P2 TTBE {}h",
                String.format("%.2f", currentHours), String.format("%.2f", p2Hours));
        return decision(false, "P1 remaining TTBE (" + String.format("%.2f", currentHours) + "h) <= P2 TTBE ("
                + String.format("%.2f", p2Hours) + "h)", currentHours, p2Hours);
    }

    /**
     * Largest notional whose net APY, after our own funding impact and amortised round-trip
     * costs, still reaches the target. Capped at a share of the smaller open interest; empty
     * when open interest is unknown.
     */
    public OptionalDouble estimateMaxPositionSizeUsd(ArbitrageOpportunity opportunity, BidAsk longBook, BidAsk shortBook) {
        double minOi = opportunity.getMinOpenInterest();
        if (minOi <= 0) {
            return OptionalDouble.empty();
        }

        double target = fundingConfig.getLadder().getTargetNetApy();
        double cap = minOi * fundingConfig.getLadder().getMaxOiShare();
        double minSize = fundingConfig.getLadder().getMinPositionSizeUsd();

        if (cap < minSize || netApy(opportunity, minSize, longBook, shortBook) < target) {
            return OptionalDouble.of(0.0);
        }
        if (netApy(opportunity, cap, longBook, shortBook) >= target) {
            return OptionalDouble.of(cap);
        }

        double lo = minSize;
        double hi = cap;
        for (int i = 0; i < BISECTION_STEPS && hi - lo > 1.0; i++) {
            double mid = (lo + hi) / 2;
            if (netApy(opportunity, mid, longBook, shortBook) >= target) {
                lo = mid;
            } else {
                hi = mid;
            }
        }
        return OptionalDouble.of(lo);
    }

    /**
     * Drops candidates whose predictor output is too uncertain, too slow or says skip.
     * Candidates scored without a predictor only face the skip check.
     */
    public List<EvaluatedOpportunity> filterByPredictionQuality(List<EvaluatedOpportunity> evaluated,
                                                                double minConfidence,
                                                                double maxBreakEvenHours) {
        List<EvaluatedOpportunity> result = new ArrayList<>();

        for (EvaluatedOpportunity item : evaluated) {
            String symbol = item.getOpportunity().getSymbol();

            if (item.getRecommendation() == Recommendation.SKIP) {
                log.debug("[Evaluator] Filtering {}: recommendation is SKIP", symbol);
                continue;
            }

            PredictedBreakEven predicted = item.getPredictedBreakEven();
            if (predicted == null || !isFromPredictor(predicted)) {
                result.add(item);
                continue;
            }

            if (predicted.getConfidence() < minConfidence) {
                log.debug("[Evaluator] Filtering {}: confidence {}% < {}%", symbol,
                        String.format("%.0f", predicted.getConfidence() * 100), String.format("%.0f", minConfidence * 100));
                continue;
            }

            if (predicted.getConfidenceAdjustedBreakEvenHours() > maxBreakEvenHours) {
                log.debug("[Evaluator] Filtering {}: break-even {}h > {}h", symbol,
                        String.format("%.1f", predicted.getConfidenceAdjustedBreakEvenHours()), maxBreakEvenHours);
                continue;
            }

            result.add(item);
        }

        return result;
    }

    /**
     * Scored candidates first by descending score, then the rest by descending spread.
     */
    public List<EvaluatedOpportunity> rankByPredictionScore(List<EvaluatedOpportunity> evaluated) {
        List<EvaluatedOpportunity> ranked = new ArrayList<>(evaluated);
        ranked.sort((a, b) -> {
            if (a.getScore() != null && b.getScore() != null) {
                return Double.compare(b.getScore().getScore(), a.getScore().getScore());
            }
            if (a.getScore() != null) {
                return -1;
            }
            if (b.getScore() != null) {
                return 1;
            }
            return Double.compare(b.getOpportunity().getSpread(), a.getOpportunity().getSpread());
        });
        return ranked;
    }

    public PredictionEnhancedEvaluation evaluateWithPredictions(ArbitrageOpportunity opportunity, ExecutionPlan plan) {
        HistoricalEvaluation historical = evaluateOpportunityWithHistory(opportunity, plan);

        PredictionEnhancedEvaluation.PredictionEvaluation prediction = null;
        if (predictionAdapter.hasPredictor()) {
            SpreadForecast forecast = predictionAdapter.forecast(opportunity);
            if (forecast.isFromPredictor()) {
                double predictedSpread = forecast.getLongPrediction().getRate() - forecast.getShortPrediction().getRate();

                Double predictedHours = null;
                if (plan != null && predictedSpread != 0) {
                    double hourly = Math.abs(predictedSpread) * plan.getPositionSizeUsd();
                    if (hourly > 0) {
                        predictedHours = plan.getCosts().getTotal() / hourly;
                    }
                }

                prediction = PredictionEnhancedEvaluation.PredictionEvaluation.builder()
                        .predictedSpread(predictedSpread)
                        .predictionConfidence(forecast.getConfidence())
                        .predictedBreakEvenHours(predictedHours)
                        .regime(forecast.getLongPrediction().getRegime())
                        .regimeConfidence(forecast.getLongPrediction().getRegimeConfidence())
                        .build();
            }
        }

        return PredictionEnhancedEvaluation.builder()
                .historicalEvaluation(historical)
                .predictionEvaluation(prediction)
                .combinedScore(combinedScore(historical, prediction))
                .build();
    }

    /**
     * Selection entry point: drops SKIP and plan-less candidates, filters and ranks by prediction
     * quality, then applies the worst-case selection.
     */
    public Optional<SelectedOpportunity> rankAndSelect(List<EvaluatedOpportunity> evaluated) {
        List<EvaluatedOpportunity> deployable = new ArrayList<>();
        for (EvaluatedOpportunity item : evaluated) {
            if (item.hasPlan() && item.getRecommendation() != Recommendation.SKIP) {
                deployable.add(item);
            }
        }

        List<EvaluatedOpportunity> filtered = filterByPredictionQuality(deployable,
                fundingConfig.getPrediction().getMinConfidenceThreshold(),
                fundingConfig.getPrediction().getMaxWorstCaseBreakEvenDays() * 24);

        log.info("[Evaluator] {} evaluated, {} deployable, {} after prediction filter",
                evaluated.size(), deployable.size(), filtered.size());

        return selectWorstCaseOpportunity(rankByPredictionScore(filtered));
    }

    double combinedScore(HistoricalEvaluation historical, PredictionEnhancedEvaluation.PredictionEvaluation prediction) {
        double score = historical.getConsistencyScore();

        Double worstCase = historical.getWorstCaseBreakEvenHours();
        if (worstCase != null && Double.isFinite(worstCase) && worstCase > 0) {
            score *= 0.7 + 0.3 * Math.max(0, 1 - worstCase / HOURS_PER_WEEK);
        }

        if (prediction != null && prediction.getPredictionConfidence() > 0.5) {
            double predictionWeight = prediction.getPredictionConfidence() * 0.4;
            double historicalWeight = 1 - predictionWeight;

            double predictionScore = Math.min(1, Math.abs(prediction.getPredictedSpread()) * 10_000);
            Double predictedHours = prediction.getPredictedBreakEvenHours();
            if (predictedHours != null && Double.isFinite(predictedHours) && predictedHours > 0) {
                predictionScore *= 0.7 + 0.3 * Math.max(0, 1 - predictedHours / HOURS_PER_WEEK);
            }

            if (prediction.getRegime() == MarketRegime.MEAN_REVERTING) {
                predictionScore *= 1.1;
            } else if (prediction.getRegime() == MarketRegime.EXTREME_DISLOCATION) {
                predictionScore *= 0.8;
            }

            score = historicalWeight * score + predictionWeight * predictionScore;
        }

        return Math.max(0, Math.min(1, score));
    }

    private double netApy(ArbitrageOpportunity opportunity, double sizeUsd, BidAsk longBook, BidAsk shortBook) {
        double longOi = opportunity.getLongOpenInterest() != null ? opportunity.getLongOpenInterest() : 0.0;
        double shortOi = opportunity.getShortOpenInterest() != null ? opportunity.getShortOpenInterest() : 0.0;

        double effectiveSpread = opportunity.getSpread()
                - costCalculator.fundingImpact(sizeUsd, longOi, opportunity.getLongRate())
                - costCalculator.fundingImpact(sizeUsd, shortOi, opportunity.getShortRate());

        double amortisationHours = fundingConfig.getLadder().getCostAmortizationHours();
        double costFraction = roundTripCosts(opportunity, sizeUsd, longBook, shortBook).getTotal() / sizeUsd;

        return (effectiveSpread - costFraction / amortisationHours) * ArbitrageOpportunity.HOURS_PER_YEAR;
    }

    private TradeCosts roundTripCosts(ArbitrageOpportunity opportunity, double sizeUsd, BidAsk longBook, BidAsk shortBook) {
        double longOi = opportunity.getLongOpenInterest() != null ? opportunity.getLongOpenInterest() : 0.0;
        double shortOi = opportunity.getShortOpenInterest() != null ? opportunity.getShortOpenInterest() : 0.0;
        double basis = basisDivergence(opportunity);

        return costCalculator.tradeCosts(sizeUsd,
                opportunity.getLongExchange(), opportunity.getShortExchange(),
                longBook, shortBook, longOi, shortOi, basis, OrderType.MARKET, true);
    }

    //Relative mark price gap between the legs, 0 when either is missing
    private static double basisDivergence(ArbitrageOpportunity opportunity) {
        Double longMark = opportunity.getLongMarkPrice();
        Double shortMark = opportunity.getShortMarkPrice();
        if (longMark == null || shortMark == null || longMark <= 0 || shortMark <= 0) {
            return 0.0;
        }
        return (longMark - shortMark) / ((longMark + shortMark) / 2);
    }

    private double currentHourlyRate(OpenPositionPair position) {
        try {
            List<ExchangeFundingRate> rates = aggregator.getFundingRates(position.getSymbol());
            Optional<ExchangeFundingRate> longRate = rates.stream()
                    .filter(r -> r.getExchange() == position.getLongExchange()).findFirst();
            Optional<ExchangeFundingRate> shortRate = rates.stream()
                    .filter(r -> r.getExchange() == position.getShortExchange()).findFirst();
            if (longRate.isPresent() && shortRate.isPresent()) {
                return shortRate.get().getCurrentRate() - longRate.get().getCurrentRate();
            }
        } catch (RuntimeException e) {
            log.debug("[Evaluator] Failed to get funding rate for {}: {}", position.getKey(), e.getMessage());
        }
        return 0.0;
    }

    private static double selectionLiquidityScore(ArbitrageOpportunity opportunity) {
        double minOi = opportunity.getMinOpenInterest();
        if (minOi <= 0) {
            return 0.1;
        }
        return Math.min(1, Math.max(0, Math.log10(Math.max(minOi / 1000, 1)) / 10));
    }

    private static boolean isFromPredictor(PredictedBreakEven predicted) {
        return predicted.getLongPrediction() != null || predicted.getShortPrediction() != null;
    }

    private static RebalanceDecision decision(boolean rebalance, String reason, Double currentHours, Double newHours) {
        return RebalanceDecision.builder()
                .shouldRebalance(rebalance)
                .reason(reason)
                .currentBreakEvenHours(currentHours)
                .newBreakEvenHours(newHours)
                .build();
    }

    private static class ScoredCandidate {
        private final EvaluatedOpportunity candidate;
        private final HistoricalEvaluation historical;
        private final double score;

        ScoredCandidate(EvaluatedOpportunity candidate, HistoricalEvaluation historical, double score) {
            this.candidate = candidate;
            this.historical = historical;
            this.score = score;
        }
    }
}
