package ru.fundingengine.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ru.fundingengine.config.FundingConfig;
import ru.fundingengine.dto.funding.ArbitrageOpportunity;
import ru.fundingengine.dto.funding.OpportunityScore;
import ru.fundingengine.dto.funding.PredictedBreakEven;
import ru.fundingengine.dto.funding.RatePrediction;
import ru.fundingengine.dto.funding.Recommendation;
import ru.fundingengine.dto.funding.SpreadForecast;
import ru.fundingengine.service.prediction.RatePredictionAdapter;

/**
 * Break-even estimates driven by predicted rather than current funding rates.
 *
 * <p>The recommendation does not skip just because a reversal is predicted: it skips only
 * when the costs cannot be recovered before the reversal.</p>
 */
@Slf4j
@Service
public class PredictedBreakEvenCalculator {

    private static final double WORST_CASE_HAIRCUT = 0.7;
    private static final double BEST_CASE_BONUS = 1.3;
    private static final double MIN_CONFIDENCE_FACTOR = 0.5;
    //Current spread that is worth trading without a usable forecast
    private static final double MEANINGFUL_SPREAD = 0.0001;
    private static final double SPREAD_SCORE_SATURATION = 0.0005;
    private static final double BREAK_EVEN_SCORE_HORIZON_HOURS = 24 * 7;
    private static final double FAST_BREAK_EVEN_HOURS = 12;

    private final RatePredictionAdapter predictionAdapter;
    private final FundingConfig fundingConfig;

    public PredictedBreakEvenCalculator(RatePredictionAdapter predictionAdapter, FundingConfig fundingConfig) {
        this.predictionAdapter = predictionAdapter;
        this.fundingConfig = fundingConfig;
    }

    public PredictedBreakEven calculatePredictedBreakEven(ArbitrageOpportunity opportunity,
                                                          double positionSizeUsd,
                                                          double totalCosts) {
        SpreadForecast forecast = predictionAdapter.forecast(opportunity);
        RatePrediction longPrediction = forecast.getLongPrediction();
        RatePrediction shortPrediction = forecast.getShortPrediction();
        double confidence = forecast.getConfidence();

        double currentSpread = opportunity.getSignedSpread();
        double predictedSpread = longPrediction.hasFiniteRate() && shortPrediction.hasFiniteRate()
                ? longPrediction.getRate() - shortPrediction.getRate()
                : currentSpread;

        double worstCaseSpread = Double.isFinite(longPrediction.getLowerBound()) && Double.isFinite(shortPrediction.getUpperBound())
                ? longPrediction.getLowerBound() - shortPrediction.getUpperBound()
                : currentSpread * WORST_CASE_HAIRCUT;

        double bestCaseSpread = Double.isFinite(longPrediction.getUpperBound()) && Double.isFinite(shortPrediction.getLowerBound())
                ? longPrediction.getUpperBound() - shortPrediction.getLowerBound()
                : currentSpread * BEST_CASE_BONUS;

        double confidenceFactor = Math.max(MIN_CONFIDENCE_FACTOR, confidence);
        double reliableHorizon = Math.round(fundingConfig.getPrediction().getDefaultReliableHorizonHours() * confidenceFactor);

        double predictedHours = breakEvenHours(totalCosts, hourlyReturn(predictedSpread, positionSizeUsd));
        double worstCaseHours = breakEvenHours(totalCosts, hourlyReturn(worstCaseSpread, positionSizeUsd));
        double bestCaseHours = breakEvenHours(totalCosts, hourlyReturn(bestCaseSpread, positionSizeUsd));

        double adjustedHours = Double.isInfinite(predictedHours)
                ? Double.POSITIVE_INFINITY
                : predictedHours / confidenceFactor;

        return PredictedBreakEven.builder()
                .predictedBreakEvenHours(predictedHours)
                .confidence(confidence)
                .predictedSpread(predictedSpread)
                .worstCaseBreakEvenHours(worstCaseHours)
                .bestCaseBreakEvenHours(bestCaseHours)
                .reliableHorizonHours(reliableHorizon)
                .confidenceAdjustedBreakEvenHours(adjustedHours)
                .predictionReliable(confidence >= fundingConfig.getPrediction().getMinConfidenceThreshold())
                .longPrediction(forecast.isFromPredictor() ? longPrediction : null)
                .shortPrediction(forecast.isFromPredictor() ? shortPrediction : null)
                .build();
    }

    public OpportunityScore scoreOpportunity(ArbitrageOpportunity opportunity,
                                             double positionSizeUsd,
                                             double totalCosts) {
        PredictedBreakEven breakEven = calculatePredictedBreakEven(opportunity, positionSizeUsd, totalCosts);
        return scoreOpportunity(opportunity, breakEven);
    }

    public OpportunityScore scoreOpportunity(ArbitrageOpportunity opportunity, PredictedBreakEven breakEven) {
        double spreadScore = Math.min(1, Math.abs(breakEven.getPredictedSpread()) / SPREAD_SCORE_SATURATION);
        double confidenceScore = breakEven.getConfidence();
        double breakEvenScore = breakEvenScore(breakEven.getConfidenceAdjustedBreakEvenHours());
        double liquidityScore = liquidityScore(opportunity);

        double score = spreadScore * 0.3
                + confidenceScore * 0.25
                + breakEvenScore * 0.3
                + liquidityScore * 0.15;

        Decision decision = recommend(score, breakEven, opportunity);

        log.debug("[PredictedBE] {} {}/{}: score={} -> {} ({})",
                opportunity.getSymbol(), opportunity.getLongExchange(), opportunity.getShortExchange(),
                String.format("%.3f", score), decision.recommendation, decision.reason);

        return OpportunityScore.builder()
                .score(score)
                .spreadScore(spreadScore)
                .confidenceScore(confidenceScore)
                .breakEvenScore(breakEvenScore)
                .liquidityScore(liquidityScore)
                .recommendation(decision.recommendation)
                .reason(decision.reason)
                .build();
    }

    public boolean isPredictionServiceAvailable() {
        return predictionAdapter.hasPredictor();
    }

    private Decision recommend(double score, PredictedBreakEven breakEven, ArbitrageOpportunity opportunity) {
        double hours = breakEven.getConfidenceAdjustedBreakEvenHours();
        double horizon = breakEven.getReliableHorizonHours();
        double currentSpread = opportunity.getSignedSpread();
        double maxDays = fundingConfig.getPrediction().getMaxWorstCaseBreakEvenDays();
        double maxHours = maxDays * 24;

        if (!Double.isFinite(hours)) {
            if (Math.abs(currentSpread) > MEANINGFUL_SPREAD) {
                return new Decision(Recommendation.BUY,
                        "Prediction unavailable but current spread " + pct(currentSpread) + " is favorable");
            }
            return new Decision(Recommendation.HOLD, "Cannot calculate break-even and current spread is minimal");
        }

        double currentSign = Math.signum(currentSpread);
        double predictedSign = Math.signum(breakEven.getPredictedSpread());
        if (currentSign != 0 && predictedSign != 0 && currentSign != predictedSign) {
            if (hours > horizon) {
                return new Decision(Recommendation.SKIP,
                        "Spread will reverse: BE " + h(hours) + " > reversal " + h(horizon) + " - wait for flip");
            }
            return new Decision(Recommendation.BUY,
                    "Break-even " + h(hours) + " before reversal " + h(horizon) + " - deploy now");
        }

        if (!breakEven.isPredictionReliable()) {
            if (Math.abs(currentSpread) > MEANINGFUL_SPREAD) {
                if (hours < maxHours) {
                    return new Decision(Recommendation.BUY,
                            "Low prediction confidence but current spread " + pct(currentSpread) + " with BE " + h(hours));
                }
                return new Decision(Recommendation.HOLD, "Current spread favorable but BE " + h(hours) + " is long");
            }
            return new Decision(Recommendation.HOLD, "Prediction unreliable ("
                    + String.format("%.0f", breakEven.getConfidence() * 100) + "%) and current spread minimal");
        }

        if (breakEven.getWorstCaseBreakEvenHours() / 24 > maxDays * 2) {
            return new Decision(Recommendation.HOLD, "Worst-case BE "
                    + String.format("%.1f", breakEven.getWorstCaseBreakEvenHours() / 24) + " days is too long");
        }

        if (hours < FAST_BREAK_EVEN_HOURS) {
            return new Decision(Recommendation.STRONG_BUY, "Fast break-even " + h(hours));
        }

        if (score >= 0.7 && hours < 48 && breakEven.getConfidence() >= 0.7) {
            return new Decision(Recommendation.STRONG_BUY, "High score " + String.format("%.2f", score)
                    + ", BE " + h(hours) + ", " + String.format("%.0f", breakEven.getConfidence() * 100) + "% confidence");
        }

        if (hours < horizon) {
            return new Decision(Recommendation.BUY, "Break-even " + h(hours) + " within horizon " + h(horizon));
        }

        if (hours < maxHours) {
            return new Decision(Recommendation.BUY, "Break-even " + h(hours) + ", no reversal predicted");
        }

        return new Decision(Recommendation.HOLD, "Long BE " + h(hours));
    }

    private double hourlyReturn(double spread, double positionSizeUsd) {
        return Math.abs(spread) * positionSizeUsd;
    }

    //Returns below the configured minimum are treated as no return at all
    private double breakEvenHours(double totalCosts, double hourlyReturn) {
        if (hourlyReturn <= fundingConfig.getPrediction().getMinHourlyReturnUsd()) {
            return Double.POSITIVE_INFINITY;
        }
        if (totalCosts <= 0) {
            return 0.0;
        }
        return totalCosts / hourlyReturn;
    }

    private static double breakEvenScore(double hours) {
        if (Double.isInfinite(hours) || Double.isNaN(hours)) {
            return 0.0;
        }
        if (hours <= 0) {
            return 1.0;
        }
        return Math.max(0, 1 - hours / BREAK_EVEN_SCORE_HORIZON_HOURS);
    }

    private static double liquidityScore(ArbitrageOpportunity opportunity) {
        double minOi = opportunity.getMinOpenInterest();
        if (minOi <= 0) {
            return 0.1;
        }
        return Math.min(1, Math.log10(Math.max(minOi / 100_000, 1)) / 3);
    }

    private static String h(double hours) {
        return String.format("%.1fh", hours);
    }

    private static String pct(double spread) {
        return String.format("%.4f%%", spread * 100);
    }

    private static class Decision {
        private final Recommendation recommendation;
        private final String reason;

        Decision(Recommendation recommendation, String reason) {
            this.recommendation = recommendation;
            this.reason = reason;
        }
    }
}
