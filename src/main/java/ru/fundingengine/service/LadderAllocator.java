package ru.fundingengine.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ru.fundingengine.config.FundingConfig;
import ru.fundingengine.dto.exchanges.ExchangeType;
import ru.fundingengine.dto.funding.ArbitrageOpportunity;
import ru.fundingengine.dto.funding.EvaluatedOpportunity;
import ru.fundingengine.dto.funding.LadderAllocationResult;
import ru.fundingengine.dto.funding.OpenPositionPair;
import ru.fundingengine.dto.funding.SelectedOpportunity;
import ru.fundingengine.exceptions.ArbitrageInvariantException;
import ru.fundingengine.service.tracking.OpportunityCooldownTracker;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Waterfall allocation of collateral over ranked opportunities: matching open pairs are topped up,
 * then new pairs are filled one at a time, each to its maximum before the next.
 * The output depends only on the inputs and their order.
 */
@Slf4j
@Service
public class LadderAllocator {

    private static final double DUST = 0.01;
    private static final double RETURN_TIE_TOLERANCE = 0.001;

    private final OpportunityCooldownTracker cooldownTracker;
    private final FundingConfig fundingConfig;

    public LadderAllocator(OpportunityCooldownTracker cooldownTracker, FundingConfig fundingConfig) {
        this.cooldownTracker = cooldownTracker;
        this.fundingConfig = fundingConfig;
    }

    public List<EvaluatedOpportunity> filterOpportunitiesForLadder(List<EvaluatedOpportunity> evaluated,
                                                                   Map<ExchangeType, Double> exchangeBalances,
                                                                   int leverage) {
        double maxBreakEvenHours = fundingConfig.getPrediction().getMaxWorstCaseBreakEvenDays() * 24;
        double minPositionSize = fundingConfig.getLadder().getMinPositionSizeUsd();
        double minCollateral = minPositionSize / leverage;

        List<EvaluatedOpportunity> result = new ArrayList<>();
        for (EvaluatedOpportunity item : evaluated) {
            ArbitrageOpportunity opportunity = item.getOpportunity();

            if (cooldownTracker.isCoolingDown(opportunity.getSymbol(), opportunity.getLongExchange(), opportunity.getShortExchange())) {
                log.debug("[Ladder] Skipping filtered opportunity {} {}/{}", opportunity.getSymbol(),
                        opportunity.getLongExchange(), opportunity.getShortExchange());
                continue;
            }

            boolean acceptableBreakEven = item.getBreakEvenHours() != null
                    && Double.isFinite(item.getBreakEvenHours())
                    && item.getBreakEvenHours() <= maxBreakEvenHours;
            if (!item.hasPlan() && !acceptableBreakEven) {
                continue;
            }

            if (item.getMaxPositionSizeUsd() != null && item.getMaxPositionSizeUsd() < minPositionSize) {
                log.debug("[Ladder] Skipping {}: capacity ${} below minimum position", opportunity.getSymbol(),
                        String.format("%.2f", item.getMaxPositionSizeUsd()));
                continue;
            }

            double longBalance = exchangeBalances.getOrDefault(opportunity.getLongExchange(), 0.0);
            double shortBalance = exchangeBalances.getOrDefault(opportunity.getShortExchange(), 0.0);
            if (longBalance < minCollateral || shortBalance < minCollateral) {
                log.debug("[Ladder] Skipping {}: insufficient collateral (long ${}, short ${})", opportunity.getSymbol(),
                        String.format("%.2f", longBalance), String.format("%.2f", shortBalance));
                continue;
            }

            result.add(item);
        }

        result.sort((a, b) -> {
            double returnDiff = b.getOpportunity().getExpectedReturn() - a.getOpportunity().getExpectedReturn();
            if (Math.abs(returnDiff) > RETURN_TIE_TOLERANCE) {
                return returnDiff > 0 ? 1 : -1;
            }
            double aMax = a.getMaxPositionSizeUsd() != null ? a.getMaxPositionSizeUsd() : Double.POSITIVE_INFINITY;
            double bMax = b.getMaxPositionSizeUsd() != null ? b.getMaxPositionSizeUsd() : Double.POSITIVE_INFINITY;
            return Double.compare(bMax, aMax);
        });

        return result;
    }

    public LadderAllocationResult allocate(List<EvaluatedOpportunity> ranked,
                                           List<OpenPositionPair> existingPositions,
                                           double totalCapital) {
        return allocate(ranked, existingPositions, totalCapital, fundingConfig.getLadder().getLeverage());
    }

    /**
     * @throws ArbitrageInvariantException when {@code existingPositions} holds more than one pair for a symbol
     */
    public LadderAllocationResult allocate(List<EvaluatedOpportunity> ranked,
                                           List<OpenPositionPair> existingPositions,
                                           double totalCapital,
                                           int leverage) {
        Map<String, OpenPositionPair> existingBySymbol = indexBySymbol(existingPositions);

        List<SelectedOpportunity> selected = new ArrayList<>();
        Set<String> allocatedSymbols = new HashSet<>();
        double remaining = totalCapital;
        double cumulativeUsed = 0;

        log.info("[Ladder] Allocating ${} across {} opportunities, {} existing position(s)",
                String.format("%.2f", totalCapital), ranked.size(), existingBySymbol.size());

        for (EvaluatedOpportunity item : ranked) {
            ArbitrageOpportunity opportunity = item.getOpportunity();
            String symbol = opportunity.getSymbol();

            if (allocatedSymbols.contains(symbol)) {
                log.debug("[Ladder] Skipping {} {}/{}: symbol already allocated in this run", symbol,
                        opportunity.getLongExchange(), opportunity.getShortExchange());
                continue;
            }

            double maxPortfolio = item.getMaxPositionSizeUsd() != null
                    ? item.getMaxPositionSizeUsd()
                    : remaining * leverage;
            double maxCollateral = maxPortfolio / leverage;

            //Collateral may be unreported (0.0); the pair still occupies the symbol
            OpenPositionPair existing = existingBySymbol.get(symbol);
            boolean hasExisting = existing != null;

            if (hasExisting && existing.matches(opportunity)) {
                double current = Math.max(0.0, existing.getCurrentCollateral());
                double additional = maxCollateral - current;

                if (additional <= DUST) {
                    log.debug("[Ladder] {} already at max (${} collateral)", symbol, String.format("%.2f", current));
                    cumulativeUsed += maxCollateral;
                    allocatedSymbols.add(symbol);
                    continue;
                }

                double topUp = Math.min(additional, remaining);
                if (topUp < DUST) {
                    break;
                }

                boolean full = topUp >= additional - DUST;

                log.info("[Ladder] {}: adding ${} ({}) | remaining ${}", symbol,
                        String.format("%.2f", topUp), full ? "FULL" : "PARTIAL",
                        String.format("%.2f", remaining - topUp));

                selected.add(SelectedOpportunity.builder()
                        .opportunity(opportunity)
                        .plan(item.getPlan())
                        .maxPositionSizeUsd((current + topUp) * leverage)
                        .existing(true)
                        .currentValue(existing.getCurrentValue())
                        .currentCollateral(current)
                        .additionalCollateral(topUp)
                        .fullyFilled(full)
                        .reason("Top-up of existing " + existing.getKey())
                        .build());
                allocatedSymbols.add(symbol);

                remaining -= topUp;
                cumulativeUsed += full ? maxCollateral : topUp;
                if (!full) {
                    break;
                }
            } else if (hasExisting) {
                log.warn("[Ladder] Skipping {}: existing pair {} does not match {}/{}", symbol, existing.getKey(),
                        opportunity.getLongExchange(), opportunity.getShortExchange());
                cumulativeUsed += maxCollateral;
                allocatedSymbols.add(symbol);
            } else {
                if (remaining <= DUST) {
                    break;
                }

                double collateral = Math.min(remaining, maxCollateral);
                boolean full = collateral >= maxCollateral - DUST;

                log.info("[Ladder] {}: NEW ${} (${}/${} collateral, {}) | remaining ${}", symbol,
                        String.format("%.2f", collateral * leverage),
                        String.format("%.2f", collateral), String.format("%.2f", maxCollateral),
                        full ? "FULL" : "PARTIAL",
                        String.format("%.2f", remaining - collateral));

                selected.add(SelectedOpportunity.builder()
                        .opportunity(opportunity)
                        .plan(item.getPlan())
                        .maxPositionSizeUsd(collateral * leverage)
                        .existing(false)
                        .additionalCollateral(collateral)
                        .fullyFilled(full)
                        .reason(full ? "New position, fully filled" : "New position, partially filled")
                        .build());
                allocatedSymbols.add(symbol);

                remaining -= collateral;
                cumulativeUsed += collateral;
                if (!full) {
                    break;
                }
            }
        }

        log.info("[Ladder] Selected {} position(s), ${} used, ${} remaining", selected.size(),
                String.format("%.2f", cumulativeUsed), String.format("%.2f", remaining));

        return LadderAllocationResult.builder()
                .selectedOpportunities(selected)
                .remainingCapital(remaining)
                .cumulativeCapitalUsed(cumulativeUsed)
                .build();
    }

    static Map<String, OpenPositionPair> indexBySymbol(List<OpenPositionPair> positions) {
        Map<String, OpenPositionPair> bySymbol = new HashMap<>();
        for (OpenPositionPair position : positions) {
            OpenPositionPair previous = bySymbol.put(position.getSymbol(), position);
            if (previous != null) {
                log.error("[Ladder] {} held as both {} and {}", position.getSymbol(), previous.getKey(), position.getKey());
                throw new ArbitrageInvariantException(
                        "Symbol " + position.getSymbol() + " has more than one open pair: "
                                + previous.getKey() + ", " + position.getKey());
            }
        }
        return bySymbol;
    }
}
