package ru.fundingengine.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import ru.fundingengine.dto.exchanges.OrderType;
import ru.fundingengine.dto.funding.OpenPositionPair;
import ru.fundingengine.dto.funding.TradeCosts;
import ru.fundingengine.service.tracking.PositionLossTracker;
import ru.fundingengine.service.tracking.PositionTimeTracker;

import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Keeps the position trackers in line with the pairs actually held. Pairs seen for the first time
 * are recorded from their reported entry time with estimated costs; pairs already known accrue
 * funding at the current spread; pairs no longer held are forgotten.
 */
@Slf4j
@Service
public class PositionTrackingService {

    private final PositionTimeTracker timeTracker;
    private final PositionLossTracker lossTracker;
    private final PositionStickinessManager stickinessManager;
    private final CostCalculator costCalculator;
    private final Clock clock;

    @Autowired
    public PositionTrackingService(PositionTimeTracker timeTracker,
                                   PositionLossTracker lossTracker,
                                   PositionStickinessManager stickinessManager,
                                   CostCalculator costCalculator) {
        this(timeTracker, lossTracker, stickinessManager, costCalculator, Clock.systemUTC());
    }

    PositionTrackingService(PositionTimeTracker timeTracker,
                            PositionLossTracker lossTracker,
                            PositionStickinessManager stickinessManager,
                            CostCalculator costCalculator,
                            Clock clock) {
        this.timeTracker = timeTracker;
        this.lossTracker = lossTracker;
        this.stickinessManager = stickinessManager;
        this.costCalculator = costCalculator;
        this.clock = clock;
    }

    public void syncOpenPositions(List<OpenPositionPair> positions) {
        Set<String> liveKeys = new HashSet<>();

        for (OpenPositionPair position : positions) {
            if (!position.isPaired()) {
                continue;
            }
            String key = position.getKey();
            liveKeys.add(key);

            Instant openedAt = position.getEntryTimestamp() != null ? position.getEntryTimestamp() : clock.instant();
            if (timeTracker.ageHours(key).isEmpty()) {
                timeTracker.recordOpen(key, openedAt);
                log.info("[Tracking] {} tracked from {}", key, openedAt);
            }

            double notional = notional(position);
            if (!lossTracker.isTracked(key)) {
                //Entry fills are unknown here; the fee schedule stands in for both legs, both ways
                TradeCosts oneWay = costCalculator.tradeCosts(notional,
                        position.getLongExchange(), position.getShortExchange(),
                        null, null, 0, 0, 0, OrderType.MARKET, false);
                lossTracker.recordEntryCosts(key, oneWay.getTotal(), oneWay.getTotal(), openedAt);
                continue;
            }

            OptionalDouble spread = stickinessManager.getCurrentSpreadForPosition(position.getSymbol(),
                    position.getLongExchange(), position.getShortExchange());
            if (spread.isPresent()) {
                lossTracker.accrueFunding(key, spread.getAsDouble() * notional);
            }
        }

        for (String key : timeTracker.getTrackedKeys()) {
            if (!liveKeys.contains(key)) {
                log.info("[Tracking] {} is no longer held, dropping", key);
                timeTracker.removeOpen(key);
                lossTracker.remove(key);
            }
        }
    }

    public void recordClosed(OpenPositionPair position) {
        if (!position.isPaired()) {
            return;
        }
        timeTracker.removeOpen(position.getKey());
        lossTracker.remove(position.getKey());
        log.debug("[Tracking] {} closed", position.getKey());
    }

    private static double notional(OpenPositionPair position) {
        return position.getNotionalSize() > 0 ? position.getNotionalSize() : position.getCurrentValue();
    }
}
