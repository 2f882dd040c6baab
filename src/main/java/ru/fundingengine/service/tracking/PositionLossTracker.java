package ru.fundingengine.service.tracking;

import ru.fundingengine.dto.funding.OpenPositionPair;
import ru.fundingengine.dto.funding.RemainingBreakEven;

import java.time.Instant;

/**
 * Sunk costs of open pairs: what was paid to get in, minus funding collected since.
 */
public interface PositionLossTracker {

    void recordEntryCosts(String positionKey, double entryCostsUsd, double exitCostsUsd);

    /**
     * {@code openedAt} drives hours held; funding accrues only from the moment of recording
     */
    void recordEntryCosts(String positionKey, double entryCostsUsd, double exitCostsUsd, Instant openedAt);

    boolean isTracked(String positionKey);

    void recordFunding(String positionKey, double amountUsd);

    /**
     * Credits {@code hourlyFundingUsd} for the time since the previous accrual
     * (or since the costs were recorded).
     */
    void accrueFunding(String positionKey, double hourlyFundingUsd);

    /**
     * @param currentHourlyRate net hourly funding the pair earns now (short rate minus long rate)
     * @return {@link RemainingBreakEven#untracked()} when nothing was recorded for the pair
     */
    RemainingBreakEven getRemainingBreakEvenHours(OpenPositionPair position,
                                                  double currentHourlyRate,
                                                  double positionValueUsd);

    void remove(String positionKey);
}
