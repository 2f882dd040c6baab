package ru.fundingengine.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import ru.fundingengine.MutableClock;
import ru.fundingengine.config.FundingConfig;
import ru.fundingengine.dto.exchanges.ExchangeType;
import ru.fundingengine.dto.funding.ExchangeFundingRate;
import ru.fundingengine.dto.funding.OpenPositionPair;
import ru.fundingengine.service.tracking.InMemoryPositionLossTracker;
import ru.fundingengine.service.tracking.InMemoryPositionTimeTracker;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PositionTrackingServiceTest {

    private static final ExchangeType LONG = ExchangeType.ASTER;
    private static final ExchangeType SHORT = ExchangeType.HYPERLIQUID;

    @Mock
    private FundingRateAggregator aggregator;

    private MutableClock clock;
    private InMemoryPositionTimeTracker timeTracker;
    private InMemoryPositionLossTracker lossTracker;
    private PositionTrackingService trackingService;

    @BeforeEach
    void setUp() {
        FundingConfig fundingConfig = new FundingConfig();
        clock = new MutableClock(Instant.parse("2025-01-01T12:00:00Z"));
        timeTracker = new InMemoryPositionTimeTracker(clock);
        lossTracker = new InMemoryPositionLossTracker(clock);
        PositionStickinessManager stickiness = new PositionStickinessManager(aggregator, timeTracker, fundingConfig);
        trackingService = new PositionTrackingService(timeTracker, lossTracker, stickiness,
                new CostCalculator(fundingConfig), clock);
    }

    private OpenPositionPair eth(Instant openedAt) {
        return OpenPositionPair.builder()
                .symbol("ETH")
                .longExchange(LONG)
                .shortExchange(SHORT)
                .notionalSize(1_000)
                .leverage(2)
                .entryTimestamp(openedAt)
                .currentValue(1_000)
                .currentCollateral(500)
                .build();
    }

    private static ExchangeFundingRate rate(ExchangeType exchange, double currentRate) {
        return ExchangeFundingRate.builder()
                .exchange(exchange)
                .symbol("ETH")
                .currentRate(currentRate)
                .predictedRate(currentRate)
                .build();
    }

    @Test
    @DisplayName("A pair seen for the first time ages from its entry time and carries its costs")
    void firstSight() {
        OpenPositionPair pair = eth(clock.instant().minus(Duration.ofHours(2)));

        trackingService.syncOpenPositions(List.of(pair));

        assertThat(timeTracker.ageHours(pair.getKey())).hasValue(2.0);
        assertThat(lossTracker.isTracked(pair.getKey())).isTrue();
        assertThat(lossTracker.getRemainingBreakEvenHours(pair, 0.0004, 1_000).getRemainingCost()).isPositive();
    }

    @Test
    @DisplayName("Without a reported entry time the pair ages from now")
    void noEntryTime() {
        OpenPositionPair pair = eth(null);

        trackingService.syncOpenPositions(List.of(pair));

        assertThat(timeTracker.ageHours(pair.getKey())).hasValue(0.0);
    }

    @Test
    @DisplayName("A held pair accrues funding at its current spread")
    void accruesFunding() {
        OpenPositionPair pair = eth(clock.instant());
        trackingService.syncOpenPositions(List.of(pair));

        when(aggregator.getFundingRates("ETH")).thenReturn(List.of(rate(LONG, 0.0001), rate(SHORT, 0.0005)));
        clock.advance(Duration.ofHours(1));
        trackingService.syncOpenPositions(List.of(pair));

        // 0.0004 * $1,000 for one hour
        assertThat(lossTracker.getRemainingBreakEvenHours(pair, 0.0004, 1_000).getFeesEarnedSoFar())
                .isCloseTo(0.4, within(1e-9));
    }

    @Test
    @DisplayName("Pairs no longer held are dropped from both trackers")
    void dropsVanished() {
        OpenPositionPair pair = eth(clock.instant());
        trackingService.syncOpenPositions(List.of(pair));

        trackingService.syncOpenPositions(List.of());

        assertThat(timeTracker.getTrackedKeys()).isEmpty();
        assertThat(lossTracker.isTracked(pair.getKey())).isFalse();
    }

    @Test
    @DisplayName("Single-leg pairs are not tracked")
    void singleLegIgnored() {
        OpenPositionPair single = OpenPositionPair.builder().symbol("BTC").longExchange(LONG).build();

        trackingService.syncOpenPositions(List.of(single));

        assertThat(timeTracker.getTrackedKeys()).isEmpty();
    }

    @Test
    @DisplayName("Closing a pair forgets it")
    void recordClosed() {
        OpenPositionPair pair = eth(clock.instant());
        trackingService.syncOpenPositions(List.of(pair));

        trackingService.recordClosed(pair);

        assertThat(timeTracker.ageHours(pair.getKey())).isEmpty();
        assertThat(lossTracker.isTracked(pair.getKey())).isFalse();
    }
}
