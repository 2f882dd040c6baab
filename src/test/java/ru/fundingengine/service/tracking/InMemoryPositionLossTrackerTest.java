package ru.fundingengine.service.tracking;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import ru.fundingengine.MutableClock;
import ru.fundingengine.dto.exchanges.ExchangeType;
import ru.fundingengine.dto.funding.OpenPositionPair;
import ru.fundingengine.dto.funding.RemainingBreakEven;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class InMemoryPositionLossTrackerTest {

    private final OpenPositionPair position = OpenPositionPair.builder()
            .symbol("ETH")
            .longExchange(ExchangeType.ASTER)
            .shortExchange(ExchangeType.HYPERLIQUID)
            .build();

    private MutableClock clock;
    private InMemoryPositionLossTracker tracker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        tracker = new InMemoryPositionLossTracker(clock);
    }

    @Test
    @DisplayName("Untracked position reports infinite remaining break-even")
    void untracked() {
        assertThat(tracker.getRemainingBreakEvenHours(position, 0.0004, 10_000).isUntracked()).isTrue();
    }

    @Test
    @DisplayName("Remaining cost shrinks with funding earned")
    void remainingCost() {
        tracker.recordEntryCosts(position.getKey(), 12, 8);
        clock.advance(Duration.ofHours(3));
        tracker.recordFunding(position.getKey(), 4);

        // (20 - 4) / (0.0004 * 10,000) = 4h
        RemainingBreakEven remaining = tracker.getRemainingBreakEvenHours(position, 0.0004, 10_000);

        assertThat(remaining.getRemainingCost()).isCloseTo(16.0, within(1e-9));
        assertThat(remaining.getRemainingBreakEvenHours()).isCloseTo(4.0, within(1e-9));
        assertThat(remaining.getFeesEarnedSoFar()).isEqualTo(4.0);
        assertThat(remaining.getHoursHeld()).isEqualTo(3.0);
    }

    @Test
    @DisplayName("Paid-off position needs zero hours; a losing rate never recovers")
    void edgeCases() {
        tracker.recordEntryCosts(position.getKey(), 5, 5);
        assertThat(tracker.getRemainingBreakEvenHours(position, -0.0001, 10_000).getRemainingBreakEvenHours())
                .isInfinite();

        tracker.recordFunding(position.getKey(), 11);
        assertThat(tracker.getRemainingBreakEvenHours(position, -0.0001, 10_000).getRemainingBreakEvenHours())
                .isZero();
    }

    @Test
    @DisplayName("Removed position is untracked again")
    void remove() {
        tracker.recordEntryCosts(position.getKey(), 5, 5);

        tracker.remove(position.getKey());

        assertThat(tracker.getRemainingBreakEvenHours(position, 0.0004, 10_000).isUntracked()).isTrue();
    }

    @Test
    @DisplayName("Accrual credits the hourly amount for the time since the previous accrual")
    void accrual() {
        tracker.recordEntryCosts(position.getKey(), 10, 10, clock.instant().minus(Duration.ofHours(5)));
        assertThat(tracker.isTracked(position.getKey())).isTrue();

        clock.advance(Duration.ofHours(2));
        tracker.accrueFunding(position.getKey(), 3);
        clock.advance(Duration.ofMinutes(30));
        tracker.accrueFunding(position.getKey(), 2);

        RemainingBreakEven remaining = tracker.getRemainingBreakEvenHours(position, 0.0004, 10_000);
        assertThat(remaining.getFeesEarnedSoFar()).isCloseTo(7.0, within(1e-9));
        assertThat(remaining.getRemainingCost()).isCloseTo(13.0, within(1e-9));
        assertThat(remaining.getHoursHeld()).isCloseTo(7.5, within(1e-9));
    }

    @Test
    @DisplayName("Accrual for an untracked position is ignored")
    void accrualUntracked() {
        tracker.accrueFunding(position.getKey(), 3);

        assertThat(tracker.isTracked(position.getKey())).isFalse();
    }
}
