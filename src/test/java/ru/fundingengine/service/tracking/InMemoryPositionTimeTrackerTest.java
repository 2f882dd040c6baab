package ru.fundingengine.service.tracking;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import ru.fundingengine.MutableClock;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryPositionTimeTrackerTest {

    @Test
    @DisplayName("Age grows with the clock and disappears on removal")
    void ageLifecycle() {
        MutableClock clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        InMemoryPositionTimeTracker tracker = new InMemoryPositionTimeTracker(clock);

        assertThat(tracker.ageHours("ETH-ASTER-HYPERLIQUID")).isEmpty();

        tracker.recordOpen("ETH-ASTER-HYPERLIQUID");
        clock.advance(Duration.ofMinutes(90));
        assertThat(tracker.ageHours("ETH-ASTER-HYPERLIQUID")).hasValue(1.5);

        tracker.removeOpen("ETH-ASTER-HYPERLIQUID");
        assertThat(tracker.ageHours("ETH-ASTER-HYPERLIQUID")).isEmpty();
    }

    @Test
    @DisplayName("A pair found already open ages from its reported open time")
    void recordedWithOpenTime() {
        MutableClock clock = new MutableClock(Instant.parse("2025-01-01T06:00:00Z"));
        InMemoryPositionTimeTracker tracker = new InMemoryPositionTimeTracker(clock);

        tracker.recordOpen("BTC-HYPERLIQUID-ASTER", Instant.parse("2025-01-01T04:30:00Z"));

        assertThat(tracker.ageHours("BTC-HYPERLIQUID-ASTER")).hasValue(1.5);
        assertThat(tracker.getTrackedKeys()).containsExactly("BTC-HYPERLIQUID-ASTER");
    }
}
