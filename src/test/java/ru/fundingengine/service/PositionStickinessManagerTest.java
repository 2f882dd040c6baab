package ru.fundingengine.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import ru.fundingengine.MutableClock;
import ru.fundingengine.config.FundingConfig;
import ru.fundingengine.dto.exchanges.ExchangeType;
import ru.fundingengine.dto.funding.ExchangeFundingRate;
import ru.fundingengine.dto.funding.OpenPositionPair;
import ru.fundingengine.dto.funding.PositionFilterResult;
import ru.fundingengine.dto.funding.StickinessAction;
import ru.fundingengine.dto.funding.StickinessEvaluationResult;
import ru.fundingengine.exceptions.FundingDataException;
import ru.fundingengine.service.tracking.InMemoryPositionTimeTracker;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

/**
 * Unit tests for the keep / close / replace hysteresis.
 */
@ExtendWith(MockitoExtension.class)
class PositionStickinessManagerTest {

    private static final ExchangeType LONG = ExchangeType.ASTER;
    private static final ExchangeType SHORT = ExchangeType.HYPERLIQUID;

    @Mock
    private FundingRateAggregator aggregator;

    private MutableClock clock;
    private PositionStickinessManager stickinessManager;

    @BeforeEach
    void setUp() {
        FundingConfig fundingConfig = new FundingConfig();
        fundingConfig.getCosts().getMakerFees().put(LONG, 0.0002);
        fundingConfig.getCosts().getMakerFees().put(SHORT, 0.0002);

        clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        stickinessManager = new PositionStickinessManager(aggregator, new InMemoryPositionTimeTracker(clock), fundingConfig);
    }

    private void givenSpread(String symbol, double longRate, double shortRate) {
        when(aggregator.getFundingRates(symbol)).thenReturn(List.of(
                rate(symbol, LONG, longRate),
                rate(symbol, SHORT, shortRate)));
    }

    private static ExchangeFundingRate rate(String symbol, ExchangeType exchange, double currentRate) {
        return ExchangeFundingRate.builder()
                .exchange(exchange)
                .symbol(symbol)
                .currentRate(currentRate)
                .predictedRate(currentRate)
                .markPrice(2000)
                .openInterest(1_000_000)
                .timestamp(Instant.parse("2025-01-01T00:00:00Z"))
                .build();
    }

    // ==============================
    // CHURN THRESHOLD
    // ==============================

    @Nested
    @DisplayName("Churn threshold")
    class ChurnThresholdTests {

        @Test
        @DisplayName("Improvement of exactly twice the churn cost replaces the position")
        void replacesAtBoundary() {
            // churn cost (0.0002 + 0.0002) * 2 = 0.0008, required 0.0016
            givenSpread("ETH", 0.0, 0.00005);

            StickinessEvaluationResult result = stickinessManager.shouldKeepPosition("ETH", LONG, SHORT, 0.00165);

            assertThat(result.getAction()).isEqualTo(StickinessAction.REPLACE);
            assertThat(result.shouldKeep()).isFalse();
        }

        @Test
        @DisplayName("Improvement just below the threshold keeps the position")
        void keepsBelowBoundary() {
            givenSpread("ETH", 0.0, 0.00005);

            StickinessEvaluationResult result = stickinessManager.shouldKeepPosition("ETH", LONG, SHORT, 0.00160);

            assertThat(result.getAction()).isEqualTo(StickinessAction.KEEP);
            assertThat(result.shouldKeep()).isTrue();
        }

        @Test
        @DisplayName("Without an alternative the position is kept")
        void noAlternative() {
            givenSpread("ETH", 0.0, 0.00005);

            assertThat(stickinessManager.shouldKeepPosition("ETH", LONG, SHORT, null).shouldKeep()).isTrue();
        }
    }

    // ==============================
    // HYSTERESIS
    // ==============================

    @Nested
    @DisplayName("Hysteresis")
    class HysteresisTests {

        @Test
        @DisplayName("Young profitable position is kept whatever the alternatives do")
        void noFlappingWithinMinHold() {
            givenSpread("ETH", 0.0, 0.00005);
            stickinessManager.recordPositionOpen("ETH", LONG, SHORT);

            for (int i = 0; i < 6; i++) {
                clock.advance(Duration.ofMinutes(30));
                double alternative = i % 2 == 0 ? 0.01 : 0.0;

                StickinessEvaluationResult result = stickinessManager.shouldKeepPosition("ETH", LONG, SHORT, alternative);

                assertThat(result.getAction()).isEqualTo(StickinessAction.KEEP);
            }
        }

        @Test
        @DisplayName("Once past min hold a much better alternative replaces it")
        void replacedAfterMinHold() {
            givenSpread("ETH", 0.0, 0.00005);
            stickinessManager.recordPositionOpen("ETH", LONG, SHORT);

            clock.advance(Duration.ofHours(5));

            assertThat(stickinessManager.shouldKeepPosition("ETH", LONG, SHORT, 0.01).getAction())
                    .isEqualTo(StickinessAction.REPLACE);
        }

        @Test
        @DisplayName("Young position with slightly negative spread above the threshold is kept")
        void youngSlightlyNegative() {
            givenSpread("ETH", 0.0003, 0.0);
            stickinessManager.recordPositionOpen("ETH", LONG, SHORT);
            clock.advance(Duration.ofHours(1));

            assertThat(stickinessManager.shouldKeepPosition("ETH", LONG, SHORT, 0.01).shouldKeep()).isTrue();
        }

        @Test
        @DisplayName("Severely negative spread closes even a young position")
        void severelyNegative() {
            givenSpread("ETH", 0.0011, 0.0);
            stickinessManager.recordPositionOpen("ETH", LONG, SHORT);

            assertThat(stickinessManager.shouldKeepPosition("ETH", LONG, SHORT, null).getAction())
                    .isEqualTo(StickinessAction.CLOSE);
        }

        @Test
        @DisplayName("Old position at or below the close threshold is closed")
        void oldBelowThreshold() {
            givenSpread("ETH", 0.0006, 0.0);
            stickinessManager.recordPositionOpen("ETH", LONG, SHORT);
            clock.advance(Duration.ofHours(5));

            assertThat(stickinessManager.shouldKeepPosition("ETH", LONG, SHORT, null).getAction())
                    .isEqualTo(StickinessAction.CLOSE);
        }
    }

    // ==============================
    // DATA FAILURES & AGE TRACKING
    // ==============================

    @Nested
    @DisplayName("Data failures and age tracking")
    class FailureTests {

        @Test
        @DisplayName("Missing leg keeps the position")
        void missingLegKeeps() {
            when(aggregator.getFundingRates("ETH")).thenReturn(List.of(rate("ETH", LONG, 0.0)));

            assertThat(stickinessManager.shouldKeepPosition("ETH", LONG, SHORT, 0.01).shouldKeep()).isTrue();
        }

        @Test
        @DisplayName("Aggregator failure keeps the position")
        void failureKeeps() {
            when(aggregator.getFundingRates("ETH")).thenThrow(new FundingDataException(LONG, "down"));

            assertThat(stickinessManager.shouldKeepPosition("ETH", LONG, SHORT, 0.01).shouldKeep()).isTrue();
        }

        @Test
        @DisplayName("Closing a position evicts its age")
        void closeEvictsAge() {
            stickinessManager.recordPositionOpen("ETH", LONG, SHORT);
            clock.advance(Duration.ofHours(2));
            assertThat(stickinessManager.getPositionAgeHours("ETH", LONG, SHORT)).hasValue(2.0);

            stickinessManager.recordPositionClose("ETH", LONG, SHORT);

            assertThat(stickinessManager.getPositionAgeHours("ETH", LONG, SHORT)).isEmpty();
        }
    }

    @Test
    @DisplayName("Filter closes single-leg positions and keeps healthy pairs")
    void filterPositionsToClose() {
        givenSpread("ETH", 0.0, 0.0002);

        OpenPositionPair eth = OpenPositionPair.builder()
                .symbol("ETH").longExchange(LONG).shortExchange(SHORT).currentCollateral(100).build();
        OpenPositionPair btc = OpenPositionPair.builder()
                .symbol("BTC").longExchange(LONG).currentCollateral(100).build();

        PositionFilterResult result = stickinessManager.filterPositionsToCloseWithStickiness(
                List.of(eth, btc), Map.of("ETH", eth, "BTC", btc), 0.0003);

        assertThat(result.getToKeep()).containsExactly(eth);
        assertThat(result.getToClose()).containsExactly(btc);
        assertThat(result.getReasons()).containsKeys("ETH", "BTC");
    }
}
