package ru.fundingengine.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import ru.fundingengine.config.FundingConfig;
import ru.fundingengine.dto.exchanges.BidAsk;
import ru.fundingengine.dto.exchanges.ExchangeType;
import ru.fundingengine.dto.funding.ArbitrageOpportunity;
import ru.fundingengine.dto.funding.ExchangeFundingRate;
import ru.fundingengine.dto.funding.FundingRateComparison;
import ru.fundingengine.exchanges.FundingDataProvider;
import ru.fundingengine.exchanges.StubFundingDataProvider;
import ru.fundingengine.exchanges.factory.FundingProviderFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Discovery and opportunity construction over in-memory exchanges.
 */
class FundingRateAggregatorTest {

    private FundingConfig fundingConfig;

    @BeforeEach
    void setUp() {
        fundingConfig = new FundingConfig();
        fundingConfig.getDiscovery().setBatchDelayMs(0);
        fundingConfig.getDiscovery().setBatchSize(2);
    }

    private FundingRateAggregator aggregator(FundingDataProvider... providers) {
        FundingProviderFactory factory = new FundingProviderFactory(List.of(providers), List.of());
        return new FundingRateAggregator(factory, fundingConfig, Runnable::run);
    }

    // ==============================
    // OPPORTUNITIES
    // ==============================

    @Nested
    @DisplayName("findArbitrageOpportunities")
    class OpportunityTests {

        @Test
        @DisplayName("ETH at -0.03% and +0.01% gives one pair with 0.04% spread")
        void ethScenario() {
            FundingRateAggregator aggregator = aggregator(
                    new StubFundingDataProvider(ExchangeType.ASTER).withRate("ETHUSDT", -0.0003),
                    new StubFundingDataProvider(ExchangeType.HYPERLIQUID).withRate("ETH", 0.0001));
            aggregator.discoverCommonAssets();

            List<ArbitrageOpportunity> opportunities = aggregator.findArbitrageOpportunities(List.of("ETH"), 0.0001);

            assertThat(opportunities).hasSize(1);
            ArbitrageOpportunity eth = opportunities.get(0);
            assertThat(eth.getLongExchange()).isEqualTo(ExchangeType.ASTER);
            assertThat(eth.getShortExchange()).isEqualTo(ExchangeType.HYPERLIQUID);
            assertThat(eth.getSpread()).isCloseTo(0.0004, within(1e-12));
            assertThat(eth.getExpectedReturn()).isCloseTo(0.0004 * 8760, within(1e-9));
            assertThat(eth.getLongMarkPrice()).isEqualTo(2000.0);
        }

        @Test
        @DisplayName("Long and short exchange always differ")
        void distinctLegs() {
            FundingRateAggregator aggregator = aggregator(
                    new StubFundingDataProvider(ExchangeType.ASTER)
                            .withRate("ETHUSDT", -0.0003).withRate("BTCUSDT", 0.0002).withRate("SOLUSDT", 0.0001),
                    new StubFundingDataProvider(ExchangeType.HYPERLIQUID)
                            .withRate("ETH", 0.0001).withRate("BTC", 0.0005).withRate("SOL", -0.0002),
                    new StubFundingDataProvider(ExchangeType.LIGHTER)
                            .withRate("ETH", 0.0004).withRate("BTC", -0.0001).withRate("SOL", 0.0003));
            List<String> symbols = aggregator.discoverCommonAssets();

            List<ArbitrageOpportunity> opportunities = aggregator.findArbitrageOpportunities(symbols, 0.0);

            assertThat(opportunities).isNotEmpty();
            assertThat(opportunities).allMatch(o -> o.getLongExchange() != o.getShortExchange());
            assertThat(opportunities).extracting(ArbitrageOpportunity::getPairKey).doesNotHaveDuplicates();
        }

        @Test
        @DisplayName("Sorted by expected return, best first")
        void sortedByExpectedReturn() {
            FundingRateAggregator aggregator = aggregator(
                    new StubFundingDataProvider(ExchangeType.ASTER)
                            .withRate("ETHUSDT", -0.0001).withRate("BTCUSDT", -0.0004).withRate("SOLUSDT", -0.0002),
                    new StubFundingDataProvider(ExchangeType.HYPERLIQUID)
                            .withRate("ETH", 0.0001).withRate("BTC", 0.0001).withRate("SOL", 0.0001));
            List<String> symbols = aggregator.discoverCommonAssets();

            List<ArbitrageOpportunity> opportunities = aggregator.findArbitrageOpportunities(symbols, 0.0);

            assertThat(opportunities).extracting(ArbitrageOpportunity::getSymbol).containsExactly("BTC", "SOL", "ETH");
        }

        @Test
        @DisplayName("Spreads below the minimum are dropped")
        void minSpread() {
            FundingRateAggregator aggregator = aggregator(
                    new StubFundingDataProvider(ExchangeType.ASTER).withRate("ETHUSDT", 0.00001),
                    new StubFundingDataProvider(ExchangeType.HYPERLIQUID).withRate("ETH", 0.00005));
            aggregator.discoverCommonAssets();

            assertThat(aggregator.findArbitrageOpportunities(List.of("ETH"), 0.0001)).isEmpty();
        }

        @Test
        @DisplayName("A failing exchange is omitted, the rest still pair up")
        void partialFailure() {
            FundingRateAggregator aggregator = aggregator(
                    new StubFundingDataProvider(ExchangeType.ASTER).withRate("ETHUSDT", -0.0003),
                    new StubFundingDataProvider(ExchangeType.HYPERLIQUID).withRate("ETH", 0.0001),
                    new StubFundingDataProvider(ExchangeType.LIGHTER).failingRateFor("ETH"));
            aggregator.discoverCommonAssets();

            List<ExchangeFundingRate> rates = aggregator.getFundingRates("ETH");
            List<ArbitrageOpportunity> opportunities = aggregator.findArbitrageOpportunities(List.of("ETH"), 0.0001);

            assertThat(rates).extracting(ExchangeFundingRate::getExchange)
                    .containsExactlyInAnyOrder(ExchangeType.ASTER, ExchangeType.HYPERLIQUID);
            assertThat(opportunities).hasSize(1);
        }
    }

    // ==============================
    // DISCOVERY
    // ==============================

    @Nested
    @DisplayName("discoverCommonAssets")
    class DiscoveryTests {

        @Test
        @DisplayName("Keeps allowed assets listed on at least two exchanges")
        void commonAssetsOnly() {
            FundingRateAggregator aggregator = aggregator(
                    new StubFundingDataProvider(ExchangeType.ASTER)
                            .withRate("ETHUSDT", 0.0001).withRate("DOGEUSDT", 0.0001).withListedSymbol("NOTALLOWEDUSDT"),
                    new StubFundingDataProvider(ExchangeType.HYPERLIQUID)
                            .withRate("ETH", 0.0001).withRate("BTC", 0.0001).withListedSymbol("NOTALLOWED"));

            List<String> common = aggregator.discoverCommonAssets();

            assertThat(common).containsExactly("ETH");
            assertThat(aggregator.getExchangeSymbol("ETH", ExchangeType.ASTER)).contains("ETHUSDT");
            assertThat(aggregator.getExchangeSymbol("ETH", ExchangeType.HYPERLIQUID)).contains("ETH");
            assertThat(aggregator.getListedExchangeCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("Falls back to configured assets when every listing fails")
        void fallbackAssets() {
            FundingRateAggregator aggregator = aggregator(
                    new StubFundingDataProvider(ExchangeType.ASTER).failingListing(),
                    new StubFundingDataProvider(ExchangeType.HYPERLIQUID).failingListing());

            assertThat(aggregator.discoverCommonAssets()).containsExactly("ETH", "BTC");
            assertThat(aggregator.getListedExchangeCount()).isZero();
        }

        @Test
        @DisplayName("Exchange without a mapping is left out of rate queries")
        void unmappedExchangeOmitted() {
            FundingRateAggregator aggregator = aggregator(
                    new StubFundingDataProvider(ExchangeType.ASTER).withRate("ETHUSDT", -0.0003),
                    new StubFundingDataProvider(ExchangeType.HYPERLIQUID).withRate("ETH", 0.0001));

            assertThat(aggregator.getFundingRates("ETH")).isEmpty();
            assertThat(aggregator.compareFundingRates("ETH")).isEmpty();
        }

        @Test
        @DisplayName("Comparison reports highest and lowest rate")
        void comparison() {
            FundingRateAggregator aggregator = aggregator(
                    new StubFundingDataProvider(ExchangeType.ASTER).withRate("ETHUSDT", -0.0003),
                    new StubFundingDataProvider(ExchangeType.HYPERLIQUID).withRate("ETH", 0.0001));
            aggregator.discoverCommonAssets();

            Optional<FundingRateComparison> comparison = aggregator.compareFundingRates("ETH");

            assertThat(comparison).isPresent();
            assertThat(comparison.get().getHighestRate().getExchange()).isEqualTo(ExchangeType.HYPERLIQUID);
            assertThat(comparison.get().getLowestRate().getExchange()).isEqualTo(ExchangeType.ASTER);
            assertThat(comparison.get().getSpread()).isCloseTo(0.0004, within(1e-12));
        }
    }

    // ==============================
    // ORDER BOOKS
    // ==============================

    @Nested
    @DisplayName("getOrderBooks")
    class OrderBookTests {

        @Test
        @DisplayName("Books are fetched per leg; missing and crossed books are left out")
        void booksPerLeg() {
            FundingRateAggregator aggregator = aggregator(
                    new StubFundingDataProvider(ExchangeType.ASTER)
                            .withRate("ETHUSDT", -0.0003).withBook("ETHUSDT", 1999.5, 2000.5),
                    new StubFundingDataProvider(ExchangeType.HYPERLIQUID)
                            .withRate("ETH", 0.0001),
                    new StubFundingDataProvider(ExchangeType.LIGHTER)
                            .withRate("ETH", 0.0002).withBook("ETH", 2001, 1999));
            aggregator.discoverCommonAssets();

            Map<ExchangeType, BidAsk> books = aggregator.getOrderBooks("ETH",
                    List.of(ExchangeType.ASTER, ExchangeType.HYPERLIQUID, ExchangeType.LIGHTER));

            assertThat(books).containsOnlyKeys(ExchangeType.ASTER);
            assertThat(books.get(ExchangeType.ASTER).getBid()).isEqualTo(1999.5);
        }

        @Test
        @DisplayName("Unknown symbol yields no books")
        void unknownSymbol() {
            FundingRateAggregator aggregator = aggregator(
                    new StubFundingDataProvider(ExchangeType.ASTER).withRate("ETHUSDT", -0.0003),
                    new StubFundingDataProvider(ExchangeType.HYPERLIQUID).withRate("ETH", 0.0001));
            aggregator.discoverCommonAssets();

            assertThat(aggregator.getOrderBooks("DOGE", List.of(ExchangeType.ASTER, ExchangeType.HYPERLIQUID)))
                    .isEmpty();
        }
    }
}
