package ru.fundingengine.exchanges;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import ru.fundingengine.client.hyperliquid.HyperliquidClient;
import ru.fundingengine.dto.exchanges.BidAsk;
import ru.fundingengine.dto.exchanges.hyperliquid.HyperliquidAssetContext;
import ru.fundingengine.exceptions.FundingDataException;

import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class HyperliquidFundingDataProviderTest {

    private static final String META_AND_CTXS = "["
            + "{\"universe\":[{\"name\":\"ETH\",\"szDecimals\":4},{\"name\":\"BTC\",\"szDecimals\":5}]},"
            + "[{\"funding\":\"0.0000125\",\"markPx\":\"2000.0\",\"midPx\":\"2000.05\",\"openInterest\":\"1000.0\","
            + "\"impactPxs\":[\"1999.8\",\"2000.2\"]},"
            + "{\"funding\":\"-0.00002\",\"markPx\":\"60000.0\",\"midPx\":\"60001.0\",\"openInterest\":\"10.0\","
            + "\"impactPxs\":null}]]";

    private ScriptedHyperliquidClient client;
    private HyperliquidFundingDataProvider provider;

    @BeforeEach
    void setUp() {
        client = new ScriptedHyperliquidClient(new ObjectMapper());
        provider = new HyperliquidFundingDataProvider(client);
    }

    @Test
    @DisplayName("Rates, mark prices and USD open interest come from one cached call")
    void readsAssetContexts() {
        client.body = META_AND_CTXS;

        assertThat(provider.getAvailableSymbols()).containsExactlyInAnyOrder("ETH", "BTC");
        assertThat(provider.getCurrentFundingRate("ETH").getAsDouble()).isEqualTo(0.0000125);
        assertThat(provider.getCurrentFundingRate("BTC").getAsDouble()).isEqualTo(-0.00002);
        assertThat(provider.getMarkPrice("BTC").getAsDouble()).isEqualTo(60000.0);
        assertThat(provider.getOpenInterest("ETH").getAsDouble()).isCloseTo(2_000_000.0, within(1e-6));
        assertThat(client.calls).isEqualTo(1);
    }

    @Test
    @DisplayName("Unknown coins have no data")
    void unknownCoin() {
        client.body = META_AND_CTXS;

        assertThat(provider.getCurrentFundingRate("DOGE")).isEmpty();
        assertThat(provider.getOpenInterest("DOGE")).isEmpty();
    }

    @Test
    @DisplayName("Impact prices stand in for the book; coins without them have none")
    void bidAskFromImpactPrices() {
        client.body = META_AND_CTXS;

        Optional<BidAsk> eth = provider.getBidAsk("ETH");

        assertThat(eth).isPresent();
        assertThat(eth.get().getBid()).isEqualTo(1999.8);
        assertThat(eth.get().getAsk()).isEqualTo(2000.2);
        assertThat(provider.getBidAsk("BTC")).isEmpty();
    }

    @Test
    @DisplayName("A context built without impact prices has no book")
    void contextWithoutImpactPrices() {
        HyperliquidClient bare = new HyperliquidClient(null, new ObjectMapper()) {
            @Override
            public Map<String, HyperliquidAssetContext> getAssetContexts() {
                return Map.of("ETH", HyperliquidAssetContext.builder()
                        .coin("ETH")
                        .funding(0.00001)
                        .markPrice(2000.0)
                        .build());
            }
        };

        HyperliquidFundingDataProvider bareProvider = new HyperliquidFundingDataProvider(bare);

        assertThat(bareProvider.getBidAsk("ETH")).isEmpty();
        assertThat(bareProvider.getCurrentFundingRate("ETH").getAsDouble()).isEqualTo(0.00001);
    }

    @Test
    @DisplayName("A failed info request surfaces as a funding data error")
    void requestFailure() {
        assertThatThrownBy(() -> provider.getAvailableSymbols())
                .isInstanceOf(FundingDataException.class);
    }

    private static class ScriptedHyperliquidClient extends HyperliquidClient {

        private String body;
        private int calls;

        ScriptedHyperliquidClient(ObjectMapper objectMapper) {
            super(null, objectMapper);
        }

        @Override
        protected Optional<String> executeInfoPost(String payload) {
            calls++;
            return Optional.ofNullable(body);
        }
    }
}
