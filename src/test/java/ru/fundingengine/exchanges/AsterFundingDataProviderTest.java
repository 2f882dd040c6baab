package ru.fundingengine.exchanges;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import ru.fundingengine.client.aster.AsterClient;
import ru.fundingengine.dto.exchanges.BidAsk;
import ru.fundingengine.exceptions.FundingDataException;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class AsterFundingDataProviderTest {

    private static final String EXCHANGE_INFO = "{\"symbols\":["
            + "{\"symbol\":\"ETHUSDT\",\"contractType\":\"PERPETUAL\",\"status\":\"TRADING\"},"
            + "{\"symbol\":\"BTCUSDT\",\"contractType\":\"PERPETUAL\",\"status\":\"TRADING\"},"
            + "{\"symbol\":\"ETHUSDT_250328\",\"contractType\":\"CURRENT_QUARTER\",\"status\":\"TRADING\"},"
            + "{\"symbol\":\"OLDUSDT\",\"contractType\":\"PERPETUAL\",\"status\":\"SETTLING\"}]}";

    private static final String PREMIUM_INDEX = "{\"symbol\":\"ETHUSDT\",\"markPrice\":\"2000.0\","
            + "\"indexPrice\":\"1999.5\",\"lastFundingRate\":\"0.0008\",\"nextFundingTime\":1735718400000,"
            + "\"time\":1735714800000}";

    private ScriptedAsterClient client;
    private AsterFundingDataProvider provider;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        client = new ScriptedAsterClient(objectMapper);
        provider = new AsterFundingDataProvider(client);
    }

    @Test
    @DisplayName("Only trading perpetuals are listed")
    void listsTradingPerpetuals() {
        client.respond("/fapi/v1/exchangeInfo", EXCHANGE_INFO);

        assertThat(provider.getAvailableSymbols()).containsExactly("ETHUSDT", "BTCUSDT");
    }

    @Test
    @DisplayName("Missing exchangeInfo fails the listing")
    void listingFailure() {
        assertThatThrownBy(() -> provider.getAvailableSymbols())
                .isInstanceOf(FundingDataException.class);
    }

    @Test
    @DisplayName("8-hour funding is converted to hourly and the premium index is cached")
    void hourlyRate() {
        client.respond("/fapi/v1/premiumIndex", PREMIUM_INDEX);

        assertThat(provider.getCurrentFundingRate("ETHUSDT").getAsDouble()).isCloseTo(0.0001, within(1e-12));
        assertThat(provider.getMarkPrice("ETHUSDT").getAsDouble()).isEqualTo(2000.0);
        assertThat(client.calls("/fapi/v1/premiumIndex")).isEqualTo(1);
    }

    @Test
    @DisplayName("Unparseable funding is empty, not zero")
    void badFundingRate() {
        client.respond("/fapi/v1/premiumIndex", PREMIUM_INDEX.replace("\"0.0008\"", "\"\""));

        assertThat(provider.getCurrentFundingRate("ETHUSDT")).isEmpty();
    }

    @Test
    @DisplayName("Open interest is reported in USD")
    void openInterestUsd() {
        client.respond("/fapi/v1/premiumIndex", PREMIUM_INDEX);
        client.respond("/fapi/v1/openInterest", "{\"symbol\":\"ETHUSDT\",\"openInterest\":\"1500\",\"time\":1735714800000}");

        assertThat(provider.getOpenInterest("ETHUSDT").getAsDouble()).isCloseTo(3_000_000.0, within(1e-6));
    }

    @Test
    @DisplayName("Open interest is unknown without a mark price")
    void openInterestWithoutMark() {
        assertThat(provider.getOpenInterest("ETHUSDT")).isEmpty();
    }

    @Test
    @DisplayName("Book ticker maps to bid/ask, crossed books are dropped")
    void bookTicker() {
        client.respond("/fapi/v1/ticker/bookTicker",
                "{\"symbol\":\"ETHUSDT\",\"bidPrice\":\"1999.9\",\"bidQty\":\"3\",\"askPrice\":\"2000.1\",\"askQty\":\"4\"}");

        Optional<BidAsk> bidAsk = provider.getBidAsk("ETHUSDT");

        assertThat(bidAsk).isPresent();
        assertThat(bidAsk.get().getBid()).isEqualTo(1999.9);
        assertThat(bidAsk.get().getAsk()).isEqualTo(2000.1);

        client.respond("/fapi/v1/ticker/bookTicker",
                "{\"symbol\":\"ETHUSDT\",\"bidPrice\":\"2001\",\"askPrice\":\"2000\"}");

        assertThat(provider.getBidAsk("ETHUSDT")).isEmpty();
    }

    // =====================================================================
    // Helpers
    // =====================================================================

    private static class ScriptedAsterClient extends AsterClient {

        private final Map<String, String> responses = new HashMap<>();
        private final Map<String, Integer> calls = new HashMap<>();

        ScriptedAsterClient(ObjectMapper objectMapper) {
            super(null, objectMapper);
        }

        void respond(String endpoint, String body) {
            responses.put(endpoint, body);
        }

        int calls(String endpoint) {
            return calls.getOrDefault(endpoint, 0);
        }

        @Override
        protected Optional<String> executePublicGet(String endpoint, Map<String, String> params) {
            calls.merge(endpoint, 1, Integer::sum);
            return Optional.ofNullable(responses.get(endpoint));
        }
    }
}
