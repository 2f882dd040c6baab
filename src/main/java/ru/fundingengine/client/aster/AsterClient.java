package ru.fundingengine.client.aster;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.CloseableHttpResponse;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.net.URIBuilder;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import ru.fundingengine.dto.exchanges.ExchangeType;
import ru.fundingengine.dto.exchanges.aster.AsterBookTicker;
import ru.fundingengine.dto.exchanges.aster.OpenInterestResponse;
import ru.fundingengine.dto.exchanges.aster.PremiumIndexResponse;
import ru.fundingengine.exceptions.FundingDataException;
import ru.fundingengine.mapper.aster.AsterMarketMapper;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Public market-data endpoints of Aster futures. No signed requests: the engine never trades.
 */
@Slf4j
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "exchanges.aster")
public class AsterClient {

    private static final long CACHE_TTL_MS = 30_000;

    private final ObjectMapper objectMapper;
    private final CloseableHttpClient httpClient;

    private String baseUrl = "https://fapi.asterdex.com";
    private int fundingIntervalHours = 8;

    //Premium index per symbol: funding rate and mark price come from the same call
    private final Map<String, CachedPremium> premiumCache = new ConcurrentHashMap<>();

    public AsterClient(CloseableHttpClient httpClient, ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    public List<String> getTradingPerpetuals() {
        String json = executePublicGet("/fapi/v1/exchangeInfo", null)
                .orElseThrow(() -> new FundingDataException(ExchangeType.ASTER, "exchangeInfo unavailable"));

        try {
            JsonNode root = objectMapper.readTree(json);
            List<String> symbols = AsterMarketMapper.toTradingPerpetuals(root);
            log.info("[Aster] Loaded {} perpetual symbols from exchangeInfo", symbols.size());
            return symbols;
        } catch (Exception e) {
            throw new FundingDataException(ExchangeType.ASTER, "Failed to parse exchangeInfo", e);
        }
    }

    public Optional<PremiumIndexResponse> getPremiumIndexInfo(String symbol) {
        long now = System.currentTimeMillis();
        CachedPremium cached = premiumCache.get(symbol);
        if (cached != null && now - cached.fetchedAt < CACHE_TTL_MS) {
            log.debug("[Aster] Using cached premium index for {}", symbol);
            return Optional.of(cached.response);
        }

        Optional<PremiumIndexResponse> response = executePublicGet("/fapi/v1/premiumIndex", Map.of("symbol", symbol))
                .flatMap(body -> read(body, PremiumIndexResponse.class, symbol));

        response.ifPresent(r -> premiumCache.put(symbol, new CachedPremium(r, now)));
        return response;
    }

    public Optional<OpenInterestResponse> getOpenInterest(String symbol) {
        return executePublicGet("/fapi/v1/openInterest", Map.of("symbol", symbol))
                .flatMap(body -> read(body, OpenInterestResponse.class, symbol));
    }

    public Optional<AsterBookTicker> getBookTicker(String symbol) {
        return executePublicGet("/fapi/v1/ticker/bookTicker", Map.of("symbol", symbol))
                .flatMap(body -> read(body, AsterBookTicker.class, symbol));
    }

    public void clearCache() {
        premiumCache.clear();
    }

    protected Optional<String> executePublicGet(String endpoint, Map<String, String> params) {
        try {
            URIBuilder builder = new URIBuilder(baseUrl + endpoint);
            if (params != null) {
                params.forEach(builder::addParameter);
            }
            URI uri = builder.build();

            HttpGet get = new HttpGet(uri);
            log.debug("[Aster Public GET] {}", uri);

            try (CloseableHttpResponse resp = httpClient.execute(get)) {
                int code = resp.getCode();
                String body = EntityUtils.toString(resp.getEntity(), StandardCharsets.UTF_8);
                if (code == 200) {
                    return Optional.of(body);
                }
                log.warn("[Aster] Public GET error: code={}, body={}", code, body);
                return Optional.empty();
            }
        } catch (Exception e) {
            log.warn("[Aster] Public GET error {}: {}", endpoint, e.getMessage());
            return Optional.empty();
        }
    }

    private <T> Optional<T> read(String body, Class<T> type, String symbol) {
        try {
            return Optional.ofNullable(objectMapper.readValue(body, type));
        } catch (Exception e) {
            log.warn("[Aster] Failed to parse {} for {}: {}", type.getSimpleName(), symbol, e.getMessage());
            return Optional.empty();
        }
    }

    @AllArgsConstructor
    private static class CachedPremium {
        private final PremiumIndexResponse response;
        private final long fetchedAt;
    }
}
