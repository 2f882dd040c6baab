package ru.fundingengine.client.hyperliquid;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.CloseableHttpResponse;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.io.entity.StringEntity;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import ru.fundingengine.dto.exchanges.ExchangeType;
import ru.fundingengine.dto.exchanges.hyperliquid.HyperliquidAssetContext;
import ru.fundingengine.exceptions.FundingDataException;
import ru.fundingengine.mapper.hyperliquid.HyperliquidAssetMapper;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;

/**
 * Hyperliquid info endpoint. One {@code metaAndAssetCtxs} call covers funding, prices and
 * open interest for every coin, so the whole response is cached.
 */
@Slf4j
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "exchanges.hyperliquid")
public class HyperliquidClient {

    private static final long CACHE_TTL_MS = 30_000;
    private static final String META_AND_ASSET_CTXS = "{\"type\":\"metaAndAssetCtxs\"}";

    private final ObjectMapper objectMapper;
    private final CloseableHttpClient httpClient;

    private String baseUrl = "https://api.hyperliquid.xyz";

    private volatile Map<String, HyperliquidAssetContext> cachedContexts = null;
    private volatile long lastFetchTime = 0;

    public HyperliquidClient(CloseableHttpClient httpClient, ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    public synchronized Map<String, HyperliquidAssetContext> getAssetContexts() {
        long now = System.currentTimeMillis();
        if (cachedContexts != null && (now - lastFetchTime) < CACHE_TTL_MS) {
            log.debug("[Hyperliquid] Using cached asset contexts");
            return cachedContexts;
        }

        String body = executeInfoPost(META_AND_ASSET_CTXS)
                .orElseThrow(() -> new FundingDataException(ExchangeType.HYPERLIQUID, "metaAndAssetCtxs unavailable"));

        try {
            Map<String, HyperliquidAssetContext> contexts =
                    HyperliquidAssetMapper.toAssetContexts(objectMapper.readTree(body));
            cachedContexts = contexts;
            lastFetchTime = now;
            log.info("[Hyperliquid] Asset contexts received and cached: {} coins", contexts.size());
            return contexts;
        } catch (Exception e) {
            throw new FundingDataException(ExchangeType.HYPERLIQUID, "Failed to parse metaAndAssetCtxs", e);
        }
    }

    public Optional<HyperliquidAssetContext> getAssetContext(String coin) {
        return Optional.ofNullable(getAssetContexts().get(coin));
    }

    public synchronized void clearCache() {
        cachedContexts = null;
        lastFetchTime = 0;
    }

    protected Optional<String> executeInfoPost(String payload) {
        try {
            HttpPost post = new HttpPost(baseUrl + "/info");
            post.setEntity(new StringEntity(payload, ContentType.APPLICATION_JSON));
            log.debug("[Hyperliquid POST] {}/info {}", baseUrl, payload);

            try (CloseableHttpResponse resp = httpClient.execute(post)) {
                int code = resp.getCode();
                String body = EntityUtils.toString(resp.getEntity(), StandardCharsets.UTF_8);
                if (code == 200) {
                    return Optional.of(body);
                }
                log.warn("[Hyperliquid] Info error: code={}, body={}", code, body);
                return Optional.empty();
            }
        } catch (Exception e) {
            log.warn("[Hyperliquid] Info request failed: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
