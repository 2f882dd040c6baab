package ru.fundingengine.mapper.hyperliquid;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import ru.fundingengine.dto.exchanges.hyperliquid.HyperliquidAssetContext;

import java.util.HashMap;
import java.util.Map;

@Slf4j
public final class HyperliquidAssetMapper {

    private HyperliquidAssetMapper() {
    }

    /**
     * Joins {@code [meta, assetCtxs]} by index: universe[i] describes assetCtxs[i].
     */
    public static Map<String, HyperliquidAssetContext> toAssetContexts(JsonNode metaAndAssetCtxs) {
        Map<String, HyperliquidAssetContext> contexts = new HashMap<>();

        if (!metaAndAssetCtxs.isArray() || metaAndAssetCtxs.size() < 2) {
            log.warn("[HyperliquidMapper] Unexpected metaAndAssetCtxs shape");
            return contexts;
        }

        JsonNode universe = metaAndAssetCtxs.get(0).path("universe");
        JsonNode assetCtxs = metaAndAssetCtxs.get(1);

        int count = Math.min(universe.size(), assetCtxs.size());
        for (int i = 0; i < count; i++) {
            JsonNode meta = universe.get(i);
            if (meta.path("isDelisted").asBoolean(false)) {
                continue;
            }

            String coin = meta.path("name").asText();
            JsonNode ctx = assetCtxs.get(i);

            try {
                JsonNode impact = ctx.path("impactPxs");
                double[] impactPrices = impact.isArray() && impact.size() == 2
                        ? new double[]{impact.get(0).asDouble(), impact.get(1).asDouble()}
                        : new double[0];

                contexts.put(coin, HyperliquidAssetContext.builder()
                        .coin(coin)
                        .funding(Double.parseDouble(ctx.path("funding").asText()))
                        .markPrice(Double.parseDouble(ctx.path("markPx").asText()))
                        .midPrice(ctx.path("midPx").asDouble(0.0))
                        .openInterest(Double.parseDouble(ctx.path("openInterest").asText()))
                        .impactPrices(impactPrices)
                        .build());
            } catch (NumberFormatException e) {
                log.debug("[HyperliquidMapper] Skipping {}: {}", coin, e.getMessage());
            }
        }

        return contexts;
    }
}
