package ru.fundingengine.service.tracking;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import ru.fundingengine.config.FundingConfig;
import ru.fundingengine.dto.exchanges.ExchangeType;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Exchange pairs that recently failed to execute for a symbol. They are skipped by the
 * ladder until the filter expires.
 */
@Slf4j
@Component
public class OpportunityCooldownTracker {

    private final Map<String, Instant> failedAt = new ConcurrentHashMap<>();
    private final Clock clock;
    private final long expiryMs;

    @Autowired
    public OpportunityCooldownTracker(FundingConfig fundingConfig) {
        this(Clock.systemUTC(), fundingConfig.getLadder().getFilterExpiryMs());
    }

    public OpportunityCooldownTracker(Clock clock, long expiryMs) {
        this.clock = clock;
        this.expiryMs = expiryMs;
    }

    public void markFailed(String symbol, ExchangeType first, ExchangeType second) {
        String key = key(symbol, first, second);
        failedAt.put(key, clock.instant());
        log.info("[Cooldown] {} filtered for {}s", key, expiryMs / 1000);
    }

    public boolean isCoolingDown(String symbol, ExchangeType first, ExchangeType second) {
        String key = key(symbol, first, second);
        Instant at = failedAt.get(key);
        if (at == null) {
            return false;
        }
        if (clock.millis() - at.toEpochMilli() >= expiryMs) {
            failedAt.remove(key);
            return false;
        }
        return true;
    }

    public void clear(String symbol, ExchangeType first, ExchangeType second) {
        failedAt.remove(key(symbol, first, second));
    }

    public void clearAll() {
        failedAt.clear();
    }

    //Direction-independent: A/B and B/A share one entry
    static String key(String symbol, ExchangeType first, ExchangeType second) {
        return first.ordinal() <= second.ordinal()
                ? symbol + "-" + first + "-" + second
                : symbol + "-" + second + "-" + first;
    }
}
