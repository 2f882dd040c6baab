package ru.fundingengine.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import ru.fundingengine.dto.exchanges.ExchangeType;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Data
@Configuration
@ConfigurationProperties(prefix = "funding")
public class FundingConfig {

    private CostsConfig costs = new CostsConfig();
    private PredictionConfig prediction = new PredictionConfig();
    private DiscoveryConfig discovery = new DiscoveryConfig();
    private StickinessConfig stickiness = new StickinessConfig();
    private LadderConfig ladder = new LadderConfig();
    private CycleConfig cycle = new CycleConfig();

    @Data
    public static class CostsConfig {
        private Map<ExchangeType, Double> makerFees = new EnumMap<>(ExchangeType.class);
        private Map<ExchangeType, Double> takerFees = new EnumMap<>(ExchangeType.class);
        private double defaultFeeRate = 0.0005;
    }

    @Data
    public static class PredictionConfig {
        private double minConfidenceThreshold = 0.6;
        private double maxWorstCaseBreakEvenDays = 7;
        private int defaultReliableHorizonHours = 24;
        //Hourly USD return below this counts as "never breaks even"
        private double minHourlyReturnUsd = 0.01;
    }

    @Data
    public static class DiscoveryConfig {
        private double minSpread = 0.0001;
        private int batchSize = 5;
        private long batchDelayMs = 1000;
        private long fetchTimeoutMs = 10000;
        private int threadPoolSize = 8;
        private Set<String> allowedAssets = new LinkedHashSet<>();
        private List<String> fallbackAssets = new ArrayList<>(List.of("ETH", "BTC"));
    }

    @Data
    public static class StickinessConfig {
        private double closeThreshold = -0.0005;
        private double minHoldHours = 4;
        private double churnCostMultiplier = 2.0;
    }

    @Data
    public static class LadderConfig {
        private int leverage = 2;
        private double minPositionSizeUsd = 10;
        private long filterExpiryMs = 3_600_000;
        private double targetNetApy = 0.35;
        private double maxOiShare = 0.05;
        private double costAmortizationHours = 168;
    }

    @Data
    public static class CycleConfig {
        private boolean enabled = false;
        private long fixedDelayMs = 300_000;
        private double planSizeUsd = 1000;
        private long balanceTimeoutMs = 10000;
        private long positionTimeoutMs = 10000;
    }

    public double getMakerFeeRate(ExchangeType exchange) {
        return costs.getMakerFees().getOrDefault(exchange, costs.getDefaultFeeRate());
    }

    public double getTakerFeeRate(ExchangeType exchange) {
        return costs.getTakerFees().getOrDefault(exchange, costs.getDefaultFeeRate());
    }
}
