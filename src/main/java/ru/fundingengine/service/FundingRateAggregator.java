package ru.fundingengine.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import ru.fundingengine.config.FundingConfig;
import ru.fundingengine.dto.exchanges.BidAsk;
import ru.fundingengine.dto.exchanges.ExchangeType;
import ru.fundingengine.dto.funding.ArbitrageOpportunity;
import ru.fundingengine.dto.funding.ExchangeFundingRate;
import ru.fundingengine.dto.funding.FundingRateComparison;
import ru.fundingengine.exchanges.FundingDataProvider;
import ru.fundingengine.exchanges.factory.FundingProviderFactory;
import ru.fundingengine.utils.SymbolNormalizer;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Collects funding rates from every configured exchange and derives long/short opportunities.
 * A failing exchange is left out of the result, it never fails the whole call.
 */
@Slf4j
@Service
public class FundingRateAggregator {

    //Liquid assets listed on at least two perpetual venues
    static final Set<String> DEFAULT_ALLOWED_ASSETS = Set.of(
            "0G", "2Z", "AAVE", "ADA", "AERO", "AI16Z", "APEX", "APT", "ARB", "ASTER",
            "AVAX", "AVNT", "BCH", "BERA", "BNB", "BTC", "CC", "CRV", "DOGE", "DOT",
            "DYDX", "EIGEN", "ENA", "ETH", "ETHFI", "FARTCOIN", "FIL", "GMX", "GRASS", "HBAR",
            "HYPE", "ICP", "IP", "JUP", "KAITO", "LAUNCHCOIN", "LDO", "LINEA", "LINK", "LTC",
            "MEGA", "MET", "MKR", "MNT", "MON", "MORPHO", "NEAR", "ONDO", "OP", "PAXG",
            "PENDLE", "PENGU", "POL", "POPCAT", "PROVE", "PUMP", "PYTH", "RESOLV", "S", "SEI",
            "SKY", "SOL", "SPX", "STBL", "STRK", "SUI", "SYRUP", "TAO", "TIA", "TON",
            "TRUMP", "TRX", "UNI", "VIRTUAL", "VVV", "WIF", "WLD", "WLFI", "XPL", "XRP",
            "YZY", "ZEC", "ZK", "ZORA", "ZRO"
    );

    private final FundingProviderFactory providerFactory;
    private final FundingConfig fundingConfig;
    private final Executor fundingDataExecutor;

    //normalized symbol -> exchange -> exchange-specific symbol
    private volatile Map<String, Map<ExchangeType, String>> symbolMappings = Collections.emptyMap();
    private volatile int listedExchangeCount;

    public FundingRateAggregator(FundingProviderFactory providerFactory,
                                 FundingConfig fundingConfig,
                                 @Qualifier("fundingDataExecutor") Executor fundingDataExecutor) {
        this.providerFactory = providerFactory;
        this.fundingConfig = fundingConfig;
        this.fundingDataExecutor = fundingDataExecutor;
    }

    public static String normalizeSymbol(String exchangeSymbol) {
        return SymbolNormalizer.normalize(exchangeSymbol);
    }

    /**
     * Lists every exchange concurrently and keeps the allowed assets found on at least two of them.
     * Rebuilds the symbol mapping used by {@link #getFundingRates(String)}.
     */
    public List<String> discoverCommonAssets() {
        log.info("[Aggregator] Discovering assets across {}", providerFactory.getExchangeTypes());

        Map<ExchangeType, CompletableFuture<List<String>>> listings = new EnumMap<>(ExchangeType.class);
        for (FundingDataProvider provider : providerFactory.getAllFundingProviders()) {
            listings.put(provider.getType(), withTimeout(
                    CompletableFuture.supplyAsync(provider::getAvailableSymbols, fundingDataExecutor),
                    provider.getType(), "symbol listing", List.of()));
        }
        CompletableFuture.allOf(listings.values().toArray(new CompletableFuture[0])).join();

        Map<String, Map<ExchangeType, String>> mappings = new TreeMap<>();
        int successfulListings = 0;
        for (Map.Entry<ExchangeType, CompletableFuture<List<String>>> entry : listings.entrySet()) {
            List<String> symbols = entry.getValue().join();
            if (!symbols.isEmpty()) {
                successfulListings++;
            }
            for (String exchangeSymbol : symbols) {
                String normalized = normalizeSymbol(exchangeSymbol);
                if (normalized == null || normalized.isEmpty()) {
                    continue;
                }
                mappings.computeIfAbsent(normalized, k -> new EnumMap<>(ExchangeType.class))
                        .putIfAbsent(entry.getKey(), exchangeSymbol);
            }
        }

        listedExchangeCount = successfulListings;

        if (successfulListings == 0) {
            List<String> fallback = fundingConfig.getDiscovery().getFallbackAssets();
            log.warn("[Aggregator] Every exchange listing failed, using fallback assets {}", fallback);
            return new ArrayList<>(fallback);
        }

        Set<String> allowed = allowedAssets();
        Set<String> common = new TreeSet<>();
        for (Map.Entry<String, Map<ExchangeType, String>> entry : mappings.entrySet()) {
            if (entry.getValue().size() >= 2 && allowed.contains(entry.getKey())) {
                common.add(entry.getKey());
            }
        }

        symbolMappings = Collections.unmodifiableMap(mappings);

        log.info("[Aggregator] Discovered {} common assets from {} listed symbols", common.size(), mappings.size());
        return new ArrayList<>(common);
    }

    //Exchanges whose listing succeeded in the last discovery; below two no pair can be formed
    public int getListedExchangeCount() {
        return listedExchangeCount;
    }

    public boolean hasSymbolMappings() {
        return !symbolMappings.isEmpty();
    }

    public Optional<String> getExchangeSymbol(String normalizedSymbol, ExchangeType exchange) {
        Map<ExchangeType, String> mapping = symbolMappings.get(normalizedSymbol);
        return mapping == null ? Optional.empty() : Optional.ofNullable(mapping.get(exchange));
    }

    public List<ExchangeFundingRate> getFundingRates(String symbol) {
        return fetchFundingRates(symbol).join();
    }

    /**
     * Top of book per requested exchange, fetched concurrently. Exchanges without a mapping,
     * a book or a timely answer are left out.
     */
    public Map<ExchangeType, BidAsk> getOrderBooks(String symbol, Collection<ExchangeType> exchanges) {
        Map<ExchangeType, CompletableFuture<Optional<BidAsk>>> fetches = new EnumMap<>(ExchangeType.class);
        for (ExchangeType exchange : exchanges) {
            if (exchange == null || !providerFactory.hasFundingProvider(exchange)) {
                continue;
            }
            Optional<String> exchangeSymbol = getExchangeSymbol(symbol, exchange);
            if (exchangeSymbol.isEmpty()) {
                continue;
            }

            FundingDataProvider provider = providerFactory.getFundingProvider(exchange);
            fetches.put(exchange, withTimeout(
                    CompletableFuture.supplyAsync(() -> provider.getBidAsk(exchangeSymbol.get()), fundingDataExecutor),
                    exchange, "order book for " + symbol, Optional.empty()));
        }
        CompletableFuture.allOf(fetches.values().toArray(new CompletableFuture[0])).join();

        Map<ExchangeType, BidAsk> books = new EnumMap<>(ExchangeType.class);
        fetches.forEach((exchange, future) -> future.join()
                .filter(BidAsk::isValid)
                .ifPresent(book -> books.put(exchange, book)));
        return books;
    }

    public Optional<FundingRateComparison> compareFundingRates(String symbol) {
        return compare(symbol, getFundingRates(symbol));
    }

    public List<ArbitrageOpportunity> findArbitrageOpportunities(List<String> symbols, double minSpread) {
        int batchSize = Math.max(1, fundingConfig.getDiscovery().getBatchSize());
        long batchDelayMs = fundingConfig.getDiscovery().getBatchDelayMs();

        //pair key -> best opportunity for that exact (symbol, long, short)
        Map<String, ArbitrageOpportunity> unique = new LinkedHashMap<>();

        for (int i = 0; i < symbols.size(); i += batchSize) {
            List<String> batch = symbols.subList(i, Math.min(i + batchSize, symbols.size()));

            Map<String, CompletableFuture<List<ExchangeFundingRate>>> fetches = new LinkedHashMap<>();
            for (String symbol : batch) {
                fetches.put(symbol, fetchFundingRates(symbol));
            }
            CompletableFuture.allOf(fetches.values().toArray(new CompletableFuture[0])).join();

            for (Map.Entry<String, CompletableFuture<List<ExchangeFundingRate>>> entry : fetches.entrySet()) {
                compare(entry.getKey(), entry.getValue().join()).ifPresent(comparison -> {
                    for (ArbitrageOpportunity opportunity : buildOpportunities(comparison, minSpread)) {
                        unique.merge(opportunity.getPairKey(), opportunity,
                                (a, b) -> b.getExpectedReturn() > a.getExpectedReturn() ? b : a);
                    }
                });
            }

            if (i + batchSize < symbols.size() && batchDelayMs > 0) {
                try {
                    Thread.sleep(batchDelayMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("[Aggregator] Interrupted between batches, returning partial results");
                    break;
                }
            }
        }

        List<ArbitrageOpportunity> opportunities = new ArrayList<>(unique.values());
        opportunities.sort(Comparator.comparingDouble(ArbitrageOpportunity::getExpectedReturn).reversed()
                .thenComparing(ArbitrageOpportunity::getPairKey));

        log.info("[Aggregator] Found {} opportunities across {} symbols (min spread {})",
                opportunities.size(), symbols.size(), String.format("%.6f", minSpread));
        return opportunities;
    }

    /**
     * (a) most negative rate long vs most positive rate short, (b) lowest rate long vs highest rate short.
     * Both may produce the same pair; the caller de-duplicates.
     */
    List<ArbitrageOpportunity> buildOpportunities(FundingRateComparison comparison, double minSpread) {
        List<ArbitrageOpportunity> result = new ArrayList<>();
        List<ExchangeFundingRate> rates = comparison.getRates();
        if (rates.size() < 2) {
            return result;
        }

        ExchangeFundingRate bestLong = rates.stream()
                .filter(r -> r.getCurrentRate() < 0)
                .min(Comparator.comparingDouble(ExchangeFundingRate::getCurrentRate))
                .orElse(null);
        ExchangeFundingRate bestShort = rates.stream()
                .filter(r -> r.getCurrentRate() > 0)
                .max(Comparator.comparingDouble(ExchangeFundingRate::getCurrentRate))
                .orElse(null);

        if (bestLong != null && bestShort != null && bestLong.getExchange() != bestShort.getExchange()) {
            double spread = Math.abs(bestLong.getCurrentRate() - bestShort.getCurrentRate());
            if (spread >= minSpread) {
                result.add(toOpportunity(comparison.getSymbol(), bestLong, bestShort, spread));
            }
        }

        ExchangeFundingRate highest = comparison.getHighestRate();
        ExchangeFundingRate lowest = comparison.getLowestRate();
        if (highest != null && lowest != null && highest.getExchange() != lowest.getExchange()) {
            double spread = highest.getCurrentRate() - lowest.getCurrentRate();
            if (spread >= minSpread) {
                result.add(toOpportunity(comparison.getSymbol(), lowest, highest, spread));
            }
        }

        return result;
    }

    private Optional<FundingRateComparison> compare(String symbol, List<ExchangeFundingRate> rates) {
        if (rates.isEmpty()) {
            log.debug("[Aggregator] No funding rates available for {}", symbol);
            return Optional.empty();
        }

        List<ExchangeFundingRate> sorted = new ArrayList<>(rates);
        sorted.sort(Comparator.comparingDouble(ExchangeFundingRate::getCurrentRate).reversed());
        ExchangeFundingRate highest = sorted.get(0);
        ExchangeFundingRate lowest = sorted.get(sorted.size() - 1);

        return Optional.of(FundingRateComparison.builder()
                .symbol(symbol)
                .rates(rates)
                .highestRate(highest)
                .lowestRate(lowest)
                .spread(highest.getCurrentRate() - lowest.getCurrentRate())
                .timestamp(Instant.now())
                .build());
    }

    private CompletableFuture<List<ExchangeFundingRate>> fetchFundingRates(String symbol) {
        List<CompletableFuture<Optional<ExchangeFundingRate>>> perExchange = new ArrayList<>();

        for (FundingDataProvider provider : providerFactory.getAllFundingProviders()) {
            Optional<String> exchangeSymbol = getExchangeSymbol(symbol, provider.getType());
            if (exchangeSymbol.isEmpty()) {
                log.debug("[Aggregator] No {} mapping for {}", provider.getType(), symbol);
                continue;
            }

            perExchange.add(withTimeout(
                    CompletableFuture.supplyAsync(() -> fetchRate(provider, symbol, exchangeSymbol.get()), fundingDataExecutor),
                    provider.getType(), "funding rate for " + symbol, Optional.empty()));
        }

        return CompletableFuture.allOf(perExchange.toArray(new CompletableFuture[0]))
                .thenApply(v -> {
                    List<ExchangeFundingRate> rates = new ArrayList<>();
                    for (CompletableFuture<Optional<ExchangeFundingRate>> future : perExchange) {
                        future.join().ifPresent(rates::add);
                    }
                    return rates;
                });
    }

    private Optional<ExchangeFundingRate> fetchRate(FundingDataProvider provider, String symbol, String exchangeSymbol) {
        OptionalDouble rate = provider.getCurrentFundingRate(exchangeSymbol);
        if (rate.isEmpty() || Double.isNaN(rate.getAsDouble())) {
            log.debug("[Aggregator] {} returned no rate for {}", provider.getType(), exchangeSymbol);
            return Optional.empty();
        }

        OptionalDouble predicted = safe(() -> provider.getPredictedFundingRate(exchangeSymbol), provider, "predicted rate");
        OptionalDouble markPrice = safe(() -> provider.getMarkPrice(exchangeSymbol), provider, "mark price");
        OptionalDouble openInterest = safe(() -> provider.getOpenInterest(exchangeSymbol), provider, "open interest");

        //Without market data a zero rate is indistinguishable from a broken feed
        if (markPrice.isEmpty() && rate.getAsDouble() == 0.0) {
            log.debug("[Aggregator] Dropping zero {} rate for {} without market data", provider.getType(), symbol);
            return Optional.empty();
        }

        return Optional.of(ExchangeFundingRate.builder()
                .exchange(provider.getType())
                .symbol(symbol)
                .currentRate(rate.getAsDouble())
                .predictedRate(predicted.orElse(rate.getAsDouble()))
                .markPrice(markPrice.orElse(0.0))
                .openInterest(openInterest.orElse(0.0))
                .timestamp(Instant.now())
                .build());
    }

    private OptionalDouble safe(Supplier<OptionalDouble> query, FundingDataProvider provider, String what) {
        try {
            return query.get();
        } catch (RuntimeException e) {
            log.debug("[Aggregator] {} {} failed: {}", provider.getType(), what, e.getMessage());
            return OptionalDouble.empty();
        }
    }

    private <T> CompletableFuture<T> withTimeout(CompletableFuture<T> future, ExchangeType exchange,
                                                 String what, T fallback) {
        return future
                .orTimeout(fundingConfig.getDiscovery().getFetchTimeoutMs(), TimeUnit.MILLISECONDS)
                .exceptionally(e -> {
                    log.warn("[Aggregator] {} {} unavailable: {}", exchange, what, e.getMessage());
                    return fallback;
                });
    }

    private Set<String> allowedAssets() {
        Set<String> configured = fundingConfig.getDiscovery().getAllowedAssets();
        return configured == null || configured.isEmpty() ? DEFAULT_ALLOWED_ASSETS : configured;
    }

    private static ArbitrageOpportunity toOpportunity(String symbol, ExchangeFundingRate longRate,
                                                      ExchangeFundingRate shortRate, double spread) {
        return ArbitrageOpportunity.builder()
                .symbol(symbol)
                .longExchange(longRate.getExchange())
                .shortExchange(shortRate.getExchange())
                .longRate(longRate.getCurrentRate())
                .shortRate(shortRate.getCurrentRate())
                .spread(spread)
                .expectedReturn(spread * ArbitrageOpportunity.HOURS_PER_YEAR)
                .longMarkPrice(longRate.getMarkPrice() > 0 ? longRate.getMarkPrice() : null)
                .shortMarkPrice(shortRate.getMarkPrice() > 0 ? shortRate.getMarkPrice() : null)
                .longOpenInterest(longRate.getOpenInterest() > 0 ? longRate.getOpenInterest() : null)
                .shortOpenInterest(shortRate.getOpenInterest() > 0 ? shortRate.getOpenInterest() : null)
                .timestamp(Instant.now())
                .build();
    }
}
