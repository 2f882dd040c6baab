package ru.fundingengine.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import ru.fundingengine.config.FundingConfig;
import ru.fundingengine.dto.exchanges.Direction;
import ru.fundingengine.dto.exchanges.Position;
import ru.fundingengine.dto.funding.OpenPositionPair;
import ru.fundingengine.exceptions.ArbitrageInvariantException;
import ru.fundingengine.exchanges.PositionProvider;
import ru.fundingengine.exchanges.factory.FundingProviderFactory;
import ru.fundingengine.utils.SymbolNormalizer;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Reads the open legs from every exchange once per cycle and joins them into pairs by base asset.
 * Unlike balances, a missing answer is not replaced by a default: an exchange that could not be read
 * may hold a leg, so the whole snapshot is unusable.
 */
@Slf4j
@Service
public class PositionSnapshotService {

    private final FundingProviderFactory providerFactory;
    private final FundingConfig fundingConfig;
    private final Executor executor;

    public PositionSnapshotService(FundingProviderFactory providerFactory,
                                   FundingConfig fundingConfig,
                                   @Qualifier("fundingDataExecutor") Executor executor) {
        this.providerFactory = providerFactory;
        this.fundingConfig = fundingConfig;
        this.executor = executor;
    }

    /**
     * @return empty when any exchange failed or timed out
     * @throws ArbitrageInvariantException when the legs cannot form one pair per symbol
     */
    public Optional<List<OpenPositionPair>> snapshot() {
        List<PositionProvider> providers = providerFactory.getAllPositionProviders();
        if (providers.isEmpty()) {
            log.warn("[Positions] No position providers registered, treating the account as flat");
            return Optional.of(List.of());
        }

        long timeoutMs = fundingConfig.getCycle().getPositionTimeoutMs();
        List<CompletableFuture<Optional<List<Position>>>> futures = new ArrayList<>();

        for (PositionProvider provider : providers) {
            futures.add(CompletableFuture.supplyAsync(() -> Optional.ofNullable(provider.getOpenPositions()), executor)
                    .orTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                    .exceptionally(e -> {
                        log.warn("[Positions] {} positions unavailable: {}", provider.getType(), e.toString());
                        return Optional.empty();
                    }));
        }

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<Position> legs = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            Optional<List<Position>> result = futures.get(i).join();
            if (result.isEmpty()) {
                log.warn("[Positions] Snapshot incomplete without {}", providers.get(i).getType());
                return Optional.empty();
            }
            legs.addAll(result.get());
        }

        List<OpenPositionPair> pairs = assemble(legs);
        log.info("[Positions] {} leg(s) on {} exchange(s) -> {} pair(s)", legs.size(), providers.size(), pairs.size());
        return Optional.of(pairs);
    }

    /**
     * Joins legs by base asset. A symbol with a lone leg yields a single-leg pair.
     *
     * @throws ArbitrageInvariantException on two legs of one side for a symbol, or both sides on one exchange
     */
    static List<OpenPositionPair> assemble(List<Position> legs) {
        Map<String, Position> longs = new TreeMap<>();
        Map<String, Position> shorts = new TreeMap<>();

        for (Position leg : legs) {
            if (leg.getSize() == 0) {
                continue;
            }
            String symbol = SymbolNormalizer.normalize(leg.getSymbol());
            Map<String, Position> side = leg.getSide() == Direction.LONG ? longs : shorts;
            Position previous = side.putIfAbsent(symbol, leg);
            if (previous != null) {
                String message = "Two " + leg.getSide() + " legs for " + symbol + ": "
                        + previous.getExchange() + " and " + leg.getExchange();
                log.error("[Positions] {}", message);
                throw new ArbitrageInvariantException(message);
            }
        }

        Map<String, OpenPositionPair> pairs = new TreeMap<>();
        for (Map.Entry<String, Position> entry : longs.entrySet()) {
            pairs.put(entry.getKey(), toPair(entry.getKey(), entry.getValue(), shorts.get(entry.getKey())));
        }
        for (Map.Entry<String, Position> entry : shorts.entrySet()) {
            if (!longs.containsKey(entry.getKey())) {
                pairs.put(entry.getKey(), toPair(entry.getKey(), null, entry.getValue()));
            }
        }
        return new ArrayList<>(pairs.values());
    }

    private static OpenPositionPair toPair(String symbol, Position longLeg, Position shortLeg) {
        if (longLeg != null && shortLeg != null && longLeg.getExchange() == shortLeg.getExchange()) {
            String message = symbol + " is both long and short on " + longLeg.getExchange();
            log.error("[Positions] {}", message);
            throw new ArbitrageInvariantException(message);
        }

        double notional;
        if (longLeg != null && shortLeg != null) {
            notional = Math.min(longLeg.getNotionalUsd(), shortLeg.getNotionalUsd());
        } else {
            notional = (longLeg != null ? longLeg : shortLeg).getNotionalUsd();
        }

        int leverage = Math.max(1, Math.max(leverageOf(longLeg), leverageOf(shortLeg)));
        double margin = Math.max(marginOf(longLeg), marginOf(shortLeg));

        return OpenPositionPair.builder()
                .symbol(symbol)
                .longExchange(longLeg != null ? longLeg.getExchange() : null)
                .shortExchange(shortLeg != null ? shortLeg.getExchange() : null)
                .notionalSize(notional)
                .leverage(leverage)
                .entryTimestamp(earliest(openedAtOf(longLeg), openedAtOf(shortLeg)))
                .currentValue(notional)
                .currentCollateral(margin > 0 ? margin : notional / leverage)
                .build();
    }

    private static int leverageOf(Position leg) {
        return leg != null ? leg.getLeverage() : 0;
    }

    private static double marginOf(Position leg) {
        return leg != null ? leg.getMargin() : 0.0;
    }

    private static Instant openedAtOf(Position leg) {
        return leg != null ? leg.getOpenedAt() : null;
    }

    private static Instant earliest(Instant a, Instant b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return a.isBefore(b) ? a : b;
    }
}
