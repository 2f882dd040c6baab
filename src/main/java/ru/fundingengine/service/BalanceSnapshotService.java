package ru.fundingengine.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import ru.fundingengine.config.FundingConfig;
import ru.fundingengine.dto.exchanges.ExchangeBalance;
import ru.fundingengine.dto.exchanges.ExchangeType;
import ru.fundingengine.exchanges.BalanceProvider;
import ru.fundingengine.exchanges.factory.FundingProviderFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * One balance read per exchange per cycle. A provider that fails or times out
 * reports zero and is flagged unavailable.
 */
@Slf4j
@Service
public class BalanceSnapshotService {

    private final FundingProviderFactory providerFactory;
    private final FundingConfig fundingConfig;
    private final Executor executor;

    public BalanceSnapshotService(FundingProviderFactory providerFactory,
                                  FundingConfig fundingConfig,
                                  @Qualifier("fundingDataExecutor") Executor executor) {
        this.providerFactory = providerFactory;
        this.fundingConfig = fundingConfig;
        this.executor = executor;
    }

    public Map<ExchangeType, ExchangeBalance> snapshot() {
        long timeoutMs = fundingConfig.getCycle().getBalanceTimeoutMs();
        List<CompletableFuture<ExchangeBalance>> futures = new ArrayList<>();

        for (BalanceProvider provider : providerFactory.getAllBalanceProviders()) {
            futures.add(CompletableFuture.supplyAsync(() -> readBalance(provider), executor)
                    .orTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                    .exceptionally(e -> {
                        log.warn("[Balance] {} balance unavailable: {}", provider.getType(), e.toString());
                        return ExchangeBalance.unavailable(provider.getType());
                    }));
        }

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        Map<ExchangeType, ExchangeBalance> balances = new EnumMap<>(ExchangeType.class);
        for (CompletableFuture<ExchangeBalance> future : futures) {
            ExchangeBalance balance = future.join();
            balances.put(balance.getExchange(), balance);
        }

        log.info("[Balance] Snapshot: {}", describe(balances));
        return balances;
    }

    public static Map<ExchangeType, Double> toBalanceMap(Map<ExchangeType, ExchangeBalance> snapshot) {
        Map<ExchangeType, Double> result = new EnumMap<>(ExchangeType.class);
        snapshot.forEach((exchange, balance) -> result.put(exchange, balance.getBalance()));
        return result;
    }

    //Capital usable by a pair is bounded by the poorer side
    public static double totalCapital(Map<ExchangeType, ExchangeBalance> snapshot) {
        return snapshot.values().stream()
                .filter(ExchangeBalance::isAvailable)
                .mapToDouble(ExchangeBalance::getBalance)
                .min()
                .orElse(0.0);
    }

    private static ExchangeBalance readBalance(BalanceProvider provider) {
        OptionalDouble balance = provider.getBalance();
        if (balance.isEmpty() || !Double.isFinite(balance.getAsDouble())) {
            log.debug("[Balance] {} returned no balance", provider.getType());
            return ExchangeBalance.unavailable(provider.getType());
        }
        return ExchangeBalance.builder()
                .exchange(provider.getType())
                .balance(balance.getAsDouble())
                .available(true)
                .build();
    }

    private static String describe(Map<ExchangeType, ExchangeBalance> balances) {
        StringBuilder sb = new StringBuilder();
        balances.forEach((exchange, balance) -> {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(exchange).append("=");
            sb.append(balance.isAvailable() ? String.format("$%.2f", balance.getBalance()) : "n/a");
        });
        return sb.toString();
    }
}
