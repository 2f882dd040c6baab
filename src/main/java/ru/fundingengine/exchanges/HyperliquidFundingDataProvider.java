package ru.fundingengine.exchanges;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ru.fundingengine.client.hyperliquid.HyperliquidClient;
import ru.fundingengine.dto.exchanges.BidAsk;
import ru.fundingengine.dto.exchanges.ExchangeType;
import ru.fundingengine.dto.exchanges.hyperliquid.HyperliquidAssetContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

@Slf4j
@Service
@RequiredArgsConstructor
public class HyperliquidFundingDataProvider implements FundingDataProvider {

    private final HyperliquidClient hyperliquidClient;

    @Override
    public ExchangeType getType() {
        return ExchangeType.HYPERLIQUID;
    }

    @Override
    public List<String> getAvailableSymbols() {
        return new ArrayList<>(hyperliquidClient.getAssetContexts().keySet());
    }

    @Override
    public OptionalDouble getCurrentFundingRate(String exchangeSymbol) {
        return hyperliquidClient.getAssetContext(exchangeSymbol)
                .map(ctx -> OptionalDouble.of(ctx.getFunding()))
                .orElse(OptionalDouble.empty());
    }

    @Override
    public OptionalDouble getMarkPrice(String exchangeSymbol) {
        return hyperliquidClient.getAssetContext(exchangeSymbol)
                .filter(ctx -> ctx.getMarkPrice() > 0)
                .map(ctx -> OptionalDouble.of(ctx.getMarkPrice()))
                .orElse(OptionalDouble.empty());
    }

    @Override
    public OptionalDouble getOpenInterest(String exchangeSymbol) {
        return hyperliquidClient.getAssetContext(exchangeSymbol)
                .filter(ctx -> ctx.getMarkPrice() > 0)
                .map(ctx -> OptionalDouble.of(ctx.getOpenInterestUsd()))
                .orElse(OptionalDouble.empty());
    }

    /**
     * Impact prices stand in for the top of book: [bid impact, ask impact]
     */
    @Override
    public Optional<BidAsk> getBidAsk(String exchangeSymbol) {
        Optional<HyperliquidAssetContext> ctx = hyperliquidClient.getAssetContext(exchangeSymbol);
        if (ctx.isEmpty() || ctx.get().getImpactPrices() == null || ctx.get().getImpactPrices().length != 2) {
            return Optional.empty();
        }

        double[] impact = ctx.get().getImpactPrices();
        BidAsk bidAsk = BidAsk.builder()
                .exchange(ExchangeType.HYPERLIQUID)
                .symbol(exchangeSymbol)
                .bid(impact[0])
                .ask(impact[1])
                .build();

        if (!bidAsk.isValid()) {
            log.debug("[Hyperliquid] Invalid impact prices for {}", exchangeSymbol);
            return Optional.empty();
        }
        return Optional.of(bidAsk);
    }
}
