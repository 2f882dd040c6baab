package ru.fundingengine.exchanges;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ru.fundingengine.client.aster.AsterClient;
import ru.fundingengine.dto.exchanges.BidAsk;
import ru.fundingengine.dto.exchanges.ExchangeType;
import ru.fundingengine.mapper.aster.AsterMarketMapper;

import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

@Slf4j
@Service
@RequiredArgsConstructor
public class AsterFundingDataProvider implements FundingDataProvider {

    private final AsterClient asterClient;

    @Override
    public ExchangeType getType() {
        return ExchangeType.ASTER;
    }

    @Override
    public List<String> getAvailableSymbols() {
        return asterClient.getTradingPerpetuals();
    }

    @Override
    public OptionalDouble getCurrentFundingRate(String exchangeSymbol) {
        OptionalDouble rate = asterClient.getPremiumIndexInfo(exchangeSymbol)
                .map(r -> r.getLastFundingRateAsDouble())
                .orElse(OptionalDouble.empty());

        if (rate.isEmpty()) {
            log.debug("[Aster] No funding rate for {}", exchangeSymbol);
            return rate;
        }
        return OptionalDouble.of(AsterMarketMapper.toHourlyRate(rate.getAsDouble(), asterClient.getFundingIntervalHours()));
    }

    @Override
    public OptionalDouble getMarkPrice(String exchangeSymbol) {
        return asterClient.getPremiumIndexInfo(exchangeSymbol)
                .map(r -> r.getMarkPriceAsDouble())
                .orElse(OptionalDouble.empty());
    }

    @Override
    public OptionalDouble getOpenInterest(String exchangeSymbol) {
        OptionalDouble markPrice = getMarkPrice(exchangeSymbol);
        if (markPrice.isEmpty()) {
            return OptionalDouble.empty();
        }

        //Aster reports open interest in base units
        return asterClient.getOpenInterest(exchangeSymbol)
                .map(oi -> {
                    try {
                        return OptionalDouble.of(Double.parseDouble(oi.getOpenInterest()) * markPrice.getAsDouble());
                    } catch (NullPointerException | NumberFormatException e) {
                        log.debug("[Aster] Bad open interest for {}: {}", exchangeSymbol, oi.getOpenInterest());
                        return OptionalDouble.empty();
                    }
                })
                .orElse(OptionalDouble.empty());
    }

    @Override
    public Optional<BidAsk> getBidAsk(String exchangeSymbol) {
        return asterClient.getBookTicker(exchangeSymbol)
                .flatMap(ticker -> AsterMarketMapper.toBidAsk(ticker, exchangeSymbol));
    }
}
