package ru.fundingengine.exchanges;

import ru.fundingengine.dto.exchanges.BidAsk;
import ru.fundingengine.dto.exchanges.ExchangeType;

import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Read-only market data for one exchange. Every query is independently fallible:
 * an empty result means "no data", never zero. Implementations may also throw
 * {@link ru.fundingengine.exceptions.FundingDataException}.
 */
public interface FundingDataProvider {

    ExchangeType getType();

    /**
     * Exchange-specific symbols of all tradable perpetuals (e.g. "ETHUSDT")
     */
    List<String> getAvailableSymbols();

    /**
     * Hourly funding rate as decimal
     */
    OptionalDouble getCurrentFundingRate(String exchangeSymbol);

    default OptionalDouble getPredictedFundingRate(String exchangeSymbol) {
        return getCurrentFundingRate(exchangeSymbol);
    }

    OptionalDouble getMarkPrice(String exchangeSymbol);

    /**
     * Open interest in USD
     */
    OptionalDouble getOpenInterest(String exchangeSymbol);

    default Optional<BidAsk> getBidAsk(String exchangeSymbol) {
        return Optional.empty();
    }
}
