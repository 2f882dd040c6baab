package ru.fundingengine.mapper.aster;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import ru.fundingengine.dto.exchanges.BidAsk;
import ru.fundingengine.dto.exchanges.ExchangeType;
import ru.fundingengine.dto.exchanges.aster.AsterBookTicker;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Slf4j
public final class AsterMarketMapper {

    private AsterMarketMapper() {
    }

    public static Optional<BidAsk> toBidAsk(AsterBookTicker ticker, String symbol) {
        if (ticker == null) {
            return Optional.empty();
        }

        try {
            BidAsk bidAsk = BidAsk.builder()
                    .exchange(ExchangeType.ASTER)
                    .symbol(symbol)
                    .bid(Double.parseDouble(ticker.getBidPrice()))
                    .ask(Double.parseDouble(ticker.getAskPrice()))
                    .build();

            return bidAsk.isValid() ? Optional.of(bidAsk) : Optional.empty();
        } catch (NullPointerException | NumberFormatException e) {
            log.warn("[AsterMapper] Failed to map book ticker for {}: {}", symbol, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Perpetual symbols currently trading, from /fapi/v1/exchangeInfo
     */
    public static List<String> toTradingPerpetuals(JsonNode exchangeInfo) {
        List<String> symbols = new ArrayList<>();

        for (JsonNode s : exchangeInfo.path("symbols")) {
            if ("PERPETUAL".equals(s.path("contractType").asText())
                    && "TRADING".equals(s.path("status").asText())) {
                symbols.add(s.path("symbol").asText());
            }
        }

        return symbols;
    }

    /**
     * Aster settles funding every {@code intervalHours}; the engine works in hourly rates.
     */
    public static double toHourlyRate(double intervalRate, int intervalHours) {
        return intervalHours > 0 ? intervalRate / intervalHours : intervalRate;
    }
}
