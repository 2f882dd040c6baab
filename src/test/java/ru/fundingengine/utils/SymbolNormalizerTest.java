package ru.fundingengine.utils;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class SymbolNormalizerTest {

    @ParameterizedTest
    @CsvSource({
            "ETHUSDT, ETH",
            "BTCUSDC, BTC",
            "ETH-USD, ETH",
            "SOL-PERP, SOL",
            "eth, ETH",
            "HYPE, HYPE",
            "USD, USD"
    })
    void normalizesExchangeSymbols(String exchangeSymbol, String expected) {
        assertThat(SymbolNormalizer.normalize(exchangeSymbol)).isEqualTo(expected);
    }
}
