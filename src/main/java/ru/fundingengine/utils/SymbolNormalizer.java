package ru.fundingengine.utils;

import java.util.Locale;

public final class SymbolNormalizer {

    private SymbolNormalizer() {
    }

    /**
     * Aster: ETHUSDT -> ETH, Extended: ETH-USD -> ETH, Hyperliquid/Lighter: ETH -> ETH
     */
    public static String normalize(String exchangeSymbol) {
        if (exchangeSymbol == null) {
            return null;
        }

        String symbol = exchangeSymbol.trim().toUpperCase(Locale.ROOT)
                .replace("USDT", "")
                .replace("USDC", "")
                .replace("-PERP", "")
                .replace("PERP", "");

        if (symbol.endsWith("-USD")) {
            symbol = symbol.substring(0, symbol.length() - 4);
        } else if (symbol.endsWith("USD") && symbol.length() > 3) {
            symbol = symbol.substring(0, symbol.length() - 3);
        }

        return symbol;
    }
}
