package ru.fundingengine.dto.exchanges;

public enum ExchangeType {
    ASTER("Aster"),
    LIGHTER("Lighter"),
    HYPERLIQUID("Hyperliquid"),
    EXTENDED("Extended");

    private final String displayName;

    ExchangeType(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
