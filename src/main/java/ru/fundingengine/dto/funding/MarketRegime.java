package ru.fundingengine.dto.funding;

public enum MarketRegime {
    MEAN_REVERTING,
    TRENDING,
    HIGH_VOLATILITY,
    EXTREME_DISLOCATION
}
