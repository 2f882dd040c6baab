package ru.fundingengine.dto.funding;

public enum Recommendation {
    STRONG_BUY,
    BUY,
    HOLD,
    SKIP;

    public boolean isDeployable() {
        return this == STRONG_BUY || this == BUY;
    }
}
