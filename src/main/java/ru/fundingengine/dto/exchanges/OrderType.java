package ru.fundingengine.dto.exchanges;

public enum OrderType {
    //Taker: crosses the book and pays half the bid/ask spread
    MARKET,
    //Maker: rests on the book, minimal slippage
    LIMIT;

    public boolean isTaker() {
        return this == MARKET;
    }
}
