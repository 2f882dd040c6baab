package ru.fundingengine.dto.exchanges;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ExchangeBalance {
    ExchangeType exchange;
    double balance;
    //false when the balance query failed or timed out; balance is then 0
    boolean available;

    public static ExchangeBalance unavailable(ExchangeType exchange) {
        return new ExchangeBalance(exchange, 0.0, false);
    }
}
