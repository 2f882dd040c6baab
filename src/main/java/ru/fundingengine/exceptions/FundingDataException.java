package ru.fundingengine.exceptions;

import lombok.Getter;
import ru.fundingengine.dto.exchanges.ExchangeType;

@Getter
public class FundingDataException extends RuntimeException {

    private final ExchangeType exchange;

    public FundingDataException(ExchangeType exchange, String message) {
        super("[" + exchange.getDisplayName() + "] " + message);
        this.exchange = exchange;
    }

    public FundingDataException(ExchangeType exchange, String message, Throwable cause) {
        super("[" + exchange.getDisplayName() + "] " + message, cause);
        this.exchange = exchange;
    }
}
