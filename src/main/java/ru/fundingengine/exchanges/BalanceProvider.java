package ru.fundingengine.exchanges;

import ru.fundingengine.dto.exchanges.ExchangeType;

import java.util.OptionalDouble;

public interface BalanceProvider {

    ExchangeType getType();

    /**
     * Free collateral in USD
     */
    OptionalDouble getBalance();
}
