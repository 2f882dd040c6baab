package ru.fundingengine.exchanges;

import ru.fundingengine.dto.exchanges.ExchangeType;
import ru.fundingengine.dto.exchanges.Position;

import java.util.List;

/**
 * Live positions of the trading account on one exchange. Implementations need account
 * credentials and are supplied by the execution layer.
 */
public interface PositionProvider {

    ExchangeType getType();

    /**
     * Every open perpetual leg; empty when the account is flat
     */
    List<Position> getOpenPositions();
}
