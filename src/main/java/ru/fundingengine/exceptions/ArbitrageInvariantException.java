package ru.fundingengine.exceptions;

/**
 * Programming-contract violation in discovery or allocation, e.g. one exchange on both legs
 * or two exchange pairs held for the same symbol.
 */
public class ArbitrageInvariantException extends RuntimeException {

    public ArbitrageInvariantException(String message) {
        super(message);
    }
}
