package ru.fundingengine.service.tracking;

import java.time.Instant;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Open timestamps of live position pairs, keyed by {@code symbol-LONG-SHORT}.
 * An entry must be written when a pair opens and removed when it closes.
 */
public interface PositionTimeTracker {

    void recordOpen(String positionKey);

    /**
     * For pairs found already open, with the time the exchange reports
     */
    void recordOpen(String positionKey, Instant openedAt);

    void removeOpen(String positionKey);

    /**
     * Empty when the pair was never recorded
     */
    OptionalDouble ageHours(String positionKey);

    Set<String> getTrackedKeys();
}
