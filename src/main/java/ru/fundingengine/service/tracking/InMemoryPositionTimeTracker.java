package ru.fundingengine.service.tracking;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
@Component
public class InMemoryPositionTimeTracker implements PositionTimeTracker {

    private final Map<String, Instant> openTimes = new ConcurrentHashMap<>();
    private final Clock clock;

    @Autowired
    public InMemoryPositionTimeTracker() {
        this(Clock.systemUTC());
    }

    public InMemoryPositionTimeTracker(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void recordOpen(String positionKey) {
        recordOpen(positionKey, clock.instant());
    }

    @Override
    public void recordOpen(String positionKey, Instant openedAt) {
        openTimes.put(positionKey, openedAt);
        log.debug("[PositionTime] Recorded open for {} at {}", positionKey, openedAt);
    }

    @Override
    public void removeOpen(String positionKey) {
        if (openTimes.remove(positionKey) != null) {
            log.debug("[PositionTime] Removed {}", positionKey);
        }
    }

    @Override
    public OptionalDouble ageHours(String positionKey) {
        Instant openedAt = openTimes.get(positionKey);
        if (openedAt == null) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(Duration.between(openedAt, clock.instant()).toMillis() / 3_600_000.0);
    }

    @Override
    public Set<String> getTrackedKeys() {
        return Set.copyOf(openTimes.keySet());
    }
}
