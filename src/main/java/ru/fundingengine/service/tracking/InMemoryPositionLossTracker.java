package ru.fundingengine.service.tracking;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import ru.fundingengine.dto.funding.OpenPositionPair;
import ru.fundingengine.dto.funding.RemainingBreakEven;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
@Component
public class InMemoryPositionLossTracker implements PositionLossTracker {

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    @Autowired
    public InMemoryPositionLossTracker() {
        this(Clock.systemUTC());
    }

    public InMemoryPositionLossTracker(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void recordEntryCosts(String positionKey, double entryCostsUsd, double exitCostsUsd) {
        recordEntryCosts(positionKey, entryCostsUsd, exitCostsUsd, clock.instant());
    }

    @Override
    public void recordEntryCosts(String positionKey, double entryCostsUsd, double exitCostsUsd, Instant openedAt) {
        entries.put(positionKey, new Entry(openedAt, entryCostsUsd + exitCostsUsd, clock.instant()));
        log.debug("[LossTracker] {} costs recorded: ${}", positionKey,
                String.format("%.4f", entryCostsUsd + exitCostsUsd));
    }

    @Override
    public boolean isTracked(String positionKey) {
        return entries.containsKey(positionKey);
    }

    @Override
    public void recordFunding(String positionKey, double amountUsd) {
        Entry entry = entries.get(positionKey);
        if (entry == null) {
            log.debug("[LossTracker] Funding for untracked {}", positionKey);
            return;
        }
        entry.addFunding(amountUsd);
    }

    @Override
    public void accrueFunding(String positionKey, double hourlyFundingUsd) {
        Entry entry = entries.get(positionKey);
        if (entry == null) {
            log.debug("[LossTracker] Accrual for untracked {}", positionKey);
            return;
        }
        double credited = entry.accrue(hourlyFundingUsd, clock.instant());
        log.debug("[LossTracker] {} accrued ${} at ${}/h", positionKey,
                String.format("%.4f", credited), String.format("%.4f", hourlyFundingUsd));
    }

    @Override
    public RemainingBreakEven getRemainingBreakEvenHours(OpenPositionPair position,
                                                         double currentHourlyRate,
                                                         double positionValueUsd) {
        Entry entry = entries.get(position.getKey());
        if (entry == null) {
            return RemainingBreakEven.untracked();
        }

        double hoursHeld = hoursBetween(entry.openedAt, clock.instant());
        double earned = entry.getFundingEarned();
        double remainingCost = entry.totalCosts - earned;
        double hourlyReturn = currentHourlyRate * positionValueUsd;

        double remainingHours;
        if (remainingCost <= 0) {
            remainingHours = 0.0;
        } else if (hourlyReturn <= 0) {
            remainingHours = Double.POSITIVE_INFINITY;
        } else {
            remainingHours = remainingCost / hourlyReturn;
        }

        return RemainingBreakEven.builder()
                .remainingBreakEvenHours(remainingHours)
                .remainingCost(remainingCost)
                .feesEarnedSoFar(earned)
                .hoursHeld(hoursHeld)
                .build();
    }

    @Override
    public void remove(String positionKey) {
        entries.remove(positionKey);
    }

    private static double hoursBetween(Instant from, Instant to) {
        return Duration.between(from, to).toMillis() / 3_600_000.0;
    }

    private static class Entry {
        private final Instant openedAt;
        private final double totalCosts;
        private double fundingEarned;
        private Instant lastAccrualAt;

        Entry(Instant openedAt, double totalCosts, Instant lastAccrualAt) {
            this.openedAt = openedAt;
            this.totalCosts = totalCosts;
            this.lastAccrualAt = lastAccrualAt;
        }

        synchronized void addFunding(double amount) {
            fundingEarned += amount;
        }

        synchronized double accrue(double hourlyAmount, Instant now) {
            double credited = hourlyAmount * Math.max(0.0, hoursBetween(lastAccrualAt, now));
            fundingEarned += credited;
            lastAccrualAt = now;
            return credited;
        }

        synchronized double getFundingEarned() {
            return fundingEarned;
        }
    }
}
