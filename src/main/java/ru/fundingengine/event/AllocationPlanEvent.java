package ru.fundingengine.event;

import lombok.AllArgsConstructor;
import lombok.Getter;
import ru.fundingengine.dto.funding.LadderAllocationResult;

import java.time.Instant;

/**
 * Published after each cycle that allocated capital; consumed by the execution layer.
 */
@Getter
@AllArgsConstructor
public class AllocationPlanEvent {
    private final LadderAllocationResult allocation;
    private final Instant createdAt;
}
