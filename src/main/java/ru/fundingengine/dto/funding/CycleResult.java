package ru.fundingengine.dto.funding;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class CycleResult {
    CycleStatus status;
    List<ArbitrageOpportunity> discovered;
    List<EvaluatedOpportunity> evaluated;
    PositionFilterResult positionDecisions;
    LadderAllocationResult allocation;
    Instant startedAt;
    Instant finishedAt;
}
