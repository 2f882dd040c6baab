package ru.fundingengine.event;

import lombok.AllArgsConstructor;
import lombok.Getter;
import ru.fundingengine.dto.funding.OpenPositionPair;

@Getter
@AllArgsConstructor
public class PositionCloseDecisionEvent {
    private final OpenPositionPair position;
    private final String reason;
}
