package ru.fundingengine.dto.funding;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class PositionFilterResult {
    List<OpenPositionPair> toClose;
    List<OpenPositionPair> toKeep;
    //symbol -> reason
    Map<String, String> reasons;
}
