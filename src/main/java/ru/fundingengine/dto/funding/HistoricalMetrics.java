package ru.fundingengine.dto.funding;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class HistoricalMetrics {
    double minRate;
    double averageRate;
    double maxRate;
    //0..1, share of periods where the rate kept its sign
    double consistencyScore;
}
