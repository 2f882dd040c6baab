package ru.fundingengine.dto.funding;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class OpportunityScore {
    double score;
    double spreadScore;
    double confidenceScore;
    double breakEvenScore;
    double liquidityScore;
    Recommendation recommendation;
    String reason;
}
