package ru.fundingengine.dto.exchanges.aster;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.OptionalDouble;

@Data
public class PremiumIndexResponse {
    private String symbol;

    @JsonProperty("markPrice")
    private String markPrice;

    @JsonProperty("indexPrice")
    private String indexPrice;

    @JsonProperty("lastFundingRate")
    private String lastFundingRate;

    @JsonProperty("nextFundingTime")
    private long nextFundingTime;

    private long time;

    public OptionalDouble getLastFundingRateAsDouble() {
        return parse(lastFundingRate);
    }

    public OptionalDouble getMarkPriceAsDouble() {
        return parse(markPrice);
    }

    //Empty instead of 0.0: a failed parse is not a zero funding rate
    private static OptionalDouble parse(String value) {
        if (value == null || value.isBlank()) {
            return OptionalDouble.empty();
        }
        try {
            return OptionalDouble.of(Double.parseDouble(value));
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }
}
