package ru.fundingengine.dto.exchanges.aster;

import lombok.Data;

@Data
public class OpenInterestResponse {
    private String symbol;
    //Base asset units
    private String openInterest;
    private long time;
}
