package ru.fundingengine.dto.exchanges.aster;

import lombok.Data;

@Data
public class AsterBookTicker {
    private String symbol;
    private String bidPrice;
    private String bidQty;
    private String askPrice;
    private String askQty;
    private Long time;
}
