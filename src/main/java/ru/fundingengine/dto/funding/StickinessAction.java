package ru.fundingengine.dto.funding;

public enum StickinessAction {
    KEEP,
    CLOSE,
    REPLACE
}
