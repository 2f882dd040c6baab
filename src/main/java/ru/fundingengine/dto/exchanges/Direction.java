package ru.fundingengine.dto.exchanges;

public enum Direction {
    LONG,
    SHORT
}
