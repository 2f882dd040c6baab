package ru.fundingengine.dto.funding;

public enum CycleStatus {
    //No exchange returned usable data
    NO_DATA,
    //Data was fetched but nothing deserved capital: deliberate zero risk
    NO_OPPORTUNITIES,
    ALLOCATED
}
