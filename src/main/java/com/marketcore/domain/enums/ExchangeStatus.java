package com.marketcore.domain.enums;

public enum ExchangeStatus {
    OPEN,
    CLOSED
}
