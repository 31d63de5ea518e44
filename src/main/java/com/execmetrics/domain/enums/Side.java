package com.execmetrics.domain.enums;

/** Buy or sell side of an execution. */
public enum Side {
    BUY,
    SELL
}
