package com.execmetrics.domain.enums;

/** Dimension an {@code AggregateRow} is grouped by. Declaration order is report order. */
public enum GroupDimension {
    OVERALL,
    INSTRUMENT,
    SIDE,
    VENUE
}
