package com.execmetrics.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Why an execution produced no metric record. The description is what the skipped table shows. */
@Getter
@RequiredArgsConstructor
public enum SkipReason {
    MALFORMED_ROW("malformed row"),
    INVALID_EXECUTION("invalid execution"),
    DUPLICATE_EXECUTION("duplicate execution id"),
    EXCLUDED_PHASE("excluded trading phase"),
    UNKNOWN_INSTRUMENT("unknown instrument"),
    NO_MARKET_DATA("no market data for instrument"),
    OUTSIDE_TOLERANCE("no observation within tolerance"),
    ZERO_BENCHMARK("benchmark price is zero");

    private final String description;
}
