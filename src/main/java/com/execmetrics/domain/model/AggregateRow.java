package com.execmetrics.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Summary of all metric records sharing a {@link GroupKey}.
 *
 * <p>Weighted averages use quantity as the weight. Currency is null when the group mixes
 * instruments quoted in different currencies.
 */
@Value
@Builder
public class AggregateRow {

    GroupKey key;
    String currency;
    long executionCount;
    BigDecimal totalQuantity;
    BigDecimal totalNotional;
    BigDecimal weightedSlippage;
    BigDecimal weightedSlippageBps;
}
