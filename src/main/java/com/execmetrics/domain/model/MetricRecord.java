package com.execmetrics.domain.model;

import com.execmetrics.domain.enums.BenchmarkMethod;
import com.execmetrics.domain.enums.Side;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * Execution-quality metrics for one successfully resolved execution.
 *
 * <p>Slippage is sign-adjusted per the configured convention; with the default convention a
 * positive value is favorable to the trader regardless of side.
 */
@Value
@Builder
public class MetricRecord {

    String executionId;
    String instrumentId;
    String currency;
    Side side;
    BigDecimal quantity;
    BigDecimal executionPrice;
    LocalDateTime executionTime;
    String venue;

    /** Reference identifiers of the instrument, null when the reference file has none. */
    String isin;
    String ticker;
    String primaryMic;

    BigDecimal benchmarkPrice;
    BenchmarkMethod benchmarkMethod;

    /** (execution price - benchmark) * side sign, in price units. */
    BigDecimal slippage;

    BigDecimal slippageBps;

    /** quantity * price * multiplier. */
    BigDecimal notional;

    /** Quote prevailing at execution time. Null when none was within tolerance. */
    QuoteSnapshot quote;

    /** Quote prevailing one quote offset before the execution. */
    QuoteSnapshot quoteBefore;

    /** Quote prevailing one quote offset after the execution. */
    QuoteSnapshot quoteAfter;

    /**
     * Fraction of the prevailing spread captured: 1.0 means filled at the far touch in the
     * trader's favor, 0.0 at the near touch. Null without a usable two-sided quote.
     */
    BigDecimal spreadCapture;
}
