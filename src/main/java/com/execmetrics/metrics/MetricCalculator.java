package com.execmetrics.metrics;

import com.execmetrics.domain.enums.BenchmarkMethod;
import com.execmetrics.domain.enums.Side;
import com.execmetrics.domain.enums.SkipReason;
import com.execmetrics.domain.enums.SlippageSignConvention;
import com.execmetrics.domain.model.Execution;
import com.execmetrics.domain.model.Instrument;
import com.execmetrics.domain.model.MarketObservation;
import com.execmetrics.domain.model.MetricRecord;
import com.execmetrics.domain.model.QuoteSnapshot;
import com.execmetrics.exception.ValidationException;
import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Derives execution-quality metrics for one execution against its benchmark.
 *
 * <p>Formulas:
 * <ul>
 *   <li><b>Notional:</b> quantity * price * instrument multiplier</li>
 *   <li><b>Slippage:</b> (price - benchmark) * side sign, where the sign comes from the
 *       configured {@link SlippageSignConvention}</li>
 *   <li><b>Slippage bps:</b> slippage / benchmark * 10,000</li>
 *   <li><b>Spread capture:</b> BUY (ask - price) / (ask - bid), SELL (price - bid) / (ask - bid),
 *       against the quote prevailing at execution time</li>
 * </ul>
 *
 * <p>The record also carries bid, ask and mid snapshots at execution time and one quote offset
 * either side of it.
 *
 * <p>A zero benchmark makes bps undefined, so the execution is rejected rather than reported
 * with a zero.
 */
public class MetricCalculator {

    private static final BigDecimal BPS = BigDecimal.valueOf(10_000);

    private final SlippageSignConvention signConvention;

    public MetricCalculator(SlippageSignConvention signConvention) {
        this.signConvention = signConvention;
    }

    public MetricRecord compute(Execution execution, Instrument instrument, BigDecimal benchmarkPrice) {
        return compute(execution, instrument, benchmarkPrice, null, null);
    }

    public MetricRecord compute(
            Execution execution,
            Instrument instrument,
            BigDecimal benchmarkPrice,
            BenchmarkMethod method,
            MarketObservation prevailingQuote) {
        return compute(execution, instrument, benchmarkPrice, method, prevailingQuote, null, null);
    }

    /**
     * Computes the metric record.
     *
     * @param method how the benchmark was derived, null if not known
     * @param prevailingQuote two-sided quote at execution time, null if none
     * @param quoteBefore two-sided quote prevailing shortly before the execution, null if none
     * @param quoteAfter two-sided quote prevailing shortly after the execution, null if none
     * @throws ValidationException if the execution has a non-positive quantity or price, or the
     *     benchmark is zero
     */
    public MetricRecord compute(
            Execution execution,
            Instrument instrument,
            BigDecimal benchmarkPrice,
            BenchmarkMethod method,
            MarketObservation prevailingQuote,
            MarketObservation quoteBefore,
            MarketObservation quoteAfter) {
        ExecutionValidator.requirePositiveQuantityAndPrice(execution);
        if (benchmarkPrice == null || benchmarkPrice.signum() == 0) {
            throw new ValidationException(
                    SkipReason.ZERO_BENCHMARK,
                    "Benchmark price is zero for execution " + execution.getExecutionId());
        }

        BigDecimal quantity = execution.getQuantity();
        BigDecimal price = execution.getPrice();

        BigDecimal notional = quantity.multiply(price).multiply(instrument.getMultiplier());
        BigDecimal slippage =
                price.subtract(benchmarkPrice).multiply(BigDecimal.valueOf(signConvention.sideSign(execution.getSide())));
        BigDecimal slippageBps = slippage.multiply(BPS).divide(benchmarkPrice, MathContext.DECIMAL64);

        return MetricRecord.builder()
                .executionId(execution.getExecutionId())
                .instrumentId(execution.getInstrumentId())
                .currency(instrument.getCurrency())
                .side(execution.getSide())
                .quantity(quantity)
                .executionPrice(price)
                .executionTime(execution.getTimestamp())
                .venue(execution.getVenue())
                .isin(instrument.getIsin())
                .ticker(instrument.getTicker())
                .primaryMic(instrument.getPrimaryMic())
                .benchmarkPrice(benchmarkPrice)
                .benchmarkMethod(method)
                .slippage(slippage)
                .slippageBps(slippageBps)
                .notional(notional)
                .quote(QuoteSnapshot.of(prevailingQuote))
                .quoteBefore(QuoteSnapshot.of(quoteBefore))
                .quoteAfter(QuoteSnapshot.of(quoteAfter))
                .spreadCapture(spreadCapture(execution.getSide(), price, prevailingQuote))
                .build();
    }

    /** Null when there is no two-sided quote or the spread is locked (bid == ask). */
    BigDecimal spreadCapture(Side side, BigDecimal price, MarketObservation quote) {
        if (quote == null || !quote.hasQuote()) {
            return null;
        }
        BigDecimal spread = quote.getAsk().subtract(quote.getBid());
        if (spread.signum() == 0) {
            return null;
        }
        BigDecimal captured = side == Side.BUY ? quote.getAsk().subtract(price) : price.subtract(quote.getBid());
        return captured.divide(spread, MathContext.DECIMAL64);
    }
}
