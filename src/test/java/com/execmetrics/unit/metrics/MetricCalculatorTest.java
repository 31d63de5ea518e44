package com.execmetrics.unit.metrics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.execmetrics.domain.enums.BenchmarkMethod;
import com.execmetrics.domain.enums.Side;
import com.execmetrics.domain.enums.SkipReason;
import com.execmetrics.domain.enums.SlippageSignConvention;
import com.execmetrics.domain.model.Execution;
import com.execmetrics.domain.model.Instrument;
import com.execmetrics.domain.model.MarketObservation;
import com.execmetrics.domain.model.MetricRecord;
import com.execmetrics.exception.ValidationException;
import com.execmetrics.metrics.MetricCalculator;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for MetricCalculator verifying notional, signed slippage, basis points and
 * spread capture against hand-computed values.
 *
 * <p>Reference trade: BUY 50 XYZ @ 103 against a benchmark of 105.
 * Slippage = (103 - 105) * -1 = +2, bps = 2 / 105 * 10,000 = 190.476..., notional = 5,150.
 */
class MetricCalculatorTest {

    private static final LocalDateTime TIME = LocalDateTime.of(2024, 3, 1, 9, 0, 15);

    private MetricCalculator calculator;
    private Instrument xyz;

    @BeforeEach
    void setUp() {
        calculator = new MetricCalculator(SlippageSignConvention.FAVORABLE_POSITIVE);
        xyz = Instrument.builder()
                .instrumentId("XYZ")
                .currency("USD")
                .multiplier(BigDecimal.ONE)
                .tickSize(new BigDecimal("0.01"))
                .build();
    }

    @Nested
    @DisplayName("Core formulas")
    class Formulas {

        @Test
        @DisplayName("Reference buy: slippage +2, notional 5150, bps ~190.48")
        void referenceBuy() {
            MetricRecord record = calculator.compute(execution(Side.BUY, "50", "103"), xyz, new BigDecimal("105"));

            assertThat(record.getSlippage()).isEqualByComparingTo("2");
            assertThat(record.getNotional()).isEqualByComparingTo("5150");
            assertThat(record.getSlippageBps().doubleValue()).isCloseTo(190.476, within(0.001));
            assertThat(record.getBenchmarkPrice()).isEqualByComparingTo("105");
            assertThat(record.getCurrency()).isEqualTo("USD");
        }

        @Test
        @DisplayName("Notional applies the instrument multiplier")
        void notionalUsesMultiplier() {
            Instrument future = Instrument.builder()
                    .instrumentId("FUT")
                    .currency("EUR")
                    .multiplier(new BigDecimal("25"))
                    .tickSize(new BigDecimal("0.5"))
                    .build();

            MetricRecord record =
                    calculator.compute(execution(Side.SELL, "4", "4500.5"), future, new BigDecimal("4500"));

            // 4 * 4500.5 * 25 = 450,050
            assertThat(record.getNotional()).isEqualByComparingTo("450050");
        }

        @Test
        @DisplayName("Buy below and sell above the benchmark are both favorable (positive)")
        void favorableIsPositiveForBothSides() {
            MetricRecord buy = calculator.compute(execution(Side.BUY, "10", "99"), xyz, new BigDecimal("100"));
            MetricRecord sell = calculator.compute(execution(Side.SELL, "10", "101"), xyz, new BigDecimal("100"));

            assertThat(buy.getSlippage()).isPositive();
            assertThat(sell.getSlippage()).isPositive();
            assertThat(buy.getSlippageBps()).isEqualByComparingTo("100");
            assertThat(sell.getSlippageBps()).isEqualByComparingTo("100");
        }

        @Test
        @DisplayName("Buy above the benchmark is adverse (negative)")
        void adverseBuyIsNegative() {
            MetricRecord buy = calculator.compute(execution(Side.BUY, "10", "101"), xyz, new BigDecimal("100"));

            assertThat(buy.getSlippage()).isEqualByComparingTo("-1");
        }

        @Test
        @DisplayName("Adverse-positive convention flips the sign")
        void adversePositiveConvention() {
            MetricCalculator costCalculator = new MetricCalculator(SlippageSignConvention.ADVERSE_POSITIVE);

            MetricRecord buy = costCalculator.compute(execution(Side.BUY, "10", "101"), xyz, new BigDecimal("100"));

            assertThat(buy.getSlippage()).isEqualByComparingTo("1");
        }

        @Test
        @DisplayName("Benchmark method is carried onto the record")
        void carriesBenchmarkMethod() {
            MetricRecord record = calculator.compute(
                    execution(Side.BUY, "10", "100"), xyz, new BigDecimal("100"), BenchmarkMethod.EXACT, null);

            assertThat(record.getBenchmarkMethod()).isEqualTo(BenchmarkMethod.EXACT);
            assertThat(record.getSpreadCapture()).isNull();
        }
    }

    @Nested
    @DisplayName("Edge cases")
    class EdgeCases {

        @Test
        @DisplayName("Zero benchmark is rejected, not reported as zero slippage")
        void zeroBenchmark() {
            assertThatThrownBy(() -> calculator.compute(execution(Side.BUY, "10", "100"), xyz, BigDecimal.ZERO))
                    .isInstanceOf(ValidationException.class)
                    .satisfies(e -> assertThat(((ValidationException) e).getReason())
                            .isEqualTo(SkipReason.ZERO_BENCHMARK));
        }

        @Test
        @DisplayName("Zero quantity is a validation failure")
        void zeroQuantity() {
            assertThatThrownBy(() -> calculator.compute(execution(Side.BUY, "0", "100"), xyz, new BigDecimal("100")))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("quantity");
        }

        @Test
        @DisplayName("Negative price is a validation failure")
        void negativePrice() {
            assertThatThrownBy(() -> calculator.compute(execution(Side.SELL, "5", "-1"), xyz, new BigDecimal("100")))
                    .isInstanceOf(ValidationException.class)
                    .satisfies(e -> assertThat(((ValidationException) e).getReason())
                            .isEqualTo(SkipReason.INVALID_EXECUTION));
        }
    }

    @Nested
    @DisplayName("Spread capture")
    class SpreadCapture {

        private final MarketObservation quote = MarketObservation.builder()
                .instrumentId("XYZ")
                .timestamp(TIME)
                .bid(new BigDecimal("10.4"))
                .ask(new BigDecimal("10.6"))
                .volume(BigDecimal.ZERO)
                .build();

        @Test
        @DisplayName("Buy at mid captures half the spread")
        void buyAtMid() {
            MetricRecord record = calculator.compute(
                    execution(Side.BUY, "100", "10.5"), xyz, new BigDecimal("10.5"), BenchmarkMethod.EXACT, quote);

            assertThat(record.getSpreadCapture()).isEqualByComparingTo("0.5");
            assertThat(record.getQuote().getBid()).isEqualByComparingTo("10.4");
            assertThat(record.getQuote().getAsk()).isEqualByComparingTo("10.6");
            assertThat(record.getQuote().getMid()).isEqualByComparingTo("10.5");
        }

        @Test
        @DisplayName("Sell at the ask captures the full spread")
        void sellAtAsk() {
            MetricRecord record = calculator.compute(
                    execution(Side.SELL, "50", "10.6"), xyz, new BigDecimal("10.5"), BenchmarkMethod.EXACT, quote);

            assertThat(record.getSpreadCapture()).isEqualByComparingTo("1");
        }

        @Test
        @DisplayName("Locked quote gives no spread capture")
        void lockedQuote() {
            MarketObservation locked = MarketObservation.builder()
                    .instrumentId("XYZ")
                    .timestamp(TIME)
                    .bid(new BigDecimal("10.5"))
                    .ask(new BigDecimal("10.5"))
                    .volume(BigDecimal.ZERO)
                    .build();

            MetricRecord record = calculator.compute(
                    execution(Side.BUY, "1", "10.5"), xyz, new BigDecimal("10.5"), BenchmarkMethod.EXACT, locked);

            assertThat(record.getSpreadCapture()).isNull();
        }
    }

    @Nested
    @DisplayName("Quote snapshots and identifiers")
    class Snapshots {

        @Test
        @DisplayName("Quotes either side of the execution are recorded with their midpoints")
        void quotesAroundExecution() {
            MarketObservation before = quote(TIME.minusSeconds(1), "10.2", "10.4");
            MarketObservation at = quote(TIME, "10.4", "10.6");
            MarketObservation after = quote(TIME.plusSeconds(1), "10.5", "10.8");

            MetricRecord record = calculator.compute(
                    execution(Side.BUY, "100", "10.5"),
                    xyz,
                    new BigDecimal("10.5"),
                    BenchmarkMethod.EXACT,
                    at,
                    before,
                    after);

            assertThat(record.getQuoteBefore().getMid()).isEqualByComparingTo("10.3");
            assertThat(record.getQuoteBefore().getObservedAt()).isEqualTo(TIME.minusSeconds(1));
            assertThat(record.getQuote().getMid()).isEqualByComparingTo("10.5");
            assertThat(record.getQuoteAfter().getBid()).isEqualByComparingTo("10.5");
            assertThat(record.getQuoteAfter().getMid()).isEqualByComparingTo("10.65");
        }

        @Test
        @DisplayName("One-sided or missing quotes leave the snapshot empty")
        void oneSidedQuote() {
            MarketObservation bidOnly = MarketObservation.builder()
                    .instrumentId("XYZ")
                    .timestamp(TIME)
                    .bid(new BigDecimal("10.4"))
                    .volume(BigDecimal.ZERO)
                    .build();

            MetricRecord record = calculator.compute(
                    execution(Side.SELL, "100", "10.5"), xyz, new BigDecimal("10.5"), BenchmarkMethod.EXACT, bidOnly);

            assertThat(record.getQuote()).isNull();
            assertThat(record.getQuoteBefore()).isNull();
            assertThat(record.getQuoteAfter()).isNull();
            assertThat(record.getSpreadCapture()).isNull();
        }

        @Test
        @DisplayName("Reference identifiers of the instrument are carried onto the record")
        void referenceIdentifiers() {
            Instrument listed = Instrument.builder()
                    .instrumentId("SAP")
                    .currency("EUR")
                    .multiplier(BigDecimal.ONE)
                    .tickSize(new BigDecimal("0.01"))
                    .isin("DE0007164600")
                    .ticker("SAP")
                    .primaryMic("XETR")
                    .build();

            MetricRecord record = calculator.compute(execution(Side.BUY, "10", "120"), listed, new BigDecimal("121"));

            assertThat(record.getIsin()).isEqualTo("DE0007164600");
            assertThat(record.getTicker()).isEqualTo("SAP");
            assertThat(record.getPrimaryMic()).isEqualTo("XETR");
            assertThat(record.getCurrency()).isEqualTo("EUR");
        }

        private MarketObservation quote(LocalDateTime timestamp, String bid, String ask) {
            return MarketObservation.builder()
                    .instrumentId("XYZ")
                    .timestamp(timestamp)
                    .bid(new BigDecimal(bid))
                    .ask(new BigDecimal(ask))
                    .volume(BigDecimal.ZERO)
                    .build();
        }
    }

    private Execution execution(Side side, String quantity, String price) {
        return Execution.builder()
                .executionId("E-1")
                .instrumentId("XYZ")
                .side(side)
                .quantity(new BigDecimal(quantity))
                .price(new BigDecimal(price))
                .timestamp(TIME)
                .build();
    }
}
