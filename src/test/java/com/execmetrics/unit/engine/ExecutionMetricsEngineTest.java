package com.execmetrics.unit.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.execmetrics.config.EngineConfig;
import com.execmetrics.domain.enums.GroupDimension;
import com.execmetrics.domain.enums.Side;
import com.execmetrics.domain.enums.SkipReason;
import com.execmetrics.domain.model.AggregateRow;
import com.execmetrics.domain.model.Execution;
import com.execmetrics.domain.model.Instrument;
import com.execmetrics.domain.model.MarketObservation;
import com.execmetrics.domain.model.MetricRecord;
import com.execmetrics.domain.model.SkippedExecution;
import com.execmetrics.engine.DatasetProfiler;
import com.execmetrics.engine.ExecutionMetricsEngine;
import com.execmetrics.engine.ExecutionMetricsReport;
import com.execmetrics.engine.MetricsInput;
import com.execmetrics.exception.DataIntegrityException;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for ExecutionMetricsEngine covering the full compute phase: the reference
 * scenario, skip accounting, fatal integrity failures and parallel resolution.
 */
class ExecutionMetricsEngineTest {

    private static final LocalDateTime BASE = LocalDateTime.of(2024, 3, 1, 9, 0, 0);

    private ExecutionMetricsEngine engine;
    private EngineConfig config;

    @BeforeEach
    void setUp() {
        engine = new ExecutionMetricsEngine(new DatasetProfiler());
        config = EngineConfig.builder().tolerance(Duration.ofSeconds(10)).build();
    }

    @Nested
    @DisplayName("Reference scenario")
    class ReferenceScenario {

        @Test
        @DisplayName("Interpolated buy is measured and the unknown instrument is skipped")
        void measuredAndSkipped() {
            MetricsInput input = baseInput()
                    .execution(execution("E-1", "XYZ", Side.BUY, "50", "103", 15))
                    .execution(execution("E-2", "UNKNOWN", Side.SELL, "10", "50", 15))
                    .build();

            ExecutionMetricsReport report = engine.run(input, config);

            assertThat(report.getDetails()).hasSize(1);
            MetricRecord record = report.getDetails().get(0);
            assertThat(record.getBenchmarkPrice()).isEqualByComparingTo("105");
            assertThat(record.getSlippage()).isEqualByComparingTo("2");
            assertThat(record.getNotional()).isEqualByComparingTo("5150");
            assertThat(record.getSlippageBps().doubleValue()).isCloseTo(190.48, within(0.01));

            assertThat(report.getSkipped())
                    .singleElement()
                    .satisfies(s -> {
                        assertThat(s.getExecutionId()).isEqualTo("E-2");
                        assertThat(s.getReason().getDescription()).isEqualTo("unknown instrument");
                    });
            assertThat(report.skipCounts()).containsExactly(Map.entry(SkipReason.UNKNOWN_INSTRUMENT, 1L));

            AggregateRow overall = report.overall();
            assertThat(overall.getExecutionCount()).isEqualTo(1);
            assertThat(report.getAggregates())
                    .noneMatch(r -> "UNKNOWN".equals(r.getKey().getValue()));
        }

        @Test
        @DisplayName("Overall count equals the number of measured records")
        void overallCountMatchesDetails() {
            MetricsInput input = baseInput()
                    .execution(execution("E-1", "XYZ", Side.BUY, "50", "103", 15))
                    .execution(execution("E-2", "XYZ", Side.SELL, "20", "109", 19))
                    .execution(execution("E-3", "XYZ", Side.SELL, "-5", "109", 19))
                    .execution(execution("E-4", "XYZ", Side.BUY, "5", "100", 300))
                    .build();

            ExecutionMetricsReport report = engine.run(input, config);

            assertThat(report.overall().getExecutionCount()).isEqualTo(report.getDetails().size()).isEqualTo(2);
            long instrumentCount = report.getAggregates().stream()
                    .filter(r -> r.getKey().getDimension() == GroupDimension.INSTRUMENT)
                    .mapToLong(AggregateRow::getExecutionCount)
                    .sum();
            assertThat(instrumentCount).isEqualTo(2);
            assertThat(report.skipCounts())
                    .containsEntry(SkipReason.INVALID_EXECUTION, 1L)
                    .containsEntry(SkipReason.OUTSIDE_TOLERANCE, 1L);
        }

        @Test
        @DisplayName("Empty execution set produces a zero overall row")
        void noExecutions() {
            ExecutionMetricsReport report = engine.run(baseInput().build(), config);

            assertThat(report.getAggregates()).hasSize(1);
            assertThat(report.overall().getExecutionCount()).isZero();
            assertThat(report.overall().getWeightedSlippage()).isEqualByComparingTo("0");
            assertThat(report.getProfile().getExecutionCount()).isZero();
        }
    }

    @Nested
    @DisplayName("Skip accounting")
    class SkipAccounting {

        @Test
        @DisplayName("Repeated execution id keeps the first and skips the rest")
        void duplicateExecutionIds() {
            MetricsInput input = baseInput()
                    .execution(execution("E-1", "XYZ", Side.BUY, "50", "103", 15))
                    .execution(execution("E-1", "XYZ", Side.BUY, "70", "104", 16))
                    .build();

            ExecutionMetricsReport report = engine.run(input, config);

            assertThat(report.getDetails()).singleElement()
                    .satisfies(r -> assertThat(r.getQuantity()).isEqualByComparingTo("50"));
            assertThat(report.skipCounts()).containsEntry(SkipReason.DUPLICATE_EXECUTION, 1L);
        }

        @Test
        @DisplayName("Rows rejected by the loader are carried into the skipped table")
        void loaderRejectionsAreReported() {
            MetricsInput input = baseInput()
                    .rejectedExecution(SkippedExecution.builder()
                            .executionId("E-9")
                            .reason(SkipReason.MALFORMED_ROW)
                            .detail("line 3: price is not a number")
                            .build())
                    .build();

            ExecutionMetricsReport report = engine.run(input, config);

            assertThat(report.getSkipped()).extracting(SkippedExecution::getExecutionId).containsExactly("E-9");
            assertThat(report.skipCounts()).containsEntry(SkipReason.MALFORMED_ROW, 1L);
        }

        @Test
        @DisplayName("Instrument without market data is skipped with its own reason")
        void noMarketData() {
            MetricsInput input = baseInput()
                    .instrument(instrument("ABC", "USD", "1"))
                    .execution(execution("E-1", "ABC", Side.BUY, "5", "10", 15))
                    .build();

            ExecutionMetricsReport report = engine.run(input, config);

            assertThat(report.getSkipped()).singleElement()
                    .satisfies(s -> assertThat(s.getReason()).isEqualTo(SkipReason.NO_MARKET_DATA));
        }
    }

    @Nested
    @DisplayName("Fatal data integrity failures")
    class IntegrityFailures {

        @Test
        @DisplayName("Duplicate instrument aborts the run")
        void duplicateInstrument() {
            MetricsInput input = baseInput()
                    .instrument(instrument("XYZ", "EUR", "2"))
                    .execution(execution("E-1", "XYZ", Side.BUY, "50", "103", 15))
                    .build();

            assertThatThrownBy(() -> engine.run(input, config)).isInstanceOf(DataIntegrityException.class);
        }

        @Test
        @DisplayName("Conflicting observations abort the run")
        void conflictingObservations() {
            MetricsInput input = baseInput()
                    .observation(observation("XYZ", 10, "101"))
                    .execution(execution("E-1", "XYZ", Side.BUY, "50", "103", 15))
                    .build();

            assertThatThrownBy(() -> engine.run(input, config))
                    .isInstanceOf(DataIntegrityException.class)
                    .satisfies(e -> assertThat(((DataIntegrityException) e).getExitCode()).isEqualTo(2));
        }
    }

    @Test
    @DisplayName("Parallel resolution produces the same report as sequential")
    void parallelMatchesSequential() {
        MetricsInput.MetricsInputBuilder builder = baseInput();
        List<Execution> executions = new ArrayList<>();
        for (int i = 0; i < 400; i++) {
            Side side = i % 2 == 0 ? Side.BUY : Side.SELL;
            String instrumentId = i % 5 == 0 ? "UNKNOWN" : "XYZ";
            executions.add(execution("E-" + i, instrumentId, side, String.valueOf(1 + i), "104", 10 + i % 11));
        }
        MetricsInput input = builder.executions(executions).build();

        ExecutionMetricsReport sequential = engine.run(input, config);
        ExecutionMetricsReport parallel =
                engine.run(input, EngineConfig.builder().tolerance(Duration.ofSeconds(10)).parallel(true).build());

        assertThat(parallel.getAggregates()).isEqualTo(sequential.getAggregates());
        assertThat(parallel.skipCounts()).isEqualTo(sequential.skipCounts());
        assertThat(sortById(parallel.getDetails())).isEqualTo(sortById(sequential.getDetails()));
    }

    private List<MetricRecord> sortById(List<MetricRecord> records) {
        return records.stream().sorted(Comparator.comparing(MetricRecord::getExecutionId)).toList();
    }

    private MetricsInput.MetricsInputBuilder baseInput() {
        return MetricsInput.builder()
                .instrument(instrument("XYZ", "USD", "1"))
                .observation(observation("XYZ", 10, "100"))
                .observation(observation("XYZ", 20, "110"));
    }

    private Instrument instrument(String id, String currency, String multiplier) {
        return Instrument.builder()
                .instrumentId(id)
                .currency(currency)
                .multiplier(new BigDecimal(multiplier))
                .tickSize(new BigDecimal("0.01"))
                .build();
    }

    private MarketObservation observation(String instrumentId, int seconds, String last) {
        return MarketObservation.builder()
                .instrumentId(instrumentId)
                .timestamp(BASE.plusSeconds(seconds))
                .last(new BigDecimal(last))
                .volume(BigDecimal.valueOf(100))
                .build();
    }

    private Execution execution(String id, String instrumentId, Side side, String qty, String price, int seconds) {
        return Execution.builder()
                .executionId(id)
                .instrumentId(instrumentId)
                .side(side)
                .quantity(new BigDecimal(qty))
                .price(new BigDecimal(price))
                .timestamp(BASE.plusSeconds(seconds))
                .venue("XNAS")
                .build();
    }
}
