package com.execmetrics.metrics;

import com.execmetrics.catalog.InstrumentCatalog;
import com.execmetrics.config.EngineConfig;
import com.execmetrics.domain.enums.SkipReason;
import com.execmetrics.domain.model.Execution;
import com.execmetrics.domain.model.Instrument;
import com.execmetrics.domain.model.MarketObservation;
import com.execmetrics.exception.ValidationException;
import com.execmetrics.marketdata.BenchmarkResolution;
import com.execmetrics.marketdata.MarketSeriesIndex;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns one execution into a metric record or a skip.
 *
 * <p>Reads only the immutable catalog and index, so calls are independent of each other and
 * safe to run concurrently. Checks run in order: structural validation, trading phase,
 * instrument lookup, benchmark resolution, metric computation. The first failure decides the
 * skip reason. Quotes are read at the execution time and one quote offset either side of it.
 */
public class ExecutionResolver {

    private static final Logger log = LoggerFactory.getLogger(ExecutionResolver.class);

    private final InstrumentCatalog catalog;
    private final MarketSeriesIndex seriesIndex;
    private final MetricCalculator calculator;
    private final EngineConfig config;

    public ExecutionResolver(
            InstrumentCatalog catalog, MarketSeriesIndex seriesIndex, MetricCalculator calculator, EngineConfig config) {
        this.catalog = catalog;
        this.seriesIndex = seriesIndex;
        this.calculator = calculator;
        this.config = config;
    }

    public ExecutionOutcome resolve(Execution execution) {
        try {
            ExecutionValidator.validate(execution);

            if (!isPhaseIncluded(execution)) {
                return skip(execution, SkipReason.EXCLUDED_PHASE, "phase " + execution.getPhase());
            }

            Optional<Instrument> instrument = catalog.lookup(execution.getInstrumentId());
            if (instrument.isEmpty()) {
                return skip(execution, SkipReason.UNKNOWN_INSTRUMENT, execution.getInstrumentId());
            }

            BenchmarkResolution benchmark = seriesIndex.resolveBenchmark(
                    execution.getInstrumentId(), execution.getTimestamp(), config.getTolerance());
            if (!benchmark.isResolved()) {
                return skip(execution, benchmark.getUnresolvedReason(), "at " + execution.getTimestamp());
            }

            LocalDateTime time = execution.getTimestamp();
            Duration offset = config.getQuoteOffset();

            return ExecutionOutcome.measured(calculator.compute(
                    execution,
                    instrument.get(),
                    benchmark.getPrice(),
                    benchmark.getMethod(),
                    quoteAt(execution, time),
                    quoteAt(execution, time.minus(offset)),
                    quoteAt(execution, time.plus(offset))));
        } catch (ValidationException e) {
            return skip(execution, e.getReason(), e.getMessage());
        }
    }

    private MarketObservation quoteAt(Execution execution, LocalDateTime time) {
        return seriesIndex
                .prevailingQuote(execution.getInstrumentId(), time, config.getTolerance())
                .orElse(null);
    }

    private boolean isPhaseIncluded(Execution execution) {
        return config.getIncludedPhases().isEmpty()
                || execution.getPhase() == null
                || config.getIncludedPhases().contains(execution.getPhase());
    }

    private ExecutionOutcome skip(Execution execution, SkipReason reason, String detail) {
        log.debug("Skipping execution {}: {} ({})", execution.getExecutionId(), reason.getDescription(), detail);
        return ExecutionOutcome.skipped(execution, reason, detail);
    }
}
