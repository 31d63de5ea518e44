package com.execmetrics.engine;

import com.execmetrics.aggregation.MetricsAggregator;
import com.execmetrics.catalog.InstrumentCatalog;
import com.execmetrics.config.EngineConfig;
import com.execmetrics.domain.enums.SkipReason;
import com.execmetrics.domain.model.DatasetProfile;
import com.execmetrics.domain.model.Execution;
import com.execmetrics.domain.model.MetricRecord;
import com.execmetrics.domain.model.SkippedExecution;
import com.execmetrics.marketdata.MarketSeriesIndex;
import com.execmetrics.metrics.ExecutionOutcome;
import com.execmetrics.metrics.ExecutionResolver;
import com.execmetrics.metrics.MetricCalculator;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point of the metrics computation.
 *
 * <p>A run has two phases:
 * <ul>
 *   <li><b>Load:</b> builds the {@link InstrumentCatalog} and {@link MarketSeriesIndex}. Any
 *       data integrity failure propagates and aborts the run with no partial report.</li>
 *   <li><b>Compute:</b> resolves every execution independently through an
 *       {@link ExecutionResolver} and folds the records into a {@link MetricsAggregator}.
 *       Per-execution failures become skipped rows and never stop the batch.</li>
 * </ul>
 *
 * <p>Resolution is a pure function of the execution and the two read-only lookups, so with
 * {@link EngineConfig#isParallel()} executions are resolved on a parallel stream. Aggregation
 * is order-independent, so the report is the same either way.
 */
@Service
public class ExecutionMetricsEngine {

    private static final Logger log = LoggerFactory.getLogger(ExecutionMetricsEngine.class);

    private final DatasetProfiler datasetProfiler;

    public ExecutionMetricsEngine(DatasetProfiler datasetProfiler) {
        this.datasetProfiler = datasetProfiler;
    }

    public ExecutionMetricsReport run(MetricsInput input, EngineConfig config) {
        InstrumentCatalog catalog = InstrumentCatalog.from(input.getInstruments());
        MarketSeriesIndex seriesIndex =
                MarketSeriesIndex.build(input.getObservations(), config.getIncludedMarketStates());

        DatasetProfile profile = datasetProfiler.profile(input.getExecutions(), input.getObservations());

        List<SkippedExecution> skipped = new ArrayList<>(input.getRejectedExecutions());
        List<Execution> executions = dropDuplicateIds(input.getExecutions(), skipped);

        ExecutionResolver resolver =
                new ExecutionResolver(catalog, seriesIndex, new MetricCalculator(config.getSignConvention()), config);

        Stream<Execution> stream = config.isParallel() ? executions.parallelStream() : executions.stream();
        List<ExecutionOutcome> outcomes = stream.map(resolver::resolve).toList();

        List<MetricRecord> details = new ArrayList<>();
        MetricsAggregator aggregator = new MetricsAggregator();
        for (ExecutionOutcome outcome : outcomes) {
            if (outcome.isMeasured()) {
                details.add(outcome.getRecord());
                aggregator.accept(outcome.getRecord());
            } else {
                skipped.add(outcome.getSkipped());
            }
        }

        ExecutionMetricsReport report = ExecutionMetricsReport.builder()
                .aggregates(aggregator.rows())
                .details(details)
                .skipped(skipped)
                .profile(profile)
                .build();

        log.info(
                "Metrics computed: {} executions measured, {} skipped, {} aggregate rows",
                details.size(),
                skipped.size(),
                report.getAggregates().size());
        for (Map.Entry<SkipReason, Long> entry : report.skipCounts().entrySet()) {
            log.warn("Skipped {} executions: {}", entry.getValue(), entry.getKey().getDescription());
        }
        return report;
    }

    // Keeps the first execution for each id; later ones are skipped
    private List<Execution> dropDuplicateIds(List<Execution> executions, List<SkippedExecution> skipped) {
        Set<String> seen = new HashSet<>();
        List<Execution> unique = new ArrayList<>(executions.size());
        for (Execution execution : executions) {
            if (execution.getExecutionId() != null && !seen.add(execution.getExecutionId())) {
                skipped.add(ExecutionOutcome.skipped(execution, SkipReason.DUPLICATE_EXECUTION, "repeated id")
                        .getSkipped());
                continue;
            }
            unique.add(execution);
        }
        return unique;
    }
}
