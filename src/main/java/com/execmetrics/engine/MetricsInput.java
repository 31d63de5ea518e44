package com.execmetrics.engine;

import com.execmetrics.domain.model.Execution;
import com.execmetrics.domain.model.Instrument;
import com.execmetrics.domain.model.MarketObservation;
import com.execmetrics.domain.model.SkippedExecution;
import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * The three datasets of a run, fully loaded.
 *
 * <p>{@code rejectedExecutions} holds execution rows the loader could not parse; they are
 * carried into the report's skipped table.
 */
@Value
@Builder
public class MetricsInput {

    @Singular
    List<Instrument> instruments;

    @Singular
    List<MarketObservation> observations;

    @Singular
    List<Execution> executions;

    @Singular
    List<SkippedExecution> rejectedExecutions;
}
