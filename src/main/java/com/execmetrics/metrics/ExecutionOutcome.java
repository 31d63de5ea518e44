package com.execmetrics.metrics;

import com.execmetrics.domain.enums.SkipReason;
import com.execmetrics.domain.model.Execution;
import com.execmetrics.domain.model.MetricRecord;
import com.execmetrics.domain.model.SkippedExecution;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/** Result of resolving one execution: exactly one of {@code record} and {@code skipped} is set. */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ExecutionOutcome {

    MetricRecord record;
    SkippedExecution skipped;

    public static ExecutionOutcome measured(MetricRecord record) {
        return new ExecutionOutcome(record, null);
    }

    public static ExecutionOutcome skipped(Execution execution, SkipReason reason, String detail) {
        return new ExecutionOutcome(
                null,
                SkippedExecution.builder()
                        .executionId(execution.getExecutionId())
                        .instrumentId(execution.getInstrumentId())
                        .reason(reason)
                        .detail(detail)
                        .build());
    }

    public boolean isMeasured() {
        return record != null;
    }
}
