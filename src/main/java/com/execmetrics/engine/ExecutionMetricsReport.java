package com.execmetrics.engine;

import com.execmetrics.domain.enums.SkipReason;
import com.execmetrics.domain.model.AggregateRow;
import com.execmetrics.domain.model.DatasetProfile;
import com.execmetrics.domain.model.MetricRecord;
import com.execmetrics.domain.model.SkippedExecution;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/** Everything a run produces: aggregates, per-execution detail and skipped executions. */
@Value
@Builder
public class ExecutionMetricsReport {

    List<AggregateRow> aggregates;
    List<MetricRecord> details;
    List<SkippedExecution> skipped;
    DatasetProfile profile;

    /** Number of skipped executions per reason, in reason declaration order. */
    public Map<SkipReason, Long> skipCounts() {
        Map<SkipReason, Long> counts = new EnumMap<>(SkipReason.class);
        for (SkippedExecution skippedExecution : skipped) {
            counts.merge(skippedExecution.getReason(), 1L, Long::sum);
        }
        return counts;
    }

    public AggregateRow overall() {
        return aggregates.get(0);
    }
}
