package com.execmetrics.config;

import com.execmetrics.domain.enums.SlippageSignConvention;
import java.time.Duration;
import java.util.Set;
import lombok.Builder;
import lombok.Value;

/**
 * Parameters of a metrics run, passed explicitly into the engine.
 *
 * <p>Empty phase/state sets disable the corresponding filter. Defaults suit unit tests; the
 * batch application binds its values from {@link ExecMetricsProperties}.
 */
@Value
@Builder
public class EngineConfig {

    /** Maximum distance between an execution and a market observation used to price it. */
    @Builder.Default
    Duration tolerance = Duration.ofSeconds(5);

    /** Distance either side of an execution at which additional quote snapshots are taken. */
    @Builder.Default
    Duration quoteOffset = Duration.ofSeconds(1);

    @Builder.Default
    SlippageSignConvention signConvention = SlippageSignConvention.FAVORABLE_POSITIVE;

    /** Execution phases that are measured. Executions with no phase are always measured. */
    @Builder.Default
    Set<String> includedPhases = Set.of();

    /** Market states whose observations may serve as benchmarks. */
    @Builder.Default
    Set<String> includedMarketStates = Set.of();

    /** Resolve executions on the common fork-join pool. */
    @Builder.Default
    boolean parallel = false;

    public static EngineConfig defaults() {
        return EngineConfig.builder().build();
    }
}
