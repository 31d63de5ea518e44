package com.execmetrics.aggregation;

import com.execmetrics.domain.model.AggregateRow;
import com.execmetrics.domain.model.GroupKey;
import com.execmetrics.domain.model.MetricRecord;
import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Folds metric records into per-group summaries.
 *
 * <p>Every record contributes to the overall group, its instrument, its side and, when known,
 * its venue. Each group keeps exact {@link BigDecimal} sums of quantity, notional,
 * quantity*slippage and quantity*bps; weighted averages are divided out once in {@link #rows()}.
 * BigDecimal addition is exact, so the rows do not depend on the order records arrive in and
 * partial aggregators can be merged with {@link #combine(MetricsAggregator)}.
 *
 * <p>Not thread-safe. Parallel callers give each partition its own aggregator and combine them.
 */
public class MetricsAggregator {

    private final Map<GroupKey, Accumulator> accumulators = new TreeMap<>();

    public MetricsAggregator() {
        accumulators.put(GroupKey.OVERALL, new Accumulator());
    }

    public void accept(MetricRecord record) {
        accumulate(GroupKey.OVERALL, record);
        accumulate(GroupKey.instrument(record.getInstrumentId()), record);
        accumulate(GroupKey.side(record.getSide().name()), record);
        if (record.getVenue() != null) {
            accumulate(GroupKey.venue(record.getVenue()), record);
        }
    }

    public void acceptAll(Iterable<MetricRecord> records) {
        for (MetricRecord record : records) {
            accept(record);
        }
    }

    /** Merges another aggregator's state into this one and returns this. */
    public MetricsAggregator combine(MetricsAggregator other) {
        other.accumulators.forEach((key, acc) ->
                accumulators.computeIfAbsent(key, k -> new Accumulator()).merge(acc));
        return this;
    }

    /** One row per group: overall first, then instruments, sides and venues sorted by key. */
    public List<AggregateRow> rows() {
        List<AggregateRow> rows = new ArrayList<>(accumulators.size());
        accumulators.forEach((key, acc) -> rows.add(acc.toRow(key)));
        return rows;
    }

    public AggregateRow overall() {
        return accumulators.get(GroupKey.OVERALL).toRow(GroupKey.OVERALL);
    }

    private void accumulate(GroupKey key, MetricRecord record) {
        accumulators.computeIfAbsent(key, k -> new Accumulator()).add(record);
    }

    private static final class Accumulator {

        private long count;
        private BigDecimal quantity = BigDecimal.ZERO;
        private BigDecimal notional = BigDecimal.ZERO;
        private BigDecimal weightedSlippage = BigDecimal.ZERO;
        private BigDecimal weightedSlippageBps = BigDecimal.ZERO;
        private final Set<String> currencies = new HashSet<>();

        void add(MetricRecord record) {
            count++;
            quantity = quantity.add(record.getQuantity());
            notional = notional.add(record.getNotional());
            weightedSlippage = weightedSlippage.add(record.getSlippage().multiply(record.getQuantity()));
            weightedSlippageBps = weightedSlippageBps.add(record.getSlippageBps().multiply(record.getQuantity()));
            currencies.add(record.getCurrency());
        }

        void merge(Accumulator other) {
            if (other.count == 0) {
                return;
            }
            count += other.count;
            quantity = quantity.add(other.quantity);
            notional = notional.add(other.notional);
            weightedSlippage = weightedSlippage.add(other.weightedSlippage);
            weightedSlippageBps = weightedSlippageBps.add(other.weightedSlippageBps);
            currencies.addAll(other.currencies);
        }

        AggregateRow toRow(GroupKey key) {
            return AggregateRow.builder()
                    .key(key)
                    .currency(currencies.size() == 1 ? currencies.iterator().next() : null)
                    .executionCount(count)
                    .totalQuantity(quantity)
                    .totalNotional(notional)
                    .weightedSlippage(weightedAverage(weightedSlippage))
                    .weightedSlippageBps(weightedAverage(weightedSlippageBps))
                    .build();
        }

        private BigDecimal weightedAverage(BigDecimal weightedSum) {
            if (quantity.signum() == 0) {
                return BigDecimal.ZERO;
            }
            return weightedSum.divide(quantity, MathContext.DECIMAL64);
        }
    }
}
