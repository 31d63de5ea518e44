package com.execmetrics.marketdata;

import com.execmetrics.domain.enums.BenchmarkMethod;
import com.execmetrics.domain.enums.SkipReason;
import com.execmetrics.domain.model.MarketObservation;
import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Observations of a single instrument in strictly ascending timestamp order.
 *
 * <p>Lookups binary-search the insertion point of the target timestamp and then walk outwards,
 * skipping observations that carry no usable price, until a candidate is found or the walk
 * leaves the tolerance window.
 */
public final class MarketSeries {

    private final String instrumentId;
    private final List<MarketObservation> observations;

    /** Caller guarantees ascending, unique timestamps. */
    MarketSeries(String instrumentId, List<MarketObservation> observations) {
        this.instrumentId = instrumentId;
        this.observations = List.copyOf(observations);
    }

    public String getInstrumentId() {
        return instrumentId;
    }

    public List<MarketObservation> getObservations() {
        return observations;
    }

    public int size() {
        return observations.size();
    }

    public LocalDateTime firstTimestamp() {
        return observations.get(0).getTimestamp();
    }

    public LocalDateTime lastTimestamp() {
        return observations.get(observations.size() - 1).getTimestamp();
    }

    /**
     * Resolves the benchmark price at {@code timestamp}.
     *
     * <p>Bracketing candidates are interpolated linearly by elapsed time. With only one candidate
     * inside the tolerance window its price is used as-is; there is no extrapolation.
     */
    public BenchmarkResolution resolve(LocalDateTime timestamp, Duration tolerance) {
        MarketObservation before = nearestAtOrBefore(timestamp, tolerance, false);
        MarketObservation after = nearestAtOrAfter(timestamp, tolerance);

        if (before == null && after == null) {
            return BenchmarkResolution.unresolved(SkipReason.OUTSIDE_TOLERANCE);
        }
        if (after == null) {
            return BenchmarkResolution.resolved(before.usablePrice(), BenchmarkMethod.NEAREST_BEFORE);
        }
        if (before == null) {
            return BenchmarkResolution.resolved(after.usablePrice(), BenchmarkMethod.NEAREST_AFTER);
        }
        if (before == after) {
            return BenchmarkResolution.resolved(before.usablePrice(), BenchmarkMethod.EXACT);
        }
        return BenchmarkResolution.resolved(interpolate(before, after, timestamp), BenchmarkMethod.INTERPOLATED);
    }

    /** Latest two-sided quote at or before {@code timestamp} within the tolerance window. */
    public Optional<MarketObservation> prevailingQuote(LocalDateTime timestamp, Duration tolerance) {
        return Optional.ofNullable(nearestAtOrBefore(timestamp, tolerance, true));
    }

    static BigDecimal interpolate(MarketObservation before, MarketObservation after, LocalDateTime timestamp) {
        BigDecimal p0 = before.usablePrice();
        BigDecimal p1 = after.usablePrice();
        long elapsed = Duration.between(before.getTimestamp(), timestamp).toNanos();
        long span = Duration.between(before.getTimestamp(), after.getTimestamp()).toNanos();
        BigDecimal fraction = BigDecimal.valueOf(elapsed).divide(BigDecimal.valueOf(span), MathContext.DECIMAL128);
        return p0.add(p1.subtract(p0).multiply(fraction, MathContext.DECIMAL128), MathContext.DECIMAL128);
    }

    private MarketObservation nearestAtOrBefore(LocalDateTime timestamp, Duration tolerance, boolean requireQuote) {
        for (int i = upperBound(timestamp) - 1; i >= 0; i--) {
            MarketObservation candidate = observations.get(i);
            if (Duration.between(candidate.getTimestamp(), timestamp).compareTo(tolerance) > 0) {
                return null;
            }
            if (requireQuote ? candidate.hasQuote() : candidate.hasUsablePrice()) {
                return candidate;
            }
        }
        return null;
    }

    private MarketObservation nearestAtOrAfter(LocalDateTime timestamp, Duration tolerance) {
        for (int i = lowerBound(timestamp); i < observations.size(); i++) {
            MarketObservation candidate = observations.get(i);
            if (Duration.between(timestamp, candidate.getTimestamp()).compareTo(tolerance) > 0) {
                return null;
            }
            if (candidate.hasUsablePrice()) {
                return candidate;
            }
        }
        return null;
    }

    // First index whose timestamp is >= target
    private int lowerBound(LocalDateTime target) {
        int lo = 0;
        int hi = observations.size();
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (observations.get(mid).getTimestamp().isBefore(target)) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }

    // First index whose timestamp is > target
    private int upperBound(LocalDateTime target) {
        int lo = 0;
        int hi = observations.size();
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (observations.get(mid).getTimestamp().isAfter(target)) {
                hi = mid;
            } else {
                lo = mid + 1;
            }
        }
        return lo;
    }
}
