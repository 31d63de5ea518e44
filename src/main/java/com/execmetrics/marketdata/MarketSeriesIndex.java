package com.execmetrics.marketdata;

import com.execmetrics.domain.enums.SkipReason;
import com.execmetrics.domain.model.MarketObservation;
import com.execmetrics.exception.DataIntegrityException;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-instrument ordered market series, built once and read-only afterwards.
 *
 * <p>Build rules:
 * <ul>
 *   <li>Observations outside the included market states are dropped (null state is kept)</li>
 *   <li>A missing instrument or timestamp is a data integrity error</li>
 *   <li>bid &gt; ask or negative volume on a kept observation is a data integrity error</li>
 *   <li>Same instrument and timestamp with identical prices: de-duplicated, first row kept</li>
 *   <li>Same instrument and timestamp with different prices: data integrity error</li>
 * </ul>
 */
public final class MarketSeriesIndex {

    private static final Logger log = LoggerFactory.getLogger(MarketSeriesIndex.class);

    private final Map<String, MarketSeries> seriesByInstrument;

    private MarketSeriesIndex(Map<String, MarketSeries> seriesByInstrument) {
        this.seriesByInstrument = Map.copyOf(seriesByInstrument);
    }

    public static MarketSeriesIndex build(Collection<MarketObservation> observations) {
        return build(observations, Set.of());
    }

    /**
     * Builds the index.
     *
     * @param includedMarketStates market states to keep; empty keeps every observation
     * @throws DataIntegrityException if any group is malformed or ambiguous
     */
    public static MarketSeriesIndex build(Collection<MarketObservation> observations, Set<String> includedMarketStates) {
        Map<String, List<MarketObservation>> grouped = new LinkedHashMap<>();
        int filtered = 0;
        for (MarketObservation observation : observations) {
            if (observation.getInstrumentId() == null || observation.getTimestamp() == null) {
                throw new DataIntegrityException("Market observation without instrument id or timestamp: " + observation);
            }
            if (!isIncluded(observation, includedMarketStates)) {
                filtered++;
                continue;
            }
            validate(observation);
            grouped.computeIfAbsent(observation.getInstrumentId(), k -> new ArrayList<>())
                    .add(observation);
        }

        Map<String, MarketSeries> series = new HashMap<>();
        int duplicates = 0;
        for (Map.Entry<String, List<MarketObservation>> entry : grouped.entrySet()) {
            List<MarketObservation> group = entry.getValue();
            // Stable sort keeps input order among equal timestamps, so "first row kept" holds
            group.sort(Comparator.comparing(MarketObservation::getTimestamp));
            List<MarketObservation> unique = new ArrayList<>(group.size());
            for (MarketObservation observation : group) {
                MarketObservation previous = unique.isEmpty() ? null : unique.get(unique.size() - 1);
                if (previous != null && previous.getTimestamp().equals(observation.getTimestamp())) {
                    if (!previous.hasSamePricesAs(observation)) {
                        throw new DataIntegrityException(
                                String.format(
                                        "Conflicting market observations for %s at %s",
                                        entry.getKey(), observation.getTimestamp()),
                                Map.of("instrumentId", entry.getKey(), "timestamp", observation.getTimestamp()));
                    }
                    duplicates++;
                    log.debug("Dropped duplicate observation for {} at {}", entry.getKey(), observation.getTimestamp());
                    continue;
                }
                unique.add(observation);
            }
            series.put(entry.getKey(), new MarketSeries(entry.getKey(), unique));
        }

        log.info(
                "Market series index built: {} instruments, {} observations ({} filtered by market state, {} duplicates dropped)",
                series.size(),
                observations.size() - filtered - duplicates,
                filtered,
                duplicates);
        return new MarketSeriesIndex(series);
    }

    /**
     * Resolves the benchmark price for an instrument at a point in time.
     *
     * @return a resolved price, or {@link SkipReason#NO_MARKET_DATA} / {@link SkipReason#OUTSIDE_TOLERANCE}
     */
    public BenchmarkResolution resolveBenchmark(String instrumentId, LocalDateTime timestamp, Duration tolerance) {
        MarketSeries series = seriesByInstrument.get(instrumentId);
        if (series == null) {
            return BenchmarkResolution.unresolved(SkipReason.NO_MARKET_DATA);
        }
        return series.resolve(timestamp, tolerance);
    }

    public Optional<MarketObservation> prevailingQuote(String instrumentId, LocalDateTime timestamp, Duration tolerance) {
        MarketSeries series = seriesByInstrument.get(instrumentId);
        if (series == null) {
            return Optional.empty();
        }
        return series.prevailingQuote(timestamp, tolerance);
    }

    public Optional<MarketSeries> series(String instrumentId) {
        return Optional.ofNullable(seriesByInstrument.get(instrumentId));
    }

    public Collection<MarketSeries> allSeries() {
        return seriesByInstrument.values();
    }

    public int instrumentCount() {
        return seriesByInstrument.size();
    }

    private static boolean isIncluded(MarketObservation observation, Set<String> includedMarketStates) {
        return includedMarketStates == null
                || includedMarketStates.isEmpty()
                || observation.getMarketState() == null
                || includedMarketStates.contains(observation.getMarketState());
    }

    // Crossed quotes are legitimate outside continuous trading, so this only runs on kept observations
    private static void validate(MarketObservation observation) {
        if (observation.hasQuote() && observation.getBid().compareTo(observation.getAsk()) > 0) {
            throw new DataIntegrityException(
                    String.format(
                            "Crossed quote for %s at %s: bid %s > ask %s",
                            observation.getInstrumentId(),
                            observation.getTimestamp(),
                            observation.getBid(),
                            observation.getAsk()),
                    Map.of("instrumentId", observation.getInstrumentId(), "timestamp", observation.getTimestamp()));
        }
        if (observation.getVolume() != null && observation.getVolume().signum() < 0) {
            throw new DataIntegrityException(String.format(
                    "Negative volume for %s at %s", observation.getInstrumentId(), observation.getTimestamp()));
        }
    }
}
