package com.execmetrics.catalog;

import com.execmetrics.domain.model.Instrument;
import com.execmetrics.exception.DataIntegrityException;
import java.math.BigDecimal;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Read-only mapping from instrument identifier to reference attributes.
 *
 * <p>Built once from the reference dataset. Duplicate identifiers abort the load: two rows for
 * the same instrument cannot be reconciled without guessing which multiplier or currency is
 * correct.
 */
public final class InstrumentCatalog {

    private static final Logger log = LoggerFactory.getLogger(InstrumentCatalog.class);

    private final Map<String, Instrument> instrumentsById;

    private InstrumentCatalog(Map<String, Instrument> instrumentsById) {
        this.instrumentsById = Collections.unmodifiableMap(instrumentsById);
    }

    /**
     * Builds the catalog, validating every row.
     *
     * @throws DataIntegrityException on a duplicate id, a missing id or currency, or a
     *     non-positive multiplier or tick size
     */
    public static InstrumentCatalog from(List<Instrument> instruments) {
        Map<String, Instrument> byId = new HashMap<>();
        for (Instrument instrument : instruments) {
            validate(instrument);
            Instrument previous = byId.putIfAbsent(instrument.getInstrumentId(), instrument);
            if (previous != null) {
                throw new DataIntegrityException(
                        "Duplicate instrument id in reference data: " + instrument.getInstrumentId(),
                        Map.of("instrumentId", instrument.getInstrumentId()));
            }
        }
        log.info("Instrument catalog built with {} instruments", byId.size());
        return new InstrumentCatalog(byId);
    }

    public Optional<Instrument> lookup(String instrumentId) {
        if (instrumentId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(instrumentsById.get(instrumentId));
    }

    public boolean contains(String instrumentId) {
        return instrumentId != null && instrumentsById.containsKey(instrumentId);
    }

    public int size() {
        return instrumentsById.size();
    }

    private static void validate(Instrument instrument) {
        String id = instrument.getInstrumentId();
        if (id == null || id.isBlank()) {
            throw new DataIntegrityException("Reference data row without instrument id");
        }
        if (instrument.getCurrency() == null || instrument.getCurrency().isBlank()) {
            throw new DataIntegrityException("Instrument " + id + " has no currency", Map.of("instrumentId", id));
        }
        requirePositive(id, "multiplier", instrument.getMultiplier());
        requirePositive(id, "tick size", instrument.getTickSize());
    }

    private static void requirePositive(String instrumentId, String field, BigDecimal value) {
        if (value == null || value.signum() <= 0) {
            throw new DataIntegrityException(
                    String.format("Instrument %s has non-positive %s: %s", instrumentId, field, value),
                    Map.of("instrumentId", instrumentId, "field", field));
        }
    }
}
