package com.execmetrics.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Static reference attributes of a traded instrument.
 *
 * <p>Built once from the reference dataset and owned by the {@code InstrumentCatalog}.
 * The multiplier scales a raw price into notional (e.g. a futures contract size); both it and
 * the tick size must be strictly positive.
 */
@Value
@Builder
public class Instrument {

    String instrumentId;

    /** ISO currency code the instrument is quoted in, e.g. "EUR". */
    String currency;

    BigDecimal multiplier;

    /** Minimum price increment. */
    BigDecimal tickSize;

    /** Optional identifiers carried through from the reference file. */
    String isin;

    String ticker;

    /** Market identifier code of the primary listing, e.g. "XETR". */
    String primaryMic;
}
