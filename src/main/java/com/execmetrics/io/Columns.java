package com.execmetrics.io;

/** CSV header names shared by the loader and the report writer. */
final class Columns {

    static final String EXECUTION_ID = "execution_id";
    static final String INSTRUMENT_ID = "instrument_id";
    static final String SIDE = "side";
    static final String QUANTITY = "quantity";
    static final String PRICE = "price";
    static final String TIMESTAMP = "timestamp";
    static final String VENUE = "venue";
    static final String PHASE = "phase";

    static final String CURRENCY = "currency";
    static final String MULTIPLIER = "multiplier";
    static final String TICK_SIZE = "tick_size";
    static final String ISIN = "isin";
    static final String TICKER = "ticker";
    static final String PRIMARY_MIC = "primary_mic";

    static final String BID = "bid";
    static final String ASK = "ask";
    static final String LAST = "last";
    static final String VOLUME = "volume";
    static final String MARKET_STATE = "market_state";

    private Columns() {}
}
