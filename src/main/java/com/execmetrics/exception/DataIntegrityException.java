package com.execmetrics.exception;

import java.util.Map;

/**
 * Reference or market data that is malformed or contradicts itself.
 *
 * <p>Fatal to the run: metrics computed against ambiguous reference data would be
 * unreliable, so no report is produced.
 */
public class DataIntegrityException extends BaseException {

    public DataIntegrityException(String message) {
        super(ErrorCode.DATA_INTEGRITY, message);
    }

    public DataIntegrityException(String message, Map<String, Object> details) {
        super(ErrorCode.DATA_INTEGRITY, message, details);
    }

    public DataIntegrityException(String message, Throwable cause) {
        super(ErrorCode.DATA_INTEGRITY, message, cause);
    }
}
