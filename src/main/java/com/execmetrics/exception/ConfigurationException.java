package com.execmetrics.exception;

/** A configured engine parameter is out of range. Aborts the run before any data is read. */
public class ConfigurationException extends BaseException {

    public ConfigurationException(String message) {
        super(ErrorCode.CONFIGURATION, message);
    }
}
