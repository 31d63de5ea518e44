package com.execmetrics.io;

/** A CSV row whose fields cannot be converted to the typed entity. */
class MalformedRowException extends RuntimeException {

    MalformedRowException(String message) {
        super(message);
    }

    MalformedRowException(String message, Throwable cause) {
        super(message, cause);
    }
}
