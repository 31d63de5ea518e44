package com.execmetrics.exception;

public class DatasetIoException extends BaseException {

    public DatasetIoException(String message, Throwable cause) {
        super(ErrorCode.IO_ERROR, message, cause);
    }
}
