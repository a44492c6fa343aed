package com.lux032.stemgenerator.exception;

/**
 * 任务台账读写失败
 */
public class LedgerException extends StemGeneratorException {

    public LedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
