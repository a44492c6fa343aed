package com.lux032.stemgenerator.exception;

/**
 * 分轨系统异常基类
 */
public class StemGeneratorException extends RuntimeException {

    public StemGeneratorException(String message) {
        super(message);
    }

    public StemGeneratorException(String message, Throwable cause) {
        super(message, cause);
    }

    public StemGeneratorException(Throwable cause) {
        super(cause);
    }
}
