package com.lux032.stemgenerator.exception;

/**
 * 自动选择时没有任何可用后端
 */
public class NoEngineAvailableException extends StemGeneratorException {

    public NoEngineAvailableException() {
        super("No stem separation engines available");
    }
}
