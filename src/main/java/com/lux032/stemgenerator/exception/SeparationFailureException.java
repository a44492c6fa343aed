package com.lux032.stemgenerator.exception;

/**
 * 后端执行失败
 * 后端内部使用,对外统一转换为失败的 SeparationResult
 */
public class SeparationFailureException extends StemGeneratorException {

    private final String engineName;

    public SeparationFailureException(String message, String engineName) {
        super(message + " (engine: " + engineName + ")");
        this.engineName = engineName;
    }

    public SeparationFailureException(String message, String engineName, Throwable cause) {
        super(message + " (engine: " + engineName + ")", cause);
        this.engineName = engineName;
    }

    public String getEngineName() {
        return engineName;
    }
}
