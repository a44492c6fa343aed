package com.lux032.stemgenerator.exception;

/**
 * 显式指定的后端不存在或当前不可用
 */
public class EngineUnavailableException extends StemGeneratorException {

    private final String engineName;

    public EngineUnavailableException(String engineName) {
        super("Requested engine is not available: " + engineName);
        this.engineName = engineName;
    }

    public String getEngineName() {
        return engineName;
    }
}
