package com.lux032.stemgenerator.model;

import lombok.Data;

import java.nio.file.Path;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 一次分离的结果
 * 后端只填写 success / stems / processingTimeSeconds / engine / errorMessage,
 * 其余字段由流水线补充
 */
@Data
public class SeparationResult {
    public static final String ENGINE_NONE = "none";
    public static final String ENGINE_CACHED = "cached";

    private boolean success;
    private Map<StemType, Path> stems = new EnumMap<>(StemType.class);
    private double processingTimeSeconds;
    private String engine;
    private String errorMessage;

    private Path sourceFile;
    private Path outputDirectory;
    private Map<String, Double> qualityScores = new LinkedHashMap<>();
    private String fallbackEngine; // 触发过回退时的回退后端
    private String fallbackError;  // 回退失败原因

    public static SeparationResult success(String engine, Map<StemType, Path> stems, double seconds) {
        SeparationResult result = new SeparationResult();
        result.setSuccess(true);
        result.setEngine(engine);
        result.getStems().putAll(stems);
        result.setProcessingTimeSeconds(seconds);
        return result;
    }

    public static SeparationResult failure(String engine, String errorMessage, double seconds) {
        SeparationResult result = new SeparationResult();
        result.setSuccess(false);
        result.setEngine(engine);
        result.setErrorMessage(errorMessage);
        result.setProcessingTimeSeconds(seconds);
        return result;
    }

    public boolean isCached() {
        return ENGINE_CACHED.equals(engine);
    }
}
