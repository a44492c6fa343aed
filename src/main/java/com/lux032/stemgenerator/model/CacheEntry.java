package com.lux032.stemgenerator.model;

import lombok.Data;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.Map;

/**
 * 内容缓存条目,stemPaths 中的路径均位于 entryDirectory 内
 */
@Data
public class CacheEntry {
    private String fileHash;
    private String engineId;
    private LocalDateTime createdAt;
    private Path entryDirectory;
    private Map<StemType, Path> stemPaths = new EnumMap<>(StemType.class);
    private Map<String, Double> qualityScores;
}
