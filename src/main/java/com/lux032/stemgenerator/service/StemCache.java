package com.lux032.stemgenerator.service;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.lux032.stemgenerator.exception.CacheCorruptionException;
import com.lux032.stemgenerator.exception.PathTraversalException;
import com.lux032.stemgenerator.model.CacheEntry;
import com.lux032.stemgenerator.model.StemType;
import com.lux032.stemgenerator.util.FileHashUtils;
import com.lux032.stemgenerator.util.I18nUtil;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * 分轨内容缓存
 * 以 (文件内容哈希, 后端) 为键保存一次完整分离的四条分轨,避免重复计算
 *
 * <p>每个条目是缓存目录下的一个子目录 {@code <hash>_<engine>},
 * 其中的 {@code cache_meta.json} 最后写入;没有元数据的目录视为未完成条目。</p>
 */
@Slf4j
public class StemCache {

    public static final String META_FILE = "cache_meta.json";

    private final Path cacheDirectory;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public StemCache(String cacheDirectory) {
        this(cacheDirectory, Clock.systemDefaultZone());
    }

    StemCache(String cacheDirectory, Clock clock) {
        this.cacheDirectory = Paths.get(cacheDirectory).toAbsolutePath().normalize();
        this.clock = clock;
        this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

        try {
            Files.createDirectories(this.cacheDirectory);
        } catch (IOException e) {
            throw new UncheckedIOException("无法创建缓存目录: " + cacheDirectory, e);
        }
        log.info(I18nUtil.getMessage("cache.initialized"), this.cacheDirectory);
    }

    /**
     * 查找缓存条目
     * 元数据缺失或损坏、分轨缺失、路径越界的条目会被清除并按未命中处理
     */
    public Optional<CacheEntry> get(String fileHash, String engineId) {
        Path entryDir = entryDirectory(fileHash, engineId);
        Path metaFile = entryDir.resolve(META_FILE);
        if (!Files.isRegularFile(metaFile)) {
            if (Files.isDirectory(entryDir)) {
                // 写入中断留下的残缺条目
                log.warn("缓存条目缺少元数据,已清除: {}", entryDir.getFileName());
                deleteRecursively(entryDir);
            }
            return Optional.empty();
        }

        try {
            CacheEntry entry = loadEntry(entryDir);
            log.info("缓存命中: {} ({})", FileHashUtils.shortHash(fileHash), engineId);
            return Optional.of(entry);
        } catch (CacheCorruptionException | PathTraversalException e) {
            log.warn("缓存条目无效,已清除: {} - {}", entryDir.getFileName(), e.getMessage());
            LogCollector.warn(I18nUtil.getMessage("cache.entry.invalid", entryDir.getFileName()));
            deleteRecursively(entryDir);
            return Optional.empty();
        }
    }

    public Optional<CacheEntry> get(Path audioFile, String engineId) throws IOException {
        return get(FileHashUtils.sha256(audioFile), engineId);
    }

    /**
     * 写入缓存: 先复制分轨,最后写元数据
     * @param stems 必须包含全部四条分轨
     */
    public CacheEntry put(String fileHash, String engineId, Map<StemType, Path> stems,
                          Map<String, Double> qualityScores) throws IOException {
        for (StemType type : StemType.values()) {
            Path source = stems.get(type);
            if (source == null || !Files.isRegularFile(source)) {
                throw new IllegalArgumentException("Missing stem for cache: " + type.getStemName());
            }
        }

        Path entryDir = entryDirectory(fileHash, engineId);
        Files.createDirectories(entryDir);
        // 覆盖写入前先移除旧元数据,中途失败时条目保持未命中状态
        Files.deleteIfExists(entryDir.resolve(META_FILE));

        CacheMeta meta = new CacheMeta();
        meta.setFileHash(fileHash);
        meta.setEngineId(engineId);
        meta.setCreatedAt(LocalDateTime.now(clock).toString());
        for (StemType type : StemType.values()) {
            Path target = entryDir.resolve(type.getFileName());
            Files.copy(stems.get(type), target, StandardCopyOption.REPLACE_EXISTING);
            meta.getStemPaths().put(type.getStemName(), type.getFileName());
        }
        if (qualityScores != null) {
            meta.getQualityScores().putAll(qualityScores);
        }

        Path tmpMeta = entryDir.resolve(META_FILE + ".tmp");
        objectMapper.writeValue(tmpMeta.toFile(), meta);
        Files.move(tmpMeta, entryDir.resolve(META_FILE), StandardCopyOption.REPLACE_EXISTING);

        log.info("已缓存分轨: {} ({})", FileHashUtils.shortHash(fileHash), engineId);
        return loadEntry(entryDir);
    }

    /**
     * 将缓存条目中的分轨复制到输出目录
     */
    public Map<StemType, Path> restore(CacheEntry entry, Path outputDirectory) throws IOException {
        Files.createDirectories(outputDirectory);
        Map<StemType, Path> restored = new EnumMap<>(StemType.class);
        for (Map.Entry<StemType, Path> stem : entry.getStemPaths().entrySet()) {
            Path target = outputDirectory.resolve(stem.getKey().getFileName());
            Files.copy(stem.getValue(), target, StandardCopyOption.REPLACE_EXISTING);
            restored.put(stem.getKey(), target);
        }
        return restored;
    }

    public boolean invalidate(String fileHash, String engineId) {
        Path entryDir = entryDirectory(fileHash, engineId);
        if (!Files.exists(entryDir)) {
            return false;
        }
        boolean removed = deleteRecursively(entryDir);
        if (removed) {
            log.info("缓存条目已失效: {} ({})", FileHashUtils.shortHash(fileHash), engineId);
        }
        return removed;
    }

    public boolean invalidate(Path audioFile, String engineId) throws IOException {
        return invalidate(FileHashUtils.sha256(audioFile), engineId);
    }

    /**
     * 清理缓存
     * @param olderThanDays 为 null 时清除全部;否则只清除早于该天数的条目,元数据缺失或损坏的条目一并清除
     * @return 删除的条目数
     */
    public int clearCache(Integer olderThanDays) {
        LocalDateTime cutoff = olderThanDays == null ? null : LocalDateTime.now(clock).minusDays(olderThanDays);
        int removed = 0;

        for (Path entryDir : listEntries()) {
            boolean eligible = cutoff == null;
            if (!eligible) {
                try {
                    CacheMeta meta = readMeta(entryDir);
                    eligible = meta.getCreatedAt() == null
                        || LocalDateTime.parse(meta.getCreatedAt()).isBefore(cutoff);
                } catch (CacheCorruptionException | DateTimeParseException e) {
                    log.debug("缓存元数据无效,将清除: {} - {}", entryDir.getFileName(), e.getMessage());
                    eligible = true;
                }
            }
            if (eligible && deleteRecursively(entryDir)) {
                removed++;
            }
        }

        log.info(I18nUtil.getMessage("cache.cleared"), removed);
        return removed;
    }

    public CacheStatistics getStatistics() {
        CacheStatistics stats = new CacheStatistics();
        stats.setCacheDirectory(cacheDirectory.toString());
        for (Path entryDir : listEntries()) {
            if (!Files.isRegularFile(entryDir.resolve(META_FILE))) {
                continue;
            }
            stats.totalEntries++;
            try (Stream<Path> files = Files.walk(entryDir)) {
                stats.totalSizeBytes += files.filter(Files::isRegularFile)
                    .mapToLong(this::sizeOf)
                    .sum();
            } catch (IOException e) {
                log.warn("统计缓存大小失败: {} - {}", entryDir, e.getMessage());
            }
        }
        return stats;
    }

    public Path getCacheDirectory() {
        return cacheDirectory;
    }

    Path entryDirectory(String fileHash, String engineId) {
        String name = sanitizeKeyPart(fileHash) + "_" + sanitizeKeyPart(engineId);
        return cacheDirectory.resolve(name);
    }

    private CacheEntry loadEntry(Path entryDir) {
        CacheMeta meta = readMeta(entryDir);
        Path realEntryDir = realPath(entryDir);

        CacheEntry entry = new CacheEntry();
        entry.setFileHash(meta.getFileHash());
        entry.setEngineId(meta.getEngineId());
        entry.setEntryDirectory(entryDir);
        entry.setQualityScores(meta.getQualityScores() == null
            ? new LinkedHashMap<>() : new LinkedHashMap<>(meta.getQualityScores()));
        try {
            entry.setCreatedAt(meta.getCreatedAt() == null ? null : LocalDateTime.parse(meta.getCreatedAt()));
        } catch (DateTimeParseException e) {
            throw new CacheCorruptionException("Invalid created_at in " + META_FILE, e);
        }

        if (meta.getStemPaths() == null) {
            throw new CacheCorruptionException("Missing stem_paths in " + META_FILE);
        }
        for (Map.Entry<String, String> stem : meta.getStemPaths().entrySet()) {
            StemType type = StemType.fromName(stem.getKey());
            if (type == null || stem.getValue() == null) {
                continue;
            }
            Path resolved = entryDir.resolve(stem.getValue()).normalize();
            if (!resolved.startsWith(entryDir)) {
                throw new PathTraversalException(resolved, entryDir);
            }
            if (!Files.isRegularFile(resolved)) {
                continue;
            }
            if (!realPath(resolved).startsWith(realEntryDir)) {
                throw new PathTraversalException(resolved, entryDir);
            }
            entry.getStemPaths().put(type, resolved);
        }

        if (entry.getStemPaths().size() != StemType.values().length) {
            throw new CacheCorruptionException(
                "Expected " + StemType.values().length + " stems, found " + entry.getStemPaths().size());
        }
        return entry;
    }

    private CacheMeta readMeta(Path entryDir) {
        Path metaFile = entryDir.resolve(META_FILE);
        if (!Files.isRegularFile(metaFile)) {
            throw new CacheCorruptionException("Missing " + META_FILE);
        }
        try {
            return objectMapper.readValue(metaFile.toFile(), CacheMeta.class);
        } catch (IOException e) {
            throw new CacheCorruptionException("Unreadable " + META_FILE + ": " + e.getMessage(), e);
        }
    }

    private List<Path> listEntries() {
        List<Path> entries = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(cacheDirectory, Files::isDirectory)) {
            for (Path dir : stream) {
                entries.add(dir);
            }
        } catch (IOException e) {
            log.error("读取缓存目录失败: {}", cacheDirectory, e);
        }
        return entries;
    }

    private boolean deleteRecursively(Path dir) {
        try (Stream<Path> walk = Files.walk(dir)) {
            List<Path> paths = new ArrayList<>();
            walk.sorted(Comparator.reverseOrder()).forEach(paths::add);
            for (Path path : paths) {
                Files.deleteIfExists(path);
            }
            return true;
        } catch (IOException e) {
            log.error("删除缓存条目失败: {}", dir, e);
            return false;
        }
    }

    private static Path realPath(Path path) {
        try {
            return path.toRealPath();
        } catch (IOException e) {
            throw new CacheCorruptionException("Cannot resolve " + path, e);
        }
    }

    private long sizeOf(Path file) {
        try {
            return Files.size(file);
        } catch (IOException e) {
            log.debug("无法读取文件大小: {} - {}", file, e.getMessage());
            return 0L;
        }
    }

    private static String sanitizeKeyPart(String value) {
        if (value == null || value.isEmpty()) {
            return "unknown";
        }
        return value.replaceAll("[^A-Za-z0-9._-]", "_").replace("..", "_");
    }

    /**
     * cache_meta.json 的结构
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class CacheMeta {
        @JsonProperty("file_hash")
        private String fileHash;
        @JsonProperty("engine_id")
        private String engineId;
        @JsonProperty("created_at")
        private String createdAt;
        @JsonProperty("stem_paths")
        private Map<String, String> stemPaths = new LinkedHashMap<>();
        @JsonProperty("quality_scores")
        private Map<String, Double> qualityScores = new LinkedHashMap<>();
    }

    /**
     * 缓存统计信息
     */
    @Data
    public static class CacheStatistics {
        private long totalEntries;
        private long totalSizeBytes;
        private String cacheDirectory;

        public double getTotalSizeMb() {
            return totalSizeBytes / 1024.0 / 1024.0;
        }

        @Override
        public String toString() {
            return String.format("缓存条目: %d, 总大小: %.2f MB, 目录: %s",
                totalEntries, getTotalSizeMb(), cacheDirectory);
        }
    }
}
