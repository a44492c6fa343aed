package com.lux032.stemgenerator.service;

import com.lux032.stemgenerator.backend.SeparationBackend;
import com.lux032.stemgenerator.config.StemConfig;
import com.lux032.stemgenerator.exception.EngineUnavailableException;
import com.lux032.stemgenerator.exception.NoEngineAvailableException;
import com.lux032.stemgenerator.model.CacheEntry;
import com.lux032.stemgenerator.model.JobStatus;
import com.lux032.stemgenerator.model.SeparationResult;
import com.lux032.stemgenerator.model.StemType;
import com.lux032.stemgenerator.model.TrackMetadata;
import com.lux032.stemgenerator.util.FileHashUtils;
import com.lux032.stemgenerator.util.I18nUtil;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 分轨流水线
 * 负责后端路由、质量回退、缓存和台账记录
 *
 * <p>一次分离按固定状态推进:
 * ATTEMPT_PRIMARY -> EVALUATE_QUALITY -> [ATTEMPT_FALLBACK] -> FINALIZE。
 * 主后端硬失败直接结束,不触发回退;回退最多一次。</p>
 */
@Slf4j
public class StemPipeline {

    public static final String ENGINE_AUTO = "auto";

    private final StemConfig config;
    private final List<SeparationBackend> backends;
    private final JobLedger ledger;
    private final StemCache cache; // 可为 null
    private final QualityAnalyzer qualityAnalyzer;
    private final StemFileManager fileManager;
    private final TrackMetadataReader metadataReader;

    enum FallbackState {
        ATTEMPT_PRIMARY,
        EVALUATE_QUALITY,
        ATTEMPT_FALLBACK,
        FINALIZE,
        DONE
    }

    public StemPipeline(StemConfig config,
                        List<SeparationBackend> backends,
                        JobLedger ledger,
                        StemCache cache,
                        QualityAnalyzer qualityAnalyzer,
                        StemFileManager fileManager,
                        TrackMetadataReader metadataReader) {
        this.config = config;
        this.backends = new ArrayList<>(backends);
        this.ledger = ledger;
        this.cache = cache;
        this.qualityAnalyzer = qualityAnalyzer;
        this.fileManager = fileManager;
        this.metadataReader = metadataReader;
    }

    /**
     * 使用默认参数分离: 自动选择后端,跳过已有输出,回退开关取配置值
     */
    public SeparationResult separate(Path file) {
        return separate(file, ENGINE_AUTO, true, config.isQualityFallbackEnabled());
    }

    /**
     * 分离单个文件
     *
     * @param file 输入音频
     * @param enginePreference 后端名称或 {@code auto}
     * @param skipIfExisting 输出目录已有四条分轨时直接返回;为 false 时也不使用内容缓存
     * @param qualityFallback 质量不达标时是否尝试另一后端
     * @throws EngineUnavailableException 显式指定的后端不可用
     * @throws NoEngineAvailableException 没有可用后端
     */
    public SeparationResult separate(Path file, String enginePreference,
                                     boolean skipIfExisting, boolean qualityFallback) {
        if (!Files.isRegularFile(file)) {
            log.error(I18nUtil.getMessage("pipeline.file.not.found"), file);
            SeparationResult result = SeparationResult.failure(SeparationResult.ENGINE_NONE,
                "File not found: " + file, 0);
            result.setSourceFile(file);
            return result;
        }

        String fileHash;
        try {
            fileHash = FileHashUtils.sha256(file);
        } catch (IOException e) {
            log.error("计算文件哈希失败: {}", file, e);
            SeparationResult result = SeparationResult.failure(SeparationResult.ENGINE_NONE,
                "Cannot read file: " + e.getMessage(), 0);
            result.setSourceFile(file);
            return result;
        }
        TrackMetadata metadata = metadataReader.read(file);
        Path outputDir = fileManager.getOutputDirectory(metadata.getArtist(), metadata.getTitle(), fileHash);

        if (skipIfExisting && fileManager.stemsExist(outputDir)) {
            log.info(I18nUtil.getMessage("pipeline.skip.existing"), file.getFileName());
            SeparationResult result = SeparationResult.success(SeparationResult.ENGINE_CACHED,
                fileManager.getStemPaths(outputDir), 0);
            result.setSourceFile(file);
            result.setOutputDirectory(outputDir);
            return result;
        }

        long trackId = ledger.addTrack(file, fileHash, metadata);
        if (ledger.hasSuccessfulJob(fileHash)) {
            log.info("台账显示 {} 曾成功分离,但输出不完整,重新处理", file.getFileName());
        }

        SeparationBackend primary = selectBackend(file, enginePreference);
        log.info(I18nUtil.getMessage("pipeline.engine.selected"), primary.getName(), file.getFileName());

        if (skipIfExisting) {
            Optional<SeparationResult> cached = restoreFromCache(file, fileHash, primary, outputDir, qualityFallback);
            if (cached.isPresent()) {
                return cached.get();
            }
        }

        return runStateMachine(new SeparationRun(file, fileHash, trackId, outputDir, primary, qualityFallback));
    }

    private SeparationResult runStateMachine(SeparationRun run) {
        FallbackState state = FallbackState.ATTEMPT_PRIMARY;
        while (state != FallbackState.DONE) {
            switch (state) {
                case ATTEMPT_PRIMARY:
                    state = attemptPrimary(run);
                    break;
                case EVALUATE_QUALITY:
                    state = evaluateQuality(run);
                    break;
                case ATTEMPT_FALLBACK:
                    state = attemptFallback(run);
                    break;
                case FINALIZE:
                    state = finalizeRun(run);
                    break;
                default:
                    throw new IllegalStateException("Unexpected state " + state);
            }
        }
        return run.finalResult;
    }

    private FallbackState attemptPrimary(SeparationRun run) {
        run.primaryJobId = ledger.createJob(run.trackId, run.primary.getName());
        ledger.updateJobStatus(run.primaryJobId, JobStatus.PROCESSING);

        SeparationResult result = invokeBackend(run.primary, run.file, run.outputDir);
        result.setSourceFile(run.file);
        result.setOutputDirectory(run.outputDir);
        run.primaryResult = result;

        if (!result.isSuccess()) {
            ledger.updateJobStatus(run.primaryJobId, JobStatus.FAILED,
                result.getProcessingTimeSeconds(), result.getErrorMessage());
            log.error(I18nUtil.getMessage("pipeline.separation.failed"),
                run.file.getFileName(), run.primary.getName(), result.getErrorMessage());
            LogCollector.error(I18nUtil.getMessage("pipeline.separation.failed",
                run.file.getFileName(), run.primary.getName(), result.getErrorMessage()));
            run.finalResult = result;
            return FallbackState.DONE;
        }
        return FallbackState.EVALUATE_QUALITY;
    }

    private FallbackState evaluateQuality(SeparationRun run) {
        Map<String, Double> scores = qualityAnalyzer.analyzeStems(run.primaryResult.getStems(), run.file);
        ledger.addQualityScores(run.primaryJobId, scores);
        run.primaryResult.getQualityScores().putAll(scores);
        run.finalResult = run.primaryResult;

        if (!run.qualityFallback || !QualityAnalyzer.needsFallback(scores)) {
            return FallbackState.FINALIZE;
        }

        Optional<SeparationBackend> fallback = findFallback(run.primary);
        if (fallback.isEmpty()) {
            log.warn("质量未达标,但没有可用的回退后端: {}", run.file.getFileName());
            return FallbackState.FINALIZE;
        }
        run.fallback = fallback.get();
        log.info(I18nUtil.getMessage("pipeline.quality.fallback"),
            run.file.getFileName(), run.primary.getName(), run.fallback.getName());
        return FallbackState.ATTEMPT_FALLBACK;
    }

    private FallbackState attemptFallback(SeparationRun run) {
        long fallbackJobId = ledger.createJob(run.trackId, run.fallback.getName());
        ledger.updateJobStatus(fallbackJobId, JobStatus.PROCESSING);

        Path staging = fileManager.getStagingDirectory(run.outputDir, run.fallback.getName());
        try {
            SeparationResult result = invokeBackend(run.fallback, run.file, staging);
            if (result.isSuccess() && result.getStems().size() == StemType.values().length) {
                result.setStems(fileManager.promoteStems(result.getStems(), run.outputDir));
                result.setSourceFile(run.file);
                result.setOutputDirectory(run.outputDir);
                result.setFallbackEngine(run.fallback.getName());

                Map<String, Double> scores = qualityAnalyzer.analyzeStems(result.getStems(), run.file);
                ledger.addQualityScores(fallbackJobId, scores);
                result.getQualityScores().putAll(scores);
                ledger.updateJobStatus(fallbackJobId, JobStatus.COMPLETED, result.getProcessingTimeSeconds(), null);

                log.info("✓ 回退后端 {} 完成: {}", run.fallback.getName(), run.file.getFileName());
                run.finalResult = result;
            } else {
                String error = result.getErrorMessage() != null ? result.getErrorMessage() : "Incomplete stems";
                recordFallbackFailure(run, fallbackJobId, result.getProcessingTimeSeconds(), error);
            }
        } catch (IOException e) {
            log.error("回退分轨落盘失败: {}", run.file.getFileName(), e);
            run.cacheable = false;
            recordFallbackFailure(run, fallbackJobId, null, e.getMessage());
        } finally {
            fileManager.deleteDirectory(staging);
        }
        return FallbackState.FINALIZE;
    }

    private void recordFallbackFailure(SeparationRun run, long fallbackJobId, Double seconds, String error) {
        ledger.updateJobStatus(fallbackJobId, JobStatus.FAILED, seconds, error);
        run.primaryResult.setFallbackEngine(run.fallback.getName());
        run.primaryResult.setFallbackError(error);
        run.finalResult = run.primaryResult;
        log.warn("回退后端 {} 失败,保留原结果: {}", run.fallback.getName(), error);
        LogCollector.warn(I18nUtil.getMessage("pipeline.fallback.failed", run.fallback.getName(), error));
    }

    private FallbackState finalizeRun(SeparationRun run) {
        SeparationResult result = run.finalResult;
        try {
            fileManager.writeMetadata(result, run.outputDir);
        } catch (IOException e) {
            log.error("写入 {} 失败: {}", StemFileManager.METADATA_FILE, run.outputDir, e);
        }

        ledger.updateJobStatus(run.primaryJobId, JobStatus.COMPLETED,
            run.primaryResult.getProcessingTimeSeconds(), null);

        if (run.cacheable) {
            storeInCache(run.fileHash, result);
        } else {
            log.warn("输出目录分轨替换未完成,本次结果不写入缓存: {}", run.outputDir);
        }

        log.info(I18nUtil.getMessage("pipeline.separation.completed"),
            run.file.getFileName(), result.getEngine(), String.format("%.1f", result.getProcessingTimeSeconds()));
        LogCollector.info(I18nUtil.getMessage("pipeline.separation.completed",
            run.file.getFileName(), result.getEngine(), String.format("%.1f", result.getProcessingTimeSeconds())));
        return FallbackState.DONE;
    }

    /**
     * 调用后端;后端意外抛出运行时异常时转换为失败结果,保证任务能进入终态
     */
    private SeparationResult invokeBackend(SeparationBackend backend, Path file, Path outputDir) {
        try {
            SeparationResult result = backend.separate(file, outputDir);
            if (result == null) {
                return SeparationResult.failure(backend.getName(), "Engine returned no result", 0);
            }
            return result;
        } catch (RuntimeException e) {
            log.error("后端 {} 抛出异常: {}", backend.getName(), file.getFileName(), e);
            return SeparationResult.failure(backend.getName(), e.getClass().getSimpleName() + ": " + e.getMessage(), 0);
        }
    }

    /**
     * 从内容缓存恢复分轨
     * 缓存的质量分数仍需回退且存在可用回退后端时不使用缓存,重新走完整流程
     */
    private Optional<SeparationResult> restoreFromCache(Path file, String fileHash, SeparationBackend backend,
                                                        Path outputDir, boolean qualityFallback) {
        if (cache == null || !config.isCacheEnabled()) {
            return Optional.empty();
        }
        Optional<CacheEntry> entry = cache.get(fileHash, backend.getName());
        if (entry.isEmpty()) {
            return Optional.empty();
        }
        Map<String, Double> cachedScores = entry.get().getQualityScores();
        if (qualityFallback && cachedScores != null && QualityAnalyzer.needsFallback(cachedScores)
            && findFallback(backend).isPresent()) {
            log.info("缓存结果质量未达标,重新分离以尝试回退: {} ({})", file.getFileName(), backend.getName());
            return Optional.empty();
        }

        try {
            Map<StemType, Path> stems = cache.restore(entry.get(), outputDir);
            SeparationResult result = SeparationResult.success(SeparationResult.ENGINE_CACHED, stems, 0);
            result.setSourceFile(file);
            result.setOutputDirectory(outputDir);
            if (entry.get().getQualityScores() != null) {
                result.getQualityScores().putAll(entry.get().getQualityScores());
            }
            fileManager.writeMetadata(result, outputDir);
            log.info(I18nUtil.getMessage("pipeline.cache.hit"), file.getFileName(), backend.getName());
            return Optional.of(result);
        } catch (IOException e) {
            log.warn("从缓存恢复分轨失败,重新分离: {} - {}", file.getFileName(), e.getMessage());
            return Optional.empty();
        }
    }

    private void storeInCache(String fileHash, SeparationResult result) {
        if (cache == null || !config.isCacheEnabled()) {
            return;
        }
        try {
            cache.put(fileHash, result.getEngine(), result.getStems(), result.getQualityScores());
        } catch (IOException | IllegalArgumentException e) {
            log.warn("写入缓存失败,不影响分离结果: {}", e.getMessage());
        }
    }

    /**
     * 选择后端
     * 显式指定时必须可用;auto 时文件小于阈值或云端不可用则用本地后端,否则用云端
     */
    public SeparationBackend selectBackend(Path file, String enginePreference) {
        if (enginePreference != null && !enginePreference.trim().isEmpty()
            && !ENGINE_AUTO.equalsIgnoreCase(enginePreference.trim())) {
            SeparationBackend backend = backends.stream()
                .filter(b -> b.matches(enginePreference))
                .findFirst()
                .orElseThrow(() -> new EngineUnavailableException(enginePreference));
            if (!backend.isAvailable()) {
                throw new EngineUnavailableException(enginePreference);
            }
            return backend;
        }

        Optional<SeparationBackend> local = backends.stream()
            .filter(SeparationBackend::isLocal)
            .filter(SeparationBackend::isAvailable)
            .findFirst();
        Optional<SeparationBackend> remote = backends.stream()
            .filter(b -> !b.isLocal())
            .filter(SeparationBackend::isAvailable)
            .findFirst();

        long size = file.toFile().length();
        if (local.isPresent() && (size < config.getLocalSizeThresholdBytes() || remote.isEmpty())) {
            return local.get();
        }
        if (remote.isPresent()) {
            return remote.get();
        }
        throw new NoEngineAvailableException();
    }

    /**
     * 与主后端不同的第一个可用后端
     */
    public Optional<SeparationBackend> findFallback(SeparationBackend primary) {
        return backends.stream()
            .filter(b -> !b.getName().equals(primary.getName()))
            .filter(SeparationBackend::isAvailable)
            .findFirst();
    }

    /**
     * 文件的输出目录中是否已有四条分轨
     */
    public boolean isProcessed(Path file) throws IOException {
        String fileHash = FileHashUtils.sha256(file);
        TrackMetadata metadata = metadataReader.read(file);
        return fileManager.stemsExist(fileManager.getOutputDirectory(metadata.getArtist(), metadata.getTitle(), fileHash));
    }

    public List<SeparationBackend> getBackends() {
        return new ArrayList<>(backends);
    }

    /**
     * 流水线状态: 输出目录、后端可用性、台账与缓存统计
     */
    public Map<String, Object> getStats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("baseDirectory", fileManager.getBaseDirectory().toString());

        Map<String, Object> engines = new LinkedHashMap<>();
        for (SeparationBackend backend : backends) {
            Map<String, Object> info = new LinkedHashMap<>();
            info.put("available", backend.isAvailable());
            info.put("local", backend.isLocal());
            info.put("parallelism", backend.getRecommendedParallelism());
            engines.put(backend.getName(), info);
        }
        stats.put("engines", engines);
        stats.put("qualityFallback", config.isQualityFallbackEnabled());
        stats.put("localSizeThresholdMb", config.getLocalSizeThresholdMb());
        stats.put("ledger", ledger.getStatistics());
        if (cache != null && config.isCacheEnabled()) {
            stats.put("cache", cache.getStatistics());
        }
        return stats;
    }

    /**
     * 单次分离的上下文
     */
    private static class SeparationRun {
        private final Path file;
        private final String fileHash;
        private final long trackId;
        private final Path outputDir;
        private final SeparationBackend primary;
        private final boolean qualityFallback;

        private long primaryJobId;
        private SeparationResult primaryResult;
        private SeparationBackend fallback;
        private SeparationResult finalResult;
        private boolean cacheable = true;

        SeparationRun(Path file, String fileHash, long trackId, Path outputDir,
                      SeparationBackend primary, boolean qualityFallback) {
            this.file = file;
            this.fileHash = fileHash;
            this.trackId = trackId;
            this.outputDir = outputDir;
            this.primary = primary;
            this.qualityFallback = qualityFallback;
        }
    }
}
