package com.lux032.stemgenerator.service;

import com.lux032.stemgenerator.config.StemConfig;
import com.lux032.stemgenerator.model.BatchError;
import com.lux032.stemgenerator.model.BatchProgress;
import com.lux032.stemgenerator.model.BatchResult;
import com.lux032.stemgenerator.model.ScanResult;
import com.lux032.stemgenerator.model.ScannedTrack;
import com.lux032.stemgenerator.model.SeparationResult;
import com.lux032.stemgenerator.util.I18nUtil;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 批量分离调度
 * 按扫描得到的优先级顺序逐个处理,单个曲目失败不影响后续曲目
 */
@Slf4j
public class BatchScheduler {

    /**
     * 每处理完一个曲目回调一次,progress 为快照
     */
    @FunctionalInterface
    public interface ProgressCallback {
        void onProgress(BatchProgress progress, ScannedTrack track);
    }

    private final StemPipeline pipeline;
    private final LibraryScanner scanner;
    private final StemConfig config;

    private volatile BatchProgress currentProgress; // 供监控面板读取

    public BatchScheduler(StemPipeline pipeline, LibraryScanner scanner, StemConfig config) {
        this.pipeline = pipeline;
        this.scanner = scanner;
        this.config = config;
    }

    /**
     * 扫描目录并批量处理
     * @param limit 小于等于 0 表示不限制
     */
    public BatchResult processDirectory(Path directory, ProgressCallback callback, boolean skipExisting, int limit) {
        long start = System.nanoTime();
        ScanResult scan = scanner.scanDirectory(directory);

        List<ScannedTrack> tracks = scan.getTracks();
        if (limit > 0 && tracks.size() > limit) {
            tracks = new ArrayList<>(tracks.subList(0, limit));
        }

        BatchResult result = processTracks(tracks, callback, skipExisting);
        for (String error : scan.getErrors()) {
            result.getErrors().add(new BatchError(null, error));
        }
        result.setProcessingTimeSeconds(elapsed(start));
        return result;
    }

    /**
     * 按给定顺序处理曲目
     */
    public BatchResult processTracks(List<ScannedTrack> tracks, ProgressCallback callback, boolean skipExisting) {
        long start = System.nanoTime();
        BatchResult result = new BatchResult();
        BatchProgress progress = result.getProgress();
        progress.setTotal(tracks.size());
        currentProgress = progress.snapshot();

        log.info("========================================");
        log.info(I18nUtil.getMessage("batch.started"), tracks.size());
        log.info("========================================");

        int index = 0;
        for (ScannedTrack track : tracks) {
            index++;
            log.info("批量处理 [{}/{}] ({}): {}", index, tracks.size(), track.getPriority(), track.getDisplayName());
            try {
                SeparationResult separation = pipeline.separate(track.getPath(), StemPipeline.ENGINE_AUTO,
                    skipExisting, config.isQualityFallbackEnabled());
                result.getResults().add(separation);
                if (separation.isSuccess() && separation.isCached()) {
                    progress.setSkipped(progress.getSkipped() + 1);
                } else if (separation.isSuccess()) {
                    progress.setCompleted(progress.getCompleted() + 1);
                } else {
                    progress.setFailed(progress.getFailed() + 1);
                    result.getErrors().add(new BatchError(track, separation.getErrorMessage()));
                }
            } catch (RuntimeException e) {
                log.error("✗ 曲目处理失败: {}", track.getPath(), e);
                progress.setFailed(progress.getFailed() + 1);
                result.getErrors().add(new BatchError(track, e.getMessage()));
            }

            currentProgress = progress.snapshot();
            if (callback != null) {
                callback.onProgress(progress.snapshot(), track);
            }
        }

        result.setProcessingTimeSeconds(elapsed(start));
        log.info("========================================");
        log.info(I18nUtil.getMessage("batch.completed"),
            progress.getCompleted(), progress.getSkipped(), progress.getFailed());
        if (!result.getErrors().isEmpty()) {
            log.warn("失败曲目列表:");
            for (BatchError error : result.getErrors()) {
                log.warn("  - {}: {}", error.getTrack() == null ? "-" : error.getTrack().getDisplayName(),
                    error.getMessage());
            }
        }
        log.info("========================================");
        LogCollector.info(I18nUtil.getMessage("batch.completed",
            progress.getCompleted(), progress.getSkipped(), progress.getFailed()));
        return result;
    }

    /**
     * 断点续处理: 强制跳过已有输出的曲目
     */
    public BatchResult resumeProcessing(Path directory, ProgressCallback callback) {
        return processDirectory(directory, callback, true, 0);
    }

    /**
     * 输出目录中还没有完整分轨的曲目
     */
    public List<ScannedTrack> getPendingTracks(Path directory) {
        List<ScannedTrack> pending = new ArrayList<>();
        for (ScannedTrack track : scanner.scanDirectory(directory).getTracks()) {
            try {
                if (!pipeline.isProcessed(track.getPath())) {
                    pending.add(track);
                }
            } catch (IOException e) {
                log.warn("无法判断处理状态,视为待处理: {} - {}", track.getPath(), e.getMessage());
                pending.add(track);
            }
        }
        return pending;
    }

    public BatchProgress getCurrentProgress() {
        BatchProgress progress = currentProgress;
        return progress == null ? null : progress.snapshot();
    }

    private static double elapsed(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000_000.0;
    }
}
