package com.lux032.stemgenerator.service;

import com.lux032.stemgenerator.config.StemConfig;
import com.lux032.stemgenerator.model.Priority;
import com.lux032.stemgenerator.model.ScanResult;
import com.lux032.stemgenerator.model.ScannedTrack;
import com.lux032.stemgenerator.model.TrackMetadata;
import com.lux032.stemgenerator.util.I18nUtil;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 音乐库扫描
 * 收集音频文件,读取标签并按优先级排序
 *
 * <p>优先级规则,命中第一条即停止:</p>
 * <ol>
 *   <li>所在 crate 或父目录属于配置的优先 crate: HIGHEST</li>
 *   <li>流派包含 house 关键字: HIGH</li>
 *   <li>BPM 大于 120: MEDIUM</li>
 *   <li>流派包含人声类关键字: NORMAL</li>
 *   <li>其他: LOW</li>
 * </ol>
 */
@Slf4j
public class LibraryScanner {

    static final List<String> HOUSE_GENRES = Arrays.asList(
        "house", "deep house", "tech house", "progressive house",
        "electro house", "future house", "tropical house");
    static final List<String> VOCAL_GENRES = Arrays.asList(
        "pop", "r&b", "rnb", "soul", "hip-hop", "hip hop", "vocal");
    static final double MEDIUM_BPM_THRESHOLD = 120.0;

    static final Comparator<ScannedTrack> PRIORITY_ORDER = Comparator
        .comparingInt((ScannedTrack t) -> t.getPriority().getRank())
        .thenComparing(ScannedTrack::getDisplayName)
        .thenComparing(t -> t.getPath().toString());

    private final StemConfig config;
    private final TrackMetadataReader metadataReader;
    private final Set<String> audioExtensions;
    private final Set<String> priorityCrates;

    public LibraryScanner(StemConfig config, TrackMetadataReader metadataReader) {
        this.config = config;
        this.metadataReader = metadataReader;
        this.audioExtensions = Arrays.stream(config.getSupportedFormats())
            .map(s -> s.toLowerCase(Locale.ROOT))
            .collect(Collectors.toSet());
        this.priorityCrates = config.getPriorityCrates().stream()
            .map(s -> s.toLowerCase(Locale.ROOT))
            .collect(Collectors.toSet());
    }

    public ScanResult scanDirectory(Path directory) {
        return scanDirectory(directory, config.isScannerRecursive());
    }

    public ScanResult scanDirectory(Path directory, boolean recursive) {
        ScanResult result = new ScanResult();
        if (!Files.isDirectory(directory)) {
            log.warn(I18nUtil.getMessage("scanner.directory.not.found"), directory);
            result.getErrors().add("Directory not found: " + directory);
            return result;
        }

        List<Path> files;
        try (Stream<Path> stream = recursive ? Files.walk(directory) : Files.list(directory)) {
            files = stream.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
        } catch (IOException | RuntimeException e) {
            log.error("扫描目录失败: {}", directory, e);
            result.getErrors().add("Failed to scan " + directory + ": " + e.getMessage());
            return result;
        }

        for (Path file : files) {
            result.setTotalFiles(result.getTotalFiles() + 1);
            if (!isAudioFile(file)) {
                continue;
            }
            result.setAudioFiles(result.getAudioFiles() + 1);
            try {
                result.getTracks().add(toScannedTrack(file));
            } catch (RuntimeException e) {
                log.warn("读取曲目失败: {} - {}", file.getFileName(), e.getMessage());
                result.getErrors().add(file + ": " + e.getMessage());
            }
        }

        result.getTracks().sort(PRIORITY_ORDER);
        log.info(I18nUtil.getMessage("scanner.completed"), directory, result.getAudioFiles(), result.getTotalFiles());
        return result;
    }

    /**
     * 扫描多个目录并统一排序
     */
    public ScanResult scanMultiple(List<Path> directories, boolean recursive) {
        ScanResult merged = new ScanResult();
        for (Path directory : directories) {
            merged.merge(scanDirectory(directory, recursive));
        }
        merged.getTracks().sort(PRIORITY_ORDER);
        return merged;
    }

    /**
     * 按优先级顺序返回前 limit 个曲目,limit 小于等于 0 表示全部
     */
    public List<ScannedTrack> listPrioritized(Path directory, int limit) {
        List<ScannedTrack> tracks = scanDirectory(directory).getTracks();
        if (limit > 0 && tracks.size() > limit) {
            return new ArrayList<>(tracks.subList(0, limit));
        }
        return tracks;
    }

    public boolean isAudioFile(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0) {
            return false;
        }
        return audioExtensions.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    ScannedTrack toScannedTrack(Path file) {
        TrackMetadata metadata = metadataReader.read(file);
        ScannedTrack track = new ScannedTrack(file);
        track.setArtist(metadata.getArtist());
        track.setTitle(metadata.getTitle());
        track.setGenre(metadata.getGenre());
        track.setBpm(metadata.getBpm());
        track.setMusicalKey(metadata.getMusicalKey());
        track.setCrate(metadata.getCrate() != null ? metadata.getCrate() : parentFolderName(file));
        track.setPriority(determinePriority(track));
        return track;
    }

    Priority determinePriority(ScannedTrack track) {
        if (isPriorityCrate(track.getCrate()) || isPriorityCrate(parentFolderName(track.getPath()))) {
            return Priority.HIGHEST;
        }
        String genre = track.getGenre() == null ? "" : track.getGenre().toLowerCase(Locale.ROOT);
        if (containsAny(genre, HOUSE_GENRES)) {
            return Priority.HIGH;
        }
        if (track.getBpm() != null && track.getBpm() > MEDIUM_BPM_THRESHOLD) {
            return Priority.MEDIUM;
        }
        if (containsAny(genre, VOCAL_GENRES)) {
            return Priority.NORMAL;
        }
        return Priority.LOW;
    }

    private boolean isPriorityCrate(String crate) {
        return crate != null && priorityCrates.contains(crate.trim().toLowerCase(Locale.ROOT));
    }

    private static boolean containsAny(String genre, List<String> keywords) {
        if (genre.isEmpty()) {
            return false;
        }
        for (String keyword : keywords) {
            if (genre.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    private static String parentFolderName(Path file) {
        Path parent = file == null ? null : file.getParent();
        return parent == null || parent.getFileName() == null ? null : parent.getFileName().toString();
    }
}
