package com.lux032.stemgenerator.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.lux032.stemgenerator.exception.PathTraversalException;
import com.lux032.stemgenerator.model.SeparationResult;
import com.lux032.stemgenerator.model.StemType;
import com.lux032.stemgenerator.util.FileHashUtils;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * 分轨输出目录管理
 * 布局: {@code <base>/<Artist> - <Title>_<hash8>/{vocals,drums,bass,other}.wav + metadata.json}
 */
@Slf4j
public class StemFileManager {

    public static final String METADATA_FILE = "metadata.json";
    static final String PREVIOUS_DIR = ".previous_stems";

    private static final int MAX_NAME_LENGTH = 100;

    private final Path baseDirectory;
    private final ObjectMapper objectMapper;

    public StemFileManager(String baseDirectory) {
        this.baseDirectory = Paths.get(baseDirectory).toAbsolutePath().normalize();
        this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path getBaseDirectory() {
        return baseDirectory;
    }

    /**
     * 计算曲目的输出目录 (不创建)
     * @throws PathTraversalException 目录解析到根目录之外
     */
    public Path getOutputDirectory(String artist, String title, String fileHash) {
        String folder = sanitizeFileName(artist) + " - " + sanitizeFileName(title)
            + "_" + FileHashUtils.shortHash(fileHash);
        Path dir = baseDirectory.resolve(folder).normalize();
        if (!dir.startsWith(baseDirectory) || dir.equals(baseDirectory)) {
            throw new PathTraversalException(dir, baseDirectory);
        }
        return dir;
    }

    /**
     * 清理文件名中的非法字符
     */
    public static String sanitizeFileName(String name) {
        if (name == null) {
            return "Unknown";
        }
        String cleaned = name.replaceAll("[<>:\"/\\\\|?*\\x00-\\x1F]", "")
            .replace("..", "")
            .trim();
        while (cleaned.startsWith(".")) {
            cleaned = cleaned.substring(1).trim();
        }
        if (cleaned.length() > MAX_NAME_LENGTH) {
            cleaned = cleaned.substring(0, MAX_NAME_LENGTH).trim();
        }
        return cleaned.isEmpty() ? "Unknown" : cleaned;
    }

    public boolean stemsExist(Path outputDirectory) {
        return getStemPaths(outputDirectory).size() == StemType.values().length;
    }

    /**
     * 目录中已存在的标准分轨
     */
    public Map<StemType, Path> getStemPaths(Path outputDirectory) {
        Map<StemType, Path> stems = new EnumMap<>(StemType.class);
        for (StemType type : StemType.values()) {
            Path stem = outputDirectory.resolve(type.getFileName());
            if (Files.isRegularFile(stem)) {
                stems.put(type, stem);
            }
        }
        return stems;
    }

    /**
     * 回退后端的暂存目录,成功后再覆盖正式分轨
     */
    public Path getStagingDirectory(Path outputDirectory, String engine) {
        return outputDirectory.resolve(".staging_" + sanitizeFileName(engine));
    }

    /**
     * 将暂存分轨移动到正式目录,覆盖同名文件
     *
     * <p>原有分轨先移入 {@value #PREVIOUS_DIR},任一步失败时恢复原分轨,
     * 正式目录不会出现新旧混合的分轨。</p>
     */
    public Map<StemType, Path> promoteStems(Map<StemType, Path> staged, Path outputDirectory) throws IOException {
        Path previousDir = outputDirectory.resolve(PREVIOUS_DIR);
        Map<StemType, Path> previous = new EnumMap<>(StemType.class);
        Map<StemType, Path> promoted = new EnumMap<>(StemType.class);
        try {
            Files.createDirectories(previousDir);
            for (StemType type : staged.keySet()) {
                Path target = outputDirectory.resolve(type.getFileName());
                if (Files.exists(target)) {
                    Path aside = previousDir.resolve(type.getFileName());
                    Files.move(target, aside, StandardCopyOption.REPLACE_EXISTING);
                    previous.put(type, aside);
                }
            }
            for (Map.Entry<StemType, Path> stem : staged.entrySet()) {
                Path target = outputDirectory.resolve(stem.getKey().getFileName());
                Files.move(stem.getValue(), target, StandardCopyOption.REPLACE_EXISTING);
                promoted.put(stem.getKey(), target);
            }
        } catch (IOException e) {
            if (rollbackPromotion(promoted, previous, outputDirectory, e)) {
                deleteDirectory(previousDir);
            }
            throw e;
        }
        deleteDirectory(previousDir);
        return promoted;
    }

    /**
     * @return 原分轨是否全部恢复;未恢复的文件保留在 {@value #PREVIOUS_DIR} 中
     */
    private boolean rollbackPromotion(Map<StemType, Path> promoted, Map<StemType, Path> previous,
                                      Path outputDirectory, IOException cause) {
        log.warn("分轨替换失败,恢复原分轨: {} - {}", outputDirectory, cause.getMessage());
        for (Path target : promoted.values()) {
            try {
                Files.deleteIfExists(target);
            } catch (IOException e) {
                cause.addSuppressed(e);
            }
        }
        boolean restored = true;
        for (Map.Entry<StemType, Path> stem : previous.entrySet()) {
            try {
                Files.move(stem.getValue(), outputDirectory.resolve(stem.getKey().getFileName()),
                    StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException e) {
                log.error("恢复原分轨失败: {}", stem.getValue(), e);
                cause.addSuppressed(e);
                restored = false;
            }
        }
        return restored;
    }

    /**
     * 写入 metadata.json
     */
    public void writeMetadata(SeparationResult result, Path outputDirectory) throws IOException {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("source_file", result.getSourceFile() == null ? null : result.getSourceFile().toString());
        root.put("engine", result.getEngine());
        root.put("processing_time_seconds", result.getProcessingTimeSeconds());
        root.put("success", result.isSuccess());

        ObjectNode scores = root.putObject("quality_scores");
        for (Map.Entry<String, Double> score : result.getQualityScores().entrySet()) {
            scores.put(score.getKey(), score.getValue());
        }
        ObjectNode stems = root.putObject("stems");
        for (Map.Entry<StemType, Path> stem : result.getStems().entrySet()) {
            stems.put(stem.getKey().getStemName(), stem.getValue().toString());
        }
        if (result.getFallbackEngine() != null) {
            ObjectNode fallback = root.putObject("fallback");
            fallback.put("engine", result.getFallbackEngine());
            fallback.put("error", result.getFallbackError());
        }

        Files.createDirectories(outputDirectory);
        objectMapper.writeValue(outputDirectory.resolve(METADATA_FILE).toFile(), root);
    }

    public void deleteDirectory(Path dir) {
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            List<Path> paths = new ArrayList<>();
            walk.sorted(Comparator.reverseOrder()).forEach(paths::add);
            for (Path path : paths) {
                Files.deleteIfExists(path);
            }
        } catch (IOException e) {
            log.warn("删除目录失败: {} - {}", dir, e.getMessage());
        }
    }
}
