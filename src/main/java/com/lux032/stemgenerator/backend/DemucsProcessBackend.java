package com.lux032.stemgenerator.backend;

import com.lux032.stemgenerator.config.StemConfig;
import com.lux032.stemgenerator.model.SeparationResult;
import com.lux032.stemgenerator.model.StemType;
import com.lux032.stemgenerator.util.I18nUtil;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * 本地 Demucs 分离后端
 * 以外部进程方式调用 demucs 命令行,输出收集到目标目录
 */
@Slf4j
public class DemucsProcessBackend implements SeparationBackend {

    private static final long PROBE_TIMEOUT_SECONDS = 60;
    private static final int LOG_TAIL_CHARS = 500;

    private final StemConfig config;
    private volatile Boolean available; // 首次探测后缓存

    public DemucsProcessBackend(StemConfig config) {
        this.config = config;
    }

    @Override
    public String getName() {
        return "demucs_" + config.getDemucsModel();
    }

    @Override
    public boolean isLocal() {
        return true;
    }

    @Override
    public int getRecommendedParallelism() {
        return Math.max(1, config.getDemucsParallelism());
    }

    @Override
    public boolean isAvailable() {
        Boolean cached = available;
        if (cached == null) {
            synchronized (this) {
                if (available == null) {
                    available = probe();
                    if (available) {
                        log.info(I18nUtil.getMessage("engine.available"), getName());
                    } else {
                        log.warn(I18nUtil.getMessage("engine.demucs.unavailable"), config.getDemucsCommand());
                    }
                }
                cached = available;
            }
        }
        return cached;
    }

    private boolean probe() {
        try {
            ProcessBuilder pb = new ProcessBuilder(config.getDemucsCommand(), "--help");
            pb.redirectErrorStream(true);
            pb.redirectOutput(ProcessBuilder.Redirect.DISCARD);
            Process process = pb.start();
            if (!process.waitFor(PROBE_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                return false;
            }
            return process.exitValue() == 0;
        } catch (IOException e) {
            log.debug("demucs 探测失败: {}", e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public SeparationResult separate(Path input, Path outputDir) {
        long start = System.nanoTime();
        if (!Files.isRegularFile(input)) {
            return SeparationResult.failure(getName(), "Input file not found: " + input, 0);
        }

        Path workDir = null;
        try {
            Files.createDirectories(outputDir);
            workDir = Files.createTempDirectory("demucs-");
            Path logFile = workDir.resolve("demucs.log");

            List<String> command = buildCommand(input, workDir);
            log.info("开始 Demucs 分离: {}", input.getFileName());
            log.debug("命令: {}", command);

            ProcessBuilder pb = new ProcessBuilder(command);
            pb.redirectErrorStream(true);
            pb.redirectOutput(logFile.toFile());
            Process process = pb.start();

            if (!process.waitFor(config.getDemucsTimeoutSeconds(), TimeUnit.SECONDS)) {
                process.destroyForcibly();
                return SeparationResult.failure(getName(),
                    "Demucs timed out after " + config.getDemucsTimeoutSeconds() + "s", elapsed(start));
            }
            int exitCode = process.exitValue();
            if (exitCode != 0) {
                String tail = tail(logFile);
                log.warn("Demucs 退出码 {}: {}", exitCode, tail);
                return SeparationResult.failure(getName(),
                    "Demucs exited with code " + exitCode + ": " + tail, elapsed(start));
            }

            Map<StemType, Path> stems = collectStems(workDir, input, outputDir);
            if (stems.size() != StemType.values().length) {
                return SeparationResult.failure(getName(), "Not all stems were produced", elapsed(start));
            }

            double seconds = elapsed(start);
            log.info("Demucs 分离完成: {} ({}s)", input.getFileName(), String.format("%.1f", seconds));
            return SeparationResult.success(getName(), stems, seconds);
        } catch (IOException e) {
            log.error("Demucs 分离失败: {}", input.getFileName(), e);
            return SeparationResult.failure(getName(), e.getMessage(), elapsed(start));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return SeparationResult.failure(getName(), "Interrupted", elapsed(start));
        } finally {
            if (workDir != null) {
                deleteQuietly(workDir);
            }
        }
    }

    List<String> buildCommand(Path input, Path workDir) {
        List<String> command = new ArrayList<>();
        command.add(config.getDemucsCommand());
        command.add("-n");
        command.add(config.getDemucsModel());
        command.add("-o");
        command.add(workDir.toAbsolutePath().toString());
        if (config.getDemucsDevice() != null && !config.getDemucsDevice().isEmpty()) {
            command.add("--device");
            command.add(config.getDemucsDevice());
        }
        command.add(input.toAbsolutePath().toString());
        return command;
    }

    /**
     * demucs 输出布局为 {@code <out>/<model>/<文件名去扩展名>/<stem>.wav}
     */
    Map<StemType, Path> collectStems(Path workDir, Path input, Path outputDir) throws IOException {
        String baseName = input.getFileName().toString();
        int dot = baseName.lastIndexOf('.');
        if (dot > 0) {
            baseName = baseName.substring(0, dot);
        }

        Path stemDir = workDir.resolve(config.getDemucsModel()).resolve(baseName);
        if (!Files.isDirectory(stemDir)) {
            stemDir = findStemDirectory(workDir).orElse(stemDir);
        }

        Map<StemType, Path> stems = new EnumMap<>(StemType.class);
        for (StemType type : StemType.values()) {
            Path produced = stemDir.resolve(type.getFileName());
            if (Files.isRegularFile(produced)) {
                Path target = outputDir.resolve(type.getFileName());
                Files.move(produced, target, StandardCopyOption.REPLACE_EXISTING);
                stems.put(type, target);
            }
        }
        return stems;
    }

    private Optional<Path> findStemDirectory(Path workDir) throws IOException {
        String marker = StemType.VOCALS.getFileName();
        try (Stream<Path> walk = Files.walk(workDir)) {
            return walk.filter(p -> p.getFileName().toString().equals(marker))
                .map(Path::getParent)
                .findFirst();
        }
    }

    private static String tail(Path logFile) {
        try {
            String content = new String(Files.readAllBytes(logFile), StandardCharsets.UTF_8).trim();
            return content.length() <= LOG_TAIL_CHARS ? content : content.substring(content.length() - LOG_TAIL_CHARS);
        } catch (IOException e) {
            return "(no output: " + e.getMessage() + ")";
        }
    }

    private static double elapsed(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000_000.0;
    }

    private static void deleteQuietly(Path dir) {
        try (Stream<Path> walk = Files.walk(dir)) {
            List<Path> paths = new ArrayList<>();
            walk.sorted(Comparator.reverseOrder()).forEach(paths::add);
            for (Path path : paths) {
                Files.deleteIfExists(path);
            }
        } catch (IOException e) {
            log.warn("清理临时目录失败: {} - {}", dir, e.getMessage());
        }
    }
}
