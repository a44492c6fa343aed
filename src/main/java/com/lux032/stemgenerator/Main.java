package com.lux032.stemgenerator;

import com.lux032.stemgenerator.config.StemConfig;
import com.lux032.stemgenerator.core.ApplicationLifecycleManager;
import com.lux032.stemgenerator.exception.StemGeneratorException;
import com.lux032.stemgenerator.model.BatchError;
import com.lux032.stemgenerator.model.BatchProgress;
import com.lux032.stemgenerator.model.BatchResult;
import com.lux032.stemgenerator.model.ScannedTrack;
import com.lux032.stemgenerator.model.SeparationResult;
import com.lux032.stemgenerator.model.StemType;
import com.lux032.stemgenerator.service.BatchScheduler;
import com.lux032.stemgenerator.service.QualityAnalyzer;
import com.lux032.stemgenerator.service.StemCache;
import com.lux032.stemgenerator.service.StemPipeline;
import com.lux032.stemgenerator.util.BannerUtil;
import com.lux032.stemgenerator.util.I18nUtil;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 分轨生成系统主程序
 * 功能：
 * 1. 单文件分离 (本地 Demucs / 云端 LALAL.AI,质量不达标时自动回退)
 * 2. 按优先级批量处理音乐库,支持断点续处理
 * 3. 内容缓存管理
 */
@Slf4j
public class Main {

    public static void main(String[] args) {
        CliArguments cli;
        try {
            cli = CliArguments.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            printUsage();
            System.exit(2);
            return;
        }
        if (cli.getCommand() == null || "help".equals(cli.getCommand())) {
            printUsage();
            return;
        }

        BannerUtil.printBanner();

        StemConfig config = StemConfig.getInstance();
        I18nUtil.init(config.getLanguage());
        if (!config.isValid()) {
            log.error(I18nUtil.getMessage("app.config.invalid"));
            System.exit(1);
            return;
        }
        log.info(I18nUtil.getMessage("app.config.loaded"));
        log.info(I18nUtil.getMessage("app.output.directory"), config.getOutputBaseDirectory());

        ApplicationLifecycleManager lifecycleManager = new ApplicationLifecycleManager(config);
        int exitCode;
        try {
            lifecycleManager.initializeServices();
            lifecycleManager.startWebServer();
            exitCode = execute(cli, lifecycleManager);
        } catch (StemGeneratorException e) {
            log.error(I18nUtil.getMessage("main.error"), e.getMessage());
            exitCode = 1;
        } catch (RuntimeException e) {
            log.error(I18nUtil.getMessage("main.error"), e.getMessage(), e);
            exitCode = 1;
        } finally {
            lifecycleManager.shutdown();
        }

        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    private static int execute(CliArguments cli, ApplicationLifecycleManager lifecycle) {
        switch (cli.getCommand()) {
            case "separate":
                return separate(cli, lifecycle.getPipeline());
            case "batch":
                return batch(cli, lifecycle.getBatchScheduler(), false);
            case "resume":
                return batch(cli, lifecycle.getBatchScheduler(), true);
            case "pending":
                return pending(cli, lifecycle.getBatchScheduler());
            case "cache":
                return cache(cli, lifecycle.getStemCache());
            case "info":
                return info(lifecycle.getPipeline());
            default:
                System.err.println("Unknown command: " + cli.getCommand());
                printUsage();
                return 2;
        }
    }

    private static int separate(CliArguments cli, StemPipeline pipeline) {
        Path file = Paths.get(cli.requirePositional(0, "file"));
        SeparationResult result = pipeline.separate(file,
            cli.getOption("engine", StemPipeline.ENGINE_AUTO),
            !cli.hasFlag("force"),
            !cli.hasFlag("no-fallback"));

        if (!result.isSuccess()) {
            System.out.println("✗ " + result.getErrorMessage());
            return 1;
        }
        System.out.println("✓ " + file.getFileName() + " -> " + result.getOutputDirectory());
        System.out.println("  engine: " + result.getEngine()
            + String.format(" (%.1fs)", result.getProcessingTimeSeconds()));
        for (StemType type : StemType.values()) {
            Double score = result.getQualityScores().get(type.getStemName());
            System.out.println(String.format("  %-7s %s", type.getStemName(),
                score == null ? "-" : String.format("%.2f dB (%s)", score, QualityAnalyzer.label(score).getLabel())));
        }
        if (result.getFallbackError() != null) {
            System.out.println("  fallback " + result.getFallbackEngine() + " failed: " + result.getFallbackError());
        }
        return 0;
    }

    private static int batch(CliArguments cli, BatchScheduler scheduler, boolean resume) {
        Path directory = Paths.get(cli.requirePositional(0, "directory"));
        BatchScheduler.ProgressCallback callback = (progress, track) -> System.out.println(
            String.format("[%d/%d] %.1f%% %s", progress.getTotal() - progress.getRemaining(),
                progress.getTotal(), progress.getPercentComplete(), track.getDisplayName()));

        BatchResult result = resume
            ? scheduler.resumeProcessing(directory, callback)
            : scheduler.processDirectory(directory, callback, !cli.hasFlag("no-skip"),
                cli.getIntOption("limit", 0));

        BatchProgress progress = result.getProgress();
        System.out.println(String.format("completed=%d skipped=%d failed=%d (%.1fs)",
            progress.getCompleted(), progress.getSkipped(), progress.getFailed(),
            result.getProcessingTimeSeconds()));
        for (BatchError error : result.getErrors()) {
            System.out.println("  ✗ " + (error.getTrack() == null ? "" : error.getTrack().getDisplayName() + ": ")
                + error.getMessage());
        }
        return result.getErrors().isEmpty() ? 0 : 1;
    }

    private static int pending(CliArguments cli, BatchScheduler scheduler) {
        Path directory = Paths.get(cli.requirePositional(0, "directory"));
        List<ScannedTrack> pending = scheduler.getPendingTracks(directory);
        for (ScannedTrack track : pending) {
            System.out.println(String.format("%-8s %s", track.getPriority(), track.getDisplayName()));
        }
        System.out.println(pending.size() + " pending");
        return 0;
    }

    private static int cache(CliArguments cli, StemCache cache) {
        if (cache == null) {
            System.out.println(I18nUtil.getMessage("app.cache.disabled"));
            return 1;
        }
        String action = cli.getPositionals().isEmpty() ? "stats" : cli.getPositionals().get(0);
        if ("clear".equals(action)) {
            Integer days = cli.hasOption("older-than") ? cli.getIntOption("older-than", 0) : null;
            System.out.println("removed " + cache.clearCache(days) + " entries");
            return 0;
        }
        if ("stats".equals(action)) {
            System.out.println(cache.getStatistics());
            return 0;
        }
        System.err.println("Unknown cache action: " + action);
        return 2;
    }

    private static int info(StemPipeline pipeline) {
        for (Map.Entry<String, Object> entry : pipeline.getStats().entrySet()) {
            System.out.println(entry.getKey() + ": " + entry.getValue());
        }
        return 0;
    }

    private static void printUsage() {
        System.out.println("Usage:");
        System.out.println("  separate <file> [--engine auto|demucs|lalal] [--no-fallback] [--force]");
        System.out.println("  batch <directory> [--limit N] [--no-skip]");
        System.out.println("  resume <directory>");
        System.out.println("  pending <directory>");
        System.out.println("  cache stats | cache clear [--older-than DAYS]");
        System.out.println("  info");
    }

    /**
     * 命令行参数: 命令 + 位置参数 + {@code --name value} 选项 + {@code --flag} 开关
     */
    static class CliArguments {
        private static final Set<String> VALUE_OPTIONS = Set.of("engine", "limit", "older-than");

        private String command;
        private final List<String> positionals = new ArrayList<>();
        private final Map<String, String> options = new HashMap<>();
        private final Set<String> flags = new HashSet<>();

        static CliArguments parse(String[] args) {
            CliArguments cli = new CliArguments();
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                if (arg.startsWith("--")) {
                    String name = arg.substring(2);
                    if (VALUE_OPTIONS.contains(name)) {
                        if (i + 1 >= args.length) {
                            throw new IllegalArgumentException("Missing value for --" + name);
                        }
                        cli.options.put(name, args[++i]);
                    } else {
                        cli.flags.add(name);
                    }
                } else if (cli.command == null) {
                    cli.command = arg;
                } else {
                    cli.positionals.add(arg);
                }
            }
            return cli;
        }

        String getCommand() {
            return command;
        }

        List<String> getPositionals() {
            return positionals;
        }

        String requirePositional(int index, String name) {
            if (positionals.size() <= index) {
                throw new IllegalArgumentException("Missing argument: " + name);
            }
            return positionals.get(index);
        }

        boolean hasOption(String name) {
            return options.containsKey(name);
        }

        String getOption(String name, String defaultValue) {
            return options.getOrDefault(name, defaultValue);
        }

        int getIntOption(String name, int defaultValue) {
            String value = options.get(name);
            if (value == null) {
                return defaultValue;
            }
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("--" + name + " expects a number: " + value, e);
            }
        }

        boolean hasFlag(String name) {
            return flags.contains(name);
        }
    }
}
