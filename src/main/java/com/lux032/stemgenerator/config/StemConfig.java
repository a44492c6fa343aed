package com.lux032.stemgenerator.config;

import lombok.Data;

import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;
import java.util.stream.Collectors;

/**
 * 分轨系统配置类
 */
@Data
public class StemConfig {

    public static final String CONFIG_FILE = "config.properties";

    // 输出配置
    private String outputBaseDirectory; // 分轨输出根目录

    // 内容缓存配置
    private boolean cacheEnabled;
    private String cacheDirectory; // 为空时使用 outputBaseDirectory/.stem_cache

    // 数据库配置
    private String dbType; // sqlite (默认) 或 mysql
    private String dbSqlitePath; // 为空时使用 outputBaseDirectory/stem_generator.db
    private String dbHost;
    private int dbPort;
    private String dbDatabase;
    private String dbUsername;
    private String dbPassword;
    private int dbMaxPoolSize;
    private int dbMinIdle;
    private long dbConnectionTimeout;
    private long dbBusyTimeoutMs; // SQLite 忙等待时间
    private int dbWriteRetries; // 写冲突最大重试次数
    private long dbWriteRetryBaseMs; // 首次重试等待,之后指数增长

    // 流水线配置
    private long localSizeThresholdMb; // 小于该大小的文件优先走本地后端
    private boolean qualityFallbackEnabled;

    // Demucs 本地后端
    private String demucsCommand;
    private String demucsModel;
    private String demucsDevice; // cpu / cuda / mps, 为空由 demucs 自行决定
    private int demucsParallelism;
    private long demucsTimeoutSeconds;

    // LALAL.AI 云端后端
    private String lalalApiKey;
    private String lalalApiUrl;
    private long lalalPollIntervalSeconds;
    private long lalalTimeoutSeconds;
    private long lalalUploadTimeoutSeconds;

    // 音频解码 (质量评估用)
    private String ffmpegPath;

    // 扫描配置
    private List<String> priorityCrates;
    private boolean scannerRecursive;
    private String[] supportedFormats;

    // HTTP 代理配置
    private boolean proxyEnabled;
    private String proxyHost;
    private int proxyPort;

    // Web 监控面板
    private boolean webEnabled;
    private int webPort;

    // 国际化配置
    private String language;

    private static StemConfig instance;

    StemConfig() {
        // 默认配置
        this.outputBaseDirectory = System.getProperty("user.home") + "/Music/Stems";
        this.cacheEnabled = true;
        this.cacheDirectory = null;

        this.dbType = "sqlite";
        this.dbSqlitePath = null;
        this.dbHost = "localhost";
        this.dbPort = 3306;
        this.dbDatabase = "stem_generator";
        this.dbUsername = "root";
        this.dbPassword = "";
        this.dbMaxPoolSize = 4;
        this.dbMinIdle = 1;
        this.dbConnectionTimeout = 30000;
        this.dbBusyTimeoutMs = 30000;
        this.dbWriteRetries = 5;
        this.dbWriteRetryBaseMs = 100;

        this.localSizeThresholdMb = 50;
        this.qualityFallbackEnabled = true;

        this.demucsCommand = "demucs";
        this.demucsModel = "htdemucs";
        this.demucsDevice = null;
        this.demucsParallelism = 1;
        this.demucsTimeoutSeconds = 1800;

        this.lalalApiKey = System.getenv("LALAL_API_KEY");
        this.lalalApiUrl = "https://www.lalal.ai/api";
        this.lalalPollIntervalSeconds = 5;
        this.lalalTimeoutSeconds = 600;
        this.lalalUploadTimeoutSeconds = 120;

        this.ffmpegPath = "ffmpeg";

        this.priorityCrates = new ArrayList<>();
        this.scannerRecursive = true;
        this.supportedFormats = new String[]{"mp3", "wav", "flac", "aiff", "aif", "m4a", "ogg"};

        this.webEnabled = false;
        this.webPort = 8080;

        this.language = "en_US";
    }

    /**
     * 获取配置单例
     */
    public static synchronized StemConfig getInstance() {
        if (instance == null) {
            instance = new StemConfig();
            instance.loadFromFile();
        }
        return instance;
    }

    /**
     * 以默认值为基础应用给定属性,不读取配置文件
     */
    public static StemConfig fromProperties(Properties props) {
        StemConfig config = new StemConfig();
        config.applyProperties(props);
        return config;
    }

    /**
     * 从配置文件加载配置
     */
    private void loadFromFile() {
        Properties props = new Properties();
        try (FileInputStream fis = new FileInputStream(CONFIG_FILE)) {
            props.load(fis);
            applyProperties(props);
            System.out.println("Configuration file loaded successfully");
            if (proxyEnabled) {
                System.out.println("HTTP proxy enabled: " + proxyHost + ":" + proxyPort);
            }
        } catch (IOException e) {
            Path configPath = Paths.get(CONFIG_FILE);
            if (!Files.exists(configPath)) {
                System.out.println("Configuration file not found, generating default configuration");
                try {
                    saveToFile(configPath);
                    System.out.println("Default configuration saved to " + CONFIG_FILE);
                } catch (IOException ioException) {
                    System.err.println("Failed to create default configuration: " + ioException.getMessage());
                }
            } else {
                System.err.println("Failed to read configuration, using defaults: " + e.getMessage());
            }
        }
    }

    void applyProperties(Properties props) {
        if (props.containsKey("output.baseDirectory")) {
            this.outputBaseDirectory = props.getProperty("output.baseDirectory").trim();
        }

        // 缓存
        if (props.containsKey("cache.enabled")) {
            this.cacheEnabled = Boolean.parseBoolean(props.getProperty("cache.enabled"));
        }
        if (props.containsKey("cache.directory")) {
            this.cacheDirectory = emptyToNull(props.getProperty("cache.directory"));
        }

        // 数据库
        if (props.containsKey("db.type")) {
            this.dbType = props.getProperty("db.type").trim();
        }
        if (props.containsKey("db.sqlite.path")) {
            this.dbSqlitePath = emptyToNull(props.getProperty("db.sqlite.path"));
        }
        if (props.containsKey("db.mysql.host")) {
            this.dbHost = props.getProperty("db.mysql.host");
        }
        this.dbPort = readInt(props, "db.mysql.port", dbPort);
        if (props.containsKey("db.mysql.database")) {
            this.dbDatabase = props.getProperty("db.mysql.database");
        }
        if (props.containsKey("db.mysql.username")) {
            this.dbUsername = props.getProperty("db.mysql.username");
        }
        if (props.containsKey("db.mysql.password")) {
            this.dbPassword = props.getProperty("db.mysql.password");
        }
        this.dbMaxPoolSize = readInt(props, "db.pool.maxPoolSize", dbMaxPoolSize);
        this.dbMinIdle = readInt(props, "db.pool.minIdle", dbMinIdle);
        this.dbConnectionTimeout = readLong(props, "db.pool.connectionTimeout", dbConnectionTimeout);
        this.dbBusyTimeoutMs = readLong(props, "db.sqlite.busyTimeoutMs", dbBusyTimeoutMs);
        this.dbWriteRetries = readInt(props, "db.writeRetries", dbWriteRetries);
        this.dbWriteRetryBaseMs = readLong(props, "db.writeRetryBaseMs", dbWriteRetryBaseMs);

        // 流水线
        this.localSizeThresholdMb = readLong(props, "pipeline.localSizeThresholdMb", localSizeThresholdMb);
        if (props.containsKey("pipeline.qualityFallback")) {
            this.qualityFallbackEnabled = Boolean.parseBoolean(props.getProperty("pipeline.qualityFallback"));
        }

        // Demucs
        if (props.containsKey("demucs.command")) {
            this.demucsCommand = props.getProperty("demucs.command").trim();
        }
        if (props.containsKey("demucs.model")) {
            this.demucsModel = props.getProperty("demucs.model").trim();
        }
        if (props.containsKey("demucs.device")) {
            this.demucsDevice = emptyToNull(props.getProperty("demucs.device"));
        }
        this.demucsParallelism = readInt(props, "demucs.parallelism", demucsParallelism);
        this.demucsTimeoutSeconds = readLong(props, "demucs.timeoutSeconds", demucsTimeoutSeconds);

        // LALAL.AI, 配置文件优先于环境变量
        if (props.containsKey("lalal.apiKey")) {
            String key = emptyToNull(props.getProperty("lalal.apiKey"));
            if (key != null) {
                this.lalalApiKey = key;
            }
        }
        if (props.containsKey("lalal.apiUrl")) {
            this.lalalApiUrl = props.getProperty("lalal.apiUrl").trim();
        }
        this.lalalPollIntervalSeconds = readLong(props, "lalal.pollIntervalSeconds", lalalPollIntervalSeconds);
        this.lalalTimeoutSeconds = readLong(props, "lalal.timeoutSeconds", lalalTimeoutSeconds);
        this.lalalUploadTimeoutSeconds = readLong(props, "lalal.uploadTimeoutSeconds", lalalUploadTimeoutSeconds);

        if (props.containsKey("audio.ffmpegPath")) {
            this.ffmpegPath = props.getProperty("audio.ffmpegPath").trim();
        }

        // 扫描
        if (props.containsKey("scanner.priorityCrates")) {
            this.priorityCrates = splitList(props.getProperty("scanner.priorityCrates"));
        }
        if (props.containsKey("scanner.recursive")) {
            this.scannerRecursive = Boolean.parseBoolean(props.getProperty("scanner.recursive"));
        }
        if (props.containsKey("file.supportedFormats")) {
            List<String> formats = splitList(props.getProperty("file.supportedFormats"));
            if (!formats.isEmpty()) {
                this.supportedFormats = formats.toArray(new String[0]);
            }
        }

        // 代理
        if (props.containsKey("proxy.enabled")) {
            this.proxyEnabled = Boolean.parseBoolean(props.getProperty("proxy.enabled"));
        }
        if (props.containsKey("proxy.host")) {
            this.proxyHost = props.getProperty("proxy.host");
        }
        this.proxyPort = readInt(props, "proxy.port", proxyPort);

        // Web
        if (props.containsKey("web.enabled")) {
            this.webEnabled = Boolean.parseBoolean(props.getProperty("web.enabled"));
        }
        this.webPort = readInt(props, "web.port", webPort);

        if (props.containsKey("i18n.language")) {
            this.language = props.getProperty("i18n.language").trim();
        }
    }

    private void saveToFile(Path configPath) throws IOException {
        Properties props = new Properties();
        props.setProperty("output.baseDirectory", outputBaseDirectory);
        props.setProperty("cache.enabled", String.valueOf(cacheEnabled));
        props.setProperty("db.type", dbType);
        props.setProperty("db.sqlite.busyTimeoutMs", String.valueOf(dbBusyTimeoutMs));
        props.setProperty("db.mysql.host", dbHost);
        props.setProperty("db.mysql.port", String.valueOf(dbPort));
        props.setProperty("db.mysql.database", dbDatabase);
        props.setProperty("db.mysql.username", dbUsername);
        props.setProperty("db.mysql.password", dbPassword == null ? "" : dbPassword);
        props.setProperty("db.pool.maxPoolSize", String.valueOf(dbMaxPoolSize));
        props.setProperty("db.pool.minIdle", String.valueOf(dbMinIdle));
        props.setProperty("db.pool.connectionTimeout", String.valueOf(dbConnectionTimeout));
        props.setProperty("db.writeRetries", String.valueOf(dbWriteRetries));
        props.setProperty("db.writeRetryBaseMs", String.valueOf(dbWriteRetryBaseMs));
        props.setProperty("pipeline.localSizeThresholdMb", String.valueOf(localSizeThresholdMb));
        props.setProperty("pipeline.qualityFallback", String.valueOf(qualityFallbackEnabled));
        props.setProperty("demucs.command", demucsCommand);
        props.setProperty("demucs.model", demucsModel);
        props.setProperty("demucs.parallelism", String.valueOf(demucsParallelism));
        props.setProperty("demucs.timeoutSeconds", String.valueOf(demucsTimeoutSeconds));
        props.setProperty("lalal.apiUrl", lalalApiUrl);
        props.setProperty("lalal.pollIntervalSeconds", String.valueOf(lalalPollIntervalSeconds));
        props.setProperty("lalal.timeoutSeconds", String.valueOf(lalalTimeoutSeconds));
        props.setProperty("audio.ffmpegPath", ffmpegPath);
        props.setProperty("scanner.priorityCrates", String.join(",", priorityCrates));
        props.setProperty("scanner.recursive", String.valueOf(scannerRecursive));
        props.setProperty("file.supportedFormats", String.join(",", supportedFormats));
        props.setProperty("proxy.enabled", String.valueOf(proxyEnabled));
        props.setProperty("web.enabled", String.valueOf(webEnabled));
        props.setProperty("web.port", String.valueOf(webPort));
        props.setProperty("i18n.language", language);

        try (FileOutputStream fos = new FileOutputStream(configPath.toFile())) {
            props.store(fos, "Stem Generator configuration");
        }
    }

    /**
     * 实际使用的缓存目录
     */
    public String getEffectiveCacheDirectory() {
        if (cacheDirectory != null && !cacheDirectory.isEmpty()) {
            return cacheDirectory;
        }
        return Paths.get(outputBaseDirectory, ".stem_cache").toString();
    }

    /**
     * 实际使用的 SQLite 文件路径
     */
    public String getEffectiveSqlitePath() {
        if (dbSqlitePath != null && !dbSqlitePath.isEmpty()) {
            return dbSqlitePath;
        }
        return Paths.get(outputBaseDirectory, "stem_generator.db").toString();
    }

    public long getLocalSizeThresholdBytes() {
        return localSizeThresholdMb * 1024L * 1024L;
    }

    public boolean isMysql() {
        return "mysql".equalsIgnoreCase(dbType);
    }

    public boolean hasLalalApiKey() {
        return lalalApiKey != null && !lalalApiKey.trim().isEmpty();
    }

    /**
     * 验证配置是否有效,问题直接输出到标准错误
     */
    public boolean isValid() {
        boolean valid = true;
        if (outputBaseDirectory == null || outputBaseDirectory.trim().isEmpty()) {
            System.err.println("Configuration error: output.baseDirectory is empty");
            valid = false;
        }
        if (!"sqlite".equalsIgnoreCase(dbType) && !"mysql".equalsIgnoreCase(dbType)) {
            System.err.println("Configuration error: unsupported db.type " + dbType);
            valid = false;
        }
        if (localSizeThresholdMb <= 0) {
            System.err.println("Configuration error: pipeline.localSizeThresholdMb must be positive");
            valid = false;
        }
        if (lalalPollIntervalSeconds <= 0 || lalalTimeoutSeconds < lalalPollIntervalSeconds) {
            System.err.println("Configuration error: lalal.timeoutSeconds must be >= lalal.pollIntervalSeconds > 0");
            valid = false;
        }
        if (demucsTimeoutSeconds <= 0) {
            System.err.println("Configuration error: demucs.timeoutSeconds must be positive");
            valid = false;
        }
        if (dbWriteRetries < 0) {
            System.err.println("Configuration error: db.writeRetries must not be negative");
            valid = false;
        }
        return valid;
    }

    private static int readInt(Properties props, String key, int current) {
        if (!props.containsKey(key)) {
            return current;
        }
        try {
            return Integer.parseInt(props.getProperty(key).trim());
        } catch (NumberFormatException e) {
            System.err.println("Invalid " + key + " configuration: " + props.getProperty(key));
            return current;
        }
    }

    private static long readLong(Properties props, String key, long current) {
        if (!props.containsKey(key)) {
            return current;
        }
        try {
            return Long.parseLong(props.getProperty(key).trim());
        } catch (NumberFormatException e) {
            System.err.println("Invalid " + key + " configuration: " + props.getProperty(key));
            return current;
        }
    }

    private static List<String> splitList(String value) {
        if (value == null || value.trim().isEmpty()) {
            return new ArrayList<>();
        }
        return Arrays.stream(value.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .collect(Collectors.toList());
    }

    private static String emptyToNull(String value) {
        if (value == null || value.trim().isEmpty()) {
            return null;
        }
        return value.trim();
    }
}
