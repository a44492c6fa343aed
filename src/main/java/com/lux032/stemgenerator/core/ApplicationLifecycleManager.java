package com.lux032.stemgenerator.core;

import com.lux032.stemgenerator.backend.DemucsProcessBackend;
import com.lux032.stemgenerator.backend.LalalCloudBackend;
import com.lux032.stemgenerator.backend.SeparationBackend;
import com.lux032.stemgenerator.config.StemConfig;
import com.lux032.stemgenerator.service.AudioSampleReader;
import com.lux032.stemgenerator.service.BatchScheduler;
import com.lux032.stemgenerator.service.DatabaseService;
import com.lux032.stemgenerator.service.JobLedger;
import com.lux032.stemgenerator.service.LibraryScanner;
import com.lux032.stemgenerator.service.QualityAnalyzer;
import com.lux032.stemgenerator.service.StemCache;
import com.lux032.stemgenerator.service.StemFileManager;
import com.lux032.stemgenerator.service.StemPipeline;
import com.lux032.stemgenerator.service.TrackMetadataReader;
import com.lux032.stemgenerator.util.I18nUtil;
import com.lux032.stemgenerator.web.WebServer;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.Arrays;

/**
 * 应用程序生命周期管理器
 * 负责按依赖顺序创建服务,并在退出时逆序关闭
 */
@Slf4j
@Getter
public class ApplicationLifecycleManager {

    private final StemConfig config;

    private DatabaseService databaseService;
    private JobLedger jobLedger;
    private StemCache stemCache;
    private StemFileManager fileManager;
    private QualityAnalyzer qualityAnalyzer;
    private TrackMetadataReader metadataReader;
    private DemucsProcessBackend demucsBackend;
    private LalalCloudBackend lalalBackend;
    private StemPipeline pipeline;
    private LibraryScanner libraryScanner;
    private BatchScheduler batchScheduler;
    private WebServer webServer;

    public ApplicationLifecycleManager(StemConfig config) {
        this.config = config;
    }

    /**
     * 初始化所有服务
     */
    public void initializeServices() {
        log.info(I18nUtil.getMessage("app.init.services"));

        // Level 0: 国际化
        I18nUtil.init(config.getLanguage());
        log.info(I18nUtil.getMessage("app.init.i18n"), config.getLanguage());

        // Level 1: 数据库
        log.info(I18nUtil.getMessage("app.init.database"), config.getDbType());
        databaseService = new DatabaseService(config);

        // Level 2: 台账、缓存和文件服务
        jobLedger = new JobLedger(databaseService, config);
        if (config.isCacheEnabled()) {
            stemCache = new StemCache(config.getEffectiveCacheDirectory());
        } else {
            log.info(I18nUtil.getMessage("app.cache.disabled"));
        }
        fileManager = new StemFileManager(config.getOutputBaseDirectory());
        metadataReader = new TrackMetadataReader();
        qualityAnalyzer = new QualityAnalyzer(new AudioSampleReader(config.getFfmpegPath()));

        // Level 3: 分离后端
        log.info(I18nUtil.getMessage("app.init.engines"));
        demucsBackend = new DemucsProcessBackend(config);
        lalalBackend = new LalalCloudBackend(config);

        // Level 4: 流水线和批处理
        pipeline = new StemPipeline(
            config,
            Arrays.<SeparationBackend>asList(demucsBackend, lalalBackend),
            jobLedger,
            stemCache,
            qualityAnalyzer,
            fileManager,
            metadataReader
        );
        libraryScanner = new LibraryScanner(config, metadataReader);
        batchScheduler = new BatchScheduler(pipeline, libraryScanner, config);

        log.info(I18nUtil.getMessage("app.all.services.ready"));
    }

    /**
     * 启动 Web 监控面板 (配置开启时)
     */
    public void startWebServer() {
        if (!config.isWebEnabled()) {
            return;
        }
        try {
            webServer = new WebServer(config.getWebPort());
            webServer.start(config, pipeline, batchScheduler);
        } catch (Exception e) {
            log.error(I18nUtil.getMessage("main.web.start.error"), e);
            log.warn(I18nUtil.getMessage("main.web.unavailable"));
        }
    }

    /**
     * 按依赖关系逆序关闭服务
     */
    public void shutdown() {
        log.info(I18nUtil.getMessage("app.shutting.down"));

        if (webServer != null && webServer.isRunning()) {
            try {
                webServer.stop();
            } catch (Exception e) {
                log.warn(I18nUtil.getMessage("app.shutdown.web.server.error"), e);
            }
        }

        if (lalalBackend != null) {
            try {
                lalalBackend.close();
            } catch (IOException e) {
                log.warn("关闭 HTTP 客户端失败", e);
            }
        }

        if (databaseService != null) {
            databaseService.close();
        }

        log.info(I18nUtil.getMessage("app.shutdown.complete"));
    }
}
