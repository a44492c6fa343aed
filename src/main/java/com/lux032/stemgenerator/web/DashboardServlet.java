package com.lux032.stemgenerator.web;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.lux032.stemgenerator.config.StemConfig;
import com.lux032.stemgenerator.model.BatchProgress;
import com.lux032.stemgenerator.service.BatchScheduler;
import com.lux032.stemgenerator.service.StemPipeline;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Dashboard 统计信息接口
 */
@Slf4j
public class DashboardServlet extends HttpServlet {

    private final StemConfig config;
    private final StemPipeline pipeline;
    private final BatchScheduler batchScheduler;
    private final Gson gson;

    public DashboardServlet(StemConfig config, StemPipeline pipeline, BatchScheduler batchScheduler) {
        this.config = config;
        this.pipeline = pipeline;
        this.batchScheduler = batchScheduler;
        this.gson = new GsonBuilder()
            .setPrettyPrinting()
            .serializeSpecialFloatingPointValues()
            .create();
    }

    @Override
    protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
        resp.setContentType("application/json; charset=UTF-8");
        resp.setCharacterEncoding("UTF-8");

        try {
            Map<String, Object> data = collectStatistics();
            resp.setStatus(HttpServletResponse.SC_OK);
            resp.getWriter().write(gson.toJson(data));
        } catch (RuntimeException e) {
            log.error("获取统计信息失败", e);
            resp.setStatus(HttpServletResponse.SC_INTERNAL_SERVER_ERROR);
            Map<String, Object> error = new HashMap<>();
            error.put("error", e.getMessage());
            error.put("dbType", config.getDbType());
            resp.getWriter().write(gson.toJson(error));
        }
    }

    Map<String, Object> collectStatistics() {
        Map<String, Object> stats = new LinkedHashMap<>();

        Map<String, Object> configInfo = new LinkedHashMap<>();
        configInfo.put("outputDirectory", config.getOutputBaseDirectory());
        configInfo.put("dbType", config.getDbType());
        configInfo.put("cacheEnabled", config.isCacheEnabled());
        stats.put("config", configInfo);

        stats.put("pipeline", pipeline.getStats());

        if (batchScheduler != null) {
            BatchProgress progress = batchScheduler.getCurrentProgress();
            if (progress != null) {
                Map<String, Object> batch = new LinkedHashMap<>();
                batch.put("total", progress.getTotal());
                batch.put("completed", progress.getCompleted());
                batch.put("failed", progress.getFailed());
                batch.put("skipped", progress.getSkipped());
                batch.put("remaining", progress.getRemaining());
                batch.put("percentComplete", String.format("%.1f", progress.getPercentComplete()));
                stats.put("batch", batch);
            }
        }

        Map<String, String> systemInfo = new LinkedHashMap<>();
        systemInfo.put("osName", System.getProperty("os.name"));
        systemInfo.put("javaVersion", System.getProperty("java.version"));
        long usedMemory = (Runtime.getRuntime().totalMemory() - Runtime.getRuntime().freeMemory()) / 1024 / 1024;
        long maxMemory = Runtime.getRuntime().maxMemory() / 1024 / 1024;
        systemInfo.put("memory", String.format("%dMB / %dMB", usedMemory, maxMemory));
        stats.put("system", systemInfo);

        return stats;
    }
}
