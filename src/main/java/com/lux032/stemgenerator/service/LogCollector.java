package com.lux032.stemgenerator.service;

import lombok.Data;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * 事件收集器 - 保存最近的分离/批处理事件供监控面板展示
 */
public class LogCollector {

    public static final String INFO = "INFO";
    public static final String WARN = "WARN";
    public static final String ERROR = "ERROR";

    private static final int MAX_LOG_SIZE = 200;
    private static final ConcurrentLinkedQueue<LogEntry> logs = new ConcurrentLinkedQueue<>();
    private static final DateTimeFormatter formatter = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    public static void addLog(String level, String message) {
        logs.offer(new LogEntry(LocalDateTime.now().format(formatter), level, message));
        while (logs.size() > MAX_LOG_SIZE) {
            logs.poll();
        }
    }

    public static void info(String message) {
        addLog(INFO, message);
    }

    public static void warn(String message) {
        addLog(WARN, message);
    }

    public static void error(String message) {
        addLog(ERROR, message);
    }

    /**
     * 获取最近的N条事件,旧的在前
     */
    public static List<LogEntry> getRecentLogs(int limit) {
        List<LogEntry> result = new ArrayList<>();
        Object[] logArray = logs.toArray();
        int startIndex = Math.max(0, logArray.length - Math.max(0, limit));
        for (int i = startIndex; i < logArray.length; i++) {
            result.add((LogEntry) logArray[i]);
        }
        return result;
    }

    public static void clear() {
        logs.clear();
    }

    @Data
    public static class LogEntry {
        private final String timestamp;
        private final String level;
        private final String message;
    }
}
