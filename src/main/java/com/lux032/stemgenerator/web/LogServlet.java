package com.lux032.stemgenerator.web;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.lux032.stemgenerator.service.LogCollector;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 事件接口 - 最近的分离和批处理事件
 */
@Slf4j
public class LogServlet extends HttpServlet {

    private static final int DEFAULT_LIMIT = 50;
    private static final int MAX_LIMIT = 200;

    private final Gson gson;

    public LogServlet() {
        this.gson = new GsonBuilder().setPrettyPrinting().create();
    }

    @Override
    protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
        resp.setContentType("application/json; charset=UTF-8");
        resp.setCharacterEncoding("UTF-8");

        List<LogCollector.LogEntry> logs = LogCollector.getRecentLogs(parseLimit(req.getParameter("limit")));

        Map<String, Object> data = new HashMap<>();
        data.put("logs", logs);
        data.put("count", logs.size());

        resp.setStatus(HttpServletResponse.SC_OK);
        resp.getWriter().write(gson.toJson(data));
    }

    static int parseLimit(String limitParam) {
        if (limitParam == null) {
            return DEFAULT_LIMIT;
        }
        try {
            int limit = Integer.parseInt(limitParam.trim());
            return Math.max(1, Math.min(limit, MAX_LIMIT));
        } catch (NumberFormatException e) {
            log.debug("无效的 limit 参数: {}", limitParam);
            return DEFAULT_LIMIT;
        }
    }
}
