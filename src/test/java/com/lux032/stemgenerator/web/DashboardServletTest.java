package com.lux032.stemgenerator.web;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.lux032.stemgenerator.config.StemConfig;
import com.lux032.stemgenerator.model.BatchProgress;
import com.lux032.stemgenerator.service.BatchScheduler;
import com.lux032.stemgenerator.service.StemPipeline;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DashboardServletTest {

    private StemPipeline pipeline;
    private BatchScheduler batchScheduler;
    private DashboardServlet servlet;

    @BeforeEach
    void setUp() {
        pipeline = mock(StemPipeline.class);
        batchScheduler = mock(BatchScheduler.class);
        Map<String, Object> pipelineStats = new LinkedHashMap<>();
        pipelineStats.put("qualityFallback", true);
        when(pipeline.getStats()).thenReturn(pipelineStats);
        servlet = new DashboardServlet(StemConfig.fromProperties(new Properties()), pipeline, batchScheduler);
    }

    @Test
    void batchSectionAppearsOnlyWhileBatchKnown() {
        assertThat(servlet.collectStatistics()).containsKeys("config", "pipeline", "system").doesNotContainKey("batch");

        when(batchScheduler.getCurrentProgress()).thenReturn(new BatchProgress(4, 1, 1, 0));
        @SuppressWarnings("unchecked")
        Map<String, Object> batch = (Map<String, Object>) servlet.collectStatistics().get("batch");

        assertThat(batch).containsEntry("total", 4).containsEntry("remaining", 2).containsEntry("percentComplete", String.format("%.1f", 50.0));
    }

    @Test
    void doGetWritesJson() throws Exception {
        HttpServletRequest request = mock(HttpServletRequest.class);
        HttpServletResponse response = mock(HttpServletResponse.class);
        StringWriter body = new StringWriter();
        when(response.getWriter()).thenReturn(new PrintWriter(body));

        servlet.doGet(request, response);

        verify(response).setStatus(HttpServletResponse.SC_OK);
        JsonObject json = JsonParser.parseString(body.toString()).getAsJsonObject();
        assertThat(json.getAsJsonObject("config").get("dbType").getAsString()).isEqualTo("sqlite");
        assertThat(json.getAsJsonObject("pipeline").get("qualityFallback").getAsBoolean()).isTrue();
    }

    @Test
    void failuresAreReportedAsServerError() throws Exception {
        when(pipeline.getStats()).thenThrow(new IllegalStateException("ledger offline"));
        HttpServletResponse response = mock(HttpServletResponse.class);
        StringWriter body = new StringWriter();
        when(response.getWriter()).thenReturn(new PrintWriter(body));

        servlet.doGet(mock(HttpServletRequest.class), response);

        verify(response).setStatus(HttpServletResponse.SC_INTERNAL_SERVER_ERROR);
        assertThat(body.toString()).contains("ledger offline");
    }
}
