package com.lux032.stemgenerator.web;

import com.lux032.stemgenerator.config.StemConfig;
import com.lux032.stemgenerator.service.BatchScheduler;
import com.lux032.stemgenerator.service.StemPipeline;
import com.lux032.stemgenerator.util.I18nUtil;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.jetty.server.HttpConfiguration;
import org.eclipse.jetty.server.HttpConnectionFactory;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.servlet.ServletContextHandler;
import org.eclipse.jetty.servlet.ServletHolder;

/**
 * 嵌入式 Web 服务器
 * 只读监控接口: 流水线状态和最近事件
 */
@Slf4j
public class WebServer {

    private Server server;
    private final int port;

    public WebServer(int port) {
        this.port = port;
    }

    /**
     * 启动 Web 服务器
     */
    public void start(StemConfig config, StemPipeline pipeline, BatchScheduler batchScheduler) throws Exception {
        server = new Server();

        HttpConfiguration httpConfig = new HttpConfiguration();
        httpConfig.setSendServerVersion(false);

        ServerConnector connector = new ServerConnector(server, new HttpConnectionFactory(httpConfig));
        connector.setPort(port);
        server.addConnector(connector);

        ServletContextHandler servletHandler = new ServletContextHandler(ServletContextHandler.NO_SESSIONS);
        servletHandler.setContextPath("/");
        servletHandler.addServlet(new ServletHolder(new DashboardServlet(config, pipeline, batchScheduler)),
            "/api/dashboard");
        servletHandler.addServlet(new ServletHolder(new LogServlet()), "/api/logs");

        server.setHandler(servletHandler);
        server.start();

        log.info(I18nUtil.getMessage("web.server.separator"));
        log.info(I18nUtil.getMessage("web.server.started"), getPort());
        log.info(I18nUtil.getMessage("web.server.separator"));
    }

    /**
     * 实际监听端口 (配置为 0 时由系统分配)
     */
    public int getPort() {
        if (server != null && server.getConnectors().length > 0) {
            return ((ServerConnector) server.getConnectors()[0]).getLocalPort();
        }
        return port;
    }

    public void stop() throws Exception {
        if (server != null && server.isRunning()) {
            server.stop();
            log.info(I18nUtil.getMessage("web.server.stopped"));
        }
    }

    public boolean isRunning() {
        return server != null && server.isRunning();
    }
}
