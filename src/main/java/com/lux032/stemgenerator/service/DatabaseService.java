package com.lux032.stemgenerator.service;

import com.lux032.stemgenerator.config.StemConfig;
import com.lux032.stemgenerator.util.I18nUtil;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * 数据库服务 - 统一管理数据库连接池
 * 默认使用本地 SQLite 文件 (WAL 模式),可配置为 MySQL
 */
@Slf4j
public class DatabaseService {

    private final HikariDataSource dataSource;
    private final StemConfig config;
    private final boolean mysql;

    /**
     * 构造函数
     * @param config 配置对象
     */
    public DatabaseService(StemConfig config) {
        this.config = config;
        this.mysql = config.isMysql();
        this.dataSource = initDataSource();

        log.info(I18nUtil.getMessage("db.service.initialized"));
    }

    /**
     * 初始化数据源
     */
    private HikariDataSource initDataSource() {
        HikariConfig hikariConfig = new HikariConfig();
        String jdbcUrl;

        if (mysql) {
            jdbcUrl = String.format(
                "jdbc:mysql://%s:%s/%s?useUnicode=true&characterEncoding=UTF-8&useSSL=false&allowPublicKeyRetrieval=true",
                config.getDbHost(),
                config.getDbPort(),
                config.getDbDatabase()
            );
            hikariConfig.setUsername(config.getDbUsername());
            hikariConfig.setPassword(config.getDbPassword());
        } else {
            Path dbFile = Paths.get(config.getEffectiveSqlitePath()).toAbsolutePath();
            try {
                if (dbFile.getParent() != null) {
                    Files.createDirectories(dbFile.getParent());
                }
            } catch (IOException e) {
                throw new RuntimeException("无法创建数据库目录: " + dbFile.getParent(), e);
            }
            jdbcUrl = "jdbc:sqlite:" + dbFile;
            // 由驱动在每个连接上设置 PRAGMA
            hikariConfig.addDataSourceProperty("journal_mode", "WAL");
            hikariConfig.addDataSourceProperty("busy_timeout", String.valueOf(config.getDbBusyTimeoutMs()));
            hikariConfig.addDataSourceProperty("foreign_keys", "true");
        }

        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(config.getDbMaxPoolSize());
        hikariConfig.setMinimumIdle(config.getDbMinIdle());
        hikariConfig.setConnectionTimeout(config.getDbConnectionTimeout());
        hikariConfig.setPoolName("stem-ledger");
        hikariConfig.setConnectionTestQuery("SELECT 1");

        log.info(I18nUtil.getMessage("db.config"), jdbcUrl);
        log.info(I18nUtil.getMessage("db.pool.config"), config.getDbMaxPoolSize(), config.getDbMinIdle());

        try {
            HikariDataSource ds = new HikariDataSource(hikariConfig);
            try (Connection conn = ds.getConnection()) {
                if (!mysql) {
                    try (Statement st = conn.createStatement()) {
                        st.execute("PRAGMA journal_mode=WAL");
                    }
                }
                log.info(I18nUtil.getMessage("db.connection.test.success"));
            }
            return ds;
        } catch (SQLException | RuntimeException e) {
            log.error(I18nUtil.getMessage("db.connection.test.failed"), e);
            if (mysql) {
                log.error(I18nUtil.getMessage("db.check.mysql.running"));
                log.error(I18nUtil.getMessage("db.check.database.created"), config.getDbDatabase());
            }
            throw new RuntimeException("数据库连接失败", e);
        }
    }

    /**
     * 获取数据库连接
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    public DataSource getDataSource() {
        return dataSource;
    }

    /**
     * 是否为 MySQL 方言
     */
    public boolean isMysql() {
        return mysql;
    }

    public String getDatabaseType() {
        return mysql ? "mysql" : "sqlite";
    }

    /**
     * 检查数据库是否可用
     */
    public boolean isAvailable() {
        try (Connection conn = getConnection()) {
            return conn.isValid(5);
        } catch (SQLException e) {
            log.error(I18nUtil.getMessage("db.unavailable"), e);
            return false;
        }
    }

    /**
     * 关闭数据源
     */
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            log.info(I18nUtil.getMessage("db.pool.closed"));
        }
    }
}
