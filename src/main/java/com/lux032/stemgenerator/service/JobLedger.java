package com.lux032.stemgenerator.service;

import com.lux032.stemgenerator.config.StemConfig;
import com.lux032.stemgenerator.exception.LedgerException;
import com.lux032.stemgenerator.model.JobRecord;
import com.lux032.stemgenerator.model.JobStatus;
import com.lux032.stemgenerator.model.QualityRecord;
import com.lux032.stemgenerator.model.TrackMetadata;
import com.lux032.stemgenerator.model.TrackRecord;
import com.lux032.stemgenerator.util.I18nUtil;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * 持久化任务台账
 * 记录曲目、分离任务和质量评分,跨进程重启保留
 *
 * <p>写操作在进程内串行执行,遇到 SQLITE_BUSY / 锁等待时按指数退避重试;
 * SQLite 以 WAL 模式运行,读操作不会被写阻塞。</p>
 */
@Slf4j
public class JobLedger {

    /**
     * 持久化时对非有限评分做截断,避免 MySQL DOUBLE 无法保存无穷值
     */
    static final double SCORE_LIMIT = 999.0;

    private static final int SQLITE_BUSY = 5;
    private static final int SQLITE_LOCKED = 6;
    private static final int MYSQL_LOCK_WAIT_TIMEOUT = 1205;
    private static final int MYSQL_DEADLOCK = 1213;

    private final DatabaseService databaseService;
    private final StemConfig config;
    private final ReentrantLock writeLock = new ReentrantLock();

    public JobLedger(DatabaseService databaseService, StemConfig config) {
        this.databaseService = databaseService;
        this.config = config;
        initTables();
        log.info(I18nUtil.getMessage("ledger.initialized"), databaseService.getDatabaseType());
    }

    @FunctionalInterface
    private interface SqlWork<T> {
        T run(Connection conn) throws SQLException;
    }

    private void initTables() {
        boolean mysql = databaseService.isMysql();
        String idColumn = mysql ? "BIGINT PRIMARY KEY AUTO_INCREMENT" : "INTEGER PRIMARY KEY AUTOINCREMENT";

        List<String> ddl = new ArrayList<>();
        ddl.add("CREATE TABLE IF NOT EXISTS tracks (" +
            "id " + idColumn + ", " +
            "file_path TEXT NOT NULL, " +
            "file_hash VARCHAR(64) NOT NULL UNIQUE, " +
            "artist VARCHAR(255), " +
            "title VARCHAR(255), " +
            "bpm DOUBLE, " +
            "musical_key VARCHAR(32), " +
            "genre VARCHAR(128), " +
            "created_at VARCHAR(32) NOT NULL" +
            ")");
        ddl.add("CREATE TABLE IF NOT EXISTS jobs (" +
            "id " + idColumn + ", " +
            "track_id BIGINT NOT NULL, " +
            "engine VARCHAR(64) NOT NULL, " +
            "status VARCHAR(16) NOT NULL DEFAULT 'pending', " +
            "processing_time_seconds DOUBLE, " +
            "error_message TEXT, " +
            "created_at VARCHAR(32) NOT NULL, " +
            "completed_at VARCHAR(32), " +
            (mysql ? "INDEX idx_jobs_track (track_id), INDEX idx_jobs_status (status), " : "") +
            "FOREIGN KEY (track_id) REFERENCES tracks(id)" +
            ")");
        ddl.add("CREATE TABLE IF NOT EXISTS quality_scores (" +
            "id " + idColumn + ", " +
            "job_id BIGINT NOT NULL, " +
            "stem_name VARCHAR(16) NOT NULL, " +
            "si_sdr DOUBLE NOT NULL, " +
            "created_at VARCHAR(32) NOT NULL, " +
            (mysql ? "INDEX idx_quality_job (job_id), " : "") +
            "FOREIGN KEY (job_id) REFERENCES jobs(id)" +
            ")");
        if (!mysql) {
            ddl.add("CREATE INDEX IF NOT EXISTS idx_tracks_hash ON tracks(file_hash)");
            ddl.add("CREATE INDEX IF NOT EXISTS idx_jobs_track ON jobs(track_id)");
            ddl.add("CREATE INDEX IF NOT EXISTS idx_jobs_status ON jobs(status)");
            ddl.add("CREATE INDEX IF NOT EXISTS idx_quality_job ON quality_scores(job_id)");
        }

        write("init schema", conn -> {
            try (Statement stmt = conn.createStatement()) {
                for (String sql : ddl) {
                    stmt.execute(sql);
                }
            }
            return null;
        });
        log.debug("台账表结构已就绪");
    }

    // ---------------------------------------------------------------- tracks

    /**
     * 登记曲目,哈希已存在时直接返回已有 ID
     */
    public long addTrack(Path filePath, String fileHash, TrackMetadata metadata) {
        String insert = databaseService.isMysql()
            ? "INSERT IGNORE INTO tracks (file_path, file_hash, artist, title, bpm, musical_key, genre, created_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?)"
            : "INSERT OR IGNORE INTO tracks (file_path, file_hash, artist, title, bpm, musical_key, genre, created_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?)";
        TrackMetadata meta = metadata != null ? metadata : new TrackMetadata();

        return write("add track", conn -> {
            try (PreparedStatement pstmt = conn.prepareStatement(insert)) {
                pstmt.setString(1, filePath.toString());
                pstmt.setString(2, fileHash);
                pstmt.setString(3, meta.getArtist());
                pstmt.setString(4, meta.getTitle());
                setNullableDouble(pstmt, 5, meta.getBpm());
                pstmt.setString(6, meta.getMusicalKey());
                pstmt.setString(7, meta.getGenre());
                pstmt.setString(8, now());
                int inserted = pstmt.executeUpdate();
                if (inserted > 0) {
                    log.debug("新曲目入账: {} ({})", filePath.getFileName(), fileHash);
                }
            }
            try (PreparedStatement pstmt = conn.prepareStatement("SELECT id FROM tracks WHERE file_hash = ?")) {
                pstmt.setString(1, fileHash);
                try (ResultSet rs = pstmt.executeQuery()) {
                    if (!rs.next()) {
                        throw new SQLException("Track row missing after insert: " + fileHash);
                    }
                    return rs.getLong(1);
                }
            }
        });
    }

    public Optional<TrackRecord> getTrackByHash(String fileHash) {
        return read("get track", conn -> {
            try (PreparedStatement pstmt = conn.prepareStatement("SELECT * FROM tracks WHERE file_hash = ?")) {
                pstmt.setString(1, fileHash);
                try (ResultSet rs = pstmt.executeQuery()) {
                    return rs.next() ? Optional.of(mapTrack(rs)) : Optional.<TrackRecord>empty();
                }
            }
        });
    }

    public boolean trackExists(String fileHash) {
        return getTrackByHash(fileHash).isPresent();
    }

    // ------------------------------------------------------------------ jobs

    /**
     * 创建 PENDING 状态的任务
     * @return 任务 ID
     */
    public long createJob(long trackId, String engine) {
        String sql = "INSERT INTO jobs (track_id, engine, status, created_at) VALUES (?, ?, ?, ?)";
        long jobId = write("create job", conn -> {
            try (PreparedStatement pstmt = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
                pstmt.setLong(1, trackId);
                pstmt.setString(2, engine);
                pstmt.setString(3, JobStatus.PENDING.getValue());
                pstmt.setString(4, now());
                pstmt.executeUpdate();
                try (ResultSet keys = pstmt.getGeneratedKeys()) {
                    if (!keys.next()) {
                        throw new SQLException("No generated key for new job");
                    }
                    return keys.getLong(1);
                }
            }
        });
        log.debug("创建任务 #{} (track={}, engine={})", jobId, trackId, engine);
        return jobId;
    }

    public void updateJobStatus(long jobId, JobStatus status) {
        updateJobStatus(jobId, status, null, null);
    }

    /**
     * 推进任务状态
     * 只允许单向迁移,终态任务不会被重新打开; completed_at 只在终态时写入
     *
     * @throws IllegalStateException 迁移不合法
     * @throws IllegalArgumentException 任务不存在
     */
    public void updateJobStatus(long jobId, JobStatus status, Double processingTimeSeconds, String errorMessage) {
        Set<JobStatus> predecessors = status.allowedPredecessors();
        if (predecessors.isEmpty()) {
            throw new IllegalStateException("Job cannot be moved back to " + status);
        }
        String placeholders = predecessors.stream().map(s -> "?").collect(Collectors.joining(", "));
        String sql = "UPDATE jobs SET status = ?, " +
            "processing_time_seconds = COALESCE(?, processing_time_seconds), " +
            "error_message = COALESCE(?, error_message), " +
            "completed_at = ? " +
            "WHERE id = ? AND status IN (" + placeholders + ")";

        int updated = write("update job", conn -> {
            try (PreparedStatement pstmt = conn.prepareStatement(sql)) {
                int i = 1;
                pstmt.setString(i++, status.getValue());
                setNullableDouble(pstmt, i++, processingTimeSeconds);
                pstmt.setString(i++, errorMessage);
                pstmt.setString(i++, status.isTerminal() ? now() : null);
                pstmt.setLong(i++, jobId);
                for (JobStatus predecessor : predecessors) {
                    pstmt.setString(i++, predecessor.getValue());
                }
                return pstmt.executeUpdate();
            }
        });

        if (updated == 0) {
            JobRecord current = getJob(jobId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown job: " + jobId));
            throw new IllegalStateException(
                "Illegal job transition " + current.getStatus() + " -> " + status + " for job #" + jobId);
        }
        log.debug("任务 #{} -> {}", jobId, status);
    }

    public Optional<JobRecord> getJob(long jobId) {
        return read("get job", conn -> {
            try (PreparedStatement pstmt = conn.prepareStatement("SELECT * FROM jobs WHERE id = ?")) {
                pstmt.setLong(1, jobId);
                try (ResultSet rs = pstmt.executeQuery()) {
                    return rs.next() ? Optional.of(mapJob(rs)) : Optional.<JobRecord>empty();
                }
            }
        });
    }

    public List<JobRecord> getJobsForTrack(long trackId) {
        return read("list jobs", conn -> {
            try (PreparedStatement pstmt = conn.prepareStatement("SELECT * FROM jobs WHERE track_id = ? ORDER BY id")) {
                pstmt.setLong(1, trackId);
                List<JobRecord> jobs = new ArrayList<>();
                try (ResultSet rs = pstmt.executeQuery()) {
                    while (rs.next()) {
                        jobs.add(mapJob(rs));
                    }
                }
                return jobs;
            }
        });
    }

    public Optional<JobRecord> getLatestJobForTrack(long trackId) {
        List<JobRecord> jobs = getJobsForTrack(trackId);
        return jobs.isEmpty() ? Optional.empty() : Optional.of(jobs.get(jobs.size() - 1));
    }

    /**
     * 该内容哈希是否有过成功完成的任务
     */
    public boolean hasSuccessfulJob(String fileHash) {
        String sql = "SELECT COUNT(*) FROM jobs j JOIN tracks t ON j.track_id = t.id " +
            "WHERE t.file_hash = ? AND j.status = ?";
        return read("check successful job", conn -> {
            try (PreparedStatement pstmt = conn.prepareStatement(sql)) {
                pstmt.setString(1, fileHash);
                pstmt.setString(2, JobStatus.COMPLETED.getValue());
                try (ResultSet rs = pstmt.executeQuery()) {
                    return rs.next() && rs.getLong(1) > 0;
                }
            }
        });
    }

    // --------------------------------------------------------------- quality

    public void addQualityScore(long jobId, String stemName, double score) {
        addQualityScores(jobId, Map.of(stemName, score));
    }

    /**
     * 在一个事务中写入一组评分
     */
    public void addQualityScores(long jobId, Map<String, Double> scores) {
        if (scores == null || scores.isEmpty()) {
            return;
        }
        String sql = "INSERT INTO quality_scores (job_id, stem_name, si_sdr, created_at) VALUES (?, ?, ?, ?)";
        write("add quality scores", conn -> {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try (PreparedStatement pstmt = conn.prepareStatement(sql)) {
                String createdAt = now();
                for (Map.Entry<String, Double> entry : scores.entrySet()) {
                    pstmt.setLong(1, jobId);
                    pstmt.setString(2, entry.getKey());
                    pstmt.setDouble(3, clampScore(entry.getValue()));
                    pstmt.setString(4, createdAt);
                    pstmt.addBatch();
                }
                pstmt.executeBatch();
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
            return null;
        });
    }

    public List<QualityRecord> getQualityRecords(long jobId) {
        return read("get quality scores", conn -> {
            try (PreparedStatement pstmt = conn.prepareStatement(
                    "SELECT * FROM quality_scores WHERE job_id = ? ORDER BY id")) {
                pstmt.setLong(1, jobId);
                List<QualityRecord> records = new ArrayList<>();
                try (ResultSet rs = pstmt.executeQuery()) {
                    while (rs.next()) {
                        QualityRecord record = new QualityRecord();
                        record.setId(rs.getLong("id"));
                        record.setJobId(rs.getLong("job_id"));
                        record.setStemName(rs.getString("stem_name"));
                        record.setSiSdr(rs.getDouble("si_sdr"));
                        record.setCreatedAt(parseTime(rs.getString("created_at")));
                        records.add(record);
                    }
                }
                return records;
            }
        });
    }

    /**
     * 分轨名 -> 评分,同名多次写入时取最后一次
     */
    public Map<String, Double> getQualityScores(long jobId) {
        Map<String, Double> scores = new LinkedHashMap<>();
        for (QualityRecord record : getQualityRecords(jobId)) {
            scores.put(record.getStemName(), record.getSiSdr());
        }
        return scores;
    }

    public OptionalDouble getAverageQuality(long jobId) {
        return getQualityRecords(jobId).stream()
            .mapToDouble(QualityRecord::getSiSdr)
            .average();
    }

    // ------------------------------------------------------------ statistics

    public LedgerStatistics getStatistics() {
        return read("statistics", conn -> {
            LedgerStatistics stats = new LedgerStatistics();
            try (Statement stmt = conn.createStatement()) {
                try (ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM tracks")) {
                    if (rs.next()) {
                        stats.setTotalTracks(rs.getLong(1));
                    }
                }
                try (ResultSet rs = stmt.executeQuery("SELECT status, COUNT(*) FROM jobs GROUP BY status")) {
                    while (rs.next()) {
                        stats.getJobsByStatus().put(rs.getString(1), rs.getLong(2));
                    }
                }
            }
            return stats;
        });
    }

    // --------------------------------------------------------------- helpers

    private <T> T write(String action, SqlWork<T> work) {
        writeLock.lock();
        try {
            int attempt = 0;
            while (true) {
                try (Connection conn = databaseService.getConnection()) {
                    return work.run(conn);
                } catch (SQLException e) {
                    if (!isBusy(e) || attempt >= config.getDbWriteRetries()) {
                        throw new LedgerException("Ledger " + action + " failed", e);
                    }
                    attempt++;
                    long delay = config.getDbWriteRetryBaseMs() * (1L << Math.min(attempt - 1, 10));
                    log.warn("数据库繁忙,{}ms 后重试 {} (第{}/{}次)", delay, action, attempt, config.getDbWriteRetries());
                    try {
                        Thread.sleep(delay);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        throw new LedgerException("Interrupted while retrying " + action, e);
                    }
                }
            }
        } finally {
            writeLock.unlock();
        }
    }

    private <T> T read(String action, SqlWork<T> work) {
        try (Connection conn = databaseService.getConnection()) {
            return work.run(conn);
        } catch (SQLException e) {
            throw new LedgerException("Ledger " + action + " failed", e);
        }
    }

    static boolean isBusy(SQLException e) {
        int code = e.getErrorCode();
        if (code == SQLITE_BUSY || code == SQLITE_LOCKED
            || code == MYSQL_LOCK_WAIT_TIMEOUT || code == MYSQL_DEADLOCK) {
            return true;
        }
        String message = e.getMessage();
        if (message == null) {
            return false;
        }
        String lower = message.toLowerCase();
        return lower.contains("busy") || lower.contains("database is locked");
    }

    static double clampScore(Double score) {
        if (score == null || score.isNaN()) {
            return -SCORE_LIMIT;
        }
        return Math.max(-SCORE_LIMIT, Math.min(SCORE_LIMIT, score));
    }

    private static void setNullableDouble(PreparedStatement pstmt, int index, Double value) throws SQLException {
        if (value == null) {
            pstmt.setNull(index, Types.DOUBLE);
        } else {
            pstmt.setDouble(index, value);
        }
    }

    private static TrackRecord mapTrack(ResultSet rs) throws SQLException {
        TrackRecord track = new TrackRecord();
        track.setId(rs.getLong("id"));
        track.setFilePath(rs.getString("file_path"));
        track.setFileHash(rs.getString("file_hash"));
        track.setArtist(rs.getString("artist"));
        track.setTitle(rs.getString("title"));
        double bpm = rs.getDouble("bpm");
        track.setBpm(rs.wasNull() ? null : bpm);
        track.setMusicalKey(rs.getString("musical_key"));
        track.setGenre(rs.getString("genre"));
        track.setCreatedAt(parseTime(rs.getString("created_at")));
        return track;
    }

    private static JobRecord mapJob(ResultSet rs) throws SQLException {
        JobRecord job = new JobRecord();
        job.setId(rs.getLong("id"));
        job.setTrackId(rs.getLong("track_id"));
        job.setEngine(rs.getString("engine"));
        job.setStatus(JobStatus.fromValue(rs.getString("status")));
        double seconds = rs.getDouble("processing_time_seconds");
        job.setProcessingTimeSeconds(rs.wasNull() ? null : seconds);
        job.setErrorMessage(rs.getString("error_message"));
        job.setCreatedAt(parseTime(rs.getString("created_at")));
        job.setCompletedAt(parseTime(rs.getString("completed_at")));
        return job;
    }

    private static String now() {
        return LocalDateTime.now().toString();
    }

    private static LocalDateTime parseTime(String value) {
        return value == null ? null : LocalDateTime.parse(value);
    }

    /**
     * 台账统计
     */
    @Data
    public static class LedgerStatistics {
        private long totalTracks;
        private Map<String, Long> jobsByStatus = new LinkedHashMap<>();

        public long getJobCount(JobStatus status) {
            return jobsByStatus.getOrDefault(status.getValue(), 0L);
        }
    }
}
