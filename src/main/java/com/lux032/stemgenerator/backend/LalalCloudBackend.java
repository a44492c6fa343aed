package com.lux032.stemgenerator.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lux032.stemgenerator.config.StemConfig;
import com.lux032.stemgenerator.exception.RemoteTimeoutException;
import com.lux032.stemgenerator.exception.SeparationFailureException;
import com.lux032.stemgenerator.model.SeparationResult;
import com.lux032.stemgenerator.model.StemType;
import com.lux032.stemgenerator.util.I18nUtil;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.entity.mime.MultipartEntityBuilder;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.CloseableHttpResponse;
import org.apache.hc.client5.http.impl.classic.HttpClientBuilder;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.HttpHost;
import org.apache.hc.core5.http.ParseException;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.util.Timeout;

import java.io.IOException;
import java.io.InputStream;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * LALAL.AI 云端分离后端
 * 上传文件 -> 定时轮询任务状态 -> 下载四条分轨
 */
@Slf4j
public class LalalCloudBackend implements SeparationBackend {

    public static final String NAME = "lalal_cloud";

    static final Set<String> ALLOWED_EXTENSIONS = Set.of("mp3", "wav", "flac", "ogg", "m4a", "aac", "wma");
    static final long MAX_FILE_SIZE_BYTES = 100L * 1024 * 1024;

    private static final String UPLOAD_ENDPOINT = "/upload/";
    private static final String CHECK_ENDPOINT = "/check/";
    private static final String STATUS_DONE = "done";
    private static final String STATUS_ERROR = "error";

    private final StemConfig config;
    private final CloseableHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public LalalCloudBackend(StemConfig config) {
        this.config = config;
        this.httpClient = createHttpClient(config);
        this.objectMapper = new ObjectMapper();
    }

    /**
     * 创建 HttpClient,支持代理配置
     */
    private CloseableHttpClient createHttpClient(StemConfig config) {
        HttpClientBuilder builder = HttpClients.custom();

        RequestConfig requestConfig = RequestConfig.custom()
            .setConnectionRequestTimeout(Timeout.ofSeconds(30))
            .setResponseTimeout(Timeout.ofSeconds(30))
            .build();
        builder.setDefaultRequestConfig(requestConfig);

        if (config.isProxyEnabled() && config.getProxyHost() != null && !config.getProxyHost().isEmpty()) {
            builder.setProxy(new HttpHost(config.getProxyHost(), config.getProxyPort()));
            log.info(I18nUtil.getMessage("proxy.enabled"), config.getProxyHost(), config.getProxyPort());
        } else if (config.isProxyEnabled()) {
            log.warn(I18nUtil.getMessage("proxy.enabled.no.host"));
        }

        return builder.build();
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public boolean isLocal() {
        return false;
    }

    @Override
    public int getRecommendedParallelism() {
        return 1;
    }

    @Override
    public boolean isAvailable() {
        return config.hasLalalApiKey();
    }

    @Override
    public SeparationResult separate(Path input, Path outputDir) {
        long start = System.nanoTime();

        if (!isAvailable()) {
            return SeparationResult.failure(NAME, "LALAL.AI API key not configured", 0);
        }
        String validationError = validateFile(input);
        if (validationError != null) {
            return SeparationResult.failure(NAME, validationError, 0);
        }

        Map<StemType, Path> stems = new EnumMap<>(StemType.class);
        try {
            Files.createDirectories(outputDir);

            log.info("上传到 LALAL.AI: {}", input.getFileName());
            String jobId = upload(input);

            JsonNode status = waitForCompletion(jobId);
            JsonNode result = status.path("result");
            for (StemType type : StemType.values()) {
                String url = result.path(remoteStemName(type)).asText(null);
                if (url == null || url.isEmpty()) {
                    log.warn("LALAL.AI 未返回分轨: {}", type.getStemName());
                    continue;
                }
                Path target = outputDir.resolve(type.getFileName());
                if (download(url, target)) {
                    stems.put(type, target);
                }
            }

            double seconds = elapsed(start);
            if (stems.size() != StemType.values().length) {
                SeparationResult failure = SeparationResult.failure(NAME, "Not all stems were retrieved", seconds);
                failure.getStems().putAll(stems);
                return failure;
            }
            log.info("LALAL.AI 分离完成: {} ({}s)", input.getFileName(), String.format("%.1f", seconds));
            return SeparationResult.success(NAME, stems, seconds);
        } catch (SeparationFailureException e) {
            log.warn("LALAL.AI 分离失败: {} - {}", input.getFileName(), e.getMessage());
            return SeparationResult.failure(NAME, e.getMessage(), elapsed(start));
        } catch (IOException e) {
            log.error("LALAL.AI 请求失败: {}", input.getFileName(), e);
            return SeparationResult.failure(NAME, e.getMessage(), elapsed(start));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return SeparationResult.failure(NAME, "Interrupted", elapsed(start));
        }
    }

    /**
     * 上传前校验
     * @return 错误信息,通过时返回 null
     */
    String validateFile(Path input) {
        if (!Files.isRegularFile(input)) {
            return "File does not exist";
        }
        String name = input.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String extension = dot >= 0 ? name.substring(dot + 1).toLowerCase(Locale.ROOT) : "";
        if (!ALLOWED_EXTENSIONS.contains(extension)) {
            return "Unsupported file type: ." + extension;
        }
        try {
            long size = Files.size(input);
            if (size > MAX_FILE_SIZE_BYTES) {
                return String.format("File too large: %.1fMB (max 100MB)", size / 1024.0 / 1024.0);
            }
        } catch (IOException e) {
            return "Cannot read file size: " + e.getMessage();
        }
        return null;
    }

    /**
     * 轮询直到任务完成、出错或超时
     */
    JsonNode waitForCompletion(String jobId) throws IOException, InterruptedException {
        long timeoutMillis = config.getLalalTimeoutSeconds() * 1000L;
        long pollMillis = Math.max(1, config.getLalalPollIntervalSeconds()) * 1000L;
        long deadline = nowMillis() + timeoutMillis;

        while (nowMillis() < deadline) {
            JsonNode status = checkStatus(jobId);
            String state = status.path("status").asText("");
            if (STATUS_DONE.equals(state)) {
                return status;
            }
            if (STATUS_ERROR.equals(state)) {
                String error = status.path("error").asText("Unknown");
                throw new SeparationFailureException("LALAL.AI processing error: " + error, NAME);
            }
            log.debug("LALAL.AI 任务 {} 状态: {}", jobId, state);
            pause(pollMillis);
        }
        throw new RemoteTimeoutException(NAME, config.getLalalTimeoutSeconds());
    }

    protected String upload(Path input) throws IOException {
        HttpPost httpPost = new HttpPost(config.getLalalApiUrl() + UPLOAD_ENDPOINT);
        httpPost.setHeader("Authorization", "license " + config.getLalalApiKey());
        httpPost.setConfig(RequestConfig.custom()
            .setResponseTimeout(Timeout.ofSeconds(config.getLalalUploadTimeoutSeconds()))
            .build());
        HttpEntity entity = MultipartEntityBuilder.create()
            .addBinaryBody("file", input.toFile(), ContentType.DEFAULT_BINARY, input.getFileName().toString())
            .addTextBody("stem", "vocals")
            .build();
        httpPost.setEntity(entity);

        try (CloseableHttpResponse response = httpClient.execute(httpPost)) {
            if (response.getCode() != 200) {
                throw new SeparationFailureException("Upload failed with status code " + response.getCode(), NAME);
            }
            JsonNode root = objectMapper.readTree(EntityUtils.toString(response.getEntity()));
            String id = root.path("id").asText(null);
            if (id == null || id.isEmpty()) {
                throw new SeparationFailureException("Invalid upload response: missing id", NAME);
            }
            log.info("上传完成, 任务 ID: {}", id);
            return id;
        } catch (ParseException e) {
            throw new IOException("Cannot parse upload response", e);
        }
    }

    /**
     * 查询任务状态,请求失败时按 error 状态返回
     */
    protected JsonNode checkStatus(String jobId) throws IOException {
        String url = config.getLalalApiUrl() + CHECK_ENDPOINT + "?id="
            + URLEncoder.encode(jobId, StandardCharsets.UTF_8);
        HttpGet httpGet = new HttpGet(url);
        httpGet.setHeader("Authorization", "license " + config.getLalalApiKey());

        try (CloseableHttpResponse response = httpClient.execute(httpGet)) {
            if (response.getCode() != 200) {
                log.warn("状态查询失败: {}", response.getCode());
                return objectMapper.createObjectNode().put("status", STATUS_ERROR)
                    .put("error", "HTTP " + response.getCode());
            }
            JsonNode root = objectMapper.readTree(EntityUtils.toString(response.getEntity()));
            if (!root.has("status")) {
                log.warn("状态响应缺少 status 字段");
                return objectMapper.createObjectNode().put("status", STATUS_ERROR)
                    .put("error", "Invalid status response");
            }
            return root;
        } catch (ParseException e) {
            throw new IOException("Cannot parse status response", e);
        }
    }

    protected boolean download(String url, Path target) throws IOException {
        HttpGet httpGet = new HttpGet(url);
        httpGet.setConfig(RequestConfig.custom()
            .setResponseTimeout(Timeout.ofSeconds(config.getLalalUploadTimeoutSeconds()))
            .build());
        try (CloseableHttpResponse response = httpClient.execute(httpGet)) {
            if (response.getCode() != 200 || response.getEntity() == null) {
                log.error("下载分轨失败: {}", response.getCode());
                return false;
            }
            try (InputStream in = response.getEntity().getContent()) {
                Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("分轨已下载: {}", target);
            return true;
        }
    }

    protected long nowMillis() {
        return System.currentTimeMillis();
    }

    protected void pause(long millis) throws InterruptedException {
        Thread.sleep(millis);
    }

    static String remoteStemName(StemType type) {
        switch (type) {
            case VOCALS:
                return "vocal";
            case DRUMS:
                return "drum";
            case BASS:
                return "bass";
            default:
                return "other";
        }
    }

    private static double elapsed(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000_000.0;
    }

    /**
     * 关闭客户端
     */
    public void close() throws IOException {
        httpClient.close();
    }
}
