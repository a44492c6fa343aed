package com.lux032.stemgenerator.service;

import com.lux032.stemgenerator.backend.SeparationBackend;
import com.lux032.stemgenerator.config.StemConfig;
import com.lux032.stemgenerator.exception.EngineUnavailableException;
import com.lux032.stemgenerator.exception.NoEngineAvailableException;
import com.lux032.stemgenerator.model.JobRecord;
import com.lux032.stemgenerator.model.JobStatus;
import com.lux032.stemgenerator.model.SeparationResult;
import com.lux032.stemgenerator.model.StemType;
import com.lux032.stemgenerator.model.TrackMetadata;
import com.lux032.stemgenerator.util.FileHashUtils;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class StemPipelineTest {

    @TempDir
    Path tempDir;

    private StemConfig config;
    private DatabaseService databaseService;
    private JobLedger ledger;
    private StemCache cache;
    private QualityAnalyzer qualityAnalyzer;
    private TrackMetadataReader metadataReader;
    private StemFileManager fileManager;
    private FakeBackend local;
    private FakeBackend remote;
    private Path track;

    @BeforeEach
    void setUp() throws IOException {
        Properties props = new Properties();
        props.setProperty("output.baseDirectory", tempDir.resolve("stems").toString());
        props.setProperty("db.sqlite.path", tempDir.resolve("ledger.db").toString());
        props.setProperty("cache.directory", tempDir.resolve("cache").toString());
        props.setProperty("pipeline.localSizeThresholdMb", "1");
        config = StemConfig.fromProperties(props);

        databaseService = new DatabaseService(config);
        ledger = new JobLedger(databaseService, config);
        cache = new StemCache(config.getEffectiveCacheDirectory());
        fileManager = new StemFileManager(config.getOutputBaseDirectory());

        qualityAnalyzer = mock(QualityAnalyzer.class);
        when(qualityAnalyzer.analyzeStems(any(), any())).thenReturn(scores(14.0));

        metadataReader = mock(TrackMetadataReader.class);
        TrackMetadata metadata = new TrackMetadata();
        metadata.setArtist("Test Artist");
        metadata.setTitle("Test Song");
        when(metadataReader.read(any())).thenReturn(metadata);

        local = new FakeBackend("demucs_htdemucs", true);
        remote = new FakeBackend("lalal_cloud", false);

        track = tempDir.resolve("song.mp3");
        Files.write(track, "small audio payload".getBytes(StandardCharsets.UTF_8));
    }

    @AfterEach
    void tearDown() {
        databaseService.close();
    }

    @Test
    void goodQualityKeepsPrimaryResult() throws IOException {
        SeparationResult result = pipeline().separate(track, StemPipeline.ENGINE_AUTO, true, true);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getEngine()).isEqualTo("demucs_htdemucs");
        assertThat(result.getFallbackEngine()).isNull();
        assertThat(result.getQualityScores()).containsEntry("vocals", 14.0);
        assertThat(result.getOutputDirectory().getFileName().toString())
            .isEqualTo("Test Artist - Test Song_" + FileHashUtils.shortHash(FileHashUtils.sha256(track)));
        assertThat(fileManager.stemsExist(result.getOutputDirectory())).isTrue();
        assertThat(result.getOutputDirectory().resolve(StemFileManager.METADATA_FILE)).exists();
        assertThat(remote.calls).isZero();

        List<JobRecord> jobs = jobsFor(track);
        assertThat(jobs).hasSize(1);
        assertThat(jobs.get(0).getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(ledger.getQualityScores(jobs.get(0).getId())).containsEntry("vocals", 14.0);
        assertThat(cache.get(FileHashUtils.sha256(track), "demucs_htdemucs")).isPresent();
    }

    @Test
    void lowQualityTriggersFallbackThatReplacesStems() throws IOException {
        when(qualityAnalyzer.analyzeStems(any(), any())).thenReturn(scores(2.0), scores(11.0));

        SeparationResult result = pipeline().separate(track, StemPipeline.ENGINE_AUTO, true, true);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getEngine()).isEqualTo("lalal_cloud");
        assertThat(result.getFallbackEngine()).isEqualTo("lalal_cloud");
        assertThat(result.getQualityScores()).containsEntry("vocals", 11.0);
        assertThat(local.calls).isEqualTo(1);
        assertThat(remote.calls).isEqualTo(1);
        assertThat(remote.outputDirs.get(0).getFileName().toString()).isEqualTo(".staging_lalal_cloud");

        Path outputDir = result.getOutputDirectory();
        assertThat(new String(Files.readAllBytes(outputDir.resolve("vocals.wav")), StandardCharsets.UTF_8))
            .isEqualTo("lalal_cloud:vocals");
        try (Stream<Path> children = Files.list(outputDir)) {
            assertThat(children.map(p -> p.getFileName().toString())).noneMatch(n -> n.startsWith(".staging"));
        }

        List<JobRecord> jobs = jobsFor(track);
        assertThat(jobs).extracting(JobRecord::getEngine).containsExactly("demucs_htdemucs", "lalal_cloud");
        assertThat(jobs).extracting(JobRecord::getStatus).containsOnly(JobStatus.COMPLETED);
        assertThat(cache.get(FileHashUtils.sha256(track), "lalal_cloud")).isPresent();
    }

    @Test
    void failedFallbackKeepsPrimaryResult() throws IOException {
        when(qualityAnalyzer.analyzeStems(any(), any())).thenReturn(scores(2.0));
        remote.failWith = "quota exceeded";

        SeparationResult result = pipeline().separate(track, StemPipeline.ENGINE_AUTO, true, true);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getEngine()).isEqualTo("demucs_htdemucs");
        assertThat(result.getFallbackEngine()).isEqualTo("lalal_cloud");
        assertThat(result.getFallbackError()).isEqualTo("quota exceeded");
        assertThat(new String(Files.readAllBytes(result.getOutputDirectory().resolve("vocals.wav")),
            StandardCharsets.UTF_8)).isEqualTo("demucs_htdemucs:vocals");

        List<JobRecord> jobs = jobsFor(track);
        assertThat(jobs).extracting(JobRecord::getStatus).containsExactly(JobStatus.COMPLETED, JobStatus.FAILED);
        assertThat(jobs.get(1).getErrorMessage()).isEqualTo("quota exceeded");
    }

    @Test
    void fallbackDisabledKeepsLowQualityResult() throws IOException {
        when(qualityAnalyzer.analyzeStems(any(), any())).thenReturn(scores(2.0));

        SeparationResult result = pipeline().separate(track, StemPipeline.ENGINE_AUTO, true, false);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getEngine()).isEqualTo("demucs_htdemucs");
        assertThat(remote.calls).isZero();
        assertThat(jobsFor(track)).hasSize(1);
    }

    @Test
    void primaryHardFailureDoesNotFallBack() throws IOException {
        local.failWith = "demucs crashed";

        SeparationResult result = pipeline().separate(track, StemPipeline.ENGINE_AUTO, true, true);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorMessage()).isEqualTo("demucs crashed");
        assertThat(remote.calls).isZero();
        List<JobRecord> jobs = jobsFor(track);
        assertThat(jobs).hasSize(1);
        assertThat(jobs.get(0).getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(cache.getStatistics().getTotalEntries()).isZero();
    }

    @Test
    void backendExceptionBecomesFailedJob() throws IOException {
        local.throwOnSeparate = true;

        SeparationResult result = pipeline().separate(track, StemPipeline.ENGINE_AUTO, true, true);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorMessage()).contains("IllegalStateException");
        assertThat(jobsFor(track)).extracting(JobRecord::getStatus).containsExactly(JobStatus.FAILED);
    }

    @Test
    void secondRunSkipsExistingOutput() {
        StemPipeline pipeline = pipeline();
        pipeline.separate(track, StemPipeline.ENGINE_AUTO, true, true);

        SeparationResult second = pipeline.separate(track, StemPipeline.ENGINE_AUTO, true, true);

        assertThat(second.isSuccess()).isTrue();
        assertThat(second.isCached()).isTrue();
        assertThat(second.getStems()).containsOnlyKeys(StemType.values());
        assertThat(local.calls).isEqualTo(1);
    }

    @Test
    void deletedOutputIsRestoredFromCache() {
        StemPipeline pipeline = pipeline();
        SeparationResult first = pipeline.separate(track, StemPipeline.ENGINE_AUTO, true, true);
        fileManager.deleteDirectory(first.getOutputDirectory());

        SeparationResult second = pipeline.separate(track, StemPipeline.ENGINE_AUTO, true, true);

        assertThat(second.isCached()).isTrue();
        assertThat(second.getQualityScores()).containsEntry("vocals", 14.0);
        assertThat(fileManager.stemsExist(first.getOutputDirectory())).isTrue();
        assertThat(local.calls).isEqualTo(1);
    }

    @Test
    void cachedLowQualityResultStillFallsBack() throws IOException {
        when(qualityAnalyzer.analyzeStems(any(), any())).thenReturn(scores(4.0), scores(4.0), scores(11.0));
        StemPipeline pipeline = pipeline();
        SeparationResult first = pipeline.separate(track, StemPipeline.ENGINE_AUTO, true, false);
        fileManager.deleteDirectory(first.getOutputDirectory());

        SeparationResult second = pipeline.separate(track, StemPipeline.ENGINE_AUTO, true, true);

        assertThat(second.isCached()).isFalse();
        assertThat(second.getEngine()).isEqualTo("lalal_cloud");
        assertThat(second.getQualityScores()).containsEntry("vocals", 11.0);
        assertThat(local.calls).isEqualTo(2);
        assertThat(remote.calls).isEqualTo(1);
        assertThat(cache.get(FileHashUtils.sha256(track), "lalal_cloud")).isPresent();
    }

    @Test
    void cachedLowQualityResultIsReusedWithoutFallback() {
        when(qualityAnalyzer.analyzeStems(any(), any())).thenReturn(scores(4.0));
        StemPipeline pipeline = pipeline();
        SeparationResult first = pipeline.separate(track, StemPipeline.ENGINE_AUTO, true, false);
        fileManager.deleteDirectory(first.getOutputDirectory());

        SeparationResult second = pipeline.separate(track, StemPipeline.ENGINE_AUTO, true, false);

        assertThat(second.isCached()).isTrue();
        assertThat(second.getQualityScores()).containsEntry("vocals", 4.0);
        assertThat(local.calls).isEqualTo(1);
        assertThat(remote.calls).isZero();
    }

    @Test
    void failedPromotionKeepsPrimaryStemsAndSkipsCache() throws IOException {
        when(qualityAnalyzer.analyzeStems(any(), any())).thenReturn(scores(2.0));
        remote.missingStem = StemType.DRUMS;

        SeparationResult result = pipeline().separate(track, StemPipeline.ENGINE_AUTO, true, true);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getEngine()).isEqualTo("demucs_htdemucs");
        assertThat(result.getFallbackError()).isNotNull();
        Path outputDir = result.getOutputDirectory();
        for (StemType type : StemType.values()) {
            assertThat(new String(Files.readAllBytes(outputDir.resolve(type.getFileName())), StandardCharsets.UTF_8))
                .isEqualTo("demucs_htdemucs:" + type.getStemName());
        }
        assertThat(outputDir.resolve(StemFileManager.PREVIOUS_DIR)).doesNotExist();
        assertThat(jobsFor(track)).extracting(JobRecord::getStatus)
            .containsExactly(JobStatus.COMPLETED, JobStatus.FAILED);
        assertThat(cache.getStatistics().getTotalEntries()).isZero();
    }

    @Test
    void forceReprocessBypassesOutputAndCache() throws IOException {
        StemPipeline pipeline = pipeline();
        pipeline.separate(track, StemPipeline.ENGINE_AUTO, true, true);

        SeparationResult second = pipeline.separate(track, StemPipeline.ENGINE_AUTO, false, true);

        assertThat(second.isCached()).isFalse();
        assertThat(second.getEngine()).isEqualTo("demucs_htdemucs");
        assertThat(local.calls).isEqualTo(2);
        assertThat(jobsFor(track)).hasSize(2);
    }

    @Test
    void missingFileFailsWithoutTouchingLedger() {
        SeparationResult result = pipeline().separate(tempDir.resolve("nope.mp3"));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getEngine()).isEqualTo(SeparationResult.ENGINE_NONE);
        assertThat(ledger.getStatistics().getTotalTracks()).isZero();
    }

    @Test
    void explicitUnavailableEngineIsRejected() {
        remote.available = false;

        assertThatThrownBy(() -> pipeline().separate(track, "lalal", true, true))
            .isInstanceOf(EngineUnavailableException.class);
        assertThatThrownBy(() -> pipeline().selectBackend(track, "spleeter"))
            .isInstanceOf(EngineUnavailableException.class);
    }

    @Test
    void noAvailableEngineIsRejected() {
        local.available = false;
        remote.available = false;

        assertThatThrownBy(() -> pipeline().selectBackend(track, StemPipeline.ENGINE_AUTO))
            .isInstanceOf(NoEngineAvailableException.class);
    }

    @Test
    void autoRoutingPrefersLocalForSmallFiles() throws IOException {
        Path large = tempDir.resolve("large.wav");
        try (RandomAccessFile file = new RandomAccessFile(large.toFile(), "rw")) {
            file.setLength(2L * 1024 * 1024);
        }
        StemPipeline pipeline = pipeline();

        assertThat(pipeline.selectBackend(track, StemPipeline.ENGINE_AUTO).getName()).isEqualTo("demucs_htdemucs");
        assertThat(pipeline.selectBackend(large, StemPipeline.ENGINE_AUTO).getName()).isEqualTo("lalal_cloud");

        remote.available = false;
        assertThat(pipeline.selectBackend(large, StemPipeline.ENGINE_AUTO).getName()).isEqualTo("demucs_htdemucs");

        remote.available = true;
        local.available = false;
        assertThat(pipeline.selectBackend(track, StemPipeline.ENGINE_AUTO).getName()).isEqualTo("lalal_cloud");
    }

    @Test
    void explicitEngineAcceptsShortNames() {
        StemPipeline pipeline = pipeline();

        assertThat(pipeline.selectBackend(track, "demucs").getName()).isEqualTo("demucs_htdemucs");
        assertThat(pipeline.selectBackend(track, "lalal").getName()).isEqualTo("lalal_cloud");
        assertThat(pipeline.selectBackend(track, "LALAL_CLOUD").getName()).isEqualTo("lalal_cloud");
    }

    @Test
    void fallbackIsADifferentAvailableBackend() {
        StemPipeline pipeline = pipeline();

        assertThat(pipeline.findFallback(local)).contains(remote);
        remote.available = false;
        assertThat(pipeline.findFallback(local)).isEmpty();
    }

    @Test
    void isProcessedReflectsOutputDirectory() throws IOException {
        StemPipeline pipeline = pipeline();
        assertThat(pipeline.isProcessed(track)).isFalse();

        pipeline.separate(track);

        assertThat(pipeline.isProcessed(track)).isTrue();
    }

    @Test
    void statsListEnginesAndLedger() {
        Map<String, Object> stats = pipeline().getStats();

        assertThat(stats).containsKeys("baseDirectory", "engines", "ledger", "cache");
        @SuppressWarnings("unchecked")
        Map<String, Object> engines = (Map<String, Object>) stats.get("engines");
        assertThat(engines).containsOnlyKeys("demucs_htdemucs", "lalal_cloud");
    }

    private StemPipeline pipeline() {
        return new StemPipeline(config, Arrays.<SeparationBackend>asList(local, remote),
            ledger, cache, qualityAnalyzer, fileManager, metadataReader);
    }

    private List<JobRecord> jobsFor(Path file) throws IOException {
        long trackId = ledger.getTrackByHash(FileHashUtils.sha256(file)).orElseThrow().getId();
        return ledger.getJobsForTrack(trackId);
    }

    private static Map<String, Double> scores(double value) {
        Map<String, Double> scores = new LinkedHashMap<>();
        for (StemType type : StemType.values()) {
            scores.put(type.getStemName(), value);
        }
        return scores;
    }

    /**
     * 写出内容为 "<name>:<stem>" 的假分轨
     */
    private static class FakeBackend implements SeparationBackend {
        private final String name;
        private final boolean local;
        private boolean available = true;
        private String failWith;
        private boolean throwOnSeparate;
        private StemType missingStem;
        private int calls;
        private final List<Path> outputDirs = new ArrayList<>();

        FakeBackend(String name, boolean local) {
            this.name = name;
            this.local = local;
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public boolean isAvailable() {
            return available;
        }

        @Override
        public boolean isLocal() {
            return local;
        }

        @Override
        public int getRecommendedParallelism() {
            return 1;
        }

        @Override
        public SeparationResult separate(Path input, Path outputDir) {
            calls++;
            outputDirs.add(outputDir);
            if (throwOnSeparate) {
                throw new IllegalStateException("backend exploded");
            }
            if (failWith != null) {
                return SeparationResult.failure(name, failWith, 0.5);
            }
            try {
                Files.createDirectories(outputDir);
                Map<StemType, Path> stems = new EnumMap<>(StemType.class);
                for (StemType type : StemType.values()) {
                    Path stem = outputDir.resolve(type.getFileName());
                    Files.write(stem, (name + ":" + type.getStemName()).getBytes(StandardCharsets.UTF_8));
                    stems.put(type, stem);
                }
                if (missingStem != null) {
                    Files.delete(stems.get(missingStem));
                }
                return SeparationResult.success(name, stems, 1.5);
            } catch (IOException e) {
                return SeparationResult.failure(name, e.getMessage(), 0);
            }
        }
    }
}
