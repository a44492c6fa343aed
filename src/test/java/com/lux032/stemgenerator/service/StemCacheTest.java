package com.lux032.stemgenerator.service;

import com.lux032.stemgenerator.model.CacheEntry;
import com.lux032.stemgenerator.model.StemType;
import com.lux032.stemgenerator.util.FileHashUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StemCacheTest {

    private static final String HASH = "0123456789abcdef0123456789abcdef0123456789abcdef0123456789abcdef";
    private static final String ENGINE = "demucs_htdemucs";
    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    @TempDir
    Path tempDir;

    private Path cacheDir;
    private StemCache cache;
    private Map<StemType, Path> stems;

    @BeforeEach
    void setUp() throws IOException {
        cacheDir = tempDir.resolve("cache");
        cache = new StemCache(cacheDir.toString(), Clock.fixed(NOW, ZoneOffset.UTC));
        stems = writeStems(Files.createDirectories(tempDir.resolve("separated")));
    }

    @Test
    void putThenGetReturnsAllStemsInsideEntry() throws IOException {
        Map<String, Double> scores = new LinkedHashMap<>();
        scores.put("vocals", 9.5);
        scores.put("drums", 6.25);

        cache.put(HASH, ENGINE, stems, scores);
        Optional<CacheEntry> entry = cache.get(HASH, ENGINE);

        assertThat(entry).isPresent();
        assertThat(entry.get().getStemPaths()).containsOnlyKeys(StemType.values());
        assertThat(entry.get().getStemPaths().values())
            .allMatch(p -> p.startsWith(entry.get().getEntryDirectory()));
        assertThat(entry.get().getQualityScores()).containsEntry("vocals", 9.5).containsEntry("drums", 6.25);
        assertThat(entry.get().getEngineId()).isEqualTo(ENGINE);
        assertThat(Files.isRegularFile(entry.get().getEntryDirectory().resolve(StemCache.META_FILE))).isTrue();
    }

    @Test
    void entriesAreKeyedByEngine() throws IOException {
        cache.put(HASH, ENGINE, stems, null);

        assertThat(cache.get(HASH, "lalal_cloud")).isEmpty();
        assertThat(cache.get("ffff", ENGINE)).isEmpty();
    }

    @Test
    void putRejectsIncompleteStemSet() {
        Map<StemType, Path> partial = new EnumMap<>(stems);
        partial.remove(StemType.BASS);

        assertThatThrownBy(() -> cache.put(HASH, ENGINE, partial, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("bass");
        assertThat(cache.get(HASH, ENGINE)).isEmpty();
    }

    @Test
    void corruptMetadataIsPurgedOnRead() throws IOException {
        cache.put(HASH, ENGINE, stems, null);
        Path entryDir = cache.entryDirectory(HASH, ENGINE);
        Files.write(entryDir.resolve(StemCache.META_FILE), "{not json".getBytes(StandardCharsets.UTF_8));

        assertThat(cache.get(HASH, ENGINE)).isEmpty();
        assertThat(Files.exists(entryDir)).isFalse();
    }

    @Test
    void missingStemFileIsPurgedOnRead() throws IOException {
        cache.put(HASH, ENGINE, stems, null);
        Path entryDir = cache.entryDirectory(HASH, ENGINE);
        Files.delete(entryDir.resolve(StemType.DRUMS.getFileName()));

        assertThat(cache.get(HASH, ENGINE)).isEmpty();
        assertThat(Files.exists(entryDir)).isFalse();
    }

    @Test
    void stemPathOutsideEntryIsRejected() throws IOException {
        cache.put(HASH, ENGINE, stems, null);
        Path entryDir = cache.entryDirectory(HASH, ENGINE);
        Files.write(cacheDir.resolve("outside.wav"), new byte[]{1});
        String meta = "{\"file_hash\":\"" + HASH + "\",\"engine_id\":\"" + ENGINE + "\","
            + "\"created_at\":\"2024-06-01T12:00:00\",\"stem_paths\":{"
            + "\"vocals\":\"../outside.wav\",\"drums\":\"drums.wav\",\"bass\":\"bass.wav\",\"other\":\"other.wav\"},"
            + "\"quality_scores\":{}}";
        Files.write(entryDir.resolve(StemCache.META_FILE), meta.getBytes(StandardCharsets.UTF_8));

        assertThat(cache.get(HASH, ENGINE)).isEmpty();
        assertThat(Files.exists(entryDir)).isFalse();
        assertThat(Files.exists(cacheDir.resolve("outside.wav"))).isTrue();
    }

    @Test
    void directoryWithoutMetadataIsAMissAndIsPurged() throws IOException {
        Path entryDir = cache.entryDirectory(HASH, ENGINE);
        Files.createDirectories(entryDir);
        Files.copy(stems.get(StemType.VOCALS), entryDir.resolve("vocals.wav"));

        assertThat(cache.getStatistics().getTotalEntries()).isZero();
        assertThat(cache.get(HASH, ENGINE)).isEmpty();
        assertThat(Files.exists(entryDir)).isFalse();
    }

    @Test
    void engineIdCannotEscapeCacheDirectory() {
        Path entry = cache.entryDirectory("../../etc", "../passwd");

        assertThat(entry.getParent()).isEqualTo(cache.getCacheDirectory());
    }

    @Test
    void restoreCopiesStemsToOutputDirectory() throws IOException {
        CacheEntry entry = cache.put(HASH, ENGINE, stems, null);
        Path output = tempDir.resolve("out");

        Map<StemType, Path> restored = cache.restore(entry, output);

        assertThat(restored).containsOnlyKeys(StemType.values());
        for (StemType type : StemType.values()) {
            assertThat(restored.get(type)).isEqualTo(output.resolve(type.getFileName()));
            assertThat(Files.readAllBytes(restored.get(type))).isEqualTo(Files.readAllBytes(stems.get(type)));
        }
        assertThat(cache.get(HASH, ENGINE)).isPresent();
    }

    @Test
    void invalidateRemovesEntry() throws IOException {
        cache.put(HASH, ENGINE, stems, null);

        assertThat(cache.invalidate(HASH, ENGINE)).isTrue();
        assertThat(cache.get(HASH, ENGINE)).isEmpty();
        assertThat(cache.invalidate(HASH, ENGINE)).isFalse();
    }

    @Test
    void clearCacheWithoutAgeRemovesEverything() throws IOException {
        cache.put(HASH, ENGINE, stems, null);
        cache.put(HASH, "lalal_cloud", stems, null);

        assertThat(cache.clearCache(null)).isEqualTo(2);
        assertThat(cache.getStatistics().getTotalEntries()).isZero();
    }

    @Test
    void clearCacheWithAgeKeepsRecentEntries() throws IOException {
        StemCache oldCache = new StemCache(cacheDir.toString(),
            Clock.fixed(NOW.minus(10, ChronoUnit.DAYS), ZoneOffset.UTC));
        oldCache.put("aaaa", ENGINE, stems, null);
        cache.put("bbbb", ENGINE, stems, null);
        Files.createDirectories(cacheDir.resolve("orphan_dir"));

        int removed = cache.clearCache(5);

        assertThat(removed).isEqualTo(2);
        assertThat(cache.get("aaaa", ENGINE)).isEmpty();
        assertThat(cache.get("bbbb", ENGINE)).isPresent();
        assertThat(Files.exists(cacheDir.resolve("orphan_dir"))).isFalse();
    }

    @Test
    void statisticsCountEntriesAndBytes() throws IOException {
        cache.put(HASH, ENGINE, stems, null);

        StemCache.CacheStatistics stats = cache.getStatistics();

        assertThat(stats.getTotalEntries()).isEqualTo(1);
        assertThat(stats.getTotalSizeBytes()).isGreaterThan(60L);
        assertThat(stats.getCacheDirectory()).isEqualTo(cache.getCacheDirectory().toString());
    }

    @Test
    void lookupByAudioFileUsesContentHash() throws IOException {
        Path audio = tempDir.resolve("track.mp3");
        Files.write(audio, "same content".getBytes(StandardCharsets.UTF_8));
        Path copy = tempDir.resolve("renamed.mp3");
        Files.copy(audio, copy);

        cache.put(FileHashUtils.sha256(audio), ENGINE, stems, null);

        assertThat(cache.get(copy, ENGINE)).isPresent();
    }

    private static Map<StemType, Path> writeStems(Path dir) throws IOException {
        Map<StemType, Path> result = new EnumMap<>(StemType.class);
        for (StemType type : StemType.values()) {
            Path file = dir.resolve(type.getFileName());
            Files.write(file, ("stem data " + type.getStemName()).getBytes(StandardCharsets.UTF_8));
            result.put(type, file);
        }
        return result;
    }
}
