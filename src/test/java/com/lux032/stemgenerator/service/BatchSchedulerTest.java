package com.lux032.stemgenerator.service;

import com.lux032.stemgenerator.config.StemConfig;
import com.lux032.stemgenerator.model.BatchProgress;
import com.lux032.stemgenerator.model.BatchResult;
import com.lux032.stemgenerator.model.Priority;
import com.lux032.stemgenerator.model.ScanResult;
import com.lux032.stemgenerator.model.ScannedTrack;
import com.lux032.stemgenerator.model.SeparationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BatchSchedulerTest {

    private StemPipeline pipeline;
    private LibraryScanner scanner;
    private BatchScheduler scheduler;

    @BeforeEach
    void setUp() {
        pipeline = mock(StemPipeline.class);
        scanner = mock(LibraryScanner.class);
        scheduler = new BatchScheduler(pipeline, scanner, StemConfig.fromProperties(new Properties()));
    }

    @Test
    void outcomesAreCountedPerTrack() {
        ScannedTrack done = track("/music/done.mp3");
        ScannedTrack cached = track("/music/cached.mp3");
        ScannedTrack failed = track("/music/failed.mp3");
        ScannedTrack crashed = track("/music/crashed.mp3");
        stub(done, SeparationResult.success("demucs_htdemucs", Collections.emptyMap(), 1));
        stub(cached, SeparationResult.success(SeparationResult.ENGINE_CACHED, Collections.emptyMap(), 0));
        stub(failed, SeparationResult.failure("lalal_cloud", "upload failed", 1));
        when(pipeline.separate(eq(crashed.getPath()), eq(StemPipeline.ENGINE_AUTO), anyBoolean(), anyBoolean()))
            .thenThrow(new IllegalStateException("ledger down"));

        BatchResult result = scheduler.processTracks(Arrays.asList(done, cached, failed, crashed), null, true);

        BatchProgress progress = result.getProgress();
        assertThat(progress.getTotal()).isEqualTo(4);
        assertThat(progress.getCompleted()).isEqualTo(1);
        assertThat(progress.getSkipped()).isEqualTo(1);
        assertThat(progress.getFailed()).isEqualTo(2);
        assertThat(progress.getRemaining()).isZero();
        assertThat(result.getResults()).hasSize(3);
        assertThat(result.getErrors()).extracting(e -> e.getMessage())
            .containsExactly("upload failed", "ledger down");
        assertThat(result.getErrors().get(0).getTrack()).isSameAs(failed);
    }

    @Test
    void callbackReceivesIndependentSnapshots() {
        ScannedTrack first = track("/music/1.mp3");
        ScannedTrack second = track("/music/2.mp3");
        stub(first, SeparationResult.success("demucs_htdemucs", Collections.emptyMap(), 1));
        stub(second, SeparationResult.failure("demucs_htdemucs", "bad", 1));
        List<BatchProgress> seen = new ArrayList<>();
        List<ScannedTrack> tracks = new ArrayList<>();

        scheduler.processTracks(Arrays.asList(first, second), (progress, track) -> {
            seen.add(progress);
            tracks.add(track);
            progress.setCompleted(99);
        }, true);

        assertThat(tracks).containsExactly(first, second);
        assertThat(seen.get(0).getCompleted()).isEqualTo(99);
        assertThat(seen.get(1).getCompleted()).isEqualTo(1);
        assertThat(seen.get(1).getFailed()).isEqualTo(1);
        assertThat(seen.get(1).getPercentComplete()).isEqualTo(100.0);
        assertThat(scheduler.getCurrentProgress().getCompleted()).isEqualTo(1);
    }

    @Test
    void emptyBatchIsComplete() {
        BatchResult result = scheduler.processTracks(Collections.emptyList(), null, true);

        assertThat(result.getProgress().getPercentComplete()).isEqualTo(100.0);
        assertThat(result.getErrors()).isEmpty();
    }

    @Test
    void processDirectoryAppliesLimitInPriorityOrder() {
        Path dir = Paths.get("/music");
        ScannedTrack a = track("/music/a.mp3");
        ScannedTrack b = track("/music/b.mp3");
        ScannedTrack c = track("/music/c.mp3");
        ScanResult scan = new ScanResult();
        scan.getTracks().addAll(Arrays.asList(a, b, c));
        when(scanner.scanDirectory(dir)).thenReturn(scan);
        for (ScannedTrack t : Arrays.asList(a, b, c)) {
            stub(t, SeparationResult.success("demucs_htdemucs", Collections.emptyMap(), 1));
        }

        BatchResult result = scheduler.processDirectory(dir, null, false, 2);

        assertThat(result.getProgress().getTotal()).isEqualTo(2);
        verify(pipeline).separate(a.getPath(), StemPipeline.ENGINE_AUTO, false, true);
        verify(pipeline).separate(b.getPath(), StemPipeline.ENGINE_AUTO, false, true);
        verify(pipeline, never()).separate(eq(c.getPath()), eq(StemPipeline.ENGINE_AUTO), anyBoolean(), anyBoolean());
    }

    @Test
    void scanErrorsBecomeTracklessBatchErrors() {
        Path dir = Paths.get("/missing");
        ScanResult scan = new ScanResult();
        scan.getErrors().add("Directory not found: /missing");
        when(scanner.scanDirectory(dir)).thenReturn(scan);

        BatchResult result = scheduler.processDirectory(dir, null, true, 0);

        assertThat(result.getErrors()).singleElement()
            .satisfies(error -> {
                assertThat(error.getTrack()).isNull();
                assertThat(error.getMessage()).startsWith("Directory not found");
            });
    }

    @Test
    void resumeAlwaysSkipsExisting() {
        Path dir = Paths.get("/music");
        ScannedTrack a = track("/music/a.mp3");
        ScanResult scan = new ScanResult();
        scan.getTracks().add(a);
        when(scanner.scanDirectory(dir)).thenReturn(scan);
        stub(a, SeparationResult.success(SeparationResult.ENGINE_CACHED, Collections.emptyMap(), 0));

        BatchResult result = scheduler.resumeProcessing(dir, null);

        verify(pipeline, times(1)).separate(a.getPath(), StemPipeline.ENGINE_AUTO, true, true);
        assertThat(result.getProgress().getSkipped()).isEqualTo(1);
    }

    @Test
    void pendingTracksExcludeProcessedOnes() throws IOException {
        Path dir = Paths.get("/music");
        ScannedTrack done = track("/music/done.mp3");
        ScannedTrack todo = track("/music/todo.mp3");
        ScannedTrack unreadable = track("/music/unreadable.mp3");
        ScanResult scan = new ScanResult();
        scan.getTracks().addAll(Arrays.asList(done, todo, unreadable));
        when(scanner.scanDirectory(dir)).thenReturn(scan);
        when(pipeline.isProcessed(done.getPath())).thenReturn(true);
        when(pipeline.isProcessed(todo.getPath())).thenReturn(false);
        when(pipeline.isProcessed(unreadable.getPath())).thenThrow(new IOException("permission denied"));

        assertThat(scheduler.getPendingTracks(dir)).containsExactly(todo, unreadable);
    }

    private void stub(ScannedTrack track, SeparationResult result) {
        when(pipeline.separate(eq(track.getPath()), eq(StemPipeline.ENGINE_AUTO), anyBoolean(), anyBoolean()))
            .thenReturn(result);
    }

    private static ScannedTrack track(String path) {
        ScannedTrack track = new ScannedTrack(Paths.get(path));
        track.setTitle(Paths.get(path).getFileName().toString());
        track.setPriority(Priority.LOW);
        return track;
    }
}
