package com.lux032.stemgenerator.service;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.UnsupportedAudioFileException;
import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 音频解码为单声道采样,仅供质量评估使用
 * WAV 直接用 Java Sound 读取,其他格式先用 ffmpeg 转为临时 WAV
 */
@Slf4j
public class AudioSampleReader {

    private final String ffmpegPath;

    public AudioSampleReader(String ffmpegPath) {
        this.ffmpegPath = ffmpegPath == null || ffmpegPath.isEmpty() ? "ffmpeg" : ffmpegPath;
    }

    /**
     * 读取音频并混为单声道
     * @throws IOException 无法解码
     */
    public DecodedAudio read(Path file) throws IOException {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".wav") || name.endsWith(".wave")) {
            return readWav(file);
        }

        Path tempDir = Files.createTempDirectory("stem-decode-");
        Path wav = tempDir.resolve("decoded.wav");
        try {
            convertWithFfmpeg(file, wav);
            return readWav(wav);
        } finally {
            Files.deleteIfExists(wav);
            Files.deleteIfExists(tempDir);
        }
    }

    DecodedAudio readWav(Path file) throws IOException {
        try (AudioInputStream source = AudioSystem.getAudioInputStream(file.toFile())) {
            AudioFormat format = source.getFormat();
            AudioInputStream stream = source;
            if (!isDirectlyDecodable(format)) {
                AudioFormat target = new AudioFormat(AudioFormat.Encoding.PCM_SIGNED,
                    format.getSampleRate(), 16, format.getChannels(), format.getChannels() * 2,
                    format.getSampleRate(), false);
                stream = AudioSystem.getAudioInputStream(target, source);
                format = target;
            }
            byte[] data = readAll(stream);
            return new DecodedAudio(toMono(data, format), (int) format.getSampleRate());
        } catch (UnsupportedAudioFileException | IllegalArgumentException e) {
            throw new IOException("Unsupported audio file: " + file.getFileName(), e);
        }
    }

    private boolean isDirectlyDecodable(AudioFormat format) {
        AudioFormat.Encoding encoding = format.getEncoding();
        int bits = format.getSampleSizeInBits();
        if (AudioFormat.Encoding.PCM_SIGNED.equals(encoding)) {
            return bits == 8 || bits == 16 || bits == 24 || bits == 32;
        }
        if (AudioFormat.Encoding.PCM_UNSIGNED.equals(encoding)) {
            return bits == 8;
        }
        if (AudioFormat.Encoding.PCM_FLOAT.equals(encoding)) {
            return bits == 32 || bits == 64;
        }
        return false;
    }

    private static byte[] readAll(AudioInputStream stream) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] buffer = new byte[64 * 1024];
        int read;
        while ((read = stream.read(buffer)) != -1) {
            out.write(buffer, 0, read);
        }
        return out.toByteArray();
    }

    static double[] toMono(byte[] data, AudioFormat format) {
        int channels = Math.max(1, format.getChannels());
        int bytesPerSample = format.getSampleSizeInBits() / 8;
        int frameSize = bytesPerSample * channels;
        int frames = data.length / frameSize;
        boolean bigEndian = format.isBigEndian();
        AudioFormat.Encoding encoding = format.getEncoding();

        double[] mono = new double[frames];
        for (int frame = 0; frame < frames; frame++) {
            double sum = 0;
            for (int ch = 0; ch < channels; ch++) {
                int offset = frame * frameSize + ch * bytesPerSample;
                sum += decodeSample(data, offset, bytesPerSample, bigEndian, encoding);
            }
            mono[frame] = sum / channels;
        }
        return mono;
    }

    private static double decodeSample(byte[] data, int offset, int bytes, boolean bigEndian,
                                       AudioFormat.Encoding encoding) {
        long raw = 0;
        for (int i = 0; i < bytes; i++) {
            int b = data[offset + (bigEndian ? i : bytes - 1 - i)] & 0xFF;
            raw = (raw << 8) | b;
        }

        if (AudioFormat.Encoding.PCM_FLOAT.equals(encoding)) {
            return bytes == 4 ? Float.intBitsToFloat((int) raw) : Double.longBitsToDouble(raw);
        }
        if (AudioFormat.Encoding.PCM_UNSIGNED.equals(encoding)) {
            return (raw - 128) / 128.0;
        }
        int bits = bytes * 8;
        long signed = (raw << (64 - bits)) >> (64 - bits);
        return signed / (double) (1L << (bits - 1));
    }

    private void convertWithFfmpeg(Path source, Path target) throws IOException {
        List<String> command = new ArrayList<>();
        command.add(ffmpegPath);
        command.add("-y");
        command.add("-i");
        command.add(source.toAbsolutePath().toString());
        command.add("-vn");
        command.add("-ac");
        command.add("1");
        command.add("-f");
        command.add("wav");
        command.add(target.toAbsolutePath().toString());

        ProcessBuilder processBuilder = new ProcessBuilder(command);
        processBuilder.redirectErrorStream(true);
        Process process = processBuilder.start();

        StringBuilder output = new StringBuilder();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(process.getInputStream()))) {
            String line;
            while ((line = reader.readLine()) != null) {
                output.append(line).append(System.lineSeparator());
            }
        }

        int exitCode;
        try {
            exitCode = process.waitFor();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("ffmpeg interrupted", e);
        }

        if (exitCode != 0 || !Files.exists(target)) {
            log.debug("ffmpeg output: {}", output.toString().trim());
            throw new IOException("ffmpeg failed (code " + exitCode + ") for " + source.getFileName());
        }
    }

    /**
     * 解码后的单声道音频
     */
    @Getter
    public static class DecodedAudio {
        private final double[] samples;
        private final int sampleRate;

        public DecodedAudio(double[] samples, int sampleRate) {
            this.samples = samples;
            this.sampleRate = sampleRate;
        }
    }
}
