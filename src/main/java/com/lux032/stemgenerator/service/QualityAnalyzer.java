package com.lux032.stemgenerator.service;

import com.lux032.stemgenerator.model.QualityLabel;
import com.lux032.stemgenerator.model.StemType;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * 分离质量评估
 *
 * <p>没有真正的参考分轨,只能拿分轨与原始混音做尺度不变信号失真比 (SI-SDR)
 * 作为近似指标。分数越高说明分轨越接近混音中的对应成分。</p>
 */
@Slf4j
public class QualityAnalyzer {

    public static final double VOCALS_REPROCESS_THRESHOLD = 7.0;
    public static final double DEFAULT_REPROCESS_THRESHOLD = 5.0;

    private static final double ENERGY_EPSILON = 1e-10;

    private final AudioSampleReader sampleReader;

    public QualityAnalyzer(AudioSampleReader sampleReader) {
        this.sampleReader = sampleReader;
    }

    /**
     * 计算 SI-SDR (dB)
     * 两段信号截到相同长度并去直流;参考能量过小返回负无穷,残差能量过小返回正无穷
     */
    public static double calculateScore(double[] reference, double[] estimate) {
        int length = Math.min(reference.length, estimate.length);
        if (length == 0) {
            return Double.NEGATIVE_INFINITY;
        }

        double refMean = 0;
        double estMean = 0;
        for (int i = 0; i < length; i++) {
            refMean += reference[i];
            estMean += estimate[i];
        }
        refMean /= length;
        estMean /= length;

        double dot = 0;
        double refEnergy = 0;
        for (int i = 0; i < length; i++) {
            double r = reference[i] - refMean;
            double e = estimate[i] - estMean;
            dot += r * e;
            refEnergy += r * r;
        }
        if (refEnergy < ENERGY_EPSILON) {
            return Double.NEGATIVE_INFINITY;
        }

        double scale = dot / refEnergy;
        double targetEnergy = 0;
        double noiseEnergy = 0;
        for (int i = 0; i < length; i++) {
            double target = scale * (reference[i] - refMean);
            double noise = (estimate[i] - estMean) - target;
            targetEnergy += target * target;
            noiseEnergy += noise * noise;
        }
        if (noiseEnergy < ENERGY_EPSILON) {
            return Double.POSITIVE_INFINITY;
        }
        return 10 * Math.log10(targetEnergy / noiseEnergy);
    }

    /**
     * 评估单条分轨,无法解码时返回空
     */
    public OptionalDouble analyzeStem(Path stemFile, Path originalFile) {
        try {
            return analyzeStem(stemFile, sampleReader.read(originalFile));
        } catch (IOException e) {
            log.warn("无法读取原始音频,跳过质量评估: {} - {}", originalFile.getFileName(), e.getMessage());
            return OptionalDouble.empty();
        }
    }

    private OptionalDouble analyzeStem(Path stemFile, AudioSampleReader.DecodedAudio original) {
        try {
            AudioSampleReader.DecodedAudio stem = sampleReader.read(stemFile);
            double[] estimate = stem.getSampleRate() == original.getSampleRate()
                ? stem.getSamples()
                : resample(stem.getSamples(), stem.getSampleRate(), original.getSampleRate());
            return OptionalDouble.of(calculateScore(original.getSamples(), estimate));
        } catch (IOException e) {
            log.warn("无法读取分轨,跳过: {} - {}", stemFile.getFileName(), e.getMessage());
            return OptionalDouble.empty();
        }
    }

    /**
     * 评估目录中存在的标准分轨
     * @return 分轨名 -> 评分,无法评估的分轨不出现在结果中
     */
    public Map<String, Double> analyzeAllStems(Path stemDirectory, Path originalFile) {
        Map<StemType, Path> stems = new LinkedHashMap<>();
        for (StemType type : StemType.values()) {
            Path stem = stemDirectory.resolve(type.getFileName());
            if (Files.isRegularFile(stem)) {
                stems.put(type, stem);
            }
        }
        return analyzeStems(stems, originalFile);
    }

    public Map<String, Double> analyzeStems(Map<StemType, Path> stems, Path originalFile) {
        Map<String, Double> scores = new LinkedHashMap<>();
        if (stems.isEmpty()) {
            return scores;
        }

        AudioSampleReader.DecodedAudio original;
        try {
            original = sampleReader.read(originalFile);
        } catch (IOException e) {
            log.warn("无法读取原始音频,跳过质量评估: {} - {}", originalFile.getFileName(), e.getMessage());
            return scores;
        }

        for (Map.Entry<StemType, Path> stem : stems.entrySet()) {
            OptionalDouble score = analyzeStem(stem.getValue(), original);
            if (score.isPresent()) {
                scores.put(stem.getKey().getStemName(), score.getAsDouble());
                log.debug("{}: {} dB ({})", stem.getKey().getStemName(),
                    String.format("%.2f", score.getAsDouble()), label(score.getAsDouble()).getLabel());
            }
        }
        return scores;
    }

    public static QualityLabel label(double score) {
        return QualityLabel.of(score);
    }

    public static double thresholdFor(String stemName) {
        return StemType.VOCALS.getStemName().equalsIgnoreCase(stemName)
            ? VOCALS_REPROCESS_THRESHOLD
            : DEFAULT_REPROCESS_THRESHOLD;
    }

    public static boolean needsReprocessing(String stemName, double score) {
        return Double.isNaN(score) || score < thresholdFor(stemName);
    }

    /**
     * 任一分轨低于阈值即需要回退
     */
    public static boolean needsFallback(Map<String, Double> scores) {
        for (Map.Entry<String, Double> entry : scores.entrySet()) {
            if (needsReprocessing(entry.getKey(), entry.getValue())) {
                return true;
            }
        }
        return false;
    }

    /**
     * 线性插值重采样
     */
    static double[] resample(double[] samples, int fromRate, int toRate) {
        if (fromRate <= 0 || toRate <= 0 || fromRate == toRate || samples.length == 0) {
            return samples;
        }
        int newLength = (int) Math.round(samples.length * (double) toRate / fromRate);
        double[] result = new double[Math.max(1, newLength)];
        double step = (double) fromRate / toRate;
        for (int i = 0; i < result.length; i++) {
            double position = i * step;
            int index = (int) position;
            if (index >= samples.length - 1) {
                result[i] = samples[samples.length - 1];
            } else {
                double fraction = position - index;
                result[i] = samples[index] * (1 - fraction) + samples[index + 1] * fraction;
            }
        }
        return result;
    }
}
