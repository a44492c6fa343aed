package com.lux032.stemgenerator.model;

/**
 * 分离质量等级 (SI-SDR 近似值, 单位 dB)
 */
public enum QualityLabel {
    EXCELLENT("excellent", 12.0),
    GOOD("good", 8.0),
    ACCEPTABLE("acceptable", 5.0),
    POOR("poor", Double.NEGATIVE_INFINITY);

    private final String label;
    private final double minScore;

    QualityLabel(String label, double minScore) {
        this.label = label;
        this.minScore = minScore;
    }

    public String getLabel() {
        return label;
    }

    public double getMinScore() {
        return minScore;
    }

    public static QualityLabel of(double score) {
        if (Double.isNaN(score)) {
            return POOR;
        }
        for (QualityLabel value : values()) {
            if (score >= value.minScore) {
                return value;
            }
        }
        return POOR;
    }
}
