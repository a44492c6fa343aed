package com.lux032.stemgenerator.model;

/**
 * 批处理优先级,数值越小越先处理
 */
public enum Priority {
    HIGHEST(1),
    HIGH(2),
    MEDIUM(3),
    NORMAL(4),
    LOW(5);

    private final int rank;

    Priority(int rank) {
        this.rank = rank;
    }

    public int getRank() {
        return rank;
    }
}
