package com.lux032.stemgenerator.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * 分离任务状态
 * 状态只能单向推进: PENDING -> PROCESSING -> COMPLETED / FAILED
 */
public enum JobStatus {
    /**
     * 已创建,尚未执行
     */
    PENDING("pending"),

    /**
     * 正在调用后端
     */
    PROCESSING("processing"),

    /**
     * 成功结束
     */
    COMPLETED("completed"),

    /**
     * 失败结束
     */
    FAILED("failed");

    private final String value;

    JobStatus(String value) {
        this.value = value;
    }

    /**
     * 数据库中保存的值
     */
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * 允许迁移到当前状态的前驱状态
     */
    public Set<JobStatus> allowedPredecessors() {
        switch (this) {
            case PROCESSING:
                return EnumSet.of(PENDING);
            case COMPLETED:
            case FAILED:
                return EnumSet.of(PENDING, PROCESSING);
            default:
                return EnumSet.noneOf(JobStatus.class);
        }
    }

    public static JobStatus fromValue(String value) {
        for (JobStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown job status: " + value);
    }
}
