package com.lux032.stemgenerator.model;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 分离任务记录
 */
@Data
public class JobRecord {
    private long id;
    private long trackId;
    private String engine;
    private JobStatus status;
    private Double processingTimeSeconds;
    private String errorMessage;
    private LocalDateTime createdAt;
    private LocalDateTime completedAt; // 仅终态时有值
}
