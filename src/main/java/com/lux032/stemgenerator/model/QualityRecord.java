package com.lux032.stemgenerator.model;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 单条分轨的质量评分
 */
@Data
public class QualityRecord {
    private long id;
    private long jobId;
    private String stemName;
    private double siSdr;
    private LocalDateTime createdAt;
}
