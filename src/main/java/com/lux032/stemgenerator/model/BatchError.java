package com.lux032.stemgenerator.model;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * 批处理中某一曲目的错误
 * track 为 null 表示扫描阶段的错误
 */
@Data
@AllArgsConstructor
public class BatchError {
    private ScannedTrack track;
    private String message;
}
